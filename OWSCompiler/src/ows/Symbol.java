package ows;

import com.google.auto.value.AutoValue;

/** A variable name qualified by its address space. */
@AutoValue
public abstract class Symbol {
  public enum Domain {
    GLOBAL,
    ENTITY;
  }

  public abstract Domain domain();

  public abstract String name();

  public static Symbol global(String name) {
    return new AutoValue_Symbol(Domain.GLOBAL, name);
  }

  public static Symbol entity(String name) {
    return new AutoValue_Symbol(Domain.ENTITY, name);
  }

  @Override
  public final String toString() {
    return domain() == Domain.GLOBAL ? name() : "player " + name();
  }
}

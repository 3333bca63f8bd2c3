package ows;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

@AutoValue
public abstract class InstructionSignature {

  /** A positional parameter: either ANY, or a named set of accepted upper-case keywords. */
  @AutoValue
  public abstract static class ParameterType {
    public static final String ANY_NAME = "ANY";

    private static final ParameterType ANY = new AutoValue_InstructionSignature_ParameterType(
        ANY_NAME, ImmutableSet.of());

    public abstract String name();

    public abstract ImmutableSet<String> values();

    public final boolean isAny() {
      return name().equals(ANY_NAME);
    }

    public final boolean accepts(String rendered) {
      return isAny() || values().contains(rendered.toUpperCase());
    }

    public static ParameterType any() {
      return ANY;
    }

    public static ParameterType of(String name, Iterable<String> values) {
      return new AutoValue_InstructionSignature_ParameterType(
          name, ImmutableSet.copyOf(values));
    }

    @Override
    public final String toString() {
      return name();
    }
  }

  public abstract String name();

  public abstract ImmutableList<ParameterType> parameters();

  public static InstructionSignature create(String name, Iterable<ParameterType> parameters) {
    return new AutoValue_InstructionSignature(name, ImmutableList.copyOf(parameters));
  }
}

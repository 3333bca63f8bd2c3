package ows;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** A lexical scope: the global one shared by all rules, one per inlined call or unrolled copy. */
public final class Scope {
  private final String name;
  private final Optional<Scope> parent;
  private final Map<Symbol, Variable> variables = new HashMap<>();

  private Scope(String name, Optional<Scope> parent) {
    this.name = name;
    this.parent = parent;
  }

  public static Scope root(String name) {
    return new Scope(name, Optional.empty());
  }

  public Scope child(String name) {
    return new Scope(name, Optional.of(this));
  }

  public String name() {
    return name;
  }

  public Optional<Scope> parent() {
    return parent;
  }

  // Innermost binding wins.
  public Optional<Variable> lookup(Symbol symbol) {
    return owner(symbol).map(scope -> scope.variables.get(symbol));
  }

  private Optional<Scope> owner(Symbol symbol) {
    for (Scope scope = this; ; scope = scope.parent.get()) {
      if (scope.variables.containsKey(symbol)) return Optional.of(scope);
      if (!scope.parent.isPresent()) return Optional.empty();
    }
  }

  public void bind(Symbol symbol, Variable variable) {
    variables.put(symbol, variable);
  }

  /**
   * Binds {@code symbol} to a stored value in this scope. A symbol already stored somewhere in the
   * chain keeps its slot; anything else, a substitution included, gets a fresh one.
   */
  public Variable assign(Symbol symbol, Node value, SlotAllocator slots) {
    Optional<Variable> existing = lookup(symbol);
    int index =
        existing.isPresent() && existing.get().isStored()
            ? existing.get().index().get()
            : slots.allocate(symbol.domain(), symbol.name());
    Variable variable = Variable.stored(value, index);
    bind(symbol, variable);
    return variable;
  }

  @Override
  public String toString() {
    return parent.isPresent() ? parent.get() + "." + name : name;
  }
}

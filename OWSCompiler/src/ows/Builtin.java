package ows;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Functions evaluated by the compiler. Each expands its argument nodes into a replacement node, or
 * declines when the arguments aren't ones it can evaluate.
 */
public enum Builtin {
  RANGE("range", 1, 3, Builtin::range),
  CEIL("ceil", 1, 1, (args, pos) -> roundToInteger(args.get(0), "Up", pos)),
  FLOOR("floor", 1, 1, (args, pos) -> roundToInteger(args.get(0), "Down", pos)),
  ROUND("round", 1, 1, (args, pos) -> roundToInteger(args.get(0), "To Nearest", pos));

  @FunctionalInterface
  interface Expander {
    Optional<Node> expand(ImmutableList<Node> args, Pos pos);
  }

  private final String functionName;
  private final int minArgs;
  private final int maxArgs;
  private final Expander expander;

  private Builtin(String functionName, int minArgs, int maxArgs, Expander expander) {
    this.functionName = functionName;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.expander = expander;
  }

  public String functionName() {
    return functionName;
  }

  public boolean acceptsArity(int count) {
    return count >= minArgs && count <= maxArgs;
  }

  public String arityDescription() {
    return minArgs == maxArgs
        ? Integer.toString(minArgs)
        : String.format("%d to %d", minArgs, maxArgs);
  }

  // Arguments have already been resolved through substitutions.
  public Optional<Node> expand(ImmutableList<Node> args, Pos pos) {
    return expander.expand(args, pos);
  }

  public static void registerAll(Scope scope) {
    for (Builtin builtin : values()) {
      scope.bind(Symbol.global(builtin.functionName), Variable.builtin(builtin));
    }
  }

  public static Optional<Builtin> forName(String name) {
    for (Builtin builtin : values()) {
      if (builtin.functionName.equals(name)) return Optional.of(builtin);
    }
    return Optional.empty();
  }

  private static Optional<Integer> integer(Node node) {
    if (node.type() != Node.Type.NUMBER) return Optional.empty();
    return node.<Node.NumberLiteral>cast().intValue();
  }

  // range(stop), range(start, stop), range(start, stop, step)
  private static Optional<Node> range(ImmutableList<Node> args, Pos pos) {
    ImmutableList.Builder<Integer> ints = ImmutableList.builder();
    for (Node arg : args) {
      Optional<Integer> value = integer(arg);
      if (!value.isPresent()) return Optional.empty();
      ints.add(value.get());
    }
    ImmutableList<Integer> bounds = ints.build();
    int start = bounds.size() > 1 ? bounds.get(0) : 0;
    int stop = bounds.size() > 1 ? bounds.get(1) : bounds.get(0);
    int step = bounds.size() > 2 ? bounds.get(2) : 1;
    if (step == 0) return Optional.empty();

    ImmutableList.Builder<Node> elements = ImmutableList.builder();
    for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
      elements.add(Node.NumberLiteral.of(pos, i));
    }
    return Optional.of(Node.ArrayLiteral.create(pos, elements.build()));
  }

  private static Optional<Node> roundToInteger(Node value, String direction, Pos pos) {
    switch (value.type()) {
      case STRING:
      case ARRAY:
      case VECTOR:
        return Optional.empty();
      default:
        return Optional.of(
            Node.Instruction.create(
                pos,
                "Round To Integer",
                ImmutableList.of(value, Node.Constant.create(pos, direction))));
    }
  }
}

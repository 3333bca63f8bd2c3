package ows;

import java.math.BigInteger;
import java.util.Optional;

import com.google.common.collect.ImmutableSet;

/** Compile-time arithmetic on number literals. */
final class ConstantFolder {

  static final ImmutableSet<String> ARITHMETIC = ImmutableSet.of("+", "-", "*", "/", "^", "%");

  // Beyond this an integer has no finite double value.
  private static final int MAX_BITS = 1023;

  /**
   * Follows substitution bindings from {@code node} and returns the literal they end in, or {@code
   * node} itself when they don't end in one. Stored variables are never followed: their runtime
   * value may differ.
   */
  static Node literal(Node node, Scope scope) {
    Node current = node;
    Scope currentScope = scope;
    while (current instanceof Node.Reference) {
      Optional<Variable> variable = currentScope.lookup(((Node.Reference) current).symbol());
      if (!variable.isPresent() || !variable.get().isSubstitution()) break;
      current = variable.get().value();
      currentScope = variable.get().scope().get();
    }
    return current.type().isLiteral() ? current : node;
  }

  /**
   * Folds {@code left op right}. Division and modulo by zero, and zero to a negative power, yield 0
   * the way the game does; results that aren't finite are left unfolded.
   */
  static Optional<Node.NumberLiteral> fold(
      Node.NumberLiteral left, String op, Node.NumberLiteral right, Pos pos) {
    Optional<BigInteger> x = left.integerValue();
    Optional<BigInteger> y = right.integerValue();
    if (x.isPresent() && y.isPresent()) {
      Optional<BigInteger> exact = foldIntegers(x.get(), op, y.get());
      if (exact.isPresent()) return Optional.of(Node.NumberLiteral.of(pos, exact.get()));
    }

    double a = left.doubleValue();
    double b = right.doubleValue();
    double result;
    switch (op) {
      case "+":
        result = a + b;
        break;
      case "-":
        result = a - b;
        break;
      case "*":
        result = a * b;
        break;
      case "/":
        result = b == 0 ? 0 : a / b;
        break;
      case "%":
        result = b == 0 ? 0 : a - b * Math.floor(a / b);
        break;
      case "^":
        result = a == 0 && b < 0 ? 0 : Math.pow(a, b);
        break;
      default:
        return Optional.empty();
    }
    if (Double.isNaN(result) || Double.isInfinite(result)) return Optional.empty();
    return Optional.of(Node.NumberLiteral.of(pos, result));
  }

  /**
   * Exact arithmetic for integer operands. Empty where the result isn't an integer, or is too large
   * for a double, so the caller falls back to floating point.
   */
  private static Optional<BigInteger> foldIntegers(BigInteger a, String op, BigInteger b) {
    BigInteger result;
    switch (op) {
      case "+":
        result = a.add(b);
        break;
      case "-":
        result = a.subtract(b);
        break;
      case "*":
        result = a.multiply(b);
        break;
      case "%":
        if (b.signum() == 0) return Optional.of(BigInteger.ZERO);
        result = a.mod(b.abs());
        if (b.signum() < 0 && result.signum() != 0) result = result.add(b);
        break;
      case "^":
        if (b.signum() < 0 || b.bitLength() > 31) return Optional.empty();
        if ((long) a.bitLength() * b.intValue() > MAX_BITS + 64) return Optional.empty();
        result = a.pow(b.intValue());
        break;
      default:
        return Optional.empty();
    }
    return result.bitLength() <= MAX_BITS ? Optional.of(result) : Optional.empty();
  }

  private ConstantFolder() {}
}

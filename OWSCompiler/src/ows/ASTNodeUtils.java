package ows;

import java.util.Optional;

/** Child dispatch used by the generated {@code visitChildren} implementations. */
public final class ASTNodeUtils {
  public static <V> V accept(ASTNodeInterface child, ASTVisitor<V> visitor, V value) {
    return child.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> children, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface child : children) {
      value = child.accept(visitor, value);
    }
    return value;
  }

  // An absent else branch or return value contributes nothing.
  public static <V> V accept(
      Optional<? extends ASTNodeInterface> child, ASTVisitor<V> visitor, V value) {
    return child.isPresent() ? child.get().accept(visitor, value) : value;
  }

  private ASTNodeUtils() {}
}

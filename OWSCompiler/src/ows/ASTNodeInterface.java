package ows;

/** Implemented by every syntax tree node through its generated {@code *_ASTNode} interface. */
public interface ASTNodeInterface {
  <V> V accept(ASTVisitor<V> visitor, V value);

  // Visits each @ASTChild in declaration order, threading the value through.
  <V> V visitChildren(ASTVisitor<V> visitor, V value);
}

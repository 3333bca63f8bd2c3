package ows;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/** A return must be a direct statement of a function body. */
class ReturnPlacementValidator extends ErrorCollectingValidator {
  private final Set<Node> allowed = Collections.newSetFromMap(new IdentityHashMap<>());

  @Override
  public void visitImpl(Node.Function function) {
    for (Node statement : function.body().statements()) {
      if (statement.type() == Node.Type.RETURN) allowed.add(statement);
    }
    super.visitImpl(function);
  }

  @Override
  public void visitImpl(Node.Return node) {
    if (!allowed.contains(node)) {
      logError(
          CompilerException.Kind.UNSUPPORTED,
          node.pos(),
          "'return' is only allowed at the top level of a function body");
    }
    super.visitImpl(node);
  }
}

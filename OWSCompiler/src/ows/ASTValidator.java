package ows;

import com.google.common.collect.ImmutableList;

/** Runs the static passes over a script before anything is lowered. */
public class ASTValidator extends ErrorCollectingValidator {

  private final Node.Script script;
  private final FunctionRegistry functionRegistry = new FunctionRegistry();

  public ASTValidator(Node.Script script) {
    this.script = script;
  }

  public ImmutableList<CompilerException> computeErrors() {
    if (acceptAll(functionRegistry)) {
      RecursionDetector detector = new RecursionDetector(functionRegistry);
      acceptAll(detector);
      detector.validate();
      takeErrors(detector);
    }
    acceptAll(new ReturnPlacementValidator());

    return errors();
  }

  private boolean acceptAll(ErrorCollectingValidator visitor) {
    script.accept(visitor, null);
    takeErrors(visitor);
    return !visitor.hasErrors();
  }
}

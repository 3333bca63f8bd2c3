package ows;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

/** Collects the top-level function definitions and rejects definitions anywhere else. */
class FunctionRegistry extends ErrorCollectingValidator {
  private final Map<String, Node.Function> functions = new LinkedHashMap<>();
  private final Set<Node.Function> topLevel = Collections.newSetFromMap(new IdentityHashMap<>());

  public ImmutableMap<String, Node.Function> functions() {
    return ImmutableMap.copyOf(functions);
  }

  @Override
  public void visitImpl(Node.Script script) {
    for (Node child : script.children()) {
      switch (child.type()) {
        case RULE:
          break;
        case FUNCTION:
          register(child.cast());
          break;
        default:
          logError(
              CompilerException.Kind.STRUCTURAL,
              child.pos(),
              String.format("expected a rule or function, found %s", child.type().displayName()));
      }
    }
    super.visitImpl(script);
  }

  private void register(Node.Function function) {
    topLevel.add(function);
    if (Builtin.forName(function.name()).isPresent()) {
      logError(
          CompilerException.Kind.STRUCTURAL,
          function.pos(),
          String.format("function '%s' redefines a builtin", function.name()));
    } else if (functions.containsKey(function.name())) {
      logError(
          CompilerException.Kind.STRUCTURAL,
          function.pos(),
          String.format("duplicate function '%s'", function.name()));
    } else {
      functions.put(function.name(), function);
    }
  }

  @Override
  public void visitImpl(Node.Function function) {
    if (!topLevel.contains(function)) {
      logError(
          CompilerException.Kind.STRUCTURAL,
          function.pos(),
          String.format("function '%s' must be defined at the top level", function.name()));
    }
    super.visitImpl(function);
  }
}

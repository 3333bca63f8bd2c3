package ows;

import java.util.HashSet;
import java.util.Set;

import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;

/** Rejects functions that can reach themselves; inlining them would never finish. */
class RecursionDetector extends ErrorCollectingValidator {
  private static class CallVisitor extends DefaultASTVisitor<Set<String>> {
    @Override
    public Set<String> visit(Node.Call call, Set<String> value) {
      if (call.callee().type() == Node.Type.GLOBAL_REF) {
        value.add(call.callee().<Node.GlobalRef>cast().name());
      }
      return call.visitChildren(this, value);
    }
  }

  private final FunctionRegistry registry;
  private final MutableGraph<String> edges =
      GraphBuilder.directed().allowsSelfLoops(true).build();

  RecursionDetector(FunctionRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void visitImpl(Node.Function function) {
    edges.addNode(function.name());

    for (String target : function.body().accept(new CallVisitor(), new HashSet<>())) {
      // A parameter shadows the function of the same name.
      if (function.params().contains(target)) continue;
      if (registry.functions().containsKey(target)) {
        edges.putEdge(function.name(), target);
      }
    }
  }

  public boolean validate() {
    return !detectCycles(
        edges,
        name ->
            logError(
                CompilerException.Kind.RECURSION,
                registry.functions().get(name).pos(),
                String.format("function '%s' is recursive and can't be inlined", name)));
  }
}

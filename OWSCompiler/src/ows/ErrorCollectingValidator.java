package ows;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.Graph;
import com.google.common.graph.Graphs;

/** Base for the static passes: visits the whole tree and collects errors instead of throwing. */
abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<CompilerException> errors = new ArrayList<>();

  protected ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(CompilerException.Kind kind, Pos pos, String msg) {
    errors.add(new CompilerException(kind, pos, msg));
  }

  // Reports every node that lies on a cycle, once. Returns true if there were any.
  protected <T> boolean detectCycles(Graph<T> graph, Consumer<T> logError) {
    Graph<T> closure = Graphs.transitiveClosure(graph);
    Set<T> logged = new HashSet<>();
    for (T node : closure.nodes()) {
      if (graph.successors(node).contains(node)) {
        if (logged.add(node)) {
          logError.accept(node);
        }
      } else {
        for (T node2 : closure.successors(node)) {
          if (!node2.equals(node) && closure.successors(node2).contains(node)) {
            if (logged.add(node)) {
              logError.accept(node);
            }
            break;
          }
        }
      }
    }

    return !logged.isEmpty();
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}

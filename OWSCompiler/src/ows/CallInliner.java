package ows;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Expands calls in place. The target has no functions, so a user function's body is lowered at
 * every call site, with each parameter bound to its unevaluated argument.
 */
final class CallInliner {
  private final Lowering lowering;

  CallInliner(Lowering lowering) {
    this.lowering = lowering;
  }

  Code inlineStatement(Node.Call call, Scope scope) throws CompilerException {
    Variable callee = resolve(call, scope);
    if (callee.kind() == Variable.Kind.BUILTIN) {
      return Code.of(lowering.render(expandBuiltin(call, callee.builtin().get(), scope), scope));
    }

    Node.Function function = callee.function();
    Scope functionScope = bindArguments(call, function, scope);
    Step step = lowering.lowerBody(function.body(), functionScope);
    Code.Builder code = Code.builder().append(step.code());
    if (step.returnValue().isPresent()) {
      code.append(lowering.lowerStatement(step.returnValue().get(), functionScope));
    }
    return code.build();
  }

  String inlineExpression(Node.Call call, Scope scope) throws CompilerException {
    Variable callee = resolve(call, scope);
    if (callee.kind() == Variable.Kind.BUILTIN) {
      return lowering.render(expandBuiltin(call, callee.builtin().get(), scope), scope);
    }

    Node.Function function = callee.function();
    Scope functionScope = bindArguments(call, function, scope);
    Step step = lowering.lowerBody(function.body(), functionScope);
    if (!step.code().isEmpty()) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED,
          call.pos(),
          String.format(
              "function '%s' performs actions and cannot be used as a value", function.name()));
    }
    if (!step.stopped() || !step.returnValue().isPresent()) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED,
          call.pos(),
          String.format("function '%s' does not return a value", function.name()));
    }
    return lowering.render(step.returnValue().get(), functionScope);
  }

  /** The expansion of {@code call} if it calls a builtin; empty for anything else. */
  Optional<Node> expandBuiltinCall(Node.Call call, Scope scope) throws CompilerException {
    if (call.callee().type() != Node.Type.GLOBAL_REF) return Optional.empty();
    Optional<Variable> callee = scope.lookup(call.callee().<Node.GlobalRef>cast().symbol());
    if (!callee.isPresent() || callee.get().kind() != Variable.Kind.BUILTIN) {
      return Optional.empty();
    }
    return Optional.of(expandBuiltin(call, callee.get().builtin().get(), scope));
  }

  private Variable resolve(Node.Call call, Scope scope) throws CompilerException {
    Node callee = call.callee();
    switch (callee.type()) {
      case GLOBAL_REF:
        break;
      case ATTRIBUTE_ACCESS:
        throw new CompilerException(
            CompilerException.Kind.UNSUPPORTED, callee.pos(), "method calls are not supported");
      default:
        throw new CompilerException(
            CompilerException.Kind.NAME_RESOLUTION,
            callee.pos(),
            String.format("%s is not callable", callee.type().displayName()));
    }

    Node.GlobalRef ref = callee.cast();
    Optional<Variable> variable = scope.lookup(ref.symbol());
    if (!variable.isPresent()) {
      throw new CompilerException(
          CompilerException.Kind.NAME_RESOLUTION,
          ref.pos(),
          String.format("undefined function '%s'", ref.name()));
    }
    if (variable.get().kind() == Variable.Kind.VALUE) {
      throw new CompilerException(
          CompilerException.Kind.NAME_RESOLUTION,
          ref.pos(),
          String.format("'%s' is not a function", ref.name()));
    }
    return variable.get();
  }

  // Parameters see the caller's scope, so an argument naming a parameter still means the caller's.
  private Scope bindArguments(Node.Call call, Node.Function function, Scope scope)
      throws CompilerException {
    if (call.args().size() != function.params().size()) {
      throw new CompilerException(
          CompilerException.Kind.STRUCTURAL,
          call.pos(),
          String.format(
              "'%s' expected %d arguments, received %d",
              function.name(), function.params().size(), call.args().size()));
    }

    Scope functionScope = scope.child(function.name());
    for (int i = 0; i < call.args().size(); i++) {
      Variable argument = Variable.substitution(call.args().get(i), scope);
      functionScope.bind(Symbol.global(function.params().get(i)), argument);
    }
    return functionScope;
  }

  private Node expandBuiltin(Node.Call call, Builtin builtin, Scope scope)
      throws CompilerException {
    if (!builtin.acceptsArity(call.args().size())) {
      throw new CompilerException(
          CompilerException.Kind.STRUCTURAL,
          call.pos(),
          String.format(
              "'%s' expected %s arguments, received %d",
              builtin.functionName(), builtin.arityDescription(), call.args().size()));
    }

    ImmutableList.Builder<Node> args = ImmutableList.builder();
    for (Node arg : call.args()) {
      args.add(ConstantFolder.literal(arg, scope));
    }
    Optional<Node> expanded = builtin.expand(args.build(), call.pos());
    if (!expanded.isPresent()) {
      throw new CompilerException(
          CompilerException.Kind.PARAMETER_TYPE,
          call.pos(),
          String.format("'%s' cannot be evaluated with these arguments", builtin.functionName()));
    }
    return expanded.get();
  }
}

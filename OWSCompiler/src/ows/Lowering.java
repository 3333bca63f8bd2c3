package ows;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Lowers statements into {@link Code} and renders values into Workshop expressions.
 *
 * <p>Structured control flow becomes {@code Skip}, {@code Skip If} and {@code Loop} actions. A
 * runtime for-loop keeps its position in a global slot, and because {@code Loop} restarts the whole
 * action list, every such loop adds a resume jump to the front of its ruleblock.
 */
final class Lowering {
  private static final ImmutableMap<String, String> BINARY_OPS =
      ImmutableMap.<String, String>builder()
          .put("+", "Add")
          .put("-", "Subtract")
          .put("*", "Multiply")
          .put("/", "Divide")
          .put("^", "Raise To Power")
          .put("%", "Modulo")
          .put("or", "Or")
          .put("and", "And")
          .build();

  private final SlotAllocator slots;
  private final Vocabulary vocabulary;
  private final InstructionValidator validator;
  private final CompilerOptions options;
  private final CallInliner inliner;

  // Innermost loop first.
  private final Deque<Code.Label> continueTargets = new ArrayDeque<>();
  private Code.Builder resumeJumps = null;

  Lowering(SlotAllocator slots, Vocabulary vocabulary, CompilerOptions options) {
    this.slots = slots;
    this.vocabulary = vocabulary;
    this.validator = new InstructionValidator(vocabulary);
    this.options = options;
    this.inliner = new CallInliner(this);
  }

  /** Lowers one ruleblock, with the resume jumps of its runtime loops in front. */
  Code lowerRuleblock(Node.Ruleblock ruleblock, Scope scope) throws CompilerException {
    Preconditions.checkState(resumeJumps == null, "ruleblocks don't nest");
    resumeJumps = Code.builder();
    try {
      Code body = lowerBlock(ruleblock.body(), scope);
      return Code.builder().append(resumeJumps.build()).append(body).build();
    } finally {
      resumeJumps = null;
    }
  }

  Code lowerBlock(Node.Block block, Scope scope) throws CompilerException {
    Code.Builder code = Code.builder();
    for (Node statement : block.statements()) {
      code.append(lowerStatement(statement, scope));
    }
    return code.build();
  }

  // Stops at the first top-level return.
  Step lowerBody(Node.Block body, Scope scope) throws CompilerException {
    Code.Builder code = Code.builder();
    for (Node statement : body.statements()) {
      if (statement.type() == Node.Type.RETURN) {
        return Step.stop(code.build(), statement.<Node.Return>cast().value());
      }
      code.append(lowerStatement(statement, scope));
    }
    return Step.proceed(code.build());
  }

  Code lowerStatement(Node node, Scope scope) throws CompilerException {
    switch (node.type()) {
      case BLOCK:
        return lowerBlock(node.cast(), scope);
      case ASSIGN:
        return lowerAssign(node.cast(), scope);
      case IF:
        return lowerIf(node.cast(), scope);
      case WHILE:
        return lowerWhile(node.cast(), scope);
      case FOR:
        return lowerFor(node.cast(), scope);
      case CONTINUE:
        return lowerContinue(node.cast());
      case CALL:
        return inliner.inlineStatement(node.cast(), scope);
      case RETURN:
        throw new CompilerException(
            CompilerException.Kind.UNSUPPORTED,
            node.pos(),
            "'return' is only allowed at the top level of a function body");
      case FUNCTION:
        throw new CompilerException(
            CompilerException.Kind.STRUCTURAL,
            node.pos(),
            "functions may only be defined at the top level");
      case SCRIPT:
      case RULE:
      case RULEBLOCK:
        throw new AssertionError(node.type());
      default:
        return Code.of(render(node, scope));
    }
  }

  private Code lowerIf(Node.If node, Scope scope) throws CompilerException {
    String condition = render(node.condition(), scope);
    Code trueCode = lowerBlock(node.trueBlock(), scope);
    Optional<Code> falseCode = Optional.empty();
    if (node.falseBranch().isPresent()) {
      falseCode = Optional.of(lowerStatement(node.falseBranch().get(), scope));
    }

    int skip = trueCode.size() + (falseCode.isPresent() ? 1 : 0);
    Code.Builder code = Code.builder();
    code.line(String.format("Skip If(Not(%s), %d)", condition, skip));
    code.append(trueCode);
    if (falseCode.isPresent()) {
      code.line(String.format("Skip(%d)", falseCode.get().size()));
      code.append(falseCode.get());
    }
    return code.build();
  }

  private Code lowerWhile(Node.While node, Scope scope) throws CompilerException {
    String condition = render(node.condition(), scope);
    Code.Label next = Code.label("while continue");
    Code body = lowerLoopBody(node.body(), scope, next);

    return Code.builder()
        .line(String.format("Skip If(Not(%s), %d)", condition, body.size() + 2))
        .append(body)
        .mark(next)
        .line(options.minimalWait())
        .line(String.format("Loop If(%s)", condition))
        .build();
  }

  private Code lowerLoopBody(Node.Block body, Scope scope, Code.Label next)
      throws CompilerException {
    continueTargets.push(next);
    try {
      return lowerBlock(body, scope);
    } finally {
      continueTargets.pop();
    }
  }

  private Code lowerContinue(Node.Continue node) throws CompilerException {
    if (continueTargets.isEmpty()) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED, node.pos(), "'continue' outside of a loop");
    }
    return Code.builder().jump("Skip(", continueTargets.peek(), ")").build();
  }

  private Code lowerFor(Node.For node, Scope scope) throws CompilerException {
    Optional<Node.ArrayLiteral> known = compileTimeArray(node.iterable(), scope);
    if (known.isPresent()) return unroll(node, known.get(), scope);
    return lowerRuntimeFor(node, scope);
  }

  /**
   * One copy of the body per element; the loop variable is a substitution, so no slot is used.
   * Each copy's scope is a child of the previous copy's, so a name first stored by one copy keeps
   * its slot in the copies after it.
   */
  private Code unroll(Node.For node, Node.ArrayLiteral array, Scope scope)
      throws CompilerException {
    Code.Builder code = Code.builder();
    Scope iteration = scope;
    for (Node element : array.elements()) {
      iteration = iteration.child("for " + node.variable());
      iteration.bind(Symbol.global(node.variable()), Variable.substitution(element, scope));
      Code.Label next = Code.label("unrolled continue");
      code.append(lowerLoopBody(node.body(), iteration, next)).mark(next);
    }
    return code.build();
  }

  private Code lowerRuntimeFor(Node.For node, Scope scope) throws CompilerException {
    Preconditions.checkState(resumeJumps != null, "for-loop outside of a ruleblock");
    int counter = slots.allocate(Symbol.Domain.GLOBAL, "for " + node.variable());
    String collection = render(node.iterable(), scope);

    // The counter lives in its own scope so that the collection still renders in the outer one.
    Symbol counterSymbol = Symbol.global("for$" + counter);
    Scope counterScope = scope.child("for counter");
    counterScope.bind(
        counterSymbol, Variable.stored(Node.NumberLiteral.of(node.pos(), 0), counter));
    Node element =
        Node.IndexedAccess.create(
            node.pos(), node.iterable(), Node.GlobalRef.create(node.pos(), counterSymbol.name()));
    Scope loopScope = counterScope.child("for " + node.variable());
    loopScope.bind(Symbol.global(node.variable()), Variable.substitution(element, counterScope));

    String position = globalRead(counter);
    String reset = String.format("Set Global Variable At Index(A, %d, 0)", counter);
    Code.Label check = Code.label("for resume");
    Code.Label next = Code.label("for continue");
    Code tail =
        Code.builder()
            .append(lowerLoopBody(node.body(), loopScope, next))
            .mark(next)
            .line(String.format("Modify Global Variable At Index(A, %d, Add, 1)", counter))
            .line(options.minimalWait())
            .line("Loop")
            .line(reset)
            .build();

    resumeJumps.jump(String.format("Skip If(Compare(%s, !=, 0), ", position), check, ")");
    return Code.builder()
        .line(reset)
        .mark(check)
        .line(
            String.format(
                "Skip If(Compare(Count Of(%s), ==, %s), %d)", collection, position, tail.size()))
        .append(tail)
        .build();
  }

  private Code lowerAssign(Node.Assign assign, Scope scope) throws CompilerException {
    switch (assign.target().type()) {
      case GLOBAL_REF:
      case ENTITY_REF:
        {
          Node.Reference ref = assign.target().cast();
          Node value =
              assign.isCompound()
                  ? Node.BinaryOp.create(assign.pos(), ref, assign.binaryOp(), assign.value())
                  : assign.value();
          String rendered = render(value, scope);
          Node bound = compileTimeArray(value, scope).<Node>map(a -> a).orElse(value);
          Variable variable = scope.assign(ref.symbol(), bound, slots);
          return Code.of(storageWrite(ref, variable.index().get(), rendered, scope));
        }
      case INDEXED_ACCESS:
        return lowerElementAssign(assign, assign.target().cast(), scope);
      default:
        throw new CompilerException(
            CompilerException.Kind.UNSUPPORTED,
            assign.target().pos(),
            String.format("cannot assign to %s", assign.target().type().displayName()));
    }
  }

  // Element writes replace the whole stored array, so the index must be known here.
  private Code lowerElementAssign(Node.Assign assign, Node.IndexedAccess target, Scope scope)
      throws CompilerException {
    if (!(target.parent() instanceof Node.Reference)) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED,
          target.pos(),
          "element assignment requires an array variable");
    }
    Node.Reference ref = target.parent().cast();
    Variable variable = lookup(ref, scope);
    Optional<Integer> index = integerLiteral(target.index(), scope);
    if (!index.isPresent()) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED,
          target.index().pos(),
          "array element assignment requires an integer literal index");
    }
    if (variable.kind() != Variable.Kind.VALUE
        || !variable.isStored()
        || variable.value().type() != Node.Type.ARRAY) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED,
          ref.pos(),
          String.format("'%s' is not bound to an array literal", ref.name()));
    }
    Node.ArrayLiteral array = variable.value().cast();
    int k = index.get();
    if (k < 0 || k >= array.elements().size()) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED,
          target.index().pos(),
          String.format(
              "index %d is out of range for '%s' of size %d",
              k, ref.name(), array.elements().size()));
    }
    // The new element is kept unrendered inside the array, so reads of the array must be
    // resolved against the old literal here.
    Node value = knownElements(assign.value(), ref.symbol(), array, scope);
    if (mentions(value, ref.symbol())) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED,
          assign.value().pos(),
          String.format(
              "an element of '%s' can't be assigned a value that reads it, except at a literal"
                  + " index",
              ref.name()));
    }

    Node element =
        assign.isCompound()
            ? Node.BinaryOp.create(assign.pos(), array.elements().get(k), assign.binaryOp(), value)
            : value;
    Node.ArrayLiteral replaced = array.withElement(k, element);
    String rendered = render(replaced, scope);
    int slot = variable.index().get();
    scope.bind(ref.symbol(), Variable.stored(replaced, slot));
    return Code.of(storageWrite(ref, slot, rendered, scope));
  }

  // Replaces reads of symbol at a literal index with the element of array they would read.
  private Node knownElements(Node node, Symbol symbol, Node.ArrayLiteral array, Scope scope) {
    switch (node.type()) {
      case INDEXED_ACCESS:
        {
          Node.IndexedAccess access = node.cast();
          Optional<Integer> index = integerLiteral(access.index(), scope);
          if (access.parent() instanceof Node.Reference
              && access.parent().<Node.Reference>cast().symbol().equals(symbol)
              && index.isPresent()) {
            int k = index.get();
            return k >= 0 && k < array.elements().size()
                ? array.elements().get(k)
                : Node.NumberLiteral.of(access.pos(), 0);
          }
          return Node.IndexedAccess.create(
              access.pos(),
              knownElements(access.parent(), symbol, array, scope),
              knownElements(access.index(), symbol, array, scope));
        }
      case BINARY_OP:
        {
          Node.BinaryOp op = node.cast();
          return Node.BinaryOp.create(
              op.pos(),
              knownElements(op.left(), symbol, array, scope),
              op.op(),
              knownElements(op.right(), symbol, array, scope));
        }
      case COMPARE:
        {
          Node.Compare compare = node.cast();
          return Node.Compare.create(
              compare.pos(),
              knownElements(compare.left(), symbol, array, scope),
              compare.op(),
              knownElements(compare.right(), symbol, array, scope));
        }
      case UNARY_OP:
        {
          Node.UnaryOp op = node.cast();
          return Node.UnaryOp.create(
              op.pos(), op.op(), knownElements(op.operand(), symbol, array, scope));
        }
      case INSTRUCTION:
        {
          Node.Instruction instruction = node.cast();
          return Node.Instruction.create(
              instruction.pos(),
              instruction.name(),
              knownElements(instruction.args(), symbol, array, scope));
        }
      case CALL:
        {
          Node.Call call = node.cast();
          return Node.Call.create(
              call.pos(), call.callee(), knownElements(call.args(), symbol, array, scope));
        }
      case STRING:
        {
          Node.StringLiteral string = node.cast();
          return Node.StringLiteral.create(
              string.pos(), string.template(), knownElements(string.args(), symbol, array, scope));
        }
      case VECTOR:
        return Node.VectorLiteral.create(
            node.pos(),
            knownElements(node.<Node.VectorLiteral>cast().components(), symbol, array, scope));
      case ARRAY:
        return Node.ArrayLiteral.create(
            node.pos(),
            knownElements(node.<Node.ArrayLiteral>cast().elements(), symbol, array, scope));
      case ATTRIBUTE_ACCESS:
        {
          Node.AttributeAccess access = node.cast();
          return Node.AttributeAccess.create(
              access.pos(), knownElements(access.parent(), symbol, array, scope), access.name());
        }
      default:
        return node;
    }
  }

  private ImmutableList<Node> knownElements(
      ImmutableList<Node> nodes, Symbol symbol, Node.ArrayLiteral array, Scope scope) {
    ImmutableList.Builder<Node> rewritten = ImmutableList.builder();
    for (Node node : nodes) {
      rewritten.add(knownElements(node, symbol, array, scope));
    }
    return rewritten.build();
  }

  private static boolean mentions(Node node, Symbol symbol) {
    return node.accept(
        new DefaultASTVisitor<Boolean>() {
          @Override
          public Boolean visit(Node.GlobalRef ref, Boolean found) {
            return found || ref.symbol().equals(symbol);
          }

          @Override
          public Boolean visit(Node.EntityRef ref, Boolean found) {
            return ref.visitChildren(this, found || ref.symbol().equals(symbol));
          }
        },
        false);
  }

  private String storageWrite(Node.Reference ref, int index, String value, Scope scope)
      throws CompilerException {
    if (ref.type() == Node.Type.GLOBAL_REF) {
      return String.format("Set Global Variable At Index(A, %d, %s)", index, value);
    }
    String owner = render(ref.<Node.EntityRef>cast().owner(), scope);
    return String.format("Set Player Variable At Index(%s, A, %d, %s)", owner, index, value);
  }

  private static String globalRead(int index) {
    return String.format("Value In Array(Global Variable(A), %d)", index);
  }

  /** Renders a value node into a Workshop expression. */
  String render(Node node, Scope scope) throws CompilerException {
    switch (node.type()) {
      case INSTRUCTION:
        return renderInstruction(node.cast(), scope);
      case CONSTANT:
        return Names.title(node.<Node.Constant>cast().name());
      case COMPARE:
        return renderCompare(node.cast(), scope);
      case BINARY_OP:
        return renderBinaryOp(node.cast(), scope);
      case UNARY_OP:
        return renderUnaryOp(node.cast(), scope);
      case GLOBAL_REF:
      case ENTITY_REF:
        return renderReference(node.cast(), scope);
      case STRING:
        return renderString(node.cast(), scope);
      case NUMBER:
        return node.<Node.NumberLiteral>cast().value();
      case TIME:
        return Node.NumberLiteral.format(node.<Node.TimeLiteral>cast().seconds());
      case VECTOR:
        {
          ImmutableList<String> components =
              renderAll(node.<Node.VectorLiteral>cast().components(), scope);
          return String.format("Vector(%s)", Joiner.on(", ").join(components));
        }
      case ARRAY:
        return renderArray(node.cast(), scope);
      case INDEXED_ACCESS:
        return renderIndexedAccess(node.cast(), scope);
      case ATTRIBUTE_ACCESS:
        return renderAttribute(node.cast(), scope);
      case CALL:
        return inliner.inlineExpression(node.cast(), scope);
      case BLOCK:
      case FUNCTION:
      case ASSIGN:
      case IF:
      case WHILE:
      case FOR:
      case RETURN:
      case CONTINUE:
        throw new CompilerException(
            CompilerException.Kind.UNSUPPORTED,
            node.pos(),
            String.format("%s cannot be used as a value", node.type().displayName()));
      case SCRIPT:
      case RULE:
      case RULEBLOCK:
        throw new AssertionError(node.type());
      default:
        throw new AssertionError("Unknown type: " + node.type());
    }
  }

  private ImmutableList<String> renderAll(ImmutableList<Node> nodes, Scope scope)
      throws CompilerException {
    ImmutableList.Builder<String> rendered = ImmutableList.builder();
    for (Node node : nodes) {
      rendered.add(render(node, scope));
    }
    return rendered.build();
  }

  private String renderInstruction(Node.Instruction node, Scope scope) throws CompilerException {
    ImmutableList<String> args = renderAll(node.args(), scope);
    validator.validate(node, args);
    String name = Names.title(node.name());
    return args.isEmpty() ? name : String.format("%s(%s)", name, Joiner.on(", ").join(args));
  }

  private String renderCompare(Node.Compare node, Scope scope) throws CompilerException {
    String left = render(node.left(), scope);
    String right = render(node.right(), scope);
    switch (node.op().toLowerCase()) {
      case "in":
        return String.format("Array Contains(%s, %s)", right, left);
      case "not in":
        return String.format("Not(Array Contains(%s, %s))", right, left);
      default:
        return String.format("Compare(%s, %s, %s)", left, node.op(), right);
    }
  }

  private String renderBinaryOp(Node.BinaryOp node, Scope scope) throws CompilerException {
    if (ConstantFolder.ARITHMETIC.contains(node.op())) {
      Node left = ConstantFolder.literal(node.left(), scope);
      Node right = ConstantFolder.literal(node.right(), scope);
      if (left.type() == Node.Type.NUMBER && right.type() == Node.Type.NUMBER) {
        Optional<Node.NumberLiteral> folded =
            ConstantFolder.fold(left.cast(), node.op(), right.cast(), node.pos());
        if (folded.isPresent()) return folded.get().value();
      }
    }

    String op = BINARY_OPS.get(node.op().toLowerCase());
    if (op == null) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED,
          node.pos(),
          String.format("unknown operator '%s'", node.op()));
    }
    return String.format(
        "%s(%s, %s)", op, render(node.left(), scope), render(node.right(), scope));
  }

  private String renderUnaryOp(Node.UnaryOp node, Scope scope) throws CompilerException {
    String operand = render(node.operand(), scope);
    switch (node.op().toLowerCase()) {
      case "-":
        return "-" + operand;
      case "+":
        return String.format("Abs(%s)", operand);
      case "not":
        return String.format("Not(%s)", operand);
      default:
        throw new CompilerException(
            CompilerException.Kind.UNSUPPORTED,
            node.pos(),
            String.format("unknown operator '%s'", node.op()));
    }
  }

  private String renderString(Node.StringLiteral node, Scope scope) throws CompilerException {
    StringBuilder sb = new StringBuilder("String(\"").append(Names.title(node.template()));
    sb.append('"');
    for (String arg : renderAll(node.args(), scope)) {
      sb.append(", ").append(arg);
    }
    return sb.append(')').toString();
  }

  private String renderArray(Node.ArrayLiteral node, Scope scope) throws CompilerException {
    String array = "Empty Array";
    for (Node element : node.elements()) {
      // The runtime can't store strings in arrays.
      String rendered = element.type() == Node.Type.STRING ? "Null" : render(element, scope);
      array = String.format("Append To Array(%s, %s)", array, rendered);
    }
    return array;
  }

  private String renderReference(Node.Reference ref, Scope scope) throws CompilerException {
    Variable variable = lookup(ref, scope);
    if (variable.kind() != Variable.Kind.VALUE) {
      throw new CompilerException(
          CompilerException.Kind.UNSUPPORTED,
          ref.pos(),
          String.format("function '%s' cannot be used as a value", ref.name()));
    }
    if (variable.isSubstitution()) {
      return render(variable.value(), variable.scope().get());
    }
    if (variable.value().type() == Node.Type.STRING) {
      return render(variable.value(), scope);
    }

    int index = variable.index().get();
    if (ref.type() == Node.Type.GLOBAL_REF) return globalRead(index);
    String owner = render(ref.<Node.EntityRef>cast().owner(), scope);
    return String.format("Value In Array(Player Variable(%s, A), %d)", owner, index);
  }

  private String renderIndexedAccess(Node.IndexedAccess node, Scope scope)
      throws CompilerException {
    if (node.parent() instanceof Node.Reference) {
      Optional<Integer> index = integerLiteral(node.index(), scope);
      if (index.isPresent()) {
        Optional<Node.ArrayLiteral> array = compileTimeArray(node.parent(), scope);
        if (array.isPresent()) {
          int k = index.get();
          ImmutableList<Node> elements = array.get().elements();
          return k >= 0 && k < elements.size() ? render(elements.get(k), scope) : "0";
        }
      }
    }
    return String.format(
        "Value In Array(%s, %s)", render(node.parent(), scope), render(node.index(), scope));
  }

  private String renderAttribute(Node.AttributeAccess node, Scope scope)
      throws CompilerException {
    String owner = attributeOwner(node.parent(), scope);
    Optional<String> template = vocabulary.attributeTemplate(owner, node.name());
    if (!template.isPresent()) {
      throw new CompilerException(
          CompilerException.Kind.ATTRIBUTE,
          node.pos(),
          String.format("'%s' has no attribute '%s'", Names.title(owner), node.name()));
    }
    return template.get().replace("{}", render(node.parent(), scope));
  }

  // The instruction name for instructions, the bound value's owner for variables, else the kind.
  private String attributeOwner(Node node, Scope scope) throws CompilerException {
    switch (node.type()) {
      case INSTRUCTION:
        return node.<Node.Instruction>cast().name();
      case GLOBAL_REF:
      case ENTITY_REF:
        {
          Variable variable = lookup(node.cast(), scope);
          if (variable.kind() != Variable.Kind.VALUE) return node.type().name();
          if (variable.isSubstitution()) {
            return attributeOwner(variable.value(), variable.scope().get());
          }
          // A stored reference to another variable isn't followed; it may be itself.
          Node value = variable.value();
          return value instanceof Node.Reference
              ? value.type().name()
              : attributeOwner(value, scope);
        }
      case ATTRIBUTE_ACCESS:
        {
          // Named after the instruction its template applies, as in "Position Of".
          Node.AttributeAccess access = node.cast();
          Optional<String> template =
              vocabulary.attributeTemplate(attributeOwner(access.parent(), scope), access.name());
          return template.isPresent() && template.get().contains("(")
              ? template.get().substring(0, template.get().indexOf('(')).trim()
              : node.type().name();
        }
      case CALL:
        return compileTimeArray(node, scope).isPresent()
            ? Node.Type.ARRAY.name()
            : node.type().name();
      default:
        return node.type().name();
    }
  }

  Variable lookup(Node.Reference ref, Scope scope) throws CompilerException {
    Optional<Variable> variable = scope.lookup(ref.symbol());
    if (!variable.isPresent()) {
      throw new CompilerException(
          CompilerException.Kind.NAME_RESOLUTION,
          ref.pos(),
          String.format("undefined variable '%s'", ref.name()));
    }
    return variable.get();
  }

  Optional<Integer> integerLiteral(Node node, Scope scope) {
    Node literal = ConstantFolder.literal(node, scope);
    if (literal.type() != Node.Type.NUMBER) return Optional.empty();
    return literal.<Node.NumberLiteral>cast().intValue();
  }

  /**
   * The array literal {@code node} is known to hold at compile time: an array literal, a variable
   * bound to one, or a builtin call that produces one.
   */
  Optional<Node.ArrayLiteral> compileTimeArray(Node node, Scope scope) throws CompilerException {
    switch (node.type()) {
      case ARRAY:
        return Optional.of(node.cast());
      case GLOBAL_REF:
      case ENTITY_REF:
        {
          Optional<Variable> variable = scope.lookup(node.<Node.Reference>cast().symbol());
          if (!variable.isPresent() || variable.get().kind() != Variable.Kind.VALUE) {
            return Optional.empty();
          }
          if (variable.get().isSubstitution()) {
            return compileTimeArray(variable.get().value(), variable.get().scope().get());
          }
          Node value = variable.get().value();
          return value.type() == Node.Type.ARRAY
              ? Optional.of(value.cast())
              : Optional.empty();
        }
      case CALL:
        {
          Optional<Node> expanded = inliner.expandBuiltinCall(node.cast(), scope);
          if (expanded.isPresent() && expanded.get().type() == Node.Type.ARRAY) {
            return Optional.of(expanded.get().cast());
          }
          return Optional.empty();
        }
      default:
        return Optional.empty();
    }
  }
}

package ows;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

import com.google.common.base.CaseFormat;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import ows.processor.ASTChild;
import ows.processor.ASTNode;

/**
 * The syntax tree handed to the compiler by the front end.
 *
 * <p>Nodes are immutable. Every concrete kind is a nested class with a {@code create} factory, and
 * its children are the accessors marked {@link ASTChild}, visited in declaration order.
 */
public abstract class Node implements ASTNodeInterface {

  public enum Type {
    // Structure
    SCRIPT,
    RULE,
    RULEBLOCK,
    BLOCK,
    FUNCTION,

    // Statements
    ASSIGN,
    IF,
    WHILE,
    FOR,
    RETURN,
    CONTINUE,

    // Values
    INSTRUCTION,
    CONSTANT,
    COMPARE,
    BINARY_OP,
    UNARY_OP,
    GLOBAL_REF,
    ENTITY_REF,
    STRING,
    NUMBER,
    TIME,
    VECTOR,
    ARRAY,
    INDEXED_ACCESS,
    ATTRIBUTE_ACCESS,
    CALL;

    public String displayName() {
      return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());
    }

    public boolean isLiteral() {
      switch (this) {
        case STRING:
        case NUMBER:
        case TIME:
        case CONSTANT:
        case ARRAY:
          return true;
        default:
          return false;
      }
    }
  }

  private final Type type;
  private final Pos pos;

  protected Node(Type type, Pos pos) {
    this.type = type;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  public Pos pos() {
    return pos;
  }

  @SuppressWarnings("unchecked")
  public <T extends Node> T cast() {
    return (T) this;
  }

  @Override
  public String toString() {
    return type.displayName();
  }

  @ASTNode
  public static final class Script extends Node implements Node_Script_ASTNode {
    private final ImmutableList<Node> children;

    private Script(Pos pos, ImmutableList<Node> children) {
      super(Type.SCRIPT, pos);
      this.children = children;
    }

    public static Script create(Pos pos, Iterable<? extends Node> children) {
      return new Script(pos, ImmutableList.copyOf(children));
    }

    // Rules and function definitions, in source order.
    @ASTChild
    @Override
    public ImmutableList<Node> children() {
      return children;
    }
  }

  /**
   * A named rule. The name may interleave text with values: each {@code {}} in {@link #name()} is
   * replaced by the matching element of {@link #nameArgs()}, rendered in the global scope.
   */
  @ASTNode
  public static final class Rule extends Node implements Node_Rule_ASTNode {
    private static final Splitter PLACEHOLDER = Splitter.on("{}");

    private final String name;
    private final ImmutableList<Node> nameArgs;
    private final boolean disabled;
    private final ImmutableList<Ruleblock> ruleblocks;

    private Rule(
        Pos pos,
        String name,
        ImmutableList<Node> nameArgs,
        boolean disabled,
        ImmutableList<Ruleblock> ruleblocks) {
      super(Type.RULE, pos);
      this.name = name;
      this.nameArgs = nameArgs;
      this.disabled = disabled;
      this.ruleblocks = ruleblocks;
    }

    public static Rule create(
        Pos pos, String name, boolean disabled, Iterable<Ruleblock> ruleblocks) {
      return create(pos, name, ImmutableList.of(), disabled, ruleblocks);
    }

    public static Rule create(
        Pos pos,
        String name,
        Iterable<? extends Node> nameArgs,
        boolean disabled,
        Iterable<Ruleblock> ruleblocks) {
      ImmutableList<Node> args = ImmutableList.copyOf(nameArgs);
      int placeholders = PLACEHOLDER.splitToList(name).size() - 1;
      Preconditions.checkArgument(
          placeholders == args.size(),
          "rule name '%s' has %s placeholders but %s values",
          name,
          placeholders,
          args.size());
      return new Rule(pos, name, args, disabled, ImmutableList.copyOf(ruleblocks));
    }

    public String name() {
      return name;
    }

    /** The text of the name between placeholders; one more piece than there are name values. */
    public ImmutableList<String> nameText() {
      return ImmutableList.copyOf(PLACEHOLDER.split(name));
    }

    @ASTChild
    @Override
    public ImmutableList<Node> nameArgs() {
      return nameArgs;
    }

    public boolean disabled() {
      return disabled;
    }

    @ASTChild
    @Override
    public ImmutableList<Ruleblock> ruleblocks() {
      return ruleblocks;
    }
  }

  /** One titled section of a rule: Event, Conditions or Actions. */
  @ASTNode
  public static final class Ruleblock extends Node implements Node_Ruleblock_ASTNode {
    private final String name;
    private final Block body;

    private Ruleblock(Pos pos, String name, Block body) {
      super(Type.RULEBLOCK, pos);
      this.name = name;
      this.body = body;
    }

    public static Ruleblock create(Pos pos, String name, Block body) {
      return new Ruleblock(pos, name, body);
    }

    public String name() {
      return name;
    }

    public boolean isConditions() {
      return name.equalsIgnoreCase("Conditions");
    }

    @ASTChild
    @Override
    public Block body() {
      return body;
    }
  }

  @ASTNode
  public static final class Block extends Node implements Node_Block_ASTNode {
    private final ImmutableList<Node> statements;

    private Block(Pos pos, ImmutableList<Node> statements) {
      super(Type.BLOCK, pos);
      this.statements = statements;
    }

    public static Block create(Pos pos, Iterable<? extends Node> statements) {
      return new Block(pos, ImmutableList.copyOf(statements));
    }

    @ASTChild
    @Override
    public ImmutableList<Node> statements() {
      return statements;
    }
  }

  @ASTNode
  public static final class Function extends Node implements Node_Function_ASTNode {
    private final String name;
    private final ImmutableList<String> params;
    private final Block body;

    private Function(Pos pos, String name, ImmutableList<String> params, Block body) {
      super(Type.FUNCTION, pos);
      this.name = name;
      this.params = params;
      this.body = body;
    }

    public static Function create(Pos pos, String name, Iterable<String> params, Block body) {
      return new Function(pos, name, ImmutableList.copyOf(params), body);
    }

    public String name() {
      return name;
    }

    public ImmutableList<String> params() {
      return params;
    }

    @ASTChild
    @Override
    public Block body() {
      return body;
    }
  }

  /** {@code target op value}, where op is {@code =} or a compound operator such as {@code +=}. */
  @ASTNode
  public static final class Assign extends Node implements Node_Assign_ASTNode {
    private final Node target;
    private final String op;
    private final Node value;

    private Assign(Pos pos, Node target, String op, Node value) {
      super(Type.ASSIGN, pos);
      this.target = target;
      this.op = op;
      this.value = value;
    }

    public static Assign create(Pos pos, Node target, String op, Node value) {
      Preconditions.checkArgument(op.endsWith("="), "not an assignment operator: %s", op);
      return new Assign(pos, target, op, value);
    }

    @ASTChild
    @Override
    public Node target() {
      return target;
    }

    public String op() {
      return op;
    }

    public boolean isCompound() {
      return !op.equals("=");
    }

    // For "+=", "+".
    public String binaryOp() {
      return op.substring(0, op.length() - 1);
    }

    @ASTChild
    @Override
    public Node value() {
      return value;
    }
  }

  @ASTNode
  public static final class If extends Node implements Node_If_ASTNode {
    private final Node condition;
    private final Block trueBlock;
    private final Optional<Node> falseBranch;

    private If(Pos pos, Node condition, Block trueBlock, Optional<Node> falseBranch) {
      super(Type.IF, pos);
      this.condition = condition;
      this.trueBlock = trueBlock;
      this.falseBranch = falseBranch;
    }

    public static If create(Pos pos, Node condition, Block trueBlock) {
      return new If(pos, condition, trueBlock, Optional.empty());
    }

    // An else block, or a chained If for "elif".
    public static If create(Pos pos, Node condition, Block trueBlock, Node falseBranch) {
      Preconditions.checkArgument(
          falseBranch.type() == Type.BLOCK || falseBranch.type() == Type.IF,
          "else branch must be a Block or an If: %s",
          falseBranch.type());
      return new If(pos, condition, trueBlock, Optional.of(falseBranch));
    }

    @ASTChild
    @Override
    public Node condition() {
      return condition;
    }

    @ASTChild
    @Override
    public Block trueBlock() {
      return trueBlock;
    }

    @ASTChild
    @Override
    public Optional<Node> falseBranch() {
      return falseBranch;
    }
  }

  @ASTNode
  public static final class While extends Node implements Node_While_ASTNode {
    private final Node condition;
    private final Block body;

    private While(Pos pos, Node condition, Block body) {
      super(Type.WHILE, pos);
      this.condition = condition;
      this.body = body;
    }

    public static While create(Pos pos, Node condition, Block body) {
      return new While(pos, condition, body);
    }

    @ASTChild
    @Override
    public Node condition() {
      return condition;
    }

    @ASTChild
    @Override
    public Block body() {
      return body;
    }
  }

  @ASTNode
  public static final class For extends Node implements Node_For_ASTNode {
    private final String variable;
    private final Node iterable;
    private final Block body;

    private For(Pos pos, String variable, Node iterable, Block body) {
      super(Type.FOR, pos);
      this.variable = variable;
      this.iterable = iterable;
      this.body = body;
    }

    public static For create(Pos pos, String variable, Node iterable, Block body) {
      return new For(pos, variable, iterable, body);
    }

    public String variable() {
      return variable;
    }

    @ASTChild
    @Override
    public Node iterable() {
      return iterable;
    }

    @ASTChild
    @Override
    public Block body() {
      return body;
    }
  }

  @ASTNode
  public static final class Return extends Node implements Node_Return_ASTNode {
    private final Optional<Node> value;

    private Return(Pos pos, Optional<Node> value) {
      super(Type.RETURN, pos);
      this.value = value;
    }

    public static Return create(Pos pos) {
      return new Return(pos, Optional.empty());
    }

    public static Return create(Pos pos, Node value) {
      return new Return(pos, Optional.of(value));
    }

    @ASTChild
    @Override
    public Optional<Node> value() {
      return value;
    }
  }

  @ASTNode
  public static final class Continue extends Node implements Node_Continue_ASTNode {
    private Continue(Pos pos) {
      super(Type.CONTINUE, pos);
    }

    public static Continue create(Pos pos) {
      return new Continue(pos);
    }
  }

  /** A call to a named Workshop instruction, such as {@code Wait(1, Ignore Condition)}. */
  @ASTNode
  public static final class Instruction extends Node implements Node_Instruction_ASTNode {
    private final String name;
    private final ImmutableList<Node> args;

    private Instruction(Pos pos, String name, ImmutableList<Node> args) {
      super(Type.INSTRUCTION, pos);
      this.name = name;
      this.args = args;
    }

    public static Instruction create(Pos pos, String name, Iterable<? extends Node> args) {
      return new Instruction(pos, name, ImmutableList.copyOf(args));
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> args() {
      return args;
    }
  }

  /** A bare Workshop keyword, such as {@code Ignore Condition} or {@code Team 1}. */
  @ASTNode
  public static final class Constant extends Node implements Node_Constant_ASTNode {
    private final String name;

    private Constant(Pos pos, String name) {
      super(Type.CONSTANT, pos);
      this.name = name;
    }

    public static Constant create(Pos pos, String name) {
      return new Constant(pos, name);
    }

    public String name() {
      return name;
    }
  }

  @ASTNode
  public static final class Compare extends Node implements Node_Compare_ASTNode {
    private final Node left;
    private final String op;
    private final Node right;

    private Compare(Pos pos, Node left, String op, Node right) {
      super(Type.COMPARE, pos);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    public static Compare create(Pos pos, Node left, String op, Node right) {
      return new Compare(pos, left, op, right);
    }

    @ASTChild
    @Override
    public Node left() {
      return left;
    }

    public String op() {
      return op;
    }

    @ASTChild
    @Override
    public Node right() {
      return right;
    }
  }

  @ASTNode
  public static final class BinaryOp extends Node implements Node_BinaryOp_ASTNode {
    private final Node left;
    private final String op;
    private final Node right;

    private BinaryOp(Pos pos, Node left, String op, Node right) {
      super(Type.BINARY_OP, pos);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    public static BinaryOp create(Pos pos, Node left, String op, Node right) {
      return new BinaryOp(pos, left, op, right);
    }

    @ASTChild
    @Override
    public Node left() {
      return left;
    }

    public String op() {
      return op;
    }

    @ASTChild
    @Override
    public Node right() {
      return right;
    }
  }

  @ASTNode
  public static final class UnaryOp extends Node implements Node_UnaryOp_ASTNode {
    private final String op;
    private final Node operand;

    private UnaryOp(Pos pos, String op, Node operand) {
      super(Type.UNARY_OP, pos);
      this.op = op;
      this.operand = operand;
    }

    public static UnaryOp create(Pos pos, String op, Node operand) {
      return new UnaryOp(pos, op, operand);
    }

    public String op() {
      return op;
    }

    @ASTChild
    @Override
    public Node operand() {
      return operand;
    }
  }

  /** A named variable reference; global and per-player variables live in separate domains. */
  public abstract static class Reference extends Node {
    private final String name;

    private Reference(Type type, Pos pos, String name) {
      super(type, pos);
      this.name = name;
    }

    public String name() {
      return name;
    }

    public abstract Symbol symbol();
  }

  @ASTNode
  public static final class GlobalRef extends Reference implements Node_GlobalRef_ASTNode {
    private GlobalRef(Pos pos, String name) {
      super(Type.GLOBAL_REF, pos, name);
    }

    public static GlobalRef create(Pos pos, String name) {
      return new GlobalRef(pos, name);
    }

    @Override
    public Symbol symbol() {
      return Symbol.global(name());
    }
  }

  /** A per-player variable, {@code owner.name}; the owner defaults to Event Player. */
  @ASTNode
  public static final class EntityRef extends Reference implements Node_EntityRef_ASTNode {
    private final Node owner;

    private EntityRef(Pos pos, Node owner, String name) {
      super(Type.ENTITY_REF, pos, name);
      this.owner = owner;
    }

    public static EntityRef create(Pos pos, String name) {
      return new EntityRef(pos, Instruction.create(pos, "Event Player", ImmutableList.of()), name);
    }

    public static EntityRef create(Pos pos, Node owner, String name) {
      return new EntityRef(pos, owner, name);
    }

    @ASTChild
    @Override
    public Node owner() {
      return owner;
    }

    @Override
    public Symbol symbol() {
      return Symbol.entity(name());
    }
  }

  /** A formatted Workshop string; {@code {0}}-style placeholders are filled by args. */
  @ASTNode
  public static final class StringLiteral extends Node implements Node_StringLiteral_ASTNode {
    private final String template;
    private final ImmutableList<Node> args;

    private StringLiteral(Pos pos, String template, ImmutableList<Node> args) {
      super(Type.STRING, pos);
      this.template = template;
      this.args = args;
    }

    public static StringLiteral create(Pos pos, String template, Iterable<? extends Node> args) {
      return new StringLiteral(pos, template, ImmutableList.copyOf(args));
    }

    public String template() {
      return template;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> args() {
      return args;
    }
  }

  @ASTNode
  public static final class NumberLiteral extends Node implements Node_NumberLiteral_ASTNode {
    private static final CharMatcher INTEGER = CharMatcher.inRange('0', '9');

    private final String value;
    private final double doubleValue;

    private NumberLiteral(Pos pos, String value, double doubleValue) {
      super(Type.NUMBER, pos);
      this.value = value;
      this.doubleValue = doubleValue;
    }

    public static NumberLiteral create(Pos pos, String value) {
      double parsed;
      try {
        parsed = Double.parseDouble(value);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("not a number: " + value, ex);
      }
      return new NumberLiteral(pos, value, parsed);
    }

    public static NumberLiteral of(Pos pos, double value) {
      return new NumberLiteral(pos, format(value), value);
    }

    public static NumberLiteral of(Pos pos, BigInteger value) {
      return new NumberLiteral(pos, value.toString(), value.doubleValue());
    }

    // Integral values print without a fractional part.
    public static String format(double value) {
      if (value == Math.rint(value) && !Double.isInfinite(value)) {
        return new BigDecimal(value).toBigInteger().toString();
      }
      return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public String value() {
      return value;
    }

    public double doubleValue() {
      return doubleValue;
    }

    /** The exact value of a literal written as an integer, such as {@code 42} or {@code -7}. */
    public Optional<BigInteger> integerValue() {
      String digits = value.startsWith("-") ? value.substring(1) : value;
      if (digits.isEmpty() || !INTEGER.matchesAllOf(digits)) return Optional.empty();
      return Optional.of(new BigInteger(value));
    }

    public Optional<Integer> intValue() {
      if (doubleValue != Math.rint(doubleValue) || Math.abs(doubleValue) > Integer.MAX_VALUE) {
        return Optional.empty();
      }
      return Optional.of((int) doubleValue);
    }
  }

  /** A duration such as {@code 500ms}, {@code 2s} or {@code 1.5min}. */
  @ASTNode
  public static final class TimeLiteral extends Node implements Node_TimeLiteral_ASTNode {
    private final String value;

    private TimeLiteral(Pos pos, String value) {
      super(Type.TIME, pos);
      this.value = value;
    }

    public static TimeLiteral create(Pos pos, String value) {
      TimeLiteral literal = new TimeLiteral(pos, value);
      literal.seconds();
      return literal;
    }

    public String value() {
      return value;
    }

    public double seconds() {
      String lower = value.trim().toLowerCase();
      double scale;
      String amount;
      if (lower.endsWith("ms")) {
        scale = 0.001;
        amount = lower.substring(0, lower.length() - 2);
      } else if (lower.endsWith("min")) {
        scale = 60;
        amount = lower.substring(0, lower.length() - 3);
      } else if (lower.endsWith("s")) {
        scale = 1;
        amount = lower.substring(0, lower.length() - 1);
      } else {
        throw new IllegalArgumentException("unknown time unit: " + value);
      }
      try {
        return Math.round(Double.parseDouble(amount) * scale * 1000) / 1000.0;
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("not a time: " + value, ex);
      }
    }
  }

  @ASTNode
  public static final class VectorLiteral extends Node implements Node_VectorLiteral_ASTNode {
    private final ImmutableList<Node> components;

    private VectorLiteral(Pos pos, ImmutableList<Node> components) {
      super(Type.VECTOR, pos);
      this.components = components;
    }

    public static VectorLiteral create(Pos pos, Iterable<? extends Node> components) {
      return new VectorLiteral(pos, ImmutableList.copyOf(components));
    }

    @ASTChild
    @Override
    public ImmutableList<Node> components() {
      return components;
    }
  }

  @ASTNode
  public static final class ArrayLiteral extends Node implements Node_ArrayLiteral_ASTNode {
    private final ImmutableList<Node> elements;

    private ArrayLiteral(Pos pos, ImmutableList<Node> elements) {
      super(Type.ARRAY, pos);
      this.elements = elements;
    }

    public static ArrayLiteral create(Pos pos, Iterable<? extends Node> elements) {
      return new ArrayLiteral(pos, ImmutableList.copyOf(elements));
    }

    @ASTChild
    @Override
    public ImmutableList<Node> elements() {
      return elements;
    }

    public ArrayLiteral withElement(int index, Node element) {
      Preconditions.checkElementIndex(index, elements.size());
      ImmutableList.Builder<Node> replaced = ImmutableList.builder();
      for (int i = 0; i < elements.size(); i++) {
        replaced.add(i == index ? element : elements.get(i));
      }
      return new ArrayLiteral(pos(), replaced.build());
    }
  }

  @ASTNode
  public static final class IndexedAccess extends Node implements Node_IndexedAccess_ASTNode {
    private final Node parent;
    private final Node index;

    private IndexedAccess(Pos pos, Node parent, Node index) {
      super(Type.INDEXED_ACCESS, pos);
      this.parent = parent;
      this.index = index;
    }

    public static IndexedAccess create(Pos pos, Node parent, Node index) {
      return new IndexedAccess(pos, parent, index);
    }

    @ASTChild
    @Override
    public Node parent() {
      return parent;
    }

    @ASTChild
    @Override
    public Node index() {
      return index;
    }
  }

  @ASTNode
  public static final class AttributeAccess extends Node
      implements Node_AttributeAccess_ASTNode {
    private final Node parent;
    private final String name;

    private AttributeAccess(Pos pos, Node parent, String name) {
      super(Type.ATTRIBUTE_ACCESS, pos);
      this.parent = parent;
      this.name = name;
    }

    public static AttributeAccess create(Pos pos, Node parent, String name) {
      return new AttributeAccess(pos, parent, name);
    }

    @ASTChild
    @Override
    public Node parent() {
      return parent;
    }

    public String name() {
      return name;
    }
  }

  @ASTNode
  public static final class Call extends Node implements Node_Call_ASTNode {
    private final Node callee;
    private final ImmutableList<Node> args;

    private Call(Pos pos, Node callee, ImmutableList<Node> args) {
      super(Type.CALL, pos);
      this.callee = callee;
      this.args = args;
    }

    public static Call create(Pos pos, Node callee, Iterable<? extends Node> args) {
      return new Call(pos, callee, ImmutableList.copyOf(args));
    }

    @ASTChild
    @Override
    public Node callee() {
      return callee;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> args() {
      return args;
    }
  }
}

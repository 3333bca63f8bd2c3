package ows;

import java.util.Arrays;

import com.google.common.collect.ImmutableList;

/** Terse syntax tree construction for tests. */
final class Trees {
  static final Pos POS = new Pos("/test/script.ows", 0, 0);

  static Node.NumberLiteral num(String value) {
    return Node.NumberLiteral.create(POS, value);
  }

  static Node.NumberLiteral num(int value) {
    return Node.NumberLiteral.of(POS, value);
  }

  static Node.TimeLiteral time(String value) {
    return Node.TimeLiteral.create(POS, value);
  }

  static Node.StringLiteral string(String template, Node... args) {
    return Node.StringLiteral.create(POS, template, Arrays.asList(args));
  }

  static Node.VectorLiteral vector(Node x, Node y, Node z) {
    return Node.VectorLiteral.create(POS, ImmutableList.of(x, y, z));
  }

  static Node.ArrayLiteral array(Node... elements) {
    return Node.ArrayLiteral.create(POS, Arrays.asList(elements));
  }

  static Node.GlobalRef var(String name) {
    return Node.GlobalRef.create(POS, name);
  }

  static Node.EntityRef pvar(String name) {
    return Node.EntityRef.create(POS, name);
  }

  static Node.Constant constant(String name) {
    return Node.Constant.create(POS, name);
  }

  static Node.Instruction instr(String name, Node... args) {
    return Node.Instruction.create(POS, name, Arrays.asList(args));
  }

  // Wait(value, Ignore Condition)
  static Node.Instruction waitFor(Node value) {
    return instr("Wait", value, constant("Ignore Condition"));
  }

  static Node.Compare compare(Node left, String op, Node right) {
    return Node.Compare.create(POS, left, op, right);
  }

  static Node.BinaryOp op(Node left, String op, Node right) {
    return Node.BinaryOp.create(POS, left, op, right);
  }

  static Node.UnaryOp unary(String op, Node operand) {
    return Node.UnaryOp.create(POS, op, operand);
  }

  static Node.IndexedAccess index(Node parent, Node index) {
    return Node.IndexedAccess.create(POS, parent, index);
  }

  static Node.AttributeAccess attr(Node parent, String name) {
    return Node.AttributeAccess.create(POS, parent, name);
  }

  static Node.Assign assign(Node target, Node value) {
    return Node.Assign.create(POS, target, "=", value);
  }

  static Node.Assign assign(Node target, String op, Node value) {
    return Node.Assign.create(POS, target, op, value);
  }

  static Node.Block block(Node... statements) {
    return Node.Block.create(POS, Arrays.asList(statements));
  }

  static Node.If ifThen(Node condition, Node.Block trueBlock) {
    return Node.If.create(POS, condition, trueBlock);
  }

  static Node.If ifThen(Node condition, Node.Block trueBlock, Node falseBranch) {
    return Node.If.create(POS, condition, trueBlock, falseBranch);
  }

  static Node.While whileLoop(Node condition, Node... body) {
    return Node.While.create(POS, condition, block(body));
  }

  static Node.For forEach(String variable, Node iterable, Node... body) {
    return Node.For.create(POS, variable, iterable, block(body));
  }

  static Node.Continue continueLoop() {
    return Node.Continue.create(POS);
  }

  static Node.Call call(String name, Node... args) {
    return Node.Call.create(POS, var(name), Arrays.asList(args));
  }

  static Node.Function function(String name, ImmutableList<String> params, Node... body) {
    return Node.Function.create(POS, name, params, block(body));
  }

  static Node.Return ret() {
    return Node.Return.create(POS);
  }

  static Node.Return ret(Node value) {
    return Node.Return.create(POS, value);
  }

  static Node.Ruleblock ruleblock(String name, Node... statements) {
    return Node.Ruleblock.create(POS, name, block(statements));
  }

  static Node.Ruleblock event() {
    return ruleblock("Event", constant("Ongoing - Global"));
  }

  static Node.Rule rule(String name, Node.Ruleblock... ruleblocks) {
    return Node.Rule.create(POS, name, false, Arrays.asList(ruleblocks));
  }

  static Node.Script script(Node... children) {
    return Node.Script.create(POS, Arrays.asList(children));
  }

  // One rule, run once globally, with the given actions.
  static Node.Script actions(Node... statements) {
    return script(rule("Test", event(), ruleblock("Actions", statements)));
  }

  private Trees() {}
}

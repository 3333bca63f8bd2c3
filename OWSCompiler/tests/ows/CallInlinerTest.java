package ows;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static ows.Trees.assign;
import static ows.Trees.call;
import static ows.Trees.function;
import static ows.Trees.instr;
import static ows.Trees.num;
import static ows.Trees.op;
import static ows.Trees.ret;
import static ows.Trees.ruleblock;
import static ows.Trees.var;
import static ows.Trees.waitFor;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class CallInlinerTest {

  private Vocabulary vocabulary;
  private Scope global;

  @BeforeEach
  public void setUp() throws IOException {
    vocabulary = WorkshopVocabulary.load();
    global = Compiler.globalScope();
  }

  private void define(Node.Function function) {
    global.bind(Symbol.global(function.name()), Variable.function(function));
  }

  private ImmutableList<String> lower(Node... statements) throws CompilerException {
    Lowering lowering = new Lowering(new SlotAllocator(), vocabulary, CompilerOptions.defaults());
    return lowering.lowerRuleblock(ruleblock("Actions", statements), global.child("Test")).resolve();
  }

  private CompilerException assertLoweringFails(Node... statements) {
    return assertThrows(CompilerException.class, () -> lower(statements));
  }

  @Test
  public void statementCall_splicesTheBody() throws CompilerException {
    define(function("f", ImmutableList.of("a"), waitFor(var("a")), instr("Abort")));

    assertThat(lower(call("f", op(num(1), "+", num(2)))))
        .containsExactly("Wait(3, Ignore Condition)", "Abort")
        .inOrder();
  }

  @Test
  public void argumentsRenderInTheCallersScope() throws CompilerException {
    define(function("f", ImmutableList.of("x", "y"), waitFor(var("y"))));

    assertThat(lower(assign(var("x"), num(5)), call("f", num(1), var("x"))))
        .containsExactly(
            "Set Global Variable At Index(A, 0, 5)",
            "Wait(Value In Array(Global Variable(A), 0), Ignore Condition)")
        .inOrder();
  }

  @Test
  public void argumentsAreRenderedAtEachUse() throws CompilerException {
    define(function("twice", ImmutableList.of("t"), waitFor(var("t")), waitFor(var("t"))));

    assertThat(lower(call("twice", instr("Random Real", num(0), num(1)))))
        .containsExactly(
            "Wait(Random Real(0, 1), Ignore Condition)", "Wait(Random Real(0, 1), Ignore Condition)")
        .inOrder();
  }

  @Test
  public void expressionCall_foldsThroughParameters() throws CompilerException {
    define(function("double", ImmutableList.of("a"), ret(op(var("a"), "*", num(2)))));

    assertThat(lower(waitFor(call("double", num(3))))).containsExactly("Wait(6, Ignore Condition)");
  }

  @Test
  public void nestedCalls_foldOnlyLiteralOperands() throws CompilerException {
    define(function("inc", ImmutableList.of("a"), ret(op(var("a"), "+", num(1)))));
    define(function("incTwice", ImmutableList.of("a"), ret(call("inc", call("inc", var("a"))))));

    // The outer operand is a call, not a literal, so only the inner sum folds.
    assertThat(lower(waitFor(call("incTwice", num(1)))))
        .containsExactly("Wait(Add(2, 1), Ignore Condition)");
  }

  @Test
  public void returnStopsTheBody() throws CompilerException {
    define(function("f", ImmutableList.of(), instr("Abort"), ret(), waitFor(num(1))));

    assertThat(lower(call("f"))).containsExactly("Abort");
  }

  @Test
  public void returnedValueBecomesAStatement() throws CompilerException {
    define(function("f", ImmutableList.of(), ret(waitFor(num(1)))));

    assertThat(lower(call("f"))).containsExactly("Wait(1, Ignore Condition)");
  }

  @Test
  public void assigningAParameterAllocatesASlot() throws CompilerException {
    define(function("f", ImmutableList.of("a"), assign(var("a"), num(1)), waitFor(var("a"))));

    assertThat(lower(call("f", num(2))))
        .containsExactly(
            "Set Global Variable At Index(A, 0, 1)",
            "Wait(Value In Array(Global Variable(A), 0), Ignore Condition)")
        .inOrder();
  }

  @Test
  public void expressionCallWithActionsRejected() {
    define(function("f", ImmutableList.of(), instr("Abort"), ret(num(1))));

    CompilerException ex = assertLoweringFails(waitFor(call("f")));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.UNSUPPORTED);
    assertThat(ex).hasMessageThat().contains("performs actions");
  }

  @Test
  public void expressionCallWithoutValueRejected() {
    define(function("f", ImmutableList.of()));

    CompilerException ex = assertLoweringFails(waitFor(call("f")));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.UNSUPPORTED);
    assertThat(ex).hasMessageThat().contains("does not return a value");
  }

  @Test
  public void arityMismatch() {
    define(function("f", ImmutableList.of("a")));

    CompilerException ex = assertLoweringFails(call("f", num(1), num(2)));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.STRUCTURAL);
    assertThat(ex).hasMessageThat().isEqualTo("'f' expected 1 arguments, received 2");
  }

  @Test
  public void undefinedFunction() {
    CompilerException ex = assertLoweringFails(call("g"));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.NAME_RESOLUTION);
    assertThat(ex).hasMessageThat().contains("undefined function 'g'");
  }

  @Test
  public void callingAValue() {
    CompilerException ex = assertLoweringFails(assign(var("x"), num(1)), call("x"));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.NAME_RESOLUTION);
    assertThat(ex).hasMessageThat().contains("'x' is not a function");
  }

  @Test
  public void roundingBuiltins() throws CompilerException {
    assertThat(
            lower(
                waitFor(call("ceil", num("2.5"))),
                waitFor(call("floor", num("2.5"))),
                waitFor(call("round", instr("Random Real", num(0), num(9))))))
        .containsExactly(
            "Wait(Round To Integer(2.5, Up), Ignore Condition)",
            "Wait(Round To Integer(2.5, Down), Ignore Condition)",
            "Wait(Round To Integer(Random Real(0, 9), To Nearest), Ignore Condition)")
        .inOrder();
  }

  @Test
  public void builtinSeesLiteralsThroughParameters() throws CompilerException {
    define(function("up", ImmutableList.of("v"), ret(call("ceil", var("v")))));

    assertThat(lower(waitFor(call("up", num("0.5")))))
        .containsExactly("Wait(Round To Integer(0.5, Up), Ignore Condition)");
  }

  @Test
  public void rangeAsAValue() throws CompilerException {
    assertThat(lower(assign(var("r"), call("range", num(3)))))
        .containsExactly(
            "Set Global Variable At Index(A, 0, "
                + "Append To Array(Append To Array(Append To Array(Empty Array, 0), 1), 2))");
  }

  @Test
  public void rangeWithZeroStepRejected() {
    CompilerException ex = assertLoweringFails(waitFor(call("range", num(0), num(3), num(0))));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.PARAMETER_TYPE);
    assertThat(ex).hasMessageThat().contains("'range'");
  }

  @Test
  public void rangeOfNonIntegersRejected() {
    CompilerException ex = assertLoweringFails(waitFor(call("range", num("1.5"))));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.PARAMETER_TYPE);
  }

  @Test
  public void builtinArity() {
    CompilerException ex = assertLoweringFails(waitFor(call("range")));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.STRUCTURAL);
    assertThat(ex).hasMessageThat().isEqualTo("'range' expected 1 to 3 arguments, received 0");
  }

  @Test
  public void ceilOfAStringRejected() {
    CompilerException ex = assertLoweringFails(waitFor(call("ceil", Trees.string("nope"))));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.PARAMETER_TYPE);
  }
}

package ows;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static ows.Trees.actions;
import static ows.Trees.assign;
import static ows.Trees.call;
import static ows.Trees.compare;
import static ows.Trees.event;
import static ows.Trees.function;
import static ows.Trees.instr;
import static ows.Trees.num;
import static ows.Trees.op;
import static ows.Trees.pvar;
import static ows.Trees.rule;
import static ows.Trees.ruleblock;
import static ows.Trees.script;
import static ows.Trees.var;
import static ows.Trees.waitFor;
import static ows.Trees.whileLoop;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

public class CompilerTest {

  private static final String X = "Value In Array(Global Variable(A), 0)";

  private Vocabulary vocabulary;

  @BeforeEach
  public void setUp() throws IOException {
    vocabulary = WorkshopVocabulary.load();
  }

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines);
  }

  private String compile(Node.Script script) throws CompilerException {
    return new Compiler(script, vocabulary).compile();
  }

  @Test
  public void whileLoopDocument() throws CompilerException {
    Node.Script script =
        script(
            rule(
                "Loop",
                event(),
                ruleblock(
                    "Actions",
                    assign(var("x"), num(0)),
                    whileLoop(compare(var("x"), "<", num(3)), assign(var("x"), "+=", num(1))))));

    assertThat(compile(script))
        .isEqualTo(
            lines(
                CompilerOptions.DEFAULT_PREAMBLE,
                "rule(\"Loop\") {",
                "Event {",
                "   Ongoing - Global;",
                "}",
                "",
                "Actions {",
                "   Set Global Variable At Index(A, 0, 0);",
                "   Skip If(Not(Compare(" + X + ", <, 3)), 3);",
                "   Set Global Variable At Index(A, 0, Add(" + X + ", 1));",
                "   Wait(0.016, Ignore Condition);",
                "   Loop If(Compare(" + X + ", <, 3));",
                "}",
                "}"));
  }

  @Test
  public void divisionByZeroFoldsToZero() throws CompilerException {
    assertThat(compile(actions(waitFor(op(num(1), "/", num(0))))))
        .contains("   Wait(0, Ignore Condition);\n");
  }

  @Test
  public void disabledRuleAndConditions() throws CompilerException {
    Node.Script script =
        script(
            Node.Rule.create(
                Trees.POS,
                "Guarded",
                true,
                ImmutableList.of(
                    event(),
                    ruleblock("Conditions", compare(instr("Event Player"), "!=", instr("Null"))),
                    ruleblock("Actions"))));

    assertThat(compile(script))
        .isEqualTo(
            lines(
                CompilerOptions.DEFAULT_PREAMBLE,
                "disabled rule(\"Guarded\") {",
                "Event {",
                "   Ongoing - Global;",
                "}",
                "",
                "Conditions {",
                "   Compare(Event Player, !=, Null) == True;",
                "}",
                "",
                "Actions {",
                "}",
                "}"));
  }

  @Test
  public void customOptions() throws CompilerException {
    CompilerOptions options =
        CompilerOptions.builder().setIndentSize(1).setPreamble("").build();

    String document =
        new Compiler(actions(instr("Abort")), vocabulary, options).compile();

    assertThat(document)
        .isEqualTo(
            lines(
                "rule(\"Test\") {",
                "Event {",
                " Ongoing - Global;",
                "}",
                "",
                "Actions {",
                " Abort;",
                "}",
                "}"));
  }

  @Test
  public void negativeIndentRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> CompilerOptions.builder().setIndentSize(-1).build());
  }

  @Test
  public void functionsEmitNothing() throws CompilerException {
    Node.Script script =
        script(
            function("stop", ImmutableList.of(), instr("Abort")),
            rule("Main", event(), ruleblock("Actions", call("stop"))));

    assertThat(compile(script)).endsWith(lines("Actions {", "   Abort;", "}", "}"));
  }

  @Test
  public void slotCountersSpanRules() throws CompilerException {
    Node.Script script =
        script(
            rule("First", event(), ruleblock("Actions", assign(var("a"), num(1)))),
            rule(
                "Second",
                event(),
                ruleblock(
                    "Actions", assign(var("b"), num(2)), assign(pvar("hp"), num(100)))));

    Compiler compiler = new Compiler(script, vocabulary);
    String document = compiler.compile();

    assertThat(document).contains("Set Global Variable At Index(A, 0, 1);");
    assertThat(document).contains("Set Global Variable At Index(A, 1, 2);");
    assertThat(document).contains("Set Player Variable At Index(Event Player, A, 0, 100);");
    assertThat(compiler.slots().count(Symbol.Domain.GLOBAL)).isEqualTo(2);
    assertThat(compiler.slots().count(Symbol.Domain.ENTITY)).isEqualTo(1);
  }

  @Test
  public void rulesShareGlobalVariables() throws CompilerException {
    Node.Script script =
        script(
            rule("Init", event(), ruleblock("Actions", assign(var("x"), num(0)))),
            rule(
                "Loop",
                event(),
                ruleblock(
                    "Actions",
                    whileLoop(compare(var("x"), "<", num(5)), assign(var("x"), "+=", num(1))))));

    Compiler compiler = new Compiler(script, vocabulary);
    String document = compiler.compile();

    assertThat(document)
        .endsWith(
            lines(
                "Actions {",
                "   Skip If(Not(Compare(" + X + ", <, 5)), 3);",
                "   Set Global Variable At Index(A, 0, Add(" + X + ", 1));",
                "   Wait(0.016, Ignore Condition);",
                "   Loop If(Compare(" + X + ", <, 5));",
                "}",
                "}"));
    assertThat(compiler.slots().count(Symbol.Domain.GLOBAL)).isEqualTo(1);
  }

  @Test
  public void reassigningInAnotherRuleKeepsTheSlot() throws CompilerException {
    Node.Script script =
        script(
            rule("A", event(), ruleblock("Actions", assign(var("x"), num(0)))),
            rule("B", event(), ruleblock("Actions", assign(var("x"), num(7)))));

    Compiler compiler = new Compiler(script, vocabulary);
    String document = compiler.compile();

    assertThat(document).contains("Set Global Variable At Index(A, 0, 0);");
    assertThat(document).contains("Set Global Variable At Index(A, 0, 7);");
    assertThat(compiler.slots().count(Symbol.Domain.GLOBAL)).isEqualTo(1);
  }

  @Test
  public void ruleNameWithValues() throws CompilerException {
    Node.Script script =
        script(
            Node.Rule.create(
                Trees.POS,
                "Wave {} of {}",
                ImmutableList.of(num(3), op(num(2), "*", num(5))),
                false,
                ImmutableList.of(event())));

    assertThat(compile(script)).contains("\nrule(\"Wave 3 of 10\") {\n");
  }

  @Test
  public void ruleNamePlaceholdersMustMatchValues() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            Node.Rule.create(
                Trees.POS, "Wave {}", ImmutableList.of(), false, ImmutableList.of(event())));
  }

  @Test
  public void recursionDiagnostic() {
    Node.Script script =
        script(function("f", ImmutableList.of(), call("f")), rule("Main", event()));

    CompilerException ex =
        assertThrows(CompilerException.class, () -> compile(script));
    assertThat(ex.diagnostic())
        .isEqualTo(
            "ERROR[RECURSION]: /test/script.ows@1:1 function 'f' is recursive and can't be inlined");
  }

  @Test
  public void loweringErrorsSurface() {
    CompilerException ex =
        assertThrows(CompilerException.class, () -> compile(actions(waitFor(var("missing")))));
    assertThat(ex.kind()).isEqualTo(CompilerException.Kind.NAME_RESOLUTION);
    assertThat(ex).hasMessageThat().isEqualTo("undefined variable 'missing'");
  }

  @Test
  public void compilerIsSingleUse() throws CompilerException {
    Compiler compiler = new Compiler(actions(instr("Abort")), vocabulary);
    compiler.compile();

    assertThrows(IllegalStateException.class, compiler::compile);
  }

  @Test
  public void outputIsDeterministic() throws CompilerException {
    Node.Script script =
        actions(
            assign(var("x"), num(1)),
            assign(pvar("y"), var("x")),
            whileLoop(instr("True"), waitFor(var("x"))));

    assertThat(compile(script)).isEqualTo(compile(script));
  }
}

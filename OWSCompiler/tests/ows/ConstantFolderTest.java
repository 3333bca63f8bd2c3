package ows;

import static com.google.common.truth.Truth.assertThat;
import static ows.Trees.num;
import static ows.Trees.var;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class ConstantFolderTest {

  private static Optional<String> fold(String left, String op, String right) {
    return ConstantFolder.fold(num(left), op, num(right), Trees.POS)
        .map(Node.NumberLiteral::value);
  }

  @Test
  public void integerArithmeticStaysIntegral() {
    assertThat(fold("2", "+", "3")).hasValue("5");
    assertThat(fold("7", "-", "10")).hasValue("-3");
    assertThat(fold("4", "*", "2.5")).hasValue("10");
    assertThat(fold("2", "^", "10")).hasValue("1024");
  }

  @Test
  public void largeIntegersStayExact() {
    assertThat(fold("2", "^", "60")).hasValue("1152921504606846976");
    assertThat(fold("9007199254740993", "+", "0")).hasValue("9007199254740993");
    assertThat(fold("-9007199254740993", "%", "10")).hasValue("7");
  }

  @Test
  public void divisionIsFloatingPoint() {
    assertThat(fold("7", "/", "2")).hasValue("3.5");
    assertThat(fold("6", "/", "3")).hasValue("2");
    assertThat(fold("2", "^", "0.5")).hasValue("1.4142135623730951");
  }

  @Test
  public void moduloTakesTheSignOfTheDivisor() {
    assertThat(fold("-7", "%", "3")).hasValue("2");
    assertThat(fold("7", "%", "-3")).hasValue("-2");
    assertThat(fold("7.5", "%", "2")).hasValue("1.5");
  }

  @Test
  public void zeroDivisorsFoldToZero() {
    assertThat(fold("1", "/", "0")).hasValue("0");
    assertThat(fold("5", "%", "0")).hasValue("0");
    assertThat(fold("0", "^", "-1")).hasValue("0");
  }

  @Test
  public void nonRealResultsAreNotFolded() {
    assertThat(fold("-8", "^", "0.5")).isEmpty();
    assertThat(fold("10", "^", "400")).isEmpty();
  }

  @Test
  public void unknownOperatorsAreNotFolded() {
    assertThat(fold("1", "and", "2")).isEmpty();
  }

  @Test
  public void literal_followsSubstitutionsOnly() {
    Scope outer = Scope.root("outer");
    outer.bind(Symbol.global("a"), Variable.substitution(num(4), outer));
    Scope inner = outer.child("inner");
    inner.bind(Symbol.global("b"), Variable.substitution(var("a"), outer));
    inner.bind(Symbol.global("stored"), Variable.stored(num(9), 0));

    assertThat(ConstantFolder.literal(var("b"), inner).type()).isEqualTo(Node.Type.NUMBER);
    assertThat(((Node.NumberLiteral) ConstantFolder.literal(var("b"), inner)).value())
        .isEqualTo("4");
    assertThat(ConstantFolder.literal(var("stored"), inner).type())
        .isEqualTo(Node.Type.GLOBAL_REF);
    assertThat(ConstantFolder.literal(var("missing"), inner).type())
        .isEqualTo(Node.Type.GLOBAL_REF);
  }
}

package ows;

import static com.google.common.truth.Truth.assertThat;
import static ows.Trees.num;

import org.junit.jupiter.api.Test;

public class ScopeTest {

  private final SlotAllocator slots = new SlotAllocator();

  @Test
  public void assignReusesTheSlotOfAVisibleName() {
    Scope rule = Scope.root("rule");
    Variable first = rule.assign(Symbol.global("x"), num(1), slots);
    Variable other = rule.assign(Symbol.global("y"), num(2), slots);
    Scope nested = rule.child("call");
    Variable again = nested.assign(Symbol.global("x"), num(3), slots);

    assertThat(first.index()).hasValue(0);
    assertThat(other.index()).hasValue(1);
    assertThat(again.index()).hasValue(0);
    assertThat(slots.count(Symbol.Domain.GLOBAL)).isEqualTo(2);
  }

  @Test
  public void mutationIsLocal() {
    Scope rule = Scope.root("rule");
    rule.assign(Symbol.global("x"), num(1), slots);
    Scope nested = rule.child("call");
    nested.assign(Symbol.global("x"), num(3), slots);

    assertThat(nested.lookup(Symbol.global("x")).get().value()).isNotSameInstanceAs(
        rule.lookup(Symbol.global("x")).get().value());
    assertThat(((Node.NumberLiteral) rule.lookup(Symbol.global("x")).get().value()).value())
        .isEqualTo("1");
  }

  @Test
  public void domainsAreDisjoint() {
    Scope rule = Scope.root("rule");
    Variable global = rule.assign(Symbol.global("x"), num(1), slots);
    Variable entity = rule.assign(Symbol.entity("x"), num(1), slots);

    assertThat(global.index()).hasValue(0);
    assertThat(entity.index()).hasValue(0);
    assertThat(rule.lookup(Symbol.global("x")).get()).isNotSameInstanceAs(
        rule.lookup(Symbol.entity("x")).get());
  }

  @Test
  public void assigningASubstitutionAllocates() {
    Scope call = Scope.root("call");
    call.bind(Symbol.global("param"), Variable.substitution(num(5), call));
    Variable stored = call.assign(Symbol.global("param"), num(6), slots);

    assertThat(stored.isStored()).isTrue();
    assertThat(stored.index()).hasValue(0);
  }

  @Test
  public void innermostBindingWins() {
    Scope outer = Scope.root("outer");
    outer.bind(Symbol.global("x"), Variable.substitution(num(1), outer));
    Scope inner = outer.child("inner");
    inner.bind(Symbol.global("x"), Variable.substitution(num(2), outer));

    assertThat(((Node.NumberLiteral) inner.lookup(Symbol.global("x")).get().value()).value())
        .isEqualTo("2");
    assertThat(inner.lookup(Symbol.global("y"))).isEmpty();
  }

  @Test
  public void allocatorsAreIndependent() {
    SlotAllocator first = new SlotAllocator();
    first.allocate(Symbol.Domain.GLOBAL, "a");
    first.allocate(Symbol.Domain.GLOBAL, "b");

    assertThat(new SlotAllocator().allocate(Symbol.Domain.GLOBAL, "a")).isEqualTo(0);
    assertThat(first.allocate(Symbol.Domain.ENTITY, "a")).isEqualTo(0);
  }
}

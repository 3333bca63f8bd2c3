package ows;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/**
 * What a {@link Symbol} is bound to in a {@link Scope}.
 *
 * <p>A stored value owns a slot in its domain's array. A substitution owns no slot: its node is
 * rendered in the captured scope at every use, which is how call arguments and unrolled loop
 * elements are passed.
 */
@AutoValue
public abstract class Variable {
  public enum Kind {
    VALUE,
    FUNCTION,
    BUILTIN;
  }

  public abstract Kind kind();

  abstract Optional<Node> node();

  public abstract Optional<Integer> index();

  // The scope a substitution renders in.
  public abstract Optional<Scope> scope();

  public abstract Optional<Builtin> builtin();

  public static Variable stored(Node value, int index) {
    Preconditions.checkArgument(index >= 0, "negative slot %s", index);
    return new AutoValue_Variable(
        Kind.VALUE, Optional.of(value), Optional.of(index), Optional.empty(), Optional.empty());
  }

  public static Variable substitution(Node value, Scope scope) {
    return new AutoValue_Variable(
        Kind.VALUE, Optional.of(value), Optional.empty(), Optional.of(scope), Optional.empty());
  }

  public static Variable function(Node.Function function) {
    return new AutoValue_Variable(
        Kind.FUNCTION, Optional.of(function), Optional.empty(), Optional.empty(), Optional.empty());
  }

  public static Variable builtin(Builtin builtin) {
    return new AutoValue_Variable(
        Kind.BUILTIN, Optional.empty(), Optional.empty(), Optional.empty(), Optional.of(builtin));
  }

  public final boolean isStored() {
    return index().isPresent();
  }

  public final boolean isSubstitution() {
    return kind() == Kind.VALUE && !index().isPresent();
  }

  public final Node value() {
    Preconditions.checkState(kind() == Kind.VALUE, "%s has no value", kind());
    return node().get();
  }

  public final Node.Function function() {
    Preconditions.checkState(kind() == Kind.FUNCTION, "%s is not a function", kind());
    return node().get().cast();
  }
}

package ows;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** The result of lowering a function body: its code, and whether a return cut it short. */
@AutoValue
public abstract class Step {
  public abstract Code code();

  public abstract boolean stopped();

  public abstract Optional<Node> returnValue();

  public static Step proceed(Code code) {
    return new AutoValue_Step(code, false, Optional.empty());
  }

  public static Step stop(Code code, Optional<Node> returnValue) {
    return new AutoValue_Step(code, true, returnValue);
  }
}

package ows;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

/** Output settings. The defaults produce the document layout the Workshop import accepts. */
@AutoValue
public abstract class CompilerOptions {
  public static final String DEFAULT_PREAMBLE =
      "rule(\"Generated by OWScript\") { Event { Ongoing - Global; }}";

  public abstract int indentSize();

  // Emitted verbatim before the first rule; empty for none.
  public abstract String preamble();

  // Ends every loop iteration, so a loop never spins within one tick.
  public abstract String minimalWait();

  public abstract Builder toBuilder();

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setIndentSize(3)
        .setPreamble(DEFAULT_PREAMBLE)
        .setMinimalWait("Wait(0.016, Ignore Condition)");
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setIndentSize(int indentSize);

    public abstract Builder setPreamble(String preamble);

    public abstract Builder setMinimalWait(String minimalWait);

    @ForOverride
    abstract CompilerOptions autoBuild();

    public final CompilerOptions build() {
      CompilerOptions options = autoBuild();
      Preconditions.checkArgument(
          options.indentSize() >= 0, "negative indent: %s", options.indentSize());
      return options;
    }
  }
}

package ows;

import java.util.IdentityHashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

/**
 * A fragment of emitted actions whose relative jumps may still point at unplaced targets.
 *
 * <p>A {@link Label} occupies no line. Jumps to it become {@code Skip} counts once the fragment
 * holding both the jump and its label is {@linkplain #resolve() resolved}.
 */
public final class Code {

  public static final class Label {
    private final String name;

    private Label(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static Label label(String name) {
    return new Label(name);
  }

  private static final class Entry {
    private final String text;
    private final Label label;
    private final String suffix;

    private Entry(String text, Label label, String suffix) {
      this.text = text;
      this.label = label;
      this.suffix = suffix;
    }

    boolean isMark() {
      return text == null;
    }

    boolean isJump() {
      return text != null && label != null;
    }
  }

  private final ImmutableList<Entry> entries;
  private final int size;

  private Code(ImmutableList<Entry> entries) {
    this.entries = entries;
    this.size = (int) entries.stream().filter(e -> !e.isMark()).count();
  }

  public static Code empty() {
    return new Code(ImmutableList.of());
  }

  public static Code of(String line) {
    return builder().line(line).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  // Emitted lines; labels don't count.
  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /** Replaces every jump with its line count, which requires every target to be in this code. */
  public ImmutableList<String> resolve() {
    Map<Label, Integer> positions = new IdentityHashMap<>();
    int line = 0;
    for (Entry entry : entries) {
      if (entry.isMark()) {
        Preconditions.checkState(
            positions.put(entry.label, line) == null, "label placed twice: %s", entry.label);
      } else {
        line++;
      }
    }

    ImmutableList.Builder<String> lines = ImmutableList.builder();
    line = 0;
    for (Entry entry : entries) {
      if (entry.isMark()) continue;
      if (entry.isJump()) {
        Integer target = positions.get(entry.label);
        Preconditions.checkState(target != null, "jump to unplaced label: %s", entry.label);
        int offset = target - line - 1;
        Verify.verify(offset >= 0, "backwards jump to %s: %s", entry.label, offset);
        lines.add(entry.text + offset + entry.suffix);
      } else {
        lines.add(entry.text);
      }
      line++;
    }
    return lines.build();
  }

  public static final class Builder {
    private final ImmutableList.Builder<Entry> entries = ImmutableList.builder();

    private Builder() {}

    public Builder line(String line) {
      entries.add(new Entry(line, null, null));
      return this;
    }

    // Emits prefix + (lines between this jump and the label) + suffix.
    public Builder jump(String prefix, Label target, String suffix) {
      entries.add(new Entry(prefix, target, suffix));
      return this;
    }

    public Builder mark(Label label) {
      entries.add(new Entry(null, label, null));
      return this;
    }

    public Builder append(Code code) {
      entries.addAll(code.entries);
      return this;
    }

    public Code build() {
      return new Code(entries.build());
    }
  }
}

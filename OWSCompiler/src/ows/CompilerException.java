package ows;

/** A user-facing compilation failure. Compilation stops at the first one. */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    // Wrong argument count, or a definition in the wrong place.
    STRUCTURAL,
    // An instruction or builtin argument outside its accepted values.
    PARAMETER_TYPE,
    NAME_RESOLUTION,
    ATTRIBUTE,
    UNSUPPORTED,
    // A function that reaches itself; it could never finish inlining.
    RECURSION;
  }

  private final Kind kind;
  private final Pos pos;
  private final String errorMsg;

  public CompilerException(Kind kind, Pos pos, String errorMsg) {
    super(errorMsg);
    this.kind = kind;
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Kind kind() {
    return kind;
  }

  public Pos pos() {
    return pos;
  }

  public String diagnostic() {
    return String.format("ERROR[%s]: %s %s", kind, pos, errorMsg);
  }
}

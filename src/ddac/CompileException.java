package ddac;

/**
 * Raised when a DDA program cannot be compiled because of the input (as opposed to {@link ddac.drc.InternalCompilerError}, which
 * signals a defect in the compiler itself).
 */
public class CompileException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** Unreadable DDA text. */
    SYNTAX,
    /** A compound term whose head is not a known computing element. */
    UNKNOWN_VOCABULARY,
    /** Wrong number of arguments, or a non-constant in a constant-only position. */
    SHAPE_VIOLATION,
    /** Identifier sanitization left nothing of a name. */
    EMPTY_IDENTIFIER,
    /** No collision-free name could be found. */
    NAME_EXHAUSTION,
    /** Algebraic feedback loop, only fatal if requested by the caller. */
    CYCLIC_AUXILIARY,
    /** A variable is referenced but never defined. */
    UNDEFINED_VARIABLE,
    /** Reading input or writing output failed. */
    IO
  }

  private final Kind kind;

  public CompileException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public CompileException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() { return kind; }

  @Override
  public String getMessage() {
    return kind + ": " + super.getMessage();
  }
}

package ddac.drc;

/**
 * A broken compiler invariant, as opposed to a problem with the input program ({@link ddac.CompileException}).
 */
public class InternalCompilerError extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public InternalCompilerError(String message) { super("Internal compiler error: " + message); }
}

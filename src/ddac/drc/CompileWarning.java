package ddac.drc;

import java.util.List;

/**
 * Non-fatal finding of a design rule check. Returned alongside a successful compile result.
 */
public record CompileWarning(Kind kind, String message, List<String> variables) {

  public enum Kind {
    /** Algebraic feedback loop without an integrator; evaluation order is best-effort. */
    CYCLIC_AUXILIARY,
    /** Auxiliary variables not needed to compute any derivative. */
    UNNEEDED_AUXILIARY,
    /** A program without state, nothing evolves in time. */
    NO_EVOLVED_VARIABLES
  }

  public CompileWarning {
    variables = List.copyOf(variables);
  }

  @Override
  public String toString() {
    return kind + ": " + message + (variables.isEmpty() ? "" : " " + variables);
  }
}

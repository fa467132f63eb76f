package ddac;

import ddac.analysis.Classification;
import ddac.backend.SimulationLayout;
import ddac.drc.CompileWarning;
import ddac.frontend.EquationSet;
import java.util.List;

/**
 * Result of compiling one DDA program up to, but excluding, a back end.
 *
 * @param name program name, used for output file names
 * @param source the program as read
 * @param linearized the program in three-address form
 */
public record Compilation(String name, EquationSet source, EquationSet linearized, Classification classification, SimulationLayout layout,
                          List<CompileWarning> warnings) {
  public Compilation {
    warnings = List.copyOf(warnings);
  }
}

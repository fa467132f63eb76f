package ddac.drc;

import ddac.CompileException;
import ddac.analysis.Classification;
import ddac.frontend.EquationSet;
import ddac.frontend.Term;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Design rule checks over a linearized program. Warnings are collected and logged; with a high error level, an algebraic loop counts
 * as a fatal error.
 */
public class DRC {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private boolean errLevelHigh = false;
  private boolean hasFatalError = false;
  private final List<CompileWarning> warnings = new ArrayList<>();

  public void SetErrLevel(boolean errLevelHigh) { this.errLevelHigh = errLevelHigh; }

  public boolean HasFatalError() { return hasFatalError; }

  public List<CompileWarning> GetWarnings() { return Collections.unmodifiableList(warnings); }

  public void Warn(CompileWarning.Kind kind, String message, List<String> variables) {
    CompileWarning warning = new CompileWarning(kind, message, variables);
    logger.warn("DRC - {}", warning);
    warnings.add(warning);
    if (errLevelHigh && kind == CompileWarning.Kind.CYCLIC_AUXILIARY)
      hasFatalError = true;
  }

  /**
   * Checks that the five groups partition exactly the variables of {@code lin}.
   * @throws InternalCompilerError on a lost, duplicated or unknown name
   */
  public void CheckClassification(EquationSet lin, Classification classification) {
    Set<String> expected = lin.allVariables();
    Map<String, Classification.Group> seen = new HashMap<>();
    for (var entry : classification.ordering().entrySet()) {
      for (String name : entry.getValue()) {
        Classification.Group previous = seen.put(name, entry.getKey());
        if (previous != null)
          throw new InternalCompilerError(String.format("'%s' classified both as %s and %s", name, previous.serialName, entry.getKey().serialName));
        if (!expected.contains(name))
          throw new InternalCompilerError(String.format("'%s' classified as %s but is not a variable of the program", name,
                                                        entry.getKey().serialName));
      }
    }
    for (String name : expected) {
      if (!seen.containsKey(name))
        throw new InternalCompilerError(String.format("'%s' lost during variable classification", name));
    }
  }

  /** Warnings about the classification result: algebraic loops, unneeded auxiliaries, a program without state. */
  public void CheckGroups(Classification classification) {
    if (!classification.auxCyclic().isEmpty())
      Warn(CompileWarning.Kind.CYCLIC_AUXILIARY, "Algebraic feedback loop without an integrator, evaluation order is best-effort",
           classification.auxCyclic());
    if (!classification.auxUnneeded().isEmpty())
      Warn(CompileWarning.Kind.UNNEEDED_AUXILIARY, "Auxiliaries not required to compute the state, evaluated for output only",
           classification.auxUnneeded());
    if (classification.evolved().isEmpty())
      Warn(CompileWarning.Kind.NO_EVOLVED_VARIABLES, "Program has no int(...) or diff(...) element, nothing evolves in time", List.of());
  }

  /**
   * Every referenced variable needs an equation, and {@code x = x} does not count as one.
   * @throws CompileException UNDEFINED_VARIABLE naming the first offending variables
   */
  public void CheckDefined(EquationSet lin) throws CompileException {
    List<String> undefined = new ArrayList<>(lin.undefinedVariables());
    for (String name : lin.names()) {
      Term rhs = lin.rhs(name).get();
      if (rhs.isVariable() && rhs.head().equals(name))
        undefined.add(name);
    }
    if (!undefined.isEmpty()) {
      Collections.sort(undefined);
      throw new CompileException(CompileException.Kind.UNDEFINED_VARIABLE, "No equation for variable(s) " + undefined);
    }
  }

  /**
   * With a high error level, an algebraic loop aborts the compilation.
   * @throws CompileException CYCLIC_AUXILIARY
   */
  public void CheckFatal() throws CompileException {
    if (!hasFatalError)
      return;
    List<String> cyclic = new ArrayList<>();
    for (CompileWarning warning : warnings) {
      if (warning.kind() == CompileWarning.Kind.CYCLIC_AUXILIARY)
        cyclic.addAll(warning.variables());
    }
    logger.fatal("DRC - aborting on algebraic loop through {}", cyclic);
    throw new CompileException(CompileException.Kind.CYCLIC_AUXILIARY, "Algebraic feedback loop through " + cyclic);
  }
}

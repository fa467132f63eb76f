package ddac.analysis;

import ddac.drc.DRC;
import ddac.frontend.Dependency;
import ddac.frontend.Element;
import ddac.frontend.EquationSet;
import ddac.frontend.Term;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Splits the variables of a linearized program into constants, evolved state and three kinds of auxiliaries.
 * <p>
 * Only auxiliaries are sorted. The dependency edges handed to the sort are restricted by their target: an edge into an evolved variable
 * or a constant is dropped, an edge out of one is kept. Feedback through integrators therefore never shows up as a cycle, while the
 * auxiliaries an integrator needs are still ordered before it.
 */
public class VariableClassifier {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final DRC drc;

  public VariableClassifier(DRC drc) { this.drc = drc; }

  public VariableClassifier() { this(new DRC()); }

  /**
   * @param lin a linearized program
   * @throws ddac.drc.InternalCompilerError if the groups do not partition the variables of {@code lin}
   */
  public Classification classify(EquationSet lin) {
    List<String> evolved = new ArrayList<>();
    List<String> constants = new ArrayList<>();
    for (String name : lin.names()) {
      Term rhs = lin.rhs(name).get();
      if (rhs.isVariable())
        continue;
      var elem = Element.fromSerialName(rhs.head());
      if (elem.isPresent() && elem.get().isEvolving())
        evolved.add(name);
      else if (elem.isPresent() && elem.get() == Element.CONST)
        constants.add(name);
    }

    Set<String> auxCandidates = new LinkedHashSet<>(lin.allVariables());
    auxCandidates.removeAll(evolved);
    auxCandidates.removeAll(constants);

    List<Dependency> auxEdges = lin.dependencyGraph().stream().filter(edge -> auxCandidates.contains(edge.dependency())).collect(Collectors.toList());
    TopologicalSort.Result sorted = TopologicalSort.sort(auxEdges);

    List<String> auxSorted = sorted.ordered().stream().filter(auxCandidates::contains).collect(Collectors.toList());
    List<String> auxCyclic = sorted.cyclic().stream().filter(auxCandidates::contains).collect(Collectors.toList());
    List<String> auxUnneeded = new ArrayList<>(auxCandidates);
    auxUnneeded.removeAll(auxSorted);
    auxUnneeded.removeAll(auxCyclic);

    Classification ret = new Classification(constants, evolved, auxSorted, auxCyclic, auxUnneeded);
    logger.debug("Classified {} constants, {} evolved, {}/{}/{} sorted/cyclic/unneeded auxiliaries", constants.size(), evolved.size(),
                 auxSorted.size(), auxCyclic.size(), auxUnneeded.size());
    drc.CheckClassification(lin, ret);
    drc.CheckGroups(ret);
    return ret;
  }
}

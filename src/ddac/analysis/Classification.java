package ddac.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partition of the variables of a linearized program into the five groups the code generator evaluates in order.
 *
 * @param constants names defined by {@code const(...)}, sorted
 * @param evolved names defined by {@code int(...)} or {@code diff(...)}, sorted
 * @param auxSorted auxiliaries in dependency order, producers first
 * @param auxCyclic auxiliaries caught in an algebraic loop, in encounter order
 * @param auxUnneeded auxiliaries nothing else depends on, sorted
 */
public record Classification(List<String> constants, List<String> evolved, List<String> auxSorted, List<String> auxCyclic,
                             List<String> auxUnneeded) {

  public enum Group {
    CONSTANTS("explicit_constants"),
    AUX_SORTED("aux.sorted"),
    AUX_CYCLIC("aux.cyclic"),
    EVOLVED("evolved"),
    AUX_UNNEEDED("aux.unneeded");

    public final String serialName;

    private Group(String serialName) { this.serialName = serialName; }
  }

  public Classification {
    constants = List.copyOf(constants);
    evolved = List.copyOf(evolved);
    auxSorted = List.copyOf(auxSorted);
    auxCyclic = List.copyOf(auxCyclic);
    auxUnneeded = List.copyOf(auxUnneeded);
  }

  /** The groups in evaluation order: constants, sorted auxiliaries, cyclic auxiliaries, evolved, unneeded auxiliaries. */
  public Map<Group, List<String>> ordering() {
    Map<Group, List<String>> ret = new LinkedHashMap<>();
    ret.put(Group.CONSTANTS, constants);
    ret.put(Group.AUX_SORTED, auxSorted);
    ret.put(Group.AUX_CYCLIC, auxCyclic);
    ret.put(Group.EVOLVED, evolved);
    ret.put(Group.AUX_UNNEEDED, auxUnneeded);
    return ret;
  }

  /** All auxiliaries: sorted, then cyclic, then unneeded. */
  public List<String> auxiliaries() {
    List<String> ret = new ArrayList<>(auxSorted);
    ret.addAll(auxCyclic);
    ret.addAll(auxUnneeded);
    return ret;
  }

  /** Every classified name, in evaluation order. */
  public List<String> all() {
    List<String> ret = new ArrayList<>();
    ordering().values().forEach(ret::addAll);
    return ret;
  }

  public Optional<Group> groupOf(String name) {
    for (var entry : ordering().entrySet()) {
      if (entry.getValue().contains(name))
        return Optional.of(entry.getKey());
    }
    return Optional.empty();
  }
}

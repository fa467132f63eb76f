package ddac.analysis;

import ddac.frontend.Dependency;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kahn's algorithm over an edge list, tolerating cycles.
 * <p>
 * Edges point from a dependent to its dependency. Nodes that are never released because they sit on a cycle, or are reachable only
 * through one, end up in {@link Result#cyclic()} instead of failing the sort. Ties are broken by the order in which the nodes appear in
 * the edge list, so the result is reproducible.
 */
public final class TopologicalSort {

  /**
   * @param ordered dependencies before their dependents
   * @param cyclic nodes that could not be placed
   */
  public record Result(List<String> ordered, List<String> cyclic) {
    public Result {
      ordered = List.copyOf(ordered);
      cyclic = List.copyOf(cyclic);
    }
  }

  private TopologicalSort() {}

  public static Result sort(List<Dependency> edges) {
    // in-degree of each dependency, in order of first appearance as a target
    Map<String, Integer> inDegree = new LinkedHashMap<>();
    // outgoing edges of each dependent, in order of first appearance as a source
    Map<String, List<String>> outgoing = new LinkedHashMap<>();
    for (Dependency edge : edges) {
      inDegree.merge(edge.dependency(), 1, Integer::sum);
      outgoing.computeIfAbsent(edge.dependent(), key -> new ArrayList<>()).add(edge.dependency());
    }

    List<String> ordered = new ArrayList<>();
    for (String source : outgoing.keySet()) {
      if (!inDegree.containsKey(source))
        ordered.add(source);
    }
    for (int i = 0; i < ordered.size(); ++i) {
      for (String target : outgoing.getOrDefault(ordered.get(i), List.of())) {
        int remaining = inDegree.merge(target, -1, Integer::sum);
        if (remaining == 0)
          ordered.add(target);
      }
    }
    List<String> cyclic = new ArrayList<>();
    inDegree.forEach((node, remaining) -> {
      if (remaining > 0)
        cyclic.add(node);
    });
    Collections.reverse(ordered);
    Collections.reverse(cyclic);
    return new Result(ordered, cyclic);
  }
}

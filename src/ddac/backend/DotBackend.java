package ddac.backend;

import ddac.CompileException;
import ddac.Compilation;
import ddac.analysis.Classification;
import ddac.frontend.Dependency;
import java.io.OutputStream;
import java.util.List;

/**
 * Writes the variable dependency graph of the linearized program in Graphviz notation. An edge points from a variable to each variable
 * its right-hand side reads; the node shape tells the classification group.
 */
public class DotBackend extends CodeBackend {

  public DotBackend() {
    dictionary.put(DictWords.comment, "//");
    dictionary.put(DictWords.statement_end, ";");
  }

  @Override
  public String Target() {
    return "dot";
  }

  @Override
  public String FileExtension() {
    return "dot";
  }

  static String Quote(String name) { return "\"" + name.replace("\\", "\\\\").replace("\"", "\\\"") + "\""; }

  /** Node attributes for a classification group, empty for plain auxiliaries. */
  static String NodeStyle(Classification.Group group) {
    switch (group) {
    case CONSTANTS:
      return "shape=plaintext";
    case EVOLVED:
      return "shape=box";
    case AUX_CYCLIC:
      return "color=red";
    case AUX_UNNEEDED:
      return "style=dashed";
    default:
      return "";
    }
  }

  @Override
  public void Write(Compilation compilation, OutputStream out) throws CompileException {
    StringBuilder ret = new StringBuilder();
    ret.append(Comment("Dependency graph of " + compilation.name())).append('\n');
    ret.append("digraph ").append(Quote(compilation.name())).append(" {\n");
    for (var group : compilation.classification().ordering().entrySet()) {
      if (group.getValue().isEmpty())
        continue;
      String style = NodeStyle(group.getKey());
      ret.append("  ").append(Comment(group.getKey().serialName)).append('\n');
      for (String name : group.getValue())
        ret.append("  ").append(Quote(name)).append(style.isEmpty() ? "" : " [" + style + "]").append(dictionary.get(DictWords.statement_end))
            .append('\n');
    }
    List<Dependency> edges = compilation.linearized().dependencyGraph();
    logger.debug("Graph of {}: {} edges", compilation.name(), edges.size());
    for (Dependency edge : edges)
      ret.append("  ").append(Quote(edge.dependent())).append(" -> ").append(Quote(edge.dependency()))
          .append(dictionary.get(DictWords.statement_end)).append('\n');
    ret.append("}\n");
    WriteText(out, ret.toString());
  }
}

package ddac.frontend;

/**
 * Prints an {@link EquationSet} in the traditional DDA notation read by {@link DdaReader}, one equation per line in sorted name order.
 */
public class DdaWriter {
  private final String header;

  /** @param header comment text put in front of the equations, may be null or span several lines */
  public DdaWriter(String header) { this.header = header; }

  public DdaWriter() { this(null); }

  public static String write(EquationSet equations) { return new DdaWriter().format(equations); }

  public String format(EquationSet equations) {
    StringBuilder ret = new StringBuilder();
    if (header != null && !header.isEmpty()) {
      for (String line : header.split("\n", -1))
        ret.append("# ").append(line).append('\n');
      ret.append('\n');
    }
    int width = equations.names().stream().mapToInt(String::length).max().orElse(0);
    for (var entry : equations.asSortedMap().entrySet()) {
      ret.append(String.format("%-" + Math.max(width, 1) + "s = ", entry.getKey()));
      ret.append(entry.getValue().toDda()).append('\n');
    }
    return ret.toString();
  }
}

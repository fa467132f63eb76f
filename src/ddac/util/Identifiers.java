package ddac.util;

import ddac.CompileException;
import ddac.analysis.Linearizer;
import ddac.frontend.EquationSet;
import ddac.frontend.Vocabulary;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps variable names onto C-like identifier syntax ({@code [A-Za-z_][A-Za-z0-9_]*}).
 * Renamings are deterministic and collision free; colliding names get underscores appended.
 */
public final class Identifiers {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern VALID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_]");

  private Identifiers() {}

  public static boolean isValid(String name) { return VALID.matcher(name).matches(); }

  /**
   * Drops every character outside {@code [A-Za-z0-9_]} and prefixes a leading digit with an underscore.
   * @throws CompileException EMPTY_IDENTIFIER if nothing remains, naming the original identifier
   */
  public static String sanitize(String name) throws CompileException {
    String ret = INVALID_CHARS.matcher(name).replaceAll("");
    if (ret.isEmpty())
      throw new CompileException(CompileException.Kind.EMPTY_IDENTIFIER, "Identifier '" + name + "' has no valid characters left");
    if (Character.isDigit(ret.charAt(0)))
      ret = "_" + ret;
    return ret;
  }

  /**
   * Computes new names for those of {@code names} that are not valid identifiers or are {@code reserved}.
   * Valid names keep their spelling; the others are visited in sorted order.
   * @return only the names that change
   */
  public static Map<String, String> renaming(Collection<String> names, Set<String> reserved) throws CompileException {
    Set<String> used = new HashSet<>(reserved);
    TreeSet<String> toRename = new TreeSet<>();
    for (String name : names) {
      if (isValid(name) && !reserved.contains(name))
        used.add(name);
      else
        toRename.add(name);
    }
    Map<String, String> ret = new LinkedHashMap<>();
    for (String name : toRename) {
      String base = sanitize(name);
      String candidate = base;
      for (int attempt = 0; used.contains(candidate); ++attempt) {
        if (attempt >= Linearizer.MAX_NAME_ATTEMPTS)
          throw new CompileException(CompileException.Kind.NAME_EXHAUSTION, "No free identifier for '" + name + "'");
        candidate += "_";
      }
      used.add(candidate);
      ret.put(name, candidate);
      logger.debug("Renaming '{}' to '{}'", name, candidate);
    }
    return ret;
  }

  /**
   * Renames every variable of {@code equations} that is not a valid identifier. Element heads of the vocabulary are kept.
   */
  public static EquationSet sanitize(EquationSet equations, Vocabulary vocabulary) throws CompileException {
    Set<String> variables = equations.allVariables();
    Map<String, String> renames = new HashMap<>(renaming(variables, Set.of()));
    if (renames.isEmpty())
      return equations;
    return equations.mapHeads(head -> vocabulary.contains(head) ? head : renames.getOrDefault(head, head));
  }
}

package ddac.frontend;

import ddac.CompileException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of the computing elements a reader, writer or back end accepts.
 * Instances are passed explicitly through the pipeline; there is no process-wide registry.
 */
public final class Vocabulary {
  private static final Vocabulary STANDARD = new Vocabulary(EnumSet.allOf(Element.class));

  private final Map<String, Element> byName;

  private Vocabulary(Set<Element> elements) {
    LinkedHashMap<String, Element> map = new LinkedHashMap<>();
    for (Element elem : elements)
      map.put(elem.serialName, elem);
    this.byName = Collections.unmodifiableMap(map);
  }

  /** The full DDA vocabulary. */
  public static Vocabulary standard() { return STANDARD; }

  /** A restricted vocabulary, e.g. for a back end that does not implement every element. */
  public static Vocabulary of(Set<Element> elements) { return new Vocabulary(EnumSet.copyOf(elements)); }

  public boolean contains(String head) { return byName.containsKey(head); }

  public Optional<Element> lookup(String head) { return Optional.ofNullable(byName.get(head)); }

  public Set<String> names() { return byName.keySet(); }

  /**
   * Resolves the head of a compound term and checks its arity.
   * @param term compound term
   * @param variable the equation the term belongs to, for the error message
   * @throws CompileException UNKNOWN_VOCABULARY for a head outside this table, SHAPE_VIOLATION for a wrong argument count
   */
  public Element resolve(Term term, String variable) throws CompileException {
    Element elem = byName.get(term.head());
    if (elem == null)
      throw new CompileException(CompileException.Kind.UNKNOWN_VOCABULARY,
                                 String.format("Unknown computing element '%s' in %s (equation of '%s')", term.head(), term.toDda(), variable));
    if (!elem.acceptsArity(term.arity())) {
      String expected = elem.maxArgs == Integer.MAX_VALUE ? "at least " + elem.minArgs
                        : (elem.minArgs == elem.maxArgs ? String.valueOf(elem.minArgs) : elem.minArgs + ".." + elem.maxArgs);
      throw new CompileException(CompileException.Kind.SHAPE_VIOLATION,
                                 String.format("'%s' takes %s arguments, got %d in %s (equation of '%s')", elem, expected, term.arity(),
                                               term.toDda(), variable));
    }
    return elem;
  }
}

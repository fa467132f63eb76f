package ddac.frontend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * A DDA program: named equations {@code name = term}.
 * <p>
 * Keys are plain names. Algorithms never rely on the storage order; they iterate {@link #names()}, which is sorted.
 * Analysis passes return new sets and leave their input untouched.
 */
public class EquationSet {
  private final Map<String, Term> equations;

  public EquationSet() { this.equations = new HashMap<>(); }

  public EquationSet(Map<String, Term> equations) {
    this();
    equations.forEach(this::put);
  }

  /** Copy constructor. Terms are immutable, so the copy is independent of the original. */
  public EquationSet(EquationSet other) { this.equations = new HashMap<>(other.equations); }

  /**
   * Binds {@code name} to {@code rhs}, replacing any previous equation.
   * @return this set, for chaining
   */
  public EquationSet put(String name, Term rhs) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Equation name must be a non-empty identifier");
    if (rhs == null)
      throw new IllegalArgumentException("Null right-hand side for " + name);
    equations.put(name, rhs);
    return this;
  }

  /**
   * Authoring convenience: returns the equation of {@code name}, declaring {@code name = name} if there is none yet.
   * Analysis code uses {@link #rhs(String)} instead.
   */
  public Term get(String name) { return equations.computeIfAbsent(name, Term::var); }

  public Optional<Term> rhs(String name) { return Optional.ofNullable(equations.get(name)); }

  public boolean contains(String name) { return equations.containsKey(name); }

  public int size() { return equations.size(); }

  public boolean isEmpty() { return equations.isEmpty(); }

  /** The equation names in sorted order. */
  public List<String> names() { return new ArrayList<>(new TreeSet<>(equations.keySet())); }

  /** Equations in sorted order of their names, as a new map. */
  public Map<String, Term> asSortedMap() {
    Map<String, Term> ret = new LinkedHashMap<>();
    for (String name : names())
      ret.put(name, equations.get(name));
    return ret;
  }

  /**
   * One edge {@code (k, v)} per equation {@code k} and distinct variable {@code v} anywhere in its right-hand side, equations visited in
   * sorted order. A variable referencing itself yields a self loop.
   */
  public List<Dependency> dependencyGraph() {
    List<Dependency> ret = new ArrayList<>();
    for (String name : names()) {
      for (Term var : equations.get(name).allVariables())
        ret.add(new Dependency(name, var.head()));
    }
    return ret;
  }

  /** All names in this set: equation names and every referenced variable. Sorted. */
  public Set<String> allVariables() {
    TreeSet<String> ret = new TreeSet<>(equations.keySet());
    for (Term rhs : equations.values())
      rhs.allVariables().forEach(var -> ret.add(var.head()));
    return ret;
  }

  /** Variables referenced by some equation but without an equation of their own, in sorted order. */
  public Set<String> undefinedVariables() {
    Set<String> ret = new LinkedHashSet<>();
    for (String name : allVariables()) {
      if (!equations.containsKey(name))
        ret.add(name);
    }
    return ret;
  }

  /** {@link Term#mapHeads} over every right-hand side. The names, being variable heads as well, are mapped too. */
  public EquationSet mapHeads(UnaryOperator<String> mapping) {
    EquationSet ret = new EquationSet();
    for (String name : names())
      ret.put(mapping.apply(name), equations.get(name).mapHeads(mapping));
    return ret;
  }

  /** {@link Term#mapVariables} over every right-hand side, renaming the equations alongside. */
  public EquationSet mapVariables(UnaryOperator<String> mapping) {
    EquationSet ret = new EquationSet();
    for (String name : names())
      ret.put(mapping.apply(name), equations.get(name).mapVariables(mapping));
    return ret;
  }

  /** {@link Term#mapTerms} over every right-hand side. Names stay. */
  public EquationSet mapTerms(UnaryOperator<String> mapping) {
    EquationSet ret = new EquationSet();
    for (String name : names())
      ret.put(name, equations.get(name).mapTerms(mapping));
    return ret;
  }

  /**
   * {@link Term#mapTails} over every right-hand side. A variable right-hand side is passed to the mapping itself, a compound one only has
   * its children rewritten.
   */
  public EquationSet mapTails(UnaryOperator<Term> mapping) {
    EquationSet ret = new EquationSet();
    for (String name : names()) {
      Term rhs = equations.get(name);
      ret.put(name, rhs.isVariable() ? mapping.apply(rhs) : rhs.mapTails(mapping, false));
    }
    return ret;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof EquationSet))
      return false;
    return equations.equals(((EquationSet)obj).equations);
  }

  @Override
  public int hashCode() {
    return equations.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder ret = new StringBuilder();
    for (String name : names())
      ret.append(name).append(" = ").append(equations.get(name).toDda()).append('\n');
    return ret.toString();
  }
}

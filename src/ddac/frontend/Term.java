package ddac.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Immutable node of a DDA syntax tree: an atom (the head) and an ordered list of children (the tail).
 * <p>
 * A Term with an empty tail is a <i>variable reference</i>, a Term with a non-empty tail is a <i>compound term</i>, i.e. the application
 * of a computing element such as {@code int(x, 0.1, 1)}.
 * <p>
 * Equality and hashing are purely structural. Two independently built equal trees are interchangeable, which the
 * {@link ddac.analysis.Linearizer} relies on for sharing sub-terms.
 * <p>
 * There are four traversal operators with different contracts: {@link #mapHeads}, {@link #mapVariables}, {@link #mapTerms} and
 * {@link #mapTails}. None of them modifies this Term.
 */
public final class Term implements Operand {
  private final String head;
  private final List<Operand> tail;
  private final int hash;

  /**
   * Creates a term.
   * @param head identifier of the variable or computing element, must be non-empty
   * @param tail children; copied
   * @throws IllegalArgumentException if the head is empty or a tail element is null
   */
  public Term(String head, List<? extends Operand> tail) {
    if (head == null || head.isEmpty())
      throw new IllegalArgumentException("Term head must be a non-empty identifier");
    for (Operand operand : tail) {
      if (operand == null)
        throw new IllegalArgumentException("Null child in tail of " + head);
    }
    this.head = head;
    this.tail = Collections.unmodifiableList(new ArrayList<>(tail));
    this.hash = 31 * head.hashCode() + this.tail.hashCode();
  }

  public Term(String head, Operand... tail) { this(head, List.of(tail)); }

  /** Creates a variable reference (a term without tail). */
  public static Term var(String name) { return new Term(name, List.of()); }

  /**
   * Authoring helper: builds {@code head(args...)} where each argument is either a {@link Operand} or a {@link Number}.
   * @throws IllegalArgumentException for any other argument type; in particular a String is never silently turned into a variable
   */
  public static Term of(String head, Object... args) {
    List<Operand> tail = new ArrayList<>(args.length);
    for (Object arg : args)
      tail.add(operand(arg));
    return new Term(head, tail);
  }

  /** Converts an authoring value into an {@link Operand}. */
  public static Operand operand(Object arg) {
    if (arg instanceof Operand)
      return (Operand)arg;
    if (arg instanceof Number)
      return new Num(((Number)arg).doubleValue());
    throw new IllegalArgumentException("Tail elements must be Terms or numbers, got " + (arg == null ? "null" : arg.getClass().getSimpleName() + " '" + arg + "'") +
                                       "; wrap identifiers with Term.var()");
  }

  /** Returns a term with the same head and a replaced tail, like calling the head as a function. */
  public Term apply(Object... args) { return of(head, args); }

  public String head() { return head; }

  /** The children as an unmodifiable list. */
  public List<Operand> tail() { return tail; }

  public int arity() { return tail.size(); }

  public Operand get(int index) { return tail.get(index); }

  public boolean isVariable() { return tail.isEmpty(); }

  public boolean isCompound() { return !tail.isEmpty(); }

  /** Variables that are direct children of this term. */
  public List<Term> variables() {
    return tail.stream().filter(el -> el instanceof Term && ((Term)el).isVariable()).map(el -> (Term)el).collect(Collectors.toList());
  }

  /**
   * All distinct variables anywhere inside this term, in depth-first order of first occurrence.
   * Recurses into compound terms and stops at variable leaves. A variable reference yields itself.
   */
  public Set<Term> allVariables() {
    LinkedHashSet<Term> ret = new LinkedHashSet<>();
    if (isVariable())
      ret.add(this);
    else
      collectVariables(ret);
    return ret;
  }

  private void collectVariables(Set<Term> into) {
    for (Operand el : tail) {
      if (!(el instanceof Term))
        continue;
      Term child = (Term)el;
      if (child.isVariable())
        into.add(child);
      else
        child.collectVariables(into);
    }
  }

  /** All distinct compound sub-terms below this term (not including this term), children before parents. */
  public Set<Term> allTerms() {
    LinkedHashSet<Term> ret = new LinkedHashSet<>();
    collectTerms(ret);
    return ret;
  }

  private void collectTerms(Set<Term> into) {
    for (Operand el : tail) {
      if (el instanceof Term && ((Term)el).isCompound()) {
        ((Term)el).collectTerms(into);
        into.add((Term)el);
      }
    }
  }

  /**
   * Applies {@code mapping} to every head in the tree: variable heads and compound heads alike.
   * Numbers pass through unchanged.
   */
  public Term mapHeads(UnaryOperator<String> mapping) {
    List<Operand> newTail = new ArrayList<>(tail.size());
    for (Operand el : tail)
      newTail.add(el instanceof Term ? ((Term)el).mapHeads(mapping) : el);
    return new Term(mapping.apply(head), newTail);
  }

  /**
   * Applies {@code mapping} to the heads of variable references only.
   * Compound heads (the computing elements) and numbers are left untouched.
   */
  public Term mapVariables(UnaryOperator<String> mapping) {
    if (isVariable())
      return var(mapping.apply(head));
    List<Operand> newTail = new ArrayList<>(tail.size());
    for (Operand el : tail)
      newTail.add(el instanceof Term ? ((Term)el).mapVariables(mapping) : el);
    return new Term(head, newTail);
  }

  /**
   * Applies {@code mapping} to the heads of compound terms only. Variable references and numbers are left untouched.
   */
  public Term mapTerms(UnaryOperator<String> mapping) {
    if (isVariable())
      return this;
    List<Operand> newTail = new ArrayList<>(tail.size());
    for (Operand el : tail)
      newTail.add(el instanceof Term ? ((Term)el).mapTerms(mapping) : el);
    return new Term(mapping.apply(head), newTail);
  }

  /**
   * Bottom-up rewrite of the children. Each Term child is first rewritten recursively (only compound children have children of their
   * own; variables come back as they are), then {@code mapping} is applied to it. The mapping decides which children it actually replaces.
   * Numbers are never passed to the mapping.
   * @param mapping rewrite applied to every Term child after its own children have been rewritten
   * @param applyToRoot if set, also applies the mapping to this term after rewriting its children
   */
  public Term mapTails(UnaryOperator<Term> mapping, boolean applyToRoot) {
    List<Operand> newTail = new ArrayList<>(tail.size());
    for (Operand el : tail) {
      if (el instanceof Term) {
        Term child = (Term)el;
        Term rewrittenChild = child.isCompound() ? child.mapTails(mapping, false) : child;
        newTail.add(Objects.requireNonNull(mapping.apply(rewrittenChild), "mapTails mapping returned null"));
      } else
        newTail.add(el);
    }
    Term ret = isVariable() ? this : new Term(head, newTail);
    return applyToRoot ? Objects.requireNonNull(mapping.apply(ret), "mapTails mapping returned null") : ret;
  }

  @Override
  public String toDda() {
    if (tail.isEmpty())
      return head;
    return head + tail.stream().map(Operand::toDda).collect(Collectors.joining(", ", "(", ")"));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Term other = (Term)obj;
    return hash == other.hash && head.equals(other.head) && tail.equals(other.tail);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return toDda();
  }
}

package ddac.analysis;

import ddac.CompileException;
import ddac.frontend.EquationSet;
import ddac.frontend.Operand;
import ddac.frontend.Term;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites a program into three-address form: every right-hand side becomes {@code f(a, b, ...)} with only variables and numbers as
 * arguments. Nested computing elements are named {@code "{head}_{n}"} and get an equation of their own; a nested term equal to the value
 * of an existing equation reuses that equation instead. Values compare after their own nested terms are resolved, so reuse does not
 * depend on the order of the names.
 * <p>
 * In strict mode, every compound equation is additionally split into {@code name = fresh} and {@code fresh = f(...)}, except for an
 * equation that another one already aliases.
 * <p>
 * Both modes are idempotent. The input set is not modified.
 */
public class Linearizer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int MAX_NAME_ATTEMPTS = 64;

  private final boolean strict;

  public Linearizer(boolean strict) { this.strict = strict; }

  public Linearizer() { this(false); }

  public boolean isStrict() { return strict; }

  /** Carries a naming failure out of a {@link Term#mapTails} callback. */
  private static class NamingFailure extends RuntimeException {
    private static final long serialVersionUID = 1L;
    final CompileException error;
    NamingFailure(CompileException error) {
      super(error);
      this.error = error;
    }
  }

  /** State of one linearization run. */
  private static class Run {
    final Set<String> taken = new HashSet<>();
    final Map<String, Integer> counters = new HashMap<>();
    /** value of an equation, nested compounds resolved as far as possible, to the first equation name having it */
    final Map<Term, String> values = new HashMap<>();
    /** hoisted term to its fresh name */
    final Map<Term, String> named = new HashMap<>();
    /** fresh name to the value of the term it stands for */
    final Map<String, Term> freshValues = new HashMap<>();
    final EquationSet result = new EquationSet();
    /** equation being rewritten */
    String root;

    String freshName(String head) throws CompileException {
      int n = counters.merge(head, 1, Integer::sum);
      String base = head + "_" + n;
      String name = base;
      for (int attempt = 0; taken.contains(name); ++attempt) {
        if (attempt >= MAX_NAME_ATTEMPTS)
          throw new CompileException(CompileException.Kind.NAME_EXHAUSTION,
                                     String.format("No free name for an intermediate '%s' after %d attempts", base, MAX_NAME_ATTEMPTS));
        name += "_";
      }
      taken.add(name);
      return name;
    }

    /** Replaces a compound child by the name of the equation having it as value, if there is one. */
    Term resolve(Term child) {
      if (child.isVariable())
        return child;
      String name = values.get(child);
      return name == null ? child : Term.var(name);
    }

    /**
     * Computes the values of all equations. A value resolves nested compounds through {@link #values} itself, so it is iterated until
     * no new value appears; the map only grows.
     */
    void collectValues(EquationSet input) {
      UnaryOperator<Term> resolve = this::resolve;
      boolean changed = true;
      while (changed) {
        changed = false;
        for (String name : input.names()) {
          Term rhs = input.rhs(name).get();
          if (rhs.isCompound() && values.putIfAbsent(rhs.mapTails(resolve, false), name) == null)
            changed = true;
        }
      }
    }

    /** {@code term} has its children hoisted already. */
    Term hoist(Term term) {
      if (term.isVariable())
        return term;
      Term value = term.mapTails(child -> child.isVariable() && freshValues.containsKey(child.head()) ? freshValues.get(child.head()) : child, false);
      String existing = values.get(value);
      if (existing != null && !existing.equals(root))
        return Term.var(existing);
      String name = named.get(term);
      if (name == null) {
        try {
          name = freshName(term.head());
        } catch (CompileException e) {
          throw new NamingFailure(e);
        }
        named.put(term, name);
        freshValues.put(name, value);
        result.put(name, term);
        logger.trace("Hoisted {} = {}", name, term);
      }
      return Term.var(name);
    }
  }

  public EquationSet linearize(EquationSet input) throws CompileException {
    Run run = new Run();
    run.taken.addAll(input.allVariables());
    run.collectValues(input);
    UnaryOperator<Term> hoist = run::hoist;
    try {
      for (String name : input.names()) {
        Term rhs = input.rhs(name).get();
        run.root = name;
        run.result.put(name, rhs.isVariable() ? rhs : rhs.mapTails(hoist, false));
      }
    } catch (NamingFailure failure) {
      throw failure.error;
    }
    if (strict)
      split(run);
    logger.debug("Linearized {} equations into {}{}", input.size(), run.result.size(), strict ? " (strict)" : "");
    return run.result;
  }

  /** Splits {@code name = f(...)} into {@code name = fresh}, {@code fresh = f(...)} unless some other equation is {@code x = name}. */
  private static void split(Run run) throws CompileException {
    EquationSet lin = new EquationSet(run.result);
    Set<String> aliased = new HashSet<>();
    for (String name : lin.names()) {
      Term rhs = lin.rhs(name).get();
      if (rhs.isVariable() && !rhs.head().equals(name))
        aliased.add(rhs.head());
    }
    for (String name : lin.names()) {
      Term rhs = lin.rhs(name).get();
      if (rhs.isVariable() || aliased.contains(name))
        continue;
      String fresh = run.freshName(rhs.head());
      run.result.put(name, Term.var(fresh));
      run.result.put(fresh, rhs);
      logger.trace("Split {} = {} = {}", name, fresh, rhs);
    }
  }

  /** A compound term whose arguments are only variables and numbers. */
  public static boolean isNormalForm(Term term) {
    if (term.isVariable())
      return false;
    for (Operand arg : term.tail()) {
      if (arg instanceof Term && ((Term)arg).isCompound())
        return false;
    }
    return true;
  }

  /** A set is linear if every right-hand side is a variable or in normal form. */
  public static boolean isLinear(EquationSet equations) {
    for (String name : equations.names()) {
      Term rhs = equations.rhs(name).get();
      if (!rhs.isVariable() && !isNormalForm(rhs))
        return false;
    }
    return true;
  }
}

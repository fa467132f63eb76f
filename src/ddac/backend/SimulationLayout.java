package ddac.backend;

import ddac.CompileException;
import ddac.analysis.Classification;
import ddac.analysis.Linearizer;
import ddac.drc.DRC;
import ddac.drc.InternalCompilerError;
import ddac.frontend.Element;
import ddac.frontend.EquationSet;
import ddac.frontend.Num;
import ddac.frontend.Operand;
import ddac.frontend.Term;
import ddac.frontend.Vocabulary;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Target independent skeleton of a simulation program: the three records, the per-step statement order, and per evolved variable
 * its step size and initial value. Back ends only translate this into their syntax.
 */
public final class SimulationLayout {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Suffix of the hidden field holding a differentiator's input from the previous step. */
  public static final String LAST_INPUT_SUFFIX = "__last";

  public enum Storage {
    STATE("state"),
    AUX("aux"),
    CONST("const");

    public final String serialName;

    private Storage(String serialName) { this.serialName = serialName; }
  }

  /** Location of a variable: its record and the index in that record. */
  public record Slot(Storage storage, int index) {}

  /**
   * An evolved variable.
   * @param inputs the summed inputs, i.e. all arguments but the step size and the initial value
   * @param step step size operand: a number or the name of a constant
   * @param initial initial value operand: a number or the name of a constant
   * @param lastInput for a differentiator, the hidden state field remembering the input of the previous step
   */
  public record Evolution(String name, Element element, List<Operand> inputs, Operand step, double stepValue, Operand initial,
                          double initialValue, Optional<String> lastInput) {
    public Evolution {
      inputs = List.copyOf(inputs);
    }
  }

  /**
   * One assignment of the derivative evaluation. {@code element} is empty for an alias {@code x = y}.
   */
  public record Statement(String target, Classification.Group group, Term rhs, Optional<Element> element) {
    public boolean isAlias() { return element.isEmpty(); }
  }

  private final EquationSet equations;
  private final Classification classification;
  private final RecordLayout state;
  private final RecordLayout aux;
  private final RecordLayout constants;
  private final Map<String, Double> constantValues;
  private final Map<String, Evolution> evolutions;
  private final List<Statement> statements;

  private SimulationLayout(EquationSet equations, Classification classification, RecordLayout state, RecordLayout aux,
                           RecordLayout constants, Map<String, Double> constantValues, Map<String, Evolution> evolutions,
                           List<Statement> statements) {
    this.equations = equations;
    this.classification = classification;
    this.state = state;
    this.aux = aux;
    this.constants = constants;
    this.constantValues = Collections.unmodifiableMap(constantValues);
    this.evolutions = Collections.unmodifiableMap(evolutions);
    this.statements = List.copyOf(statements);
  }

  public static SimulationLayout build(EquationSet lin, Classification classification, Vocabulary vocabulary) throws CompileException {
    return build(lin, classification, vocabulary, new DRC());
  }

  /**
   * @param lin linearized program
   * @throws CompileException UNDEFINED_VARIABLE, UNKNOWN_VOCABULARY or SHAPE_VIOLATION
   */
  public static SimulationLayout build(EquationSet lin, Classification classification, Vocabulary vocabulary, DRC drc)
      throws CompileException {
    if (!Linearizer.isLinear(lin))
      throw new IllegalArgumentException("Simulation layout requires a linearized program");
    drc.CheckDefined(lin);

    // heads before shapes, so that an unknown element is reported as such
    Map<String, Element> elements = new LinkedHashMap<>();
    for (String name : lin.names()) {
      Term rhs = lin.rhs(name).get();
      if (rhs.isCompound())
        elements.put(name, vocabulary.resolve(rhs, name));
    }

    Map<String, Double> constantValues = new LinkedHashMap<>();
    for (String name : classification.constants())
      constantValues.put(name, constantValue(lin, name, constantValues, new HashSet<>()));

    Set<String> taken = new HashSet<>(lin.allVariables());
    Map<String, Evolution> evolutions = new LinkedHashMap<>();
    List<String> stateFields = new ArrayList<>(classification.evolved());
    for (String name : classification.evolved()) {
      Term rhs = lin.rhs(name).get();
      Element elem = elements.get(name);
      List<Operand> tail = rhs.tail();
      Operand step = throughAliases(lin, tail.get(tail.size() - 2));
      Operand initial = throughAliases(lin, tail.get(tail.size() - 1));
      double stepValue = constantContext(lin, step, name, "step size", constantValues);
      double initialValue = constantContext(lin, initial, name, "initial value", constantValues);
      Optional<String> lastInput = Optional.empty();
      if (elem == Element.DIFF) {
        String hidden = hiddenName(name + LAST_INPUT_SUFFIX, taken);
        stateFields.add(hidden);
        lastInput = Optional.of(hidden);
      }
      evolutions.put(name, new Evolution(name, elem, tail.subList(0, tail.size() - 2), step, stepValue, initial, initialValue, lastInput));
    }

    List<Statement> statements = new ArrayList<>();
    for (var group : classification.ordering().entrySet()) {
      for (String name : group.getValue()) {
        Term rhs = lin.rhs(name).get();
        statements.add(new Statement(name, group.getKey(), rhs, Optional.ofNullable(elements.get(name))));
      }
    }

    SimulationLayout ret = new SimulationLayout(lin, classification, new RecordLayout(Storage.STATE, stateFields),
                                                new RecordLayout(Storage.AUX, classification.auxiliaries()),
                                                new RecordLayout(Storage.CONST, classification.constants()), constantValues, evolutions,
                                                statements);
    logger.debug("Layout: {} state fields, {} auxiliaries, {} constants, {} statements", ret.state.size(), ret.aux.size(),
                 ret.constants.size(), statements.size());
    return ret;
  }

  /** Value of {@code const(x)}, following chains of constants. */
  private static double constantValue(EquationSet lin, String name, Map<String, Double> known, Set<String> visiting)
      throws CompileException {
    Double cached = known.get(name);
    if (cached != null)
      return cached;
    Term rhs = lin.rhs(name).get();
    if (!visiting.add(name))
      throw new CompileException(CompileException.Kind.SHAPE_VIOLATION, "Constant '" + name + "' is defined in terms of itself");
    Operand arg = rhs.get(0);
    if (arg instanceof Num)
      return ((Num)arg).value();
    Term ref = (Term)arg;
    String target = ref.isVariable() ? followAliases(lin, ref.head()) : ref.head();
    Optional<Term> refRhs = lin.rhs(target);
    if (refRhs.isPresent() && refRhs.get().isCompound() && refRhs.get().head().equals(Element.CONST.serialName))
      return constantValue(lin, target, known, visiting);
    throw new CompileException(CompileException.Kind.SHAPE_VIOLATION,
                               String.format("Only constants allowed in const(...); '%s' references '%s'", name, ref.head()));
  }

  private static double constantContext(EquationSet lin, Operand operand, String variable, String what,
                                        Map<String, Double> constantValues) throws CompileException {
    if (operand instanceof Num)
      return ((Num)operand).value();
    Term term = (Term)operand;
    Double value = term.isVariable() ? constantValues.get(followAliases(lin, term.head())) : null;
    if (value == null)
      throw new CompileException(CompileException.Kind.SHAPE_VIOLATION,
                                 String.format("Only constants allowed as %s of '%s', got '%s'", what, variable, term.toDda()));
    return value;
  }

  /** End of a chain of {@code x = y} equations; strict linearization puts one in front of every constant. */
  private static String followAliases(EquationSet lin, String name) {
    Set<String> seen = new HashSet<>();
    String current = name;
    while (seen.add(current)) {
      Optional<Term> rhs = lin.rhs(current);
      if (rhs.isEmpty() || !rhs.get().isVariable())
        break;
      current = rhs.get().head();
    }
    return current;
  }

  private static Operand throughAliases(EquationSet lin, Operand operand) {
    if (operand instanceof Term && ((Term)operand).isVariable())
      return Term.var(followAliases(lin, ((Term)operand).head()));
    return operand;
  }

  private static String hiddenName(String base, Set<String> taken) throws CompileException {
    String name = base;
    for (int attempt = 0; taken.contains(name); ++attempt) {
      if (attempt >= Linearizer.MAX_NAME_ATTEMPTS)
        throw new CompileException(CompileException.Kind.NAME_EXHAUSTION, "No free name for hidden field " + base);
      name += "_";
    }
    taken.add(name);
    return name;
  }

  public EquationSet equations() { return equations; }

  public Classification classification() { return classification; }

  public RecordLayout state() { return state; }

  public RecordLayout aux() { return aux; }

  public RecordLayout constants() { return constants; }

  public RecordLayout record(Storage storage) {
    switch (storage) {
    case STATE:
      return state;
    case AUX:
      return aux;
    case CONST:
      return constants;
    default:
      throw new InternalCompilerError("Unhandled storage " + storage);
    }
  }

  /** Values of the constants, in the order of the constants record. */
  public Map<String, Double> constantValues() { return constantValues; }

  /** Evolved variables in the order of the state record. */
  public List<Evolution> evolutions() { return new ArrayList<>(evolutions.values()); }

  public Optional<Evolution> evolution(String name) { return Optional.ofNullable(evolutions.get(name)); }

  /** All assignments of one derivative evaluation, constants (initialization only) first. */
  public List<Statement> statements() { return statements; }

  public List<Statement> statements(Classification.Group group) { return statements.stream().filter(st -> st.group() == group).toList(); }

  /** Finds a variable in the state, auxiliary and constants records, in that order. */
  public Optional<Slot> lookup(String name) {
    for (Storage storage : Storage.values()) {
      OptionalInt index = record(storage).indexOf(name);
      if (index.isPresent())
        return Optional.of(new Slot(storage, index.getAsInt()));
    }
    return Optional.empty();
  }

  /** Names a user can query: every program variable, without the hidden differentiator fields. Sorted. */
  public List<String> queryableVariables() {
    TreeSet<String> ret = new TreeSet<>(classification.evolved());
    ret.addAll(aux.fields());
    ret.addAll(constants.fields());
    return new ArrayList<>(ret);
  }

  public boolean isHidden(String stateField) { return state.indexOf(stateField).isPresent() && !evolutions.containsKey(stateField); }
}

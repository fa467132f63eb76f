package ddac.frontend;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * The computing elements of the DDA language.
 * <p>
 * Following analog computer conventions, {@link #INT} and {@link #SUM} invert the sign of their (summed) inputs, and so does
 * {@link #DIFF}. Integrators and differentiators carry their step size and initial value as the last two arguments.
 */
public enum Element {
  CONST("const", 1, 1),
  NEG("neg", 1, 1),
  DIV("div", 2, 2),
  INT("int", 3, Integer.MAX_VALUE),
  DIFF("diff", 3, Integer.MAX_VALUE),
  SUM("sum", 1, Integer.MAX_VALUE),
  MULT("mult", 1, Integer.MAX_VALUE),
  DEAD_UPPER("dead_upper", 2, 2),
  DEAD_LOWER("dead_lower", 2, 2),
  MIN("min", 2, 2),
  MAX("max", 2, 2),
  LT("lt", 4, 4),
  LE("le", 4, 4),
  GT("gt", 4, 4),
  GE("ge", 4, 4),
  SQRT("sqrt", 1, 1),
  ABS("abs", 1, 1),
  EXP("exp", 1, 1),
  FLOOR("floor", 1, 1),
  SIGN("sign", 1, 1),
  SIN("sin", 1, 1),
  COS("cos", 1, 1),
  ARCSIN("arcsin", 1, 1),
  LOGICAL_XOR("logical_xor", 2, 2),
  NOISE("noise", 1, 1),
  FUNCGEN("funcgen", 3, 3);

  public final String serialName;
  public final int minArgs;
  public final int maxArgs;

  private Element(String serialName, int minArgs, int maxArgs) {
    this.serialName = serialName;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
  }

  public static Optional<Element> fromSerialName(String serialName) {
    return Stream.of(Element.values()).filter(elem -> elem.serialName.equals(serialName)).findAny();
  }

  /** Elements whose output is time-evolved state rather than an algebraic function of the current values. */
  public boolean isEvolving() { return this == INT || this == DIFF; }

  public boolean acceptsArity(int arity) { return arity >= minArgs && arity <= maxArgs; }

  @Override
  public String toString() {
    return serialName;
  }
}

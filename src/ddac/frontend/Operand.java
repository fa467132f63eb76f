package ddac.frontend;

/**
 * A tail element of a {@link Term}: either a nested {@link Term} or a numeric literal {@link Num}. These two are the only
 * implementations; consumers test for {@link Num} and treat everything else as a Term.
 * Identifiers never appear here as plain strings; a name is always wrapped into a variable Term.
 */
public interface Operand {

  /** Formats this operand in the C-like DDA notation, e.g. {@code mult(x, 2)}. */
  String toDda();
}

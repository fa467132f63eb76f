package ddac.frontend;

/**
 * Numeric literal inside a term tail.
 * Integral values print without a fractional part so that {@code int(x, 0.1, 1)} survives a print/parse cycle unchanged.
 */
public record Num(double value) implements Operand {

  public Num {
    // -0.0 prints as "0"
    if (value == 0.0)
      value = 0.0;
  }

  public static Num of(double value) { return new Num(value); }

  public boolean isIntegral() { return value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15; }

  @Override
  public String toDda() {
    if (isIntegral())
      return Long.toString((long)value);
    return Double.toString(value);
  }

  @Override
  public String toString() {
    return toDda();
  }
}

package ddac.backend;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Explicit Runge-Kutta schemes as Butcher tableaux. Every scheme advances the evolved record using only vector additions and scalar
 * multiplications, with a step size per evolved variable.
 */
public enum RungeKutta {
  EULER(1, "Explicit Euler scheme", new double[][] {{}}, new double[] {1.0}),
  RK2(2, "RK2 scheme", new double[][] {{}, {1.0}}, new double[] {0.5, 0.5}),
  KUTTA3(3, "Kutta's third order scheme", new double[][] {{}, {0.5}, {-1.0, 2.0}}, new double[] {1.0 / 6.0, 4.0 / 6.0, 1.0 / 6.0}),
  RK4(4, "Classical RK4 scheme", new double[][] {{}, {0.5}, {0.0, 0.5}, {0.0, 0.0, 1.0}},
      new double[] {1.0 / 6.0, 2.0 / 6.0, 2.0 / 6.0, 1.0 / 6.0});

  public final int order;
  public final String description;
  /** Lower triangular stage coefficients; row i has i entries. */
  private final double[][] a;
  private final double[] b;

  private RungeKutta(int order, String description, double[][] a, double[] b) {
    this.order = order;
    this.description = description;
    this.a = a;
    this.b = b;
  }

  public static Optional<RungeKutta> fromOrder(int order) { return Stream.of(values()).filter(rk -> rk.order == order).findAny(); }

  public int stages() { return b.length; }

  /** Coefficient of {@code k[j]} in the argument of stage {@code i} (j &lt; i). */
  public double a(int i, int j) { return j < a[i].length ? a[i][j] : 0.0; }

  public double b(int i) { return b[i]; }

  /** Stage time offsets as a fraction of the step, the row sums of {@code a}. */
  public double c(int i) {
    double ret = 0.0;
    for (double coeff : a[i])
      ret += coeff;
    return ret;
  }

  /** Derivative evaluation {@code dqdt = f(y)} over the evolved record. */
  @FunctionalInterface
  public interface Derivative {
    void evaluate(double[] y, double[] dqdt, int stage);
  }

  /**
   * Advances {@code y} by one step in place.
   * @param dt step size per component
   */
  public void step(double[] y, double[] dt, Derivative f) {
    int n = y.length;
    double[][] k = new double[stages()][n];
    double[] arg = new double[n];
    for (int i = 0; i < stages(); ++i) {
      for (int v = 0; v < n; ++v) {
        double sum = y[v];
        for (int j = 0; j < i; ++j)
          sum += a(i, j) * dt[v] * k[j][v];
        arg[v] = sum;
      }
      f.evaluate(arg, k[i], i);
    }
    for (int v = 0; v < n; ++v) {
      double incr = 0.0;
      for (int i = 0; i < stages(); ++i)
        incr += b[i] * k[i][v];
      y[v] += incr * dt[v];
    }
  }
}

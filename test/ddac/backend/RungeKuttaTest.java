package ddac.backend;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RungeKuttaTest {

  /** Integrates y' = -y, y(0) = 1 up to t = 1 and returns the absolute error. */
  static double error(RungeKutta scheme, int steps) {
    double[] y = {1.0};
    double[] dt = {1.0 / steps};
    for (int i = 0; i < steps; ++i)
      scheme.step(y, dt, (state, dqdt, stage) -> dqdt[0] = -state[0]);
    return Math.abs(y[0] - Math.exp(-1.0));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 4})
  void testConvergenceOrder(int order) {
    RungeKutta scheme = RungeKutta.fromOrder(order).get();
    Assertions.assertEquals(order, scheme.stages());
    double ratio = error(scheme, 10) / error(scheme, 20);
    double expected = Math.pow(2, order);
    Assertions.assertTrue(ratio > 0.75 * expected && ratio < 1.35 * expected, scheme + ": error ratio " + ratio);
  }

  @Test
  void testHigherOrderIsMoreAccurate() {
    double previous = Double.POSITIVE_INFINITY;
    for (RungeKutta scheme : RungeKutta.values()) {
      double err = error(scheme, 10);
      Assertions.assertTrue(err < previous, scheme + " is not more accurate than its predecessor");
      previous = err;
    }
  }

  @Test
  void testTableaux() {
    // consistency: weights sum to one
    for (RungeKutta scheme : RungeKutta.values()) {
      double sum = 0.0;
      for (int i = 0; i < scheme.stages(); ++i)
        sum += scheme.b(i);
      Assertions.assertEquals(1.0, sum, 1e-15, scheme.description);
    }
    Assertions.assertEquals(1.0, RungeKutta.KUTTA3.c(2), 1e-15);
    Assertions.assertEquals(-1.0, RungeKutta.KUTTA3.a(2, 0));
    Assertions.assertEquals(0.0, RungeKutta.RK4.a(3, 0));
    Assertions.assertEquals(1.0, RungeKutta.RK4.a(3, 2));
    Assertions.assertTrue(RungeKutta.fromOrder(0).isEmpty());
    Assertions.assertTrue(RungeKutta.fromOrder(5).isEmpty());
  }

  @Test
  void testPerComponentStep() {
    double[] y = {1.0, 1.0};
    double[] dt = {0.1, 0.2};
    RungeKutta.EULER.step(y, dt, (state, dqdt, stage) -> {
      dqdt[0] = 1.0;
      dqdt[1] = 1.0;
    });
    Assertions.assertEquals(1.1, y[0], 1e-15);
    Assertions.assertEquals(1.2, y[1], 1e-15);
  }
}

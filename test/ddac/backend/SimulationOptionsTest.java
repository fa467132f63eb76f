package ddac.backend;

import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SimulationOptionsTest {

  @Test
  void testSet() {
    SimulationOptions options = new SimulationOptions();
    options.set("max_iterations=1000");
    options.set("modulo_write=10");
    options.set("rk_order=4");
    options.set("noise_seed=7");
    options.set("binary_output");
    options.set("always_compute_aux_before_printing=0");
    options.set("write_initial_conditions=true");
    Assertions.assertEquals(1000, options.max_iterations);
    Assertions.assertEquals(10, options.modulo_write);
    Assertions.assertEquals(4, options.rk_order);
    Assertions.assertEquals(7, options.noise_seed);
    Assertions.assertTrue(options.binary_output);
    Assertions.assertFalse(options.always_compute_aux_before_printing);
    Assertions.assertTrue(options.write_initial_conditions);
  }

  @Test
  void testOverrides() {
    SimulationOptions options = new SimulationOptions();
    options.set("initial:y=-1");
    options.set("dt:y=1e-3");
    options.set("const:k=2.5");
    options.set("initial:y=3");
    Assertions.assertEquals(Map.of("y", 3.0), options.initial_overrides);
    Assertions.assertEquals(Map.of("y", 0.001), options.dt_overrides);
    Assertions.assertEquals(Map.of("k", 2.5), options.const_overrides);
  }

  @ParameterizedTest
  @ValueSource(strings = {"unknown=1", "rk_order=5", "rk_order=0", "modulo_write=0", "max_iterations=ten", "max_iterations", "debug=maybe",
                          "initial:=1", "initial:y", "const:k=abc"})
  void testInvalid(String setting) {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new SimulationOptions().set(setting));
  }

  @Test
  void testCopyIsIndependent() {
    SimulationOptions options = new SimulationOptions();
    options.query_variables.add("y");
    options.set("initial:y=1");
    SimulationOptions copy = options.copy();
    copy.query_variables.add("x");
    copy.set("initial:y=2");
    copy.set("rk_order=2");
    Assertions.assertEquals(1, options.query_variables.size());
    Assertions.assertEquals(1.0, options.initial_overrides.get("y"));
    Assertions.assertEquals(1, options.rk_order);
    Assertions.assertEquals(2, copy.query_variables.size());
  }
}

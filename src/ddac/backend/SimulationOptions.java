package ddac.backend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run time options of a simulation. The same keys are understood by the generated C++ program as {@code --key=value}.
 */
public class SimulationOptions {

  public int max_iterations = 100;
  public int modulo_write = 1;
  public int rk_order = 1;

  public boolean debug = false;
  public boolean list_all_variables = false;
  public boolean write_initial_conditions = false;
  public boolean always_compute_aux_before_printing = true;
  public boolean binary_output = false;

  /** Seed of the noise(...) element. */
  public long noise_seed = 0;

  /** Variables to print; all queryable variables if empty. */
  public List<String> query_variables = new ArrayList<>();

  public Map<String, Double> initial_overrides = new LinkedHashMap<>();
  public Map<String, Double> dt_overrides = new LinkedHashMap<>();
  public Map<String, Double> const_overrides = new LinkedHashMap<>();

  public static final String INITIAL_PREFIX = "initial:";
  public static final String DT_PREFIX = "dt:";
  public static final String CONST_PREFIX = "const:";

  public SimulationOptions copy() {
    SimulationOptions ret = new SimulationOptions();
    ret.max_iterations = max_iterations;
    ret.modulo_write = modulo_write;
    ret.rk_order = rk_order;
    ret.debug = debug;
    ret.list_all_variables = list_all_variables;
    ret.write_initial_conditions = write_initial_conditions;
    ret.always_compute_aux_before_printing = always_compute_aux_before_printing;
    ret.binary_output = binary_output;
    ret.noise_seed = noise_seed;
    ret.query_variables = new ArrayList<>(query_variables);
    ret.initial_overrides = new LinkedHashMap<>(initial_overrides);
    ret.dt_overrides = new LinkedHashMap<>(dt_overrides);
    ret.const_overrides = new LinkedHashMap<>(const_overrides);
    return ret;
  }

  /**
   * Applies one {@code key=value} setting, e.g. {@code rk_order=4}, {@code binary_output}, {@code initial:y=-1}.
   * A flag without value is switched on.
   * @throws IllegalArgumentException for an unknown key or a malformed value
   */
  public void set(String setting) {
    int eq = setting.indexOf('=');
    String key = eq < 0 ? setting : setting.substring(0, eq);
    String value = eq < 0 ? null : setting.substring(eq + 1);
    if (key.startsWith(INITIAL_PREFIX)) {
      initial_overrides.put(overrideName(key, INITIAL_PREFIX), number(key, value));
      return;
    }
    if (key.startsWith(DT_PREFIX)) {
      dt_overrides.put(overrideName(key, DT_PREFIX), number(key, value));
      return;
    }
    if (key.startsWith(CONST_PREFIX)) {
      const_overrides.put(overrideName(key, CONST_PREFIX), number(key, value));
      return;
    }
    switch (key) {
    case "max_iterations":
      max_iterations = integer(key, value);
      break;
    case "modulo_write":
      modulo_write = integer(key, value);
      if (modulo_write < 1)
        throw new IllegalArgumentException("modulo_write must be positive");
      break;
    case "rk_order":
      rk_order = integer(key, value);
      if (RungeKutta.fromOrder(rk_order).isEmpty())
        throw new IllegalArgumentException("rk_order must be between 1 and 4, got " + rk_order);
      break;
    case "noise_seed":
      noise_seed = integer(key, value);
      break;
    case "debug":
      debug = flag(key, value);
      break;
    case "list_all_variables":
      list_all_variables = flag(key, value);
      break;
    case "write_initial_conditions":
      write_initial_conditions = flag(key, value);
      break;
    case "always_compute_aux_before_printing":
      always_compute_aux_before_printing = flag(key, value);
      break;
    case "binary_output":
      binary_output = flag(key, value);
      break;
    default:
      throw new IllegalArgumentException("Unknown simulation option '" + key + "'");
    }
  }

  private static String overrideName(String key, String prefix) {
    String name = key.substring(prefix.length());
    if (name.isEmpty())
      throw new IllegalArgumentException("Missing variable name in '" + key + "'");
    return name;
  }

  private static double number(String key, String value) {
    if (value == null)
      throw new IllegalArgumentException("Missing value for '" + key + "'");
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number for '" + key + "': " + value, e);
    }
  }

  private static int integer(String key, String value) {
    if (value == null)
      throw new IllegalArgumentException("Missing value for '" + key + "'");
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not an integer for '" + key + "': " + value, e);
    }
  }

  private static boolean flag(String key, String value) {
    if (value == null || value.equals("1") || value.equalsIgnoreCase("true"))
      return true;
    if (value.equals("0") || value.equalsIgnoreCase("false"))
      return false;
    throw new IllegalArgumentException("Not a flag value for '" + key + "': " + value);
  }
}

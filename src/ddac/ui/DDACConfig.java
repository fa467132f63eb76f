package ddac.ui;

/**
 * Data-Class to hold tool options, loaded from YAML.
 */
public class DDACConfig {

  public boolean strict_linearization = false;
  public boolean fail_on_cyclic_auxiliaries = false;

  // defaults of the generated program and of the run target
  public int rk_order = 1;
  public int max_iterations = 100;
  public int modulo_write = 1;

  /** printf style format of numbers in generated code, empty for the shortest exact form */
  public String number_format = "";
  public String indent = "    ";
  public String state_type = "state_variables";
  public String aux_type = "auxiliaries";
  public String const_type = "constants";
}

package ddac.backend;

import ddac.CompileException;
import ddac.Compilation;
import ddac.analysis.Classification;
import ddac.drc.InternalCompilerError;
import ddac.frontend.Element;
import ddac.frontend.Num;
import ddac.frontend.Operand;
import ddac.frontend.Term;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Runs a {@link SimulationLayout} on the JVM, with the same options and output as the generated C++ program.
 * <p>
 * The simulation clock advances by the smallest step size of all evolved variables per iteration; {@code funcgen} sees the time at the
 * start of the step in every stage.
 */
public class Simulator extends CodeBackend {

  private final SimulationOptions options;

  public Simulator(SimulationOptions options) {
    this.options = options;
    dictionary.put(DictWords.comment, "#");
    dictionary.put(DictWords.separator, "\t");
  }

  public Simulator() { this(new SimulationOptions()); }

  @Override
  public String Target() {
    return "run";
  }

  @Override
  public String FileExtension() {
    return options.binary_output ? "bin" : "tsv";
  }

  public SimulationOptions getOptions() { return options; }

  @Override
  public void Write(Compilation compilation, OutputStream out) throws CompileException {
    if (options.list_all_variables) {
      WriteText(out, ListVariables(compilation.layout()));
      return;
    }
    Run run = new Run(compilation.layout(), options);
    logger.debug("Simulating {} with {} for {} iterations", compilation.name(), run.scheme.description, options.max_iterations);
    try {
      run.simulate(out);
    } catch (IOException e) {
      throw new CompileException(CompileException.Kind.IO, "Writing simulation output failed", e);
    }
  }

  /** The three variable groups, one name per line, each group headed by a comment line. */
  public String ListVariables(SimulationLayout layout) {
    StringBuilder ret = new StringBuilder();
    ret.append(Comment("state")).append('\n');
    layout.classification().evolved().forEach(name -> ret.append(name).append('\n'));
    ret.append(Comment("aux")).append('\n');
    layout.aux().fields().forEach(name -> ret.append(name).append('\n'));
    ret.append(Comment("constants")).append('\n');
    layout.constants().fields().forEach(name -> ret.append(name).append('\n'));
    return ret.toString();
  }

  /**
   * Integrates without writing and returns the final values of {@code variables}.
   */
  public double[] Simulate(SimulationLayout layout, List<String> variables) {
    Run run = new Run(layout, options);
    for (int iter = 0; iter < options.max_iterations; ++iter)
      run.integrate();
    run.computeAux(run.y, run.stepStart);
    double[] ret = new double[variables.size()];
    for (int i = 0; i < ret.length; ++i)
      ret[i] = run.value(variables.get(i));
    return ret;
  }

  /** State of one simulation. */
  private class Run {
    final SimulationLayout layout;
    final SimulationOptions options;
    final RungeKutta scheme;
    final double[] y;
    final double[] dt;
    final double[] aux;
    final double[] consts;
    final double clockStep;
    final Random random;
    final List<String> queryNames;
    double time = 0.0;
    double stepStart = 0.0;

    Run(SimulationLayout layout, SimulationOptions options) {
      this.layout = layout;
      this.options = options;
      this.scheme = RungeKutta.fromOrder(options.rk_order)
                        .orElseThrow(() -> new IllegalArgumentException("rk_order must be between 1 and 4, got " + options.rk_order));
      this.random = new Random(options.noise_seed);
      this.consts = new double[layout.constants().size()];
      for (var entry : layout.constantValues().entrySet())
        consts[layout.constants().indexOf(entry.getKey()).getAsInt()] = entry.getValue();
      for (var entry : options.const_overrides.entrySet())
        consts[indexIn(layout.constants(), entry.getKey(), "const")] = entry.getValue();

      this.y = new double[layout.state().size()];
      this.dt = new double[layout.state().size()];
      this.aux = new double[layout.aux().size()];
      double minStep = Double.POSITIVE_INFINITY;
      for (SimulationLayout.Evolution evolution : layout.evolutions()) {
        int idx = layout.state().indexOf(evolution.name()).getAsInt();
        y[idx] = constant(evolution.initial(), evolution.initialValue());
        dt[idx] = constant(evolution.step(), evolution.stepValue());
      }
      for (var entry : options.initial_overrides.entrySet())
        y[indexOfEvolved(entry.getKey(), "initial")] = entry.getValue();
      for (var entry : options.dt_overrides.entrySet())
        dt[indexOfEvolved(entry.getKey(), "dt")] = entry.getValue();
      for (SimulationLayout.Evolution evolution : layout.evolutions()) {
        int idx = layout.state().indexOf(evolution.name()).getAsInt();
        if (evolution.lastInput().isPresent())
          dt[layout.state().indexOf(evolution.lastInput().get()).getAsInt()] = dt[idx];
        minStep = Math.min(minStep, dt[idx]);
      }
      this.clockStep = Double.isInfinite(minStep) ? 1.0 : minStep;

      this.queryNames = options.query_variables.isEmpty() ? layout.queryableVariables() : options.query_variables;
      for (String name : queryNames) {
        if (layout.lookup(name).isEmpty() || !layout.queryableVariables().contains(name))
          throw new IllegalArgumentException("'" + name + "' is not a variable of the program");
      }
      prime();
    }

    private int indexIn(RecordLayout record, String name, String what) {
      return record.indexOf(name).orElseThrow(() -> new IllegalArgumentException("No " + what + " named '" + name + "'"));
    }

    private int indexOfEvolved(String name, String what) {
      if (layout.evolution(name).isEmpty())
        throw new IllegalArgumentException("Cannot override " + what + " of '" + name + "', it is not an evolved variable");
      return layout.state().indexOf(name).getAsInt();
    }

    private double constant(Operand operand, double fallback) {
      if (operand instanceof Term && ((Term)operand).isVariable()) {
        var idx = layout.constants().indexOf(((Term)operand).head());
        if (idx.isPresent())
          return consts[idx.getAsInt()];
      }
      return fallback;
    }

    /** Differentiators start from their current input, so that the first step sees no jump. */
    private void prime() {
      computeAux(y, 0.0);
      for (SimulationLayout.Evolution evolution : layout.evolutions()) {
        if (evolution.lastInput().isPresent())
          y[layout.state().indexOf(evolution.lastInput().get()).getAsInt()] = inputSum(evolution, y);
      }
    }

    void integrate() {
      stepStart = time;
      scheme.step(y, dt, (state, dqdt, stage) -> derivative(state, dqdt));
      time = stepStart + clockStep;
    }

    void simulate(OutputStream out) throws IOException {
      DataOutputStream binary = options.binary_output ? new DataOutputStream(out) : null;
      StringBuilder text = new StringBuilder();
      if (binary == null) {
        text.append(String.join(dictionary.get(DictWords.separator), queryNames)).append('\n');
      }
      if (options.write_initial_conditions) {
        Arrays.fill(aux, Double.NaN);
        writeRow(binary, text, false);
      }
      for (int iter = 0; iter < options.max_iterations; ++iter) {
        integrate();
        if (iter % options.modulo_write == 0)
          writeRow(binary, text, options.always_compute_aux_before_printing);
        if (binary == null && text.length() > 1 << 16) {
          out.write(text.toString().getBytes(StandardCharsets.UTF_8));
          text.setLength(0);
        }
      }
      if (binary != null)
        binary.flush();
      else
        out.write(text.toString().getBytes(StandardCharsets.UTF_8));
      out.flush();
    }

    private void writeRow(DataOutputStream binary, StringBuilder text, boolean recompute) throws IOException {
      if (recompute)
        computeAux(y, stepStart);
      for (int i = 0; i < queryNames.size(); ++i) {
        double value = value(queryNames.get(i));
        if (binary != null)
          binary.writeDouble(value);
        else
          text.append(i == 0 ? "" : dictionary.get(DictWords.separator)).append(value);
      }
      if (binary == null)
        text.append('\n');
    }

    double value(String name) {
      SimulationLayout.Slot slot = layout.lookup(name).orElseThrow(() -> new IllegalArgumentException("Unknown variable " + name));
      switch (slot.storage()) {
      case STATE:
        return y[slot.index()];
      case AUX:
        return aux[slot.index()];
      case CONST:
        return consts[slot.index()];
      default:
        throw new InternalCompilerError("Unhandled storage " + slot.storage());
      }
    }

    private double operand(Operand operand, double[] state) {
      if (operand instanceof Num)
        return ((Num)operand).value();
      SimulationLayout.Slot slot = layout.lookup(((Term)operand).head()).get();
      switch (slot.storage()) {
      case STATE:
        return state[slot.index()];
      case AUX:
        return aux[slot.index()];
      case CONST:
        return consts[slot.index()];
      default:
        throw new InternalCompilerError("Unhandled storage " + slot.storage());
      }
    }

    private double inputSum(SimulationLayout.Evolution evolution, double[] state) {
      double ret = 0.0;
      for (Operand input : evolution.inputs())
        ret += operand(input, state);
      return ret;
    }

    void computeAux(double[] state, double t) {
      if (options.debug)
        Arrays.fill(aux, Double.NaN);
      for (SimulationLayout.Statement statement : layout.statements()) {
        if (statement.group() == Classification.Group.CONSTANTS || statement.group() == Classification.Group.EVOLVED)
          continue;
        aux[layout.aux().indexOf(statement.target()).getAsInt()] = evaluate(statement, state, t);
      }
    }

    private void derivative(double[] state, double[] dqdt) {
      if (options.debug)
        Arrays.fill(aux, Double.NaN);
      for (SimulationLayout.Statement statement : layout.statements()) {
        switch (statement.group()) {
        case CONSTANTS:
          break;
        case EVOLVED:
          evolve(layout.evolution(statement.target()).get(), state, dqdt);
          break;
        default:
          aux[layout.aux().indexOf(statement.target()).getAsInt()] = evaluate(statement, state, stepStart);
        }
      }
    }

    private void evolve(SimulationLayout.Evolution evolution, double[] state, double[] dqdt) {
      int idx = layout.state().indexOf(evolution.name()).getAsInt();
      double input = inputSum(evolution, state);
      if (evolution.element() == Element.INT) {
        dqdt[idx] = -input;
        return;
      }
      int last = layout.state().indexOf(evolution.lastInput().get()).getAsInt();
      double delta = input - state[last];
      dqdt[last] = delta / dt[last];
      dqdt[idx] = (-delta / dt[idx] - state[idx]) / dt[idx];
    }

    private double evaluate(SimulationLayout.Statement statement, double[] state, double t) {
      Term rhs = statement.rhs();
      if (statement.isAlias())
        return operand(rhs, state);
      double[] a = new double[rhs.arity()];
      for (int i = 0; i < a.length; ++i)
        a[i] = operand(rhs.get(i), state);
      return apply(statement.element().get(), a, t);
    }

    private double apply(Element element, double[] a, double t) {
      switch (element) {
      case CONST:
        return a[0];
      case NEG:
        return -a[0];
      case DIV:
        return a[0] / a[1];
      case SUM:
        return -Arrays.stream(a).sum();
      case MULT:
        return Arrays.stream(a).reduce(1.0, (x, z) -> x * z);
      case DEAD_UPPER:
        return a[0] > a[1] ? a[0] - a[1] : 0.0;
      case DEAD_LOWER:
        return a[0] < a[1] ? a[0] - a[1] : 0.0;
      case MIN:
        return Math.min(a[0], a[1]);
      case MAX:
        return Math.max(a[0], a[1]);
      case LT:
        return a[0] < a[1] ? a[2] : a[3];
      case LE:
        return a[0] <= a[1] ? a[2] : a[3];
      case GT:
        return a[0] > a[1] ? a[2] : a[3];
      case GE:
        return a[0] >= a[1] ? a[2] : a[3];
      case SQRT:
        return Math.sqrt(a[0]);
      case ABS:
        return Math.abs(a[0]);
      case EXP:
        return Math.exp(a[0]);
      case FLOOR:
        return (double)(long)a[0];
      case SIGN:
        return Math.signum(a[0]);
      case SIN:
        return Math.sin(a[0]);
      case COS:
        return Math.cos(a[0]);
      case ARCSIN:
        return Math.asin(a[0]);
      case LOGICAL_XOR:
        return (a[0] > 0) != (a[1] > 0) ? 1.0 : 0.0;
      case NOISE:
        return a[0] * (2.0 * random.nextDouble() - 1.0);
      case FUNCGEN:
        return a[0] * Math.sin(a[1] * t + a[2]);
      case INT:
      case DIFF:
        throw new InternalCompilerError("Evolving element " + element + " evaluated as an auxiliary");
      default:
        throw new InternalCompilerError("Unknown element " + element);
      }
    }
  }

  /** Convenience for a layout without a surrounding compilation. */
  public Map<String, Double> FinalValues(SimulationLayout layout) {
    List<String> names = layout.queryableVariables();
    double[] values = Simulate(layout, names);
    Map<String, Double> ret = new LinkedHashMap<>();
    for (int i = 0; i < names.size(); ++i)
      ret.put(names.get(i), values[i]);
    return ret;
  }
}

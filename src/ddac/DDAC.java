package ddac;

import ddac.analysis.Classification;
import ddac.analysis.Linearizer;
import ddac.analysis.VariableClassifier;
import ddac.backend.CodeBackend;
import ddac.backend.CppBackend;
import ddac.backend.DdaBackend;
import ddac.backend.DotBackend;
import ddac.backend.SimulationLayout;
import ddac.backend.SimulationOptions;
import ddac.backend.Simulator;
import ddac.drc.DRC;
import ddac.frontend.EquationSet;
import ddac.frontend.Vocabulary;
import ddac.ui.DDACConfig;
import ddac.util.FileWriter;
import ddac.util.Identifiers;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The compiler pipeline: sanitize identifiers, linearize, classify, check, lay out, and hand the result to a back end.
 * Every stage returns a new value; a failing stage aborts with a {@link CompileException}.
 */
public class DDAC {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Vocabulary vocabulary;
  private DDACConfig cfg = new DDACConfig();
  private boolean errLevelHigh = false;

  public DDAC(Vocabulary vocabulary) { this.vocabulary = vocabulary; }

  public DDAC() { this(Vocabulary.standard()); }

  public Vocabulary getVocabulary() { return vocabulary; }

  public void setConfig(DDACConfig cfg) {
    this.cfg = cfg;
    this.errLevelHigh = cfg.fail_on_cyclic_auxiliaries;
  }

  public DDACConfig getConfig() { return cfg; }

  /** With a high error level, an algebraic loop is a compile error instead of a warning. */
  public void SetErrLevel(boolean errLevelHigh) { this.errLevelHigh = errLevelHigh; }

  public Compilation Compile(String name, EquationSet source) throws CompileException {
    logger.debug("Compiling {} ({} equations)", name, source.size());
    EquationSet sanitized = Identifiers.sanitize(source, vocabulary);
    EquationSet lin = new Linearizer(cfg.strict_linearization).linearize(sanitized);

    DRC drc = new DRC();
    drc.SetErrLevel(errLevelHigh);
    Classification classification = new VariableClassifier(drc).classify(lin);
    drc.CheckFatal();
    SimulationLayout layout = SimulationLayout.build(lin, classification, vocabulary, drc);
    return new Compilation(name, source, lin, classification, layout, drc.GetWarnings());
  }

  /**
   * Compiles independent programs in parallel. Results keep the order of {@code programs}.
   * @throws CompileException the first failure in that order
   */
  public List<Compilation> CompileAll(Map<String, EquationSet> programs, int threads) throws CompileException {
    ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
    try {
      Map<String, Future<Compilation>> futures = new LinkedHashMap<>();
      for (var entry : programs.entrySet())
        futures.put(entry.getKey(), executor.submit(() -> Compile(entry.getKey(), entry.getValue())));
      List<Compilation> ret = new ArrayList<>();
      for (var entry : futures.entrySet()) {
        try {
          ret.add(entry.getValue().get());
        } catch (ExecutionException e) {
          if (e.getCause() instanceof CompileException)
            throw (CompileException)e.getCause();
          if (e.getCause() instanceof RuntimeException)
            throw (RuntimeException)e.getCause();
          throw new IllegalStateException("Compiling " + entry.getKey() + " failed", e.getCause());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while compiling " + entry.getKey(), e);
        }
      }
      return ret;
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Creates the back end for a target name ({@code cpp}, {@code dda}, {@code dot} or {@code run}), configured from the tool configuration.
   * @param options run time options; for {@code cpp}, the defaults compiled into the generated program
   */
  public CodeBackend Backend(String target, SimulationOptions options) {
    CodeBackend ret;
    switch (target) {
    case "cpp":
      CppBackend cpp = new CppBackend();
      cpp.stateType = cfg.state_type;
      cpp.auxType = cfg.aux_type;
      cpp.constType = cfg.const_type;
      cpp.indent = cfg.indent;
      cpp.defaults = options;
      ret = cpp;
      break;
    case "dda":
      ret = new DdaBackend();
      break;
    case "dot":
      ret = new DotBackend();
      break;
    case "run":
      ret = new Simulator(options);
      break;
    default:
      throw new IllegalArgumentException("Unknown target '" + target + "', expected cpp, dda, dot or run");
    }
    if (cfg.number_format != null && !cfg.number_format.isEmpty())
      ret.numberFormat = cfg.number_format;
    return ret;
  }

  /**
   * Default run time options from the tool configuration.
   * @throws IllegalArgumentException for an unsupported Runge-Kutta order or output stride
   */
  public SimulationOptions DefaultOptions() {
    SimulationOptions ret = new SimulationOptions();
    ret.set("rk_order=" + cfg.rk_order);
    ret.set("max_iterations=" + cfg.max_iterations);
    ret.set("modulo_write=" + cfg.modulo_write);
    return ret;
  }

  /**
   * Runs the back end and registers its output as {@code <name>.<extension>}.
   */
  public void Generate(Compilation compilation, CodeBackend backend, FileWriter toFile) throws CompileException {
    String file = compilation.name() + "." + backend.FileExtension();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    backend.Write(compilation, out);
    toFile.ReplaceContent(file, out.toByteArray());
    logger.info("Generated {} for target {}", file, backend.Target());
  }
}

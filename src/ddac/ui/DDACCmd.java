package ddac.ui;

import ddac.CompileException;
import ddac.Compilation;
import ddac.DDAC;
import ddac.backend.CodeBackend;
import ddac.backend.SimulationOptions;
import ddac.drc.InternalCompilerError;
import ddac.frontend.DdaReader;
import ddac.frontend.EquationSet;
import ddac.util.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

public class DDACCmd {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int EXIT_OK = 0;
  public static final int EXIT_COMPILE_ERROR = 1;
  public static final int EXIT_USAGE = 2;

  private static final String USAGE = "ddac - compile DDA circuits into Runge-Kutta simulation programs";

  // entrypoint
  public static void main(String[] args) {
    // console appender, level is set once the options are parsed
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stderr")));
    Configurator.reconfigure(builder.build());

    System.exit(Run(args, System.out));
  }

  static Options BuildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("circuit.dda")
                          .hasArg()
                          .desc("DDA file to compile; repeat to compile several files in parallel")
                          .build());
    options.addOption(
        Option.builder("t").longOpt("target").argName("cpp|dda|dot|run").hasArg().desc("Output target, cpp by default").build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .desc("Directory to write <name>.<ext> into; output goes to stdout if not set")
                          .build());
    options.addOption(Option.builder("c").longOpt("config").argName("config.yaml").hasArg().desc("YAML tool configuration").build());
    options.addOption(Option.builder().longOpt("strict").desc("Strict linearization, every root becomes a named equation").build());
    options.addOption(Option.builder().longOpt("fail-on-cyclic").desc("Treat algebraic loops as errors").build());
    options.addOption(Option.builder().longOpt("rk").argName("1-4").hasArg().desc("Runge-Kutta order").build());
    options.addOption(Option.builder("n").longOpt("iterations").argName("count").hasArg().desc("Number of integration steps").build());
    options.addOption(Option.builder("m").longOpt("modulo-write").argName("stride").hasArg().desc("Write every m-th step").build());
    options.addOption(Option.builder("s")
                          .longOpt("set")
                          .argName("name=value")
                          .hasArg()
                          .desc("Simulation option, e.g. initial:y=1, dt:y=0.01, const:k=2, binary_output, noise_seed=7")
                          .build());
    options.addOption(Option.builder("j").longOpt("threads").argName("count").hasArg().desc("Compiler threads for several inputs").build());
    options.addOption(Option.builder().longOpt("binary").desc("Binary simulation output").build());
    options.addOption(Option.builder().longOpt("list").desc("List the state, aux and constant variables instead of simulating").build());
    options.addOption(Option.builder("h").longOpt("help").desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Runs the tool on {@code args}; generated text goes to {@code out} unless an output directory is set.
   * @return the process exit code
   */
  public static int Run(String[] args, OutputStream out) {
    Options options = BuildOptions();
    CommandLine line;
    try {
      line = new DefaultParser().parse(options, args);
    } catch (ParseException exp) {
      System.err.println(exp.getMessage());
      PrintHelp(options);
      return EXIT_USAGE;
    }
    if (line.hasOption("h")) {
      PrintHelp(options);
      return EXIT_OK;
    }

    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    if (!line.hasOption("i")) {
      logger.error("No input file given");
      PrintHelp(options);
      return EXIT_USAGE;
    }

    DDAC ddac = new DDAC();
    DDACConfig cfg;
    SimulationOptions simOptions;
    String target = line.getOptionValue("t", "cpp");
    int threads;
    try {
      cfg = line.hasOption("c") ? LoadConfig(Paths.get(line.getOptionValue("c"))) : new DDACConfig();
      if (line.hasOption("strict"))
        cfg.strict_linearization = true;
      if (line.hasOption("fail-on-cyclic"))
        cfg.fail_on_cyclic_auxiliaries = true;
      if (line.hasOption("rk"))
        cfg.rk_order = Integer.parseInt(line.getOptionValue("rk"));
      if (line.hasOption("n"))
        cfg.max_iterations = Integer.parseInt(line.getOptionValue("n"));
      if (line.hasOption("m"))
        cfg.modulo_write = Integer.parseInt(line.getOptionValue("m"));
      threads = Integer.parseInt(line.getOptionValue("j", "1"));

      ddac.setConfig(cfg);
      simOptions = ddac.DefaultOptions();
      if (line.hasOption("binary"))
        simOptions.binary_output = true;
      if (line.hasOption("list"))
        simOptions.list_all_variables = true;
      if (line.hasOption("s")) {
        for (String setting : line.getOptionValues("s"))
          simOptions.set(setting);
      }
      List<String> queries = line.getArgList();
      simOptions.query_variables.addAll(queries);
    } catch (IllegalArgumentException | CompileException e) {
      // NumberFormatException is an IllegalArgumentException
      logger.error(e.getMessage());
      return e instanceof CompileException ? EXIT_COMPILE_ERROR : EXIT_USAGE;
    }

    try {
      CodeBackend backend = ddac.Backend(target, simOptions);

      // program names become output file names
      Map<String, Path> inputs = new LinkedHashMap<>();
      for (String input : line.getOptionValues("i")) {
        Path path = Paths.get(input);
        Path previous = inputs.putIfAbsent(ProgramName(path), path);
        if (previous != null)
          throw new IllegalArgumentException(
              String.format("Inputs %s and %s share the program name '%s'", previous, path, ProgramName(path)));
      }
      Map<String, EquationSet> programs = new LinkedHashMap<>();
      DdaReader reader = new DdaReader(ddac.getVocabulary());
      for (var input : inputs.entrySet())
        programs.put(input.getKey(), reader.read(input.getValue()));
      List<Compilation> compilations = ddac.CompileAll(programs, threads);

      if (line.hasOption("o")) {
        FileWriter toFile = new FileWriter(line.getOptionValue("o"));
        for (Compilation compilation : compilations)
          ddac.Generate(compilation, backend, toFile);
        toFile.WriteFiles();
      } else {
        for (Compilation compilation : compilations)
          backend.Write(compilation, out);
      }
    } catch (IllegalArgumentException e) {
      logger.error(e.getMessage());
      return EXIT_USAGE;
    } catch (CompileException e) {
      logger.error(e.getMessage());
      return EXIT_COMPILE_ERROR;
    } catch (InternalCompilerError e) {
      logger.fatal(e.getMessage(), e);
      return EXIT_COMPILE_ERROR;
    }
    return EXIT_OK;
  }

  /** Reads the tool configuration. An empty file yields the defaults; unknown keys are errors. */
  public static DDACConfig LoadConfig(Path file) throws CompileException {
    try (InputStream in = Files.newInputStream(file)) {
      DDACConfig ret = new Yaml().loadAs(in, DDACConfig.class);
      return ret == null ? new DDACConfig() : ret;
    } catch (IOException e) {
      throw new CompileException(CompileException.Kind.IO, "Cannot read configuration " + file, e);
    } catch (YAMLException e) {
      throw new CompileException(CompileException.Kind.SYNTAX, "Invalid configuration " + file + ": " + e.getMessage(), e);
    }
  }

  /** Base name of the input file without its extension. */
  static String ProgramName(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static void PrintHelp(Options options) {
    new HelpFormatter().printHelp("ddac -i <circuit.dda> [options] [variables...]", USAGE, options, null);
  }
}

package ddac.backend;

import ddac.CompileException;
import ddac.Compilation;
import ddac.analysis.Classification;
import ddac.frontend.Element;
import ddac.frontend.Num;
import ddac.frontend.Operand;
import ddac.frontend.Term;
import ddac.util.Identifiers;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Emits a standalone C++17 simulation program. The program depends only on the standard library; it prints rows of the queried
 * variables to stdout and diagnostics to stderr. Run time options follow {@link SimulationOptions}, e.g.
 * {@code ./a.out --max_iterations=1000 --rk_order=4 --initial:y=-1 y}.
 */
public class CppBackend extends CodeBackend {

  /** C++ keywords and the names the generated program uses itself. */
  public static final Set<String> RESERVED =
      Set.of("alignas", "alignof", "and", "and_eq", "asm", "auto", "bitand", "bitor", "bool", "break", "case", "catch", "char", "char16_t",
             "char32_t", "class", "compl", "const", "constexpr", "const_cast", "continue", "decltype", "default", "delete", "do", "double",
             "dynamic_cast", "else", "enum", "explicit", "export", "extern", "false", "float", "for", "friend", "goto", "if", "inline", "int",
             "long", "mutable", "namespace", "new", "noexcept", "not", "not_eq", "nullptr", "operator", "or", "or_eq", "private", "protected",
             "public", "register", "reinterpret_cast", "return", "short", "signed", "sizeof", "static", "static_assert", "static_cast",
             "struct", "switch", "template", "this", "thread_local", "throw", "true", "try", "typedef", "typeid", "typename", "union",
             "unsigned", "using", "virtual", "void", "volatile", "wchar_t", "while", "xor", "xor_eq", "byName", "set_to_nan", "_r",
             "_other", "_name_", "_nan_", "_du", "_dummy_dqdt");

  public String stateType = "state_variables";
  public String auxType = "auxiliaries";
  public String constType = "constants";
  public String indent = "    ";
  /** Defaults compiled into the generated argument parser. */
  public SimulationOptions defaults = new SimulationOptions();

  private static final String STATE = "_state";
  private static final String DQDT = "_dqdt";
  private static final String AUX = "_aux";
  private static final String CONSTANTS = "_constants";
  private static final String LOOKUP = "_name_";

  public CppBackend() {
    dictionary.put(DictWords.comment, "//");
    dictionary.put(DictWords.assign, " = ");
    dictionary.put(DictWords.statement_end, ";");
    dictionary.put(DictWords.separator, ", ");
  }

  @Override
  public String Target() {
    return "cpp";
  }

  @Override
  public String FileExtension() {
    return "cpp";
  }

  @Override
  public void Write(Compilation compilation, OutputStream out) throws CompileException {
    WriteText(out, GenerateSource(compilation.name(), compilation.layout()));
  }

  /** Name of the C++ function implementing a computing element inside namespace {@code dda}. */
  public static String FunctionName(Element element) {
    switch (element) {
    case CONST:
      return "Const";
    case INT:
      return "Int";
    case DIFF:
      return "Diff";
    case DIV:
      return "Div";
    default:
      return element.serialName;
    }
  }

  public String GenerateSource(String programName, SimulationLayout layout) throws CompileException {
    List<String> allFields = new ArrayList<>(layout.state().fields());
    allFields.addAll(layout.aux().fields());
    allFields.addAll(layout.constants().fields());
    // a member may not share its struct's name
    Set<String> reserved = new HashSet<>(RESERVED);
    reserved.addAll(List.of(stateType, auxType, constType));
    Map<String, String> renames = Identifiers.renaming(allFields, reserved);
    Fields fields = new Fields(layout, renames);

    Map<String, String> values = new LinkedHashMap<>();
    values.put("program", programName);
    values.put("impl", ELEMENTS_IMPL);
    values.put("state_type", stateType);
    values.put("aux_type", auxType);
    values.put("const_type", constType);
    values.put("state_fields", Declare("double", fields.cpp(layout.state().fields()), 1));
    values.put("state_operators", StateOperators(fields.cpp(layout.state().fields())));
    values.put("state_by_name", ByName(layout.classification().evolved(), fields, 2));
    values.put("aux_fields", Declare("double", fields.cpp(layout.aux().fields()), 1));
    values.put("aux_set_to_nan", Lines(fields.cpp(layout.aux().fields()).stream().map(f -> f + " = _nan_;").collect(Collectors.toList()), 2));
    values.put("aux_by_name", ByName(layout.aux().fields(), fields, 2));
    values.put("const_fields", ConstantFields(layout, fields));
    values.put("const_by_name", ByName(layout.constants().fields(), fields, 2));
    values.put("state_names", StringList(layout.classification().evolved()));
    values.put("aux_names", StringList(layout.aux().fields()));
    values.put("const_names", StringList(layout.constants().fields()));
    values.put("all_variables", StringList(layout.queryableVariables()));
    values.put("equations", Lines(Equations(layout, fields), 1));
    values.put("init_data", Lines(InitData(layout, fields), 1));
    values.put("prime", Lines(Prime(layout, fields), 1));
    values.put("integrate", Integrate());
    values.put("max_iterations", Integer.toString(defaults.max_iterations));
    values.put("modulo_write", Integer.toString(defaults.modulo_write));
    values.put("rk_order", Integer.toString(defaults.rk_order));
    values.put("binary_output", Boolean.toString(defaults.binary_output));
    values.put("write_initial_conditions", Boolean.toString(defaults.write_initial_conditions));
    values.put("always_compute_aux_before_printing", Boolean.toString(defaults.always_compute_aux_before_printing));
    String ret = Fill(TEMPLATE, values);
    logger.debug("Generated {} lines of C++ for {}", ret.lines().count(), programName);
    return ret;
  }

  /** C++ identifiers of the layout's fields and their qualification inside f(). */
  private static class Fields {
    final SimulationLayout layout;
    final Map<String, String> renames;

    Fields(SimulationLayout layout, Map<String, String> renames) {
      this.layout = layout;
      this.renames = renames;
    }

    String cpp(String name) { return renames.getOrDefault(name, name); }

    List<String> cpp(List<String> names) { return names.stream().map(this::cpp).collect(Collectors.toList()); }

    String qualified(String name) {
      SimulationLayout.Slot slot = layout.lookup(name).get();
      String record = slot.storage() == SimulationLayout.Storage.STATE ? STATE : (slot.storage() == SimulationLayout.Storage.AUX ? AUX : CONSTANTS);
      return record + "." + cpp(name);
    }
  }

  private String Indent(int level) { return indent.repeat(level); }

  private String Lines(List<String> lines, int level) {
    if (lines.isEmpty())
      return Indent(level) + Comment("none");
    return lines.stream().map(line -> line.isEmpty() ? line : Indent(level) + line).collect(Collectors.joining("\n"));
  }

  private String Declare(String type, List<String> names, int level) {
    if (names.isEmpty())
      return Indent(level) + Comment("none");
    return Indent(level) + type + " " + String.join(", ", names) + ";";
  }

  private static String StringList(List<String> names) {
    return names.stream().map(name -> "\"" + name + "\"").collect(Collectors.joining(", "));
  }

  private String ByName(List<String> names, Fields fields, int level) {
    return Lines(names.stream().map(name -> "if(" + LOOKUP + " == \"" + name + "\") return &" + fields.cpp(name) + ";").collect(Collectors.toList()),
                 level);
  }

  private String ConstantFields(SimulationLayout layout, Fields fields) {
    List<String> lines = new ArrayList<>();
    for (var entry : layout.constantValues().entrySet())
      lines.add("double " + fields.cpp(entry.getKey()) + " = " + FormatNumber(entry.getValue()) + ";");
    return Lines(lines, 1);
  }

  private String StateOperators(List<String> names) {
    StringBuilder ret = new StringBuilder();
    String[][] operators = {{"+", stateType, "true"}, {"*", stateType, "true"}, {"*", "double", "false"}};
    for (String[] op : operators) {
      boolean componentwise = Boolean.parseBoolean(op[2]);
      ret.append(Indent(1)).append(stateType).append(" operator").append(op[0]).append("(const ").append(op[1]).append(" &_other) const {\n");
      ret.append(Indent(2)).append(stateType).append(" _r;\n");
      for (String name : names)
        ret.append(Indent(2)).append("_r.").append(name).append(" = ").append(name).append(' ').append(op[0]).append(" _other")
            .append(componentwise ? "." + name : "").append(";\n");
      ret.append(Indent(2)).append("return _r;\n");
      ret.append(Indent(1)).append("}\n");
    }
    return ret.toString().stripTrailing();
  }

  /** Prints an operand in C syntax, numbers as floating point literals. */
  private String Expression(Operand operand) {
    if (operand instanceof Num)
      return FormatNumber(((Num)operand).value());
    Term term = (Term)operand;
    if (term.isVariable())
      return term.head();
    return term.head() + term.tail().stream().map(this::Expression).collect(Collectors.joining(dictionary.get(DictWords.separator), "(", ")"));
  }

  private Term ToCpp(Term rhs, Fields fields) {
    return rhs.mapVariables(fields::qualified).mapTerms(head -> "dda::" + FunctionName(Element.fromSerialName(head).get()));
  }

  private String Sum(List<Operand> inputs, Fields fields) {
    if (inputs.isEmpty())
      return "0.0";
    return inputs.stream().map(input -> input instanceof Term ? fields.qualified(((Term)input).head()) : Expression(input))
        .collect(Collectors.joining(" + ", "(", ")"));
  }

  private List<String> Equations(SimulationLayout layout, Fields fields) {
    List<String> ret = new ArrayList<>();
    int section = 1;
    for (var group : layout.classification().ordering().entrySet()) {
      if (group.getKey() == Classification.Group.CONSTANTS)
        continue;
      ret.add(Comment(section++ + ". " + Description(group.getKey())));
      List<SimulationLayout.Statement> statements = layout.statements(group.getKey());
      if (statements.isEmpty())
        ret.add(Comment("none"));
      for (SimulationLayout.Statement statement : statements) {
        if (group.getKey() == Classification.Group.EVOLVED)
          ret.addAll(Derivative(layout.evolution(statement.target()).get(), fields));
        else
          ret.add(Assign(AUX + "." + fields.cpp(statement.target()), Expression(ToCpp(statement.rhs(), fields))));
      }
    }
    return ret;
  }

  private static String Description(Classification.Group group) {
    switch (group) {
    case CONSTANTS:
      return "Explicit constants";
    case AUX_SORTED:
      return "Topologically sorted aux variables";
    case AUX_CYCLIC:
      return "Cyclic aux variables (best-effort order)";
    case EVOLVED:
      return "State variable changes (dqdt)";
    case AUX_UNNEEDED:
      return "Aux variables not needed for dqdt (output only)";
    default:
      throw new IllegalArgumentException("Unknown group " + group);
    }
  }

  private List<String> Derivative(SimulationLayout.Evolution evolution, Fields fields) {
    String name = fields.cpp(evolution.name());
    if (evolution.element() == Element.INT) {
      String args = evolution.inputs().stream().map(input -> input instanceof Term ? fields.qualified(((Term)input).head()) : Expression(input))
                        .collect(Collectors.joining(", "));
      return List.of(Assign(DQDT + "." + name, "dda::Int(" + args + ")"));
    }
    String last = fields.cpp(evolution.lastInput().get());
    return List.of("{",
                   Indent(1) + "const double _du = " + Sum(evolution.inputs(), fields) + " - " + STATE + "." + last + ";",
                   Indent(1) + Assign(DQDT + "." + last, "_du / _dt." + last),
                   Indent(1) + Assign(DQDT + "." + name, "(-_du / _dt." + name + " - " + STATE + "." + name + ") / _dt." + name),
                   "}");
  }

  private String ConstantOperand(Operand operand, double value, Fields fields) {
    if (operand instanceof Term && ((Term)operand).isVariable())
      return CONSTANTS + "." + fields.cpp(((Term)operand).head());
    return FormatNumber(value);
  }

  private List<String> InitData(SimulationLayout layout, Fields fields) {
    List<String> ret = new ArrayList<>();
    for (SimulationLayout.Evolution evolution : layout.evolutions()) {
      String name = fields.cpp(evolution.name());
      ret.add(Assign("_initial." + name, ConstantOperand(evolution.initial(), evolution.initialValue(), fields)));
      ret.add(Assign("_dt." + name, ConstantOperand(evolution.step(), evolution.stepValue(), fields)));
    }
    return ret;
  }

  private List<String> Prime(SimulationLayout layout, Fields fields) {
    List<String> ret = new ArrayList<>();
    for (SimulationLayout.Evolution evolution : layout.evolutions()) {
      if (evolution.lastInput().isEmpty())
        continue;
      String last = fields.cpp(evolution.lastInput().get());
      ret.add(Assign("_dt." + last, "_dt." + fields.cpp(evolution.name())));
      ret.add(Assign(STATE + "." + last, Sum(evolution.inputs(), fields)));
    }
    return ret;
  }

  /** The switch over all Runge-Kutta schemes, generated from their tableaux. */
  private String Integrate() {
    StringBuilder ret = new StringBuilder();
    for (RungeKutta scheme : RungeKutta.values()) {
      ret.append(Indent(1)).append("case ").append(scheme.order).append(":\n");
      ret.append(Indent(2)).append(Comment(scheme.description)).append('\n');
      for (int i = 0; i < scheme.stages(); ++i) {
        StringBuilder arg = new StringBuilder(STATE);
        for (int j = 0; j < i; ++j) {
          double a = scheme.a(i, j);
          if (a != 0.0)
            arg.append(" + _dt*k").append(j + 1).append('*').append(FormatNumber(a));
        }
        ret.append(Indent(2)).append("f(").append(arg).append(", k").append(i + 1).append(", ").append(AUX).append(");\n");
      }
      StringBuilder incr = new StringBuilder();
      for (int i = 0; i < scheme.stages(); ++i)
        incr.append(i == 0 ? "" : " + ").append('k').append(i + 1).append('*').append(FormatNumber(scheme.b(i)));
      ret.append(Indent(2)).append(STATE).append(" = ").append(STATE).append(" + (").append(incr).append(")*_dt;\n");
      ret.append(Indent(2)).append("break;\n");
    }
    return ret.toString().stripTrailing();
  }

  private static String Fill(String template, Map<String, String> values) {
    String ret = template;
    for (var entry : values.entrySet())
      ret = ret.replace("${" + entry.getKey() + "}", entry.getValue());
    return ret;
  }

  private static final String ELEMENTS_IMPL = """
      #define A constexpr double
      #define D template<typename... T> A
      A Const(double a) { return a; }
      A neg(double a) { return -a; }
      A Div(double a, double b) { return a/b; }
      D Int(T... a) { return -(a + ...); }
      D sum(T... a) { return -(a + ...); }
      D mult(T... a) { return (a * ...); }
      A dead_upper(double a, double b) { return a > b ? (a-b) : 0; }
      A dead_lower(double a, double b) { return a < b ? (a-b) : 0; }
      A min(double a, double b) { return a < b ? a : b; }
      A max(double a, double b) { return a > b ? a : b; }
      A lt(double a, double b, double c, double d) { return a <  b ? c : d; }
      A le(double a, double b, double c, double d) { return a <= b ? c : d; }
      A gt(double a, double b, double c, double d) { return a >  b ? c : d; }
      A ge(double a, double b, double c, double d) { return a >= b ? c : d; }
      inline double sqrt(double a) { return std::sqrt(a); }
      A abs(double a) { return a < 0 ? -a : a; }
      inline double exp(double a) { return std::exp(a); }
      A floor(double a) { return (long long)(a); }
      A sign(double a) { return a > 0 ? 1 : (a < 0 ? -1 : 0); }
      inline double sin(double a) { return std::sin(a); }
      inline double cos(double a) { return std::cos(a); }
      inline double arcsin(double a) { return std::asin(a); }
      A logical_xor(double a, double b) { return (a > 0) != (b > 0) ? 1 : 0; }
      inline double noise(double a) { return a * (2.0 * std::rand() / RAND_MAX - 1.0); }
      inline double funcgen(double a, double omega, double phi) { return a * std::sin(omega * ::simulation_time + phi); }
      #undef D
      #undef A""";

  private static final String TEMPLATE = """
      // Generated by ddac from ${program}. Build with: g++ --std=c++17 -O2 -o ${program} ${program}.cpp

      #include <cmath>
      #include <cfenv>
      #include <cstdio>
      #include <cstdlib>
      #include <limits>
      #include <vector>
      #include <string>
      #include <sstream>
      #include <algorithm>
      #include <map>
      #include <utility>
      #include <iostream>

      bool debug;
      double simulation_time = 0.0;
      constexpr double _nan_ = std::numeric_limits<double>::signaling_NaN();

      namespace dda {
      ${impl}
      } // end namespace dda

      // Time-evolved variables, the actual state (dq/dt != 0)
      struct ${state_type} {
      ${state_fields}
      ${state_operators}
          const double* byName(const std::string& _name_) const {
      ${state_by_name}
              return nullptr;
          }
      };

      // Auxiliary variables, derived from ${state_type}, not evolved in time
      struct ${aux_type} {
      ${aux_fields}
          void set_to_nan() {
      ${aux_set_to_nan}
          }
          const double* byName(const std::string& _name_) const {
      ${aux_by_name}
              return nullptr;
          }
      };

      // Explicit constants, overridable at program start
      struct ${const_type} {
      ${const_fields}
          const double* byName(const std::string& _name_) const {
      ${const_by_name}
              return nullptr;
          }
      } _constants;

      static const std::vector<std::string> state_names = { ${state_names} };
      static const std::vector<std::string> aux_names = { ${aux_names} };
      static const std::vector<std::string> const_names = { ${const_names} };
      static const std::vector<std::string> all_variables = { ${all_variables} };

      ${state_type} _initial, _dt;
      double clock_step = 1.0;

      /// Computes _dqdt = f(_state). _aux is filled along the way.
      void f(${state_type} const &_state, ${state_type} &_dqdt, ${aux_type} &_aux) {
          if(debug) _aux.set_to_nan();
      ${equations}
      }

      /// Computes the aux variables of a state, for consistent printing.
      void compute_aux(${state_type} const &_state, ${aux_type} &_aux) {
          ${state_type} _dummy_dqdt;
          f(_state, _dummy_dqdt, _aux);
      }

      /// Initial values and step sizes, after constant overrides.
      void init_data() {
      ${init_data}
      }

      /// Hidden differentiator fields start from the current input.
      void prime(${state_type} &_state) {
          ${aux_type} _aux;
          compute_aux(_state, _aux);
      ${prime}
          clock_step = std::numeric_limits<double>::infinity();
          for(auto const& name : state_names) clock_step = std::min(clock_step, *_dt.byName(name));
          if(state_names.empty()) clock_step = 1.0;
      }

      void integrate(${state_type} &_state, ${aux_type} &_aux, int rk_order) {
          ${state_type} k1, k2, k3, k4;
          switch(rk_order) {
      ${integrate}
          default:
              std::cerr << "ERR: rk_order must be between 1 and 4" << std::endl;
              exit(-42);
          }
          simulation_time += clock_step;
      }

      struct csv_writer {
          std::vector<std::string> query_variables;
          bool write_initial_conditions, always_compute_aux_before_printing, binary_output;

          const char* sep(size_t i) const { return (i != query_variables.size() ? "\\t" : "\\n"); }

          void write_header() const {
              if(binary_output) return;
              for(size_t i = 0; i < query_variables.size();)
                  std::cout << query_variables[i++] << sep(i);
          }

          void write_line(const ${state_type} &_state, const ${aux_type} &_aux) const {
              ${aux_type} recomputed_aux;
              const ${aux_type} *actual_aux = &_aux;
              if(always_compute_aux_before_printing) {
                  compute_aux(_state, recomputed_aux);
                  actual_aux = &recomputed_aux;
              }
              for(size_t i = 0; i < query_variables.size(); i++) {
                  const double* lookup = nullptr;
                  const std::string& var = query_variables[i];
                  if(!lookup) lookup = _state.byName(var);
                  if(!lookup) lookup = actual_aux->byName(var);
                  if(!lookup) lookup = _constants.byName(var);
                  if(!lookup) { std::cerr << "Lookup failed: " << var << std::endl; exit(-123); }
                  if(binary_output) std::cout.write(reinterpret_cast<const char*>(lookup), sizeof(double));
                  else std::cout << *lookup << sep(i+1);
              }
          }
      } writer;

      ${state_type} simulate_dda(${state_type} initial, int max_iterations, int modulo_write, int rk_order) {
          ${state_type} _state = initial;
          ${aux_type} _aux;

          if(debug) {
      #ifdef _GNU_SOURCE
              feenableexcept(FE_DIVBYZERO | FE_INVALID | FE_OVERFLOW);
      #else
              std::cerr << "Warning: floating point exceptions not supported on this platform" << std::endl;
      #endif
          }

          writer.write_header();
          if(writer.write_initial_conditions) {
              _aux.set_to_nan();
              writer.write_line(_state, _aux);
          }
          for(int iter = 0; iter < max_iterations; iter++) {
              integrate(_state, _aux, rk_order);
              if(iter % modulo_write == 0)
                  writer.write_line(_state, _aux);
          }
          return _state;
      }

      using namespace std;

      static bool unprefix(string& str, const string& prefix) {
          bool is_prefixed = !str.compare(0, prefix.size(), prefix);
          if(is_prefixed) str = str.substr(prefix.size());
          return is_prefixed;
      }

      static double extract(const string& key, const string& value) {
          double target;
          istringstream ss(value); ss >> target;
          if(ss.fail()) { cerr << "ERR: Not a number for " << key << ": " << value << endl; exit(-4); }
          return target;
      }

      static void list_group(const char* title, const vector<string>& names) {
          cout << "# " << title << endl;
          for(auto const& name : names) cout << name << endl;
      }

      int main(int argc, char** argv) {
          map<string, int> numbers;
          numbers["max_iterations"] = ${max_iterations};
          numbers["modulo_write"] = ${modulo_write};
          numbers["rk_order"] = ${rk_order};
          numbers["number_precision"] = 10;

          map<string, bool> flags;
          flags["debug"] = false;
          flags["list_all_variables"] = false;
          flags["write_initial_conditions"] = ${write_initial_conditions};
          flags["always_compute_aux_before_printing"] = ${always_compute_aux_before_printing};
          flags["binary_output"] = ${binary_output};

          vector<pair<string, double>> initial_overrides, dt_overrides, const_overrides;

          vector<string> args(argv + 1, argv + argc);
          for(auto arg : args) {
              if(arg == "--help") {
                  cerr << "Usage: " << argv[0] << " [arguments] <variables_to_print>" << endl;
                  cerr << "* Boolean arguments (--foo, --foo=1 or --foo=0)" << endl;
                  for(auto const& [key, val] : flags) cerr << "  " << key << " (default: " << val << ")" << endl;
                  cerr << "* Numeric arguments (--foo=123)" << endl;
                  for(auto const& [key, val] : numbers) cerr << "  " << key << " (default: " << val << ")" << endl;
                  cerr << "* Overrides: --initial:<state>=<value> --dt:<state>=<value> --const:<constant>=<value>" << endl;
                  cerr << "* Query fields (all if none given): list them with --list_all_variables" << endl;
                  exit(-1);
              }
              if(unprefix(arg, "--")) {
                  size_t eq = arg.find('=');
                  string key = arg.substr(0, eq);
                  string value = eq == string::npos ? "1" : arg.substr(eq + 1);
                  if(unprefix(key, "initial:")) initial_overrides.emplace_back(key, extract(key, value));
                  else if(unprefix(key, "dt:")) dt_overrides.emplace_back(key, extract(key, value));
                  else if(unprefix(key, "const:")) const_overrides.emplace_back(key, extract(key, value));
                  else if(numbers.count(key)) numbers[key] = (int)extract(key, value);
                  else if(flags.count(key)) flags[key] = extract(key, value) != 0;
                  else {
                      cerr << "ERR: Illegal argument: " << arg << endl << "ERR: Try --help" << endl;
                      exit(-3);
                  }
              } else if(find(all_variables.begin(), all_variables.end(), arg) != all_variables.end()) {
                  writer.query_variables.push_back(arg);
              } else {
                  cerr << "ERR: Illegal argument: " << arg << endl << "ERR: It is not a variable. Try --list_all_variables" << endl;
                  exit(-2);
              }
          }

          if(flags["list_all_variables"]) {
              list_group("state", state_names);
              list_group("aux", aux_names);
              list_group("constants", const_names);
              exit(0);
          }

          for(auto const& [name, value] : const_overrides) {
              const double* slot = _constants.byName(name);
              if(!slot) { cerr << "ERR: No constant named " << name << endl; exit(-2); }
              *const_cast<double*>(slot) = value;
          }
          init_data();
          for(auto const& [name, value] : initial_overrides) {
              const double* slot = _initial.byName(name);
              if(!slot) { cerr << "ERR: No state variable named " << name << endl; exit(-2); }
              *const_cast<double*>(slot) = value;
          }
          for(auto const& [name, value] : dt_overrides) {
              const double* slot = _dt.byName(name);
              if(!slot) { cerr << "ERR: No state variable named " << name << endl; exit(-2); }
              *const_cast<double*>(slot) = value;
          }
          prime(_initial);

          if(writer.query_variables.empty())
              writer.query_variables = all_variables;
          cout.precision(numbers["number_precision"]);
          debug = flags["debug"];
          writer.write_initial_conditions = flags["write_initial_conditions"];
          writer.always_compute_aux_before_printing = flags["always_compute_aux_before_printing"];
          writer.binary_output = flags["binary_output"];

          simulate_dda(_initial, numbers["max_iterations"], numbers["modulo_write"], numbers["rk_order"]);
      }
      """;
}

package ddac.backend;

import ddac.CompileException;
import ddac.Compilation;
import ddac.DDAC;
import ddac.frontend.DdaReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SimulatorTest {

  static final String DECAY = "y = int(mult(-1, neg(y)), 0.05, -1)\n";

  static final String SCALED = """
      k = const(1)
      y = int(mult(k, y), 0.05, 1)
      """;

  static Compilation compile(String text) throws CompileException { return new DDAC().Compile("test", DdaReader.parse(text)); }

  static SimulationOptions iterations(int n) {
    SimulationOptions ret = new SimulationOptions();
    ret.max_iterations = n;
    return ret;
  }

  @Test
  void testExponentialDecay() throws CompileException {
    Compilation c = compile(DECAY);
    double y = new Simulator(iterations(60)).Simulate(c.layout(), List.of("y"))[0];
    double exact = -Math.exp(-3.0);
    Assertions.assertEquals(0.0, (y - exact) / exact, 0.1, "y(3) = " + y);
    // Euler on y' = -y multiplies by (1 - dt) per step
    Assertions.assertEquals(-Math.pow(0.95, 60), y, 1e-12);
  }

  @ParameterizedTest
  @ValueSource(ints = {2, 3, 4})
  void testHigherOrders(int order) throws CompileException {
    SimulationOptions options = iterations(60);
    options.rk_order = order;
    double y = new Simulator(options).Simulate(compile(DECAY).layout(), List.of("y"))[0];
    Assertions.assertEquals(-Math.exp(-3.0), y, 1e-3);
  }

  @Test
  void testTextOutput() throws CompileException {
    SimulationOptions options = iterations(5);
    options.modulo_write = 2;
    options.query_variables.add("y");
    String text = new Simulator(options).Generate(compile(DECAY));
    List<String> lines = text.lines().toList();
    Assertions.assertEquals("y", lines.get(0));
    // rows after steps 1, 3 and 5
    Assertions.assertEquals(4, lines.size());
    Assertions.assertEquals(-Math.pow(0.95, 5), Double.parseDouble(lines.get(3)), 1e-12);
  }

  @Test
  void testDefaultColumns() throws CompileException {
    String text = new Simulator(iterations(1)).Generate(compile(DECAY));
    Assertions.assertEquals("mult_1\tneg_1\ty", text.lines().findFirst().get());
  }

  @Test
  void testInitialConditionsRow() throws CompileException {
    SimulationOptions options = iterations(2);
    options.write_initial_conditions = true;
    options.query_variables.add("y");
    List<String> lines = new Simulator(options).Generate(compile(DECAY)).lines().toList();
    Assertions.assertEquals(4, lines.size());
    Assertions.assertEquals(-1.0, Double.parseDouble(lines.get(1)));
  }

  @Test
  void testBinaryOutput() throws CompileException, IOException {
    SimulationOptions options = iterations(3);
    options.binary_output = true;
    options.query_variables.add("y");
    options.query_variables.add("neg_1");
    Simulator sim = new Simulator(options);
    Assertions.assertEquals("bin", sim.FileExtension());
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    sim.Write(compile(DECAY), out);
    Assertions.assertEquals(3 * 2 * Double.BYTES, out.size());
    DataInputStream in = new DataInputStream(new ByteArrayInputStream(out.toByteArray()));
    double y = 0.0;
    double neg = 0.0;
    for (int row = 0; row < 3; ++row) {
      y = in.readDouble();
      neg = in.readDouble();
    }
    Assertions.assertEquals(-Math.pow(0.95, 3), y, 1e-12);
    // aux recomputed before printing
    Assertions.assertEquals(-y, neg, 1e-12);
  }

  @Test
  void testListVariables() throws CompileException {
    SimulationOptions options = new SimulationOptions();
    options.list_all_variables = true;
    String text = new Simulator(options).Generate(compile(SCALED));
    Assertions.assertEquals("# state\ny\n# aux\nmult_1\n# constants\nk\n", text);
  }

  @Test
  void testOverrides() throws CompileException {
    Compilation c = compile(SCALED);
    SimulationOptions options = iterations(60);
    options.set("initial:y=2");
    options.set("const:k=2");
    double y = new Simulator(options).Simulate(c.layout(), List.of("y"))[0];
    Assertions.assertEquals(2 * Math.pow(0.9, 60), y, 1e-9);

    SimulationOptions step = iterations(30);
    step.set("dt:y=0.1");
    Assertions.assertEquals(Math.pow(0.9, 30), new Simulator(step).Simulate(c.layout(), List.of("y"))[0], 1e-9);
  }

  @Test
  void testConstantStepSize() throws CompileException {
    Compilation c = compile("""
        h = const(0.1)
        y = int(y, h, 1)
        """);
    SimulationOptions options = iterations(10);
    options.set("const:h=0.05");
    Assertions.assertEquals(Math.pow(0.95, 10), new Simulator(options).Simulate(c.layout(), List.of("y"))[0], 1e-12);
  }

  @Test
  void testBadOverrides() throws CompileException {
    Compilation c = compile(SCALED);
    SimulationOptions initial = iterations(1);
    initial.set("initial:k=1");
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Simulator(initial).Simulate(c.layout(), List.of("y")));
    SimulationOptions constant = iterations(1);
    constant.set("const:y=1");
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Simulator(constant).Simulate(c.layout(), List.of("y")));
    SimulationOptions query = iterations(1);
    query.query_variables.add("nothing");
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Simulator(query).Generate(c));
  }

  @Test
  void testDifferentiator() throws CompileException {
    Compilation c = compile("""
        x = int(-1, 0.01, 0)
        d = diff(x, 0.01, 0)
        """);
    Assertions.assertTrue(c.layout().isHidden("d" + SimulationLayout.LAST_INPUT_SUFFIX));
    Map<String, Double> values = new Simulator(iterations(10)).FinalValues(c.layout());
    Assertions.assertEquals(List.of("d", "x"), List.copyOf(values.keySet()));
    Assertions.assertEquals(0.1, values.get("x"), 1e-12);
    // the differentiator is sign inverting
    Assertions.assertEquals(-1.0, values.get("d"), 1e-9);
  }

  @Test
  void testElements() throws CompileException {
    Compilation c = compile("""
        t  = int(-1, 0.5, 0)
        a  = sum(t, 1)
        m  = mult(t, t, 2)
        q  = div(t, 4)
        du = dead_upper(t, 0.5)
        dl = dead_lower(t, 2)
        mn = min(t, 0.5)
        mx = max(t, 0.5)
        l  = lt(t, 2, 10, 20)
        g  = ge(t, 2, 10, 20)
        s  = sqrt(t)
        ab = abs(neg(t))
        f  = floor(sum(-2.5))
        sg = sign(neg(t))
        x  = logical_xor(t, -1)
        z  = noise(0)
        fg = funcgen(2, 0, 1.5707963267948966)
        """);
    Map<String, Double> v = new Simulator(iterations(2)).FinalValues(c.layout());
    Assertions.assertEquals(1.0, v.get("t"), 1e-15);
    Assertions.assertEquals(-2.0, v.get("a"), 1e-15);
    Assertions.assertEquals(2.0, v.get("m"), 1e-15);
    Assertions.assertEquals(0.25, v.get("q"), 1e-15);
    Assertions.assertEquals(0.5, v.get("du"), 1e-15);
    Assertions.assertEquals(-1.0, v.get("dl"), 1e-15);
    Assertions.assertEquals(0.5, v.get("mn"), 1e-15);
    Assertions.assertEquals(1.0, v.get("mx"), 1e-15);
    Assertions.assertEquals(10.0, v.get("l"), 1e-15);
    Assertions.assertEquals(20.0, v.get("g"), 1e-15);
    Assertions.assertEquals(1.0, v.get("s"), 1e-15);
    Assertions.assertEquals(1.0, v.get("ab"), 1e-15);
    Assertions.assertEquals(2.0, v.get("f"), 1e-15);
    Assertions.assertEquals(-1.0, v.get("sg"), 1e-15);
    Assertions.assertEquals(1.0, v.get("x"), 1e-15);
    Assertions.assertEquals(0.0, v.get("z"), 1e-15);
    Assertions.assertEquals(2.0, v.get("fg"), 1e-12);
  }

  @Test
  void testTextIsUtf8() throws CompileException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    new Simulator(iterations(1)).Write(compile(DECAY), out);
    Assertions.assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("mult_1"));
  }
}

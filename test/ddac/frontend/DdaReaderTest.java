package ddac.frontend;

import ddac.CompileException;
import ddac.analysis.Linearizer;
import java.util.EnumSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DdaReaderTest {

  static final String DECAY = """
      # exponential decay
      dt = const(0.05)

      y  = int(mult(-1, neg(y)), dt, -1)   # feedback through the integrator
      """;

  @Test
  void testParse() throws CompileException {
    EquationSet eqs = DdaReader.parse(DECAY);
    Assertions.assertEquals(2, eqs.size());
    Assertions.assertEquals(Term.of("const", 0.05), eqs.rhs("dt").get());
    Assertions.assertEquals(Term.of("int", Term.of("mult", -1, Term.of("neg", Term.var("y"))), Term.var("dt"), -1), eqs.rhs("y").get());
  }

  @Test
  void testNumbersAndSemicolons() throws CompileException {
    EquationSet eqs = DdaReader.parse("a = sum(1e-3, -2.5E+2, +4, .5);\nb = a\n");
    Assertions.assertEquals(Term.of("sum", 1e-3, -250, 4, 0.5), eqs.rhs("a").get());
    Assertions.assertEquals(Term.var("a"), eqs.rhs("b").get());
  }

  @ParameterizedTest
  @ValueSource(strings = {"x = 3", "x = sum(1, 2", "x sum(1)", "x = sum()", "x = sum(1) y", "x = a\nx = b", "= sum(1)"})
  void testSyntaxErrors(String text) {
    CompileException e = Assertions.assertThrows(CompileException.class, () -> DdaReader.parse(text));
    Assertions.assertEquals(CompileException.Kind.SYNTAX, e.getKind());
  }

  @Test
  void testErrorPosition() {
    CompileException e = Assertions.assertThrows(CompileException.class, () -> DdaReader.parse("a = const(1)\nb = sum(a,, 1)\n"));
    Assertions.assertTrue(e.getMessage().contains("Line 2"), e.getMessage());
  }

  @Test
  void testUnknownElement() {
    CompileException e = Assertions.assertThrows(CompileException.class, () -> DdaReader.parse("a = const(1)\n\nb = tanh(a)\n"));
    Assertions.assertEquals(CompileException.Kind.UNKNOWN_VOCABULARY, e.getKind());
    Assertions.assertTrue(e.getMessage().contains("Line 3"), e.getMessage());
    Assertions.assertTrue(e.getMessage().contains("tanh"), e.getMessage());
  }

  @Test
  void testRestrictedVocabulary() throws CompileException {
    DdaReader reader = new DdaReader(Vocabulary.of(EnumSet.of(Element.INT, Element.CONST)));
    Assertions.assertEquals(1, reader.read("y = int(y, 0.1, 1)").size());
    CompileException e = Assertions.assertThrows(CompileException.class, () -> reader.read("y = int(neg(y), 0.1, 1)"));
    Assertions.assertEquals(CompileException.Kind.UNKNOWN_VOCABULARY, e.getKind());
  }

  @Test
  void testWriterFormat() {
    EquationSet eqs = new EquationSet().put("dt", Term.of("const", 0.05)).put("long_name", Term.of("neg", Term.var("dt")));
    String text = new DdaWriter("header line").format(eqs);
    Assertions.assertEquals("# header line\n\ndt        = const(0.05)\nlong_name = neg(dt)\n", text);
  }

  @ParameterizedTest
  @ValueSource(booleans = {false, true})
  void testRoundTrip(boolean strict) throws CompileException {
    String text = """
        k   = const(2)
        x   = int(v, 0.01, 1)
        v   = int(mult(k, x), sum(0.005, 0.005), 0)
        e   = sum(mult(x, x), mult(k, v, v), -1.5e-7)
        out = lt(e, 0, x, neg(x))
        """;
    EquationSet lin = new Linearizer(strict).linearize(DdaReader.parse(text));
    Assertions.assertEquals(lin, DdaReader.parse(DdaWriter.write(lin)));
  }
}

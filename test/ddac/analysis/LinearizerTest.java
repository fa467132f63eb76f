package ddac.analysis;

import ddac.CompileException;
import ddac.frontend.EquationSet;
import ddac.frontend.Operand;
import ddac.frontend.Term;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LinearizerTest {

  static Term v(String name) { return Term.var(name); }

  @Test
  void testHoistsNestedTerms() throws CompileException {
    EquationSet eqs = new EquationSet().put("y", Term.of("int", Term.of("mult", -1, Term.of("neg", v("y"))), 0.05, -1));
    EquationSet lin = new Linearizer().linearize(eqs);
    EquationSet expected = new EquationSet()
                               .put("y", Term.of("int", v("mult_1"), 0.05, -1))
                               .put("mult_1", Term.of("mult", -1, v("neg_1")))
                               .put("neg_1", Term.of("neg", v("y")));
    Assertions.assertEquals(expected, lin);
    Assertions.assertTrue(Linearizer.isLinear(lin));
    Assertions.assertFalse(Linearizer.isLinear(eqs));
  }

  @Test
  void testReusesExistingEquation() throws CompileException {
    EquationSet eqs = new EquationSet()
                          .put("a", Term.of("neg", v("x")))
                          .put("b", Term.of("sum", Term.of("neg", v("x")), 1))
                          .put("x", Term.of("const", 1));
    EquationSet lin = new Linearizer().linearize(eqs);
    Assertions.assertEquals(3, lin.size());
    Assertions.assertEquals(Term.of("sum", v("a"), 1), lin.rhs("b").get());
  }

  @Test
  void testSharesEqualSubterms() throws CompileException {
    EquationSet eqs = new EquationSet()
                          .put("a", Term.of("sum", Term.of("mult", v("x"), v("x")), 1))
                          .put("b", Term.of("sum", Term.of("mult", v("x"), v("x")), 2))
                          .put("x", Term.of("const", 3));
    EquationSet lin = new Linearizer().linearize(eqs);
    Assertions.assertEquals(4, lin.size());
    Assertions.assertEquals(Term.of("sum", v("mult_1"), 1), lin.rhs("a").get());
    Assertions.assertEquals(Term.of("sum", v("mult_1"), 2), lin.rhs("b").get());
  }

  @Test
  void testFreshNamesAvoidCollisions() throws CompileException {
    EquationSet eqs = new EquationSet()
                          .put("neg_1", Term.of("const", 2))
                          .put("y", Term.of("sum", Term.of("neg", v("x")), v("neg_1")))
                          .put("x", Term.of("const", 1));
    EquationSet lin = new Linearizer().linearize(eqs);
    Assertions.assertEquals(Term.of("neg", v("x")), lin.rhs("neg_1_").get());
    Assertions.assertEquals(Term.of("const", 2), lin.rhs("neg_1").get());
    Assertions.assertEquals(Term.of("sum", v("neg_1_"), v("neg_1")), lin.rhs("y").get());
  }

  @Test
  void testNameExhaustion() {
    EquationSet eqs = new EquationSet().put("y", Term.of("sum", Term.of("neg", v("x")), 1)).put("x", Term.of("const", 0));
    String taken = "neg_1";
    for (int i = 0; i <= Linearizer.MAX_NAME_ATTEMPTS; ++i) {
      eqs.put(taken, Term.of("const", i));
      taken += "_";
    }
    CompileException e = Assertions.assertThrows(CompileException.class, () -> new Linearizer().linearize(eqs));
    Assertions.assertEquals(CompileException.Kind.NAME_EXHAUSTION, e.getKind());
  }

  @Test
  void testReusesEquationIndependentOfNameOrder() throws CompileException {
    EquationSet eqs = new EquationSet()
                          .put("a", Term.of("sum", Term.of("mult", v("x"), Term.of("neg", v("y")))))
                          .put("b", Term.of("mult", v("x"), Term.of("neg", v("y"))))
                          .put("x", Term.of("const", 1))
                          .put("y", Term.of("const", 2));
    EquationSet lin = new Linearizer().linearize(eqs);
    Assertions.assertEquals(Term.of("sum", v("b")), lin.rhs("a").get());
    Assertions.assertEquals(Term.of("mult", v("x"), v("neg_1")), lin.rhs("b").get());
    Assertions.assertEquals(Term.of("neg", v("y")), lin.rhs("neg_1").get());
    Assertions.assertEquals(5, lin.size());
    // the same program under names sorting the other way round
    EquationSet swapped = eqs.mapVariables(name -> name.equals("a") ? "z" : name);
    Assertions.assertEquals(Term.of("sum", v("b")), new Linearizer().linearize(swapped).rhs("z").get());
  }

  @Test
  void testReusesEquationThroughResolvedValue() throws CompileException {
    EquationSet eqs = new EquationSet()
                          .put("a", Term.of("sum", Term.of("mult", Term.of("neg", v("y")), 2), 1))
                          .put("b", Term.of("mult", v("n"), 2))
                          .put("n", Term.of("neg", v("y")))
                          .put("y", Term.of("const", 2));
    EquationSet lin = new Linearizer().linearize(eqs);
    Assertions.assertEquals(Term.of("sum", v("b"), 1), lin.rhs("a").get());
    Assertions.assertEquals(4, lin.size());
  }

  @Test
  void testStrictSplitsEveryRoot() throws CompileException {
    EquationSet eqs = new EquationSet().put("y", Term.of("int", v("y"), 0.1, 1)).put("out", Term.of("mult", v("y"), 2));
    EquationSet lin = new Linearizer(true).linearize(eqs);
    Assertions.assertEquals(v("mult_1"), lin.rhs("out").get());
    Assertions.assertEquals(Term.of("mult", v("y"), 2), lin.rhs("mult_1").get());
    Assertions.assertEquals(v("int_1"), lin.rhs("y").get());
    Assertions.assertEquals(Term.of("int", v("y"), 0.1, 1), lin.rhs("int_1").get());
    Assertions.assertEquals(eqs.rhs("out").get(), new Linearizer(false).linearize(eqs).rhs("out").get());
  }

  @Test
  void testStrictFeedbackThroughIntegrators() throws CompileException {
    EquationSet eqs = new EquationSet()
                          .put("a", Term.of("int", v("b"), 0.1, 1))
                          .put("b", Term.of("int", v("a"), 0.1, 0))
                          .put("c", Term.of("mult", v("a"), 2));
    Linearizer linearizer = new Linearizer(true);
    EquationSet lin = linearizer.linearize(eqs);
    EquationSet expected = new EquationSet()
                               .put("a", v("int_1"))
                               .put("int_1", Term.of("int", v("b"), 0.1, 1))
                               .put("b", v("int_2"))
                               .put("int_2", Term.of("int", v("a"), 0.1, 0))
                               .put("c", v("mult_1"))
                               .put("mult_1", Term.of("mult", v("a"), 2));
    Assertions.assertEquals(expected, lin);
    Assertions.assertEquals(lin, linearizer.linearize(lin));
    Classification c = new VariableClassifier().classify(lin);
    Assertions.assertEquals(List.of("int_1", "int_2"), c.evolved());
    Assertions.assertTrue(c.auxCyclic().isEmpty());
  }

  @Test
  void testStrictKeepsAliasedRoot() throws CompileException {
    EquationSet eqs = new EquationSet().put("x", Term.of("neg", v("k"))).put("w", v("x")).put("k", Term.of("const", 1));
    EquationSet lin = new Linearizer(true).linearize(eqs);
    Assertions.assertEquals(Term.of("neg", v("k")), lin.rhs("x").get());
    Assertions.assertEquals(v("x"), lin.rhs("w").get());
    Assertions.assertEquals(v("const_1"), lin.rhs("k").get());
  }

  @Test
  void testInputNotModified() throws CompileException {
    EquationSet eqs = new EquationSet().put("y", Term.of("int", Term.of("neg", v("y")), 0.1, 1));
    EquationSet copy = new EquationSet(eqs);
    new Linearizer(true).linearize(eqs);
    Assertions.assertEquals(copy, eqs);
  }

  static final String[] HEADS = {"sum", "mult", "neg", "int", "max"};
  static final String[] VARS = {"a", "b", "c", "d", "e"};

  static Operand randomOperand(Random rand, int depth) {
    int pick = rand.nextInt(depth > 0 ? 4 : 2);
    if (pick == 0)
      return Term.operand(rand.nextInt(5) - 2);
    if (pick == 1)
      return v(VARS[rand.nextInt(VARS.length)]);
    List<Operand> tail = new ArrayList<>();
    int arity = 1 + rand.nextInt(3);
    for (int i = 0; i < arity; ++i)
      tail.add(randomOperand(rand, depth - 1));
    return new Term(HEADS[rand.nextInt(HEADS.length)], tail);
  }

  static EquationSet randomProgram(Random rand) {
    EquationSet ret = new EquationSet();
    for (String name : VARS) {
      Operand rhs = randomOperand(rand, 4);
      ret.put(name, rhs instanceof Term ? (Term)rhs : Term.of("const", rhs));
    }
    return ret;
  }

  @ParameterizedTest
  @ValueSource(longs = {3, 17, 99, 123456789, -42})
  void testIdempotent(long seed) throws CompileException {
    for (boolean strict : new boolean[] {false, true}) {
      EquationSet eqs = randomProgram(new Random(seed));
      Linearizer linearizer = new Linearizer(strict);
      EquationSet once = linearizer.linearize(eqs);
      Assertions.assertTrue(Linearizer.isLinear(once), once::toString);
      Assertions.assertEquals(once, linearizer.linearize(once), () -> "strict=" + strict + "\n" + once);
      for (String name : eqs.names())
        Assertions.assertTrue(once.contains(name));
    }
  }

  @RepeatedTest(32)
  void testIdempotent_random() throws CompileException {
    long seed = new Random().nextLong();
    try {
      testIdempotent(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testIdempotent with seed " + seed);
      throw t;
    }
  }

  @Test
  void testDeterministicNames() throws CompileException {
    EquationSet eqs = randomProgram(new Random(7));
    Assertions.assertEquals(new Linearizer().linearize(eqs), new Linearizer().linearize(new EquationSet(eqs)));
  }
}

package ddac.util;

import ddac.CompileException;
import ddac.frontend.EquationSet;
import ddac.frontend.Term;
import ddac.frontend.Vocabulary;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class IdentifiersTest {

  @ParameterizedTest
  @ValueSource(strings = {"x", "_", "mult_1", "A9", "__last"})
  void testValid(String name) {
    Assertions.assertTrue(Identifiers.isValid(name));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "1x", "a-b", "a b", "x'"})
  void testInvalid(String name) {
    Assertions.assertFalse(Identifiers.isValid(name));
  }

  @Test
  void testSanitize() throws CompileException {
    Assertions.assertEquals("ab", Identifiers.sanitize("a-b"));
    Assertions.assertEquals("_1x", Identifiers.sanitize("1x"));
    Assertions.assertEquals("y", Identifiers.sanitize("y"));
    CompileException e = Assertions.assertThrows(CompileException.class, () -> Identifiers.sanitize("--"));
    Assertions.assertEquals(CompileException.Kind.EMPTY_IDENTIFIER, e.getKind());
    Assertions.assertTrue(e.getMessage().contains("'--'"), e.getMessage());
  }

  @Test
  void testRenamingAvoidsCollisions() throws CompileException {
    Map<String, String> renames = Identifiers.renaming(List.of("x", "a-b", "ab"), Set.of());
    Assertions.assertEquals(Map.of("a-b", "ab_"), renames);
  }

  @Test
  void testRenamingReserved() throws CompileException {
    Map<String, String> renames = Identifiers.renaming(List.of("double", "double_", "y"), Set.of("double"));
    Assertions.assertEquals(Map.of("double", "double__"), renames);
  }

  @Test
  void testRenamingIsDeterministic() throws CompileException {
    Map<String, String> a = Identifiers.renaming(List.of("x.1", "x-1", "x1"), Set.of());
    Map<String, String> b = Identifiers.renaming(List.of("x1", "x-1", "x.1"), Set.of());
    Assertions.assertEquals(a, b);
    // sorted order: "x-1" before "x.1"
    Assertions.assertEquals("x1_", a.get("x-1"));
    Assertions.assertEquals("x1__", a.get("x.1"));
  }

  @Test
  void testNameExhaustion() {
    List<String> names = new ArrayList<>();
    names.add("a-b");
    for (int i = 0; i <= 64; ++i)
      names.add("ab" + "_".repeat(i));
    CompileException e = Assertions.assertThrows(CompileException.class, () -> Identifiers.renaming(names, Set.of()));
    Assertions.assertEquals(CompileException.Kind.NAME_EXHAUSTION, e.getKind());
  }

  @Test
  void testSanitizeEquations() throws CompileException {
    EquationSet eqs = new EquationSet().put("y", Term.of("int", Term.var("a-b"), 0.1, 0)).put("a-b", Term.of("neg", Term.var("y")));
    EquationSet sanitized = Identifiers.sanitize(eqs, Vocabulary.standard());
    Assertions.assertEquals(List.of("ab", "y"), sanitized.names());
    Assertions.assertEquals(Term.of("int", Term.var("ab"), 0.1, 0), sanitized.rhs("y").get());
    Assertions.assertEquals(Term.of("neg", Term.var("y")), sanitized.rhs("ab").get());
    // valid programs come back unchanged
    EquationSet valid = new EquationSet().put("y", Term.of("neg", Term.var("y")));
    Assertions.assertSame(valid, Identifiers.sanitize(valid, Vocabulary.standard()));
  }
}

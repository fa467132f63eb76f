package ddac.frontend;

import ddac.CompileException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads the traditional DDA notation:
 *
 * <pre>
 * # comment
 * dt = const(0.05)
 * y  = int(mult(-1, neg(y)), dt, -1)
 * </pre>
 *
 * One assignment per line. Heads are checked against the vocabulary passed in; an unknown head is reported as UNKNOWN_VOCABULARY
 * with the line it appears on.
 */
public class DdaReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Vocabulary vocabulary;
  private String text = "";
  private int pos = 0;
  private int line = 1;
  private int col = 1;

  public DdaReader(Vocabulary vocabulary) { this.vocabulary = vocabulary; }

  public DdaReader() { this(Vocabulary.standard()); }

  /** Parses DDA text using the standard vocabulary. */
  public static EquationSet parse(String text) throws CompileException { return new DdaReader().read(text); }

  public EquationSet read(Path file) throws CompileException {
    String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CompileException(CompileException.Kind.IO, "Cannot read " + file, e);
    }
    logger.debug("Reading DDA program {}", file);
    return read(content);
  }

  public synchronized EquationSet read(String text) throws CompileException {
    this.text = text;
    this.pos = 0;
    this.line = 1;
    this.col = 1;
    EquationSet ret = new EquationSet();
    skipBlank();
    while (peek() != -1) {
      int eqLine = line;
      String name = identifier();
      skipSpaces();
      expect('=');
      skipSpaces();
      Operand rhs = operand();
      if (!(rhs instanceof Term))
        throw error("Right-hand side of '" + name + "' must be a term, got the number " + rhs.toDda() + "; wrap it as const(...)");
      skipSpaces();
      if (peek() == ';')
        next();
      skipSpaces();
      if (peek() == '#')
        skipComment();
      if (peek() != -1 && peek() != '\n' && peek() != '\r')
        throw error("Expected end of line after the equation of '" + name + "'");
      if (ret.contains(name))
        throw new CompileException(CompileException.Kind.SYNTAX, String.format("Line %d: '%s' is assigned twice", eqLine, name));
      ret.put(name, (Term)rhs);
      logger.trace("Read {} = {}", name, rhs);
      skipBlank();
    }
    return ret;
  }

  private Operand operand() throws CompileException {
    int c = peek();
    if (c == '-' || c == '+' || c == '.' || Character.isDigit(c))
      return number();
    int startLine = line;
    String head = identifier();
    skipSpaces();
    if (peek() != '(')
      return Term.var(head);
    next();
    List<Operand> tail = new ArrayList<>();
    skipSpaces();
    if (peek() == ')')
      throw error("Empty argument list for '" + head + "'");
    while (true) {
      tail.add(operand());
      skipSpaces();
      int sep = next();
      if (sep == ')')
        break;
      if (sep != ',')
        throw error("Expected ',' or ')' in arguments of '" + head + "'");
      skipSpaces();
    }
    Term ret = new Term(head, tail);
    if (!vocabulary.contains(head))
      throw new CompileException(CompileException.Kind.UNKNOWN_VOCABULARY,
                                 String.format("Line %d: unknown computing element '%s' in %s", startLine, head, ret.toDda()));
    return ret;
  }

  private Num number() throws CompileException {
    int start = pos;
    if (peek() == '-' || peek() == '+')
      next();
    while (Character.isDigit(peek()) || peek() == '.')
      next();
    if (peek() == 'e' || peek() == 'E') {
      next();
      if (peek() == '-' || peek() == '+')
        next();
      while (Character.isDigit(peek()))
        next();
    }
    String literal = text.substring(start, pos);
    try {
      return new Num(Double.parseDouble(literal));
    } catch (NumberFormatException e) {
      throw error("Malformed number '" + literal + "'");
    }
  }

  private String identifier() throws CompileException {
    int start = pos;
    if (!isIdentifierStart(peek()))
      throw error("Expected an identifier");
    while (isIdentifierPart(peek()))
      next();
    return text.substring(start, pos);
  }

  private static boolean isIdentifierStart(int c) { return c != -1 && (Character.isLetter(c) || c == '_'); }
  private static boolean isIdentifierPart(int c) { return c != -1 && (Character.isLetterOrDigit(c) || c == '_'); }

  private void expect(char expected) throws CompileException {
    if (peek() != expected)
      throw error("Expected '" + expected + "'");
    next();
  }

  private void skipSpaces() {
    while (peek() == ' ' || peek() == '\t')
      next();
  }

  private void skipComment() {
    while (peek() != '\n' && peek() != -1)
      next();
  }

  /** Skips whitespace including line breaks, and comment lines. */
  private void skipBlank() {
    while (true) {
      int c = peek();
      if (c == '#')
        skipComment();
      else if (c != -1 && Character.isWhitespace(c))
        next();
      else
        return;
    }
  }

  private int peek() { return pos < text.length() ? text.charAt(pos) : -1; }

  private int next() {
    int c = peek();
    if (c == -1)
      return c;
    pos++;
    if (c == '\n') {
      line++;
      col = 1;
    } else
      col++;
    return c;
  }

  private CompileException error(String message) {
    String found = peek() == -1 ? "end of input" : "'" + (char)peek() + "'";
    return new CompileException(CompileException.Kind.SYNTAX, String.format("Line %d, column %d: %s (found %s)", line, col, message, found));
  }
}

package ddac.backend;

import ddac.CompileException;
import ddac.Compilation;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class of the back ends. Subclasses fill the {@link #dictionary} with their target syntax and translate a {@link Compilation}.
 */
public abstract class CodeBackend {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public enum DictWords {
    comment,
    assign,
    statement_end,
    separator
  }

  public EnumMap<DictWords, String> dictionary = new EnumMap<>(DictWords.class);

  /** printf format for numbers in generated text, null for the shortest exact form */
  public String numberFormat = null;

  public CodeBackend() {
    dictionary.put(DictWords.comment, "");
    dictionary.put(DictWords.assign, " = ");
    dictionary.put(DictWords.statement_end, "");
    dictionary.put(DictWords.separator, ", ");
  }

  /** Name of the target, as selected on the command line. */
  public abstract String Target();

  /** Extension of the output file, without dot. */
  public abstract String FileExtension();

  /**
   * Translates {@code compilation} onto {@code out}. The stream is not closed.
   * @throws CompileException IO if writing fails, or any compile error the back end detects
   */
  public abstract void Write(Compilation compilation, OutputStream out) throws CompileException;

  /** {@link #Write} into a String. */
  public String Generate(Compilation compilation) throws CompileException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Write(compilation, out);
    return out.toString(StandardCharsets.UTF_8);
  }

  protected static void WriteText(OutputStream out, String text) throws CompileException {
    try {
      out.write(text.getBytes(StandardCharsets.UTF_8));
      out.flush();
    } catch (IOException e) {
      throw new CompileException(CompileException.Kind.IO, "Writing output failed", e);
    }
  }

  protected String Comment(String text) { return dictionary.get(DictWords.comment) + " " + text; }

  protected String Assign(String lhs, String rhs) {
    return lhs + dictionary.get(DictWords.assign) + rhs + dictionary.get(DictWords.statement_end);
  }

  /** Formats a number so that it reads back as a floating point literal, without trailing zeros. */
  public String FormatNumber(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value))
      throw new IllegalArgumentException("Cannot emit non-finite number " + value);
    if (numberFormat == null)
      return Double.toString(value);
    String ret = String.format(Locale.ROOT, numberFormat, value);
    int exp = ret.indexOf('e');
    String mantissa = exp < 0 ? ret : ret.substring(0, exp);
    String exponent = exp < 0 ? "" : ret.substring(exp);
    if (mantissa.contains(".")) {
      mantissa = mantissa.replaceAll("0+$", "");
      if (mantissa.endsWith("."))
        mantissa += "0";
    } else
      mantissa += ".0";
    return mantissa + exponent;
  }
}

package ddac.backend;

import ddac.CompileException;
import ddac.Compilation;
import ddac.frontend.DdaWriter;
import java.io.OutputStream;

/** Emits the linearized program in traditional DDA notation, readable again by {@link ddac.frontend.DdaReader}. */
public class DdaBackend extends CodeBackend {

  public DdaBackend() { dictionary.put(DictWords.comment, "#"); }

  @Override
  public String Target() {
    return "dda";
  }

  @Override
  public String FileExtension() {
    return "dda";
  }

  @Override
  public void Write(Compilation compilation, OutputStream out) throws CompileException {
    var classification = compilation.classification();
    String header = String.format("Linearized from %s\nstate: %s\naux: %s\nconstants: %s", compilation.name(),
                                  String.join(" ", classification.evolved()), String.join(" ", classification.auxiliaries()),
                                  String.join(" ", classification.constants()));
    WriteText(out, new DdaWriter(header).format(compilation.linearized()));
  }
}

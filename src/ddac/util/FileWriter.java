package ddac.util;

import ddac.CompileException;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Collects generated files and writes them below an output directory.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: file relative path; insertion order is the write order */
  private final LinkedHashMap<String, byte[]> contents = new LinkedHashMap<>();
  private final String base_path;

  public FileWriter(String base_path) { this.base_path = base_path == null ? "." : base_path; }

  /**
   * Appends text to a file. The path string should be equal for all updates that target the same file.
   */
  public synchronized void UpdateContent(String file, String text) {
    byte[] previous = contents.getOrDefault(file, new byte[0]);
    byte[] added = text.getBytes(StandardCharsets.UTF_8);
    byte[] merged = new byte[previous.length + added.length];
    System.arraycopy(previous, 0, merged, 0, previous.length);
    System.arraycopy(added, 0, merged, previous.length, added.length);
    contents.put(file, merged);
  }

  /** Sets the content of a file, replacing earlier updates. */
  public synchronized void ReplaceContent(String file, byte[] content) { contents.put(file, content.clone()); }

  public synchronized Set<String> Files() { return Set.copyOf(contents.keySet()); }

  public synchronized byte[] Content(String file) {
    byte[] ret = contents.get(file);
    return ret == null ? null : ret.clone();
  }

  /**
   * Writes all registered files. Missing parent directories are created.
   * @throws CompileException IO on the first file that cannot be written
   */
  public synchronized void WriteFiles() throws CompileException {
    for (Map.Entry<String, byte[]> entry : contents.entrySet())
      WriteFile(entry.getKey(), entry.getValue());
  }

  private void WriteFile(String file, byte[] content) throws CompileException {
    File outFile = Paths.get(base_path, file).toFile();
    File parent = outFile.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.isDirectory() && !parent.mkdirs())
      throw new CompileException(CompileException.Kind.IO, "Cannot create directory " + parent);
    logger.info("Writing " + outFile.getPath());
    try (FileOutputStream out = new FileOutputStream(outFile)) {
      out.write(content);
    } catch (IOException e) {
      logger.fatal("File " + file + " could not be written");
      throw new CompileException(CompileException.Kind.IO, "Cannot write " + outFile, e);
    }
  }
}

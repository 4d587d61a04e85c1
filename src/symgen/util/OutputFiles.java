package symgen.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.codegen.OutputException;

/*
 * Owns the output streams of one run. Everything is written to <name>.tmp first and only moved onto the final
 * name by commit(), so a failed run leaves no truncated file behind.
 */
public class OutputFiles {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final String TMP_SUFFIX = ".tmp";

  private final Path directory;
  private final String basename;
  /** key: final path */
  private final Map<Path, PrintWriter> open = new LinkedHashMap<>();

  public OutputFiles(Path directory, String basename) {
    this.directory = directory;
    this.basename = basename;
  }

  public String getBasename() { return basename; }

  /** Final location of the file {@code <basename><suffix>}. */
  public Path pathOf(String suffix) { return directory.resolve(basename + suffix); }

  /**
   * Opens {@code <basename><suffix>} for writing.
   * @param suffix file name suffix including any dot, e.g. {@code ".py"} or {@code "_varmap.csv"}
   */
  public PrintWriter open(String suffix) throws OutputException {
    Path target = pathOf(suffix);
    if (open.containsKey(target))
      throw new OutputException("Output file opened twice: " + target);
    try {
      if (directory.toString().length() > 0)
        Files.createDirectories(directory);
      PrintWriter writer = new PrintWriter(Files.newBufferedWriter(temporary(target), StandardCharsets.UTF_8));
      open.put(target, writer);
      logger.trace("Opened {}", temporary(target));
      return writer;
    } catch (IOException e) {
      throw new OutputException("Could not create file: " + target, e);
    }
  }

  /** Closes every stream and moves each temporary file onto its final name. */
  public void commit() throws OutputException {
    for (Map.Entry<Path, PrintWriter> entry : open.entrySet()) {
      PrintWriter writer = entry.getValue();
      writer.close();
      if (writer.checkError())
        throw new OutputException("Error while writing " + entry.getKey());
      try {
        Files.move(temporary(entry.getKey()), entry.getKey(), StandardCopyOption.REPLACE_EXISTING);
      } catch (IOException e) {
        throw new OutputException("Could not move output into place: " + entry.getKey(), e);
      }
      logger.info("Wrote {}", entry.getKey());
    }
    open.clear();
  }

  /** Closes every stream and deletes the temporary files. */
  public void discard() {
    for (Path target : open.keySet()) {
      open.get(target).close();
      try {
        Files.deleteIfExists(temporary(target));
      } catch (IOException e) {
        logger.warn("Could not delete temporary file {}: {}", temporary(target), e.getMessage());
      }
    }
    open.clear();
  }

  private static Path temporary(Path target) { return target.resolveSibling(target.getFileName() + TMP_SUFFIX); }
}

package symgen.codegen;

import java.io.PrintWriter;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.frontend.Model;
import symgen.frontend.ProductEnumerator;
import symgen.frontend.SetQueries;
import symgen.frontend.SymbolTable;
import symgen.ui.SymGenConfig;
import symgen.util.OutputFiles;

/**
 * State of one generation run: the model collaborators, options, output streams and the styles a backend selects.
 * A run never shares a session with another.
 */
public class GenerationSession {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public final SymbolTable symbols;
  public final SetQueries sets;
  public final ProductEnumerator enumerator;
  public final SymGenConfig config;

  private final OutputFiles files;
  private final PrintWriter code;
  private final PrintWriter info;

  private Style equationStyle = null;
  private Style sumStyle = null;
  private int lineLength;
  private boolean alphabetic;

  public GenerationSession(SymbolTable symbols, SetQueries sets, ProductEnumerator enumerator, SymGenConfig config, OutputFiles files,
                           String codeExtension) throws OutputException {
    this.symbols = symbols;
    this.sets = sets;
    this.enumerator = enumerator;
    this.config = config;
    this.files = files;
    this.lineLength = config.lineLength;
    this.alphabetic = config.alphabeticElements;
    this.code = files.open("." + codeExtension);
    this.info = files.open(".lis");
  }

  public GenerationSession(Model model, SymGenConfig config, OutputFiles files, String codeExtension) throws OutputException {
    this(model, model, model, config, files, codeExtension);
  }

  /** Primary output stream. */
  public PrintWriter code() { return code; }
  /** Secondary stream for statistics and diagnostics. */
  public PrintWriter info() { return info; }
  public OutputFiles files() { return files; }

  public Style getEquationStyle() { return equationStyle; }
  public void setEquationStyle(Style style) { this.equationStyle = style; }
  public Style getSumStyle() { return sumStyle; }
  public void setSumStyle(Style style) { this.sumStyle = style; }

  /** Maximum line width, 0 to write equations verbatim. */
  public int getLineLength() { return lineLength; }
  public void setLineLength(int lineLength) { this.lineLength = lineLength; }

  public boolean isAlphabetic() { return alphabetic; }
  public void setAlphabetic(boolean alphabetic) { this.alphabetic = alphabetic; }

  /** Elements of a set in this run's enumeration order. */
  public List<String> elementsOf(String set) { return sets.elementsOf(set, alphabetic); }
}

package symgen;

import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.backend.Lang;
import symgen.backend.LangBackend;
import symgen.codegen.GenerationException;
import symgen.codegen.GenerationSession;
import symgen.frontend.Model;
import symgen.ui.SymGenConfig;
import symgen.util.OutputFiles;

/**
 * Entry point of the library: writes one model in one target language.
 */
public class SymGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final SymGenConfig config;

  public SymGen() { this(new SymGenConfig()); }

  public SymGen(SymGenConfig config) { this.config = config; }

  public SymGenConfig getConfig() { return config; }

  /**
   * Generates {@code <outDir>/<basename>.<ext>}, the {@code .lis} summary and any side files of the target. Nothing is
   * left in place if generation fails.
   *
   * @return true on success; failures are logged
   */
  public boolean generate(Lang lang, Model model, Path outDir, String basename) {
    LangBackend backend = lang.create();
    OutputFiles files = new OutputFiles(outDir, basename);
    try {
      GenerationSession session = new GenerationSession(model, config, files, backend.codeExtension());
      backend.prepare(session);
      logger.info("Generating {} output for {} equations", lang.serialName, model.equations().size());
      backend.writeFile(basename);
      files.commit();
    } catch (GenerationException e) {
      logger.error("{}: {}", e.getClass().getSimpleName(), e.getMessage());
      logger.debug("Generation failed", e);
      files.discard();
      return false;
    }
    return true;
  }
}

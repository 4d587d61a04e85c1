package symgen.codegen;

import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.backend.LangBackend;
import symgen.frontend.Equation;
import symgen.frontend.Symbol;
import symgen.frontend.SymbolType;

/**
 * Drives one generation run: declarations, then every equation either as one vector statement or expanded over
 * the Cartesian product of its sets.
 */
public class EquationWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final GenerationSession session;
  private final LangBackend backend;

  public EquationWriter(GenerationSession session, LangBackend backend) {
    this.session = session;
    this.backend = backend;
  }

  public void write(String basename) throws GenerationException {
    logger.debug("write_file {} with {}", basename, backend.getClass().getSimpleName());

    // Allow the backend to set options and write introductory text
    backend.beginFile(basename);

    // Styles have no defaults and must be chosen by the backend
    if (session.getEquationStyle() == null)
      throw new ConfigurationException("Equation style has not been set");
    if (session.getSumStyle() == null)
      throw new ConfigurationException("Summation style has not been set");
    logger.debug("eqn style: {}, sum style: {}", session.getEquationStyle(), session.getSumStyle());

    for (SymbolType type : SymbolType.values())
      for (Symbol symbol : session.symbols.symbols(type))
        backend.declare(symbol);

    int blocks = 0;
    for (Equation eq : session.symbols.equations()) {
      if (backend.skipsInvalidEquations()) {
        if (eq.hasUndeclaredSymbol(session.symbols, session.sets)) {
          logger.warn("Skipping {}: undeclared symbols in {}", eq, DiagnosticPrinter.print(eq.asNode()));
          continue;
        }
        if (!eq.isTimeDomainValid(session.symbols)) {
          logger.warn("Skipping {}: lag or lead applied to an expression in {}", eq, DiagnosticPrinter.print(eq.asNode()));
          continue;
        }
      }

      List<String> eqSets = eq.definedOverSets(session.sets);
      logger.trace("{} defined over {}", eq, eqSets);
      backend.beginBlock(eq);
      ++blocks;

      if (session.getEquationStyle() == Style.Vector) {
        backend.showEq(eq, eqSets, Collections.nCopies(eqSets.size(), NodeRenderer.ALL_ELEMENTS));
        continue;
      }

      int expected = eq.scalarCount(session.symbols, session.sets);
      int written = 0;
      for (List<String> subs : session.enumerator.product(eqSets, session.isAlphabetic())) {
        backend.showEq(eq, eqSets, subs);
        ++written;
      }
      if (written != expected)
        throw new ConsistencyException(String.format("Incorrect number of equations written for %s: expected %d, wrote %d. Using # with a time set?",
                                                     eq, expected, written));
    }
    logger.debug("{} equation blocks written", blocks);

    // All done, allow the backend to write a postscript
    backend.endFile();
    session.code().flush();
    session.info().flush();
  }
}

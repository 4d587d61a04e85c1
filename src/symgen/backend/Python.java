package symgen.backend;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.backend.python.NamedVector;
import symgen.backend.python.SideTables;
import symgen.backend.python.UsageContext;
import symgen.backend.python.VariableSlot;
import symgen.backend.python.VectorRegistry;
import symgen.codegen.ConsistencyException;
import symgen.codegen.GenerationException;
import symgen.codegen.GenerationSession;
import symgen.codegen.RenderContext;
import symgen.codegen.SemanticException;
import symgen.codegen.Style;
import symgen.frontend.Equation;
import symgen.frontend.Node;
import symgen.frontend.NodeKind;
import symgen.frontend.Symbol;

/**
 * Python {@code msgproc} function for the MSG solver. Every scalar equation is written out and every variable
 * reference becomes an element of one of the solver vectors; the equation count must match the number of endogenous
 * unknowns.
 */
public class Python extends LangBackend {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final List<NamedVector> REPORTED = List.of(NamedVector.Z1L, NamedVector.ZEL, NamedVector.J1L, NamedVector.X1L,
                                                            NamedVector.EXO, NamedVector.PAR);

  private final VectorRegistry registry = new VectorRegistry();
  private SideTables tables;
  private int block = 1;
  private int scalar = 1;

  @Override
  public void prepare(GenerationSession session) {
    super.prepare(session);
    session.setEquationStyle(Style.Scalar);
    session.setSumStyle(Style.Scalar);
  }

  @Override
  public String codeExtension() {
    return "py";
  }

  public VectorRegistry getRegistry() { return registry; }

  @Override
  public void beginFile(String basename) throws GenerationException {
    tables = new SideTables(session);

    code().print("import numpy as np\n");
    code().print("from math import exp\n");
    code().print("from math import log\n");
    code().print("\n\n");
    code().print("def msgproc(x1l:np.ndarray, j1l:np.ndarray, zel:np.ndarray, z1l:np.ndarray, x1r:np.ndarray, j1r:np.ndarray, " +
                 "z1r:np.ndarray, zer:np.ndarray, yjr:np.ndarray, yxr:np.ndarray, exo:np.ndarray, exz:np.ndarray, " +
                 "par:np.ndarray):\n");
    code().print("\n");
  }

  @Override
  public void declare(Symbol symbol) throws GenerationException {
    if (symbol.isSet())
      return;
    VariableSlot slot = registry.declare(symbol, session.symbols.elementCount(symbol));
    tables.write(slot);
  }

  @Override
  public void beginBlock(Equation eq) throws GenerationException {
    int nblk = block++;
    int nstart = scalar;
    int nscalar = eq.scalarCount(session.symbols, session.sets);
    int nend = nstart + nscalar - 1;
    scalar = nend + 1;

    List<String> sets = eq.definedOverSets(session.sets);
    code().printf("    # Equation block %d\n", nblk);
    if (!eq.isLvalue(session.symbols))
      throw new SemanticException("LHS of equation " + eq.getNumber() + " is not a variable");
    if (!sets.isEmpty())
      code().printf("    #    Defined over sets (%s)\n", String.join(",", sets));
    if (nscalar > 0)
      code().printf("    #    Scalar equations %d-%d (%d total)\n\n", nstart, nend, nscalar);
    else
      code().print("    #    Contains undeclared symbols\n");
  }

  @Override
  public void beginEqn(Equation eq) {
    code().print("    ");
  }

  @Override
  public void endEqn(Equation eq) {
    code().print("\n\n");
  }

  @Override
  public String operatorToken(Node node) {
    return node.kind == NodeKind.Pow ? "**" : node.token;
  }

  @Override
  public String lineBreak() {
    return " \\\n        ";
  }

  @Override
  public String showSymbol(String name, List<String> subscripts, RenderContext context) throws GenerationException {
    UsageContext usage = UsageContext.of(context.lhs(), context.dt());
    VariableSlot slot = registry.lookup(name).orElseThrow(() -> new SemanticException("Name not in variable list: " + name));
    return registry.locate(name, elementIndex(slot.getSymbol(), subscripts), usage).toString();
  }

  /** Row-major position of a subscripted element within the symbol's domain. */
  int elementIndex(Symbol symbol, List<String> subscripts) throws SemanticException {
    List<String> domain = symbol.domain();
    if (domain.size() != subscripts.size())
      throw new SemanticException("Symbol " + symbol.name() + " expects " + domain.size() + " subscripts, got " + subscripts.size());
    int index = 0;
    for (int i = 0; i < domain.size(); ++i) {
      int pos = session.sets.indexOf(domain.get(i), subscripts.get(i), session.isAlphabetic());
      if (pos < 0)
        throw new SemanticException("Subscript " + subscripts.get(i) + " of " + symbol.name() + " is not an element of set " +
                                    domain.get(i));
      index = index * session.sets.cardinality(domain.get(i)) + pos;
    }
    return index;
  }

  @Override
  public void endFile() throws GenerationException {
    code().print("\n# END OF MSGPROC function declaration\n");

    int ecount = scalar - 1;
    int vcount = 0;
    for (NamedVector vector : REPORTED)
      if (vector.isEndogenous())
        vcount += registry.lengthOf(vector);

    info().print("\nLength of MSGPROC Vectors:\n\n");
    for (NamedVector vector : REPORTED)
      info().printf("   %s has %d elements\n", vector.vectorName(), registry.lengthOf(vector));

    List<VariableSlot> unused = new ArrayList<>();
    for (VariableSlot slot : registry.slots())
      if (slot.getSymbol().isVariable() && !session.symbols.isUsed(slot.getSymbol()))
        unused.add(slot);
    int ucount = VectorRegistry.endogenousCount(unused);

    info().print("\n");
    info().printf("Equation Count: %d\n", ecount);
    info().printf("Endogenous Variables, Used:   %d\n", vcount - ucount);
    info().printf("Endogenous Variables, Total:  %d\n", vcount);

    if (ecount != vcount - ucount) {
      String err = "Counts of equations and endogenous variables do not match.";
      info().printf("\nFatal Error:\n   %s\n", err);
      throw new ConsistencyException(err + " Equations: " + ecount + ", endogenous variables: " + (vcount - ucount) +
                                     ". Check lags and leads on time-domain sets.");
    }
    logger.debug("{} scalar equations for {} endogenous variables", ecount, vcount - ucount);
  }
}

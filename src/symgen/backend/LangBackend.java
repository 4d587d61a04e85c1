package symgen.backend;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.codegen.EquationWriter;
import symgen.codegen.GenerationException;
import symgen.codegen.GenerationSession;
import symgen.codegen.LineWrapper;
import symgen.codegen.NodeRenderer;
import symgen.codegen.RenderContext;
import symgen.frontend.Equation;
import symgen.frontend.Node;
import symgen.frontend.NodeKind;
import symgen.frontend.Symbol;

/**
 * Default behavior of every output hook. A target language extends this class and overrides the hooks it renders
 * differently. One instance serves exactly one run.
 */
public class LangBackend {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  protected GenerationSession session;
  protected NodeRenderer renderer;

  /** Binds the backend to a run. Targets select their styles and options here. */
  public void prepare(GenerationSession session) {
    this.session = session;
    this.renderer = new NodeRenderer(session, this);
    if (session.getLineLength() == 0)
      session.setLineLength(defaultLineLength());
  }

  /** Extension of the primary output file. */
  public String codeExtension() { return "txt"; }

  /** Line width used when none is configured, 0 for unlimited. */
  public int defaultLineLength() { return 0; }

  protected PrintWriter code() { return session.code(); }
  protected PrintWriter info() { return session.info(); }

  //////////   file structure   //////////

  public void beginFile(String basename) throws GenerationException {}

  public void endFile() throws GenerationException {}

  /** Called once per set, then per parameter, then per variable, before any equation. */
  public void declare(Symbol symbol) throws GenerationException {}

  /** Preamble of one equation block. */
  public void beginBlock(Equation eq) throws GenerationException {}

  public void beginEqn(Equation eq) throws GenerationException {}

  public void endEqn(Equation eq) throws GenerationException { code().print(" ;\n\n"); }

  /** Equations with undeclared symbols or invalid lags and leads are left out. */
  public boolean skipsInvalidEquations() { return true; }

  //////////   expressions   //////////

  /**
   * Opening of a function envelope.
   * @param arg index set of a sum or prod, null for other functions
   */
  public String beginFunc(String func, String arg) throws GenerationException {
    if (arg != null)
      return func + "(" + arg + ",";
    return func + "(";
  }

  public String endFunc() { return ")"; }

  /**
   * Renders one variable or parameter reference.
   * @param subscripts use-site subscripts, each an element or an unbound set name
   */
  public String showSymbol(String name, List<String> subscripts, RenderContext context) throws GenerationException {
    if (subscripts.isEmpty())
      return name;
    List<String> subs = new ArrayList<>(subscripts);
    context.timeSubstitution().ifPresent(sub -> subs.set(sub.position(), sub.element()));
    return name + "(" + String.join(",", subs) + ")";
  }

  public String showNode(NodeKind parent, Node node, List<String> sets, List<String> subs) throws GenerationException {
    return renderer.render(parent, node, sets, subs);
  }

  public String operatorToken(Node node) { return node.kind == NodeKind.Pow ? "^" : node.token; }

  public String openParen() { return "("; }
  public String closeParen() { return ")"; }
  /** Brackets around an expanded sum and around each product term. */
  public String openGroup() { return "("; }
  public String closeGroup() { return ")"; }
  public String sumTermSeparator() { return "\n      "; }
  /** Inserted between the operands of a long binary operation. */
  public String lineBreak() { return " \n        "; }

  /** Division as a dedicated construct; empty to use the infix operator. */
  public Optional<String> fraction(String numerator, String denominator) { return Optional.empty(); }

  public String normalizedOpen() { return " - ("; }
  public String normalizedClose() { return ")"; }

  /**
   * Writes one equation: both sides rendered, joined as {@code LHS = RHS} or in normalized form, and wrapped to the
   * line width when one is set.
   */
  public void showEq(Equation eq, List<String> sets, List<String> subs) throws GenerationException {
    String lstr = showNode(NodeKind.Nul, eq.getLhs(), sets, subs);
    String rstr = showNode(NodeKind.Nul, eq.getRhs(), sets, subs);

    beginEqn(eq);

    String all = session.config.normalized ? lstr + normalizedOpen() + rstr + normalizedClose() : lstr + " = " + rstr;
    int width = session.getLineLength();
    if (width == 0 || all.length() <= width)
      code().print(all);
    else {
      String[] lines = all.split("\n", -1);
      for (int i = 0; i < lines.length; ++i)
        wrapWrite(lines[i], i + 1 < lines.length, false);
    }

    endEqn(eq);
  }

  //////////   output   //////////

  public void writeFile(String basename) throws GenerationException { new EquationWriter(session, this).write(basename); }

  /** Writes text to the code stream, wrapped to the session's line width. */
  public void wrapWrite(String line, boolean addNewline, boolean commaOk) throws GenerationException {
    int width = session.getLineLength();
    if (width == 0) {
      code().print(line);
      if (addNewline)
        code().print("\n");
      return;
    }
    code().print(LineWrapper.wrap(line, width, addNewline, commaOk));
  }
}

package symgen.codegen;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.backend.LangBackend;
import symgen.frontend.Node;
import symgen.frontend.NodeKind;

/**
 * Output renderer shared by all backends. Symbols, function envelopes and a few tokens come from the backend's hooks;
 * parenthesization, sum expansion and line breaks are decided here.
 */
public class NodeRenderer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Subscript value meaning "every element of the set at this position". */
  public static final String ALL_ELEMENTS = "*";

  private final GenerationSession session;
  private final LangBackend backend;

  public NodeRenderer(GenerationSession session, LangBackend backend) {
    this.session = session;
    this.backend = backend;
  }

  /**
   * Renders {@code cur} below a node of kind {@code parent}.
   *
   * @param sets index sets bound so far, outermost first
   * @param subs value bound to each of {@code sets}: an element, or {@link #ALL_ELEMENTS}
   * @return the rendered text, empty for a null node
   */
  public String render(NodeKind parent, Node cur, List<String> sets, List<String> subs) throws GenerationException {
    if (cur == null)
      return "";
    boolean parens = Precedence.needsParens(parent, cur.kind, true);

    switch (cur.kind) {
    case Nam:
      return renderSymbol(cur, sets, subs);
    case Lag:
    case Led:
      return backend.showNode(cur.kind, cur.right, sets, subs);
    case Dom:
      return backend.showNode(cur.kind, cur.left, sets, subs);
    case Lst:
      throw new IllegalStateException("Unexpected lst node in equation rendering");
    case Sum:
    case Prd:
      if (session.getSumStyle() == Style.Scalar)
        return renderScalarAggregate(cur, sets, subs);
      return renderVectorAggregate(cur, sets, subs);
    default:
      break;
    }

    boolean isFunc = false;
    String lstr;
    String endFunc = "";
    String op;
    switch (cur.kind) {
    case Log:
    case Exp:
      isFunc = true;
      lstr = backend.beginFunc(cur.token, null);
      endFunc = backend.endFunc();
      op = "";
      break;
    default:
      lstr = backend.showNode(cur.kind, cur.left, sets, subs);
      op = backend.operatorToken(cur);
    }
    String rstr = backend.showNode(cur.kind, cur.right, sets, subs);

    if (cur.kind == NodeKind.Dvd) {
      var fraction = backend.fraction(lstr, rstr);
      if (fraction.isPresent())
        return fraction.get();
    }

    String cr = "";
    if (lstr.length() + rstr.length() > session.config.breakCombinedLength || lstr.length() > session.config.breakSideLength ||
        rstr.length() > session.config.breakSideLength)
      cr = backend.lineBreak();

    String lpar = (parens && !isFunc) ? backend.openParen() : "";
    String rpar = (parens && !isFunc) ? backend.closeParen() : "";

    boolean wrapRight = cur.kind == NodeKind.Sub && (cur.right.kind == NodeKind.Add || cur.right.kind == NodeKind.Sub);
    if (wrapRight)
      return lpar + lstr + cr + op + "(" + rstr + ")" + rpar + endFunc;
    return lpar + lstr + cr + op + rstr + rpar + endFunc;
  }

  private String renderSymbol(Node cur, List<String> sets, List<String> subs) throws GenerationException {
    RenderContext context = RenderContext.of(cur);
    List<String> resolved = new ArrayList<>(cur.subscripts.size());
    for (int i = 0; i < cur.subscripts.size(); ++i) {
      String sub = cur.subscripts.get(i);
      int bound = sets.lastIndexOf(sub);
      if (bound < 0 || bound >= subs.size() || subs.get(bound).equals(ALL_ELEMENTS)) {
        resolved.add(sub);
        continue;
      }
      String element = subs.get(bound);
      resolved.add(element);
      if (context.dt() != 0 && session.sets.isTimeSet(sub)) {
        List<String> periods = session.elementsOf(sub);
        int shifted = periods.indexOf(element) + context.dt();
        if (shifted >= 0 && shifted < periods.size())
          context = context.withTimeSubstitution(i, periods.get(shifted));
      }
    }
    return backend.showSymbol(cur.token, resolved, context);
  }

  private String renderScalarAggregate(Node cur, List<String> sets, List<String> subs) throws GenerationException {
    String set = cur.indexSet();
    if (logger.isTraceEnabled())
      logger.trace("scalar {}: {}", cur.token, DiagnosticPrinter.print(cur));

    List<String> augSets = new ArrayList<>(sets);
    augSets.add(set);

    String op = (cur.kind == NodeKind.Prd) ? "*" : "+";
    String lpar = (cur.kind == NodeKind.Prd) ? backend.openGroup() : "";
    String rpar = (cur.kind == NodeKind.Prd) ? backend.closeGroup() : "";

    StringBuilder buf = new StringBuilder(backend.openGroup());
    String thisOp = " ";
    for (String element : session.elementsOf(set)) {
      List<String> augSubs = new ArrayList<>(subs);
      augSubs.add(element);
      String rstr = backend.showNode(cur.kind, cur.right, augSets, augSubs);
      buf.append(backend.sumTermSeparator()).append(thisOp).append(lpar).append(rstr).append(rpar);
      thisOp = op;
    }
    return buf.append(backend.closeGroup()).toString();
  }

  private String renderVectorAggregate(Node cur, List<String> sets, List<String> subs) throws GenerationException {
    String set = cur.indexSet();
    if (logger.isTraceEnabled())
      logger.trace("vector {}: {}", cur.token, DiagnosticPrinter.print(cur));

    List<String> augSets = new ArrayList<>(sets);
    augSets.add(set);
    List<String> augSubs = new ArrayList<>(subs);
    augSubs.add(ALL_ELEMENTS);

    return backend.beginFunc(cur.token, set) + backend.showNode(cur.kind, cur.right, augSets, augSubs) + backend.endFunc();
  }
}

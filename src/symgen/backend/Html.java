package symgen.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.codegen.GenerationException;
import symgen.codegen.GenerationSession;
import symgen.codegen.RenderContext;
import symgen.codegen.SemanticException;
import symgen.codegen.Style;
import symgen.frontend.Equation;
import symgen.frontend.Symbol;
import symgen.frontend.SymbolType;

/**
 * HTML documentation of a model: declaration tables with cross links, and every equation typeset by MathJax.
 * Equations with undeclared symbols are shown as well.
 */
public class Html extends LangBackend {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final String CSS = "a:link { color:blue; } "
                                    + "body { margin-left:2em; margin-top:2em; margin-right:2em; } "
                                    + "td { padding-left: 1em; padding-right: 1em; } "
                                    + "th { text-align: left; padding-left: 1em; padding-right: 1em; } "
                                    + "div.heading { margin-top: 2em; font-weight: bold; font-size: 120%; } "
                                    + "div.dblock { margin-top: 0em; margin-left: 0em; margin-right: 0em; } "
                                    + "div.eblock { margin-top: 1em; overflow-x: scroll;  } "
                                    + "div.eqn { margin-top: 1em; margin-left: 2em;} ";
  private static final String NBSP = "&nbsp;";

  private final IndexLetters letters = new IndexLetters();
  private int block = 0;
  private int scalar = 1;

  @Override
  public void prepare(GenerationSession session) {
    super.prepare(session);
    session.setEquationStyle(Style.Vector);
    session.setSumStyle(Style.Vector);
  }

  @Override
  public String codeExtension() {
    return "html";
  }

  @Override
  public boolean skipsInvalidEquations() {
    return false;
  }

  @Override
  public void beginFile(String basename) {
    code().print("<html>\n<head>\n");
    code().printf("<title>%s</title>\n", basename);
    code().printf("<style type='text/css'>\n%s</style>\n", CSS);
    code().print("<script>MathJax = { jax: ['input/tex', 'output/svg'], tex: { tags: 'ams', packages: {'[+]': ['textmacros']} }, "
                 + "svg: { displayAlign: 'left' }, loader: {load: ['[tex]/textmacros']} };</script>");
    code().print("<script type='text/javascript' id='MathJax-script' async src='https://cdn.jsdelivr.net/npm/mathjax@3/es5/tex-svg.js'>"
                 + "</script>\n");
    code().print("</head>\n<body>\n");
    code().printf("<h1>%s</h1>\n", basename);
  }

  @Override
  public void endFile() throws GenerationException {
    if (block == 0)
      writeDecls();
    code().print("</div>\n</body>\n</html>\n");
    info().printf("\nDocumented equations: %d\n", block);
    info().printf("Scalar equations: %d\n", scalar - 1);
  }

  @Override
  public void declare(Symbol symbol) {
    if (symbol.isSet())
      letters.add(symbol.name(), false);
  }

  private static String link(String target) { return "<a href='#" + target + "'>" + target + "</a>"; }

  private String equationLinks(Symbol symbol, boolean lhs) {
    List<Equation> eqs = session.symbols.equationsUsing(symbol, lhs);
    if (eqs.isEmpty())
      return "none";
    return eqs.stream().map(eq -> link(Integer.toString(eq.getNumber()))).collect(Collectors.joining(", "));
  }

  private void openTable(String header) {
    code().print("<div class=\"dblock\">\n");
    code().print("<table class=\"dec\" border=1 cellspacing=0>\n");
    code().print(header);
  }

  private void writeDecls() throws GenerationException {
    letters.makeUnique(session.symbols);

    code().print("<div class=\"heading\">Sets:</div>\n");
    List<Symbol> sets = session.symbols.symbols(SymbolType.Set);
    if (!sets.isEmpty()) {
      openTable("<tr><th>Name<th>Elements<th>Description</tr>\n");
      for (Symbol set : sets) {
        String elements = set.domain().isEmpty() ? NBSP : String.join(", ", set.domain());
        code().printf("<tr><td><a id='%s'><b>%s</b></a><td>%s<td>%s</tr>\n", set.name(), set.name(), elements, orNbsp(set.description()));
      }
      code().print("</table>\n</div>\n");
    }

    code().print("<div class=\"heading\">Variables:</div>\n");
    List<Symbol> vars = session.symbols.symbols(SymbolType.Variable);
    if (!vars.isEmpty()) {
      openTable("<tr><th>Name<th>Domain<th>Description<th>Units<th>LHS<th>RHS</tr>\n");
      for (Symbol var : vars)
        code().printf("<tr><td><a id='%s'><b>%s</b></a><td>%s<td>%s<td>%s<td>%s<td>%s</tr>\n", var.name(), var.name(), domainLinks(var),
                      orNbsp(var.description()), String.join(",", var.attributes()), equationLinks(var, true), equationLinks(var, false));
      code().print("</table>\n</div>\n");
    }

    code().print("<div class=\"heading\">Parameters:</div>\n");
    List<Symbol> pars = session.symbols.symbols(SymbolType.Parameter);
    if (!pars.isEmpty()) {
      openTable("<tr><th>Name<th>Domain<th>Description</tr>\n");
      for (Symbol par : pars)
        code().printf("<tr><td><a id='%s'><b>%s</b></a><td><b>%s</b><td>%s</tr>\n", par.name(), par.name(), domainLinks(par),
                      orNbsp(par.description()));
      code().print("</table>\n</div>\n");
    }

    code().print("<div class=\"heading\">Equations:</div>\n");
    code().print("<div class=\"dblock\">\n");
  }

  private static String orNbsp(String text) { return text.isEmpty() ? NBSP : text; }

  private static String domainLinks(Symbol symbol) {
    if (symbol.domain().isEmpty())
      return NBSP;
    return symbol.domain().stream().map(Html::link).collect(Collectors.joining(", "));
  }

  /** "i in SET, j in SET2" with links to the set declarations; literal elements are left out. */
  private String qualifier(List<String> sets) throws SemanticException {
    List<String> parts = new ArrayList<>();
    for (String set : sets)
      if (session.sets.isSet(set))
        parts.add("<i>" + letters.indexOf(set) + "</i> in <b>" + link(set) + "</b>");
    return String.join(", ", parts);
  }

  @Override
  public void beginBlock(Equation eq) throws GenerationException {
    if (block == 0)
      writeDecls();
    ++block;

    int nscalar = eq.scalarCount(session.symbols, session.sets);
    scalar += nscalar;

    String var = eq.lhsSymbolName().orElse("Not a variable");
    code().printf("<a id='%d'/>", eq.getNumber());
    if (eq.getLabel().isPresent())
      code().printf("Equation %d: %s: %s<br>\n", eq.getNumber(), link(var), eq.getLabel().get());
    else
      code().printf("Equation %d: %s<br>\n", eq.getNumber(), link(var));

    switch (nscalar) {
    case 0:
      code().print("Contains undeclared symbols<br>\n");
      break;
    case 1:
      break;
    default:
      code().printf("For %s (%d total):<br>\n", qualifier(eq.definedOverSets(session.sets)), nscalar);
    }

    code().print("<div class=\"eblock\">\n<div class=\"eqn\"> \\[ ");
  }

  @Override
  public void endEqn(Equation eq) {
    code().print(" \\]\n</div>\n</div>\n");
  }

  private static String escape(String name) { return name.replace("_", "\\_"); }

  @Override
  public String beginFunc(String func, String arg) throws GenerationException {
    if (func.equals("sum") || func.equals("prod"))
      return "\\" + func + "_{" + letters.indexOf(arg) + " \\; \\text{in} \\; \\href{#" + arg + "}{" + escape(arg) + "}} { \\left(";
    if (arg != null)
      throw new SemanticException("Unexpected function call with argument: " + func + "(" + arg + ")");
    if (func.equals("log"))
      return "ln{ \\left(";
    return func + "{ \\left(";
  }

  @Override
  public String endFunc() {
    return "\\right) }";
  }

  @Override
  public String showSymbol(String name, List<String> subscripts, RenderContext context) throws GenerationException {
    String ret;
    if (subscripts.isEmpty())
      ret = "\\href{#" + name + "}{" + escape(name) + "}";
    else {
      List<String> indexes = new ArrayList<>();
      for (String sub : subscripts)
        indexes.add(session.sets.isSet(sub) ? letters.indexOf(sub) : "\\text{" + sub + "}");
      ret = "\\href{#" + name + "}{" + escape(name) + "(" + String.join(",", indexes) + ")}";
    }
    for (int delta = context.dt(); delta != 0; delta += (delta < 0) ? 1 : -1)
      ret = (delta < 0 ? "lag({" : "lead({") + ret + "})";
    return ret;
  }

  @Override
  public String openParen() {
    return "{(";
  }

  @Override
  public String closeParen() {
    return ")}";
  }

  @Override
  public String openGroup() {
    return "{\\left(";
  }

  @Override
  public String closeGroup() {
    return "\\right)}";
  }

  @Override
  public Optional<String> fraction(String numerator, String denominator) {
    return Optional.of("\\frac{" + numerator + "}{" + denominator + "}");
  }

  @Override
  public String normalizedOpen() {
    return " - \\left(";
  }

  @Override
  public String normalizedClose() {
    return "\\right)";
  }
}

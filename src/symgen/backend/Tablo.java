package symgen.backend;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
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
 * GEMPACK TABLO output. Parameters are read from logical file {@code param}; each variable is read from the file
 * its header letter selects. In calc mode equations become formulas and the computed variables are written to
 * file {@code calc}.
 */
public class Tablo extends LangBackend {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Kind of data a header holds, by the header's first letter. */
  enum HeaderType {
    Impl('A', "impl"),
    ImplExog('B', "impl"),
    AddPar('C', "addpar"),
    Inter('I', "inter"),
    Kalman('K', "kalman"),
    Make('M', "make"),
    Endog('N', "endog"),
    IoTable('O', "iotable"),
    Param('P', "param"),
    Extra('T', "extra"),
    Exog('X', "exog"),
    Other(' ', "other");

    public final char letter;
    public final String fileName;
    private HeaderType(char letter, String fileName) {
      this.letter = letter;
      this.fileName = fileName;
    }

    static HeaderType of(Symbol symbol) {
      if (symbol.attributes().isEmpty())
        return Other;
      char first = symbol.attributes().get(0).charAt(0);
      for (HeaderType type : values())
        if (type != Other && type.letter == first)
          return type;
      return Other;
    }
  }

  private final IndexLetters letters = new IndexLetters();
  private final List<String> calcVars = new ArrayList<>();
  private boolean calc;
  private boolean declsWritten = false;
  private int eqnCount = 0;
  private int scalarEqnCount = 0;
  private int varCount = 0;
  private int parCount = 0;

  @Override
  public void prepare(GenerationSession session) {
    super.prepare(session);
    session.setEquationStyle(Style.Vector);
    session.setSumStyle(Style.Vector);
    session.setAlphabetic(true);
    calc = session.config.calcMode;
  }

  @Override
  public String codeExtension() {
    return "tab";
  }

  @Override
  public int defaultLineLength() {
    return 75;
  }

  @Override
  public void beginFile(String basename) {
    if (!calc) {
      code().print("equation    (default=levels)       ;\n");
      code().print("equation    (default=add_homotopy) ;\n");
      code().print("variable    (default=levels)       ;\n");
    } else
      code().print("formula     (default=initial)      ;\n");
    code().print("coefficient (default=parameter)    ;\n");
    code().print("\n");
  }

  @Override
  public void declare(Symbol symbol) {
    if (symbol.isSet())
      letters.add(symbol.name(), session.sets.isTimeSet(symbol.name()));
    else if (symbol.isVariable())
      ++varCount;
    else if (symbol.isParameter())
      ++parCount;
  }

  //////////   declarations   //////////

  private boolean isShown(Symbol symbol, Set<String> usedSets) {
    if (!calc)
      return true;
    if (symbol.isSet())
      return usedSets.contains(symbol.name());
    return session.symbols.isUsed(symbol);
  }

  private void markSetUsed(String set, Set<String> usedSets) {
    if (!usedSets.add(set))
      return;
    for (String sup : session.sets.immediateSupersets(set))
      markSetUsed(sup, usedSets);
  }

  /** Sets referenced by equations or by the domain of a shown symbol, with all their supersets. */
  private Set<String> usedSets() {
    Set<String> ret = new HashSet<>();
    for (Symbol set : session.symbols.symbols(SymbolType.Set))
      if (session.symbols.isUsed(set))
        markSetUsed(set.name(), ret);
    for (SymbolType type : List.of(SymbolType.Parameter, SymbolType.Variable))
      for (Symbol symbol : session.symbols.symbols(type))
        if (isShown(symbol, ret))
          symbol.domain().forEach(set -> markSetUsed(set, ret));
    return ret;
  }

  private boolean needsRead(Symbol symbol) throws SemanticException {
    if (calc)
      return !session.symbols.equationsUsing(symbol, false).isEmpty() && !symbol.attributes().isEmpty();
    if (symbol.attributes().isEmpty())
      throw new SemanticException("Header required for symbol: " + symbol.name());
    return true;
  }

  /** "(all,i,SET) " for every set in the list. */
  private String qualifier(List<String> sets) throws SemanticException {
    StringBuilder ret = new StringBuilder();
    for (String set : sets)
      if (session.sets.isSet(set))
        ret.append("(all,").append(letters.indexOf(set)).append(",").append(set).append(") ");
    return ret.toString();
  }

  private String reference(String name, List<String> subscripts, int dt) throws SemanticException {
    if (subscripts.isEmpty())
      return name;
    List<String> indexes = new ArrayList<>();
    for (String sub : subscripts) {
      if (!session.sets.isSet(sub)) {
        indexes.add("\"" + sub + "\"");
        continue;
      }
      String index = letters.indexOf(sub);
      if (letters.isTime(sub) && dt != 0)
        index += String.format("%+d", dt);
      indexes.add(index);
    }
    return name + "(" + String.join(",", indexes) + ")";
  }

  private void writeDecls() throws GenerationException {
    declsWritten = true;
    letters.makeUnique(session.symbols);
    Set<String> usedSets = usedSets();

    List<Symbol> sets = session.symbols.symbols(SymbolType.Set);
    for (Symbol set : sets)
      if (isShown(set, usedSets)) {
        String iqual = letters.isTime(set.name()) ? "(intertemporal) " : "";
        wrapWrite("set " + iqual + set.name() + " (" + String.join(",", set.domain()) + ") ;", true, true);
      }
    if (!sets.isEmpty())
      code().print("\n");

    int subsets = 0;
    for (Symbol set : sets)
      if (isShown(set, usedSets))
        for (String sup : session.sets.immediateSupersets(set.name())) {
          code().printf("subset %s is subset of %s ;\n", set.name(), sup);
          ++subsets;
        }
    if (subsets > 0)
      code().print("\n");

    List<Symbol> pars = session.symbols.symbols(SymbolType.Parameter);
    for (Symbol par : pars)
      if (isShown(par, usedSets))
        wrapWrite("coefficient " + qualifier(par.domain()) + reference(par.name(), par.domain(), 0) + " ;", true, false);
    if (!pars.isEmpty()) {
      code().print("\n");
      code().print("file param ;\n\n");
    }

    int hdr = 0;
    for (Symbol par : pars)
      if (isShown(par, usedSets)) {
        String header = (par.attributes().size() == 1) ? par.attributes().get(0) : String.format("H%03d", hdr++);
        wrapWrite("read " + qualifier(par.domain()) + "\n   " + reference(par.name(), par.domain(), 0) + " from file param header \"" +
                      header + "\" ;",
                  true, false);
      }
    if (!pars.isEmpty())
      code().print("\n");

    LinkedHashSet<String> files = new LinkedHashSet<>();
    List<Symbol> readVars = new ArrayList<>();
    for (Symbol var : session.symbols.symbols(SymbolType.Variable))
      if (isShown(var, usedSets)) {
        String keyword = calc ? "coefficient " : "variable ";
        wrapWrite(keyword + qualifier(var.domain()) + reference(var.name(), var.domain(), 0) + " ;", true, false);
        if (needsRead(var)) {
          files.add(HeaderType.of(var).fileName);
          readVars.add(var);
        }
      }

    code().print("\n");
    if (!files.isEmpty()) {
      for (String file : files)
        code().printf("file %s ;\n", file);
      code().print("\n");
    }

    for (Symbol var : readVars)
      wrapWrite("read " + qualifier(var.domain()) + "\n   " + reference(var.name(), var.domain(), 0) + " from file " +
                    HeaderType.of(var).fileName + " header \"" + var.attributes().get(0) + "\" ;",
                true, false);
  }

  //////////   equations   //////////

  @Override
  public void beginBlock(Equation eq) throws GenerationException {
    if (!declsWritten)
      writeDecls();

    ++eqnCount;
    scalarEqnCount += eq.scalarCount(session.symbols, session.sets);
    String qual = qualifier(eq.definedOverSets(session.sets));

    if (!calc) {
      String name = eq.getName().orElse("EQN" + eqnCount);
      code().printf("\nequation %s %s\n   ", name, qual);
      return;
    }
    if (!eq.isLvalue(session.symbols))
      throw new SemanticException("LHS of equation " + eqnCount + " in calc mode is not a variable");
    code().printf("\nformula %s\n   ", qual);
    String var = eq.lhsSymbolName().get();
    if (!calcVars.contains(var))
      calcVars.add(var);
  }

  @Override
  public void endEqn(Equation eq) {
    code().print(" ;\n");
  }

  @Override
  public String beginFunc(String func, String arg) throws GenerationException {
    if (func.equals("sum") || func.equals("prod"))
      return func + "(" + letters.indexOf(arg) + "," + arg + ",";
    if (arg != null)
      throw new SemanticException("Unexpected function call with argument: " + func + "(" + arg + ")");
    if (func.equals("log"))
      return "loge(";
    return func + "(";
  }

  @Override
  public String showSymbol(String name, List<String> subscripts, RenderContext context) throws GenerationException {
    return reference(name, subscripts, context.dt());
  }

  //////////   summary   //////////

  @Override
  public void endFile() throws GenerationException {
    if (!declsWritten)
      writeDecls();

    EnumMap<HeaderType, Integer> nv = new EnumMap<>(HeaderType.class);
    for (HeaderType type : HeaderType.values())
      nv.put(type, 0);
    int unused = 0;
    for (Symbol var : session.symbols.symbols(SymbolType.Variable)) {
      if (!session.symbols.isUsed(var))
        ++unused;
      else
        nv.merge(HeaderType.of(var), session.symbols.elementCount(var), Integer::sum);
    }

    if (calc) {
      code().print("\nfile (new) calc ;\n\n");
      for (String name : calcVars) {
        Symbol var = session.symbols.lookup(name).get();
        if (var.attributes().size() == 1)
          wrapWrite("write " + qualifier(var.domain()) + "\n   " + reference(name, var.domain(), 0) + " to file calc header \"" +
                        var.attributes().get(0) + "\" ;\n",
                    true, false);
      }
      code().print("\n");
    }

    info().print("\nVector information:\n");
    info().printf("\n   Equations: %d\n", eqnCount);
    info().printf("   Variables, Used: %d\n", varCount - unused);
    info().printf("   Variables, Unused: %d\n", unused);
    info().printf("   Parameters: %d\n", parCount);

    info().print("\nTime information:\n");
    info().printf("\n   Periods used: %d\n", session.sets.cardinality("time"));

    int nvEnd = nv.get(HeaderType.Impl) + nv.get(HeaderType.Endog) + nv.get(HeaderType.Inter) + nv.get(HeaderType.IoTable) +
                nv.get(HeaderType.Extra);
    int nvExo = nv.get(HeaderType.ImplExog) + nv.get(HeaderType.Exog) + nv.get(HeaderType.Kalman) + nv.get(HeaderType.Make);
    int nvUnk = nv.get(HeaderType.Other);

    info().print("\nScalar information:\n");
    info().printf("\n   Equations: %d\n", scalarEqnCount);
    info().printf("\n   Endogenous variables: %d\n", nvEnd);
    for (HeaderType type : List.of(HeaderType.Endog, HeaderType.Inter, HeaderType.IoTable, HeaderType.Extra, HeaderType.Impl))
      info().printf("      Type %s: %d\n", type.fileName, nv.get(type));

    int ndiff = scalarEqnCount - nvEnd;
    info().print("\n   Closure:\n");
    if (ndiff == 0)
      info().print("      Equations and variables match\n");
    else if (ndiff > 0)
      info().printf("      Excess equations: %d\n", ndiff);
    else
      info().printf("      Excess variables: %d\n", -ndiff);

    info().printf("\n   Exogenous variables: %d\n", nvExo);
    for (HeaderType type : List.of(HeaderType.Exog, HeaderType.Kalman, HeaderType.Make, HeaderType.ImplExog))
      info().printf("      Type %s: %d\n", type.fileName, nv.get(type));

    info().printf("\n   Undetermined variables: %d\n", nvUnk);
    info().printf("      Type %s: %d\n", HeaderType.Other.fileName, nvUnk);
    for (Symbol var : session.symbols.symbols(SymbolType.Variable))
      if (session.symbols.isUsed(var) && HeaderType.of(var) == HeaderType.Other)
        info().printf("      %-13s: %d\n", var.name(), session.symbols.elementCount(var));

    if (ndiff != 0)
      logger.warn("TABLO closure: {} scalar equations for {} endogenous variables", scalarEqnCount, nvEnd);
  }
}

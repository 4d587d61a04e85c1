package symgen.backend.python;

import java.io.PrintWriter;
import java.util.List;
import symgen.codegen.GenerationSession;
import symgen.codegen.OutputException;
import symgen.frontend.Symbol;
import symgen.util.OutputFiles;

/**
 * The CSV files written next to the solver code:
 * <ul>
 * <li>{@code _varinfo.csv}: one row per symbol with its element count, type, unit and attributes</li>
 * <li>{@code _vars.csv}: one numbered row per variable element with its region</li>
 * <li>{@code _varmap.csv}: vector element of each symbol element in every legal context</li>
 * <li>{@code _optmap.csv}: the same mapping keyed by variable list number</li>
 * </ul>
 */
public class SideTables {
  private final GenerationSession session;
  private final PrintWriter varinfo;
  private final PrintWriter vars;
  private final PrintWriter varmap;
  private final PrintWriter optmap;
  private int varsNumber = 1;

  public SideTables(GenerationSession session) throws OutputException {
    this.session = session;
    OutputFiles files = session.files();
    this.varmap = files.open("_varmap.csv");
    this.optmap = files.open("_optmap.csv");
    this.varinfo = files.open("_varinfo.csv");
    this.vars = files.open("_vars.csv");
  }

  /** Writes every row describing a freshly placed slot. */
  public void write(VariableSlot slot) {
    writeVarinfo(slot);
    if (slot.getSymbol().isVariable())
      writeVars(slot);
    writeVarmap(slot);
  }

  private void writeVarinfo(VariableSlot slot) {
    Symbol symbol = slot.getSymbol();
    String sets = symbol.domain().isEmpty() ? "" : "(" + String.join(",", symbol.domain()) + ")";
    varinfo.printf("\"%s%s\",%d,%s,%s,\"%s\",\"%s\"\n", symbol.name(), sets, slot.getCount(), slot.getType().tag, slot.getUnit(),
                   symbol.description(), String.join(",", symbol.attributes()));
  }

  private void writeVars(VariableSlot slot) {
    Symbol symbol = slot.getSymbol();
    int regionIndex = VectorRegistry.US_UNITS.contains(slot.getUnit()) ? -1 : regionPosition(symbol.domain());

    slot.setVarsNumber(varsNumber);
    for (List<String> tuple : session.enumerator.product(symbol.domain(), session.isAlphabetic())) {
      String region = regionIndex >= 0 ? tuple.get(regionIndex) : session.config.defaultRegion;
      vars.printf("%d,\"%s(%s)\",\"%s\",\"%s\",\"%s\",\n", varsNumber++, symbol.name(), String.join(",", tuple),
                  symbol.description(), slot.getUnit(), region);
    }
  }

  /** Position of the region subscript: a destination or owner set if present, else the last region set. */
  int regionPosition(List<String> domain) {
    int region = -1;
    int dest = -1;
    String regions = session.config.regionSet;
    for (int i = 0; i < domain.size(); ++i) {
      String set = domain.get(i);
      if (set.equalsIgnoreCase(regions) || session.sets.isSubset(set, regions)) {
        region = i;
        if (set.equalsIgnoreCase("dest") || set.equalsIgnoreCase("owner"))
          dest = i;
      }
    }
    return dest >= 0 ? dest : region;
  }

  private void writeVarmap(VariableSlot slot) {
    Symbol symbol = slot.getSymbol();
    boolean isPar = symbol.isParameter();
    for (NamedVector vector : slot.getType().vectors().values()) {
      int offset = slot.offsetIn(vector).orElseThrow(() -> new IllegalStateException(symbol.name() + " not placed in " + vector));
      int n = isPar ? 0 : slot.getVarsNumber();
      for (List<String> tuple : session.enumerator.product(symbol.domain(), session.isAlphabetic())) {
        String element = vector.vectorName() + "[" + offset + "]";
        varmap.printf("\"%s(%s)\",\"%s\",%s,%d\n", symbol.name(), String.join(",", tuple), element, vector.vectorName(), offset);
        optmap.printf("%d,\"%s\",%s,%d%s\n", n, element, vector.vectorName(), offset, isPar ? ",0" : "");
        ++offset;
        if (!isPar)
          ++n;
      }
    }
  }
}

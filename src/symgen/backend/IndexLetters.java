package symgen.backend;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import symgen.codegen.SemanticException;
import symgen.frontend.SymbolTable;

/**
 * Index variable of each set for targets that write symbolic subscripts: the set's first letter, numbered when it
 * collides with a symbol name or an earlier index.
 */
public class IndexLetters {
  private final Map<String, String> indexBySet = new LinkedHashMap<>();
  private final Set<String> timeSets = new HashSet<>();

  public void add(String set, boolean isTime) {
    indexBySet.put(set, set.substring(0, 1));
    if (isTime)
      timeSets.add(set);
  }

  /** Renames indexes so that each one is unique and not a symbol name. */
  public void makeUnique(SymbolTable symbols) {
    Set<String> sofar = new HashSet<>();
    for (Map.Entry<String, String> entry : indexBySet.entrySet()) {
      String index = entry.getValue();
      char first = index.charAt(0);
      int n = 1;
      while (symbols.lookup(index).isPresent() || sofar.contains(index))
        index = first + Integer.toString(n++);
      entry.setValue(index);
      sofar.add(index);
    }
  }

  public String indexOf(String set) throws SemanticException {
    String ret = indexBySet.get(set);
    if (ret == null)
      throw new SemanticException("No index variable for set " + set);
    return ret;
  }

  public boolean isTime(String set) { return timeSets.contains(set); }
}

package symgen.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.util.CartesianProduct;

/**
 * In-memory model: symbol table, set hierarchy and equations. Built once through {@link Builder}, read-only afterwards.
 */
public class Model implements SymbolTable, SetQueries, ProductEnumerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Map<String, Symbol> symbolsByName;
  private final EnumMap<SymbolType, List<Symbol>> symbolsByType;
  private final Map<String, List<String>> supersets;
  private final Set<String> elements;
  private final List<Equation> equations;
  private final Set<String> usedNames;
  private final Map<String, List<Equation>> lhsUses = new HashMap<>();
  private final Map<String, List<Equation>> rhsUses = new HashMap<>();

  private Model(Builder builder) {
    this.symbolsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.symbols));
    this.symbolsByType = new EnumMap<>(SymbolType.class);
    for (SymbolType type : SymbolType.values())
      symbolsByType.put(type, symbolsByName.values().stream().filter(sym -> sym.type() == type).collect(Collectors.toUnmodifiableList()));
    this.supersets = new HashMap<>(builder.supersets);
    this.elements = symbolsByType.get(SymbolType.Set).stream().flatMap(set -> set.domain().stream()).collect(Collectors.toSet());
    this.equations = List.copyOf(builder.equations);

    this.usedNames = new HashSet<>();
    for (Equation eq : equations) {
      collectUses(eq, eq.getLhs(), lhsUses);
      collectUses(eq, eq.getRhs(), rhsUses);
    }
    logger.debug("Model with {} sets, {} parameters, {} variables, {} equations", symbolsByType.get(SymbolType.Set).size(),
                 symbolsByType.get(SymbolType.Parameter).size(), symbolsByType.get(SymbolType.Variable).size(), equations.size());
  }

  private void collectUses(Equation eq, Node side, Map<String, List<Equation>> uses) {
    side.forEach(node -> {
      List<String> names = new ArrayList<>();
      if (node.kind == NodeKind.Nam) {
        names.add(node.token);
        names.addAll(node.subscripts);
      } else if (node.kind.isAggregate())
        names.add(node.indexSet());
      for (String name : names) {
        usedNames.add(name);
        List<Equation> list = uses.computeIfAbsent(name, n -> new ArrayList<>());
        if (!list.contains(eq))
          list.add(eq);
      }
    });
  }

  //////////   SymbolTable   //////////

  @Override
  public List<Symbol> symbols(SymbolType type) {
    return symbolsByType.get(type);
  }

  @Override
  public Optional<Symbol> lookup(String name) {
    return Optional.ofNullable(symbolsByName.get(name));
  }

  @Override
  public int elementCount(Symbol symbol) {
    if (symbol.isSet())
      return symbol.domain().size();
    int ret = 1;
    for (String set : symbol.domain())
      ret *= cardinality(set);
    return ret;
  }

  @Override
  public boolean isUsed(Symbol symbol) {
    return usedNames.contains(symbol.name());
  }

  @Override
  public List<Equation> equationsUsing(Symbol symbol, boolean lhs) {
    return (lhs ? lhsUses : rhsUses).getOrDefault(symbol.name(), List.of());
  }

  @Override
  public List<Equation> equations() {
    return equations;
  }

  //////////   SetQueries   //////////

  @Override
  public List<String> elementsOf(String set) {
    Symbol symbol = symbolsByName.get(set);
    if (symbol == null || !symbol.isSet())
      return List.of();
    return symbol.domain();
  }

  @Override
  public boolean isSubset(String subset, String superset) {
    for (String sup : immediateSupersets(subset))
      if (sup.equals(superset) || isSubset(sup, superset))
        return true;
    return false;
  }

  @Override
  public List<String> immediateSupersets(String set) {
    return supersets.getOrDefault(set, List.of());
  }

  @Override
  public boolean isSet(String name) {
    Symbol symbol = symbolsByName.get(name);
    return symbol != null && symbol.isSet();
  }

  @Override
  public boolean isElement(String token) {
    return elements.contains(token);
  }

  //////////   ProductEnumerator   //////////

  @Override
  public Iterable<List<String>> product(List<String> sets, boolean alphabetic) {
    List<List<String>> dims = new ArrayList<>();
    for (String set : sets)
      dims.add(elementsOf(set, alphabetic));
    return new CartesianProduct(dims);
  }

  /**
   * Collects declarations and equations in file order.
   */
  public static class Builder {
    private final LinkedHashMap<String, Symbol> symbols = new LinkedHashMap<>();
    private final Map<String, List<String>> supersets = new HashMap<>();
    private final List<Equation> equations = new ArrayList<>();

    private void add(Symbol symbol) {
      if (symbols.containsKey(symbol.name()))
        throw new IllegalArgumentException("Symbol declared twice: " + symbol.name());
      symbols.put(symbol.name(), symbol);
    }

    public Builder set(String name, String description, List<String> elements) {
      add(new Symbol(name, SymbolType.Set, description, elements, List.of()));
      return this;
    }

    /** Declares a set as a subset of previously declared sets. */
    public Builder subset(String name, String description, List<String> elements, String... supersetNames) {
      for (String sup : supersetNames) {
        Symbol supSymbol = symbols.get(sup);
        if (supSymbol == null || !supSymbol.isSet())
          throw new IllegalArgumentException("Superset of " + name + " is not a declared set: " + sup);
        if (!supSymbol.domain().containsAll(elements))
          throw new IllegalArgumentException("Set " + name + " has elements outside of " + sup);
      }
      set(name, description, elements);
      supersets.put(name, List.of(supersetNames));
      return this;
    }

    public Builder parameter(String name, String description, List<String> domain, List<String> attributes) {
      add(new Symbol(name, SymbolType.Parameter, description, domain, attributes));
      return this;
    }

    public Builder variable(String name, String description, List<String> domain, List<String> attributes) {
      add(new Symbol(name, SymbolType.Variable, description, domain, attributes));
      return this;
    }

    /** Adds an equation; it is numbered by its position. */
    public Builder equation(String name, String label, Node lhs, Node rhs) {
      equations.add(new Equation(equations.size() + 1, name, label, lhs, rhs));
      return this;
    }

    public Model build() { return new Model(this); }
  }
}

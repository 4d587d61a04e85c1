package symgen.frontend;

import java.util.List;
import java.util.Optional;

/**
 * Registry of declared symbols and the equations that use them.
 */
public interface SymbolTable {
  /** Symbols of one class in registration order. */
  List<Symbol> symbols(SymbolType type);

  Optional<Symbol> lookup(String name);

  /** Number of scalar elements of a symbol: the product of its domain's cardinalities. */
  int elementCount(Symbol symbol);

  /** True if the symbol appears in any equation. */
  boolean isUsed(Symbol symbol);

  /** Equations using the symbol on the requested side. */
  List<Equation> equationsUsing(Symbol symbol, boolean lhs);

  /** All equations in file order. */
  List<Equation> equations();
}

package symgen.backend.python;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import symgen.frontend.Symbol;

/** Vector placement of one declared variable or parameter. */
public class VariableSlot {
  private final Symbol symbol;
  private final VariableType type;
  private final String unit;
  private final int count;
  /** key: driving vector, value: first element */
  private final Map<NamedVector, Integer> offsets = new EnumMap<>(NamedVector.class);
  private int varsNumber = 0;

  VariableSlot(Symbol symbol, VariableType type, String unit, int count) {
    this.symbol = symbol;
    this.type = type;
    this.unit = unit;
    this.count = count;
  }

  public Symbol getSymbol() { return symbol; }
  public String getName() { return symbol.name(); }
  public VariableType getType() { return type; }
  /** Unit tag; empty for parameters. */
  public String getUnit() { return unit; }
  /** Number of scalar elements. */
  public int getCount() { return count; }

  /** First element of this slot in the given vector, if placed there. */
  public Optional<Integer> offsetIn(NamedVector vector) { return Optional.ofNullable(offsets.get(vector)); }

  Map<NamedVector, Integer> offsets() { return Collections.unmodifiableMap(offsets); }

  void place(NamedVector vector, int offset) { offsets.put(vector, offset); }

  /** Row number of the first element in the variable list, 0 if not listed. */
  public int getVarsNumber() { return varsNumber; }
  void setVarsNumber(int varsNumber) { this.varsNumber = varsNumber; }

  @Override
  public String toString() {
    return symbol.name() + " (" + type.tag + ", " + count + " elements) " + offsets;
  }
}

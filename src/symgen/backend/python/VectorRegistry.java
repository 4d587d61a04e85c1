package symgen.backend.python;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import symgen.codegen.AllocationException;
import symgen.codegen.SemanticException;
import symgen.frontend.Symbol;

/**
 * Reserves space for each symbol in the solver vectors. Driving vectors grow by the symbol's element count;
 * followers reuse the offset their driver assigned to the same symbol.
 */
public class VectorRegistry {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final List<String> UNITS = List.of("del", "pct", "gdp", "usgdp", "cent", "dollar", "gwh", "gwhgdp", "idx",
                                                   "nomusdbillion", "realusdbillion", "btu", "mmt", "btugdp", "mmtgdp",
                                                   "btuusgdp", "mmtusgdp");
  /** Units normalized on US GDP. */
  public static final List<String> US_UNITS = List.of("usgdp", "btuusgdp", "mmtusgdp", "gwhusgdp");

  /** A reference resolved to one vector element. */
  public record Location(NamedVector vector, int offset) {
    @Override
    public String toString() {
      return vector.vectorName() + "[" + offset + "]";
    }
  }

  private final Map<NamedVector, Integer> lengths = new EnumMap<>(NamedVector.class);
  private final Map<String, VariableSlot> slots = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
  private final List<VariableSlot> declared = new ArrayList<>();

  public VectorRegistry() {
    for (NamedVector vector : NamedVector.values())
      lengths.put(vector, 0);
  }

  /**
   * Registers a parameter or variable and reserves its space in every vector its type can appear in. A variable
   * needs exactly one type tag and a unit among its attributes.
   *
   * @param count number of scalar elements
   */
  public VariableSlot declare(Symbol symbol, int count) throws SemanticException, AllocationException {
    if (slots.containsKey(symbol.name()))
      throw new SemanticException("Multiple definitions of variable: " + symbol.name());

    VariableType type = symbol.isParameter() ? VariableType.Par : typeOf(symbol);
    String unit = symbol.isParameter() ? "" : unitOf(symbol);
    VariableSlot slot = new VariableSlot(symbol, type, unit, count);
    allocateAll(slot);

    slots.put(symbol.name(), slot);
    declared.add(slot);
    logger.debug("Declared {}", slot);
    return slot;
  }

  private static VariableType typeOf(Symbol symbol) throws SemanticException {
    VariableType found = null;
    for (String attribute : symbol.attributes()) {
      Optional<VariableType> type = VariableType.fromTag(attribute);
      if (type.isEmpty() || type.get() == VariableType.Par)
        continue;
      if (found != null && found != type.get())
        throw new SemanticException("Multiple variable types for variable: " + symbol.name());
      found = type.get();
    }
    if (found == null)
      throw new SemanticException("No type declared for variable " + symbol.name());
    return found;
  }

  private static String unitOf(Symbol symbol) throws SemanticException {
    for (String unit : UNITS)
      if (symbol.hasAttribute(unit))
        return unit;
    throw new SemanticException("No units given for variable " + symbol.name() + " with attributes " +
                                String.join(",", symbol.attributes()));
  }

  /** Places the slot in the vector of every legal context of its type, drivers before followers. */
  void allocateAll(VariableSlot slot) throws AllocationException {
    for (UsageContext context : slot.getType().vectors().keySet())
      allocate(slot, context);
  }

  /** Places the slot in the vector its type uses in {@code context}; a follower needs its driver placed first. */
  void allocate(VariableSlot slot, UsageContext context) throws AllocationException {
    Optional<NamedVector> vector = slot.getType().vectorFor(context);
    if (vector.isEmpty() || slot.offsetIn(vector.get()).isPresent())
      return;
    NamedVector target = vector.get();
    if (target.isDriver()) {
      int start = lengths.get(target);
      slot.place(target, start);
      lengths.put(target, start + slot.getCount());
      return;
    }
    Optional<Integer> start = slot.offsetIn(target.driver());
    if (start.isEmpty())
      throw new AllocationException(target + " without " + target.driver());
    slot.place(target, start.get());
  }

  public Optional<VariableSlot> lookup(String name) { return Optional.ofNullable(slots.get(name)); }

  /** Slots in declaration order. */
  public List<VariableSlot> slots() { return Collections.unmodifiableList(declared); }

  /**
   * Resolves element {@code index} of a symbol referenced in {@code context}.
   *
   * @param index row-major position of the element within the symbol's domain
   */
  public Location locate(String name, int index, UsageContext context) throws SemanticException {
    VariableSlot slot = lookup(name).orElseThrow(() -> new SemanticException("Name not in variable list: " + name));
    Optional<NamedVector> vector = slot.getType().vectorFor(context);
    if (vector.isEmpty())
      throw new SemanticException("Invalid context for variable " + name + ": Type '" + slot.getType().tag + "' on " +
                                  context.description);
    if (index < 0 || index >= slot.getCount())
      throw new SemanticException("Element " + index + " out of range for " + name);
    int offset = slot.offsetIn(vector.get()).orElseThrow(() -> new IllegalStateException(name + " not placed in " + vector.get()));
    return new Location(vector.get(), offset + index);
  }

  /** Number of elements reserved in a driving vector; followers report their driver's length. */
  public int lengthOf(NamedVector vector) { return lengths.get(vector.driver()); }

  /** Elements the endogenous vectors reserve for the given slots. */
  public static int endogenousCount(Collection<VariableSlot> slots) {
    int ret = 0;
    for (VariableSlot slot : slots)
      if (slot.getType().reservesEndogenous())
        ret += slot.getCount();
    return ret;
  }
}

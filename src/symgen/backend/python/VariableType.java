package symgen.backend.python;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Role of a symbol in the solver, selected by an attribute tag. The type decides which vector a reference lands in
 * for each usage context; contexts without a vector are illegal for the type.
 */
public enum VariableType {
  End("end", Map.of(UsageContext.CurLhs, NamedVector.Z1L, UsageContext.CurRhs, NamedVector.Z1R)),
  Ets("ets", Map.of(UsageContext.CurLhs, NamedVector.ZEL, UsageContext.CurRhs, NamedVector.ZER, UsageContext.LeadRhs,
                    NamedVector.EXZ)),
  Exo("exo", Map.of(UsageContext.CurRhs, NamedVector.EXO)),
  Cos("cos", Map.of(UsageContext.LeadLhs, NamedVector.J1L, UsageContext.CurRhs, NamedVector.YJR)),
  Sta("sta", Map.of(UsageContext.LeadLhs, NamedVector.X1L, UsageContext.CurRhs, NamedVector.YXR)),
  Stl("stl", Map.of(UsageContext.CurLhs, NamedVector.X1L, UsageContext.LagRhs, NamedVector.YXR, UsageContext.CurRhs,
                    NamedVector.X1R)),
  Par("par", Map.of(UsageContext.CurRhs, NamedVector.PAR));

  public final String tag;
  private final Map<UsageContext, NamedVector> vectors;

  private VariableType(String tag, Map<UsageContext, NamedVector> vectors) {
    this.tag = tag;
    this.vectors = Collections.unmodifiableMap(new EnumMap<>(vectors));
  }

  public Optional<NamedVector> vectorFor(UsageContext context) { return Optional.ofNullable(vectors.get(context)); }

  /** Legal contexts with their vectors, in context order. */
  public Map<UsageContext, NamedVector> vectors() { return vectors; }

  /** True if the type takes space in one of the endogenous vectors. */
  public boolean reservesEndogenous() { return vectors.values().stream().anyMatch(NamedVector::isEndogenous); }

  public static Optional<VariableType> fromTag(String tag) {
    for (VariableType type : values())
      if (type.tag.equals(tag))
        return Optional.of(type);
    return Optional.empty();
  }
}

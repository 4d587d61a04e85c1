package symgen.backend.python;

/**
 * Vectors of the solver's {@code msgproc} interface. A follower shares the offsets of its driver, so a variable
 * occupies the same positions in both.
 */
public enum NamedVector {
  Z1L(null),
  ZEL(null),
  J1L(null),
  X1L(null),
  EXO(null),
  PAR(null),
  Z1R(Z1L),
  ZER(ZEL),
  EXZ(ZEL),
  YJR(J1L),
  YXR(X1L),
  X1R(X1L);

  private final NamedVector driver;

  private NamedVector(NamedVector driver) { this.driver = driver; }

  /** Vector whose offsets this one reuses; the vector itself if it reserves its own space. */
  public NamedVector driver() { return driver == null ? this : driver; }

  public boolean isDriver() { return driver == null; }

  /** Name of the vector in generated code. */
  public String vectorName() { return name().toLowerCase(); }

  /** Vectors that hold the endogenous unknowns of the model. */
  public boolean isEndogenous() { return this == Z1L || this == ZEL || this == J1L || this == X1L; }
}

package symgen.codegen;

/**
 * Expansion mode for equations and for sum/prod nodes.
 */
public enum Style {
  /** One output statement (or term) per element combination. */
  Scalar,
  /** One statement over whole sets. */
  Vector
}

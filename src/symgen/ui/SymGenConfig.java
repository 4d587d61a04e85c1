package symgen.ui;

/**
 * Data-Class to hold generation options.
 */
public class SymGenConfig {

  /** Maximum output line width; 0 selects the target's default. */
  public int lineLength = 0;
  /** Break a binary operation when both operands together exceed this length. */
  public int breakCombinedLength = 70;
  /** Break a binary operation when either operand exceeds this length. */
  public int breakSideLength = 40;

  /** Write equations as {@code LHS - (RHS)}. */
  public boolean normalized = false;
  /** Enumerate set elements in alphabetical order. */
  public boolean alphabeticElements = false;
  /** TABLO formula mode: declare used symbols only and compute the LHS variables. */
  public boolean calcMode = false;

  /** Set whose position in a variable's domain gives the region column of the variable list. */
  public String regionSet = "regions";
  /** Region reported for variables without a region subscript. */
  public String defaultRegion = "USA";
}

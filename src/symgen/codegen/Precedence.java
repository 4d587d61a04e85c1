package symgen.codegen;

import java.util.EnumSet;
import symgen.frontend.NodeKind;

/**
 * Parenthesization rules, decided by the kind of a node and the kind of its parent.
 * The code variant additionally never wraps lag and lead nodes under neg, dvd and pow, and leaves
 * operands of log, exp, lag and lead bare since the function envelope or shift already delimits them.
 */
public final class Precedence {
  private Precedence() {}

  private static final EnumSet<NodeKind> NEG_BARE =
      EnumSet.of(NodeKind.Nam, NodeKind.Num, NodeKind.Mul, NodeKind.Log, NodeKind.Exp, NodeKind.Pow, NodeKind.Sum, NodeKind.Prd);
  private static final EnumSet<NodeKind> DVD_BARE =
      EnumSet.of(NodeKind.Nam, NodeKind.Num, NodeKind.Pow, NodeKind.Sum, NodeKind.Prd, NodeKind.Log, NodeKind.Exp);
  private static final EnumSet<NodeKind> POW_BARE =
      EnumSet.of(NodeKind.Nam, NodeKind.Num, NodeKind.Log, NodeKind.Exp, NodeKind.Sum, NodeKind.Prd);

  /**
   * @param parent kind of the parent node, {@code null} or {@link NodeKind#Nul} at the top of a side
   * @param child kind of the node being rendered
   * @param codeVariant rules of the output renderer rather than the diagnostic printer
   * @throws IllegalStateException if {@code parent} cannot have rendered children
   */
  public static boolean needsParens(NodeKind parent, NodeKind child, boolean codeVariant) {
    if (parent == null)
      parent = NodeKind.Nul;
    switch (parent) {
    case Nul:
    case Add:
    case Sub:
      return child == NodeKind.Neg;
    case Mul:
      return child == NodeKind.Add || child == NodeKind.Sub || child == NodeKind.Dvd || child == NodeKind.Neg;
    case Neg:
      return !NEG_BARE.contains(child) && !(codeVariant && child.isTimeShift());
    case Dvd:
      return !DVD_BARE.contains(child) && !(codeVariant && child.isTimeShift());
    case Pow:
      return !POW_BARE.contains(child) && !(codeVariant && child.isTimeShift());
    case Log:
    case Exp:
    case Lag:
    case Led:
      return !codeVariant;
    case Sum:
    case Prd:
    case Equ:
    case Dom:
    case Nam:
    case Num:
      return false;
    default:
      throw new IllegalStateException("Invalid parent node kind for rendering: " + parent);
    }
  }

  /** True if a comma separates a name or number from a sibling of the same sort. */
  public static boolean needsComma(NodeKind parent, NodeKind child) {
    return (parent == NodeKind.Nam || parent == NodeKind.Num) && (child == NodeKind.Nam || child == NodeKind.Num);
  }
}

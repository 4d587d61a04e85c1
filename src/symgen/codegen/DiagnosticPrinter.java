package symgen.codegen;

import symgen.frontend.Node;
import symgen.frontend.NodeKind;

/**
 * Prints expression trees for log and error messages: literal operator tokens, lst chains as parenthesized lists,
 * no backend involvement.
 */
public final class DiagnosticPrinter {
  private DiagnosticPrinter() {}

  static final int BREAK_COMBINED = 70;
  static final int BREAK_SIDE = 40;

  /** Single-line rendering. */
  public static String print(Node node) { return print(NodeKind.Nul, node, null); }

  /** Rendering with long operands broken onto new lines starting with {@code indent}. */
  public static String print(Node node, String indent) { return print(NodeKind.Nul, node, indent); }

  private static String print(NodeKind parent, Node cur, String indent) {
    if (cur == null)
      return "";
    boolean parens = Precedence.needsParens(parent, cur.kind, false);
    String comma = Precedence.needsComma(parent, cur.kind) ? "," : "";

    switch (cur.kind) {
    case Sum:
    case Prd:
      return cur.token + "(" + print(cur.kind, cur.left, indent) + "," + print(cur.kind, cur.right, indent) + ")";
    case Lst:
      return "(" + String.join(",", cur.listTokens()) + ")";
    default:
      break;
    }

    String lstr = print(cur.kind, cur.left, indent);
    String rstr = print(cur.kind, cur.right, indent);
    String cr = "";
    if (indent != null && (lstr.length() + rstr.length() > BREAK_COMBINED || lstr.length() > BREAK_SIDE || rstr.length() > BREAK_SIDE))
      cr = "\n" + indent;
    boolean wrapRight = cur.kind == NodeKind.Sub && (cur.right.kind == NodeKind.Add || cur.right.kind == NodeKind.Sub);
    String right = wrapRight ? "(" + rstr + ")" : rstr;
    String chunk = lstr + comma + cr + cur.token + right;
    return parens ? "(" + chunk + ")" : chunk;
  }
}

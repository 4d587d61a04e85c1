package symgen.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Immutable expression tree node. Unary operators (neg, log, exp, lag, lead) keep their operand as the right child.
 * A name node stores the use-site subscripts; its right child is a lst chain of the same tokens for diagnostics.
 * Sum and prod nodes keep the index set as a name node on the left and the body on the right.
 */
public final class Node {
  public final NodeKind kind;
  /** Operator token, symbol name, number text or function name. */
  public final String token;
  public final Node left;
  public final Node right;
  /** Use-site subscripts of a name node: set names or literal elements. Empty for every other kind. */
  public final List<String> subscripts;
  public final boolean lhs;
  /** Accumulated time shift; lag adds -1, lead +1. */
  public final int dt;

  private Node(NodeKind kind, String token, Node left, Node right, List<String> subscripts, boolean lhs, int dt) {
    this.kind = kind;
    this.token = token;
    this.left = left;
    this.right = right;
    this.subscripts = subscripts;
    this.lhs = lhs;
    this.dt = dt;
  }
  private Node(NodeKind kind, String token, Node left, Node right) { this(kind, token, left, right, List.of(), false, 0); }

  public static Node name(String name, String... subscripts) { return name(name, List.of(subscripts)); }
  public static Node name(String name, List<String> subscripts) {
    Objects.requireNonNull(name);
    List<String> subs = List.copyOf(subscripts);
    return new Node(NodeKind.Nam, name, null, subs.isEmpty() ? null : list(subs), subs, false, 0);
  }
  public static Node number(String text) { return new Node(NodeKind.Num, text, null, null); }
  public static Node number(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value))
      return number(Long.toString((long)value));
    return number(Double.toString(value));
  }

  /** Right-linked chain of literal tokens, headed by an empty lst node. */
  public static Node list(List<String> tokens) {
    Node chain = null;
    for (int i = tokens.size() - 1; i >= 0; --i)
      chain = new Node(NodeKind.Lst, tokens.get(i), null, chain);
    return new Node(NodeKind.Lst, "", null, chain);
  }

  public static Node add(Node l, Node r) { return binary(NodeKind.Add, l, r); }
  public static Node sub(Node l, Node r) { return binary(NodeKind.Sub, l, r); }
  public static Node mul(Node l, Node r) { return binary(NodeKind.Mul, l, r); }
  public static Node div(Node l, Node r) { return binary(NodeKind.Dvd, l, r); }
  public static Node pow(Node l, Node r) { return binary(NodeKind.Pow, l, r); }
  public static Node neg(Node operand) { return new Node(NodeKind.Neg, "-", null, operand); }
  public static Node log(Node operand) { return new Node(NodeKind.Log, "log", null, operand); }
  public static Node exp(Node operand) { return new Node(NodeKind.Exp, "exp", null, operand); }
  public static Node lag(Node operand) { return new Node(NodeKind.Lag, "lag", null, operand); }
  public static Node lead(Node operand) { return new Node(NodeKind.Led, "lead", null, operand); }
  public static Node sum(String set, Node body) { return new Node(NodeKind.Sum, "sum", name(set), body); }
  public static Node prod(String set, Node body) { return new Node(NodeKind.Prd, "prod", name(set), body); }
  public static Node equation(Node lhs, Node rhs) { return binary(NodeKind.Equ, lhs, rhs); }
  /** Expression annotated with the sets it is defined over. */
  public static Node domain(Node expression, List<String> sets) { return new Node(NodeKind.Dom, "", expression, list(sets)); }

  public static Node binary(NodeKind kind, Node l, Node r) {
    String token;
    switch (kind) {
    case Add:
      token = "+";
      break;
    case Sub:
      token = "-";
      break;
    case Mul:
      token = "*";
      break;
    case Dvd:
      token = "/";
      break;
    case Pow:
      token = "^";
      break;
    case Equ:
      token = "=";
      break;
    default:
      throw new IllegalArgumentException("Not a binary node kind: " + kind);
    }
    return new Node(kind, token, Objects.requireNonNull(l), Objects.requireNonNull(r));
  }

  /** Index set of a sum or prod node. */
  public String indexSet() {
    if (!kind.isAggregate())
      throw new IllegalStateException("No index set on " + kind);
    return left.token;
  }

  /**
   * Returns a copy of this tree with the side flag set on every node and time shifts accumulated from the given start.
   */
  public Node annotate(boolean lhs, int dt) {
    int childDt = dt;
    if (kind == NodeKind.Lag)
      childDt = dt - 1;
    else if (kind == NodeKind.Led)
      childDt = dt + 1;
    Node newLeft = (left == null || kind == NodeKind.Lst) ? left : left.annotate(lhs, childDt);
    Node newRight = (right == null || kind == NodeKind.Lst || kind == NodeKind.Nam) ? right : right.annotate(lhs, childDt);
    return new Node(kind, token, newLeft, newRight, subscripts, lhs, kind.isTimeShift() ? childDt : dt);
  }

  /** Visits this node and its subtrees in pre-order, skipping lst chains and the index node of sum and prod. */
  public void forEach(Consumer<Node> visitor) {
    if (kind == NodeKind.Lst)
      return;
    visitor.accept(this);
    if (left != null && !kind.isAggregate())
      left.forEach(visitor);
    if (right != null && kind != NodeKind.Nam)
      right.forEach(visitor);
  }

  /** Tokens of a lst chain (excluding its head). */
  public List<String> listTokens() {
    if (kind != NodeKind.Lst)
      return Collections.emptyList();
    List<String> ret = new ArrayList<>();
    for (Node cur = right; cur != null; cur = cur.right)
      ret.add(cur.token);
    return ret;
  }

  @Override
  public String toString() {
    return kind.serialName + "(" + token + (subscripts.isEmpty() ? "" : subscripts.toString()) + ")";
  }
}

package symgen.frontend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * One model equation. Both sides are annotated on construction: every node knows its side and accumulated time shift.
 */
public class Equation {
  private final int number;
  private final String name;
  private final String label;
  private final Node lhs;
  private final Node rhs;

  /**
   * @param number 1-based position in the model file
   * @param name equation name, may be null
   * @param label descriptive label, may be null
   */
  public Equation(int number, String name, String label, Node lhs, Node rhs) {
    this.number = number;
    this.name = name;
    this.label = label;
    this.lhs = lhs.annotate(true, 0);
    this.rhs = rhs.annotate(false, 0);
  }

  public int getNumber() { return number; }
  public Optional<String> getName() { return Optional.ofNullable(name); }
  public Optional<String> getLabel() { return Optional.ofNullable(label); }
  public Node getLhs() { return lhs; }
  public Node getRhs() { return rhs; }
  /** Both sides joined under an equ root, for diagnostics. */
  public Node asNode() { return Node.equation(lhs, rhs); }

  /**
   * Free index sets of the equation in order of first appearance, left side first.
   * Sets bound by an enclosing sum or prod are not free.
   */
  public List<String> definedOverSets(SetQueries sets) {
    LinkedHashSet<String> ret = new LinkedHashSet<>();
    Deque<String> bound = new ArrayDeque<>();
    collectSets(lhs, sets, bound, ret);
    collectSets(rhs, sets, bound, ret);
    return new ArrayList<>(ret);
  }

  private static void collectSets(Node node, SetQueries sets, Deque<String> bound, LinkedHashSet<String> out) {
    if (node == null || node.kind == NodeKind.Lst)
      return;
    if (node.kind == NodeKind.Nam) {
      for (String sub : node.subscripts)
        if (sets.isSet(sub) && !bound.contains(sub))
          out.add(sub);
      return;
    }
    if (node.kind.isAggregate()) {
      bound.push(node.indexSet());
      collectSets(node.right, sets, bound, out);
      bound.pop();
      return;
    }
    collectSets(node.left, sets, bound, out);
    collectSets(node.right, sets, bound, out);
  }

  /** Names of all symbols referenced by the equation, in order of appearance. */
  public List<String> referencedNames() {
    LinkedHashSet<String> ret = new LinkedHashSet<>();
    lhs.forEach(node -> {
      if (node.kind == NodeKind.Nam)
        ret.add(node.token);
    });
    rhs.forEach(node -> {
      if (node.kind == NodeKind.Nam)
        ret.add(node.token);
    });
    return new ArrayList<>(ret);
  }

  /**
   * True if a name is not declared as a parameter or variable, or a subscript is neither a set nor an element,
   * or a sum or prod ranges over an unknown set.
   */
  public boolean hasUndeclaredSymbol(SymbolTable symbols, SetQueries sets) {
    boolean[] found = {false};
    Consumer<Node> check = node -> {
      if (node.kind == NodeKind.Nam) {
        Optional<Symbol> symbol = symbols.lookup(node.token);
        if (symbol.isEmpty() || symbol.get().isSet())
          found[0] = true;
        for (String sub : node.subscripts)
          if (!sets.isSet(sub) && !sets.isElement(sub))
            found[0] = true;
      } else if (node.kind.isAggregate() && !sets.isSet(node.indexSet()))
        found[0] = true;
    };
    lhs.forEach(check);
    rhs.forEach(check);
    return found[0];
  }

  /** True if every lag and lead applies to a variable reference, possibly through further lags or leads. */
  public boolean isTimeDomainValid(SymbolTable symbols) {
    boolean[] valid = {true};
    Consumer<Node> check = node -> {
      if (node.kind.isTimeShift() && !isVariableReference(stripTimeShifts(node), symbols))
        valid[0] = false;
    };
    lhs.forEach(check);
    rhs.forEach(check);
    return valid[0];
  }

  /** Number of scalar equations this equation expands to; 0 if it references undeclared symbols. */
  public int scalarCount(SymbolTable symbols, SetQueries sets) {
    if (hasUndeclaredSymbol(symbols, sets))
      return 0;
    int count = 1;
    for (String set : definedOverSets(sets))
      count *= sets.cardinality(set);
    return count;
  }

  /** True if the left side is a single variable reference, optionally wrapped in lag or lead. */
  public boolean isLvalue(SymbolTable symbols) { return isVariableReference(stripTimeShifts(lhs), symbols); }

  /** First name referenced on the left side. */
  public Optional<String> lhsSymbolName() {
    List<String> names = new ArrayList<>();
    lhs.forEach(node -> {
      if (node.kind == NodeKind.Nam)
        names.add(node.token);
    });
    return names.stream().findFirst();
  }

  private static Node stripTimeShifts(Node node) {
    Node cur = node;
    while (cur != null && cur.kind.isTimeShift())
      cur = cur.right;
    return cur;
  }

  private static boolean isVariableReference(Node node, SymbolTable symbols) {
    return node != null && node.kind == NodeKind.Nam && symbols.lookup(node.token).map(Symbol::isVariable).orElse(false);
  }

  @Override
  public String toString() {
    return "Equation " + number + (name != null ? " " + name : "");
  }
}

package symgen.codegen;

import java.util.EnumSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import symgen.frontend.NodeKind;

class PrecedenceTest {

  // children that can appear below an operator
  static final EnumSet<NodeKind> CHILDREN = EnumSet.complementOf(EnumSet.of(NodeKind.Equ, NodeKind.Nul, NodeKind.Lst));

  @ParameterizedTest
  @EnumSource(value = NodeKind.class, names = {"Nul", "Add", "Sub"})
  void testAdditiveParents(NodeKind parent) {
    for (NodeKind child : CHILDREN)
      Assertions.assertEquals(child == NodeKind.Neg, Precedence.needsParens(parent, child, false), parent + " over " + child);
  }

  @Test
  void testMulParent() {
    EnumSet<NodeKind> wrapped = EnumSet.of(NodeKind.Add, NodeKind.Sub, NodeKind.Dvd, NodeKind.Neg);
    for (NodeKind child : CHILDREN)
      Assertions.assertEquals(wrapped.contains(child), Precedence.needsParens(NodeKind.Mul, child, false), "mul over " + child);
  }

  @Test
  void testNegDvdPowParents() {
    EnumSet<NodeKind> negBare = EnumSet.of(NodeKind.Nam, NodeKind.Num, NodeKind.Mul, NodeKind.Log, NodeKind.Exp, NodeKind.Pow,
                                           NodeKind.Sum, NodeKind.Prd);
    EnumSet<NodeKind> dvdBare = EnumSet.of(NodeKind.Nam, NodeKind.Num, NodeKind.Pow, NodeKind.Sum, NodeKind.Prd, NodeKind.Log,
                                           NodeKind.Exp);
    EnumSet<NodeKind> powBare = EnumSet.of(NodeKind.Nam, NodeKind.Num, NodeKind.Log, NodeKind.Exp, NodeKind.Sum, NodeKind.Prd);
    for (NodeKind child : CHILDREN) {
      Assertions.assertEquals(!negBare.contains(child), Precedence.needsParens(NodeKind.Neg, child, false), "neg over " + child);
      Assertions.assertEquals(!dvdBare.contains(child), Precedence.needsParens(NodeKind.Dvd, child, false), "dvd over " + child);
      Assertions.assertEquals(!powBare.contains(child), Precedence.needsParens(NodeKind.Pow, child, false), "pow over " + child);
    }
  }

  @Test
  void testCodeVariantLeavesTimeShiftsBare() {
    for (NodeKind parent : EnumSet.of(NodeKind.Neg, NodeKind.Dvd, NodeKind.Pow)) {
      Assertions.assertTrue(Precedence.needsParens(parent, NodeKind.Lag, false));
      Assertions.assertFalse(Precedence.needsParens(parent, NodeKind.Lag, true));
      Assertions.assertFalse(Precedence.needsParens(parent, NodeKind.Led, true));
      Assertions.assertTrue(Precedence.needsParens(parent, NodeKind.Add, true));
    }
  }

  @ParameterizedTest
  @EnumSource(value = NodeKind.class, names = {"Log", "Exp", "Lag", "Led"})
  void testFunctionParents(NodeKind parent) {
    for (NodeKind child : CHILDREN) {
      Assertions.assertTrue(Precedence.needsParens(parent, child, false));
      Assertions.assertFalse(Precedence.needsParens(parent, child, true));
    }
  }

  @ParameterizedTest
  @EnumSource(value = NodeKind.class, names = {"Sum", "Prd", "Equ", "Dom", "Nam", "Num"})
  void testTransparentParents(NodeKind parent) {
    for (NodeKind child : CHILDREN) {
      Assertions.assertFalse(Precedence.needsParens(parent, child, false));
      Assertions.assertFalse(Precedence.needsParens(parent, child, true));
    }
  }

  @Test
  void testNullParentIsTopLevel() {
    Assertions.assertTrue(Precedence.needsParens(null, NodeKind.Neg, false));
    Assertions.assertFalse(Precedence.needsParens(null, NodeKind.Add, true));
  }

  @Test
  void testListParentIsRejected() {
    Assertions.assertThrows(IllegalStateException.class, () -> Precedence.needsParens(NodeKind.Lst, NodeKind.Nam, false));
  }

  @Test
  void testComma() {
    Assertions.assertTrue(Precedence.needsComma(NodeKind.Nam, NodeKind.Num));
    Assertions.assertTrue(Precedence.needsComma(NodeKind.Num, NodeKind.Nam));
    Assertions.assertFalse(Precedence.needsComma(NodeKind.Add, NodeKind.Nam));
    Assertions.assertFalse(Precedence.needsComma(NodeKind.Nam, NodeKind.Lst));
  }
}

package symgen.frontend;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Kind of an expression tree node. The serial name is the token used in model files.
 */
public enum NodeKind {
  Add("add"),
  Sub("sub"),
  Mul("mul"),
  Dvd("dvd"),
  Neg("neg"),
  Pow("pow"),
  Log("log"),
  Exp("exp"),
  Lag("lag"),
  Led("lead"),
  Sum("sum"),
  Prd("prod"),
  Nam("nam"),
  Num("num"),
  Equ("equ"),
  Dom("dom"),
  Lst("lst"),
  Nul("nul");

  public final String serialName;
  private NodeKind(String serialName) { this.serialName = serialName; }

  public static Optional<NodeKind> fromSerialName(String serialName) {
    return Stream.of(NodeKind.values()).filter(kind -> kind.serialName.equals(serialName)).findAny();
  }

  /** True for the binary arithmetic operators that render as an infix token. */
  public boolean isInfix() { return this == Add || this == Sub || this == Mul || this == Dvd || this == Pow; }

  /** True for sum and product over a set. */
  public boolean isAggregate() { return this == Sum || this == Prd; }

  /** True for lag and lead. */
  public boolean isTimeShift() { return this == Lag || this == Led; }
}

package symgen.frontend;

/**
 * Symbol classes, in the order they are declared to a backend.
 */
public enum SymbolType {
  Set("set"),
  Parameter("parameter"),
  Variable("variable");

  public final String serialName;
  private SymbolType(String serialName) { this.serialName = serialName; }
}

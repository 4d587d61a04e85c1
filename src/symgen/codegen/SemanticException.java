package symgen.codegen;

/**
 * A symbol is used in a way the target cannot express, or is declared twice.
 */
public class SemanticException extends GenerationException {
  private static final long serialVersionUID = 1L;

  public SemanticException(String message) { super(message); }
  public SemanticException(String message, Throwable cause) { super(message, cause); }
}

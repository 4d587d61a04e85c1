package symgen.codegen;

/**
 * Counted equations or slots do not add up.
 */
public class ConsistencyException extends GenerationException {
  private static final long serialVersionUID = 1L;

  public ConsistencyException(String message) { super(message); }
  public ConsistencyException(String message, Throwable cause) { super(message, cause); }
}

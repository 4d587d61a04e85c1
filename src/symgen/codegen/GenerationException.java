package symgen.codegen;

/**
 * Base of all errors that abort a generation run.
 */
public class GenerationException extends Exception {
  private static final long serialVersionUID = 1L;

  public GenerationException(String message) { super(message); }
  public GenerationException(String message, Throwable cause) { super(message, cause); }
}

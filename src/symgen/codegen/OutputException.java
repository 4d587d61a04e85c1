package symgen.codegen;

/**
 * An output file could not be created, written or moved into place.
 */
public class OutputException extends GenerationException {
  private static final long serialVersionUID = 1L;

  public OutputException(String message) { super(message); }
  public OutputException(String message, Throwable cause) { super(message, cause); }
}

package symgen.codegen;

/**
 * Output text cannot be laid out within the configured width.
 */
public class FormatException extends GenerationException {
  private static final long serialVersionUID = 1L;

  public FormatException(String message) { super(message); }
  public FormatException(String message, Throwable cause) { super(message, cause); }
}

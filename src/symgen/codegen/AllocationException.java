package symgen.codegen;

/**
 * A vector slot could not be resolved or was requested out of order.
 */
public class AllocationException extends GenerationException {
  private static final long serialVersionUID = 1L;

  public AllocationException(String message) { super(message); }
  public AllocationException(String message, Throwable cause) { super(message, cause); }
}

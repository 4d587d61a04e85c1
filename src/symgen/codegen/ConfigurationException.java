package symgen.codegen;

/**
 * A required generation style or option is missing or invalid.
 */
public class ConfigurationException extends GenerationException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) { super(message); }
  public ConfigurationException(String message, Throwable cause) { super(message, cause); }
}

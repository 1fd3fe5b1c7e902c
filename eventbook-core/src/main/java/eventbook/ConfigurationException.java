package eventbook;

/**
 * Thrown when required configuration is missing or malformed.
 *
 * <p>Configuration errors are fatal: they are raised while the application bootstraps
 * and are never retried.
 */
public final class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  static ConfigurationException missing(String variable) {
    return new ConfigurationException(
        "Please define the " + variable + " environment variable");
  }
}

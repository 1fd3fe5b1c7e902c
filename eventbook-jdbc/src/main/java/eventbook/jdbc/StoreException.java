package eventbook.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the stores in
 * {@link eventbook.jdbc.store}.
 */
public final class StoreException extends RuntimeException {
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

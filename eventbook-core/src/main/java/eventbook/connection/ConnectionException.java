package eventbook.connection;

/**
 * Thrown when a ready connection cannot be provided: the connection attempt failed, the
 * caller's wait timed out or was interrupted, or the manager is closed.
 *
 * <p>Connection errors are recoverable. After a failed attempt the next
 * {@link ConnectionManager#acquire()} starts a new one.
 */
public final class ConnectionException extends RuntimeException {

  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}

package eventbook.validation;

/**
 * The event collection could not be queried because the runtime is not fully initialized:
 * no ready connection yet, or the events table does not exist.
 */
public final class CollectionNotReadyException extends ReferenceException {

  public CollectionNotReadyException(String message) {
    super(message);
  }

  public CollectionNotReadyException(String message, Throwable cause) {
    super(message, cause);
  }
}

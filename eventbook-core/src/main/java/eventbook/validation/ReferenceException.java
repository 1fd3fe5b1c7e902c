package eventbook.validation;

/**
 * Base type for failures of the booking referential check. Subtypes tell "the data is
 * wrong" ({@link DanglingReferenceException}) from "the system is not wired up yet"
 * ({@link CollectionNotReadyException}).
 */
public abstract class ReferenceException extends RuntimeException {

  protected ReferenceException(String message) {
    super(message);
  }

  protected ReferenceException(String message, Throwable cause) {
    super(message, cause);
  }
}

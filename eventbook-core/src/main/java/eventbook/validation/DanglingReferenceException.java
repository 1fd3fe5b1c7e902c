package eventbook.validation;

/**
 * The referenced event did not exist when the existence query ran.
 */
public final class DanglingReferenceException extends ReferenceException {
  private final String eventId;

  public DanglingReferenceException(String eventId) {
    super("Event with ID " + eventId + " does not exist");
    this.eventId = eventId;
  }

  /** The identifier that was looked up. */
  public String eventId() {
    return eventId;
  }
}

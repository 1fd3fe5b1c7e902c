package eventbook.model;

/**
 * Fields of a {@link Booking} payload, named as they appear in violations.
 */
public enum BookingField {
  EVENT_ID("eventId"),
  EMAIL("email");

  private final String fieldName;

  BookingField(String fieldName) {
    this.fieldName = fieldName;
  }

  public String fieldName() {
    return fieldName;
  }
}

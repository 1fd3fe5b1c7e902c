package eventbook.model;

/**
 * Raw booking payload as submitted by a caller, before normalization.
 *
 * @see eventbook.validation.BookingPipeline
 */
public final class BookingDraft {
  private final String eventId;
  private final String email;

  private BookingDraft(String eventId, String email) {
    this.eventId = eventId;
    this.email = email;
  }

  public static BookingDraft of(String eventId, String email) {
    return new BookingDraft(eventId, email);
  }

  public static BookingDraft from(Booking booking) {
    return new BookingDraft(booking.eventId(), booking.email());
  }

  public BookingDraft withEventId(String eventId) {
    return new BookingDraft(eventId, email);
  }

  public BookingDraft withEmail(String email) {
    return new BookingDraft(eventId, email);
  }

  public String eventId() {
    return eventId;
  }

  public String email() {
    return email;
  }

  @Override
  public String toString() {
    return "BookingDraft{eventId=" + eventId + ", email=" + email + "}";
  }
}

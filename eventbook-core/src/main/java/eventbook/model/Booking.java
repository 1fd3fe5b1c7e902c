package eventbook.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only record representing a persisted booking row.
 *
 * <p>{@code eventId} is a point-in-time reference: the event existed when the booking was
 * last written, but may have been removed since.
 */
public record Booking(String id, String eventId, String email, Instant createdAt, Instant updatedAt) {

  public Booking {
    Objects.requireNonNull(id, "id");
  }

  public static Booking of(String id, NormalizedBooking booking, Instant createdAt, Instant updatedAt) {
    return new Booking(id, booking.eventId(), booking.email(), createdAt, updatedAt);
  }
}

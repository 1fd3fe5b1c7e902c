package eventbook.model;

import java.util.Objects;

/**
 * A validated booking: {@code eventId} referenced an existing event when it was checked,
 * and {@code email} is trimmed and lowercased.
 */
public record NormalizedBooking(String eventId, String email) {

  public NormalizedBooking {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(email, "email");
  }
}

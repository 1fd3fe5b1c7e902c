package eventbook.spi;

import eventbook.model.Booking;
import eventbook.model.NormalizedBooking;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for bookings.
 *
 * @see eventbook.jdbc.store.JdbcBookingStore
 */
public interface BookingStore {

  Booking insert(Connection conn, NormalizedBooking booking, Instant now);

  /**
   * Replaces the fields of an existing booking, preserving {@code createdAt}.
   *
   * @return the updated booking, or empty if no booking has this identifier
   */
  Optional<Booking> update(Connection conn, String id, NormalizedBooking booking, Instant now);

  Optional<Booking> findById(Connection conn, String id);

  /**
   * Lists bookings referencing an event, oldest first. Served by the {@code event_id} index.
   */
  List<Booking> findByEventId(Connection conn, String eventId);
}

package eventbook.jdbc.store;

import com.github.f4b6a3.ulid.UlidCreator;
import eventbook.jdbc.JdbcTemplate;
import eventbook.jdbc.TableNames;
import eventbook.model.Booking;
import eventbook.model.NormalizedBooking;
import eventbook.spi.BookingStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Portable JDBC booking store. Bookings use plain SQL only, so one implementation serves
 * every supported database.
 */
public final class JdbcBookingStore implements BookingStore {
  private static final String COLUMNS = "id, event_id, email, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<Booking> BOOKING_ROW_MAPPER = rs -> new Booking(
      rs.getString("id"),
      rs.getString("event_id"),
      rs.getString("email"),
      rs.getTimestamp("created_at").toInstant(),
      rs.getTimestamp("updated_at").toInstant());

  private final String tableName;

  public JdbcBookingStore() {
    this(TableNames.BOOKINGS);
  }

  public JdbcBookingStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public Booking insert(Connection conn, NormalizedBooking booking, Instant now) {
    String id = UlidCreator.getMonotonicUlid().toString();
    Instant ts = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?)";
    JdbcTemplate.update(conn, sql, id, booking.eventId(), booking.email(), ts, ts);
    return Booking.of(id, booking, ts, ts);
  }

  @Override
  public Optional<Booking> update(Connection conn, String id, NormalizedBooking booking, Instant now) {
    String sql = "UPDATE " + tableName + " SET event_id=?, email=?, updated_at=? WHERE id=?";
    int updated = JdbcTemplate.update(conn, sql,
        booking.eventId(), booking.email(), now.truncatedTo(ChronoUnit.MILLIS), id);
    return updated == 0 ? Optional.empty() : findById(conn, id);
  }

  @Override
  public Optional<Booking> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, BOOKING_ROW_MAPPER, id);
  }

  @Override
  public List<Booking> findByEventId(Connection conn, String eventId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE event_id=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, BOOKING_ROW_MAPPER, eventId);
  }
}

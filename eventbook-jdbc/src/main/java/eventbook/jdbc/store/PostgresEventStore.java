package eventbook.jdbc.store;

import eventbook.jdbc.JdbcTemplate;
import eventbook.jdbc.StoreException;
import eventbook.jdbc.TableNames;
import eventbook.model.Event;
import eventbook.model.NormalizedEvent;
import eventbook.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL event store.
 *
 * <p>Updates use {@code RETURNING} to write and read back the row in a single round trip.
 */
public final class PostgresEventStore extends AbstractJdbcEventStore {
  private static final String UNDEFINED_TABLE = "42P01";

  public PostgresEventStore() {
    super(TableNames.EVENTS);
  }

  public PostgresEventStore(String tableName) {
    super(tableName);
  }

  public PostgresEventStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcEventStore withTableName(String tableName) {
    return new PostgresEventStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public Optional<Event> update(Connection conn, String id, NormalizedEvent event, Instant now) {
    String sql = "UPDATE " + tableName() + " SET title=?, slug=?, description=?, overview=?, "
        + "image=?, venue=?, location=?, event_date=?, event_time=?, mode=?, audience=?, "
        + "agenda=?, organizer=?, tags=?, updated_at=? WHERE id=? RETURNING " + COLUMNS;
    try {
      List<Event> rows = JdbcTemplate.updateReturning(conn, sql, eventRowMapper,
          updateParams(id, event, now));
      return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    } catch (StoreException e) {
      throw translate(e, event.slug());
    }
  }

  @Override
  protected boolean isMissingTable(SQLException e) {
    return UNDEFINED_TABLE.equals(e.getSQLState());
  }
}

package eventbook.jdbc.store;

import com.github.f4b6a3.ulid.UlidCreator;
import eventbook.DuplicateSlugException;
import eventbook.jdbc.JdbcTemplate;
import eventbook.jdbc.StoreException;
import eventbook.jdbc.TableNames;
import eventbook.model.Event;
import eventbook.model.EventMode;
import eventbook.model.NormalizedEvent;
import eventbook.spi.EventStore;
import eventbook.util.JsonCodec;
import eventbook.validation.CollectionNotReadyException;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base JDBC event store with standard SQL implementations.
 *
 * <p>Subclasses identify their database through {@link #name()} and
 * {@link #jdbcUrlPrefixes()}, and classify vendor errors through
 * {@link #isUniqueViolation} and {@link #isMissingTable}. Register custom implementations
 * via {@code META-INF/services/eventbook.jdbc.store.AbstractJdbcEventStore}.
 *
 * <p>Identifiers are monotonic ULIDs. Timestamps are truncated to milliseconds so the
 * returned record matches what the database stores.
 *
 * @see JdbcEventStores
 */
public abstract class AbstractJdbcEventStore implements EventStore {
  protected static final String COLUMNS = "id, title, slug, description, overview, image, venue, "
      + "location, event_date, event_time, mode, audience, agenda, organizer, tags, "
      + "created_at, updated_at";

  private static final Set<String> UNIQUE_VIOLATION_STATES = Set.of("23505");

  private final String tableName;
  private final JsonCodec jsonCodec;

  protected final JdbcTemplate.RowMapper<Event> eventRowMapper;

  protected AbstractJdbcEventStore() {
    this(TableNames.EVENTS);
  }

  protected AbstractJdbcEventStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcEventStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.eventRowMapper = this::mapEvent;
  }

  private Event mapEvent(ResultSet rs) throws SQLException {
    String mode = rs.getString("mode");
    return new Event(
        rs.getString("id"),
        rs.getString("title"),
        rs.getString("slug"),
        rs.getString("description"),
        rs.getString("overview"),
        rs.getString("image"),
        rs.getString("venue"),
        rs.getString("location"),
        rs.getString("event_date"),
        rs.getString("event_time"),
        EventMode.fromValue(mode).orElseThrow(() -> new SQLException("Unknown event mode: " + mode)),
        rs.getString("audience"),
        jsonCodec.parseArray(rs.getString("agenda")),
        rs.getString("organizer"),
        jsonCodec.parseArray(rs.getString("tags")),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }

  /**
   * Unique identifier for this event store (e.g., "mysql", "postgresql", "h2"). Also names
   * the bundled schema script.
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this event store handles (e.g., "jdbc:mysql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store writing to another table.
   */
  public abstract AbstractJdbcEventStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  @Override
  public Event insert(Connection conn, NormalizedEvent event, Instant now) {
    String id = UlidCreator.getMonotonicUlid().toString();
    Instant ts = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, sql,
          id, event.title(), event.slug(), event.description(), event.overview(),
          event.image(), event.venue(), event.location(), event.date(), event.time(),
          event.mode().value(), event.audience(), jsonCodec.toJsonArray(event.agenda()),
          event.organizer(), jsonCodec.toJsonArray(event.tags()), ts, ts);
    } catch (StoreException e) {
      throw translate(e, event.slug());
    }
    return Event.of(id, event, ts, ts);
  }

  @Override
  public Optional<Event> update(Connection conn, String id, NormalizedEvent event, Instant now) {
    String sql = "UPDATE " + tableName() + " SET title=?, slug=?, description=?, overview=?, "
        + "image=?, venue=?, location=?, event_date=?, event_time=?, mode=?, audience=?, "
        + "agenda=?, organizer=?, tags=?, updated_at=? WHERE id=?";
    int updated;
    try {
      updated = JdbcTemplate.update(conn, sql, updateParams(id, event, now));
    } catch (StoreException e) {
      throw translate(e, event.slug());
    }
    return updated == 0 ? Optional.empty() : findById(conn, id);
  }

  @Override
  public Optional<Event> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    try {
      return JdbcTemplate.queryOne(conn, sql, eventRowMapper, id);
    } catch (StoreException e) {
      throw translate(e, null);
    }
  }

  @Override
  public Optional<Event> findBySlug(Connection conn, String slug) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE slug=?";
    try {
      return JdbcTemplate.queryOne(conn, sql, eventRowMapper, slug);
    } catch (StoreException e) {
      throw translate(e, null);
    }
  }

  @Override
  public boolean exists(Connection conn, String id) {
    String sql = "SELECT 1 FROM " + tableName() + " WHERE id=?";
    try {
      return !JdbcTemplate.query(conn, sql, rs -> Boolean.TRUE, id).isEmpty();
    } catch (StoreException e) {
      throw translate(e, null);
    }
  }

  /**
   * Parameters for the standard UPDATE statement, in column order followed by the id.
   */
  protected Object[] updateParams(String id, NormalizedEvent event, Instant now) {
    return new Object[] {
        event.title(), event.slug(), event.description(), event.overview(),
        event.image(), event.venue(), event.location(), event.date(), event.time(),
        event.mode().value(), event.audience(), jsonCodec.toJsonArray(event.agenda()),
        event.organizer(), jsonCodec.toJsonArray(event.tags()),
        now.truncatedTo(ChronoUnit.MILLIS), id};
  }

  /**
   * Maps a wrapped {@link SQLException} to the domain exception it represents.
   *
   * @param e    the store failure
   * @param slug slug being written, or {@code null} for reads
   * @return the exception to throw
   */
  protected RuntimeException translate(StoreException e, String slug) {
    if (e.getCause() instanceof SQLException sql) {
      if (slug != null && isUniqueViolation(sql)) {
        return new DuplicateSlugException(slug, sql);
      }
      if (isMissingTable(sql)) {
        return new CollectionNotReadyException(
            "Event collection is not ready: table " + tableName() + " does not exist", sql);
      }
    }
    return e;
  }

  /**
   * Whether {@code e} reports a unique index violation. Defaults to SQL state 23505.
   */
  protected boolean isUniqueViolation(SQLException e) {
    return UNIQUE_VIOLATION_STATES.contains(e.getSQLState());
  }

  /**
   * Whether {@code e} reports that the queried table does not exist.
   */
  protected abstract boolean isMissingTable(SQLException e);
}

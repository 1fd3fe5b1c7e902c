package eventbook.spi;

import eventbook.model.Event;
import eventbook.model.NormalizedEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence contract for events.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls its
 * lifetime. Implementations live in the {@code eventbook-jdbc} module.
 *
 * @see eventbook.jdbc.store.AbstractJdbcEventStore
 */
public interface EventStore {

  /**
   * Inserts a validated event, assigning its identifier and timestamps.
   *
   * @param conn  the JDBC connection
   * @param event the normalized event
   * @param now   creation time, stored as both {@code createdAt} and {@code updatedAt}
   * @return the stored event
   * @throws eventbook.DuplicateSlugException if the slug is already taken
   */
  Event insert(Connection conn, NormalizedEvent event, Instant now);

  /**
   * Replaces the fields of an existing event, preserving {@code createdAt}.
   *
   * @param conn  the JDBC connection
   * @param id    identifier of the event to update
   * @param event the normalized event
   * @param now   update time
   * @return the updated event, or empty if no event has this identifier
   * @throws eventbook.DuplicateSlugException if the new slug is already taken
   */
  Optional<Event> update(Connection conn, String id, NormalizedEvent event, Instant now);

  Optional<Event> findById(Connection conn, String id);

  Optional<Event> findBySlug(Connection conn, String slug);

  /**
   * Checks whether an event with the given identifier is stored.
   *
   * @param conn the JDBC connection
   * @param id   the event identifier
   * @return {@code true} if the event exists
   * @throws eventbook.validation.CollectionNotReadyException if the events collection
   *                                                          has not been created
   */
  boolean exists(Connection conn, String id);
}

package eventbook.jdbc.store;

import eventbook.DuplicateSlugException;
import eventbook.jdbc.Fixtures;
import eventbook.jdbc.Schemas;
import eventbook.model.Booking;
import eventbook.model.Event;
import eventbook.model.NormalizedBooking;
import eventbook.model.NormalizedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behavior shared by every supported database. Subclasses provide the data source
 * and the dialect store.
 */
abstract class AbstractEventStoreIntegrationTest {

  abstract DataSource dataSource();

  abstract AbstractJdbcEventStore store();

  private final JdbcBookingStore bookings = new JdbcBookingStore();

  @BeforeEach
  void resetSchema() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      Schemas.apply(conn, store().name());
      try (Statement st = conn.createStatement()) {
        st.execute("DELETE FROM bookings");
        st.execute("DELETE FROM events");
      }
    }
  }

  @Test
  void insertAndFind() throws Exception {
    Instant now = Instant.parse("2025-01-10T12:00:00.123456Z");
    try (Connection conn = dataSource().getConnection()) {
      Event inserted = store().insert(conn, Fixtures.event("Java Night", "java-night"), now);

      assertEquals(26, inserted.id().length());
      assertEquals(Instant.parse("2025-01-10T12:00:00.123Z"), inserted.createdAt());

      Event found = store().findById(conn, inserted.id()).orElseThrow();
      assertEquals(inserted, found);
      assertEquals(List.of("Doors open", "Talks \"live\""), found.agenda());
      assertEquals(found, store().findBySlug(conn, "java-night").orElseThrow());
      assertTrue(store().exists(conn, inserted.id()));
      assertFalse(store().exists(conn, "01HZX3K5Y3M4N5P6Q7R8S9T0VW"));
    }
  }

  @Test
  void duplicateSlugIsRejected() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      store().insert(conn, Fixtures.event("Java Night", "java-night"), Instant.now());

      DuplicateSlugException e = assertThrows(DuplicateSlugException.class,
          () -> store().insert(conn, Fixtures.event("Java  Night", "java-night"), Instant.now()));
      assertEquals("java-night", e.slug());
    }
  }

  @Test
  void updateReplacesFieldsAndKeepsCreatedAt() throws Exception {
    Instant created = Instant.parse("2025-01-10T12:00:00Z");
    Instant updatedAt = Instant.parse("2025-01-11T08:00:00Z");
    try (Connection conn = dataSource().getConnection()) {
      Event inserted = store().insert(conn, Fixtures.event("Java Night", "java-night"), created);
      NormalizedEvent changed = Fixtures.event("Kotlin Night", "kotlin-night");

      Event updated = store().update(conn, inserted.id(), changed, updatedAt).orElseThrow();

      assertEquals("kotlin-night", updated.slug());
      assertEquals(created, updated.createdAt());
      assertEquals(updatedAt, updated.updatedAt());
      assertTrue(store().findBySlug(conn, "java-night").isEmpty());
    }
  }

  @Test
  void updateToTakenSlugIsRejected() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      store().insert(conn, Fixtures.event("Java Night", "java-night"), Instant.now());
      Event other = store().insert(conn, Fixtures.event("Go Night", "go-night"), Instant.now());

      assertThrows(DuplicateSlugException.class, () -> store().update(conn, other.id(),
          Fixtures.event("Java Night", "java-night"), Instant.now()));
    }
  }

  @Test
  void updateUnknownIdIsEmpty() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      Optional<Event> result = store().update(conn, "01HZX3K5Y3M4N5P6Q7R8S9T0VW",
          Fixtures.event("Java Night", "java-night"), Instant.now());
      assertTrue(result.isEmpty());
    }
  }

  @Test
  void bookingsAreListedByEventOldestFirst() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      Event event = store().insert(conn, Fixtures.event("Java Night", "java-night"), Instant.now());
      Booking first = bookings.insert(conn, new NormalizedBooking(event.id(), "ada@example.com"), Instant.now());
      Booking second = bookings.insert(conn, new NormalizedBooking(event.id(), "grace@example.com"), Instant.now());

      assertEquals(List.of(first, second), bookings.findByEventId(conn, event.id()));
      assertEquals(first, bookings.findById(conn, first.id()).orElseThrow());
    }
  }
}

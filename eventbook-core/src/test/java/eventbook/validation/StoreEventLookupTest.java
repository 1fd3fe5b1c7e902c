package eventbook.validation;

import eventbook.EventbookConfig;
import eventbook.connection.ConnectionManager;
import eventbook.model.Event;
import eventbook.model.NormalizedEvent;
import eventbook.spi.DatabaseHandle;
import eventbook.spi.EventStore;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class StoreEventLookupTest {
  private static final EventbookConfig CONFIG = EventbookConfig.builder()
      .databaseUrl("jdbc:test:lookup")
      .build();

  @Test
  void failsWithNotReadyBeforeConnection() {
    try (ConnectionManager manager = ConnectionManager.builder()
        .config(CONFIG)
        .connector(config -> new StubHandle())
        .build()) {
      StoreEventLookup lookup = new StoreEventLookup(manager, new ExistsStore(true), Runnable::run);

      CompletionException e = assertThrows(CompletionException.class,
          () -> lookup.exists("01HZX3K5Y3M4N5P6Q7R8S9T0VW").join());

      assertInstanceOf(CollectionNotReadyException.class, e.getCause());
    }
  }

  @Test
  void queriesStoreOnceReady() {
    try (ConnectionManager manager = ConnectionManager.builder()
        .config(CONFIG)
        .connector(config -> new StubHandle())
        .build()) {
      manager.acquire(Duration.ofSeconds(5));

      assertTrue(new StoreEventLookup(manager, new ExistsStore(true), Runnable::run)
          .exists("01HZX3K5Y3M4N5P6Q7R8S9T0VW").join());
      assertFalse(new StoreEventLookup(manager, new ExistsStore(false), Runnable::run)
          .exists("01HZX3K5Y3M4N5P6Q7R8S9T0VW").join());
    }
  }

  private static final class StubHandle implements DatabaseHandle {
    @Override
    public Connection getConnection() {
      return null;
    }

    @Override
    public String url() {
      return "jdbc:test:lookup";
    }

    @Override
    public void close() {
    }
  }

  private static final class ExistsStore implements EventStore {
    private final boolean exists;

    ExistsStore(boolean exists) {
      this.exists = exists;
    }

    @Override
    public boolean exists(Connection conn, String id) {
      return exists;
    }

    @Override
    public Event insert(Connection conn, NormalizedEvent event, Instant now) {
      throw new UnsupportedOperationException();
    }

    @Override
    public Optional<Event> update(Connection conn, String id, NormalizedEvent event, Instant now) {
      throw new UnsupportedOperationException();
    }

    @Override
    public Optional<Event> findById(Connection conn, String id) {
      throw new UnsupportedOperationException();
    }

    @Override
    public Optional<Event> findBySlug(Connection conn, String slug) {
      throw new UnsupportedOperationException();
    }
  }
}

package eventbook.validation;

import eventbook.connection.ConnectionException;
import eventbook.connection.ConnectionManager;
import eventbook.spi.DatabaseHandle;
import eventbook.spi.EventLookup;
import eventbook.spi.EventStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link EventLookup} that queries an {@link EventStore} through the handle cached by a
 * {@link ConnectionManager}.
 *
 * <p>The lookup never starts a connection attempt itself. If the manager has no ready
 * handle, the lookup fails with {@link CollectionNotReadyException}; callers acquire the
 * connection first. The query runs on the given executor so the caller never blocks.
 */
public final class StoreEventLookup implements EventLookup {
  private final ConnectionManager connectionManager;
  private final EventStore eventStore;
  private final Executor executor;

  public StoreEventLookup(ConnectionManager connectionManager, EventStore eventStore, Executor executor) {
    this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public CompletableFuture<Boolean> exists(String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    Optional<DatabaseHandle> handle = connectionManager.current();
    if (handle.isEmpty()) {
      return CompletableFuture.failedFuture(new CollectionNotReadyException(
          "Event collection is not ready: connection state is " + connectionManager.state()));
    }
    return CompletableFuture.supplyAsync(() -> query(handle.get(), eventId), executor);
  }

  private boolean query(DatabaseHandle handle, String eventId) {
    try (Connection conn = handle.getConnection()) {
      return eventStore.exists(conn, eventId);
    } catch (SQLException e) {
      throw new ConnectionException("Failed to obtain a connection for event lookup", e);
    }
  }
}

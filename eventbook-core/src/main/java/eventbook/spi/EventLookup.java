package eventbook.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Existence check for events, the only storage query the booking pipeline issues.
 *
 * <p>The returned future completes with {@code true} when an event with the identifier is
 * stored at the instant the query runs. It completes exceptionally with
 * {@link eventbook.validation.CollectionNotReadyException} when the event collection
 * cannot be queried yet, and with {@link eventbook.connection.ConnectionException} on
 * connection failures.
 *
 * @see eventbook.validation.StoreEventLookup
 */
@FunctionalInterface
public interface EventLookup {

  /**
   * Checks whether an event with the given identifier exists.
   *
   * @param eventId the event identifier
   * @return future completing with the existence result
   */
  CompletableFuture<Boolean> exists(String eventId);
}

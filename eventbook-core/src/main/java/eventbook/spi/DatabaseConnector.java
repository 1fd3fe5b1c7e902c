package eventbook.spi;

import eventbook.EventbookConfig;

/**
 * Performs one connection attempt against the configured database.
 *
 * <p>Invoked by {@link eventbook.connection.ConnectionManager} at most once per
 * initialization phase. Implementations block until the store is reachable or the attempt
 * fails; they must not retry internally, since retry is driven by the next
 * {@code acquire()} call.
 *
 * @see eventbook.jdbc.HikariDatabaseConnector
 */
@FunctionalInterface
public interface DatabaseConnector {

  /**
   * Connects to the database described by {@code config}.
   *
   * @param config connection settings
   * @return a ready handle
   * @throws Exception if the store is unreachable or rejects the connection
   */
  DatabaseHandle connect(EventbookConfig config) throws Exception;
}

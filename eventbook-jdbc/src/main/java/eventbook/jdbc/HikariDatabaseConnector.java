package eventbook.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eventbook.EventbookConfig;
import eventbook.spi.DatabaseConnector;
import eventbook.spi.DatabaseHandle;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * {@link DatabaseConnector} that opens a HikariCP pool.
 *
 * <p>The pool is sized from {@link EventbookConfig#poolSize()}. The connect timeout bounds
 * both the wait for a pooled connection and pool start-up: the pool is created with an
 * initialization fail timeout, so an unreachable database fails the attempt instead of
 * producing a handle that fails later.
 *
 * <p>Extra pool settings can be applied with a customizer:
 * <pre>{@code
 * new HikariDatabaseConnector(hikari -> hikari.addDataSourceProperty("sslmode", "require"));
 * }</pre>
 */
public final class HikariDatabaseConnector implements DatabaseConnector {
  private static final Logger logger = Logger.getLogger(HikariDatabaseConnector.class.getName());
  private static final String POOL_NAME = "eventbook-pool";

  private final Consumer<HikariConfig> customizer;

  public HikariDatabaseConnector() {
    this(hikari -> {});
  }

  public HikariDatabaseConnector(Consumer<HikariConfig> customizer) {
    this.customizer = Objects.requireNonNull(customizer, "customizer");
  }

  @Override
  public DatabaseHandle connect(EventbookConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.databaseUrl());
    if (config.username() != null) {
      hikari.setUsername(config.username());
    }
    if (config.password() != null) {
      hikari.setPassword(config.password());
    }
    long timeoutMs = config.connectTimeout().toMillis();
    hikari.setMaximumPoolSize(config.poolSize());
    hikari.setMinimumIdle(1);
    hikari.setConnectionTimeout(timeoutMs);
    hikari.setInitializationFailTimeout(timeoutMs);
    hikari.setPoolName(POOL_NAME);
    customizer.accept(hikari);

    // Blocks until the first connection is established or the fail timeout elapses
    HikariDataSource dataSource = new HikariDataSource(hikari);
    logger.fine(() -> "Started pool " + dataSource.getPoolName()
        + " with maximumPoolSize=" + dataSource.getMaximumPoolSize());
    return new DataSourceHandle(dataSource, config.databaseUrl(), dataSource::close);
  }
}

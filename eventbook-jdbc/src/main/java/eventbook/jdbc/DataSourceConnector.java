package eventbook.jdbc;

import eventbook.EventbookConfig;
import eventbook.spi.DatabaseConnector;
import eventbook.spi.DatabaseHandle;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link DatabaseConnector} over a {@link DataSource} managed elsewhere, e.g. by a
 * container or Spring Boot.
 *
 * <p>The attempt borrows one connection and validates it within the configured connect
 * timeout. The resulting handle does not own the data source: closing it leaves the data
 * source open.
 */
public final class DataSourceConnector implements DatabaseConnector {
  private final DataSource dataSource;

  public DataSourceConnector(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public DatabaseHandle connect(EventbookConfig config) throws SQLException {
    int timeoutSeconds = (int) Math.max(1, config.connectTimeout().toSeconds());
    String url;
    try (Connection conn = dataSource.getConnection()) {
      if (!conn.isValid(timeoutSeconds)) {
        throw new SQLException("Connection from DataSource failed validation");
      }
      url = conn.getMetaData().getURL();
    }
    return new DataSourceHandle(dataSource, url == null ? config.databaseUrl() : url, () -> {});
  }
}

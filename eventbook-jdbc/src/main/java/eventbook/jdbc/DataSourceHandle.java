package eventbook.jdbc;

import eventbook.spi.DatabaseHandle;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link DatabaseHandle} backed by a {@link DataSource}. Connections are borrowed through
 * {@link DataSource#getConnection()}; {@link #close()} runs the release action supplied by
 * the connector that created the handle.
 */
public final class DataSourceHandle implements DatabaseHandle {
  private final DataSource dataSource;
  private final String url;
  private final Runnable release;

  public DataSourceHandle(DataSource dataSource, String url, Runnable release) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.url = Objects.requireNonNull(url, "url");
    this.release = Objects.requireNonNull(release, "release");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public String url() {
    return url;
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public void close() {
    release.run();
  }
}

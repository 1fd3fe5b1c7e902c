package eventbook.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A ready handle to the backing store, produced by a {@link DatabaseConnector} and cached by
 * {@link eventbook.connection.ConnectionManager}.
 *
 * <p>The handle is shared by every caller once connected. Callers borrow short-lived JDBC
 * connections from it and must close them; they never close or reconfigure the handle
 * itself. Only the owning {@code ConnectionManager} closes it.
 */
public interface DatabaseHandle extends AutoCloseable {

  /**
   * Borrows a JDBC connection from the handle.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;

  /**
   * JDBC URL this handle is connected to, used to pick a store dialect.
   */
  String url();

  /**
   * Releases all resources held by the handle.
   */
  @Override
  void close();
}

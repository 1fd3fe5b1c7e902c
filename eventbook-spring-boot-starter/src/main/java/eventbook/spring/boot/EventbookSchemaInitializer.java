package eventbook.spring.boot;

import eventbook.connection.ConnectionManager;
import eventbook.jdbc.Schemas;
import eventbook.jdbc.StoreException;
import eventbook.spi.DatabaseHandle;

import org.springframework.beans.factory.InitializingBean;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Applies the bundled schema script once the context starts, using the configured table
 * names. Enabled by {@code eventbook.initialize-schema=true}.
 */
public class EventbookSchemaInitializer implements InitializingBean {
  private final ConnectionManager connectionManager;
  private final String storeName;
  private final String eventsTable;
  private final String bookingsTable;

  public EventbookSchemaInitializer(ConnectionManager connectionManager, String storeName,
      String eventsTable, String bookingsTable) {
    this.connectionManager = connectionManager;
    this.storeName = storeName;
    this.eventsTable = eventsTable;
    this.bookingsTable = bookingsTable;
  }

  @Override
  public void afterPropertiesSet() {
    DatabaseHandle handle = connectionManager.acquire(connectionManager.config().connectTimeout());
    try (Connection conn = handle.getConnection()) {
      Schemas.apply(conn, storeName, eventsTable, bookingsTable);
    } catch (SQLException e) {
      throw new StoreException("Failed to obtain a connection for schema initialization", e);
    }
  }
}

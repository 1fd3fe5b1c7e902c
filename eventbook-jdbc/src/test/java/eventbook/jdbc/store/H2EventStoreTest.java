package eventbook.jdbc.store;

import eventbook.jdbc.Fixtures;
import eventbook.validation.CollectionNotReadyException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class H2EventStoreTest extends AbstractEventStoreIntegrationTest {
  private final JdbcDataSource dataSource = Fixtures.h2DataSource(Fixtures.h2Url("store"));
  private final H2EventStore store = new H2EventStore();

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcEventStore store() {
    return store;
  }

  @Test
  void missingTableIsCollectionNotReady() throws Exception {
    AbstractJdbcEventStore unmigrated = store.withTableName("events_missing");
    try (Connection conn = dataSource.getConnection()) {
      CollectionNotReadyException e = assertThrows(CollectionNotReadyException.class,
          () -> unmigrated.exists(conn, "01HZX3K5Y3M4N5P6Q7R8S9T0VW"));
      assertTrue(e.getMessage().contains("events_missing"));
    }
  }

  @Test
  void customTableName() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("CREATE TABLE archived_events AS SELECT * FROM events WHERE 1=0");
      AbstractJdbcEventStore archive = store.withTableName("archived_events");

      String id = archive.insert(conn, Fixtures.event("Old Night", "old-night"), Instant.now()).id();

      assertTrue(archive.exists(conn, id));
      assertFalse(store.exists(conn, id));
    }
  }

  @Test
  void rejectsInvalidTableName() {
    assertThrows(IllegalArgumentException.class, () -> new H2EventStore("events; DROP TABLE x"));
  }
}

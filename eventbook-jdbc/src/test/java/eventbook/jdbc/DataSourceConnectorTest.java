package eventbook.jdbc;

import eventbook.EventbookConfig;
import eventbook.spi.DatabaseHandle;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectorTest {

  @Test
  void adoptsDataSourceAndReportsItsUrl() throws Exception {
    String url = Fixtures.h2Url("ds");
    JdbcDataSource dataSource = Fixtures.h2DataSource(url);
    EventbookConfig config = EventbookConfig.builder().databaseUrl("jdbc:h2:mem:configured").build();

    DatabaseHandle handle = new DataSourceConnector(dataSource).connect(config);

    assertTrue(handle.url().startsWith("jdbc:h2:mem:ds_"));
    try (Connection conn = handle.getConnection()) {
      assertTrue(conn.isValid(1));
    }
  }

  @Test
  void closingHandleLeavesDataSourceUsable() throws Exception {
    JdbcDataSource dataSource = Fixtures.h2DataSource(Fixtures.h2Url("ds"));
    EventbookConfig config = EventbookConfig.builder().databaseUrl("jdbc:h2:mem:configured").build();

    new DataSourceConnector(dataSource).connect(config).close();

    try (Connection conn = dataSource.getConnection()) {
      assertTrue(conn.isValid(1));
    }
  }

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnector(null));
  }
}

package eventbook.jdbc.store;

import eventbook.jdbc.DockerAvailable;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;

import javax.sql.DataSource;

@DockerAvailable
class PostgresEventStoreIntegrationTest extends AbstractEventStoreIntegrationTest {
  private static PostgreSQLContainer<?> postgres;
  private static PGSimpleDataSource dataSource;

  @BeforeAll
  static void startContainer() {
    postgres = new PostgreSQLContainer<>("postgres:16-alpine");
    postgres.start();
    dataSource = new PGSimpleDataSource();
    dataSource.setUrl(postgres.getJdbcUrl());
    dataSource.setUser(postgres.getUsername());
    dataSource.setPassword(postgres.getPassword());
  }

  @AfterAll
  static void stopContainer() {
    if (postgres != null) {
      postgres.stop();
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcEventStore store() {
    return new PostgresEventStore();
  }
}

package eventbook.jdbc.store;

import com.mysql.cj.jdbc.MysqlDataSource;
import eventbook.jdbc.DockerAvailable;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;

import javax.sql.DataSource;

@DockerAvailable
class MySqlEventStoreIntegrationTest extends AbstractEventStoreIntegrationTest {
  private static MySQLContainer<?> mysql;
  private static MysqlDataSource dataSource;

  @BeforeAll
  static void startContainer() {
    mysql = new MySQLContainer<>("mysql:8.0");
    mysql.start();
    dataSource = new MysqlDataSource();
    dataSource.setUrl(mysql.getJdbcUrl());
    dataSource.setUser(mysql.getUsername());
    dataSource.setPassword(mysql.getPassword());
  }

  @AfterAll
  static void stopContainer() {
    if (mysql != null) {
      mysql.stop();
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcEventStore store() {
    return new MySqlEventStore();
  }
}

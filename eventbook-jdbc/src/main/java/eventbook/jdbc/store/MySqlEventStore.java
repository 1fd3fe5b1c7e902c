package eventbook.jdbc.store;

import eventbook.jdbc.TableNames;
import eventbook.util.JsonCodec;

import java.sql.SQLException;
import java.util.List;

/**
 * MySQL event store. Also handles TiDB, which speaks the MySQL protocol.
 *
 * <p>MySQL reports every integrity violation as SQL state 23000, so duplicate keys are
 * recognized by vendor code {@value #ER_DUP_ENTRY}.
 */
public final class MySqlEventStore extends AbstractJdbcEventStore {
  static final int ER_DUP_ENTRY = 1062;
  static final int ER_NO_SUCH_TABLE = 1146;

  public MySqlEventStore() {
    super(TableNames.EVENTS);
  }

  public MySqlEventStore(String tableName) {
    super(tableName);
  }

  public MySqlEventStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcEventStore withTableName(String tableName) {
    return new MySqlEventStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected boolean isUniqueViolation(SQLException e) {
    return e.getErrorCode() == ER_DUP_ENTRY;
  }

  @Override
  protected boolean isMissingTable(SQLException e) {
    return e.getErrorCode() == ER_NO_SUCH_TABLE || "42S02".equals(e.getSQLState());
  }
}

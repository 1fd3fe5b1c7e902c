package eventbook.jdbc.store;

import eventbook.jdbc.TableNames;
import eventbook.util.JsonCodec;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;

/**
 * H2 event store. Primarily for testing.
 */
public final class H2EventStore extends AbstractJdbcEventStore {
  // 42S02 table not found, 42S03 with candidates, 42S04 database empty
  private static final Set<String> MISSING_TABLE_STATES = Set.of("42S02", "42S03", "42S04");

  public H2EventStore() {
    super(TableNames.EVENTS);
  }

  public H2EventStore(String tableName) {
    super(tableName);
  }

  public H2EventStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcEventStore withTableName(String tableName) {
    return new H2EventStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected boolean isMissingTable(SQLException e) {
    return MISSING_TABLE_STATES.contains(e.getSQLState());
  }
}

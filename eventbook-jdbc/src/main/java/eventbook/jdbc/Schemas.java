package eventbook.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Applies the bundled DDL scripts ({@code /schema/h2.sql}, {@code /schema/postgresql.sql},
 * {@code /schema/mysql.sql}). Scripts are idempotent. The {@code ${events}} and
 * {@code ${bookings}} placeholders are replaced with the table names, which default to
 * {@link TableNames#EVENTS} and {@link TableNames#BOOKINGS}.
 */
public final class Schemas {
  private static final Logger logger = Logger.getLogger(Schemas.class.getName());

  private Schemas() {}

  private static final String EVENTS_PLACEHOLDER = "${events}";
  private static final String BOOKINGS_PLACEHOLDER = "${bookings}";

  /**
   * Runs the script for the given store name against {@code conn}, creating the default
   * tables.
   *
   * @param conn      the JDBC connection
   * @param storeName store name as returned by
   *                  {@link eventbook.jdbc.store.AbstractJdbcEventStore#name()}
   */
  public static void apply(Connection conn, String storeName) {
    apply(conn, storeName, TableNames.EVENTS, TableNames.BOOKINGS);
  }

  /**
   * Runs the script for the given store name against {@code conn}, creating tables with
   * the given names.
   *
   * @throws IllegalArgumentException if a table name is not a plain identifier
   */
  public static void apply(Connection conn, String storeName, String eventsTable, String bookingsTable) {
    List<String> statements = statements(storeName, eventsTable, bookingsTable);
    try (Statement st = conn.createStatement()) {
      for (String sql : statements) {
        st.execute(sql);
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to apply schema for " + storeName, e);
    }
    logger.info("Applied " + statements.size() + " schema statements for " + storeName
        + " (tables " + eventsTable + ", " + bookingsTable + ")");
  }

  static List<String> statements(String storeName) {
    return statements(storeName, TableNames.EVENTS, TableNames.BOOKINGS);
  }

  static List<String> statements(String storeName, String eventsTable, String bookingsTable) {
    TableNames.validate(eventsTable);
    TableNames.validate(bookingsTable);
    String resource = "/schema/" + storeName + ".sql";
    String script;
    try (InputStream in = Schemas.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for store: " + storeName);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : script.split("\\R")) {
      String trimmed = line.strip();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      current.append(line
          .replace(EVENTS_PLACEHOLDER, eventsTable)
          .replace(BOOKINGS_PLACEHOLDER, bookingsTable)).append('\n');
      if (trimmed.endsWith(";")) {
        String sql = current.toString().strip();
        statements.add(sql.substring(0, sql.length() - 1));
        current.setLength(0);
      }
    }
    if (!current.toString().isBlank()) {
      statements.add(current.toString().strip());
    }
    return statements;
  }
}

/**
 * JDBC implementations of the eventbook SPIs.
 *
 * <p>{@link eventbook.jdbc.HikariDatabaseConnector} opens a HikariCP pool for a
 * {@link eventbook.connection.ConnectionManager}; {@link eventbook.jdbc.DataSourceConnector}
 * adopts an existing {@link javax.sql.DataSource}. Store implementations live in
 * {@link eventbook.jdbc.store}. DDL for each supported database ships under
 * {@code /schema/} on the classpath and can be applied with {@link eventbook.jdbc.Schemas}.
 */
package eventbook.jdbc;

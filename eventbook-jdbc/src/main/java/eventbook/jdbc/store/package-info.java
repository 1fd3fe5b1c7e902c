/**
 * JDBC stores for events and bookings.
 *
 * <p>{@link eventbook.jdbc.store.AbstractJdbcEventStore} has one subclass per database,
 * found through {@link eventbook.jdbc.store.JdbcEventStores}. Bookings need no dialect
 * handling and use {@link eventbook.jdbc.store.JdbcBookingStore} everywhere.
 */
package eventbook.jdbc.store;

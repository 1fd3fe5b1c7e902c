/**
 * Service provider interfaces: how the core reaches the database.
 *
 * <p>{@link eventbook.spi.DatabaseConnector} performs one connection attempt and yields a
 * {@link eventbook.spi.DatabaseHandle}; {@link eventbook.spi.EventStore} and
 * {@link eventbook.spi.BookingStore} persist normalized entities through connections
 * borrowed from that handle; {@link eventbook.spi.EventLookup} is the single existence
 * query the booking pipeline depends on.
 */
package eventbook.spi;

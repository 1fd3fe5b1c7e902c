/**
 * Lazily initialized, shared database handle.
 *
 * @see eventbook.connection.ConnectionManager
 */
package eventbook.connection;

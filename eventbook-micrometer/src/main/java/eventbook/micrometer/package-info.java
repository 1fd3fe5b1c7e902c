/**
 * Micrometer integration for eventbook metrics.
 */
package eventbook.micrometer;

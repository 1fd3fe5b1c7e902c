/**
 * Spring Boot auto-configuration for eventbook.
 */
package eventbook.spring.boot;

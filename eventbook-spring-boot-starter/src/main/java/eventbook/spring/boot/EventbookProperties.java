package eventbook.spring.boot;

import eventbook.EventbookConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.env.PropertyResolver;

import java.time.Duration;

/**
 * Configuration properties for eventbook.
 *
 * <p>Connection settings left unset fall back to the {@code DATABASE_*} environment
 * variables read by {@link EventbookConfig#fromEnvironment()}, and then to the matching
 * {@code spring.datasource.*} properties.
 *
 * @see EventbookAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventbook")
public class EventbookProperties {

    /**
     * JDBC URL of the backing store. Falls back to {@code DATABASE_URL}.
     */
    private String databaseUrl;

    private String username;

    private String password;

    /**
     * Maximum pooled connections. Falls back to {@code DATABASE_POOL_SIZE}, default 10.
     */
    private Integer poolSize;

    /**
     * Bound on one connection attempt. Falls back to {@code DATABASE_CONNECT_TIMEOUT_MS},
     * default 10s.
     */
    private Duration connectTimeout;

    /**
     * Apply the bundled DDL for the detected database at startup. Connects eagerly.
     */
    private boolean initializeSchema = false;

    private String eventsTable = "events";

    private String bookingsTable = "bookings";

    private final Metrics metrics = new Metrics();

    /**
     * Resolves the connection settings, property first, then environment variable, then
     * {@code spring.datasource.*}.
     *
     * @param resolver the Spring environment
     * @return the configuration
     * @throws eventbook.ConfigurationException if no database URL is defined anywhere
     */
    public EventbookConfig toConfig(PropertyResolver resolver) {
        return EventbookConfig.fromEnvironment(name -> switch (name) {
            case EventbookConfig.DATABASE_URL -> firstNonBlank(databaseUrl,
                resolver.getProperty(name), resolver.getProperty("spring.datasource.url"));
            case EventbookConfig.DATABASE_USERNAME -> firstNonBlank(username,
                resolver.getProperty(name), resolver.getProperty("spring.datasource.username"));
            case EventbookConfig.DATABASE_PASSWORD -> firstNonBlank(password,
                resolver.getProperty(name), resolver.getProperty("spring.datasource.password"));
            case EventbookConfig.DATABASE_POOL_SIZE -> poolSize != null
                ? String.valueOf(poolSize) : resolver.getProperty(name);
            case EventbookConfig.DATABASE_CONNECT_TIMEOUT_MS -> connectTimeout != null
                ? String.valueOf(connectTimeout.toMillis()) : resolver.getProperty(name);
            default -> resolver.getProperty(name);
        });
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public void setDatabaseUrl(String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public Integer getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(Integer poolSize) {
        this.poolSize = poolSize;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public String getEventsTable() {
        return eventsTable;
    }

    public void setEventsTable(String eventsTable) {
        this.eventsTable = eventsTable;
    }

    public String getBookingsTable() {
        return bookingsTable;
    }

    public void setBookingsTable(String bookingsTable) {
        this.bookingsTable = bookingsTable;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventbook";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}

package eventbook;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable connection settings for an {@link eventbook.connection.ConnectionManager}.
 *
 * <p>Built either explicitly via {@link #builder()} or from the process environment via
 * {@link #fromEnvironment()}. The database URL is the only required value; its absence is
 * reported eagerly, before any connection attempt is made.
 *
 * <h2>Environment variables</h2>
 * <ul>
 *   <li>{@value #DATABASE_URL}: JDBC URL of the backing store (required)</li>
 *   <li>{@value #DATABASE_USERNAME}: login user (optional)</li>
 *   <li>{@value #DATABASE_PASSWORD}: login password (optional)</li>
 *   <li>{@value #DATABASE_POOL_SIZE}: maximum pooled connections (default {@value #DEFAULT_POOL_SIZE})</li>
 *   <li>{@value #DATABASE_CONNECT_TIMEOUT_MS}: connection timeout in milliseconds
 *       (default {@value #DEFAULT_CONNECT_TIMEOUT_MS})</li>
 * </ul>
 */
public final class EventbookConfig {
  public static final String DATABASE_URL = "DATABASE_URL";
  public static final String DATABASE_USERNAME = "DATABASE_USERNAME";
  public static final String DATABASE_PASSWORD = "DATABASE_PASSWORD";
  public static final String DATABASE_POOL_SIZE = "DATABASE_POOL_SIZE";
  public static final String DATABASE_CONNECT_TIMEOUT_MS = "DATABASE_CONNECT_TIMEOUT_MS";

  public static final int DEFAULT_POOL_SIZE = 10;
  public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;

  private final String databaseUrl;
  private final String username;
  private final String password;
  private final int poolSize;
  private final Duration connectTimeout;

  private EventbookConfig(Builder builder) {
    if (builder.databaseUrl == null || builder.databaseUrl.isBlank()) {
      throw ConfigurationException.missing(DATABASE_URL);
    }
    if (builder.poolSize < 1) {
      throw new ConfigurationException("poolSize must be >= 1, got " + builder.poolSize);
    }
    Objects.requireNonNull(builder.connectTimeout, "connectTimeout");
    if (builder.connectTimeout.isZero() || builder.connectTimeout.isNegative()) {
      throw new ConfigurationException("connectTimeout must be positive");
    }
    this.databaseUrl = builder.databaseUrl.trim();
    this.username = builder.username;
    this.password = builder.password;
    this.poolSize = builder.poolSize;
    this.connectTimeout = builder.connectTimeout;
  }

  /**
   * Reads the configuration from {@link System#getenv()}.
   *
   * @return the configuration
   * @throws ConfigurationException if {@value #DATABASE_URL} is not defined or a numeric
   *                                variable is malformed
   */
  public static EventbookConfig fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  /**
   * Reads the configuration from the given variable map.
   *
   * @param environment variable name to value
   * @return the configuration
   * @throws ConfigurationException if {@value #DATABASE_URL} is not defined
   */
  public static EventbookConfig fromEnvironment(Map<String, String> environment) {
    Objects.requireNonNull(environment, "environment");
    return fromEnvironment(environment::get);
  }

  /**
   * Reads the configuration through an arbitrary variable lookup (e.g. a Spring
   * {@code Environment}).
   *
   * @param lookup returns the value of a variable, or {@code null} when undefined
   * @return the configuration
   * @throws ConfigurationException if {@value #DATABASE_URL} is not defined
   */
  public static EventbookConfig fromEnvironment(Function<String, String> lookup) {
    Objects.requireNonNull(lookup, "lookup");
    String url = lookup.apply(DATABASE_URL);
    if (url == null || url.isBlank()) {
      throw ConfigurationException.missing(DATABASE_URL);
    }
    Builder builder = builder()
        .databaseUrl(url)
        .username(blankToNull(lookup.apply(DATABASE_USERNAME)))
        .password(blankToNull(lookup.apply(DATABASE_PASSWORD)));
    String poolSize = blankToNull(lookup.apply(DATABASE_POOL_SIZE));
    if (poolSize != null) {
      builder.poolSize(parseInt(DATABASE_POOL_SIZE, poolSize));
    }
    String timeout = blankToNull(lookup.apply(DATABASE_CONNECT_TIMEOUT_MS));
    if (timeout != null) {
      builder.connectTimeout(Duration.ofMillis(parseNumber(DATABASE_CONNECT_TIMEOUT_MS, timeout)));
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String databaseUrl() {
    return databaseUrl;
  }

  /** Login user, or {@code null} when the URL carries credentials itself. */
  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  public int poolSize() {
    return poolSize;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  @Override
  public String toString() {
    return "EventbookConfig{databaseUrl=" + databaseUrl
        + ", username=" + username
        + ", poolSize=" + poolSize
        + ", connectTimeout=" + connectTimeout + "}";
  }

  private static int parseInt(String variable, String value) {
    long parsed = parseNumber(variable, value);
    if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
      throw new ConfigurationException(variable + " is out of range, got '" + value + "'");
    }
    return (int) parsed;
  }

  private static long parseNumber(String variable, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(variable + " must be a number, got '" + value + "'", e);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  public static final class Builder {
    private String databaseUrl;
    private String username;
    private String password;
    private int poolSize = DEFAULT_POOL_SIZE;
    private Duration connectTimeout = Duration.ofMillis(DEFAULT_CONNECT_TIMEOUT_MS);

    private Builder() {
    }

    /** <b>Required.</b> JDBC URL of the backing store. */
    public Builder databaseUrl(String databaseUrl) {
      this.databaseUrl = databaseUrl;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder poolSize(int poolSize) {
      this.poolSize = poolSize;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public EventbookConfig build() {
      return new EventbookConfig(this);
    }
  }
}

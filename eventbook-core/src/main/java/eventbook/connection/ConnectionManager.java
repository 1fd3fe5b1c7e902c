package eventbook.connection;

import eventbook.EventbookConfig;
import eventbook.spi.DatabaseConnector;
import eventbook.spi.DatabaseHandle;
import eventbook.spi.MetricsExporter;
import eventbook.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Owns the single shared {@link DatabaseHandle} of the process.
 *
 * <p>The handle is created lazily by the first {@link #acquire()} call and cached for the
 * lifetime of the manager. Concurrent callers arriving while an attempt is in flight share
 * that attempt: exactly one {@link DatabaseConnector#connect} call is made, and every
 * caller observes the same handle or the same {@link ConnectionException}. A failed
 * attempt is forgotten before its waiters are released, so the next {@code acquire()}
 * starts a fresh one.
 *
 * <p>Each caller receives its own dependent future. Cancelling it, or letting it time out
 * via {@link CompletableFuture#orTimeout}, affects only that caller; the shared attempt
 * keeps running.
 *
 * <p>Managers are explicit objects owned by the application bootstrap, not globals. Build
 * one per process and pass it to the components that need it:
 * <pre>{@code
 * EventbookConfig config = EventbookConfig.fromEnvironment();   // fails fast on missing DATABASE_URL
 * ConnectionManager connections = ConnectionManager.builder()
 *     .config(config)
 *     .connector(new HikariDatabaseConnector())
 *     .build();
 * DatabaseHandle handle = connections.acquire().join();
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionManager.class.getName());
  private static final Pattern PASSWORD_PARAM = Pattern.compile("(?i)(password=)[^;&]*");
  // user:secret@ in the authority part
  private static final Pattern USERINFO_PASSWORD = Pattern.compile("(//[^/:@?;]*:)[^/@?;]*@");

  private final EventbookConfig config;
  private final DatabaseConnector connector;
  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final MetricsExporter metrics;

  private final Object lock = new Object();
  private volatile DatabaseHandle handle;
  private CompletableFuture<DatabaseHandle> pending; // guarded by lock
  private boolean closed; // guarded by lock

  private ConnectionManager(Builder builder) {
    this.config = Objects.requireNonNull(builder.config, "config");
    this.connector = Objects.requireNonNull(builder.connector, "connector");
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
    if (builder.executor == null) {
      this.ownedExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("eventbook-connect-"));
      this.executor = ownedExecutor;
    } else {
      this.ownedExecutor = null;
      this.executor = builder.executor;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a future completing with the ready handle.
   *
   * <p>Completes immediately when the handle is cached. Otherwise joins the attempt in
   * flight, or starts one if there is none.
   *
   * @return a future completing with the handle, or exceptionally with a
   * {@link ConnectionException}
   */
  public CompletableFuture<DatabaseHandle> acquire() {
    DatabaseHandle ready = handle;
    if (ready != null) {
      return CompletableFuture.completedFuture(ready);
    }
    CompletableFuture<DatabaseHandle> attempt;
    boolean start = false;
    synchronized (lock) {
      if (closed) {
        return CompletableFuture.failedFuture(new ConnectionException("ConnectionManager is closed"));
      }
      if (handle != null) {
        return CompletableFuture.completedFuture(handle);
      }
      if (pending == null) {
        pending = new CompletableFuture<>();
        start = true;
      }
      attempt = pending;
    }
    // Copy before starting so a fast failure still reaches this caller
    CompletableFuture<DatabaseHandle> result = attempt.copy();
    if (start) {
      startAttempt(attempt);
    }
    return result;
  }

  /**
   * Blocking variant of {@link #acquire()}.
   *
   * @param timeout maximum time to wait for the handle
   * @return the ready handle
   * @throws ConnectionException if the attempt fails, the wait times out, or the calling
   *                             thread is interrupted
   */
  public DatabaseHandle acquire(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    CompletableFuture<DatabaseHandle> future = acquire();
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(false);
      throw new ConnectionException("Interrupted while waiting for database connection", e);
    } catch (TimeoutException e) {
      future.cancel(false);
      throw new ConnectionException("Timed out after " + timeout.toMillis()
          + "ms waiting for database connection", e);
    } catch (CancellationException e) {
      throw new ConnectionException("Database connection wait was cancelled", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof ConnectionException ce) {
        throw ce;
      }
      throw new ConnectionException("Database connection failed", cause);
    }
  }

  /**
   * Returns the cached handle without starting an attempt.
   *
   * @return the handle, or empty unless the state is {@link ConnectionState#READY}
   */
  public Optional<DatabaseHandle> current() {
    return Optional.ofNullable(handle);
  }

  public ConnectionState state() {
    synchronized (lock) {
      if (closed) {
        return ConnectionState.CLOSED;
      }
      if (handle != null) {
        return ConnectionState.READY;
      }
      return pending == null ? ConnectionState.UNINITIALIZED : ConnectionState.CONNECTING;
    }
  }

  public EventbookConfig config() {
    return config;
  }

  /**
   * Closes the cached handle and rejects further {@code acquire()} calls. An attempt still
   * in flight is failed for its waiters; if it later succeeds, its handle is closed.
   */
  @Override
  public void close() {
    DatabaseHandle toClose;
    CompletableFuture<DatabaseHandle> inFlight;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      toClose = handle;
      handle = null;
      inFlight = pending;
      pending = null;
    }
    if (inFlight != null) {
      inFlight.completeExceptionally(new ConnectionException("ConnectionManager closed while connecting"));
    }
    if (toClose != null) {
      closeQuietly(toClose);
      logger.info("Closed database connection to " + redact(toClose.url()));
    }
    if (ownedExecutor != null) {
      ownedExecutor.shutdownNow();
    }
  }

  private void startAttempt(CompletableFuture<DatabaseHandle> attempt) {
    metrics.incrementConnectionAttempt();
    logger.fine(() -> "Connecting to " + redact(config.databaseUrl()));
    try {
      executor.execute(() -> connect(attempt));
    } catch (RejectedExecutionException e) {
      fail(attempt, new ConnectionException("Connection executor rejected the attempt", e));
    }
  }

  private void connect(CompletableFuture<DatabaseHandle> attempt) {
    DatabaseHandle connected;
    try {
      connected = connector.connect(config);
      if (connected == null) {
        throw new IllegalStateException("DatabaseConnector returned null");
      }
    } catch (Exception e) {
      fail(attempt, e);
      return;
    }

    boolean stale;
    synchronized (lock) {
      stale = closed || pending != attempt;
      if (!stale) {
        handle = connected;
        pending = null;
      }
    }
    if (stale) {
      closeQuietly(connected);
      attempt.completeExceptionally(new ConnectionException("ConnectionManager closed while connecting"));
      return;
    }
    metrics.incrementConnectionSuccess();
    logger.info("Database connected successfully: " + redact(connected.url()));
    attempt.complete(connected);
  }

  private void fail(CompletableFuture<DatabaseHandle> attempt, Exception cause) {
    synchronized (lock) {
      if (pending == attempt) {
        pending = null;
      }
    }
    metrics.incrementConnectionFailure();
    logger.log(Level.WARNING, "Database connection failed: " + redact(config.databaseUrl()), cause);
    ConnectionException error = cause instanceof ConnectionException ce
        ? ce
        : new ConnectionException("Failed to connect to " + redact(config.databaseUrl()), cause);
    attempt.completeExceptionally(error);
  }

  private static void closeQuietly(DatabaseHandle toClose) {
    try {
      toClose.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close database handle", e);
    }
  }

  static String redact(String url) {
    if (url == null) {
      return null;
    }
    String masked = USERINFO_PASSWORD.matcher(url).replaceFirst("$1***@");
    return PASSWORD_PARAM.matcher(masked).replaceAll("$1***");
  }

  /**
   * Builder for {@link ConnectionManager}.
   */
  public static final class Builder {
    private EventbookConfig config;
    private DatabaseConnector connector;
    private Executor executor;
    private MetricsExporter metrics;

    private Builder() {
    }

    /** <b>Required.</b> Connection settings, normally {@link EventbookConfig#fromEnvironment()}. */
    public Builder config(EventbookConfig config) {
      this.config = config;
      return this;
    }

    /** <b>Required.</b> Performs the connection attempt. */
    public Builder connector(DatabaseConnector connector) {
      this.connector = connector;
      return this;
    }

    /**
     * Executor running connection attempts. Defaults to a private single daemon thread,
     * shut down by {@link ConnectionManager#close()}.
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ConnectionManager build() {
      return new ConnectionManager(this);
    }
  }
}

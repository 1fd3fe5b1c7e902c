package eventbook;

import eventbook.connection.ConnectionException;
import eventbook.connection.ConnectionManager;
import eventbook.model.Booking;
import eventbook.model.BookingDraft;
import eventbook.model.Event;
import eventbook.model.EventDraft;
import eventbook.model.NormalizedEvent;
import eventbook.spi.BookingStore;
import eventbook.spi.DatabaseHandle;
import eventbook.spi.EventLookup;
import eventbook.spi.EventStore;
import eventbook.spi.MetricsExporter;
import eventbook.util.DaemonThreadFactory;
import eventbook.validation.BookingPipeline;
import eventbook.validation.CollectionNotReadyException;
import eventbook.validation.DanglingReferenceException;
import eventbook.validation.EventPipeline;
import eventbook.validation.StoreEventLookup;
import eventbook.validation.ValidationException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link ConnectionManager}, the validation pipelines
 * and the stores into "validate, then persist" operations.
 *
 * <p>Every operation is asynchronous. Store calls run on a dedicated executor, so callers
 * never block on I/O. Failures surface as exceptionally completed futures carrying the
 * typed exception ({@link ValidationException}, {@link DanglingReferenceException},
 * {@link CollectionNotReadyException}, {@link DuplicateSlugException},
 * {@link ConnectionException}), wrapped in a {@link CompletionException} when the failure
 * happened in a dependent stage.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (ConnectionManager connections = ConnectionManager.builder()
 *          .config(EventbookConfig.fromEnvironment())
 *          .connector(new HikariDatabaseConnector())
 *          .build();
 *      Eventbook eventbook = Eventbook.builder()
 *          .connectionManager(connections)
 *          .eventStore(JdbcEventStores.detect(connections.config().databaseUrl()))
 *          .bookingStore(new JdbcBookingStore())
 *          .build()) {
 *   Event event = eventbook.createEvent(draft).join();
 *   Booking booking = eventbook.createBooking(BookingDraft.of(event.id(), "ada@example.com")).join();
 * }
 * }</pre>
 *
 * <p>The connection manager is not owned: closing an {@code Eventbook} leaves it open.
 */
public final class Eventbook implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Eventbook.class.getName());
  private static final String EVENT = "event";
  private static final String BOOKING = "booking";

  private final ConnectionManager connections;
  private final EventStore eventStore;
  private final BookingStore bookingStore;
  private final EventPipeline eventPipeline;
  private final BookingPipeline bookingPipeline;
  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final MetricsExporter metrics;
  private final Clock clock;

  private Eventbook(Builder builder) {
    this.connections = Objects.requireNonNull(builder.connectionManager, "connectionManager");
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.bookingStore = Objects.requireNonNull(builder.bookingStore, "bookingStore");
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
    this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
    if (builder.executor == null) {
      int threads = connections.config().poolSize();
      this.ownedExecutor = Executors.newFixedThreadPool(threads, new DaemonThreadFactory("eventbook-store-"));
      this.executor = ownedExecutor;
    } else {
      this.ownedExecutor = null;
      this.executor = builder.executor;
    }
    EventLookup lookup = builder.eventLookup != null
        ? builder.eventLookup
        : new StoreEventLookup(connections, eventStore, executor);
    this.eventPipeline = new EventPipeline();
    this.bookingPipeline = new BookingPipeline(lookup);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Validates and inserts a new event.
   *
   * @param draft the raw payload
   * @return future completing with the stored event
   */
  public CompletableFuture<Event> createEvent(EventDraft draft) {
    NormalizedEvent normalized;
    try {
      normalized = eventPipeline.validateAndNormalize(draft);
    } catch (ValidationException e) {
      recordRejection(EVENT, e);
      return CompletableFuture.failedFuture(e);
    }
    return track(EVENT, connections.acquire()
        .thenApplyAsync(handle -> withConnection(handle,
            conn -> eventStore.insert(conn, normalized, clock.instant())), executor));
  }

  /**
   * Validates a replacement payload against the stored event and writes it.
   *
   * @param id    the event identifier
   * @param draft the full proposed payload
   * @return future completing with the updated event, or empty if no event has this id
   */
  public CompletableFuture<Optional<Event>> updateEvent(String id, EventDraft draft) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(draft, "draft");
    return track(EVENT, connections.acquire()
        .thenApplyAsync(handle -> withConnection(handle, conn -> eventStore.findById(conn, id)
            .flatMap(previous -> {
              NormalizedEvent normalized = eventPipeline.validateAndNormalize(previous, draft);
              return eventStore.update(conn, id, normalized, clock.instant());
            })), executor));
  }

  public CompletableFuture<Optional<Event>> findEvent(String id) {
    Objects.requireNonNull(id, "id");
    return read(conn -> eventStore.findById(conn, id));
  }

  public CompletableFuture<Optional<Event>> findEventBySlug(String slug) {
    Objects.requireNonNull(slug, "slug");
    return read(conn -> eventStore.findBySlug(conn, slug));
  }

  /**
   * Validates a new booking, checks that its event exists, and inserts it.
   *
   * @param draft the raw payload
   * @return future completing with the stored booking
   */
  public CompletableFuture<Booking> createBooking(BookingDraft draft) {
    Objects.requireNonNull(draft, "draft");
    return track(BOOKING, connections.acquire()
        .thenCompose(handle -> bookingPipeline.validateAndNormalize(draft)
            .thenApplyAsync(normalized -> withConnection(handle,
                conn -> bookingStore.insert(conn, normalized, clock.instant())), executor)));
  }

  /**
   * Validates a replacement booking and writes it. The event reference is re-checked only
   * if {@code eventId} changes.
   *
   * @param id    the booking identifier
   * @param draft the full proposed payload
   * @return future completing with the updated booking, or empty if no booking has this id
   */
  public CompletableFuture<Optional<Booking>> updateBooking(String id, BookingDraft draft) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(draft, "draft");
    return track(BOOKING, connections.acquire()
        .thenCompose(handle -> CompletableFuture
            .supplyAsync(() -> withConnection(handle, conn -> bookingStore.findById(conn, id)), executor)
            .thenCompose(previous -> previous
                .map(stored -> bookingPipeline.validateAndNormalize(stored, draft)
                    .thenApplyAsync(normalized -> withConnection(handle,
                        conn -> bookingStore.update(conn, id, normalized, clock.instant())), executor))
                .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty())))));
  }

  public CompletableFuture<Optional<Booking>> findBooking(String id) {
    Objects.requireNonNull(id, "id");
    return read(conn -> bookingStore.findById(conn, id));
  }

  public CompletableFuture<List<Booking>> bookingsForEvent(String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    return read(conn -> bookingStore.findByEventId(conn, eventId));
  }

  /**
   * Shuts down the store executor if this instance created it.
   */
  @Override
  public void close() {
    if (ownedExecutor != null) {
      ownedExecutor.shutdown();
    }
  }

  private <T> CompletableFuture<T> read(Function<Connection, T> work) {
    return connections.acquire()
        .thenApplyAsync(handle -> withConnection(handle, work), executor);
  }

  private static <T> T withConnection(DatabaseHandle handle, Function<Connection, T> work) {
    try (Connection conn = handle.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw new ConnectionException("Failed to obtain a connection from " + handle.url(), e);
    }
  }

  private <T> CompletableFuture<T> track(String entity, CompletableFuture<T> future) {
    return future.whenComplete((result, error) -> {
      if (error == null) {
        if (!(result instanceof Optional<?> optional) || optional.isPresent()) {
          metrics.incrementPersisted(entity);
        }
        return;
      }
      recordRejection(entity, unwrap(error));
    });
  }

  private void recordRejection(String entity, Throwable error) {
    String reason;
    if (error instanceof ValidationException ve) {
      reason = ve.violations().get(0).rule().name().toLowerCase(Locale.ROOT);
    } else if (error instanceof DanglingReferenceException) {
      reason = "dangling_reference";
    } else if (error instanceof CollectionNotReadyException) {
      reason = "collection_not_ready";
    } else if (error instanceof DuplicateSlugException) {
      reason = "duplicate_slug";
    } else {
      logger.log(Level.WARNING, "Failed to persist " + entity, error);
      return;
    }
    metrics.incrementRejected(entity, reason);
    logger.fine(() -> "Rejected " + entity + ": " + error.getMessage());
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Builder for {@link Eventbook}.
   */
  public static final class Builder {
    private ConnectionManager connectionManager;
    private EventStore eventStore;
    private BookingStore bookingStore;
    private EventLookup eventLookup;
    private Executor executor;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> Source of the shared database handle. */
    public Builder connectionManager(ConnectionManager connectionManager) {
      this.connectionManager = connectionManager;
      return this;
    }

    /** <b>Required.</b> */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder bookingStore(BookingStore bookingStore) {
      this.bookingStore = bookingStore;
      return this;
    }

    /**
     * Existence check used by the booking pipeline. Defaults to a {@link StoreEventLookup}
     * over the event store.
     */
    public Builder eventLookup(EventLookup eventLookup) {
      this.eventLookup = eventLookup;
      return this;
    }

    /**
     * Executor for store calls. Defaults to a private pool sized like the connection pool,
     * shut down by {@link Eventbook#close()}.
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Source of {@code createdAt}/{@code updatedAt}. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Eventbook build() {
      return new Eventbook(this);
    }
  }
}

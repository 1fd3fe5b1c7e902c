package eventbook.micrometer;

import eventbook.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventbook.connection.attempts}: connection attempts started</li>
 *   <li>{@code eventbook.connection.success}: attempts that produced a ready handle</li>
 *   <li>{@code eventbook.connection.failure}: attempts that failed</li>
 *   <li>{@code eventbook.persisted}: entities written, tagged {@code entity}</li>
 *   <li>{@code eventbook.rejected}: payloads rejected before persistence, tagged
 *       {@code entity} and {@code reason}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter connectionAttempts;
  private final Counter connectionSuccess;
  private final Counter connectionFailure;
  private final Set<Meter> taggedMeters = ConcurrentHashMap.newKeySet();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventbook"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventbook");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "tickets.eventbook"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.connectionAttempts = Counter.builder(namePrefix + ".connection.attempts")
        .description("Database connection attempts started")
        .register(registry);
    this.connectionSuccess = Counter.builder(namePrefix + ".connection.success")
        .description("Database connection attempts that succeeded")
        .register(registry);
    this.connectionFailure = Counter.builder(namePrefix + ".connection.failure")
        .description("Database connection attempts that failed")
        .register(registry);
  }

  @Override
  public void incrementConnectionAttempt() {
    if (closed) return;
    connectionAttempts.increment();
  }

  @Override
  public void incrementConnectionSuccess() {
    if (closed) return;
    connectionSuccess.increment();
  }

  @Override
  public void incrementConnectionFailure() {
    if (closed) return;
    connectionFailure.increment();
  }

  @Override
  public void incrementPersisted(String entity) {
    if (closed) return;
    Counter counter = Counter.builder(namePrefix + ".persisted")
        .description("Entities persisted")
        .tag("entity", entity)
        .register(registry);
    taggedMeters.add(counter);
    counter.increment();
  }

  @Override
  public void incrementRejected(String entity, String reason) {
    if (closed) return;
    Counter counter = Counter.builder(namePrefix + ".rejected")
        .description("Payloads rejected before persistence")
        .tag("entity", entity)
        .tag("reason", reason)
        .register(registry);
    taggedMeters.add(counter);
    counter.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    List<Meter> meters = new ArrayList<>(
        List.of(connectionAttempts, connectionSuccess, connectionFailure));
    meters.addAll(taggedMeters);
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    taggedMeters.clear();
    if (first != null) throw first;
  }
}

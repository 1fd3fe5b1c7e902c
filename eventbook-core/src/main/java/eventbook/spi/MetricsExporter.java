package eventbook.spi;

/**
 * Observability hook for exporting connection and persistence counters to a metrics
 * backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of underlying connection attempts started.
   */
  void incrementConnectionAttempt();

  /**
   * Increments the count of connection attempts that produced a ready handle.
   */
  void incrementConnectionSuccess();

  /**
   * Increments the count of connection attempts that failed.
   */
  void incrementConnectionFailure();

  /**
   * Increments the count of entities persisted.
   *
   * @param entity entity kind, {@code "event"} or {@code "booking"}
   */
  void incrementPersisted(String entity);

  /**
   * Increments the count of payloads rejected before persistence.
   *
   * @param entity entity kind, {@code "event"} or {@code "booking"}
   * @param reason short rejection reason (a rule name, {@code "dangling_reference"}, ...)
   */
  void incrementRejected(String entity, String reason);

  final class Noop implements MetricsExporter {
    private Noop() {
    }

    @Override
    public void incrementConnectionAttempt() {
    }

    @Override
    public void incrementConnectionSuccess() {
    }

    @Override
    public void incrementConnectionFailure() {
    }

    @Override
    public void incrementPersisted(String entity) {
    }

    @Override
    public void incrementRejected(String entity, String reason) {
    }
  }
}

package eventbook.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void connectionCounters() {
    exporter.incrementConnectionAttempt();
    exporter.incrementConnectionAttempt();
    exporter.incrementConnectionFailure();
    exporter.incrementConnectionSuccess();

    assertEquals(2.0, counter("eventbook.connection.attempts").count());
    assertEquals(1.0, counter("eventbook.connection.failure").count());
    assertEquals(1.0, counter("eventbook.connection.success").count());
  }

  @Test
  void persistedIsTaggedByEntity() {
    exporter.incrementPersisted("event");
    exporter.incrementPersisted("event");
    exporter.incrementPersisted("booking");

    assertEquals(2.0, registry.get("eventbook.persisted").tag("entity", "event").counter().count());
    assertEquals(1.0, registry.get("eventbook.persisted").tag("entity", "booking").counter().count());
  }

  @Test
  void rejectedIsTaggedByEntityAndReason() {
    exporter.incrementRejected("booking", "dangling_reference");
    exporter.incrementRejected("booking", "invalid_email");
    exporter.incrementRejected("booking", "invalid_email");

    assertEquals(1.0, registry.get("eventbook.rejected")
        .tags("entity", "booking", "reason", "dangling_reference").counter().count());
    assertEquals(2.0, registry.get("eventbook.rejected")
        .tags("entity", "booking", "reason", "invalid_email").counter().count());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry customRegistry = new SimpleMeterRegistry();
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(customRegistry, "tickets.eventbook");
    custom.incrementConnectionAttempt();
    custom.incrementPersisted("event");

    assertEquals(1.0, customRegistry.get("tickets.eventbook.connection.attempts").counter().count());
    assertEquals(1.0, customRegistry.get("tickets.eventbook.persisted").counter().count());
    assertNull(customRegistry.find("eventbook.connection.attempts").counter());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "eventbook."));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementConnectionAttempt();
    exporter.incrementPersisted("event");
    exporter.incrementRejected("event", "duplicate_slug");

    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.incrementPersisted("event");
    assertNull(registry.find("eventbook.persisted").counter());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }
}

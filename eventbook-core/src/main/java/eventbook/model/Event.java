package eventbook.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Read-only record representing a persisted event row, as returned by
 * {@link eventbook.spi.EventStore} queries.
 *
 * @param id        store-assigned identifier (ULID)
 * @param createdAt time of the first successful write
 * @param updatedAt time of the latest successful write
 */
public record Event(
    String id,
    String title,
    String slug,
    String description,
    String overview,
    String image,
    String venue,
    String location,
    String date,
    String time,
    EventMode mode,
    String audience,
    List<String> agenda,
    String organizer,
    List<String> tags,
    Instant createdAt,
    Instant updatedAt) {

  public Event {
    Objects.requireNonNull(id, "id");
    agenda = List.copyOf(agenda);
    tags = List.copyOf(tags);
  }

  /**
   * Combines a normalized payload with store-managed fields.
   */
  public static Event of(String id, NormalizedEvent event, Instant createdAt, Instant updatedAt) {
    return new Event(id, event.title(), event.slug(), event.description(), event.overview(),
        event.image(), event.venue(), event.location(), event.date(), event.time(), event.mode(),
        event.audience(), event.agenda(), event.organizer(), event.tags(), createdAt, updatedAt);
  }
}

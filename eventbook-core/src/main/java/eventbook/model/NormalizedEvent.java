package eventbook.model;

import java.util.List;
import java.util.Objects;

/**
 * A validated event payload in canonical form, ready to be written by an
 * {@link eventbook.spi.EventStore}.
 *
 * <p>{@code date} is {@code YYYY-MM-DD}, {@code time} is 24-hour {@code HH:MM}, and
 * {@code slug} is derived from {@code title}.
 */
public record NormalizedEvent(
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
    List<String> tags) {

  public NormalizedEvent {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(slug, "slug");
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(mode, "mode");
    agenda = List.copyOf(agenda);
    tags = List.copyOf(tags);
  }
}

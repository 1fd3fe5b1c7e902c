package eventbook.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw event payload as submitted by a caller, before normalization.
 *
 * <p>Every field is optional at this stage; missing or malformed values are reported by
 * {@link eventbook.validation.EventPipeline}. {@code slug} is not part of a draft: it is
 * always derived from {@code title}.
 *
 * <pre>{@code
 * EventDraft draft = EventDraft.builder()
 *     .title("JSConf 2025")
 *     .date("2025-05-20")
 *     .time("9:30 AM")
 *     .mode("hybrid")
 *     ...
 *     .build();
 * }</pre>
 *
 * @see #from(Event)
 */
public final class EventDraft {
  private final String title;
  private final String description;
  private final String overview;
  private final String image;
  private final String venue;
  private final String location;
  private final String date;
  private final String time;
  private final String mode;
  private final String audience;
  private final List<String> agenda;
  private final String organizer;
  private final List<String> tags;

  private EventDraft(Builder builder) {
    this.title = builder.title;
    this.description = builder.description;
    this.overview = builder.overview;
    this.image = builder.image;
    this.venue = builder.venue;
    this.location = builder.location;
    this.date = builder.date;
    this.time = builder.time;
    this.mode = builder.mode;
    this.audience = builder.audience;
    this.agenda = copyOrNull(builder.agenda);
    this.organizer = builder.organizer;
    this.tags = copyOrNull(builder.tags);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a draft carrying the current values of a stored event, typically as the base of
   * an update: {@code EventDraft.from(event).toBuilder().time("18:00").build()}.
   *
   * @param event the stored event
   * @return a draft with identical field values
   */
  public static EventDraft from(Event event) {
    return builder()
        .title(event.title())
        .description(event.description())
        .overview(event.overview())
        .image(event.image())
        .venue(event.venue())
        .location(event.location())
        .date(event.date())
        .time(event.time())
        .mode(event.mode().value())
        .audience(event.audience())
        .agenda(event.agenda())
        .organizer(event.organizer())
        .tags(event.tags())
        .build();
  }

  public Builder toBuilder() {
    return builder()
        .title(title)
        .description(description)
        .overview(overview)
        .image(image)
        .venue(venue)
        .location(location)
        .date(date)
        .time(time)
        .mode(mode)
        .audience(audience)
        .agenda(agenda)
        .organizer(organizer)
        .tags(tags);
  }

  /**
   * Returns the raw string value of a field, or {@code null} if absent. Not defined for
   * the collection fields {@link EventField#AGENDA} and {@link EventField#TAGS}.
   */
  public String text(EventField field) {
    return switch (field) {
      case TITLE -> title;
      case DESCRIPTION -> description;
      case OVERVIEW -> overview;
      case IMAGE -> image;
      case VENUE -> venue;
      case LOCATION -> location;
      case DATE -> date;
      case TIME -> time;
      case MODE -> mode;
      case AUDIENCE -> audience;
      case ORGANIZER -> organizer;
      case AGENDA, TAGS -> throw new IllegalArgumentException(field + " is not a text field");
    };
  }

  public String title() {
    return title;
  }

  public String description() {
    return description;
  }

  public String overview() {
    return overview;
  }

  public String image() {
    return image;
  }

  public String venue() {
    return venue;
  }

  public String location() {
    return location;
  }

  public String date() {
    return date;
  }

  public String time() {
    return time;
  }

  public String mode() {
    return mode;
  }

  public String audience() {
    return audience;
  }

  /** Agenda items, or {@code null} if absent. Items may themselves be {@code null}. */
  public List<String> agenda() {
    return agenda;
  }

  public String organizer() {
    return organizer;
  }

  /** Tags, or {@code null} if absent. Items may themselves be {@code null}. */
  public List<String> tags() {
    return tags;
  }

  private static List<String> copyOrNull(List<String> values) {
    return values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
  }

  /**
   * Builder for {@link EventDraft}.
   */
  public static final class Builder {
    private String title;
    private String description;
    private String overview;
    private String image;
    private String venue;
    private String location;
    private String date;
    private String time;
    private String mode;
    private String audience;
    private List<String> agenda;
    private String organizer;
    private List<String> tags;

    private Builder() {
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder overview(String overview) {
      this.overview = overview;
      return this;
    }

    public Builder image(String image) {
      this.image = image;
      return this;
    }

    public Builder venue(String venue) {
      this.venue = venue;
      return this;
    }

    public Builder location(String location) {
      this.location = location;
      return this;
    }

    /** Calendar date; any ISO-8601 date or date-time is accepted. */
    public Builder date(String date) {
      this.date = date;
      return this;
    }

    /** Time of day, {@code HH:MM} or {@code H:MM AM/PM}. */
    public Builder time(String time) {
      this.time = time;
      return this;
    }

    public Builder mode(String mode) {
      this.mode = mode;
      return this;
    }

    public Builder mode(EventMode mode) {
      this.mode = mode == null ? null : mode.value();
      return this;
    }

    public Builder audience(String audience) {
      this.audience = audience;
      return this;
    }

    public Builder agenda(List<String> agenda) {
      this.agenda = agenda;
      return this;
    }

    public Builder organizer(String organizer) {
      this.organizer = organizer;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags = tags;
      return this;
    }

    public EventDraft build() {
      return new EventDraft(this);
    }
  }
}

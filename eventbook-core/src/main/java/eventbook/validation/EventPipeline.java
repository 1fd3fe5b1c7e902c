package eventbook.validation;

import eventbook.model.Event;
import eventbook.model.EventDraft;
import eventbook.model.EventField;
import eventbook.model.EventMode;
import eventbook.model.NormalizedEvent;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates and normalizes event payloads before they are persisted.
 *
 * <p>Runs in two passes. The structural pass trims every text field and checks required
 * fields, the {@code mode} enumeration and non-empty {@code agenda}/{@code tags}; all
 * violations are reported together. The derivation pass then rewrites the fields being
 * set or changed:
 * <ul>
 *   <li>{@code title} → {@code slug} via {@link Slugs#slugify}</li>
 *   <li>{@code date} → {@code YYYY-MM-DD} via {@link EventDates#canonical}</li>
 *   <li>{@code time} → 24-hour {@code HH:MM} via {@link EventTimes#canonical}</li>
 * </ul>
 * For a new event every field counts as changed. For an update, the caller passes the
 * stored event and the proposed draft; fields whose trimmed value equals the stored one
 * keep their stored derivation.
 *
 * <p>This class is stateless and thread-safe. It performs no I/O.
 */
public final class EventPipeline {
  private static final Logger logger = Logger.getLogger(EventPipeline.class.getName());
  static final String ENTITY = "event";

  private static final Map<EventField, String> REQUIRED_MESSAGES = new EnumMap<>(EventField.class);

  static {
    REQUIRED_MESSAGES.put(EventField.TITLE, "Event title is required");
    REQUIRED_MESSAGES.put(EventField.DESCRIPTION, "Event description is required");
    REQUIRED_MESSAGES.put(EventField.OVERVIEW, "Event overview is required");
    REQUIRED_MESSAGES.put(EventField.IMAGE, "Event image is required");
    REQUIRED_MESSAGES.put(EventField.VENUE, "Event venue is required");
    REQUIRED_MESSAGES.put(EventField.LOCATION, "Event location is required");
    REQUIRED_MESSAGES.put(EventField.DATE, "Event date is required");
    REQUIRED_MESSAGES.put(EventField.TIME, "Event time is required");
    REQUIRED_MESSAGES.put(EventField.MODE, "Event mode is required");
    REQUIRED_MESSAGES.put(EventField.AUDIENCE, "Event audience is required");
    REQUIRED_MESSAGES.put(EventField.AGENDA, "Event agenda is required");
    REQUIRED_MESSAGES.put(EventField.ORGANIZER, "Event organizer is required");
    REQUIRED_MESSAGES.put(EventField.TAGS, "Event tags are required");
  }

  /**
   * Validates a payload for a new event.
   *
   * @param draft the raw payload
   * @return the persist-ready event
   * @throws ValidationException if any field rule is violated
   */
  public NormalizedEvent validateAndNormalize(EventDraft draft) {
    Objects.requireNonNull(draft, "draft");
    return normalize(draft, null, EnumSet.allOf(EventField.class));
  }

  /**
   * Validates a payload replacing a stored event. Slug, date and time are re-derived only
   * when {@code title}, {@code date} or {@code time} respectively differ from the stored
   * values.
   *
   * @param previous the stored event
   * @param proposed the full proposed payload
   * @return the persist-ready event
   * @throws ValidationException if any field rule is violated
   */
  public NormalizedEvent validateAndNormalize(Event previous, EventDraft proposed) {
    Objects.requireNonNull(previous, "previous");
    Objects.requireNonNull(proposed, "proposed");
    return normalize(proposed, previous, changedFields(previous, proposed));
  }

  /**
   * Computes which fields of {@code proposed} differ from {@code previous}, comparing
   * trimmed text values and list contents.
   *
   * @param previous the stored event
   * @param proposed the proposed payload
   * @return the changed fields
   */
  public static Set<EventField> changedFields(Event previous, EventDraft proposed) {
    EnumSet<EventField> changed = EnumSet.noneOf(EventField.class);
    EventDraft stored = EventDraft.from(previous);
    for (EventField field : EventField.values()) {
      boolean same = switch (field) {
        case AGENDA -> Objects.equals(stored.agenda(), proposed.agenda());
        case TAGS -> Objects.equals(stored.tags(), proposed.tags());
        default -> Objects.equals(stored.text(field), trim(proposed.text(field)));
      };
      if (!same) {
        changed.add(field);
      }
    }
    return changed;
  }

  private NormalizedEvent normalize(EventDraft draft, Event previous, Set<EventField> changed) {
    Map<EventField, String> text = new EnumMap<>(EventField.class);
    List<Violation> violations = new ArrayList<>();

    for (EventField field : EventField.values()) {
      if (field == EventField.AGENDA || field == EventField.TAGS) {
        checkCollection(field, field == EventField.AGENDA ? draft.agenda() : draft.tags(), violations);
        continue;
      }
      String value = trim(draft.text(field));
      if (value == null || value.isEmpty()) {
        violations.add(new Violation(field.fieldName(), Rule.REQUIRED_FIELD, REQUIRED_MESSAGES.get(field)));
      } else {
        text.put(field, value);
      }
    }
    Optional<EventMode> mode = Optional.empty();
    if (text.containsKey(EventField.MODE)) {
      mode = EventMode.fromValue(text.get(EventField.MODE));
      if (mode.isEmpty()) {
        violations.add(new Violation(EventField.MODE.fieldName(), Rule.INVALID_ENUM,
            "Mode must be online, offline, or hybrid"));
      }
    }
    reject(violations);

    String title = text.get(EventField.TITLE);
    String slug = previous == null || changed.contains(EventField.TITLE)
        ? Slugs.slugify(title)
        : previous.slug();

    String date = previous == null ? null : previous.date();
    if (previous == null || changed.contains(EventField.DATE)) {
      date = EventDates.canonical(text.get(EventField.DATE)).orElse(null);
      if (date == null) {
        violations.add(new Violation(EventField.DATE.fieldName(), Rule.INVALID_DATE,
            "Date must be a valid date string"));
      }
    }
    String time = previous == null ? null : previous.time();
    if (previous == null || changed.contains(EventField.TIME)) {
      time = EventTimes.canonical(text.get(EventField.TIME)).orElse(null);
      if (time == null) {
        violations.add(new Violation(EventField.TIME.fieldName(), Rule.INVALID_TIME,
            "Time must be in HH:MM or HH:MM AM/PM format"));
      }
    }
    reject(violations);

    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Normalized event slug=" + slug + " date=" + date + " time=" + time
          + " changed=" + changed);
    }
    return new NormalizedEvent(
        title,
        slug,
        text.get(EventField.DESCRIPTION),
        text.get(EventField.OVERVIEW),
        text.get(EventField.IMAGE),
        text.get(EventField.VENUE),
        text.get(EventField.LOCATION),
        date,
        time,
        mode.orElseThrow(),
        text.get(EventField.AUDIENCE),
        draft.agenda(),
        text.get(EventField.ORGANIZER),
        draft.tags());
  }

  private static void checkCollection(EventField field, List<String> values, List<Violation> violations) {
    if (values == null) {
      violations.add(new Violation(field.fieldName(), Rule.REQUIRED_FIELD, REQUIRED_MESSAGES.get(field)));
    } else if (values.isEmpty()) {
      String label = field == EventField.AGENDA ? "Agenda" : "Tags";
      violations.add(new Violation(field.fieldName(), Rule.EMPTY_COLLECTION,
          label + " must contain at least one item"));
    } else if (values.contains(null)) {
      violations.add(new Violation(field.fieldName(), Rule.REQUIRED_FIELD,
          field.fieldName() + " must not contain null items"));
    }
  }

  private static void reject(List<Violation> violations) {
    if (!violations.isEmpty()) {
      throw new ValidationException(ENTITY, violations);
    }
  }

  private static String trim(String value) {
    return value == null ? null : value.strip();
  }
}

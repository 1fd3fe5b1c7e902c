package eventbook.validation;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Normalizes event dates to the canonical {@code YYYY-MM-DD} form.
 *
 * <p>Parsing is ISO-8601 only and locale-independent. Accepted inputs, tried in order:
 * <ol>
 *   <li>calendar date, {@code 2024-06-15}</li>
 *   <li>date-time with offset, {@code 2024-06-15T10:30:00.000Z} or {@code 2024-06-15T23:30+02:00}</li>
 *   <li>date-time with region, {@code 2024-06-15T10:30+02:00[Europe/Paris]}</li>
 *   <li>date-time without offset, {@code 2024-06-15T10:30}, read as UTC</li>
 *   <li>RFC 1123, {@code Sat, 15 Jun 2024 10:30:00 GMT}</li>
 * </ol>
 * Date-times are converted to their UTC calendar date, so {@code 2024-06-15T23:30-05:00}
 * normalizes to {@code 2024-06-16}. Years outside 0000-9999 are rejected.
 */
public final class EventDates {
  private static final List<Function<String, LocalDate>> PARSERS = List.of(
      s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE),
      s -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
          .atZoneSameInstant(ZoneOffset.UTC).toLocalDate(),
      s -> ZonedDateTime.parse(s, DateTimeFormatter.ISO_ZONED_DATE_TIME)
          .withZoneSameInstant(ZoneOffset.UTC).toLocalDate(),
      s -> Instant.parse(s).atOffset(ZoneOffset.UTC).toLocalDate(),
      s -> LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate(),
      s -> ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME)
          .withZoneSameInstant(ZoneOffset.UTC).toLocalDate());

  private EventDates() {
  }

  /**
   * Parses {@code value} and formats it as {@code YYYY-MM-DD}.
   *
   * @param value the raw date, already trimmed
   * @return the canonical date, or empty if the value cannot be parsed
   */
  public static Optional<String> canonical(String value) {
    if (value == null || value.isEmpty()) {
      return Optional.empty();
    }
    for (Function<String, LocalDate> parser : PARSERS) {
      LocalDate date;
      try {
        date = parser.apply(value);
      } catch (DateTimeException e) {
        continue;
      }
      if (date.getYear() < 0 || date.getYear() > 9999) {
        return Optional.empty();
      }
      return Optional.of(DateTimeFormatter.ISO_LOCAL_DATE.format(date));
    }
    return Optional.empty();
  }
}

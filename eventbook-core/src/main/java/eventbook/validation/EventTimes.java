package eventbook.validation;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes event times to zero-padded 24-hour {@code HH:MM}.
 *
 * <p>Accepts 24-hour {@code H:MM}/{@code HH:MM} (hours 0-23) and 12-hour
 * {@code H:MM AM}/{@code HH:MMPM} (hours 1-12, at most one space before the
 * case-insensitive period). {@code "12:00 AM"} is {@code "00:00"}, {@code "12:30 PM"} is
 * {@code "12:30"}, {@code "3:15 PM"} is {@code "15:15"}.
 */
public final class EventTimes {
  private static final Pattern H24 = Pattern.compile("^([0-1]?[0-9]|2[0-3]):([0-5][0-9])$");
  private static final Pattern H12 = Pattern.compile(
      "^(0?[1-9]|1[0-2]):([0-5][0-9])\\s?(AM|PM)$",
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

  private EventTimes() {
  }

  /**
   * @param value the raw time, already trimmed
   * @return the canonical time, or empty if the value matches neither accepted shape
   */
  public static Optional<String> canonical(String value) {
    if (value == null) {
      return Optional.empty();
    }
    Matcher m = H24.matcher(value);
    if (m.matches()) {
      return Optional.of(format(Integer.parseInt(m.group(1)), m.group(2)));
    }
    m = H12.matcher(value);
    if (m.matches()) {
      int hours = Integer.parseInt(m.group(1));
      boolean pm = "PM".equals(m.group(3).toUpperCase(Locale.ROOT));
      if (pm && hours != 12) {
        hours += 12;
      } else if (!pm && hours == 12) {
        hours = 0;
      }
      return Optional.of(format(hours, m.group(2)));
    }
    return Optional.empty();
  }

  private static String format(int hours, String minutes) {
    return String.format(Locale.ROOT, "%02d:%s", hours, minutes);
  }
}

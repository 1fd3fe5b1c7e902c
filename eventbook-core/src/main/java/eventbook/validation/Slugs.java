package eventbook.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Derives URL-safe slugs from event titles.
 *
 * <p>{@code "C++ & Python: Advanced Programming!"} becomes
 * {@code "c-python-advanced-programming"}. The result never starts or ends with a hyphen
 * and never contains two consecutive hyphens. It may be empty when the title holds only
 * punctuation.
 */
public final class Slugs {
  // ECMAScript whitespace and line terminators, so U+FEFF counts and U+0085 does not
  private static final String SPACE_CHARS =
      "\\t\\n\\u000B\\f\\r \\u00A0\\u1680\\u2000-\\u200A\\u2028\\u2029\\u202F\\u205F\\u3000\\uFEFF";
  private static final Pattern EDGE_SPACE = Pattern.compile("^[" + SPACE_CHARS + "]+|[" + SPACE_CHARS + "]+$");
  private static final Pattern SPECIAL = Pattern.compile("[^a-zA-Z0-9_" + SPACE_CHARS + "-]");
  private static final Pattern WHITESPACE = Pattern.compile("[" + SPACE_CHARS + "]+");
  private static final Pattern HYPHENS = Pattern.compile("-+");
  private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

  private Slugs() {
  }

  public static String slugify(String title) {
    Objects.requireNonNull(title, "title");
    String slug = EDGE_SPACE.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("");
    slug = SPECIAL.matcher(slug).replaceAll("");
    slug = WHITESPACE.matcher(slug).replaceAll("-");
    slug = HYPHENS.matcher(slug).replaceAll("-");
    return EDGE_HYPHENS.matcher(slug).replaceAll("");
  }
}

package eventbook.validation;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Booking email normalization and shape check.
 *
 * <p>The shape rule is {@code X@Y.Z} where each part is one or more characters that are
 * neither whitespace nor {@code @}. It is deliberately loose: {@code .a@b..c} passes.
 */
public final class EmailAddresses {
  private static final Pattern SHAPE = Pattern.compile(
      "^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$", Pattern.UNICODE_CHARACTER_CLASS);

  private EmailAddresses() {
  }

  /** Trims and lowercases; {@code null} stays {@code null}. */
  public static String normalize(String email) {
    return email == null ? null : email.strip().toLowerCase(Locale.ROOT);
  }

  public static boolean isValid(String email) {
    return email != null && SHAPE.matcher(email).matches();
  }
}

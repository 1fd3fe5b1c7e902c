package eventbook.validation;

import java.util.Objects;

/**
 * One rule violated by one field of a payload.
 *
 * @param field   payload field name, e.g. {@code "agenda"}
 * @param rule    the violated rule
 * @param message human-readable description
 */
public record Violation(String field, Rule rule, String message) {

  public Violation {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(message, "message");
  }

  @Override
  public String toString() {
    return field + " [" + rule + "]: " + message;
  }
}

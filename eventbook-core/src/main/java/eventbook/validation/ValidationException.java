package eventbook.validation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Thrown when a payload violates one or more field rules. Carries every violation found
 * in the same pass, each naming its field.
 */
public final class ValidationException extends RuntimeException {
  private final String entity;
  private final List<Violation> violations;

  public ValidationException(String entity, List<Violation> violations) {
    super(message(entity, violations));
    this.entity = Objects.requireNonNull(entity, "entity");
    this.violations = List.copyOf(violations);
    if (this.violations.isEmpty()) {
      throw new IllegalArgumentException("violations must not be empty");
    }
  }

  /** Entity kind the payload was meant for, {@code "event"} or {@code "booking"}. */
  public String entity() {
    return entity;
  }

  public List<Violation> violations() {
    return violations;
  }

  public Optional<Violation> violation(String field) {
    return violations.stream().filter(v -> v.field().equals(field)).findFirst();
  }

  public boolean hasViolation(String field, Rule rule) {
    return violations.stream().anyMatch(v -> v.field().equals(field) && v.rule() == rule);
  }

  private static String message(String entity, List<Violation> violations) {
    return "Invalid " + entity + ": " + violations.stream()
        .map(Violation::toString)
        .collect(Collectors.joining("; "));
  }
}

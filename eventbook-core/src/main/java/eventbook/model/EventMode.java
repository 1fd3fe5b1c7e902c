package eventbook.model;

import java.util.Optional;

/**
 * How an event is attended. Stored as its lowercase {@link #value()}.
 */
public enum EventMode {
  ONLINE("online"),
  OFFLINE("offline"),
  HYBRID("hybrid");

  private final String value;

  EventMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Resolves a stored value. Matching is exact: {@code "Online"} is not a mode.
   *
   * @param value the stored value
   * @return the mode, or empty if the value is not one of the enumerated values
   */
  public static Optional<EventMode> fromValue(String value) {
    for (EventMode mode : values()) {
      if (mode.value.equals(value)) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }
}

package eventbook.model;

/**
 * Fields of an {@link Event} payload, named as they appear in violations.
 */
public enum EventField {
  TITLE("title"),
  DESCRIPTION("description"),
  OVERVIEW("overview"),
  IMAGE("image"),
  VENUE("venue"),
  LOCATION("location"),
  DATE("date"),
  TIME("time"),
  MODE("mode"),
  AUDIENCE("audience"),
  AGENDA("agenda"),
  ORGANIZER("organizer"),
  TAGS("tags");

  private final String fieldName;

  EventField(String fieldName) {
    this.fieldName = fieldName;
  }

  public String fieldName() {
    return fieldName;
  }
}

package eventbook;

/**
 * Thrown by an {@link eventbook.spi.EventStore} write when the derived slug is already
 * taken by another event.
 *
 * <p>Slugs are derived in memory by the pipeline; uniqueness is enforced only by the
 * store's unique index, so this is always a persistence-time failure.
 */
public final class DuplicateSlugException extends RuntimeException {
  private final String slug;

  public DuplicateSlugException(String slug, Throwable cause) {
    super("An event with slug '" + slug + "' already exists", cause);
    this.slug = slug;
  }

  public String slug() {
    return slug;
  }
}

package eventbook.validation;

import com.github.f4b6a3.ulid.Ulid;
import eventbook.model.Booking;
import eventbook.model.BookingDraft;
import eventbook.model.BookingField;
import eventbook.model.NormalizedBooking;
import eventbook.spi.EventLookup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Validates and normalizes booking payloads, including the referential check against the
 * event collection.
 *
 * <p>The email is trimmed, lowercased and checked with {@link EmailAddresses#isValid};
 * the event identifier is trimmed and canonicalized. Structural violations fail the
 * returned future with a {@link ValidationException} without touching the store. When the
 * booking is new, or its {@code eventId} changes, one existence query is issued through
 * the {@link EventLookup}: a missing event fails with {@link DanglingReferenceException},
 * an unqueryable collection with {@link CollectionNotReadyException}.
 *
 * <p>The check is point-in-time: an event deleted after the query returns is not detected.
 *
 * <p>This class is thread-safe.
 */
public final class BookingPipeline {
  private static final Logger logger = Logger.getLogger(BookingPipeline.class.getName());
  static final String ENTITY = "booking";

  private final EventLookup eventLookup;

  public BookingPipeline(EventLookup eventLookup) {
    this.eventLookup = Objects.requireNonNull(eventLookup, "eventLookup");
  }

  /**
   * Validates a payload for a new booking. The referenced event is always looked up.
   *
   * @param draft the raw payload
   * @return future completing with the persist-ready booking
   */
  public CompletableFuture<NormalizedBooking> validateAndNormalize(BookingDraft draft) {
    Objects.requireNonNull(draft, "draft");
    return normalize(draft, null);
  }

  /**
   * Validates a payload replacing a stored booking. The referenced event is looked up only
   * when the canonical {@code eventId} differs from the stored one.
   *
   * @param previous the stored booking
   * @param proposed the full proposed payload
   * @return future completing with the persist-ready booking
   */
  public CompletableFuture<NormalizedBooking> validateAndNormalize(Booking previous, BookingDraft proposed) {
    Objects.requireNonNull(previous, "previous");
    Objects.requireNonNull(proposed, "proposed");
    return normalize(proposed, previous);
  }

  private CompletableFuture<NormalizedBooking> normalize(BookingDraft draft, Booking previous) {
    NormalizedBooking booking;
    try {
      booking = normalizeFields(draft);
    } catch (ValidationException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (previous != null && previous.eventId().equals(booking.eventId())) {
      return CompletableFuture.completedFuture(booking);
    }

    CompletableFuture<Boolean> lookup;
    try {
      lookup = eventLookup.exists(booking.eventId());
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    return lookup.thenApply(exists -> {
      if (!Boolean.TRUE.equals(exists)) {
        logger.fine(() -> "Rejected booking for missing event " + booking.eventId());
        throw new DanglingReferenceException(booking.eventId());
      }
      return booking;
    });
  }

  private static NormalizedBooking normalizeFields(BookingDraft draft) {
    List<Violation> violations = new ArrayList<>();

    String eventId = draft.eventId() == null ? null : draft.eventId().strip();
    if (eventId == null || eventId.isEmpty()) {
      violations.add(new Violation(BookingField.EVENT_ID.fieldName(), Rule.REQUIRED_FIELD,
          "Event ID is required"));
    } else if (!Ulid.isValid(eventId)) {
      violations.add(new Violation(BookingField.EVENT_ID.fieldName(), Rule.INVALID_IDENTIFIER,
          "Event ID must be a valid identifier"));
    } else {
      eventId = Ulid.from(eventId).toString();
    }

    String email = EmailAddresses.normalize(draft.email());
    if (email == null || email.isEmpty()) {
      violations.add(new Violation(BookingField.EMAIL.fieldName(), Rule.REQUIRED_FIELD,
          "Email is required"));
    } else if (!EmailAddresses.isValid(email)) {
      violations.add(new Violation(BookingField.EMAIL.fieldName(), Rule.INVALID_EMAIL,
          "Please provide a valid email address"));
    }

    if (!violations.isEmpty()) {
      throw new ValidationException(ENTITY, violations);
    }
    return new NormalizedBooking(eventId, email);
  }
}

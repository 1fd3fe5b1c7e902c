/**
 * Per-entity validation and normalization.
 *
 * <p>{@link eventbook.validation.EventPipeline} turns an
 * {@link eventbook.model.EventDraft} into a {@link eventbook.model.NormalizedEvent}
 * (slug, canonical date and time); {@link eventbook.validation.BookingPipeline} turns a
 * {@link eventbook.model.BookingDraft} into a {@link eventbook.model.NormalizedBooking}
 * after checking that the referenced event exists.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link eventbook.validation.ValidationException}: field rules, see
 *       {@link eventbook.validation.Rule}</li>
 *   <li>{@link eventbook.validation.DanglingReferenceException}: referenced event missing</li>
 *   <li>{@link eventbook.validation.CollectionNotReadyException}: event collection not
 *       queryable yet</li>
 * </ul>
 */
package eventbook.validation;

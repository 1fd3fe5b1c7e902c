package eventbook.validation;

/**
 * Field-level rule a payload can violate.
 */
public enum Rule {
  /** Field absent, or blank after trimming. */
  REQUIRED_FIELD,
  /** Value is not one of the enumerated values. */
  INVALID_ENUM,
  /** Collection present but has no elements. */
  EMPTY_COLLECTION,
  INVALID_DATE,
  INVALID_TIME,
  INVALID_EMAIL,
  /** Reference is not a well-formed store identifier. */
  INVALID_IDENTIFIER
}

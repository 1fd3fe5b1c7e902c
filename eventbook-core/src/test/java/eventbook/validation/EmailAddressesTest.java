package eventbook.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmailAddressesTest {

  @Test
  void normalizeTrimsAndLowercases() {
    assertEquals("ada@example.com", EmailAddresses.normalize("  Ada@Example.COM "));
    assertEquals("user@example.com", EmailAddresses.normalize("  USER@EXAMPLE.COM  "));
    assertNull(EmailAddresses.normalize(null));
  }

  @Test
  void acceptsSimpleShape() {
    assertTrue(EmailAddresses.isValid("ada@example.com"));
    assertTrue(EmailAddresses.isValid("first.last+tag@sub.example.org"));
  }

  @Test
  void looseShapeAcceptsOddButStructuredAddresses() {
    assertTrue(EmailAddresses.isValid(".a@b..c"));
  }

  @Test
  void rejectsMissingPartsWhitespaceAndExtraAt() {
    assertFalse(EmailAddresses.isValid("ada.example.com"));
    assertFalse(EmailAddresses.isValid("ada@example"));
    assertFalse(EmailAddresses.isValid("ada @example.com"));
    assertFalse(EmailAddresses.isValid("ada@@example.com"));
    assertFalse(EmailAddresses.isValid("@example.com"));
    assertFalse(EmailAddresses.isValid(null));
  }
}

package eventbook.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SlugsTest {

  @Test
  void stripsPunctuationAndJoinsWordsWithHyphens() {
    assertEquals("c-python-advanced-programming", Slugs.slugify("C++ & Python: Advanced Programming!"));
  }

  @Test
  void collapsesWhitespaceAndHyphenRuns() {
    assertEquals("react-summit-2024", Slugs.slugify("  React   Summit -- 2024  "));
  }

  @Test
  void neverStartsOrEndsWithHyphen() {
    assertEquals("devops-days", Slugs.slugify("--DevOps Days--"));
  }

  @Test
  void keepsUnderscores() {
    assertEquals("snake_case-meetup", Slugs.slugify("snake_case meetup"));
  }

  @Test
  void dropsNonAsciiLetters() {
    assertEquals("caf-meetup", Slugs.slugify("Café Meetup"));
  }

  @Test
  void punctuationOnlyTitleYieldsEmptySlug() {
    assertEquals("", Slugs.slugify("!!!"));
  }

  @Test
  void byteOrderMarkSeparatesWordsAndIsTrimmed() {
    assertEquals("java-night", Slugs.slugify("Java\uFEFFNight"));
    assertEquals("java-night", Slugs.slugify("\uFEFFJava Night\uFEFF"));
  }

  @Test
  void nextLineIsRemovedNotHyphenated() {
    assertEquals("javanight", Slugs.slugify("Java\u0085Night"));
  }

  @Test
  void unicodeSpacesBecomeHyphens() {
    assertEquals("java-night", Slugs.slugify("Java\u00A0Night"));
    assertEquals("java-night", Slugs.slugify("Java\u3000Night"));
  }

  @Test
  void isIdempotent() {
    String once = Slugs.slugify("JS Conf: Next Gen");
    assertEquals(once, Slugs.slugify(once));
  }
}

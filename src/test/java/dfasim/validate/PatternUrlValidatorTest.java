package dfasim.validate;

import static org.junit.jupiter.api.Assertions.*;

import dfasim.grammar.UrlGrammar;
import java.util.List;
import org.junit.jupiter.api.Test;

final class PatternUrlValidatorTest {

  private final PatternUrlValidator validator = new PatternUrlValidator(new SecurityScanner());

  @Test
  void splitsValidUrl() {
    final ValidationResult result = validator.validate("https://example.com/path?q=1#frag");
    assertTrue(result.valid());
    assertEquals(
      new UrlComponents("https", "example.com", "/path", "?q=1", "#frag"),
      result.components()
    );
    assertEquals(
      List.of("start", "scheme", "authority", "path", "query", "fragment"),
      result.stateSequence()
    );
  }

  @Test
  void portIsAccepted() {
    final ValidationResult result = validator.validate("http://example.com:8080/x");
    assertTrue(result.valid());
    assertEquals("/x", result.components().path());
  }

  @Test
  void rejectionsExplainThemselves() {
    assertEquals(RejectionReasons.EMPTY, validator.validate("").rejectionReason());
    assertEquals(RejectionReasons.BAD_SCHEME_START, validator.validate("ftp://x.com").rejectionReason());
    assertEquals(RejectionReasons.BAD_SCHEME, validator.validate("http:x.com").rejectionReason());
    assertEquals(RejectionReasons.MISSING_DOMAIN, validator.validate("http://").rejectionReason());
    assertEquals(RejectionReasons.BAD_DOMAIN, validator.validate("http://.com").rejectionReason());
    assertEquals(RejectionReasons.BAD_FORMAT, validator.validate("http://x.com/a b").rejectionReason());
  }

  @Test
  void approximateSequenceEndsInRejected() {
    assertEquals(List.of("start", "rejected"), validator.validate("ftp://x.com").stateSequence());
    assertEquals(List.of("start", "scheme", "rejected"), validator.validate("http://").stateSequence());
    assertEquals(
      List.of("start", "scheme", "authority", "path", "rejected"),
      validator.validate("http://x.com/a b").stateSequence()
    );
  }

  @Test
  void agreesWithAutomatonOnScenarios() {
    final UrlValidator automaton = AutomatonUrlValidator.forUrlGrammar(new SecurityScanner());
    for (String url : List.of(
      "https://example.com/path?q=1#frag",
      "http://example.com",
      "http://a.b.c/d/e",
      "http://example.com/?x=1",
      "http://",
      "https:",
      "ftp://x.com",
      ""
    )) {
      final ValidationResult expected = automaton.validate(url);
      final ValidationResult actual = validator.validate(url);
      assertEquals(expected.valid(), actual.valid(), url);
      assertEquals(expected.components(), actual.components(), url);
      assertEquals(UrlGrammar.START, actual.stateSequence().get(0), url);
    }
  }
}

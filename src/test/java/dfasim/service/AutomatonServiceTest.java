package dfasim.service;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import dfasim.codec.AutomatonCodec;
import dfasim.validate.AutomatonUrlValidator;
import dfasim.validate.SecurityIssue;
import dfasim.validate.SecurityScanner;
import dfasim.validate.UrlComponents;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class AutomatonServiceTest {

  @TempDir
  Path dir;

  private AutomatonService service;

  private final ObjectMapper mapper = new ObjectMapper();

  @BeforeEach
  void setUp() {
    service = new AutomatonService(
      new AutomatonStore(dir, new AutomatonCodec()),
      AutomatonUrlValidator.forUrlGrammar(new SecurityScanner())
    );
  }

  // Strings ending in `b`, over {a, b}
  private static CreateRequest endsInB() {
    return new CreateRequest(
      List.of("q0", "q1"),
      List.of("a", "b"),
      List.of(
        new CreateRequest.TransitionRow("q0", "a", "q0"),
        new CreateRequest.TransitionRow("q0", "b", "q1"),
        new CreateRequest.TransitionRow("q1", "a", "q0"),
        new CreateRequest.TransitionRow("q1", "b", "q1")
      ),
      "q0",
      List.of("q1")
    );
  }

  @Test
  void createThenTest() {
    final CreateResponse created = service.create(endsInB());
    assertTrue(created.success());
    assertEquals("DFA created successfully", created.message());
    assertNotNull(created.dfaId());

    final TestResponse accepted = service.test(created.dfaId(), "aab");
    assertTrue(accepted.success());
    assertTrue(accepted.accepted());
    assertEquals(List.of("q0", "q0", "q0", "q1"), accepted.stateSequence());
    assertNull(accepted.message());

    final TestResponse rejected = service.test(created.dfaId(), "ba");
    assertTrue(rejected.success());
    assertFalse(rejected.accepted());
  }

  @Test
  void createIsIdempotent() {
    assertEquals(service.create(endsInB()).dfaId(), service.create(endsInB()).dfaId());
  }

  @Test
  void unknownSymbolIsStructuredRejection() {
    final String id = service.create(endsInB()).dfaId();
    final TestResponse response = service.test(id, "abc");
    assertTrue(response.success());
    assertFalse(response.accepted());
    assertEquals(List.of("q0", "q0", "q1"), response.stateSequence());
    assertEquals("Symbol 'c' not in alphabet (at position 2)", response.message());
  }

  @Test
  void invalidAutomatonIsFailure() {
    final CreateRequest request = new CreateRequest(
      List.of("q0"),
      List.of("a"),
      List.of(),
      "q0",
      List.of("q9")
    );
    final CreateResponse response = service.create(request);
    assertFalse(response.success());
    assertTrue(response.message().startsWith("Error creating DFA: "));
    assertNull(response.dfaId());
  }

  @Test
  void multiCharacterSymbolIsFailure() {
    final CreateRequest request = new CreateRequest(
      List.of("q0"),
      List.of("ab"),
      List.of(),
      "q0",
      List.of()
    );
    assertFalse(service.create(request).success());
  }

  @Test
  void incompleteRowsAreSkipped() {
    final CreateRequest request = new CreateRequest(
      List.of("q0"),
      List.of("a"),
      List.of(
        new CreateRequest.TransitionRow("q0", "a", "q0"),
        new CreateRequest.TransitionRow("q0", null, "q0"),
        new CreateRequest.TransitionRow("q0", "a", "")
      ),
      "q0",
      List.of("q0")
    );
    final CreateResponse created = service.create(request);
    assertTrue(created.success());
    assertTrue(service.test(created.dfaId(), "aaa").accepted());
  }

  @Test
  void missingAutomatonIsFailure() {
    final TestResponse response = service.test("f".repeat(64), "a");
    assertFalse(response.success());
    assertNull(response.accepted());
    assertTrue(response.message().startsWith("Error testing DFA: File "));
    assertTrue(response.message().endsWith(" not found."));

    assertFalse(service.diagram("nope").success());
    assertFalse(service.check("nope", List.of("a")).success());
  }

  @Test
  void checkUsesCompiledAcceptor() {
    final String id = service.create(endsInB()).dfaId();
    final CheckResponse response = service.check(id, List.of("ab", "ba", "", "abc", "bbb"));
    assertTrue(response.success());
    assertEquals(List.of(true, false, false, false, true), response.accepted());

    // Second call reuses the compiled acceptor
    assertEquals(List.of(true), service.check(id, List.of("b")).accepted());
  }

  @Test
  void checkTreatsNullLikeTest() {
    final String id = service.create(endsInB()).dfaId();
    assertFalse(service.test(id, null).accepted());

    final CheckResponse response = service.check(id, Arrays.asList("b", null));
    assertTrue(response.success());
    assertEquals(List.of(true, false), response.accepted());

    final CheckResponse none = service.check(id, null);
    assertTrue(none.success());
    assertEquals(List.of(), none.accepted());
  }

  @Test
  void compiledAcceptorsAreBounded() {
    final var bounded = new AutomatonService(
      new AutomatonStore(dir, new AutomatonCodec()),
      AutomatonUrlValidator.forUrlGrammar(new SecurityScanner()),
      1
    );
    final String endsInB = bounded.create(endsInB()).dfaId();
    final CreateRequest flipped = endsInB();
    final String endsInA = bounded
      .create(new CreateRequest(
        flipped.states(),
        flipped.alphabet(),
        flipped.transitions(),
        flipped.startState(),
        List.of("q0")
      ))
      .dfaId();

    assertEquals(List.of(true), bounded.check(endsInB, List.of("ab")).accepted());
    assertEquals(List.of(true), bounded.check(endsInA, List.of("ba")).accepted());
    assertEquals(1, bounded.compiledCount());

    // Evicted acceptors are compiled again on demand
    assertEquals(List.of(false), bounded.check(endsInB, List.of("ba")).accepted());
    assertEquals(1, bounded.compiledCount());

    assertThrows(
      IllegalArgumentException.class,
      () -> new AutomatonService(new AutomatonStore(dir, new AutomatonCodec()), null, 0)
    );
  }

  @Test
  void diagram() {
    final String id = service.create(endsInB()).dfaId();
    final DiagramResponse response = service.diagram(id);
    assertTrue(response.success());
    assertTrue(response.dot().startsWith("digraph \"dfa\" {"));
    assertTrue(response.dot().contains("\"q1\" [shape = doublecircle, label = <q1>];"));
  }

  @Test
  void validateUrl() {
    final UrlReport valid = service.validateUrl("https://example.com/path?q=1#frag");
    assertTrue(valid.valid());
    assertNull(valid.rejectionReason());
    assertEquals(new UrlComponents("https", "example.com", "/path", "?q=1", "#frag"), valid.components());
    assertEquals(List.of("https://"), valid.securityIssues().get(SecurityIssue.PROTOCOL_VIOLATION));

    final UrlReport invalid = service.validateUrl(null);
    assertFalse(invalid.valid());
    assertEquals("URL cannot be empty", invalid.rejectionReason());
    assertNull(invalid.components());
  }

  @Test
  void responsesSerializeToJson() throws Exception {
    final String failure = mapper.writeValueAsString(CreateResponse.failed("Error creating DFA: nope"));
    assertTrue(failure.contains("\"success\":false"));
    assertTrue(failure.contains("\"message\":\"Error creating DFA: nope\""));
    assertFalse(failure.contains("dfa_id"));

    final String report = mapper.writeValueAsString(service.validateUrl("ftp://x.com"));
    assertTrue(report.contains("\"valid\":false"));
    assertTrue(report.contains("\"state_sequence\":[\"start\",\"rejected\"]"));
    assertTrue(report.contains("\"rejection_reason\":"));
    assertFalse(report.contains("\"components\""));
  }

  @Test
  void requestDeserializesFromJson() throws Exception {
    final String json = "{\"states\": [\"q0\", \"q1\"], \"alphabet\": [\"a\", \"b\"],"
      + " \"transitions\": [{\"state\": \"q0\", \"symbol\": \"b\", \"next_state\": \"q1\"}],"
      + " \"start_state\": \"q0\", \"accept_states\": [\"q1\"]}";
    final CreateRequest request = mapper.readValue(json, CreateRequest.class);
    assertEquals(List.of("q0", "q1"), request.states());
    assertEquals(new CreateRequest.TransitionRow("q0", "b", "q1"), request.transitions().get(0));

    final CreateResponse created = service.create(request);
    assertTrue(created.success());
    assertTrue(service.test(created.dfaId(), "b").accepted());
    assertFalse(service.test(created.dfaId(), "a").accepted());
  }
}

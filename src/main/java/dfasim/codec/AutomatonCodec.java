package dfasim.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dfasim.Automaton;
import dfasim.InvalidAutomatonException;
import dfasim.TransitionKey;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts automata to and from their JSON documents.
 *
 * <p>Encoding is canonical: states, symbols and transitions are always written
 * in sorted order, so equal automata produce byte-identical JSON.
 */
public final class AutomatonCodec {

  private static final Logger log = LoggerFactory.getLogger(AutomatonCodec.class);

  /**
   * Separator between state and symbol in legacy transition keys.
   */
  static final char LEGACY_SEPARATOR = ',';

  private final ObjectMapper mapper;

  public AutomatonCodec() {
    this(new ObjectMapper());
  }

  public AutomatonCodec(ObjectMapper mapper) {
    // Fixed line endings keep the canonical JSON identical across platforms
    final var indenter = new DefaultIndenter("  ", "\n");
    this.mapper = mapper
      .copy()
      .enable(SerializationFeature.INDENT_OUTPUT)
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .setDefaultPrettyPrinter(
        new DefaultPrettyPrinter()
          .withObjectIndenter(indenter)
          .withArrayIndenter(indenter)
      );
  }

  /**
   * Describe an automaton as a document.
   *
   * @param automaton automaton to encode
   * @return document using transition triples
   */
  public AutomatonDocument encode(Automaton automaton) {
    final List<AutomatonDocument.Transition> transitions = automaton
      .transitions()
      .entrySet()
      .stream()
      .map(entry -> new AutomatonDocument.Transition(
        entry.getKey().state(),
        String.valueOf(entry.getKey().symbol()),
        entry.getValue()
      ))
      .collect(Collectors.toList());

    return new AutomatonDocument(
      new ArrayList<>(automaton.states()),
      symbolsToStrings(automaton),
      transitions,
      null,
      automaton.start(),
      new ArrayList<>(automaton.accept()),
      automaton.sink().orElse(null)
    );
  }

  /**
   * Describe an automaton using {@code "<state>,<symbol>"} transition keys.
   *
   * @param automaton automaton to encode
   * @return document using the legacy transition map
   * @throws UnencodableKeyException if a state or symbol contains the separator
   */
  public AutomatonDocument encodeLegacy(Automaton automaton) {
    if (automaton.alphabet().contains(LEGACY_SEPARATOR)) {
      throw new UnencodableKeyException(
        "Symbol '" + LEGACY_SEPARATOR + "' cannot appear in a \"<state>,<symbol>\" key"
      );
    }
    for (String state : automaton.states()) {
      if (state.indexOf(LEGACY_SEPARATOR) >= 0) {
        throw new UnencodableKeyException(
          "State '" + state + "' cannot appear in a \"<state>,<symbol>\" key"
        );
      }
    }

    final Map<String, String> legacy = new LinkedHashMap<>();
    for (Map.Entry<TransitionKey, String> entry : automaton.transitions().entrySet()) {
      legacy.put(entry.getKey().state() + LEGACY_SEPARATOR + entry.getKey().symbol(), entry.getValue());
    }

    return new AutomatonDocument(
      new ArrayList<>(automaton.states()),
      symbolsToStrings(automaton),
      null,
      legacy,
      automaton.start(),
      new ArrayList<>(automaton.accept()),
      automaton.sink().orElse(null)
    );
  }

  /**
   * Rebuild an automaton from a document.
   *
   * @param document decoded JSON document
   * @return validated automaton
   * @throws MalformedDocumentException if fields are missing or have the wrong shape
   * @throws InvalidAutomatonException if the document describes an inconsistent automaton
   */
  public Automaton decode(AutomatonDocument document) throws MalformedDocumentException {
    final List<String> states = required(document.states(), "states");
    final List<String> alphabet = required(document.alphabet(), "alphabet");
    final String start = required(document.startState(), "start_state");
    final List<String> accept = required(document.acceptStates(), "accept_states");

    final var builder = Automaton
      .builder()
      .states(states)
      .start(start)
      .accept(accept)
      .sink(document.sinkState());

    for (String symbol : alphabet) {
      builder.symbol(singleSymbol(symbol));
    }

    if (document.transitions() != null && document.legacyTransitions() != null) {
      throw new MalformedDocumentException("Document has both 'transitions' and 'transition_function'");
    } else if (document.transitions() != null) {
      for (AutomatonDocument.Transition transition : document.transitions()) {
        if (transition == null) {
          throw new MalformedDocumentException("Null entry in 'transitions'");
        }
        builder.transition(
          required(transition.from(), "transitions.from"),
          singleSymbol(required(transition.on(), "transitions.on")),
          required(transition.to(), "transitions.to")
        );
      }
    } else if (document.legacyTransitions() != null) {
      for (Map.Entry<String, String> entry : document.legacyTransitions().entrySet()) {
        final String[] parts = entry.getKey().split(String.valueOf(LEGACY_SEPARATOR), -1);
        if (parts.length != 2) {
          throw new MalformedDocumentException("Transition key '" + entry.getKey() + "' is not \"<state>,<symbol>\"");
        }
        builder.transition(
          parts[0],
          singleSymbol(parts[1]),
          required(entry.getValue(), "transition_function value")
        );
      }
    } else {
      throw new MalformedDocumentException("Missing field 'transitions'");
    }

    return builder.build();
  }

  /**
   * Serialize an automaton to canonical JSON.
   *
   * @param automaton automaton to serialize
   * @return pretty-printed JSON
   */
  public String toJson(Automaton automaton) {
    try {
      return mapper.writeValueAsString(encode(automaton));
    } catch (JsonProcessingException error) {
      throw new IllegalStateException("Failed to serialize " + automaton, error);
    }
  }

  /**
   * Parse an automaton from JSON.
   *
   * @param json JSON text (either transition format)
   * @return validated automaton
   */
  public Automaton fromJson(String json) throws MalformedDocumentException {
    final AutomatonDocument document;
    try {
      document = mapper.readValue(json, AutomatonDocument.class);
    } catch (JsonProcessingException error) {
      throw new MalformedDocumentException("Not a valid automaton document: " + error.getOriginalMessage(), error);
    }
    if (document == null) {
      throw new MalformedDocumentException("Empty automaton document");
    }
    return decode(document);
  }

  /**
   * Save an automaton to a file, replacing whatever was there.
   *
   * @param automaton automaton to save
   * @param file destination file
   */
  public void write(Automaton automaton, Path file) throws IOException {
    writeDocument(encode(automaton), file);
  }

  private void writeDocument(AutomatonDocument document, Path file) throws IOException {
    try (OutputStream out = Files.newOutputStream(file)) {
      mapper.writeValue(out, document);
    }
    log.debug("Wrote automaton to {}", file);
  }

  /**
   * Load an automaton from a file.
   *
   * @param file file written by {@link #write} (or by older tools)
   * @return validated automaton
   * @throws AutomatonNotFoundException if the file does not exist
   * @throws MalformedDocumentException if the file is not an automaton document
   */
  public Automaton read(Path file) throws IOException {
    final AutomatonDocument document;
    try (InputStream in = Files.newInputStream(file)) {
      document = mapper.readValue(in, AutomatonDocument.class);
    } catch (NoSuchFileException error) {
      throw new AutomatonNotFoundException(file.toString(), error);
    } catch (JsonProcessingException error) {
      throw new MalformedDocumentException("File " + file + " is not a valid JSON file.", error);
    }
    if (document == null) {
      throw new MalformedDocumentException("File " + file + " is empty.");
    }
    log.debug("Read automaton document from {}", file);
    return decode(document);
  }

  private static List<String> symbolsToStrings(Automaton automaton) {
    return automaton
      .alphabet()
      .stream()
      .map(String::valueOf)
      .collect(Collectors.toList());
  }

  private static char singleSymbol(String symbol) throws MalformedDocumentException {
    if (symbol == null || symbol.length() != 1) {
      throw new MalformedDocumentException("Symbol '" + symbol + "' is not a single character");
    }
    return symbol.charAt(0);
  }

  private static <T> T required(T value, String field) throws MalformedDocumentException {
    if (value == null) {
      throw new MalformedDocumentException("Missing field '" + field + "'");
    }
    if (value instanceof List<?> list && list.stream().anyMatch(Objects::isNull)) {
      throw new MalformedDocumentException("Null entry in '" + field + "'");
    }
    return value;
  }
}

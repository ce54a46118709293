package dfasim.service;

import dfasim.Automaton;
import dfasim.InvalidAutomatonException;
import dfasim.RunResult;
import dfasim.Simulator;
import dfasim.UnknownSymbolException;
import dfasim.codegen.CompiledAutomaton;
import dfasim.validate.UrlValidator;
import dfasim.validate.ValidationResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers which want answers rather than exceptions.
 *
 * <p>Every operation returns a response record which serializes cleanly to
 * JSON. Failures (bad automata, missing identifiers, corrupt files) come back
 * as {@code success = false} with a message.
 */
public final class AutomatonService {

  private static final Logger log = LoggerFactory.getLogger(AutomatonService.class);

  /** Compiled acceptors kept around by default */
  public static final int DEFAULT_COMPILED_CACHE_SIZE = 64;

  private final AutomatonStore store;
  private final UrlValidator urlValidator;

  /** Least recently used compiled acceptors, guarded by itself */
  private final Map<String, CompiledAutomaton> compiled;

  public AutomatonService(AutomatonStore store, UrlValidator urlValidator) {
    this(store, urlValidator, DEFAULT_COMPILED_CACHE_SIZE);
  }

  /**
   * @param store where automata are kept
   * @param urlValidator strategy behind {@link #validateUrl}
   * @param compiledCacheSize how many compiled acceptors to keep loaded
   */
  public AutomatonService(AutomatonStore store, UrlValidator urlValidator, int compiledCacheSize) {
    if (compiledCacheSize < 1) {
      throw new IllegalArgumentException("Cache size must be positive: " + compiledCacheSize);
    }
    this.store = store;
    this.urlValidator = urlValidator;
    this.compiled = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, CompiledAutomaton> eldest) {
        return size() > compiledCacheSize;
      }
    };
  }

  /**
   * Build an automaton and store it.
   *
   * @param request parts of the automaton
   * @return identifier of the stored automaton, or why it could not be built
   */
  public CreateResponse create(CreateRequest request) {
    try {
      final String id = store.save(toAutomaton(request));
      return CreateResponse.created(id);
    } catch (InvalidAutomatonException error) {
      log.debug("Rejected automaton: {}", error.getMessage());
      return CreateResponse.failed("Error creating DFA: " + error.getMessage());
    } catch (IOException error) {
      log.error("Could not store automaton", error);
      return CreateResponse.failed("Error creating DFA: " + error.getMessage());
    }
  }

  /**
   * Run a stored automaton on one input.
   *
   * @param dfaId identifier from {@link #create}
   * @param input input string
   * @return verdict and states visited, or why the automaton could not be run
   */
  public TestResponse test(String dfaId, String input) {
    final Automaton automaton;
    try {
      automaton = store.load(dfaId);
    } catch (IOException | InvalidAutomatonException error) {
      return TestResponse.failed("Error testing DFA: " + error.getMessage());
    }

    try {
      final RunResult<String> result = Simulator.run(automaton, input == null ? "" : input);
      return TestResponse.ran(result.accepted(), result.trace(), null);
    } catch (UnknownSymbolException error) {
      final List<String> trace = error
        .trace()
        .stream()
        .map(Object::toString)
        .collect(Collectors.toList());
      return TestResponse.ran(false, trace, error.getMessage() + " (at position " + error.position + ")");
    }
  }

  /**
   * Check many inputs against a stored automaton using its compiled form.
   *
   * <p>Inputs containing symbols outside of the alphabet are reported as not
   * accepted. A {@code null} input is checked as the empty string.
   *
   * @param dfaId identifier from {@link #create}
   * @param inputs input strings ({@code null} is treated as no inputs)
   * @return acceptance of each input, or why the automaton could not be run
   */
  public CheckResponse check(String dfaId, List<String> inputs) {
    final CompiledAutomaton acceptor;
    try {
      acceptor = compiled(dfaId);
    } catch (IOException | InvalidAutomatonException error) {
      return new CheckResponse(false, "Error testing DFA: " + error.getMessage(), null);
    }

    final List<String> checked = inputs == null ? List.of() : inputs;
    final var accepted = new ArrayList<Boolean>(checked.size());
    for (String input : checked) {
      boolean result;
      try {
        result = acceptor.accepts(input == null ? "" : input);
      } catch (UnknownSymbolException error) {
        result = false;
      }
      accepted.add(result);
    }
    return new CheckResponse(true, null, accepted);
  }

  /**
   * Validate a URL and scan it for suspicious content.
   *
   * @param url URL to check ({@code null} is treated as empty)
   * @return full report
   */
  public UrlReport validateUrl(String url) {
    final String checked = url == null ? "" : url;
    final ValidationResult result = urlValidator.validate(checked);
    return new UrlReport(
      result.valid(),
      result.stateSequence(),
      urlValidator.scanner().scan(checked, result.components()),
      result.rejectionReason(),
      result.components()
    );
  }

  /**
   * Render a stored automaton as a Graphviz diagram.
   *
   * @param dfaId identifier from {@link #create}
   * @return Dot source, or why the automaton could not be loaded
   */
  public DiagramResponse diagram(String dfaId) {
    try {
      final Automaton automaton = store.load(dfaId);
      return new DiagramResponse(true, null, automaton.dotGraph("dfa"));
    } catch (IOException | InvalidAutomatonException error) {
      return new DiagramResponse(false, "Error rendering DFA: " + error.getMessage(), null);
    }
  }

  private CompiledAutomaton compiled(String dfaId) throws IOException {
    synchronized (compiled) {
      final CompiledAutomaton cached = compiled.get(dfaId);
      if (cached != null) {
        return cached;
      }
    }
    final CompiledAutomaton fresh = CompiledAutomaton.compile(store.load(dfaId));
    synchronized (compiled) {
      final CompiledAutomaton raced = compiled.putIfAbsent(dfaId, fresh);
      return raced == null ? fresh : raced;
    }
  }

  /** Number of compiled acceptors currently kept loaded */
  int compiledCount() {
    synchronized (compiled) {
      return compiled.size();
    }
  }

  private static Automaton toAutomaton(CreateRequest request) {
    final Automaton.Builder builder = Automaton
      .builder()
      .states(request.states())
      .start(request.startState())
      .accept(request.acceptStates());

    for (String symbol : request.alphabet()) {
      builder.symbol(singleChar(symbol));
    }
    for (CreateRequest.TransitionRow row : request.transitions()) {
      if (row.isComplete()) {
        builder.transition(row.state(), singleChar(row.symbol()), row.nextState());
      }
    }
    return builder.build();
  }

  private static char singleChar(String symbol) {
    if (symbol == null || symbol.length() != 1) {
      throw new InvalidAutomatonException(
        InvalidAutomatonException.Kind.DANGLING_TRANSITION_SYMBOL,
        "Symbol '" + symbol + "' must be exactly one character"
      );
    }
    return symbol.charAt(0);
  }
}

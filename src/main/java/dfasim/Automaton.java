package dfasim;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable deterministic finite automaton over single-character symbols.
 *
 * <p>Instances are only produced by {@link Builder}, which checks that the
 * start state, accept states, sink and every transition refer to declared
 * states and symbols. The transition function need not be total: a missing
 * entry simply stops a run.
 */
public final class Automaton implements Dfa<String, Character>, DotGraph<String, SortedSet<Character>> {

  private static final Logger log = LoggerFactory.getLogger(Automaton.class);

  /**
   * Name given to the implicit trap state unless the builder is told otherwise.
   */
  public static final String DEFAULT_TRAP_STATE = "trap";

  /**
   * What the builder does with a transition whose target is not a declared state.
   */
  public enum UndefinedTargetPolicy {
    /**
     * Fail construction.
     */
    REJECT,

    /**
     * Redirect the transition to a trap state, which is added to the states,
     * loops back to itself on every symbol, and becomes the sink. Input after
     * the trap is entered is not read, not even to check it against the
     * alphabet.
     */
    USE_TRAP_STATE
  }

  private final SortedSet<String> states;
  private final SortedSet<Character> alphabet;
  private final SortedMap<TransitionKey, String> transitions;
  private final String start;
  private final SortedSet<String> accept;
  private final String sink;

  // Transitions regrouped by source state, for fast lookups during runs
  private final Map<String, Map<Character, String>> transitionsByState;

  private Automaton(
    SortedSet<String> states,
    SortedSet<Character> alphabet,
    SortedMap<TransitionKey, String> transitions,
    String start,
    SortedSet<String> accept,
    String sink
  ) {
    this.states = Collections.unmodifiableSortedSet(states);
    this.alphabet = Collections.unmodifiableSortedSet(alphabet);
    this.transitions = Collections.unmodifiableSortedMap(transitions);
    this.start = start;
    this.accept = Collections.unmodifiableSortedSet(accept);
    this.sink = sink;

    final var byState = new HashMap<String, Map<Character, String>>();
    for (String state : states) {
      byState.put(state, new HashMap<>());
    }
    for (Map.Entry<TransitionKey, String> entry : transitions.entrySet()) {
      byState.get(entry.getKey().state()).put(entry.getKey().symbol(), entry.getValue());
    }
    byState.replaceAll((state, map) -> Collections.unmodifiableMap(map));
    this.transitionsByState = Collections.unmodifiableMap(byState);
  }

  public static Builder builder() {
    return new Builder();
  }

  public SortedSet<String> states() {
    return states;
  }

  @Override
  public SortedSet<Character> alphabet() {
    return alphabet;
  }

  /**
   * Full transition function.
   *
   * @return transitions ordered by source state, then symbol
   */
  public SortedMap<TransitionKey, String> transitions() {
    return transitions;
  }

  public String start() {
    return start;
  }

  public SortedSet<String> accept() {
    return accept;
  }

  @Override
  public String initial() {
    return start;
  }

  @Override
  public Set<String> accepting() {
    return accept;
  }

  @Override
  public Optional<String> sink() {
    return Optional.ofNullable(sink);
  }

  @Override
  public Map<Character, String> transitionsMap(String state) {
    return transitionsByState.getOrDefault(state, Collections.emptyMap());
  }

  /**
   * Look up a single transition.
   *
   * @param state source state
   * @param symbol symbol read
   * @return target state, if the transition is defined
   */
  public Optional<String> transition(String state, char symbol) {
    return Optional.ofNullable(transitions.get(new TransitionKey(state, symbol)));
  }

  /**
   * Is every (state, symbol) pair defined?
   *
   * @return whether the transition function is total
   */
  public boolean isTotal() {
    return transitions.size() == states.size() * alphabet.size();
  }

  @Override
  public Stream<DotGraph.Vertex<String>> vertices() {
    return states
      .stream()
      .map(state -> new DotGraph.Vertex<>(state, accept.contains(state), state.equals(sink)));
  }

  @Override
  public Stream<DotGraph.Edge<String, SortedSet<Character>>> edges() {
    record Arc(String from, String to) { }

    // Merge parallel transitions into one edge labelled with all their symbols
    final Map<Arc, SortedSet<Character>> arcs = new LinkedHashMap<>();
    for (Map.Entry<TransitionKey, String> entry : transitions.entrySet()) {
      arcs
        .computeIfAbsent(new Arc(entry.getKey().state(), entry.getValue()), k -> new TreeSet<>())
        .add(entry.getKey().symbol());
    }

    final var transitionEdges = arcs
      .entrySet()
      .stream()
      .map(entry -> new DotGraph.Edge<>(entry.getKey().from(), entry.getKey().to(), entry.getValue()));
    final var initialEdge = Stream
      .of(new DotGraph.Edge<String, SortedSet<Character>>(null, start, null));
    return Stream.concat(initialEdge, transitionEdges);
  }

  /**
   * Render a set of symbols, collapsing runs of consecutive characters into
   * ranges (eg. {@code a-z}).
   */
  @Override
  public String renderEdgeLabel(DotGraph.Edge<String, SortedSet<Character>> edge) {
    final SortedSet<Character> symbols = edge.label();
    if (symbols == null) {
      return "";
    }

    final var parts = new ArrayList<String>();
    final Iterator<Character> iterator = symbols.iterator();
    char rangeStart = iterator.next();
    char rangeEnd = rangeStart;
    while (iterator.hasNext()) {
      final char next = iterator.next();
      if (next == rangeEnd + 1) {
        rangeEnd = next;
      } else {
        parts.add(renderRange(rangeStart, rangeEnd));
        rangeStart = next;
        rangeEnd = next;
      }
    }
    parts.add(renderRange(rangeStart, rangeEnd));
    return String.join(" ", parts);
  }

  private static String renderRange(char from, char to) {
    if (from == to) {
      return String.valueOf(from);
    } else if (from + 1 == to) {
      return "" + from + " " + to;
    } else {
      return from + "-" + to;
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Automaton)) {
      return false;
    } else {
      final var other = (Automaton) obj;
      return states.equals(other.states)
        && alphabet.equals(other.alphabet)
        && transitions.equals(other.transitions)
        && start.equals(other.start)
        && accept.equals(other.accept)
        && Objects.equals(sink, other.sink);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(states, alphabet, transitions, start, accept, sink);
  }

  @Override
  public String toString() {
    return "Automaton(states = " + states
      + ", alphabet = " + alphabet.size() + " symbols"
      + ", transitions = " + transitions.size()
      + ", start = " + start
      + ", accept = " + accept
      + (sink == null ? "" : ", sink = " + sink)
      + ")";
  }

  /**
   * Accumulates the parts of an automaton and validates them on {@link #build()}.
   *
   * <p>Builders are not thread-safe. Each call to {@code build} validates and
   * copies the current contents, so a builder can be reused.
   */
  public static final class Builder {
    private final Set<String> states = new LinkedHashSet<>();
    private final Set<Character> alphabet = new LinkedHashSet<>();
    private final Map<TransitionKey, String> transitions = new LinkedHashMap<>();
    private final Set<String> accept = new LinkedHashSet<>();
    private String start;
    private String sink;
    private UndefinedTargetPolicy undefinedTargetPolicy = UndefinedTargetPolicy.REJECT;
    private String trapState = DEFAULT_TRAP_STATE;

    private Builder() {
    }

    public Builder state(String state) {
      states.add(Objects.requireNonNull(state, "state"));
      return this;
    }

    public Builder states(Collection<String> newStates) {
      newStates.forEach(this::state);
      return this;
    }

    public Builder symbol(char symbol) {
      alphabet.add(symbol);
      return this;
    }

    public Builder alphabet(Collection<Character> symbols) {
      alphabet.addAll(symbols);
      return this;
    }

    /**
     * Add every character of a string to the alphabet.
     *
     * @param symbols characters to add
     */
    public Builder alphabet(CharSequence symbols) {
      symbols.chars().forEach(c -> alphabet.add((char) c));
      return this;
    }

    /**
     * Define (or redefine) one transition.
     *
     * @param from source state
     * @param symbol symbol read
     * @param to target state
     */
    public Builder transition(String from, char symbol, String to) {
      transitions.put(new TransitionKey(from, symbol), Objects.requireNonNull(to, "to"));
      return this;
    }

    public Builder start(String state) {
      this.start = state;
      return this;
    }

    public Builder accepting(String state) {
      accept.add(Objects.requireNonNull(state, "state"));
      return this;
    }

    public Builder accept(Collection<String> states) {
      states.forEach(this::accepting);
      return this;
    }

    /**
     * Mark a state as the sink: a run that enters it stops and rejects.
     *
     * @param state sink state (or {@code null} for none)
     */
    public Builder sink(String state) {
      this.sink = state;
      return this;
    }

    public Builder onUndefinedTarget(UndefinedTargetPolicy policy) {
      this.undefinedTargetPolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    /**
     * Name of the state used by {@link UndefinedTargetPolicy#USE_TRAP_STATE}.
     *
     * @param state name of the trap state
     */
    public Builder trapState(String state) {
      this.trapState = Objects.requireNonNull(state, "state");
      return this;
    }

    /**
     * Validate and freeze the automaton.
     *
     * @return immutable automaton
     * @throws InvalidAutomatonException if the parts are inconsistent
     */
    public Automaton build() {
      final var finalStates = new TreeSet<String>(states);
      final var finalTransitions = new TreeMap<TransitionKey, String>();
      String finalSink = sink;

      // Redirect undefined targets before anything is validated
      boolean trapUsed = false;
      for (Map.Entry<TransitionKey, String> entry : transitions.entrySet()) {
        String target = entry.getValue();
        if (!states.contains(target) && undefinedTargetPolicy == UndefinedTargetPolicy.USE_TRAP_STATE) {
          log.warn("{} targets undeclared state '{}', using trap state '{}'", entry.getKey(), target, trapState);
          target = trapState;
          trapUsed = true;
        }
        finalTransitions.put(entry.getKey(), target);
      }
      if (trapUsed && finalStates.add(trapState)) {
        for (Character symbol : alphabet) {
          finalTransitions.putIfAbsent(new TransitionKey(trapState, symbol), trapState);
        }
        if (finalSink == null) {
          finalSink = trapState;
        }
      }

      if (start == null || !finalStates.contains(start)) {
        throw new InvalidAutomatonException(
          InvalidAutomatonException.Kind.START_NOT_IN_STATES,
          "Start state '" + start + "' is not one of the states " + finalStates
        );
      }

      for (String state : accept) {
        if (!finalStates.contains(state)) {
          throw new InvalidAutomatonException(
            InvalidAutomatonException.Kind.ACCEPT_NOT_SUBSET_OF_STATES,
            "Accept state '" + state + "' is not one of the states " + finalStates
          );
        }
      }

      for (Map.Entry<TransitionKey, String> entry : finalTransitions.entrySet()) {
        final TransitionKey key = entry.getKey();
        if (!finalStates.contains(key.state())) {
          throw new InvalidAutomatonException(
            InvalidAutomatonException.Kind.DANGLING_TRANSITION_STATE,
            "Transition " + key + " starts from undeclared state '" + key.state() + "'"
          );
        }
        if (!finalStates.contains(entry.getValue())) {
          throw new InvalidAutomatonException(
            InvalidAutomatonException.Kind.DANGLING_TRANSITION_STATE,
            "Transition " + key + " targets undeclared state '" + entry.getValue() + "'"
          );
        }
        if (!alphabet.contains(key.symbol())) {
          throw new InvalidAutomatonException(
            InvalidAutomatonException.Kind.DANGLING_TRANSITION_SYMBOL,
            "Transition " + key + " reads symbol '" + key.symbol() + "' which is not in the alphabet"
          );
        }
      }

      if (finalSink != null) {
        if (!finalStates.contains(finalSink)) {
          throw new InvalidAutomatonException(
            InvalidAutomatonException.Kind.SINK_NOT_IN_STATES,
            "Sink state '" + finalSink + "' is not one of the states " + finalStates
          );
        }
        if (accept.contains(finalSink)) {
          throw new InvalidAutomatonException(
            InvalidAutomatonException.Kind.SINK_IS_ACCEPTING,
            "Sink state '" + finalSink + "' cannot be accepting"
          );
        }
      }

      final var automaton = new Automaton(
        finalStates,
        new TreeSet<>(alphabet),
        finalTransitions,
        start,
        new TreeSet<>(accept),
        finalSink
      );

      if (log.isDebugEnabled()) {
        final var unreachable = new TreeSet<>(finalStates);
        unreachable.removeAll(automaton.reachableStates());
        log.debug("Built {} (unreachable states: {})", automaton, unreachable);
      }
      return automaton;
    }
  }
}

package dfasim.shell;

import dfasim.Automaton;
import dfasim.InvalidAutomatonException;
import dfasim.RunResult;
import dfasim.Simulator;
import dfasim.UnknownSymbolException;
import dfasim.codec.AutomatonCodec;
import dfasim.codec.AutomatonNotFoundException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Menu driven shell for building, testing, saving and loading automata.
 *
 * <p>Reaching the end of the input behaves like choosing to exit.
 */
public final class DfaShell {

  private static final Logger log = LoggerFactory.getLogger(DfaShell.class);

  private final BufferedReader in;
  private final PrintStream out;
  private final ShellSettings settings;
  private final AutomatonCodec codec;

  public DfaShell(BufferedReader in, PrintStream out, ShellSettings settings, AutomatonCodec codec) {
    this.in = in;
    this.out = out;
    this.settings = settings;
    this.codec = codec;
  }

  public static void main(String[] args) throws IOException {
    final var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    new DfaShell(in, System.out, ShellSettings.load(), new AutomatonCodec()).run();
  }

  /**
   * Show the menu until the user exits.
   */
  public void run() throws IOException {
    out.println("DFA Simulator");
    out.println("=============");

    while (true) {
      out.println();
      out.println("Options:");
      out.println("1. Create a new DFA");
      out.println("2. Load a DFA from file");
      out.println("3. Exit");

      final String choice = prompt("\nEnter your choice (1-3): ");
      if (choice == null) {
        return;
      }
      switch (choice.trim()) {
        case "1":
          if (!createAndTest()) {
            return;
          }
          break;
        case "2":
          if (!loadAndTest()) {
            return;
          }
          break;
        case "3":
          return;
        default:
          out.println("Invalid choice. Please try again.");
          break;
      }
    }
  }

  /**
   * Prompt for an automaton, test it, then offer to save it.
   *
   * @return whether input remains
   */
  private boolean createAndTest() throws IOException {
    out.println("=== DFA Creator ===");

    final String statesLine = prompt("Enter states (comma-separated): ");
    if (statesLine == null) {
      return false;
    }
    final Set<String> states = splitList(statesLine);

    final String alphabetLine = prompt("Enter alphabet symbols (comma-separated): ");
    if (alphabetLine == null) {
      return false;
    }
    final Set<String> symbols = splitList(alphabetLine);
    for (String symbol : symbols) {
      if (symbol.length() != 1) {
        out.println("Error: alphabet symbols must be single characters, got '" + symbol + "'.");
        return true;
      }
    }

    final Automaton.Builder builder = Automaton
      .builder()
      .states(states)
      .alphabet(String.join("", symbols))
      .onUndefinedTarget(Automaton.UndefinedTargetPolicy.USE_TRAP_STATE)
      .trapState(settings.trapState());

    out.println();
    out.println("Define transition function:");
    for (String state : new TreeSet<>(states)) {
      for (String symbol : new TreeSet<>(symbols)) {
        final String target = prompt("δ(" + state + ", " + symbol + ") = ");
        if (target == null) {
          return false;
        }
        final String nextState = target.trim();
        if (!states.contains(nextState)) {
          out.println("Error: " + nextState + " is not a valid state. Using a trap state.");
        }
        builder.transition(state, symbol.charAt(0), nextState);
      }
    }

    String start;
    while (true) {
      start = prompt("\nEnter start state: ");
      if (start == null) {
        return false;
      }
      start = start.trim();
      if (states.contains(start)) {
        break;
      }
      out.println("Error: Start state must be in the set of states.");
    }
    builder.start(start);

    final String acceptLine = prompt("\nEnter accept states (comma-separated): ");
    if (acceptLine == null) {
      return false;
    }
    final Set<String> accept = splitList(acceptLine);
    if (!states.containsAll(accept)) {
      out.println("Warning: Some accept states are not in the set of states.");
      log.warn("Dropping unknown accept states {}", accept.stream().filter(s -> !states.contains(s)).collect(Collectors.toList()));
      accept.retainAll(states);
    }
    builder.accept(accept);

    final Automaton automaton;
    try {
      automaton = builder.build();
    } catch (InvalidAutomatonException error) {
      out.println("Error: " + error.getMessage());
      return true;
    }

    if (!testLoop(automaton)) {
      return false;
    }

    final String save = prompt("\nSave this DFA? (y/n): ");
    if (save == null) {
      return false;
    }
    if (save.trim().equalsIgnoreCase("y")) {
      final String filename = prompt("Enter filename: ");
      if (filename == null) {
        return false;
      }
      try {
        codec.write(automaton, resolve(filename));
        out.println("DFA saved to " + filename.trim());
      } catch (IOException error) {
        out.println("Error: could not save " + filename.trim() + ": " + error.getMessage());
      }
    }
    return true;
  }

  /**
   * Load an automaton from a file and test it.
   *
   * @return whether input remains
   */
  private boolean loadAndTest() throws IOException {
    final String line = prompt("Enter filename to load: ");
    if (line == null) {
      return false;
    }
    final String filename = line.trim();

    final Automaton automaton;
    try {
      automaton = codec.read(resolve(filename));
    } catch (AutomatonNotFoundException error) {
      out.println("Error: File " + filename + " not found.");
      return true;
    } catch (IOException | InvalidAutomatonException error) {
      out.println("Error: " + error.getMessage());
      return true;
    }
    out.println("DFA loaded from " + filename);
    return testLoop(automaton);
  }

  /**
   * Run strings through an automaton until the user enters {@code q}.
   *
   * @return whether input remains
   */
  private boolean testLoop(Automaton automaton) throws IOException {
    while (true) {
      final String input = prompt("\nEnter a string to test (or 'q' to quit): ");
      if (input == null) {
        return false;
      }
      if (input.toLowerCase(Locale.ROOT).equals("q")) {
        return true;
      }

      try {
        final RunResult<String> result = Simulator.run(automaton, input);
        out.println("String " + (result.accepted() ? "accepted" : "rejected"));
        out.println("State sequence: " + String.join(" -> ", result.trace()));
      } catch (UnknownSymbolException error) {
        out.println("Error: " + error.getMessage());
      }
    }
  }

  private Path resolve(String filename) {
    return settings.storeDirectory().resolve(filename.trim());
  }

  private String prompt(String message) throws IOException {
    out.print(message);
    out.flush();
    return in.readLine();
  }

  private static Set<String> splitList(String line) {
    return Arrays
      .stream(line.split(","))
      .map(String::trim)
      .filter(s -> !s.isEmpty())
      .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}

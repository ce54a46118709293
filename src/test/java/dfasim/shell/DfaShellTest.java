package dfasim.shell;

import static org.junit.jupiter.api.Assertions.*;

import dfasim.codec.AutomatonCodec;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class DfaShellTest {

  @TempDir
  Path dir;

  private String runShell(String... lines) throws Exception {
    final var in = new BufferedReader(new StringReader(String.join("\n", lines) + "\n"));
    final var bytes = new ByteArrayOutputStream();
    final var out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    final var settings = new ShellSettings(dir, "trap", 255, 1024);
    new DfaShell(in, out, settings, new AutomatonCodec()).run();
    return bytes.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
  }

  @Test
  void createTestSaveAndLoad() throws Exception {
    final String output = runShell(
      "1",
      "q0,q1",
      "0,1",
      "q0", "q1", "q0", "q1",
      "x",
      "q0",
      "q1,zz",
      "01",
      "10",
      "012",
      "q",
      "y",
      "ends1.json",
      "2",
      "ends1.json",
      "1",
      "Q",
      "3"
    );

    assertTrue(output.contains("δ(q0, 0) = "));
    assertTrue(output.contains("Error: Start state must be in the set of states."));
    assertTrue(output.contains("Warning: Some accept states are not in the set of states."));
    assertTrue(output.contains("String accepted\nState sequence: q0 -> q0 -> q1\n"));
    assertTrue(output.contains("String rejected\nState sequence: q0 -> q1 -> q0\n"));
    assertTrue(output.contains("Error: Symbol '2' not in alphabet"));
    assertTrue(output.contains("DFA saved to ends1.json"));
    assertTrue(output.contains("DFA loaded from ends1.json"));
    assertTrue(output.contains("State sequence: q0 -> q1\n"));
    assertTrue(Files.exists(dir.resolve("ends1.json")));
  }

  @Test
  void undefinedTargetGoesToTrap() throws Exception {
    final String output = runShell(
      "1",
      "a,b",
      "x",
      "b",
      "nowhere",
      "a",
      "b",
      "x",
      "xx",
      "xxx",
      "q",
      "n"
    );

    assertTrue(output.contains("Error: nowhere is not a valid state. Using a trap state."));
    assertTrue(output.contains("String accepted\nState sequence: a -> b\n"));
    assertTrue(output.contains("String rejected\nState sequence: a -> b -> trap\n"));
    assertFalse(output.contains("a -> b -> trap -> trap"));
  }

  @Test
  void loadErrorsAreReported() throws Exception {
    Files.writeString(dir.resolve("bad.json"), "{oops", StandardCharsets.UTF_8);
    final String output = runShell(
      "2",
      "missing.json",
      "2",
      "bad.json",
      "3"
    );

    assertTrue(output.contains("Error: File missing.json not found."));
    assertTrue(output.contains("is not a valid JSON file."));
  }

  @Test
  void rejectsMultiCharacterSymbols() throws Exception {
    final String output = runShell("1", "q0", "ab", "3");
    assertTrue(output.contains("Error: alphabet symbols must be single characters, got 'ab'."));
  }

  @Test
  void invalidChoiceAndEndOfInput() throws Exception {
    final String output = runShell("9");
    assertTrue(output.startsWith("DFA Simulator"));
    assertTrue(output.contains("Invalid choice. Please try again."));
  }
}

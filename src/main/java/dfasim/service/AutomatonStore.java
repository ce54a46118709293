package dfasim.service;

import dfasim.Automaton;
import dfasim.codec.AutomatonCodec;
import dfasim.codec.AutomatonNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory of saved automata, addressed by content.
 *
 * <p>The identifier of an automaton is the SHA-256 digest of its canonical
 * JSON, so saving equal automata (from any thread or process) always lands on
 * the same file with the same bytes.
 */
public final class AutomatonStore {

  private static final Logger log = LoggerFactory.getLogger(AutomatonStore.class);

  private static final Pattern ID_PATTERN = Pattern.compile("[0-9a-f]{64}");

  private final Path directory;
  private final AutomatonCodec codec;

  public AutomatonStore(Path directory, AutomatonCodec codec) {
    this.directory = directory;
    this.codec = codec;
  }

  /**
   * Compute the identifier of an automaton without saving it.
   *
   * @param automaton automaton to identify
   * @return lowercase hex SHA-256 of the canonical JSON
   */
  public String idOf(Automaton automaton) {
    return digest(codec.toJson(automaton));
  }

  /**
   * Save an automaton.
   *
   * @param automaton automaton to save
   * @return identifier under which it can be loaded
   */
  public String save(Automaton automaton) throws IOException {
    final String json = codec.toJson(automaton);
    final String id = digest(json);
    final Path file = fileFor(id);

    if (!Files.exists(file)) {
      Files.createDirectories(directory);
      final Path temp = Files.createTempFile(directory, id, ".tmp");
      try {
        Files.writeString(temp, json, StandardCharsets.UTF_8);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      } finally {
        Files.deleteIfExists(temp);
      }
      log.info("Saved automaton {} to {}", id, file);
    }
    return id;
  }

  /**
   * Load a saved automaton.
   *
   * @param id identifier returned by {@link #save}
   * @return automaton
   * @throws AutomatonNotFoundException if nothing was saved under the identifier
   */
  public Automaton load(String id) throws IOException {
    if (id == null || !ID_PATTERN.matcher(id).matches()) {
      throw new AutomatonNotFoundException(String.valueOf(id));
    }
    return codec.read(fileFor(id));
  }

  private Path fileFor(String id) {
    return directory.resolve(id + ".json");
  }

  private static String digest(String json) {
    try {
      final MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(sha256.digest(json.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException error) {
      throw new IllegalStateException("SHA-256 is not available", error);
    }
  }
}

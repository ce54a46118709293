package dfasim.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;

final class ShellSettingsTest {

  @Test
  void emptyPropertiesGiveDefaults() {
    assertEquals(ShellSettings.defaults(), ShellSettings.from(new Properties()));
  }

  @Test
  void readsEveryKey() {
    final var properties = new Properties();
    properties.setProperty("dfasim.store.dir", "/tmp/automata");
    properties.setProperty("dfasim.trap.state", "dead");
    properties.setProperty("dfasim.url.max-path-length", "10");
    properties.setProperty("dfasim.url.max-query-length", " 20 ");

    final ShellSettings settings = ShellSettings.from(properties);
    assertEquals(Path.of("/tmp/automata"), settings.storeDirectory());
    assertEquals("dead", settings.trapState());
    assertEquals(10, settings.maxPathLength());
    assertEquals(20, settings.maxQueryLength());
  }

  @Test
  void badLengthsAreRejected() {
    final var notNumber = new Properties();
    notNumber.setProperty("dfasim.url.max-path-length", "long");
    assertThrows(IllegalArgumentException.class, () -> ShellSettings.from(notNumber));

    final var negative = new Properties();
    negative.setProperty("dfasim.url.max-query-length", "-1");
    assertThrows(IllegalArgumentException.class, () -> ShellSettings.from(negative));
  }

  @Test
  void loadsClasspathDefaults() {
    final ShellSettings settings = ShellSettings.load();
    assertEquals(255, settings.maxPathLength());
    assertEquals(1024, settings.maxQueryLength());
  }
}

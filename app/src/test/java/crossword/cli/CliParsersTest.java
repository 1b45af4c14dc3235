package crossword.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import crossword.examples.WordLists;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class CliParsersTest {

  @TempDir Path tempDir;

  @Test
  void splitsTrimsAndDeduplicatesWords() {
    assertEquals(List.of("CAT", "TAR"), CliParsers.parseWords(" CAT, TAR,,CAT "));
    assertEquals(List.of(), CliParsers.parseWords("  "));
  }

  @Test
  void loadsWordFileSkippingBlanksAndComments() throws IOException {
    Path file = tempDir.resolve("words.txt");
    Files.writeString(file, "# planets\nMARS\n\n  VENUS  \nMARS\nEARTH\n");

    assertEquals(List.of("MARS", "VENUS", "EARTH"), CliParsers.loadWordsFromFile(file.toString()));
  }

  @Test
  void missingWordFileIsAnArgumentError() {
    String missing = tempDir.resolve("nope.txt").toString();
    assertThrows(IllegalArgumentException.class, () -> CliParsers.loadWordsFromFile(missing));
  }

  @Test
  void resolvesExamplesCaseInsensitively() {
    assertEquals(WordLists.planets(), CliParsers.loadExampleByName(" Planets "));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.loadExampleByName("birds"));
  }

  @Test
  void parsesNumbers() {
    assertEquals(12, CliParsers.parseInt(" 12 ", "--width"));
    assertEquals(-3L, CliParsers.parseLong("-3", "--seed"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseInt("x", "--width"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseLong("", "--seed"));
  }
}

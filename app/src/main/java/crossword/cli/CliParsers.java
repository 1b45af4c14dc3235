package crossword.cli;

import com.google.common.base.Splitter;
import crossword.examples.WordLists;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Shared helpers for CLI argument parsing and word list loading. */
final class CliParsers {
  private static final Splitter WORD_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  static int parseInt(String raw, String optionName) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing value for " + optionName);
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, String optionName) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing value for " + optionName);
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static List<String> parseWords(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    return distinct(WORD_SPLITTER.splitToList(raw));
  }

  static List<String> loadExampleByName(String exampleName) {
    return WordLists.byName(exampleName)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown example: " + exampleName + " (known: " + WordLists.names() + ")"));
  }

  /** Reads one word per line; blank lines and lines starting with '#' are skipped. */
  static List<String> loadWordsFromFile(String wordFile) throws IOException {
    Path path = Path.of(wordFile);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Word file not found: " + path);
    }
    List<String> words = new ArrayList<>();
    for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      words.add(trimmed);
    }
    return distinct(words);
  }

  private static List<String> distinct(List<String> words) {
    Set<String> unique = new LinkedHashSet<>(words);
    return List.copyOf(unique);
  }
}

package crossword.examples;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Built-in word lists for trying the generator without an input file. */
public final class WordLists {

  private static final Map<String, List<String>> LISTS = buildLists();

  private WordLists() {}

  public static List<String> tiny() {
    return List.of("CAT", "TAR", "ART");
  }

  public static List<String> animals() {
    return List.of(
        "ELEPHANT", "GIRAFFE", "ZEBRA", "TIGER", "OTTER", "BEAVER", "RABBIT", "EAGLE", "PARROT",
        "BADGER", "HERON", "LLAMA", "RAVEN", "WALRUS", "TORTOISE");
  }

  public static List<String> programming() {
    return List.of(
        "COMPILER", "THREAD", "MONITOR", "LAMBDA", "STREAM", "RECORD", "INTERFACE", "GENERIC",
        "ITERATOR", "BUFFER", "SOCKET", "PARSER", "SCHEDULER", "ENCODER", "CACHE", "INDEX");
  }

  public static List<String> planets() {
    return List.of("MERCURY", "VENUS", "EARTH", "MARS", "JUPITER", "SATURN", "URANUS", "NEPTUNE");
  }

  public static Optional<List<String>> byName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(LISTS.get(name.trim().toLowerCase(Locale.ROOT)));
  }

  public static List<String> names() {
    return List.copyOf(LISTS.keySet());
  }

  private static Map<String, List<String>> buildLists() {
    Map<String, List<String>> lists = new LinkedHashMap<>();
    lists.put("tiny", tiny());
    lists.put("animals", animals());
    lists.put("programming", programming());
    lists.put("planets", planets());
    return lists;
  }
}

package crossword.rank;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders words so the ones built from letters common across the whole list come first.
 *
 * <p>A word's score is the sum, over its characters, of each character's relative frequency in the
 * entire list. Equal scores keep their input order.
 */
public final class WordRanker {

  private WordRanker() {}

  public static List<String> rank(List<String> words) {
    Objects.requireNonNull(words, "words");
    Map<Character, Double> frequencies = letterFrequencies(words);
    List<Scored> scored = new ArrayList<>(words.size());
    for (String word : words) {
      scored.add(new Scored(word, score(word, frequencies)));
    }
    scored.sort(Comparator.comparingDouble(Scored::score).reversed());

    List<String> ranked = new ArrayList<>(scored.size());
    for (Scored entry : scored) {
      ranked.add(entry.word());
    }
    return List.copyOf(ranked);
  }

  /** Occurrence count of each character divided by the total character count. */
  public static Map<Character, Double> letterFrequencies(List<String> words) {
    Map<Character, Integer> counts = new HashMap<>();
    long total = 0;
    for (String word : words) {
      for (int i = 0; i < word.length(); i++) {
        counts.merge(word.charAt(i), 1, Integer::sum);
      }
      total += word.length();
    }
    Map<Character, Double> frequencies = new HashMap<>(counts.size());
    if (total == 0) {
      return frequencies;
    }
    for (Map.Entry<Character, Integer> entry : counts.entrySet()) {
      frequencies.put(entry.getKey(), entry.getValue() / (double) total);
    }
    return frequencies;
  }

  public static double score(String word, Map<Character, Double> frequencies) {
    double score = 0;
    for (int i = 0; i < word.length(); i++) {
      score += frequencies.getOrDefault(word.charAt(i), 0.0);
    }
    return score;
  }

  private record Scored(String word, double score) {}
}

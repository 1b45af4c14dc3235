package crossword.generate;

import crossword.core.GridConfig;
import crossword.core.model.Direction;
import crossword.core.model.Grid;
import crossword.place.Placer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Drives a single trial from a seeded grid until the word queue runs dry.
 *
 * <p>Words are taken from the head of the pending queue. A word that cannot be placed is deferred;
 * after every successful placement the deferred words are put back in front of the remaining
 * queue, so each of them gets another chance on the larger grid. The run ends when the pending
 * queue is empty; words still deferred at that point are left out.
 */
public final class GenerationLoop {

  private GenerationLoop() {}

  /**
   * Runs one trial: a horizontal and a vertical seeding of the ranked list, returning whichever
   * ends denser. The horizontal run wins ties.
   */
  public static GenerationResult runTrial(
      GridConfig config, List<String> rankedWords, Random random) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(rankedWords, "rankedWords");
    Objects.requireNonNull(random, "random");
    GenerationResult across = run(seed(config, rankedWords, Direction.ACROSS), rankedWords, random);
    GenerationResult down = run(seed(config, rankedWords, Direction.DOWN), rankedWords, random);
    return down.density() > across.density() ? down : across;
  }

  /**
   * Places the first word of two or more letters that fits along {@code direction}, centred on the
   * middle row (across) or column (down). Returns an empty grid when no word fits. A single letter
   * is never a seed: nothing could cross it.
   */
  public static Grid seed(GridConfig config, List<String> rankedWords, Direction direction) {
    Grid grid = Grid.empty(config);
    for (String word : rankedWords) {
      if (word.length() < 2) {
        continue;
      }
      int x;
      int y;
      if (direction.isVertical()) {
        x = config.width() / 2;
        y = (config.height() - word.length()) / 2;
      } else {
        x = (config.width() - word.length()) / 2;
        y = config.height() / 2;
      }
      if (Placer.spanFits(grid, direction, x, y, word.length())) {
        return grid.withWordPlaced(x, y, direction, word);
      }
    }
    return grid;
  }

  /** Works through {@code words} starting from {@code start}. */
  public static GenerationResult run(Grid start, List<String> words, Random random) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(words, "words");
    Objects.requireNonNull(random, "random");

    Grid grid = start;
    Deque<String> pending = new ArrayDeque<>(words);
    List<String> deferred = new ArrayList<>();
    int iterations = 0;
    int placements = 0;
    int deferrals = 0;

    while (!pending.isEmpty()) {
      iterations++;
      String word = pending.poll();
      if (grid.containsWord(word)) {
        continue;
      }
      List<Grid> candidates = Placer.place(grid, word);
      if (candidates.isEmpty()) {
        deferred.add(word);
        deferrals++;
        continue;
      }
      grid = candidates.get(random.nextInt(candidates.size()));
      placements++;

      Deque<String> requeued = new ArrayDeque<>(deferred.size() + pending.size());
      requeued.addAll(deferred);
      requeued.addAll(pending);
      pending = requeued;
      deferred.clear();
    }
    return new GenerationResult(grid, iterations, placements, deferrals);
  }
}

package crossword.generate;

import crossword.core.model.Grid;
import java.util.Objects;

/**
 * Outcome of one generation run: the finished grid plus counters describing how the word queue was
 * worked through.
 *
 * @param iterations number of queue entries examined
 * @param placements number of words committed after the seed word
 * @param deferrals number of times a word failed and was set aside
 */
public record GenerationResult(Grid grid, int iterations, int placements, int deferrals) {

  public GenerationResult {
    Objects.requireNonNull(grid, "grid");
  }

  public double density() {
    return grid.density();
  }
}

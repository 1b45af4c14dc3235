package crossword.place;

import crossword.core.model.Direction;
import crossword.core.model.Grid;
import crossword.core.model.IntersectionPoint;
import crossword.core.model.PlacedWord;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Enumerates every legal way of crossing a word into a grid.
 *
 * <p>Each pairing of an anchor from the grid's {@link crossword.index.IntersectionIndex} with a
 * matching letter position in the word is tried on its own. Identical results reached from
 * different anchors are kept as separate candidates.
 */
public final class Placer {

  private Placer() {}

  /** Candidate grids obtained by placing {@code word}; empty when it cannot cross anything. */
  public static List<Grid> place(Grid grid, String word) {
    List<PlacedWord> placements = placements(grid, word);
    List<Grid> candidates = new ArrayList<>(placements.size());
    for (PlacedWord placement : placements) {
      candidates.add(
          grid.withWordPlaced(placement.x(), placement.y(), placement.direction(), word));
    }
    return candidates;
  }

  /** The start cells and orientations at which {@code word} fits, in anchor scan order. */
  public static List<PlacedWord> placements(Grid grid, String word) {
    Objects.requireNonNull(grid, "grid");
    Objects.requireNonNull(word, "word");
    List<PlacedWord> placements = new ArrayList<>();
    if (word.isEmpty()) {
      return placements;
    }
    for (char letter : distinctLetters(word)) {
      List<IntersectionPoint> anchors = grid.intersections().pointsFor(letter);
      if (anchors.isEmpty()) {
        continue;
      }
      for (IntersectionPoint anchor : anchors) {
        Direction direction = anchor.direction();
        for (int i = 0; i < word.length(); i++) {
          if (word.charAt(i) != letter) {
            continue;
          }
          int x = anchor.x() - i * direction.dx();
          int y = anchor.y() - i * direction.dy();
          if (!spanFits(grid, direction, x, y, word.length())) {
            continue;
          }
          if (FitChecker.fits(grid, word, direction, x, y)) {
            placements.add(new PlacedWord(word, grid.normalizeX(x), y, direction));
          }
        }
      }
    }
    return placements;
  }

  /**
   * Whether a span of {@code length} cells from {@code (x, y)} stays on the grid. On a wrapping
   * grid a horizontal span may cross the side edge but must be shorter than the row so that it
   * never meets itself.
   */
  public static boolean spanFits(Grid grid, Direction direction, int x, int y, int length) {
    if (length <= 0) {
      return false;
    }
    if (direction.isVertical()) {
      return grid.isInBounds(x, y) && y + length - 1 < grid.height();
    }
    if (y < 0 || y >= grid.height()) {
      return false;
    }
    if (grid.wraps()) {
      return length < grid.width();
    }
    return x >= 0 && x + length - 1 < grid.width();
  }

  private static Set<Character> distinctLetters(String word) {
    Set<Character> letters = new LinkedHashSet<>();
    for (int i = 0; i < word.length(); i++) {
      letters.add(word.charAt(i));
    }
    return letters;
  }
}

package crossword.index;

import com.google.common.collect.ImmutableListMultimap;
import crossword.core.model.Direction;
import crossword.core.model.Grid;
import crossword.core.model.IntersectionPoint;
import java.util.List;
import java.util.Objects;

/**
 * Letters of a grid state that a new word may cross, keyed by character.
 *
 * <p>A filled cell is a horizontal anchor when neither horizontal neighbour holds a letter and at
 * least one horizontal side has both diagonal corners clear; vertical anchors are the transpose.
 * Cells outside the grid count as clear. A cell open both ways is recorded as horizontal only, so
 * every point carries exactly one orientation.
 */
public final class IntersectionIndex {

  private final ImmutableListMultimap<Character, IntersectionPoint> points;

  private IntersectionIndex(ImmutableListMultimap<Character, IntersectionPoint> points) {
    this.points = points;
  }

  /** Scans {@code grid} row by row and collects its anchors. */
  public static IntersectionIndex build(Grid grid) {
    Objects.requireNonNull(grid, "grid");
    ImmutableListMultimap.Builder<Character, IntersectionPoint> builder =
        ImmutableListMultimap.builder();
    for (int y = 0; y < grid.height(); y++) {
      for (int x = 0; x < grid.width(); x++) {
        if (!grid.isLetterAt(x, y)) {
          continue;
        }
        Direction open = openDirection(grid, x, y);
        if (open != null) {
          char letter = grid.charAt(x, y);
          builder.put(letter, new IntersectionPoint(letter, x, y, open));
        }
      }
    }
    return new IntersectionIndex(builder.build());
  }

  /** The orientation a new word could take through {@code (x, y)}, or null if none. */
  static Direction openDirection(Grid grid, int x, int y) {
    if (isHorizontallyOpen(grid, x, y)) {
      return Direction.ACROSS;
    }
    if (isVerticallyOpen(grid, x, y)) {
      return Direction.DOWN;
    }
    return null;
  }

  static boolean isHorizontallyOpen(Grid grid, int x, int y) {
    if (grid.isLetterAt(x - 1, y) || grid.isLetterAt(x + 1, y)) {
      return false;
    }
    boolean leftClear = clear(grid, x - 1, y - 1) && clear(grid, x - 1, y + 1);
    boolean rightClear = clear(grid, x + 1, y - 1) && clear(grid, x + 1, y + 1);
    return leftClear || rightClear;
  }

  static boolean isVerticallyOpen(Grid grid, int x, int y) {
    if (grid.isLetterAt(x, y - 1) || grid.isLetterAt(x, y + 1)) {
      return false;
    }
    boolean aboveClear = clear(grid, x - 1, y - 1) && clear(grid, x + 1, y - 1);
    boolean belowClear = clear(grid, x - 1, y + 1) && clear(grid, x + 1, y + 1);
    return aboveClear || belowClear;
  }

  private static boolean clear(Grid grid, int x, int y) {
    return !grid.isLetterAt(x, y);
  }

  public List<IntersectionPoint> pointsFor(char letter) {
    return points.get(letter);
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }
}

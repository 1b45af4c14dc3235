package crossword.place;

import crossword.core.model.Direction;
import crossword.core.model.Grid;

/**
 * Compatibility rules for writing a word onto a grid that already holds letters.
 *
 * <p>A placement fits when every cell it covers is empty or already holds the same letter, at
 * least one cell is such a shared letter, no shared letter already belongs to a word running the
 * same way, no newly filled cell touches a letter on either perpendicular side, and the cells just
 * before and just after the word hold no letter. Cells outside the grid hold no letter but can
 * never be written.
 */
public final class FitChecker {

  private FitChecker() {}

  public static boolean fits(Grid grid, String word, Direction direction, int x, int y) {
    int dx = direction.dx();
    int dy = direction.dy();
    int px = direction.perpendicular().dx();
    int py = direction.perpendicular().dy();

    if (grid.isLetterAt(x - dx, y - dy)) {
      return false;
    }
    int len = word.length();
    if (grid.isLetterAt(x + len * dx, y + len * dy)) {
      return false;
    }

    boolean crossed = false;
    for (int i = 0; i < len; i++) {
      int lx = x + i * dx;
      int ly = y + i * dy;
      char existing = grid.charAt(lx, ly);
      if (existing == word.charAt(i)) {
        if (grid.isCoveredAlong(lx, ly, direction)) {
          return false;
        }
        crossed = true;
      } else if (existing == Grid.EMPTY) {
        if (grid.isLetterAt(lx - px, ly - py) || grid.isLetterAt(lx + px, ly + py)) {
          return false;
        }
      } else {
        return false;
      }
    }
    return crossed;
  }

  public static boolean fits(Grid grid, String word, boolean vertical, int x, int y) {
    return fits(grid, word, vertical ? Direction.DOWN : Direction.ACROSS, x, y);
  }
}

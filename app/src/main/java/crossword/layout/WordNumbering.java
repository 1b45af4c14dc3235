package crossword.layout;

import crossword.core.model.Direction;
import crossword.core.model.Grid;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Numbers the entries of a finished grid the way printed crosswords do.
 *
 * <p>Cells are visited left to right, top to bottom. Every cell where a run of two or more letters
 * starts across or down receives the next number; a cell starting both an across and a down run
 * shares one number between them.
 */
public final class WordNumbering {

  private WordNumbering() {}

  public static List<NumberedEntry> number(Grid grid) {
    Objects.requireNonNull(grid, "grid");
    List<NumberedEntry> entries = new ArrayList<>();
    int next = 1;
    for (int y = 0; y < grid.height(); y++) {
      for (int x = 0; x < grid.width(); x++) {
        boolean across = grid.startsWord(x, y, Direction.ACROSS);
        boolean down = grid.startsWord(x, y, Direction.DOWN);
        if (!across && !down) {
          continue;
        }
        int number = next++;
        if (across) {
          entries.add(
              new NumberedEntry(
                  number, x, y, Direction.ACROSS, grid.runAt(x, y, Direction.ACROSS)));
        }
        if (down) {
          entries.add(
              new NumberedEntry(number, x, y, Direction.DOWN, grid.runAt(x, y, Direction.DOWN)));
        }
      }
    }
    return entries;
  }

  public static List<NumberedEntry> entries(List<NumberedEntry> numbered, Direction direction) {
    return numbered.stream().filter(entry -> entry.direction() == direction).toList();
  }
}

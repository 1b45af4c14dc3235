package crossword.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;

import crossword.core.GridConfig;
import crossword.core.model.Direction;
import crossword.core.model.Grid;
import crossword.core.model.PlacedWord;
import java.util.List;
import org.junit.jupiter.api.Test;

final class WordNumberingTest {

  @Test
  void sharesNumberWhenAcrossAndDownStartTogether() {
    Grid grid =
        Grid.of(
            GridConfig.of(5, 5),
            List.of(
                new PlacedWord("CAT", 0, 0, Direction.ACROSS),
                new PlacedWord("CUP", 0, 0, Direction.DOWN),
                new PlacedWord("TOE", 2, 0, Direction.DOWN)));

    List<NumberedEntry> entries = WordNumbering.number(grid);

    assertEquals(
        List.of(
            new NumberedEntry(1, 0, 0, Direction.ACROSS, "CAT"),
            new NumberedEntry(1, 0, 0, Direction.DOWN, "CUP"),
            new NumberedEntry(2, 2, 0, Direction.DOWN, "TOE")),
        entries);
    assertEquals("1A", entries.get(0).label());
    assertEquals("2D", entries.get(2).label());
  }

  @Test
  void numbersRowByRowAndSkipsSingleLetters() {
    Grid grid =
        Grid.empty(GridConfig.of(7, 7))
            .withWordPlaced(2, 3, Direction.ACROSS, "CAT")
            .withWordPlaced(4, 3, Direction.DOWN, "TOD")
            .withWordPlaced(4, 5, Direction.ACROSS, "DOG");

    List<NumberedEntry> entries = WordNumbering.number(grid);

    assertEquals(
        List.of(
            new NumberedEntry(1, 2, 3, Direction.ACROSS, "CAT"),
            new NumberedEntry(2, 4, 3, Direction.DOWN, "TOD"),
            new NumberedEntry(3, 4, 5, Direction.ACROSS, "DOG")),
        entries);
    assertEquals(2, WordNumbering.entries(entries, Direction.ACROSS).size());
    assertEquals(1, WordNumbering.entries(entries, Direction.DOWN).size());
  }

  @Test
  void wrappedAcrossWordIsNumberedAtItsStart() {
    Grid grid =
        Grid.empty(new GridConfig(6, 3, true)).withWordPlaced(4, 1, Direction.ACROSS, "ABC");

    assertEquals(
        List.of(new NumberedEntry(1, 4, 1, Direction.ACROSS, "ABC")), WordNumbering.number(grid));
  }

  @Test
  void emptyGridHasNoEntries() {
    assertEquals(List.of(), WordNumbering.number(Grid.empty(GridConfig.of(3, 3))));
  }
}

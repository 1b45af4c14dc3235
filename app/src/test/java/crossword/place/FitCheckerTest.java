package crossword.place;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import crossword.core.GridConfig;
import crossword.core.model.Direction;
import crossword.core.model.Grid;
import org.junit.jupiter.api.Test;

final class FitCheckerTest {

  private static Grid catGrid() {
    return Grid.empty(GridConfig.of(7, 7)).withWordPlaced(2, 3, Direction.ACROSS, "CAT");
  }

  @Test
  void acceptsCleanCrossing() {
    assertTrue(FitChecker.fits(catGrid(), "TOE", Direction.DOWN, 4, 3));
    assertTrue(FitChecker.fits(catGrid(), "BAT", Direction.DOWN, 3, 2), "crossing mid-word");
    assertTrue(FitChecker.fits(catGrid(), "ACT", true, 2, 2));
  }

  @Test
  void rejectsConflictingLetter() {
    assertFalse(FitChecker.fits(catGrid(), "DOG", Direction.DOWN, 3, 3), "D would overwrite A");
  }

  @Test
  void rejectsPlacementWithoutCrossing() {
    assertFalse(FitChecker.fits(catGrid(), "DOG", Direction.ACROSS, 0, 0));
    assertFalse(FitChecker.fits(Grid.empty(GridConfig.of(5, 5)), "DOG", Direction.DOWN, 1, 1));
  }

  @Test
  void rejectsNewLetterBesideAnotherWord() {
    Grid grid = catGrid().withWordPlaced(4, 3, Direction.DOWN, "TOE");
    assertFalse(FitChecker.fits(grid, "ROT", Direction.DOWN, 5, 2), "O would sit beside T");
    assertFalse(
        FitChecker.fits(grid, "NOD", Direction.ACROSS, 3, 4), "N would sit directly under A");
    assertTrue(FitChecker.fits(grid, "OX", Direction.ACROSS, 4, 4));
  }

  @Test
  void rejectsLetterImmediatelyBeforeOrAfterTheSpan() {
    assertTrue(FitChecker.fits(catGrid(), "CAR", Direction.DOWN, 2, 3));

    Grid below = catGrid().withWordPlaced(2, 6, Direction.ACROSS, "DOG");
    assertFalse(
        FitChecker.fits(below, "CAR", Direction.DOWN, 2, 3), "R would end right above DOG");

    Grid above = catGrid().withWordPlaced(2, 1, Direction.ACROSS, "DOG");
    assertFalse(FitChecker.fits(above, "XC", Direction.DOWN, 2, 2), "X would start under DOG");
  }

  @Test
  void rejectsRunningAlongAnExistingWord() {
    Grid grid = catGrid().withWordPlaced(4, 3, Direction.DOWN, "TOE");
    assertFalse(
        FitChecker.fits(grid, "SCAT", Direction.ACROSS, 1, 3),
        "SCAT would swallow CAT in line");
  }

  @Test
  void rejectsSpansLeavingTheGrid() {
    assertFalse(FitChecker.fits(catGrid(), "TOADS", Direction.DOWN, 4, 3), "would pass row 6");
    assertFalse(FitChecker.fits(catGrid(), "HAT", Direction.DOWN, 3, -2), "starts above row 0");
  }
}

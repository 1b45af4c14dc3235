package crossword.layout;

import crossword.core.model.Direction;

/** A numbered across or down entry as it would appear next to its clue. */
public record NumberedEntry(int number, int x, int y, Direction direction, String answer) {

  public String label() {
    return number + (direction == Direction.ACROSS ? "A" : "D");
  }
}

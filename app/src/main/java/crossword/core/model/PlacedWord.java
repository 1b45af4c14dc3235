package crossword.core.model;

import java.util.Objects;

/** A word committed to a grid together with its start cell and orientation. */
public record PlacedWord(String word, int x, int y, Direction direction) {

  public PlacedWord {
    Objects.requireNonNull(word, "word");
    Objects.requireNonNull(direction, "direction");
  }

  public int length() {
    return word.length();
  }

  /** Horizontal coordinate of the i-th letter, before any wrapping. */
  public int xAt(int i) {
    return x + i * direction.dx();
  }

  public int yAt(int i) {
    return y + i * direction.dy();
  }
}

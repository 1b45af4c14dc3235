package crossword.core.model;

/** Orientation of a word on the grid. */
public enum Direction {
  ACROSS(1, 0),
  DOWN(0, 1);

  private final int dx;
  private final int dy;

  Direction(int dx, int dy) {
    this.dx = dx;
    this.dy = dy;
  }

  public int dx() {
    return dx;
  }

  public int dy() {
    return dy;
  }

  public boolean isVertical() {
    return this == DOWN;
  }

  public Direction perpendicular() {
    return this == ACROSS ? DOWN : ACROSS;
  }
}

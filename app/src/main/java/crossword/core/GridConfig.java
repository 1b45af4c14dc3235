package crossword.core;

/**
 * Shape of the grid a crossword is generated on.
 *
 * <p>With {@code wrap} enabled the grid is a cylinder: horizontal coordinates wrap modulo {@code
 * width}, vertical coordinates never wrap.
 */
public record GridConfig(int width, int height, boolean wrap) {

  public GridConfig {
    if (width <= 0) {
      throw new IllegalArgumentException("width must be positive: " + width);
    }
    if (height <= 0) {
      throw new IllegalArgumentException("height must be positive: " + height);
    }
    try {
      Math.multiplyExact(width, height);
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("grid too large: " + width + "x" + height, ex);
    }
  }

  public static GridConfig of(int width, int height) {
    return new GridConfig(width, height, false);
  }

  public int area() {
    return width * height;
  }

  public int index(int x, int y) {
    return y * width + x;
  }

  public int xOf(int index) {
    return index % width;
  }

  public int yOf(int index) {
    return index / width;
  }
}

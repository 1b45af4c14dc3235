package crossword.core.model;

import com.google.common.base.Suppliers;
import crossword.core.GridConfig;
import crossword.index.IntersectionIndex;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Immutable crossword grid state.
 *
 * <p>Every placement produces a new {@code Grid}; the parent state is never touched, so sibling
 * candidates can be explored (and shared across threads) freely. Cells are stored row-major with
 * {@code index = y * width + x}.
 *
 * <p>Coordinate queries are bounds-safe. Cells outside the grid read as {@link #BLOCKED}, except
 * horizontally on a wrapping grid where {@code x} is taken modulo the width.
 */
public final class Grid {

  /** Marker for a cell holding no letter. */
  public static final char EMPTY = ' ';

  /** Value returned for coordinates outside the grid. Never equal to a letter. */
  public static final char BLOCKED = '\0';

  private final GridConfig config;
  private final char[] cells;
  private final byte[] coverage;
  private final List<PlacedWord> placedWords;
  private final Supplier<IntersectionIndex> intersections;

  private Grid(GridConfig config, char[] cells, byte[] coverage, List<PlacedWord> placedWords) {
    this.config = config;
    this.cells = cells;
    this.coverage = coverage;
    this.placedWords = placedWords;
    this.intersections = Suppliers.memoize(() -> IntersectionIndex.build(this));
  }

  public static Grid empty(GridConfig config) {
    Objects.requireNonNull(config, "config");
    char[] cells = new char[config.area()];
    Arrays.fill(cells, EMPTY);
    return new Grid(config, cells, new byte[config.area()], List.of());
  }

  /**
   * Rebuilds a grid by writing the given words in order onto an empty grid. No compatibility
   * checks are made.
   */
  public static Grid of(GridConfig config, List<PlacedWord> words) {
    Grid grid = empty(config);
    for (PlacedWord word : words) {
      grid = grid.withWordPlaced(word.x(), word.y(), word.direction(), word.word());
    }
    return grid;
  }

  /**
   * Returns a new grid with {@code word} written from {@code (x, y)} along {@code direction}.
   *
   * <p>The caller is responsible for having validated the placement.
   */
  public Grid withWordPlaced(int x, int y, Direction direction, String word) {
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(word, "word");
    char[] next = cells.clone();
    byte[] nextCoverage = coverage.clone();
    for (int i = 0; i < word.length(); i++) {
      int index = config.index(normalizeX(x + i * direction.dx()), y + i * direction.dy());
      next[index] = word.charAt(i);
      nextCoverage[index] |= coverageBit(direction);
    }
    List<PlacedWord> words = new ArrayList<>(placedWords.size() + 1);
    words.addAll(placedWords);
    words.add(new PlacedWord(word, normalizeX(x), y, direction));
    return new Grid(config, next, nextCoverage, List.copyOf(words));
  }

  public Grid withWordPlaced(int x, int y, boolean vertical, String word) {
    return withWordPlaced(x, y, vertical ? Direction.DOWN : Direction.ACROSS, word);
  }

  /** Returns the grid as it would be had {@code word} never been placed. */
  public Grid withoutWord(String word) {
    List<PlacedWord> remaining = new ArrayList<>(placedWords.size());
    for (PlacedWord placed : placedWords) {
      if (!placed.word().equals(word)) {
        remaining.add(placed);
      }
    }
    return of(config, remaining);
  }

  public GridConfig config() {
    return config;
  }

  public int width() {
    return config.width();
  }

  public int height() {
    return config.height();
  }

  public boolean wraps() {
    return config.wrap();
  }

  public boolean isInBounds(int x, int y) {
    if (y < 0 || y >= config.height()) {
      return false;
    }
    return config.wrap() || (x >= 0 && x < config.width());
  }

  public char charAt(int x, int y) {
    if (!isInBounds(x, y)) {
      return BLOCKED;
    }
    return cells[config.index(normalizeX(x), y)];
  }

  public boolean isEmptyAt(int x, int y) {
    return charAt(x, y) == EMPTY;
  }

  public boolean isLetterAt(int x, int y) {
    char c = charAt(x, y);
    return c != EMPTY && c != BLOCKED;
  }

  /** Whether a placed word running along {@code direction} covers {@code (x, y)}. */
  public boolean isCoveredAlong(int x, int y, Direction direction) {
    if (!isInBounds(x, y)) {
      return false;
    }
    return (coverage[config.index(normalizeX(x), y)] & coverageBit(direction)) != 0;
  }

  private static byte coverageBit(Direction direction) {
    return (byte) (direction == Direction.ACROSS ? 1 : 2);
  }

  /** Maps {@code x} into {@code [0, width)} on a wrapping grid; identity otherwise. */
  public int normalizeX(int x) {
    return config.wrap() ? Math.floorMod(x, config.width()) : x;
  }

  /**
   * Whether a word of length greater than one starts at {@code (x, y)} reading along {@code
   * direction}: the cell holds a letter, the one before it does not, the one after it does.
   */
  public boolean startsWord(int x, int y, Direction direction) {
    return isLetterAt(x, y)
        && !isLetterAt(x - direction.dx(), y - direction.dy())
        && isLetterAt(x + direction.dx(), y + direction.dy());
  }

  /** Reads the run of letters starting at {@code (x, y)} along {@code direction}. */
  public String runAt(int x, int y, Direction direction) {
    StringBuilder sb = new StringBuilder();
    int cx = x;
    int cy = y;
    int limit = direction.isVertical() ? config.height() : config.width();
    while (sb.length() < limit && isLetterAt(cx, cy)) {
      sb.append(charAt(cx, cy));
      cx += direction.dx();
      cy += direction.dy();
    }
    return sb.toString();
  }

  public List<PlacedWord> placedWords() {
    return placedWords;
  }

  public Set<String> placedWordSet() {
    Set<String> words = new LinkedHashSet<>();
    for (PlacedWord placed : placedWords) {
      words.add(placed.word());
    }
    return words;
  }

  public boolean containsWord(String word) {
    for (PlacedWord placed : placedWords) {
      if (placed.word().equals(word)) {
        return true;
      }
    }
    return false;
  }

  public int wordCount() {
    return placedWords.size();
  }

  /** Sum of placed word lengths over the grid area. Crossing cells count once per word. */
  public double density() {
    long letters = 0;
    for (PlacedWord placed : placedWords) {
      letters += placed.length();
    }
    return (double) letters / config.area();
  }

  public int filledCellCount() {
    int count = 0;
    for (char c : cells) {
      if (c != EMPTY) {
        count++;
      }
    }
    return count;
  }

  /** Crossing anchors of this state, built on first use and kept for the life of the grid. */
  public IntersectionIndex intersections() {
    return intersections.get();
  }

  public List<String> rows() {
    List<String> rows = new ArrayList<>(config.height());
    for (int y = 0; y < config.height(); y++) {
      rows.add(new String(cells, y * config.width(), config.width()));
    }
    return rows;
  }

  @Override
  public String toString() {
    return String.join("\n", rows());
  }
}

package crossword.core.model;

/**
 * Filled cell from which a new word may cross the grid, tagged with the single orientation that is
 * open at that cell.
 */
public record IntersectionPoint(char letter, int x, int y, Direction direction) {}

package crossword.cli;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main generate --example animals --size 13}
 *   <li>{@code Main generate --words CAT,TAR,ART --size 5 --seed 7 --json}
 * </ul>
 *
 * <p>Exit codes: 0 on success, 1 when the word list cannot be read, 2 for invalid arguments, 3
 * when the search stopped before every trial ran.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    int exit = run(args);
    if (exit != 0) {
      System.exit(exit);
    }
  }

  static int run(String[] args) {
    try {
      return new GenerateCommand(System.out).execute(args);
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      System.err.println(GenerateCommand.USAGE);
      return 2;
    } catch (IOException ex) {
      LOG.error("Failed to read word list", ex);
      return 1;
    }
  }
}

package crossword.select;

import crossword.core.GridConfig;
import crossword.core.model.Grid;
import crossword.generate.GenerationResult;
import java.util.List;
import java.util.Objects;

/** Result of a multi-start search together with per-worker detail and timing. */
public record SelectionReport(
    GridConfig config,
    List<String> rankedWords,
    GenerationResult best,
    int bestWorker,
    long baseSeed,
    List<WorkerOutcome> workers,
    long elapsedMillis,
    String terminationReason) {

  public SelectionReport {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(best, "best");
    rankedWords = List.copyOf(Objects.requireNonNull(rankedWords, "rankedWords"));
    workers = List.copyOf(Objects.requireNonNull(workers, "workers"));
  }

  public Grid grid() {
    return best.grid();
  }

  public double density() {
    return best.density();
  }

  public int trialsRun() {
    return workers.stream().mapToInt(WorkerOutcome::trialsRun).sum();
  }

  public List<String> unplacedWords() {
    return rankedWords.stream().filter(word -> !best.grid().containsWord(word)).toList();
  }

  public boolean completed() {
    return terminationReason == null;
  }
}

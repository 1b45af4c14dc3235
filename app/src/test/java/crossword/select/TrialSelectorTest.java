package crossword.select;

import static crossword.testing.GridAssertions.assertDensityMatchesWords;
import static crossword.testing.GridAssertions.assertPlacementsRoundTrip;
import static crossword.testing.GridAssertions.assertWordsReadBack;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import crossword.core.GridConfig;
import crossword.core.SelectionOptions;
import crossword.core.model.Grid;
import crossword.examples.WordLists;
import crossword.rank.WordRanker;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class TrialSelectorTest {

  private static final GridConfig ANIMAL_GRID = GridConfig.of(13, 13);

  @Test
  void sameSeedSelectsTheSameGrid() {
    SelectionOptions options = new SelectionOptions(25, 3, 42L, 0);
    SelectionReport first = new TrialSelector(options).select(ANIMAL_GRID, WordLists.animals());
    SelectionReport second = new TrialSelector(options).select(ANIMAL_GRID, WordLists.animals());

    assertEquals(first.grid().rows(), second.grid().rows());
    assertEquals(first.grid().placedWords(), second.grid().placedWords());
    assertEquals(first.bestWorker(), second.bestWorker());
    assertEquals(75, first.trialsRun());
    assertTrue(first.completed(), "no budget was set");
  }

  @Test
  void parallelReductionMatchesSequentialBatches() {
    SelectionOptions options = new SelectionOptions(15, 4, 7L, 0);
    TrialSelector selector = new TrialSelector(options);
    List<String> ranked = WordRanker.rank(WordLists.programming());
    GridConfig config = GridConfig.of(15, 15);

    SelectionReport report = selector.selectRanked(config, ranked);

    WorkerOutcome expected = null;
    for (int worker = 0; worker < options.workers(); worker++) {
      WorkerOutcome outcome = selector.runBatch(worker, config, ranked, 7L, Long.MAX_VALUE);
      WorkerOutcome reported = report.workers().get(worker);
      assertEquals(outcome.best().grid().rows(), reported.best().grid().rows());
      assertEquals(outcome.bestSeed(), reported.bestSeed());
      if (expected == null || outcome.best().density() > expected.best().density()) {
        expected = outcome;
      }
    }
    assertEquals(expected.worker(), report.bestWorker());
    assertEquals(expected.best().grid().rows(), report.grid().rows());
  }

  @Test
  void bestIsAtLeastAsDenseAsEveryWorker() {
    SelectionReport report =
        new TrialSelector(new SelectionOptions(10, 4, 99L, 0))
            .select(ANIMAL_GRID, WordLists.animals());

    for (WorkerOutcome outcome : report.workers()) {
      assertTrue(outcome.hasResult());
      assertTrue(report.density() >= outcome.best().density());
      assertEquals(10, outcome.trialsRun());
      assertNull(outcome.stopReason());
    }
    Grid grid = report.grid();
    assertDensityMatchesWords(grid);
    assertWordsReadBack(grid);
    assertPlacementsRoundTrip(grid);
    assertTrue(grid.wordCount() >= 2, "animal list always yields crossings");
  }

  @Test
  void smallExampleReachesExpectedDensity() {
    SelectionReport report =
        new TrialSelector(new SelectionOptions(20, 2, 1L, 0))
            .select(GridConfig.of(5, 5), List.of("CAT", "TAR", "ART"));

    double density = report.density();
    assertTrue(
        Math.abs(density - 0.24) < 1e-12 || Math.abs(density - 0.36) < 1e-12,
        "unexpected density " + density);
    assertEquals(List.of("TAR", "ART", "CAT"), report.rankedWords());
    assertEquals(3 - report.grid().wordCount(), report.unplacedWords().size());
  }

  @Test
  void cancelledSelectorRunsNoTrials() {
    TrialSelector selector = new TrialSelector(new SelectionOptions(100, 2, 3L, 0));
    selector.cancel();

    SelectionReport report = selector.select(ANIMAL_GRID, WordLists.animals());

    assertEquals(0, report.trialsRun());
    assertEquals(0, report.grid().wordCount());
    assertEquals(-1, report.bestWorker());
    assertEquals(TrialSelector.CANCELLED, report.terminationReason());
  }

  @Test
  void cancellationOnlyStopsOneRun() {
    TrialSelector selector = new TrialSelector(new SelectionOptions(5, 2, 3L, 0));
    selector.cancel();
    assertTrue(selector.isCancelled());

    SelectionReport stopped = selector.select(GridConfig.of(5, 5), List.of("CAT", "TAR"));
    assertEquals(0, stopped.trialsRun());
    assertFalse(selector.isCancelled(), "the finished run consumes the request");

    SelectionReport next = selector.select(GridConfig.of(5, 5), List.of("CAT", "TAR"));
    assertEquals(10, next.trialsRun());
    assertTrue(next.completed());
    assertEquals(2, next.grid().wordCount());
  }

  @Test
  void timeBudgetStopsAtATrialBoundary() {
    int trials = 2_000_000;
    SelectionReport report =
        new TrialSelector(new SelectionOptions(trials, 1, 5L, 1))
            .select(ANIMAL_GRID, WordLists.animals());

    assertTrue(report.trialsRun() >= 1, "at least one trial always runs");
    assertTrue(report.trialsRun() < trials, "budget should cut the batch short");
    assertEquals(TrialSelector.TIME_BUDGET_EXHAUSTED, report.terminationReason());
    assertTrue(report.grid().wordCount() >= 1);
  }

  @Test
  void emptyWordListYieldsEmptyGrid() {
    SelectionReport report =
        new TrialSelector(new SelectionOptions(5, 2, 11L, 0))
            .select(GridConfig.of(4, 4), List.of());
    assertEquals(0.0, report.density());
    assertEquals(10, report.trialsRun());
  }

  @Test
  void trialSeedsDifferAcrossWorkersAndTrials() {
    Set<Long> seeds = new HashSet<>();
    for (int worker = 0; worker < 8; worker++) {
      for (int trial = 0; trial < 500; trial++) {
        seeds.add(TrialSelector.trialSeed(123L, worker, trial));
      }
    }
    assertEquals(8 * 500, seeds.size());
    assertEquals(TrialSelector.trialSeed(5L, 1, 2), TrialSelector.trialSeed(5L, 1, 2));
  }
}

package crossword.select;

import crossword.core.GridConfig;
import crossword.core.SelectionOptions;
import crossword.core.model.Grid;
import crossword.generate.GenerationLoop;
import crossword.generate.GenerationResult;
import crossword.rank.WordRanker;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-start search: runs batches of independent trials and keeps the densest grid.
 *
 * <p>Each worker runs its batch sequentially and keeps its own best; the per-worker bests are then
 * reduced in worker order. Both comparisons are strict, so the earliest trial wins ties and the
 * outcome depends only on the seeds, never on thread scheduling.
 */
public final class TrialSelector {
  private static final Logger LOG = LoggerFactory.getLogger(TrialSelector.class);

  static final String TIME_BUDGET_EXHAUSTED = "time budget exhausted";
  static final String CANCELLED = "cancelled";
  static final String INTERRUPTED = "interrupted";

  private final SelectionOptions options;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public TrialSelector() {
    this(SelectionOptions.defaults());
  }

  public TrialSelector(SelectionOptions options) {
    this.options = SelectionOptions.normalize(options);
  }

  /**
   * Stops every worker of the run in progress at its next trial boundary. Called between runs, it
   * stops the next run before its first trial. Each run clears the request when it returns.
   */
  public void cancel() {
    cancelled.set(true);
  }

  /** Whether a stop has been requested and not yet consumed by a finished run. */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Ranks {@code words} and searches for the densest grid. */
  public SelectionReport select(GridConfig config, List<String> words) {
    Objects.requireNonNull(words, "words");
    return selectRanked(config, WordRanker.rank(words));
  }

  /** Searches with {@code rankedWords} used as given. */
  public SelectionReport selectRanked(GridConfig config, List<String> rankedWords) {
    Objects.requireNonNull(config, "config");
    List<String> words = List.copyOf(Objects.requireNonNull(rankedWords, "rankedWords"));
    long baseSeed = options.baseSeed() != null ? options.baseSeed() : new Random().nextLong();
    long started = System.nanoTime();
    long deadline =
        options.hasTimeBudget() ? started + options.timeBudgetMs() * 1_000_000L : Long.MAX_VALUE;

    LOG.info(
        "Running {} worker(s) x {} trial(s) on a {}x{} grid{} with {} word(s), seed {}",
        options.workers(),
        options.trialsPerWorker(),
        config.width(),
        config.height(),
        config.wrap() ? " (wrapping)" : "",
        words.size(),
        baseSeed);

    List<WorkerOutcome> outcomes = new ArrayList<>(options.workers());
    String terminationReason = null;
    try {
      if (options.workers() == 1) {
        outcomes.add(runBatch(0, config, words, baseSeed, deadline));
      } else {
        terminationReason = runParallel(config, words, baseSeed, deadline, outcomes);
      }
    } finally {
      cancelled.set(false);
    }

    GenerationResult best = null;
    int bestWorker = -1;
    for (WorkerOutcome outcome : outcomes) {
      if (terminationReason == null && outcome.stopReason() != null) {
        terminationReason = outcome.stopReason();
      }
      if (!outcome.hasResult()) {
        continue;
      }
      if (best == null || outcome.best().density() > best.density()) {
        best = outcome.best();
        bestWorker = outcome.worker();
      }
    }
    if (best == null) {
      best = new GenerationResult(Grid.empty(config), 0, 0, 0);
    }

    long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;
    SelectionReport report =
        new SelectionReport(
            config, words, best, bestWorker, baseSeed, outcomes, elapsedMillis, terminationReason);
    LOG.info(
        "Best density {} ({} of {} word(s)) after {} trial(s) in {} ms",
        String.format(Locale.ROOT, "%.3f", report.density()),
        best.grid().wordCount(),
        words.size(),
        report.trialsRun(),
        elapsedMillis);
    if (terminationReason != null) {
      LOG.warn("Search stopped early: {}", terminationReason);
    }
    return report;
  }

  private String runParallel(
      GridConfig config,
      List<String> words,
      long baseSeed,
      long deadline,
      List<WorkerOutcome> outcomes) {
    ForkJoinPool pool = new ForkJoinPool(options.workers());
    try {
      List<ForkJoinTask<WorkerOutcome>> tasks = new ArrayList<>(options.workers());
      for (int worker = 0; worker < options.workers(); worker++) {
        int id = worker;
        tasks.add(pool.submit(() -> runBatch(id, config, words, baseSeed, deadline)));
      }
      for (ForkJoinTask<WorkerOutcome> task : tasks) {
        try {
          outcomes.add(task.get());
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          cancel();
          LOG.warn(
              "Interrupted while waiting for workers; keeping {} finished batch(es)",
              outcomes.size());
          return INTERRUPTED;
        } catch (ExecutionException ex) {
          cancel();
          throw new IllegalStateException("Trial worker failed", ex.getCause());
        }
      }
      return null;
    } finally {
      pool.shutdown();
    }
  }

  WorkerOutcome runBatch(
      int worker, GridConfig config, List<String> words, long baseSeed, long deadline) {
    GenerationResult best = null;
    long bestSeed = 0;
    int trialsRun = 0;
    String stopReason = null;

    for (int trial = 0; trial < options.trialsPerWorker(); trial++) {
      if (cancelled.get()) {
        stopReason = CANCELLED;
        break;
      }
      if (trial > 0 && System.nanoTime() > deadline) {
        stopReason = TIME_BUDGET_EXHAUSTED;
        break;
      }
      long seed = trialSeed(baseSeed, worker, trial);
      GenerationResult result = GenerationLoop.runTrial(config, words, new Random(seed));
      trialsRun++;
      if (best == null || result.density() > best.density()) {
        best = result;
        bestSeed = seed;
      }
    }

    if (best != null) {
      LOG.debug(
          "Worker {} finished {} trial(s); best density {} from seed {}",
          worker,
          trialsRun,
          best.density(),
          bestSeed);
    }
    return new WorkerOutcome(worker, best, bestSeed, trialsRun, stopReason);
  }

  /** Derives a well-mixed seed for one trial from the run seed and the trial coordinates. */
  public static long trialSeed(long baseSeed, int worker, int trial) {
    long z = baseSeed + 0x9E3779B97F4A7C15L * (((long) worker << 32) + trial + 1);
    z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
    z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
    return z ^ (z >>> 31);
  }
}

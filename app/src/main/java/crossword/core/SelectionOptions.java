package crossword.core;

/**
 * Budget for the multi-start search.
 *
 * @param trialsPerWorker trials each worker runs before reporting its best grid
 * @param workers number of batches run concurrently
 * @param baseSeed seed every trial seed is derived from; {@code null} picks a fresh one per run
 * @param timeBudgetMs wall-clock limit after which workers stop at the next trial boundary; 0
 *     means unbounded
 */
public record SelectionOptions(int trialsPerWorker, int workers, Long baseSeed, long timeBudgetMs) {

  public static final int DEFAULT_TRIALS_PER_WORKER = 1000;
  public static final int DEFAULT_WORKERS = 4;

  public SelectionOptions {
    if (trialsPerWorker < 1) {
      throw new IllegalArgumentException("trialsPerWorker must be at least 1");
    }
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be at least 1");
    }
    if (timeBudgetMs < 0) {
      throw new IllegalArgumentException("timeBudgetMs must be non-negative");
    }
  }

  public static SelectionOptions defaults() {
    return new SelectionOptions(DEFAULT_TRIALS_PER_WORKER, DEFAULT_WORKERS, null, 0);
  }

  public static SelectionOptions normalize(SelectionOptions options) {
    return options != null ? options : defaults();
  }

  public SelectionOptions withTrialsPerWorker(int trialsPerWorker) {
    return new SelectionOptions(trialsPerWorker, workers, baseSeed, timeBudgetMs);
  }

  public SelectionOptions withWorkers(int workers) {
    return new SelectionOptions(trialsPerWorker, workers, baseSeed, timeBudgetMs);
  }

  public SelectionOptions withBaseSeed(Long baseSeed) {
    return new SelectionOptions(trialsPerWorker, workers, baseSeed, timeBudgetMs);
  }

  public SelectionOptions withTimeBudgetMs(long timeBudgetMs) {
    return new SelectionOptions(trialsPerWorker, workers, baseSeed, timeBudgetMs);
  }

  public boolean hasTimeBudget() {
    return timeBudgetMs > 0;
  }
}

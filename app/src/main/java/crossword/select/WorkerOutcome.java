package crossword.select;

import crossword.generate.GenerationResult;

/**
 * Best trial of one worker's batch.
 *
 * @param best densest result of the batch, or {@code null} if no trial completed
 * @param bestSeed seed of the trial that produced {@code best}
 * @param stopReason why the batch ended before its full trial count, or {@code null}
 */
public record WorkerOutcome(
    int worker, GenerationResult best, long bestSeed, int trialsRun, String stopReason) {

  public boolean hasResult() {
    return best != null;
  }
}

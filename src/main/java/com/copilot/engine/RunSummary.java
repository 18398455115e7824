package com.copilot.engine;

/**
 * Outcome counts of one engine run.
 *
 * @param subjects      Subjects submitted
 * @param delivered     Records handed to the sink
 * @param timedOut      Subjects discarded after exceeding the timeout
 * @param cancelled     Subjects discarded because the run was cancelled
 * @param elapsedMillis Wall-clock duration
 */
public record RunSummary(int subjects, int delivered, int timedOut, int cancelled, long elapsedMillis) {

    public boolean isComplete() {
        return delivered == subjects;
    }
}

package com.copilot.engine;

/**
 * Receives decision records, one per subject, in subject order.
 * Called from a single thread.
 */
@FunctionalInterface
public interface ActionSink {

    /**
     * Accept the record of one fully evaluated subject.
     *
     * @param record Decision record
     */
    void accept(DecisionRecord record);
}

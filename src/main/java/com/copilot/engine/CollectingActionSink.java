package com.copilot.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sink that keeps every record in delivery order.
 */
public class CollectingActionSink implements ActionSink {

    private final List<DecisionRecord> records = new ArrayList<>();

    @Override
    public void accept(DecisionRecord record) {
        records.add(record);
    }

    public List<DecisionRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }
}

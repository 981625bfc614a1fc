package com.fuzzy.reconciliation.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory sink that keeps every event it receives. Thread-safe.
 */
public class CollectingOutputSink implements OutputSink {

    private final List<OutputEvent> events = Collections.synchronizedList(new ArrayList<>());
    private final List<String> batchIds = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onBatch(String batchId, List<OutputEvent> batch) {
        batchIds.add(batchId);
        events.addAll(batch);
    }

    public List<OutputEvent> getEvents() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public List<String> getBatchIds() {
        synchronized (batchIds) {
            return List.copyOf(batchIds);
        }
    }

    public void clear() {
        events.clear();
        batchIds.clear();
    }
}

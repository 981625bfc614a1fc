package com.fuzzy.reconciliation.output;

import java.util.List;

/**
 * Downstream consumer of output events. Called once per committed batch, in batch order,
 * from the thread that applied the batch.
 */
@FunctionalInterface
public interface OutputSink {

    /**
     * @param batchId id of the committed batch
     * @param events  events of the batch; may be empty
     */
    void onBatch(String batchId, List<OutputEvent> events);
}

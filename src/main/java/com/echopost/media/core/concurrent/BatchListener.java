package com.echopost.media.core.concurrent;

/**
 * Receives progress after each batch finishes. Called on the thread that runs the pass.
 */
@FunctionalInterface
public interface BatchListener {

    BatchListener NONE = (batchIndex, batchCount, emitted, dropped) -> { };

    /**
     * @param batchIndex zero-based index of the completed batch
     * @param emitted    items of this batch that produced a result
     * @param dropped    items of this batch that failed, timed out or produced nothing
     */
    void onBatchCompleted(int batchIndex, int batchCount, int emitted, int dropped);
}

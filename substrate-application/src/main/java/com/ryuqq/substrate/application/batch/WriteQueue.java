package com.ryuqq.substrate.application.batch;

import com.ryuqq.substrate.core.model.BatchedWritePayload;

/**
 * Asynchronous, batched persistence queue.
 *
 * <p>Every enqueued payload ends in exactly one of two states: persisted,
 * or marked failed (with its run item marked failed). Payloads are never dropped.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface WriteQueue {

    /**
     * Appends a payload; never blocks on I/O.
     *
     * @param payload the payload
     */
    void enqueue(BatchedWritePayload payload);

    /**
     * Waits until the queue and any in-flight batch are drained.
     *
     * @param timeoutMs maximum wait
     * @return true if drained before the timeout
     */
    boolean waitUntilEmpty(long timeoutMs);

    /**
     * Number of payloads waiting in the queue (excluding the in-flight batch).
     *
     * @return queue size
     */
    int pendingCount();
}

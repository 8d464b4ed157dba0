package com.ryuqq.substrate.core.spi;

import com.ryuqq.substrate.core.model.BatchedWritePayload;
import com.ryuqq.substrate.core.model.ItemId;

/**
 * A unit-of-work against the relational store, opened once per batch.
 *
 * <p>Transient contention is reported as {@link StorageContentionException};
 * any other {@link RuntimeException} is treated as a permanent failure of the payload.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface PersistenceSession extends AutoCloseable {

    /**
     * Stages a payload in the current transaction.
     *
     * @param payload the payload
     * @throws StorageContentionException on transient contention
     */
    void persist(BatchedWritePayload payload);

    /**
     * Stages a failure mark for the work-item row.
     *
     * @param itemId the item
     * @param reason failure reason
     */
    void markItemFailed(ItemId itemId, String reason);

    /**
     * Commits staged writes.
     *
     * @throws StorageContentionException on transient contention
     */
    void commit();

    /**
     * Discards staged writes.
     */
    void rollback();

    @Override
    void close();
}

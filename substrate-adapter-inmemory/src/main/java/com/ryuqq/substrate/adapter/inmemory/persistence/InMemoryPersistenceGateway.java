package com.ryuqq.substrate.adapter.inmemory.persistence;

import com.ryuqq.substrate.core.model.BatchedWritePayload;
import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.spi.PersistenceGateway;
import com.ryuqq.substrate.core.spi.PersistenceSession;
import com.ryuqq.substrate.core.spi.StorageContentionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link PersistenceGateway} simulating a transactional store.
 *
 * <p>Sessions stage writes; {@code commit} makes them visible through
 * {@link #getCommittedPayloads()} and {@link #getFailedItems()}; {@code rollback}
 * discards them.</p>
 *
 * <p><strong>Failure Injection:</strong></p>
 * <ul>
 *   <li>{@link #failPersistTransiently(ItemId, int)} - persist throws
 *       {@link StorageContentionException} for the next N attempts of an item</li>
 *   <li>{@link #failPersistPermanently(ItemId)} - persist always throws {@link IllegalStateException}</li>
 *   <li>{@link #failCommitsTransiently(int)} - the next N commits throw {@link StorageContentionException}</li>
 *   <li>{@link #failCommitsPermanently(int)} - the next N commits throw {@link IllegalStateException}</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class InMemoryPersistenceGateway implements PersistenceGateway {

    private final List<BatchedWritePayload> committedPayloads = new ArrayList<>();
    private final Map<ItemId, String> failedItems = new LinkedHashMap<>();
    private final ConcurrentHashMap<ItemId, AtomicInteger> transientPersistFailures = new ConcurrentHashMap<>();
    private final Map<ItemId, Boolean> permanentPersistFailures = new ConcurrentHashMap<>();
    private final AtomicInteger transientCommitFailures = new AtomicInteger();
    private final AtomicInteger permanentCommitFailures = new AtomicInteger();
    private final AtomicInteger sessionsOpened = new AtomicInteger();
    private final AtomicInteger commits = new AtomicInteger();
    private final AtomicInteger rollbacks = new AtomicInteger();

    @Override
    public PersistenceSession openSession() {
        sessionsOpened.incrementAndGet();
        return new InMemorySession();
    }

    public void failPersistTransiently(ItemId itemId, int times) {
        transientPersistFailures.put(itemId, new AtomicInteger(times));
    }

    public void failPersistPermanently(ItemId itemId) {
        permanentPersistFailures.put(itemId, Boolean.TRUE);
    }

    public void failCommitsTransiently(int times) {
        transientCommitFailures.set(times);
    }

    public void failCommitsPermanently(int times) {
        permanentCommitFailures.set(times);
    }

    public synchronized List<BatchedWritePayload> getCommittedPayloads() {
        return List.copyOf(committedPayloads);
    }

    /**
     * Returns committed ids of persisted payloads, in commit order.
     *
     * @return item ids
     */
    public synchronized List<ItemId> getCommittedItemIds() {
        List<ItemId> ids = new ArrayList<>();
        for (BatchedWritePayload payload : committedPayloads) {
            ids.add(payload.getItemId());
        }
        return ids;
    }

    public synchronized Map<ItemId, String> getFailedItems() {
        return Map.copyOf(failedItems);
    }

    public int getSessionsOpened() {
        return sessionsOpened.get();
    }

    public int getCommits() {
        return commits.get();
    }

    public int getRollbacks() {
        return rollbacks.get();
    }

    /**
     * Clears all state (for testing).
     */
    public synchronized void clear() {
        committedPayloads.clear();
        failedItems.clear();
        transientPersistFailures.clear();
        permanentPersistFailures.clear();
        transientCommitFailures.set(0);
        permanentCommitFailures.set(0);
        sessionsOpened.set(0);
        commits.set(0);
        rollbacks.set(0);
    }

    private synchronized void publish(List<BatchedWritePayload> payloads, Map<ItemId, String> failures) {
        committedPayloads.addAll(payloads);
        failedItems.putAll(failures);
    }

    private static boolean consume(AtomicInteger counter) {
        return counter != null && counter.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    private final class InMemorySession implements PersistenceSession {

        private final List<BatchedWritePayload> staged = new ArrayList<>();
        private final Map<ItemId, String> stagedFailures = new LinkedHashMap<>();
        private boolean closed;

        @Override
        public void persist(BatchedWritePayload payload) {
            ensureOpen();
            if (permanentPersistFailures.containsKey(payload.getItemId())) {
                throw new IllegalStateException("constraint violation for " + payload.getItemId());
            }
            if (consume(transientPersistFailures.get(payload.getItemId()))) {
                throw new StorageContentionException("database is locked");
            }
            staged.add(payload);
        }

        @Override
        public void markItemFailed(ItemId itemId, String reason) {
            ensureOpen();
            stagedFailures.put(itemId, reason);
        }

        @Override
        public void commit() {
            ensureOpen();
            if (consume(transientCommitFailures)) {
                throw new StorageContentionException("database is busy");
            }
            if (consume(permanentCommitFailures)) {
                throw new IllegalStateException("disk I/O error");
            }
            publish(staged, stagedFailures);
            commits.incrementAndGet();
            staged.clear();
            stagedFailures.clear();
        }

        @Override
        public void rollback() {
            ensureOpen();
            rollbacks.incrementAndGet();
            staged.clear();
            stagedFailures.clear();
        }

        @Override
        public void close() {
            closed = true;
            staged.clear();
            stagedFailures.clear();
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("session is closed");
            }
        }
    }
}

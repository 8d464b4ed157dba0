package com.ryuqq.substrate.adapter.inmemory.store;

import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.RunCounters;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.spi.ProgressStore;
import com.ryuqq.substrate.core.spi.SharedStoreException;
import com.ryuqq.substrate.core.statemachine.CounterDelta;
import com.ryuqq.substrate.core.statemachine.ItemState;
import com.ryuqq.substrate.core.statemachine.ItemTransition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link ProgressStore} for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>runs:</strong> ConcurrentHashMap&lt;RunId, RunRecord&gt; - counters and item map per run</li>
 * </ul>
 *
 * <p>Each mutation synchronizes on its {@code RunRecord}, so item state and counters of a
 * run always change together. Different runs never contend.</p>
 *
 * <p><strong>Failure Injection:</strong> {@link #setUnavailable(boolean)} makes every
 * operation throw {@link SharedStoreException}.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class InMemoryProgressStore implements ProgressStore {

    private final ConcurrentHashMap<RunId, RunRecord> runs = new ConcurrentHashMap<>();
    private final AtomicInteger batchCalls = new AtomicInteger();
    private volatile boolean unavailable;

    @Override
    public void seed(RunId runId, int total, long startEpochSeconds) {
        checkAvailable();
        RunRecord record = record(runId);
        synchronized (record) {
            record.counters = RunCounters.seeded(total, startEpochSeconds);
            record.items.clear();
            record.present = true;
        }
    }

    @Override
    public void seedWithItems(RunId runId, Collection<ItemId> itemIds, long startEpochSeconds) {
        checkAvailable();
        RunRecord record = record(runId);
        synchronized (record) {
            record.items.clear();
            for (ItemId itemId : itemIds) {
                record.items.put(itemId, ItemState.PENDING);
            }
            record.counters = RunCounters.seeded(record.items.size(), startEpochSeconds);
            record.present = true;
        }
    }

    @Override
    public boolean compareAndTransition(RunId runId, ItemId itemId, Set<ItemState> allowedFrom, ItemState target) {
        checkAvailable();
        RunRecord record = record(runId);
        synchronized (record) {
            ItemState current = record.items.getOrDefault(itemId, ItemState.PENDING);
            if (current == target || !allowedFrom.contains(current)) {
                return false;
            }
            record.items.put(itemId, target);
            record.counters = record.counters.apply(ItemTransition.delta(current, target));
            record.present = true;
            return true;
        }
    }

    @Override
    public int applyTransitions(RunId runId, Map<ItemId, ItemState> targets) {
        checkAvailable();
        batchCalls.incrementAndGet();
        RunRecord record = record(runId);
        synchronized (record) {
            CounterDelta net = CounterDelta.ZERO;
            int changed = 0;
            for (Map.Entry<ItemId, ItemState> entry : targets.entrySet()) {
                ItemState previous = record.items.getOrDefault(entry.getKey(), ItemState.PENDING);
                if (previous == entry.getValue()) {
                    continue;
                }
                net = net.plus(ItemTransition.delta(previous, entry.getValue()));
                record.items.put(entry.getKey(), entry.getValue());
                changed++;
            }
            record.counters = record.counters.apply(net);
            record.present = true;
            return changed;
        }
    }

    @Override
    public Optional<RunCounters> readCounters(RunId runId) {
        checkAvailable();
        RunRecord record = runs.get(runId);
        if (record == null) {
            return Optional.empty();
        }
        synchronized (record) {
            return record.present ? Optional.of(record.counters) : Optional.empty();
        }
    }

    @Override
    public void writeCounters(RunId runId, RunCounters counters) {
        checkAvailable();
        RunRecord record = record(runId);
        synchronized (record) {
            record.counters = counters;
            record.present = true;
        }
    }

    @Override
    public Optional<ItemState> readItemState(RunId runId, ItemId itemId) {
        checkAvailable();
        RunRecord record = runs.get(runId);
        if (record == null) {
            return Optional.empty();
        }
        synchronized (record) {
            return Optional.ofNullable(record.items.get(itemId));
        }
    }

    @Override
    public Map<ItemId, ItemState> readItems(RunId runId) {
        checkAvailable();
        RunRecord record = runs.get(runId);
        if (record == null) {
            return Map.of();
        }
        synchronized (record) {
            return new LinkedHashMap<>(record.items);
        }
    }

    @Override
    public Set<RunId> listRuns() {
        checkAvailable();
        return Set.copyOf(runs.keySet());
    }

    /**
     * Number of {@link #applyTransitions} calls so far (test helper).
     *
     * @return call count
     */
    public int getBatchCalls() {
        return batchCalls.get();
    }

    /**
     * Removes the item map of a run while keeping its counters (test helper).
     *
     * @param runId the run
     */
    public void dropItems(RunId runId) {
        RunRecord record = runs.get(runId);
        if (record != null) {
            synchronized (record) {
                record.items.clear();
            }
        }
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    /**
     * Clears all state (for testing).
     */
    public void clear() {
        runs.clear();
        batchCalls.set(0);
        unavailable = false;
    }

    private RunRecord record(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return runs.computeIfAbsent(runId, id -> new RunRecord());
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new SharedStoreException("progress store unavailable");
        }
    }

    private static final class RunRecord {
        private RunCounters counters = RunCounters.empty();
        private final Map<ItemId, ItemState> items = new LinkedHashMap<>();
        private boolean present;
    }
}

package com.ryuqq.substrate.core.spi;

import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.RunCounters;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.statemachine.ItemState;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared store SPI holding per-run counters and per-item states.
 *
 * <p><strong>Logical key schema:</strong></p>
 * <ul>
 *   <li>{@code run:{runId}:state} - hash of total/pending/processing/success/failed/start_ts</li>
 *   <li>{@code run:{runId}:items} - hash of itemId to state wire value</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> {@link #compareAndTransition} and {@link #applyTransitions}
 * must read item state and update both the item map and the counters as one atomic unit
 * (a server-side script or a transaction). An item absent from the map is {@link ItemState#PENDING}.
 * Decrements never take a counter below zero.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface ProgressStore {

    /**
     * Initialises counters for a run: {@code pending = total}, other counters zero.
     *
     * <p>Existing item states of the run are discarded.</p>
     *
     * @param runId the run
     * @param total number of items
     * @param startEpochSeconds start timestamp
     */
    void seed(RunId runId, int total, long startEpochSeconds);

    /**
     * Initialises counters and pre-registers every item as pending.
     *
     * @param runId the run
     * @param itemIds items of the run
     * @param startEpochSeconds start timestamp
     */
    void seedWithItems(RunId runId, Collection<ItemId> itemIds, long startEpochSeconds);

    /**
     * Atomically moves an item to {@code target} if its current state is one of {@code allowedFrom}.
     *
     * @param runId the run
     * @param itemId the item
     * @param allowedFrom states from which the transition applies
     * @param target new state
     * @return true if the transition was applied, false if it was a no-op
     */
    boolean compareAndTransition(RunId runId, ItemId itemId, Set<ItemState> allowedFrom, ItemState target);

    /**
     * Atomically applies a batch of last-write-wins target states for one run.
     *
     * <p>Reads each item's previous state, skips unchanged items, sums the counter deltas,
     * clamps each net decrement to the current counter value, then writes states and counters.</p>
     *
     * @param runId the run
     * @param targets item to target state
     * @return number of items whose state changed
     */
    int applyTransitions(RunId runId, Map<ItemId, ItemState> targets);

    /**
     * Reads the counters of a run.
     *
     * @param runId the run
     * @return counters, or empty if the run was never seeded or touched
     */
    Optional<RunCounters> readCounters(RunId runId);

    /**
     * Overwrites the counters of a run (reconciliation).
     *
     * @param runId the run
     * @param counters new counters
     */
    void writeCounters(RunId runId, RunCounters counters);

    /**
     * Reads the recorded state of one item.
     *
     * @param runId the run
     * @param itemId the item
     * @return the state, or empty if the item was never recorded
     */
    Optional<ItemState> readItemState(RunId runId, ItemId itemId);

    /**
     * Reads every recorded item state of a run.
     *
     * @param runId the run
     * @return item to state (empty if none)
     */
    Map<ItemId, ItemState> readItems(RunId runId);

    /**
     * Lists runs that have counters in the store.
     *
     * @return known run ids
     */
    Set<RunId> listRuns();
}

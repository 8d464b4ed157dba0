package com.ryuqq.substrate.application.progress;

import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.statemachine.ItemState;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Crash-safe, idempotent per-run progress ledger.
 *
 * <p>Every item transition adjusts the run aggregate by exactly one unit per touched
 * field, and repeating a transition is a no-op. Counters never go below zero.</p>
 *
 * <p><strong>Item Lifecycle:</strong></p>
 * <pre>
 * seed(run, total)
 *   ↓
 * markStarted(run, item)          PENDING → PROCESSING
 *   ↓
 * markFinished(run, item, ok)     PENDING | PROCESSING → SUCCESS | FAILED
 *   ↓ (optional)
 * markRestarted(run, item)        SUCCESS | FAILED → PROCESSING
 * </pre>
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>{@code StoreBackedProgressLedger} - every call is one atomic store operation</li>
 *   <li>{@code BufferedProgressLedger} - local mirror with batched flushes</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface ProgressTracker {

    /**
     * Initialises a run with {@code total} pending items.
     *
     * @param runId the run
     * @param total number of items
     */
    void seed(RunId runId, int total);

    /**
     * Initialises a run and pre-registers its items as pending.
     *
     * @param runId the run
     * @param itemIds the items
     */
    void seedWithItems(RunId runId, Collection<ItemId> itemIds);

    /**
     * Records that an item started processing. Applies only from PENDING (or absent).
     *
     * @param runId the run
     * @param itemId the item
     * @return the run snapshot after the call (unchanged if the transition did not apply)
     */
    ProgressSnapshot markStarted(RunId runId, ItemId itemId);

    /**
     * Records that an item finished. Applies only from PENDING (or absent) and PROCESSING.
     *
     * @param runId the run
     * @param itemId the item
     * @param ok true for success
     * @return the run snapshot after the call (unchanged if the transition did not apply)
     */
    ProgressSnapshot markFinished(RunId runId, ItemId itemId, boolean ok);

    /**
     * Moves a finished item back to PROCESSING for re-analysis.
     *
     * @param runId the run
     * @param itemId the item
     * @return the run snapshot after the call (unchanged if the transition did not apply)
     */
    ProgressSnapshot markRestarted(RunId runId, ItemId itemId);

    /**
     * Returns the display snapshot of a run.
     *
     * @param runId the run
     * @return the snapshot (NOT_STARTED with zero counts for unknown runs)
     */
    ProgressSnapshot snapshot(RunId runId);

    /**
     * Rebuilds the aggregate from item states and returns the new snapshot.
     *
     * <p>If no item states exist but the aggregate is non-zero, the aggregate is kept.</p>
     *
     * @param runId the run
     * @return the snapshot after reconciliation
     */
    ProgressSnapshot reconcile(RunId runId);

    /**
     * Groups the recorded items of a run by state.
     *
     * @param runId the run
     * @return state to items (every state present, possibly empty)
     */
    Map<ItemState, List<ItemId>> itemsByState(RunId runId);

    /**
     * Forces residual items in the given states to FAILED.
     *
     * @param runId the run
     * @param states states to settle (typically PENDING and PROCESSING)
     * @return the items that were moved to FAILED
     */
    List<ItemId> forceFinalize(RunId runId, Set<ItemState> states);

    /**
     * Returns snapshots of every known run.
     *
     * @return run to snapshot
     */
    Map<RunId, ProgressSnapshot> listSnapshots();

    /**
     * Pushes buffered transitions to the shared store. No-op for unbuffered ledgers.
     */
    default void flush() {
    }
}

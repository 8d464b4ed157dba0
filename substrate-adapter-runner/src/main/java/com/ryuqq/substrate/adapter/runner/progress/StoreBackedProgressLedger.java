package com.ryuqq.substrate.adapter.runner.progress;

import com.ryuqq.substrate.application.progress.ProgressTracker;
import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.model.RunCounters;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.spi.ProgressStore;
import com.ryuqq.substrate.core.statemachine.ItemState;
import com.ryuqq.substrate.core.statemachine.ItemTransition;
import com.ryuqq.substrate.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 공유 저장소 직접 호출 ProgressTracker 구현체.
 *
 * <p>모든 상태 전이는 {@link ProgressStore#compareAndTransition}
 * 한 번으로 원자적으로 적용됩니다. 중복 호출은 저장소에서 무시되므로
 * 카운터가 두 번 움직이지 않습니다.</p>
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>markStarted: PENDING → PROCESSING</li>
 *   <li>markFinished: PENDING | PROCESSING → SUCCESS | FAILED</li>
 *   <li>markRestarted: SUCCESS | FAILED → PROCESSING</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class StoreBackedProgressLedger implements ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(StoreBackedProgressLedger.class);

    private final ProgressStore store;
    private final TimeSource timeSource;

    /**
     * 생성자.
     *
     * @param store 진행 상태 저장소
     * @param timeSource 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StoreBackedProgressLedger(ProgressStore store, TimeSource timeSource) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.store = store;
        this.timeSource = timeSource;
    }

    @Override
    public void seed(RunId runId, int total) {
        requireRun(runId);
        if (total < 0) {
            throw new IllegalArgumentException("total cannot be negative (current: " + total + ")");
        }
        store.seed(runId, total, timeSource.currentEpochSecond());
    }

    @Override
    public void seedWithItems(RunId runId, Collection<ItemId> itemIds) {
        requireRun(runId);
        if (itemIds == null) {
            throw new IllegalArgumentException("itemIds cannot be null");
        }
        store.seedWithItems(runId, itemIds, timeSource.currentEpochSecond());
    }

    @Override
    public ProgressSnapshot markStarted(RunId runId, ItemId itemId) {
        return transition(runId, itemId, ItemTransition.STARTABLE, ItemState.PROCESSING);
    }

    @Override
    public ProgressSnapshot markFinished(RunId runId, ItemId itemId, boolean ok) {
        return transition(runId, itemId, ItemTransition.FINISHABLE, ItemState.finishedOf(ok));
    }

    @Override
    public ProgressSnapshot markRestarted(RunId runId, ItemId itemId) {
        return transition(runId, itemId, ItemTransition.RESTARTABLE, ItemState.PROCESSING);
    }

    @Override
    public ProgressSnapshot snapshot(RunId runId) {
        requireRun(runId);
        RunCounters counters = store.readCounters(runId).orElse(RunCounters.empty());
        return ProgressSnapshot.from(counters, timeSource.currentTimeMillis());
    }

    @Override
    public ProgressSnapshot reconcile(RunId runId) {
        requireRun(runId);
        Map<ItemId, ItemState> items = store.readItems(runId);
        RunCounters existing = store.readCounters(runId).orElse(RunCounters.empty());

        int pending = 0;
        int processing = 0;
        int success = 0;
        int failed = 0;
        for (ItemState state : items.values()) {
            switch (state) {
                case PENDING -> pending++;
                case PROCESSING -> processing++;
                case SUCCESS -> success++;
                case FAILED -> failed++;
                default -> throw new IllegalStateException("Unknown item state: " + state);
            }
        }
        int total = pending + processing + success + failed;

        RunCounters rebuilt;
        if (total == 0 && !existing.isBlank()) {
            rebuilt = existing;
            log.debug("Reconcile kept existing counters for {} (no item states)", runId);
        } else {
            rebuilt = new RunCounters(total, pending, processing, success, failed, existing.startEpochSeconds());
            if (!rebuilt.equals(existing)) {
                log.info("Reconciled {}: {} -> {}", runId, existing, rebuilt);
            }
        }
        store.writeCounters(runId, rebuilt);
        return ProgressSnapshot.from(rebuilt, timeSource.currentTimeMillis());
    }

    @Override
    public Map<ItemState, List<ItemId>> itemsByState(RunId runId) {
        requireRun(runId);
        Map<ItemState, List<ItemId>> grouped = new EnumMap<>(ItemState.class);
        for (ItemState state : ItemState.values()) {
            grouped.put(state, new ArrayList<>());
        }
        for (Map.Entry<ItemId, ItemState> entry : store.readItems(runId).entrySet()) {
            grouped.get(entry.getValue()).add(entry.getKey());
        }
        return grouped;
    }

    @Override
    public List<ItemId> forceFinalize(RunId runId, Set<ItemState> states) {
        requireRun(runId);
        if (states == null || states.isEmpty()) {
            return List.of();
        }
        Map<ItemId, ItemState> targets = new LinkedHashMap<>();
        for (Map.Entry<ItemId, ItemState> entry : store.readItems(runId).entrySet()) {
            if (states.contains(entry.getValue()) && !entry.getValue().isFinished()) {
                targets.put(entry.getKey(), ItemState.FAILED);
            }
        }
        if (targets.isEmpty()) {
            return List.of();
        }
        int changed = store.applyTransitions(runId, targets);
        log.info("Force-finalized {} items of {} to FAILED", changed, runId);
        return new ArrayList<>(targets.keySet());
    }

    @Override
    public Map<RunId, ProgressSnapshot> listSnapshots() {
        Map<RunId, ProgressSnapshot> snapshots = new LinkedHashMap<>();
        for (RunId runId : store.listRuns()) {
            snapshots.put(runId, snapshot(runId));
        }
        return snapshots;
    }

    private ProgressSnapshot transition(RunId runId, ItemId itemId, Set<ItemState> allowedFrom, ItemState target) {
        requireRun(runId);
        if (itemId == null) {
            throw new IllegalArgumentException("itemId cannot be null");
        }
        boolean applied = store.compareAndTransition(runId, itemId, allowedFrom, target);
        if (!applied) {
            log.debug("Transition to {} ignored for {} in {}", target, itemId, runId);
        }
        return snapshot(runId);
    }

    private static void requireRun(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
    }
}

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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 로컬 미러 + 배치 flush 방식의 ProgressTracker 구현체.
 *
 * <p>상태 전이는 먼저 워커 로컬 미러에 적용되고(카운터는 0 미만으로 내려가지 않음)
 * 큐에 쌓인 뒤, 일정 개수 또는 일정 시간이 지나면 Run 단위로 묶여
 * {@link ProgressStore#applyTransitions} 한 번으로 저장소에 반영됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * markFinished(run, item, ok)
 *   ↓
 * 로컬 미러 준비 (없으면 저장소 카운터로 시드)
 *   ↓
 * 이전 상태 확인 (로컬 → 저장소 → PENDING)
 *   ↓
 * 허용된 전이면 로컬 적용 + 큐 적재
 *   ↓
 * 큐 크기 ≥ flushSize 또는 경과 ≥ flushIntervalMs → flush()
 *   ↓
 * flush: Run별 그룹화 (같은 Item은 마지막 상태 우선) → applyTransitions
 * </pre>
 *
 * <p>flush가 실패하면 해당 Run의 전이는 큐 앞쪽에 남아 다음 flush에서 재시도됩니다.
 * 조회 계열 연산(snapshot, reconcile 등)은 먼저 flush한 뒤 저장소를 기준으로 동작합니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class BufferedProgressLedger implements ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(BufferedProgressLedger.class);

    private final ProgressStore store;
    private final StoreBackedProgressLedger direct;
    private final CounterBufferConfig config;
    private final TimeSource timeSource;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<RunId, RunCounters> mirror = new HashMap<>();
    private final Map<RunId, Map<ItemId, ItemState>> localItems = new HashMap<>();
    private final List<QueuedTransition> queue = new ArrayList<>();
    private long lastFlushMillis;

    /**
     * 생성자.
     *
     * @param store 진행 상태 저장소
     * @param config 버퍼 설정
     * @param timeSource 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BufferedProgressLedger(ProgressStore store, CounterBufferConfig config, TimeSource timeSource) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.store = store;
        this.direct = new StoreBackedProgressLedger(store, timeSource);
        this.config = config;
        this.timeSource = timeSource;
        this.lastFlushMillis = timeSource.currentTimeMillis();
    }

    @Override
    public void seed(RunId runId, int total) {
        direct.seed(runId, total);
        resetLocal(runId);
    }

    @Override
    public void seedWithItems(RunId runId, Collection<ItemId> itemIds) {
        direct.seedWithItems(runId, itemIds);
        resetLocal(runId);
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

    /**
     * 스냅샷 조회. 대기 중인 전이를 먼저 flush합니다.
     *
     * <p>저장소를 읽을 수 없으면 로컬 미러 기준 스냅샷을 반환합니다.</p>
     */
    @Override
    public ProgressSnapshot snapshot(RunId runId) {
        flush();
        try {
            return direct.snapshot(runId);
        } catch (RuntimeException e) {
            log.warn("Failed to read counters for {}, using local mirror", runId, e);
            return localSnapshot(runId);
        }
    }

    @Override
    public ProgressSnapshot reconcile(RunId runId) {
        flush();
        ProgressSnapshot snapshot = direct.reconcile(runId);
        forget(runId);
        return snapshot;
    }

    @Override
    public Map<ItemState, List<ItemId>> itemsByState(RunId runId) {
        flush();
        return direct.itemsByState(runId);
    }

    @Override
    public List<ItemId> forceFinalize(RunId runId, Set<ItemState> states) {
        flush();
        List<ItemId> finalized = direct.forceFinalize(runId, states);
        forget(runId);
        return finalized;
    }

    @Override
    public Map<RunId, ProgressSnapshot> listSnapshots() {
        flush();
        return direct.listSnapshots();
    }

    /**
     * 대기 중인 전이를 저장소에 반영.
     *
     * <p>flush는 버퍼 lock을 잡은 채 수행되어 같은 Item의 전이가 순서대로 반영됩니다.
     * 실패한 Run의 전이는 큐 앞쪽으로 되돌려 다음 flush에서 재시도합니다.
     * 예외를 전파하지 않습니다.</p>
     */
    @Override
    public void flush() {
        lock.lock();
        try {
            lastFlushMillis = timeSource.currentTimeMillis();
            if (queue.isEmpty()) {
                return;
            }
            List<QueuedTransition> drained = new ArrayList<>(queue);
            queue.clear();

            Map<RunId, Map<ItemId, ItemState>> grouped = new LinkedHashMap<>();
            for (QueuedTransition transition : drained) {
                grouped.computeIfAbsent(transition.runId(), k -> new LinkedHashMap<>())
                    .put(transition.itemId(), transition.target());
            }

            List<QueuedTransition> failed = new ArrayList<>();
            for (Map.Entry<RunId, Map<ItemId, ItemState>> entry : grouped.entrySet()) {
                try {
                    int changed = store.applyTransitions(entry.getKey(), entry.getValue());
                    log.debug("Flushed {} transitions ({} changed) for {}",
                        entry.getValue().size(), changed, entry.getKey());
                } catch (RuntimeException e) {
                    log.warn("Counter flush failed for {}, keeping {} transitions buffered",
                        entry.getKey(), entry.getValue().size(), e);
                    for (QueuedTransition transition : drained) {
                        if (transition.runId().equals(entry.getKey())) {
                            failed.add(transition);
                        }
                    }
                }
            }
            queue.addAll(0, failed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run의 로컬 미러를 제거. 다음 전이 시 저장소에서 다시 시드됩니다.
     *
     * @param runId Run ID
     */
    public void forget(RunId runId) {
        lock.lock();
        try {
            mirror.remove(runId);
            localItems.remove(runId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * flush 대기 중인 전이 수.
     *
     * @return 큐 크기
     */
    public int pendingTransitions() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private ProgressSnapshot transition(RunId runId, ItemId itemId, Set<ItemState> allowedFrom, ItemState target) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (itemId == null) {
            throw new IllegalArgumentException("itemId cannot be null");
        }

        RunCounters seedCounters = needsMirror(runId) ? loadCounters(runId) : null;
        ItemState storedState = needsItem(runId, itemId) ? loadItemState(runId, itemId) : null;

        boolean shouldFlush;
        ProgressSnapshot snapshot;
        lock.lock();
        try {
            if (seedCounters != null) {
                mirror.putIfAbsent(runId, seedCounters);
            }
            Map<ItemId, ItemState> items = localItems.computeIfAbsent(runId, k -> new HashMap<>());
            if (storedState != null) {
                items.putIfAbsent(itemId, storedState);
            }
            ItemState previous = items.getOrDefault(itemId, ItemState.PENDING);

            if (previous != target && allowedFrom.contains(previous)) {
                items.put(itemId, target);
                RunCounters current = mirror.getOrDefault(runId, RunCounters.empty());
                mirror.put(runId, current.apply(ItemTransition.delta(previous, target)));
                queue.add(new QueuedTransition(runId, itemId, target));
            }

            long now = timeSource.currentTimeMillis();
            shouldFlush = queue.size() >= config.flushSize()
                || (!queue.isEmpty() && now - lastFlushMillis >= config.flushIntervalMs());
            snapshot = ProgressSnapshot.from(mirror.getOrDefault(runId, RunCounters.empty()), now);
        } finally {
            lock.unlock();
        }

        if (shouldFlush) {
            flush();
        }
        return snapshot;
    }

    private ProgressSnapshot localSnapshot(RunId runId) {
        lock.lock();
        try {
            RunCounters counters = mirror.getOrDefault(runId, RunCounters.empty());
            return ProgressSnapshot.from(counters, timeSource.currentTimeMillis());
        } finally {
            lock.unlock();
        }
    }

    private void resetLocal(RunId runId) {
        lock.lock();
        try {
            queue.removeIf(transition -> transition.runId().equals(runId));
            localItems.remove(runId);
            mirror.remove(runId);
        } finally {
            lock.unlock();
        }
    }

    private boolean needsMirror(RunId runId) {
        lock.lock();
        try {
            return !mirror.containsKey(runId);
        } finally {
            lock.unlock();
        }
    }

    private boolean needsItem(RunId runId, ItemId itemId) {
        lock.lock();
        try {
            Map<ItemId, ItemState> items = localItems.get(runId);
            return items == null || !items.containsKey(itemId);
        } finally {
            lock.unlock();
        }
    }

    private RunCounters loadCounters(RunId runId) {
        try {
            Optional<RunCounters> counters = store.readCounters(runId);
            return counters.orElse(RunCounters.empty());
        } catch (RuntimeException e) {
            log.debug("Failed to seed local mirror for {}", runId, e);
            return RunCounters.empty();
        }
    }

    private ItemState loadItemState(RunId runId, ItemId itemId) {
        try {
            return store.readItemState(runId, itemId).orElse(ItemState.PENDING);
        } catch (RuntimeException e) {
            log.debug("Failed to read state of {} in {}", itemId, runId, e);
            return ItemState.PENDING;
        }
    }

    private record QueuedTransition(RunId runId, ItemId itemId, ItemState target) {
    }
}

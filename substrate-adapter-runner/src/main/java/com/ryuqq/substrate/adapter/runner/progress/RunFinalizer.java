package com.ryuqq.substrate.adapter.runner.progress;

import com.ryuqq.substrate.adapter.runner.event.SafeEventPublisher;
import com.ryuqq.substrate.application.progress.ProgressTracker;
import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.statemachine.ItemState;
import com.ryuqq.substrate.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 정체된 Run 정리 컴포넌트.
 *
 * <p>워커가 중단되어 PENDING/PROCESSING 상태로 남은 Item 때문에
 * 영원히 완료되지 않는 Run을 강제로 마무리합니다.</p>
 *
 * <p><strong>정리 시나리오:</strong></p>
 * <pre>
 * 1. 워커가 markStarted(run, item) 후 크래시
 *    → Item이 PROCESSING 상태로 남음
 * 2. RunFinalizer가 주기적으로 scan() 실행
 * 3. 처리 완료 수가 staleAfterMs 동안 변하지 않은 미완료 Run 발견
 * 4. 잔여 Item → FAILED, reconcile, run_complete 이벤트 발행
 * </pre>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>이미 완료된 Run은 건너뜀</li>
 *   <li>개별 Run 처리 중 예외가 발생해도 다음 Run을 계속 처리</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class RunFinalizer {

    private static final Logger log = LoggerFactory.getLogger(RunFinalizer.class);
    private static final Set<ItemState> RESIDUAL_STATES = EnumSet.of(ItemState.PENDING, ItemState.PROCESSING);

    private final ProgressTracker ledger;
    private final SafeEventPublisher events;
    private final RunFinalizerConfig config;
    private final TimeSource timeSource;
    private final ConcurrentMap<RunId, Observation> observations = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param ledger 진행 장부
     * @param events 이벤트 발행기
     * @param config 설정
     * @param timeSource 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RunFinalizer(
        ProgressTracker ledger,
        SafeEventPublisher events,
        RunFinalizerConfig config,
        TimeSource timeSource
    ) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.ledger = ledger;
        this.events = events;
        this.config = config;
        this.timeSource = timeSource;
    }

    /**
     * 정체된 Run 스캔 및 정리.
     *
     * <p>주기적으로 호출되어야 합니다. 처음 관측된 Run은 관측 시각만 기록하고,
     * 이후 처리 완료 수가 staleAfterMs 동안 변하지 않으면 정리 대상이 됩니다.</p>
     *
     * @return 정리된 Run 수
     */
    public int scan() {
        log.info("RunFinalizer scan started");

        Map<RunId, ProgressSnapshot> snapshots;
        try {
            snapshots = ledger.listSnapshots();
        } catch (RuntimeException e) {
            log.error("RunFinalizer failed to list runs", e);
            return 0;
        }

        long now = timeSource.currentTimeMillis();
        int finalized = 0;
        int candidates = 0;
        for (Map.Entry<RunId, ProgressSnapshot> entry : snapshots.entrySet()) {
            RunId runId = entry.getKey();
            ProgressSnapshot snapshot = entry.getValue();
            if (snapshot.isComplete() || snapshot.total() == 0) {
                observations.remove(runId);
                continue;
            }
            if (!isStale(runId, snapshot.processed(), now)) {
                continue;
            }
            candidates++;
            if (candidates > config.batchSize()) {
                break;
            }
            if (tryFinalize(runId)) {
                finalized++;
            }
        }
        observations.keySet().retainAll(snapshots.keySet());

        log.info("RunFinalizer scan completed: {} finalized out of {} runs", finalized, snapshots.size());
        return finalized;
    }

    /**
     * 단일 Run 강제 정리.
     *
     * @param runId Run ID
     * @return 정리 후 스냅샷
     */
    public ProgressSnapshot finalizeRun(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        List<ItemId> settled = ledger.forceFinalize(runId, RESIDUAL_STATES);
        ProgressSnapshot snapshot = ledger.reconcile(runId);
        observations.remove(runId);

        events.publishRunComplete(runId, snapshot);
        log.info("RunFinalizer finalized {}: {} residual items failed, status={}",
            runId, settled.size(), snapshot.status().wireValue());
        return snapshot;
    }

    private boolean tryFinalize(RunId runId) {
        try {
            finalizeRun(runId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to finalize {} in RunFinalizer scan", runId, e);
            return false;
        }
    }

    private boolean isStale(RunId runId, int processed, long now) {
        Observation previous = observations.get(runId);
        if (previous == null || previous.processed() != processed) {
            observations.put(runId, new Observation(processed, now));
            return false;
        }
        return now - previous.observedAtMillis() >= config.staleAfterMs();
    }

    private record Observation(int processed, long observedAtMillis) {
    }
}

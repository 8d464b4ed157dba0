package com.ryuqq.substrate.adapter.runner.progress;

import com.ryuqq.substrate.adapter.inmemory.event.InMemoryEventSink;
import com.ryuqq.substrate.adapter.inmemory.store.InMemoryProgressStore;
import com.ryuqq.substrate.adapter.inmemory.time.ManualTimeSource;
import com.ryuqq.substrate.adapter.runner.event.SafeEventPublisher;
import com.ryuqq.substrate.application.progress.ProgressTracker;
import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.model.RunCounters;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.spi.SharedStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RunFinalizer 테스트.
 *
 * <p>RunFinalizer의 복구 동작을 검증합니다:</p>
 * <ul>
 *   <li>처리 수가 staleAfter 동안 변하지 않은 Run만 종료</li>
 *   <li>잔여 PENDING/PROCESSING 항목 FAILED 처리 후 카운터 재계산</li>
 *   <li>run_complete 이벤트 발행</li>
 *   <li>한 Run의 실패가 스캔 전체를 중단시키지 않음</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RunFinalizerTest {

    private static final long STALE_AFTER = 1_800_000L;
    private static final RunId RUN = RunId.of("run-1");

    private ManualTimeSource time;
    private InMemoryProgressStore store;
    private StoreBackedProgressLedger ledger;
    private InMemoryEventSink sink;
    private RunFinalizer finalizer;

    @Mock
    private ProgressTracker mockLedger;

    @BeforeEach
    void setUp() {
        time = new ManualTimeSource(1_700_000_000_000L);
        store = new InMemoryProgressStore();
        ledger = new StoreBackedProgressLedger(store, time);
        sink = new InMemoryEventSink();
        finalizer = new RunFinalizer(ledger, new SafeEventPublisher(sink), new RunFinalizerConfig(), time);
    }

    private void seedRun(RunId runId, int items) {
        List<ItemId> ids = new ArrayList<>();
        for (int i = 1; i <= items; i++) {
            ids.add(ItemId.of(i));
        }
        ledger.seedWithItems(runId, ids);
    }

    // ============================================================
    // 1. 정체 판정
    // ============================================================

    @Test
    void scan_처음_관측한_Run은_종료하지_않음() {
        // given
        seedRun(RUN, 3);

        // when
        int finalized = finalizer.scan();

        // then
        assertThat(finalized).isZero();
        assertThat(sink.eventsOfType(SafeEventPublisher.RUN_COMPLETE)).isEmpty();
    }

    @Test
    void scan_staleAfter_동안_진행이_없으면_잔여_항목을_실패_처리() {
        // given
        seedRun(RUN, 3);
        ledger.markFinished(RUN, ItemId.of(1), true);
        ledger.markStarted(RUN, ItemId.of(2));
        finalizer.scan();
        time.advance(STALE_AFTER);

        // when
        int finalized = finalizer.scan();

        // then
        assertThat(finalized).isEqualTo(1);
        ProgressSnapshot snapshot = ledger.snapshot(RUN);
        assertThat(snapshot.success()).isEqualTo(1);
        assertThat(snapshot.failed()).isEqualTo(2);
        assertThat(snapshot.isComplete()).isTrue();

        List<InMemoryEventSink.PublishedEvent> events = sink.eventsOfType(SafeEventPublisher.RUN_COMPLETE);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).scope()).isEqualTo(SafeEventPublisher.GLOBAL_SCOPE);
        assertThat(events.get(0).data())
            .containsEntry("run_id", "run-1")
            .containsEntry("failed", 2)
            .containsEntry("status", "completed");
    }

    @Test
    void scan_관측_사이에_진행이_있으면_타이머_초기화() {
        // given
        seedRun(RUN, 3);
        finalizer.scan();
        time.advance(STALE_AFTER - 1);
        ledger.markFinished(RUN, ItemId.of(1), true);
        finalizer.scan();
        time.advance(STALE_AFTER - 1);

        // when
        int finalized = finalizer.scan();

        // then
        assertThat(finalized).isZero();
        assertThat(ledger.snapshot(RUN).failed()).isZero();
    }

    @Test
    void scan_완료된_Run과_빈_Run은_건너뜀() {
        // given
        seedRun(RUN, 1);
        ledger.markFinished(RUN, ItemId.of(1), true);
        ledger.seed(RunId.of("empty"), 0);
        finalizer.scan();
        time.advance(STALE_AFTER);

        // when
        int finalized = finalizer.scan();

        // then
        assertThat(finalized).isZero();
        assertThat(sink.getEvents()).isEmpty();
    }

    @Test
    void scan_batchSize를_넘는_Run은_다음_스캔으로_미룸() {
        // given
        RunFinalizer limited = new RunFinalizer(ledger, new SafeEventPublisher(sink),
            new RunFinalizerConfig().withBatchSize(1), time);
        seedRun(RunId.of("run-a"), 2);
        seedRun(RunId.of("run-b"), 2);
        limited.scan();
        time.advance(STALE_AFTER);

        // when
        int first = limited.scan();
        int second = limited.scan();

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(1);
        assertThat(sink.eventsOfType(SafeEventPublisher.RUN_COMPLETE)).hasSize(2);
    }

    // ============================================================
    // 2. 오류 격리
    // ============================================================

    @Test
    void scan_한_Run_종료_실패해도_다음_Run_계속_진행() {
        // given
        RunId broken = RunId.of("broken");
        RunId healthy = RunId.of("healthy");
        ProgressSnapshot stuck = ProgressSnapshot.from(new RunCounters(2, 1, 0, 1, 0, 0L), time.currentTimeMillis());
        Map<RunId, ProgressSnapshot> snapshots = new LinkedHashMap<>();
        snapshots.put(broken, stuck);
        snapshots.put(healthy, stuck);
        when(mockLedger.listSnapshots()).thenReturn(snapshots);
        when(mockLedger.forceFinalize(eq(broken), any())).thenThrow(new SharedStoreException("down"));
        when(mockLedger.forceFinalize(eq(healthy), any())).thenReturn(List.of(ItemId.of(2)));
        when(mockLedger.reconcile(healthy)).thenReturn(
            ProgressSnapshot.from(new RunCounters(2, 0, 0, 1, 1, 0L), time.currentTimeMillis()));

        RunFinalizer mocked = new RunFinalizer(mockLedger, new SafeEventPublisher(sink), new RunFinalizerConfig(), time);
        mocked.scan();
        time.advance(STALE_AFTER);

        // when
        int finalized = mocked.scan();

        // then
        assertThat(finalized).isEqualTo(1);
        verify(mockLedger, never()).reconcile(broken);
        verify(mockLedger).reconcile(healthy);
    }

    @Test
    void scan_Run_목록_조회_실패시_0_반환() {
        // given
        when(mockLedger.listSnapshots()).thenThrow(new SharedStoreException("down"));
        RunFinalizer mocked = new RunFinalizer(mockLedger, new SafeEventPublisher(sink), new RunFinalizerConfig(), time);

        // when
        int finalized = mocked.scan();

        // then
        assertThat(finalized).isZero();
    }

    // ============================================================
    // 3. 수동 종료
    // ============================================================

    @Test
    void finalizeRun_즉시_종료하고_이벤트_발행() {
        // given
        seedRun(RUN, 4);
        ledger.markFinished(RUN, ItemId.of(1), true);

        // when
        ProgressSnapshot snapshot = finalizer.finalizeRun(RUN);

        // then
        assertThat(snapshot.success()).isEqualTo(1);
        assertThat(snapshot.failed()).isEqualTo(3);
        assertThat(snapshot.isComplete()).isTrue();
        assertThat(sink.eventsOfType(SafeEventPublisher.RUN_COMPLETE).get(0).data())
            .containsEntry("message", "Run completed");
    }
}

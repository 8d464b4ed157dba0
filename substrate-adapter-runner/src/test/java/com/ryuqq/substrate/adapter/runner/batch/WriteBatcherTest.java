package com.ryuqq.substrate.adapter.runner.batch;

import com.ryuqq.substrate.adapter.inmemory.event.InMemoryEventSink;
import com.ryuqq.substrate.adapter.inmemory.persistence.InMemoryPersistenceGateway;
import com.ryuqq.substrate.adapter.inmemory.store.InMemoryProgressStore;
import com.ryuqq.substrate.adapter.inmemory.time.ManualTimeSource;
import com.ryuqq.substrate.adapter.runner.event.SafeEventPublisher;
import com.ryuqq.substrate.adapter.runner.progress.StoreBackedProgressLedger;
import com.ryuqq.substrate.core.model.BatchedWritePayload;
import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.spi.PersistenceGateway;
import com.ryuqq.substrate.core.time.SystemTimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * WriteBatcher 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>maxBatch / chunkSize 단위 커밋과 커밋 후 성공 기록</li>
 *   <li>잠금 경합 시 payload 재큐잉 (유실 없음)</li>
 *   <li>영구 오류 시 실패 표시와 analysis_failed 이벤트</li>
 *   <li>커밋 경합 재시도 및 소진 시 재큐잉, 재적재 상한 초과 시 실패 처리</li>
 *   <li>Run 마지막 Item 처리 시 장부 flush와 run_complete 발행</li>
 *   <li>백그라운드 루프와 waitUntilEmpty</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WriteBatcherTest {

    private static final RunId RUN = RunId.of("run-1");

    private ManualTimeSource time;
    private InMemoryProgressStore progressStore;
    private StoreBackedProgressLedger ledger;
    private InMemoryPersistenceGateway persistence;
    private InMemoryEventSink sink;

    @Mock
    private PersistenceGateway flakyGateway;

    @BeforeEach
    void setUp() {
        time = new ManualTimeSource(1_700_000_000_000L);
        progressStore = new InMemoryProgressStore();
        ledger = new StoreBackedProgressLedger(progressStore, time);
        persistence = new InMemoryPersistenceGateway();
        sink = new InMemoryEventSink();
    }

    private WriteBatcher batcher(WriteBatcherConfig config) {
        return new WriteBatcher(persistence, ledger, new SafeEventPublisher(sink), config, time, new Random(5));
    }

    private List<ItemId> seedAndEnqueue(WriteBatcher batcher, int count) {
        List<ItemId> ids = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            ids.add(ItemId.of(i));
        }
        ledger.seedWithItems(RUN, ids);
        for (ItemId id : ids) {
            batcher.enqueue(BatchedWritePayload.of(RUN, id, Map.of("summary", "item " + id.getValue())));
        }
        return ids;
    }

    // ============================================================
    // 1. 정상 커밋
    // ============================================================

    @Test
    void drainNow_chunkSize마다_커밋하고_성공을_장부에_기록() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        List<ItemId> ids = seedAndEnqueue(batcher, 70);

        // when
        int batches = batcher.drainNow();

        // then
        assertThat(batches).isEqualTo(1);
        assertThat(persistence.getCommits()).isEqualTo(3);
        assertThat(persistence.getCommittedItemIds()).containsExactlyElementsOf(ids);
        ProgressSnapshot snapshot = ledger.snapshot(RUN);
        assertThat(snapshot.success()).isEqualTo(70);
        assertThat(snapshot.isComplete()).isTrue();
        assertThat(batcher.pendingCount()).isZero();
    }

    @Test
    void drainNow_maxBatch_단위로_나누어_처리() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig().withMaxBatch(2));
        seedAndEnqueue(batcher, 5);

        // when
        int batches = batcher.drainNow();

        // then
        assertThat(batches).isEqualTo(3);
        assertThat(persistence.getCommittedItemIds()).hasSize(5);
    }

    @Test
    void markFinishedOnCommit_비활성화시_장부를_건드리지_않음() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig().withMarkFinishedOnCommit(false));
        seedAndEnqueue(batcher, 3);

        // when
        batcher.drainNow();

        // then
        assertThat(persistence.getCommittedItemIds()).hasSize(3);
        assertThat(ledger.snapshot(RUN).success()).isZero();
    }

    @Test
    void 마지막_Item_커밋시_run_complete_발행() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        seedAndEnqueue(batcher, 2);

        // when
        batcher.drainNow();

        // then
        assertThat(sink.eventsOfType(SafeEventPublisher.RUN_COMPLETE)).singleElement()
            .satisfies(e -> {
                assertThat(e.scope()).isEqualTo(SafeEventPublisher.GLOBAL_SCOPE);
                assertThat(e.data())
                    .containsEntry("run_id", "run-1")
                    .containsEntry("success", 2)
                    .containsEntry("status", "completed")
                    .containsEntry("message", "All tasks completed");
            });
    }

    @Test
    void 미완료_Run은_run_complete_발행하지_않음() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        ledger.seed(RUN, 3);
        batcher.enqueue(BatchedWritePayload.of(RUN, ItemId.of(1), Map.of("summary", "first")));

        // when
        batcher.drainNow();

        // then
        assertThat(ledger.snapshot(RUN).processed()).isEqualTo(1);
        assertThat(sink.eventsOfType(SafeEventPublisher.RUN_COMPLETE)).isEmpty();
    }

    @Test
    void 마지막_Item_실패시에도_run_complete_발행() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        seedAndEnqueue(batcher, 2);
        persistence.failCommitsPermanently(1);

        // when
        batcher.drainNow();

        // then
        assertThat(sink.eventsOfType("analysis_failed")).hasSize(2);
        assertThat(sink.eventsOfType(SafeEventPublisher.RUN_COMPLETE)).singleElement()
            .satisfies(e -> assertThat(e.data())
                .containsEntry("failed", 2)
                .containsEntry("message", "Run completed with failures"));
    }

    @Test
    void Run에_속하지_않은_payload도_커밋() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        batcher.enqueue(BatchedWritePayload.standalone(ItemId.of(99), Map.of("k", "v")));

        // when
        batcher.drainNow();

        // then
        assertThat(persistence.getCommittedItemIds()).containsExactly(ItemId.of(99));
        assertThat(progressStore.listRuns()).isEmpty();
    }

    // ============================================================
    // 2. Persist 오류
    // ============================================================

    @Test
    void persist_잠금_경합은_재큐잉되어_결국_커밋() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        seedAndEnqueue(batcher, 3);
        persistence.failPersistTransiently(ItemId.of(1), 2);

        // when
        batcher.drainNow();

        // then
        assertThat(persistence.getCommittedItemIds())
            .containsExactlyInAnyOrder(ItemId.of(1), ItemId.of(2), ItemId.of(3));
        assertThat(persistence.getFailedItems()).isEmpty();
        assertThat(time.getSleepCalls()).isGreaterThanOrEqualTo(2);
        assertThat(ledger.snapshot(RUN).success()).isEqualTo(3);
    }

    @Test
    void persist_경합_재큐잉_한도_초과시_실패_처리() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig().withMaxContentionRequeues(2));
        seedAndEnqueue(batcher, 2);
        persistence.failPersistTransiently(ItemId.of(1), 10);

        // when
        batcher.drainNow();

        // then
        assertThat(persistence.getCommittedItemIds()).containsExactly(ItemId.of(2));
        assertThat(persistence.getFailedItems()).containsEntry(ItemId.of(1), "database is locked");
        ProgressSnapshot snapshot = ledger.snapshot(RUN);
        assertThat(snapshot.failed()).isEqualTo(1);
        assertThat(snapshot.success()).isEqualTo(1);
    }

    @Test
    void persist_영구_오류는_실패_표시와_analysis_failed_이벤트() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        seedAndEnqueue(batcher, 3);
        persistence.failPersistPermanently(ItemId.of(2));

        // when
        batcher.drainNow();

        // then
        assertThat(persistence.getCommittedItemIds()).containsExactly(ItemId.of(1), ItemId.of(3));
        assertThat(persistence.getFailedItems()).containsKey(ItemId.of(2));
        assertThat(sink.eventsOfType("analysis_failed")).singleElement()
            .satisfies(e -> {
                assertThat(e.scope()).isEqualTo(SafeEventPublisher.GLOBAL_SCOPE);
                assertThat(e.data())
                    .containsEntry("message", "Task failed")
                    .containsEntry("run_id", "run-1")
                    .containsEntry("failed", 1);
            });
        assertThat(ledger.snapshot(RUN).failed()).isEqualTo(1);
    }

    // ============================================================
    // 3. Commit 오류
    // ============================================================

    @Test
    void commit_일시_경합은_재시도_후_한번만_커밋() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        seedAndEnqueue(batcher, 4);
        persistence.failCommitsTransiently(2);

        // when
        batcher.drainNow();

        // then
        assertThat(persistence.getRollbacks()).isEqualTo(2);
        assertThat(persistence.getCommits()).isEqualTo(1);
        assertThat(persistence.getCommittedItemIds()).hasSize(4).doesNotHaveDuplicates();
        assertThat(ledger.snapshot(RUN).success()).isEqualTo(4);
    }

    @Test
    void commit_경합_재시도_소진시_payload를_재큐잉하여_유실_없음() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig().withCommitRetries(3));
        seedAndEnqueue(batcher, 4);
        persistence.failCommitsTransiently(3);

        // when
        int batches = batcher.drainNow();

        // then
        assertThat(batches).isEqualTo(2);
        assertThat(persistence.getRollbacks()).isEqualTo(3);
        assertThat(persistence.getCommittedItemIds()).hasSize(4).doesNotHaveDuplicates();
        assertThat(ledger.snapshot(RUN).success()).isEqualTo(4);
    }

    @Test
    void commit_경합_재적재_한도_초과시_실패_처리() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig()
            .withCommitRetries(1)
            .withMaxContentionRequeues(2));
        seedAndEnqueue(batcher, 1);
        persistence.failCommitsTransiently(3);

        // when
        int batches = batcher.drainNow();

        // then
        assertThat(batches).isEqualTo(3);
        assertThat(persistence.getCommittedItemIds()).isEmpty();
        assertThat(persistence.getFailedItems()).containsEntry(ItemId.of(1), "database is busy");
        assertThat(ledger.snapshot(RUN).failed()).isEqualTo(1);
        assertThat(sink.eventsOfType("analysis_failed")).hasSize(1);
    }

    @Test
    void commit_경합이_계속되어도_재적재는_상한에서_멈춤() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig()
            .withCommitRetries(1)
            .withMaxContentionRequeues(2));
        seedAndEnqueue(batcher, 1);
        persistence.failCommitsTransiently(20);

        // when
        int batches = batcher.drainNow();

        // then
        assertThat(batches).isEqualTo(3);
        assertThat(persistence.getCommittedItemIds()).isEmpty();
        assertThat(batcher.pendingCount()).isZero();
        assertThat(batcher.trackedContentionCount()).isZero();
        assertThat(ledger.snapshot(RUN).failed()).isEqualTo(1);
    }

    @Test
    void 경합_후_커밋된_payload는_재적재_횟수가_초기화됨() {
        // given: persist 경합 2회로 한도까지 집계된 payload
        WriteBatcher batcher = batcher(new WriteBatcherConfig()
            .withCommitRetries(1)
            .withMaxContentionRequeues(2));
        seedAndEnqueue(batcher, 1);
        persistence.failPersistTransiently(ItemId.of(1), 2);

        // when
        batcher.drainNow();
        ledger.markRestarted(RUN, ItemId.of(1));
        batcher.enqueue(BatchedWritePayload.of(RUN, ItemId.of(1), Map.of("summary", "again")));
        persistence.failCommitsTransiently(2);
        batcher.drainNow();

        // then
        assertThat(persistence.getCommittedItemIds()).containsExactly(ItemId.of(1), ItemId.of(1));
        assertThat(persistence.getFailedItems()).isEmpty();
    }

    @Test
    void 경합_집계된_payload가_영구_실패하면_집계에서_제거() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig().withCommitRetries(1));
        seedAndEnqueue(batcher, 1);
        persistence.failCommitsTransiently(1);
        persistence.failCommitsPermanently(1);

        // when
        batcher.drainNow();

        // then
        assertThat(persistence.getFailedItems()).containsEntry(ItemId.of(1), "disk I/O error");
        assertThat(batcher.trackedContentionCount()).isZero();
    }

    @Test
    void commit_영구_오류는_청크_전체를_실패_처리() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        seedAndEnqueue(batcher, 3);
        persistence.failCommitsPermanently(1);

        // when
        batcher.drainNow();

        // then
        assertThat(persistence.getCommittedItemIds()).isEmpty();
        assertThat(persistence.getFailedItems()).hasSize(3).containsEntry(ItemId.of(1), "disk I/O error");
        assertThat(ledger.snapshot(RUN).failed()).isEqualTo(3);
        assertThat(sink.eventsOfType("analysis_failed")).hasSize(3);
    }

    @Test
    void session_열기_실패시_배치를_재큐잉() {
        // given
        when(flakyGateway.openSession())
            .thenThrow(new IllegalStateException("pool exhausted"))
            .thenAnswer(invocation -> persistence.openSession());
        WriteBatcher batcher = new WriteBatcher(flakyGateway, ledger, new SafeEventPublisher(sink),
            new WriteBatcherConfig(), time, new Random(5));
        seedAndEnqueue(batcher, 2);

        // when
        int batches = batcher.drainNow();

        // then
        assertThat(batches).isEqualTo(2);
        verify(flakyGateway, times(2)).openSession();
        assertThat(persistence.getCommittedItemIds()).containsExactly(ItemId.of(1), ItemId.of(2));
    }

    // ============================================================
    // 4. 백그라운드 루프
    // ============================================================

    @Test
    void start_후_waitUntilEmpty는_모든_payload_커밋까지_대기() {
        // given
        WriteBatcher batcher = new WriteBatcher(persistence, ledger, new SafeEventPublisher(sink),
            new WriteBatcherConfig(), SystemTimeSource.INSTANCE, new Random(5));
        batcher.start();
        try {
            seedAndEnqueue(batcher, 10);

            // when
            boolean drained = batcher.waitUntilEmpty(5_000);

            // then
            assertThat(drained).isTrue();
            assertThat(persistence.getCommittedItemIds()).hasSize(10);
            assertThat(batcher.pendingCount()).isZero();
        } finally {
            batcher.close();
        }
    }

    @Test
    void close_남은_payload를_처리한_뒤_종료() {
        // given
        WriteBatcher batcher = new WriteBatcher(persistence, ledger, new SafeEventPublisher(sink),
            new WriteBatcherConfig().withMaxWaitMs(60_000), SystemTimeSource.INSTANCE, new Random(5));
        batcher.start();
        seedAndEnqueue(batcher, 3);

        // when
        batcher.close();

        // then
        assertThat(persistence.getCommittedItemIds()).hasSize(3);
    }

    @Test
    void 겹친_drain이_있어도_처리중인_batch를_비었다고_보지_않음() {
        // given
        AtomicBoolean nested = new AtomicBoolean(false);
        AtomicBoolean emptyDuringOuterBatch = new AtomicBoolean(true);
        WriteBatcher[] holder = new WriteBatcher[1];
        when(flakyGateway.openSession()).thenAnswer(invocation -> {
            if (nested.compareAndSet(false, true)) {
                holder[0].drainNow();
                emptyDuringOuterBatch.set(holder[0].waitUntilEmpty(0));
            }
            return persistence.openSession();
        });
        holder[0] = new WriteBatcher(flakyGateway, ledger, new SafeEventPublisher(sink),
            new WriteBatcherConfig().withMaxBatch(1), time, new Random(5));
        seedAndEnqueue(holder[0], 2);

        // when
        holder[0].drainNow();

        // then
        assertThat(emptyDuringOuterBatch).isFalse();
        assertThat(holder[0].waitUntilEmpty(0)).isTrue();
        assertThat(persistence.getCommittedItemIds()).containsExactlyInAnyOrder(ItemId.of(1), ItemId.of(2));
    }

    @Test
    void waitUntilEmpty_빈_큐는_즉시_true() {
        // given
        WriteBatcher batcher = batcher(new WriteBatcherConfig());

        // when & then
        assertThat(batcher.waitUntilEmpty(0)).isTrue();
    }

    @Test
    void enqueue_null은_예외() {
        WriteBatcher batcher = batcher(new WriteBatcherConfig());
        assertThatThrownBy(() -> batcher.enqueue(null)).isInstanceOf(IllegalArgumentException.class);
    }
}

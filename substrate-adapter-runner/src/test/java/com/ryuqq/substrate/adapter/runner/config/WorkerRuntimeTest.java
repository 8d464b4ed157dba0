package com.ryuqq.substrate.adapter.runner.config;

import com.ryuqq.substrate.adapter.inmemory.event.InMemoryEventSink;
import com.ryuqq.substrate.adapter.inmemory.persistence.InMemoryPersistenceGateway;
import com.ryuqq.substrate.adapter.inmemory.store.InMemoryDeadLetterStore;
import com.ryuqq.substrate.adapter.inmemory.store.InMemoryProgressStore;
import com.ryuqq.substrate.adapter.inmemory.store.InMemoryRateLimitStore;
import com.ryuqq.substrate.adapter.inmemory.task.InMemoryTaskSubmitter;
import com.ryuqq.substrate.adapter.runner.admission.AdaptiveCeilingBreaker;
import com.ryuqq.substrate.core.model.BatchedWritePayload;
import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.protection.noop.NoOpRateCeilingBreaker;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkerRuntime 조립 테스트.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
class WorkerRuntimeTest {

    private final InMemoryProgressStore progressStore = new InMemoryProgressStore();
    private final InMemoryPersistenceGateway persistence = new InMemoryPersistenceGateway();

    private WorkerRuntime.Builder builder(SubstrateSettings settings) {
        return WorkerRuntime.builder()
            .settings(settings)
            .rateLimitStore(new InMemoryRateLimitStore())
            .progressStore(progressStore)
            .deadLetterStore(new InMemoryDeadLetterStore())
            .eventSink(new InMemoryEventSink())
            .persistenceGateway(persistence)
            .taskSubmitter(new InMemoryTaskSubmitter());
    }

    @Test
    void build_기본_설정은_적응형_브레이커_사용() {
        // when
        WorkerRuntime runtime = builder(new SubstrateSettings()).build();

        // then
        assertThat(runtime.getBreaker()).isInstanceOf(AdaptiveCeilingBreaker.class);
        assertThat(runtime.getAdmission().tryAcquire("provider", 5, 0)).isTrue();
    }

    @Test
    void build_브레이커_비활성화시_NoOp_사용() {
        // given
        SubstrateSettings settings = SubstrateSettings.fromEnvironment(Map.of("SUBSTRATE_BREAKER_DISABLE", "1"));

        // when
        WorkerRuntime runtime = builder(settings).build();

        // then
        assertThat(runtime.getBreaker()).isInstanceOf(NoOpRateCeilingBreaker.class);
    }

    @Test
    void build_필수_의존성_누락시_예외() {
        assertThatThrownBy(() -> WorkerRuntime.builder().settings(new SubstrateSettings()).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("rateLimitStore cannot be null");
    }

    @Test
    void close_쓰기_큐와_카운터_버퍼를_비움() {
        // given
        RunId run = RunId.of("run-1");
        WorkerRuntime runtime = builder(new SubstrateSettings()).build();
        runtime.start();
        runtime.getBufferedLedger().seedWithItems(run, List.of(ItemId.of(1), ItemId.of(2)));
        runtime.getBufferedLedger().markStarted(run, ItemId.of(1));
        runtime.getWriteBatcher().enqueue(BatchedWritePayload.of(run, ItemId.of(1), Map.of("summary", "ok")));

        // when
        runtime.close();

        // then
        assertThat(persistence.getCommittedItemIds()).containsExactly(ItemId.of(1));
        assertThat(runtime.getBufferedLedger().pendingTransitions()).isZero();
        assertThat(progressStore.readCounters(run)).hasValueSatisfying(c -> {
            assertThat(c.success()).isEqualTo(1);
            assertThat(c.pending()).isEqualTo(1);
        });
    }
}

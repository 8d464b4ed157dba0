package com.ryuqq.substrate.adapter.runner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.substrate.adapter.runner.admission.AdaptiveCeilingBreaker;
import com.ryuqq.substrate.adapter.runner.admission.HybridAdmissionController;
import com.ryuqq.substrate.adapter.runner.batch.WriteBatcher;
import com.ryuqq.substrate.adapter.runner.event.SafeEventPublisher;
import com.ryuqq.substrate.adapter.runner.lifecycle.DeadLetterService;
import com.ryuqq.substrate.adapter.runner.lifecycle.TaskLifecycleManager;
import com.ryuqq.substrate.adapter.runner.lifecycle.TieredBackoffPolicy;
import com.ryuqq.substrate.adapter.runner.progress.BufferedProgressLedger;
import com.ryuqq.substrate.adapter.runner.progress.RunFinalizer;
import com.ryuqq.substrate.adapter.runner.progress.StoreBackedProgressLedger;
import com.ryuqq.substrate.core.protection.AdmissionController;
import com.ryuqq.substrate.core.protection.RateCeilingBreaker;
import com.ryuqq.substrate.core.protection.noop.NoOpRateCeilingBreaker;
import com.ryuqq.substrate.core.spi.DeadLetterStore;
import com.ryuqq.substrate.core.spi.EventSink;
import com.ryuqq.substrate.core.spi.PersistenceGateway;
import com.ryuqq.substrate.core.spi.ProgressStore;
import com.ryuqq.substrate.core.spi.RateLimitStore;
import com.ryuqq.substrate.core.spi.TaskSubmitter;
import com.ryuqq.substrate.core.time.SystemTimeSource;
import com.ryuqq.substrate.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * 워커 하나의 구성 요소 묶음.
 *
 * <p>버킷 레지스트리, 로컬 카운터 미러, 쓰기 큐처럼 워커 프로세스 단위로 존재하는 상태를
 * 명시적인 객체로 소유합니다. 저장소 어댑터는 외부에서 주입됩니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>{@code
 * try (WorkerRuntime runtime = WorkerRuntime.builder()
 *         .settings(SubstrateSettings.fromEnvironment(System.getenv()))
 *         .rateLimitStore(limiterStore)
 *         .progressStore(progressStore)
 *         .deadLetterStore(deadLetterStore)
 *         .eventSink(eventSink)
 *         .persistenceGateway(gateway)
 *         .taskSubmitter(submitter)
 *         .build()) {
 *     runtime.start();
 *     ...
 * }
 * }</pre>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class WorkerRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    private final SubstrateSettings settings;
    private final RateCeilingBreaker breaker;
    private final AdmissionController admission;
    private final StoreBackedProgressLedger directLedger;
    private final BufferedProgressLedger bufferedLedger;
    private final SafeEventPublisher events;
    private final DeadLetterService deadLetters;
    private final TaskLifecycleManager lifecycle;
    private final WriteBatcher writeBatcher;
    private final RunFinalizer runFinalizer;

    private WorkerRuntime(Builder builder) {
        this.settings = builder.settings;
        TimeSource timeSource = builder.timeSource;
        Random random = builder.random;

        this.breaker = settings.breakerEnabled()
            ? new AdaptiveCeilingBreaker(builder.rateLimitStore, settings.breaker(), timeSource)
            : new NoOpRateCeilingBreaker();
        this.admission = new HybridAdmissionController(
            builder.rateLimitStore, breaker, settings.admission(), timeSource, random);

        this.directLedger = new StoreBackedProgressLedger(builder.progressStore, timeSource);
        this.bufferedLedger = new BufferedProgressLedger(builder.progressStore, settings.counterBuffer(), timeSource);
        this.events = new SafeEventPublisher(builder.eventSink);

        this.deadLetters = new DeadLetterService(
            builder.deadLetterStore, builder.taskSubmitter, builder.objectMapper, timeSource);
        this.lifecycle = new TaskLifecycleManager(
            bufferedLedger, deadLetters, events, builder.persistenceGateway,
            new TieredBackoffPolicy(settings.lifecycle(), random));

        this.writeBatcher = new WriteBatcher(
            builder.persistenceGateway, bufferedLedger, events, settings.writeBatcher(), timeSource, random);
        this.runFinalizer = new RunFinalizer(bufferedLedger, events, settings.runFinalizer(), timeSource);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 백그라운드 구성 요소 시작.
     */
    public void start() {
        writeBatcher.start();
        log.info("WorkerRuntime started (breaker={}, limiterStore={})",
            settings.breakerEnabled() ? "adaptive" : "disabled", settings.limiterStoreUrl());
    }

    /**
     * 쓰기 큐를 비우고 버퍼된 카운터를 flush한 뒤 종료.
     */
    @Override
    public void close() {
        writeBatcher.close();
        bufferedLedger.flush();
        log.info("WorkerRuntime closed");
    }

    public SubstrateSettings getSettings() {
        return settings;
    }

    public RateCeilingBreaker getBreaker() {
        return breaker;
    }

    public AdmissionController getAdmission() {
        return admission;
    }

    public StoreBackedProgressLedger getDirectLedger() {
        return directLedger;
    }

    public BufferedProgressLedger getBufferedLedger() {
        return bufferedLedger;
    }

    public SafeEventPublisher getEvents() {
        return events;
    }

    public DeadLetterService getDeadLetters() {
        return deadLetters;
    }

    public TaskLifecycleManager getLifecycle() {
        return lifecycle;
    }

    public WriteBatcher getWriteBatcher() {
        return writeBatcher;
    }

    public RunFinalizer getRunFinalizer() {
        return runFinalizer;
    }

    /**
     * WorkerRuntime 빌더.
     */
    public static final class Builder {

        private SubstrateSettings settings = new SubstrateSettings();
        private RateLimitStore rateLimitStore;
        private ProgressStore progressStore;
        private DeadLetterStore deadLetterStore;
        private EventSink eventSink;
        private PersistenceGateway persistenceGateway;
        private TaskSubmitter taskSubmitter;
        private TimeSource timeSource = SystemTimeSource.INSTANCE;
        private Random random = new Random();
        private ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

        private Builder() {
        }

        public Builder settings(SubstrateSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder rateLimitStore(RateLimitStore rateLimitStore) {
            this.rateLimitStore = rateLimitStore;
            return this;
        }

        public Builder progressStore(ProgressStore progressStore) {
            this.progressStore = progressStore;
            return this;
        }

        public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
            this.deadLetterStore = deadLetterStore;
            return this;
        }

        public Builder eventSink(EventSink eventSink) {
            this.eventSink = eventSink;
            return this;
        }

        public Builder persistenceGateway(PersistenceGateway persistenceGateway) {
            this.persistenceGateway = persistenceGateway;
            return this;
        }

        public Builder taskSubmitter(TaskSubmitter taskSubmitter) {
            this.taskSubmitter = taskSubmitter;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * WorkerRuntime 생성.
         *
         * @return 구성된 런타임
         * @throws IllegalArgumentException 필수 의존성이 누락된 경우
         */
        public WorkerRuntime build() {
            require(settings, "settings");
            require(rateLimitStore, "rateLimitStore");
            require(progressStore, "progressStore");
            require(deadLetterStore, "deadLetterStore");
            require(eventSink, "eventSink");
            require(persistenceGateway, "persistenceGateway");
            require(taskSubmitter, "taskSubmitter");
            require(timeSource, "timeSource");
            require(random, "random");
            require(objectMapper, "objectMapper");
            return new WorkerRuntime(this);
        }

        private static void require(Object value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
        }
    }
}

package com.ryuqq.substrate.adapter.runner.config;

import com.ryuqq.substrate.adapter.runner.batch.WriteBatcherConfig;
import com.ryuqq.substrate.adapter.runner.lifecycle.LifecycleConfig;
import com.ryuqq.substrate.adapter.runner.progress.CounterBufferConfig;
import com.ryuqq.substrate.adapter.runner.progress.RunFinalizerConfig;
import com.ryuqq.substrate.core.protection.AdmissionConfig;
import com.ryuqq.substrate.core.protection.CeilingBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 워커 설정 묶음 (불변 record).
 *
 * <p>{@link #fromEnvironment(Map)}는 {@code SUBSTRATE_} 접두사 환경 변수를 각 설정 record로
 * 매핑합니다. 형식이 잘못된 값은 경고 로그를 남기고 기본값을 사용합니다.</p>
 *
 * <p><strong>환경 변수:</strong></p>
 * <ul>
 *   <li>SUBSTRATE_STORE_URL - 공유 저장소 주소</li>
 *   <li>SUBSTRATE_LIMITER_STORE_URL - 속도 제한 전용 저장소 주소 (없으면 SUBSTRATE_STORE_URL)</li>
 *   <li>SUBSTRATE_LIMITER_SYNC_MS, SUBSTRATE_LIMITER_HEADROOM, SUBSTRATE_WORKER_PROCESSES,
 *       SUBSTRATE_LIMITER_FAIL_OPEN_TOKENS</li>
 *   <li>SUBSTRATE_BREAKER_DISABLE (1/true/yes/on), SUBSTRATE_BREAKER_FLOOR, SUBSTRATE_BREAKER_CEILING,
 *       SUBSTRATE_BREAKER_INITIAL, SUBSTRATE_BREAKER_CLEAN_WINDOW_MS</li>
 *   <li>SUBSTRATE_COUNTER_FLUSH_SIZE, SUBSTRATE_COUNTER_FLUSH_MS</li>
 *   <li>SUBSTRATE_TASK_MAX_RETRIES</li>
 *   <li>SUBSTRATE_BATCH_MAX, SUBSTRATE_BATCH_MAX_WAIT_MS, SUBSTRATE_BATCH_COMMIT_CHUNK,
 *       SUBSTRATE_BATCH_COMMIT_MS</li>
 *   <li>SUBSTRATE_FINALIZER_STALE_MS</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 * @param storeUrl 공유 저장소 주소 (없으면 null)
 * @param limiterStoreUrl 속도 제한 저장소 주소 (없으면 storeUrl)
 * @param admission Admission 설정
 * @param breaker ceiling 브레이커 설정
 * @param counterBuffer 카운터 버퍼 설정
 * @param lifecycle 작업 생명주기 설정
 * @param writeBatcher 쓰기 배처 설정
 * @param runFinalizer Run 정리 설정
 */
public record SubstrateSettings(
    String storeUrl,
    String limiterStoreUrl,
    AdmissionConfig admission,
    CeilingBreakerConfig breaker,
    CounterBufferConfig counterBuffer,
    LifecycleConfig lifecycle,
    WriteBatcherConfig writeBatcher,
    RunFinalizerConfig runFinalizer
) {

    private static final Logger log = LoggerFactory.getLogger(SubstrateSettings.class);
    private static final Set<String> TRUTHY = Set.of("1", "true", "yes", "on");

    public SubstrateSettings() {
        this(null, null, new AdmissionConfig(), new CeilingBreakerConfig(), new CounterBufferConfig(),
            new LifecycleConfig(), new WriteBatcherConfig(), new RunFinalizerConfig());
    }

    public SubstrateSettings {
        if (admission == null || breaker == null || counterBuffer == null
            || lifecycle == null || writeBatcher == null || runFinalizer == null) {
            throw new IllegalArgumentException("configs cannot be null");
        }
        if (limiterStoreUrl == null || limiterStoreUrl.isBlank()) {
            limiterStoreUrl = storeUrl;
        }
    }

    /**
     * 환경 변수 맵에서 설정 생성.
     *
     * @param env 환경 변수 (예: {@code System.getenv()})
     * @return 설정
     */
    public static SubstrateSettings fromEnvironment(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        EnvReader reader = new EnvReader(env);

        String storeUrl = reader.string("SUBSTRATE_STORE_URL").orElse(null);
        String limiterStoreUrl = reader.string("SUBSTRATE_LIMITER_STORE_URL").orElse(storeUrl);

        AdmissionConfig admissionDefaults = new AdmissionConfig();
        AdmissionConfig admission = build("admission", admissionDefaults, () -> admissionDefaults
            .withSyncIntervalMs(reader.longValue("SUBSTRATE_LIMITER_SYNC_MS", admissionDefaults.syncIntervalMs()))
            .withHeadroom(reader.doubleValue("SUBSTRATE_LIMITER_HEADROOM", admissionDefaults.headroom()))
            .withWorkerProcessCount(reader.intValue("SUBSTRATE_WORKER_PROCESSES", admissionDefaults.workerProcessCount()))
            .withFailOpenTokens(reader.intValue("SUBSTRATE_LIMITER_FAIL_OPEN_TOKENS", admissionDefaults.failOpenTokens())));

        CeilingBreakerConfig breakerDefaults = new CeilingBreakerConfig();
        CeilingBreakerConfig breaker = build("breaker", breakerDefaults, () -> breakerDefaults
            .withBounds(
                reader.intValue("SUBSTRATE_BREAKER_FLOOR", breakerDefaults.floor()),
                reader.intValue("SUBSTRATE_BREAKER_CEILING", breakerDefaults.ceiling()),
                reader.intValue("SUBSTRATE_BREAKER_INITIAL", breakerDefaults.initial()))
            .withCleanWindowMs(reader.longValue("SUBSTRATE_BREAKER_CLEAN_WINDOW_MS", breakerDefaults.cleanWindowMs())));
        if (reader.flag("SUBSTRATE_BREAKER_DISABLE")) {
            breaker = breaker.withEnabled(false);
        }

        CounterBufferConfig counterDefaults = new CounterBufferConfig();
        CounterBufferConfig counterBuffer = build("counter buffer", counterDefaults, () -> counterDefaults
            .withFlushSize(reader.intValue("SUBSTRATE_COUNTER_FLUSH_SIZE", counterDefaults.flushSize()))
            .withFlushIntervalMs(reader.longValue("SUBSTRATE_COUNTER_FLUSH_MS", counterDefaults.flushIntervalMs())));

        LifecycleConfig lifecycleDefaults = new LifecycleConfig();
        LifecycleConfig lifecycle = build("lifecycle", lifecycleDefaults, () -> lifecycleDefaults
            .withMaxRetries(reader.intValue("SUBSTRATE_TASK_MAX_RETRIES", lifecycleDefaults.maxRetries())));

        WriteBatcherConfig batchDefaults = new WriteBatcherConfig();
        WriteBatcherConfig writeBatcher = build("write batcher", batchDefaults, () -> batchDefaults
            .withMaxBatch(reader.intValue("SUBSTRATE_BATCH_MAX", batchDefaults.maxBatch()))
            .withMaxWaitMs(reader.longValue("SUBSTRATE_BATCH_MAX_WAIT_MS", batchDefaults.maxWaitMs()))
            .withChunkSize(reader.intValue("SUBSTRATE_BATCH_COMMIT_CHUNK", batchDefaults.chunkSize()))
            .withCommitIntervalMs(reader.longValue("SUBSTRATE_BATCH_COMMIT_MS", batchDefaults.commitIntervalMs())));

        RunFinalizerConfig finalizerDefaults = new RunFinalizerConfig();
        RunFinalizerConfig runFinalizer = build("run finalizer", finalizerDefaults, () -> finalizerDefaults
            .withStaleAfterMs(reader.longValue("SUBSTRATE_FINALIZER_STALE_MS", finalizerDefaults.staleAfterMs())));

        return new SubstrateSettings(storeUrl, limiterStoreUrl, admission, breaker, counterBuffer,
            lifecycle, writeBatcher, runFinalizer);
    }

    /**
     * 브레이커 활성화 여부.
     *
     * @return kill-switch가 켜져 있지 않으면 true
     */
    public boolean breakerEnabled() {
        return breaker.enabled();
    }

    private static <T> T build(String name, T defaults, ConfigFactory<T> factory) {
        try {
            return factory.create();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {} settings, using defaults: {}", name, e.getMessage());
            return defaults;
        }
    }

    @FunctionalInterface
    private interface ConfigFactory<T> {
        T create();
    }

    private static final class EnvReader {

        private final Map<String, String> env;

        EnvReader(Map<String, String> env) {
            this.env = env;
        }

        Optional<String> string(String key) {
            String value = env.get(key);
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(value.trim());
        }

        boolean flag(String key) {
            return string(key).map(v -> TRUTHY.contains(v.toLowerCase(Locale.ROOT))).orElse(false);
        }

        int intValue(String key, int fallback) {
            Optional<String> raw = string(key);
            if (raw.isEmpty()) {
                return fallback;
            }
            try {
                return Integer.parseInt(raw.get());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer for {}: '{}', using {}", key, raw.get(), fallback);
                return fallback;
            }
        }

        long longValue(String key, long fallback) {
            Optional<String> raw = string(key);
            if (raw.isEmpty()) {
                return fallback;
            }
            try {
                return Long.parseLong(raw.get());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer for {}: '{}', using {}", key, raw.get(), fallback);
                return fallback;
            }
        }

        double doubleValue(String key, double fallback) {
            Optional<String> raw = string(key);
            if (raw.isEmpty()) {
                return fallback;
            }
            try {
                return Double.parseDouble(raw.get());
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: '{}', using {}", key, raw.get(), fallback);
                return fallback;
            }
        }
    }
}

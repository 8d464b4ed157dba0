package com.ryuqq.substrate.adapter.runner.admission;

import com.ryuqq.substrate.core.protection.AdmissionConfig;
import com.ryuqq.substrate.core.protection.AdmissionController;
import com.ryuqq.substrate.core.protection.RateCeilingBreaker;
import com.ryuqq.substrate.core.spi.RateLimitStore;
import com.ryuqq.substrate.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 로컬 토큰 버킷 + 공유 초 단위 윈도우 기반 AdmissionController 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * tryAcquire(key, limit, maxWait)
 *   ↓
 * bucket.tryTake() ─ 성공 → true
 *   ↓ 실패
 * sleep(min(retrySleepCap, maxWait) - jitter)
 *   ↓
 * bucket.tryTake() → 결과 반환
 *
 * blockUntilAcquired(key, limit, maxBlock)
 *   ↓
 * loop:
 *   hold 남아 있으면 min(hold, blockSlice) 만큼 대기
 *   deadline 경과 → false
 *   tryAcquire(key, limit, min(blockSlice, 남은 시간)) 성공 → true
 *   blockPause 대기
 * </pre>
 *
 * <p>버킷은 (key, limit) 조합마다 워커 내에서 하나씩 생성됩니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class HybridAdmissionController implements AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(HybridAdmissionController.class);
    private static final long MAX_JITTER_MS = 50;

    private final RateLimitStore store;
    private final RateCeilingBreaker breaker;
    private final AdmissionConfig config;
    private final TimeSource timeSource;
    private final Random random;
    private final ConcurrentMap<String, LocalTokenBucket> buckets = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param store 공유 저장소
     * @param breaker 글로벌 ceiling 제공자
     * @param config 설정
     * @param timeSource 시간 소스
     * @param random jitter 난수 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public HybridAdmissionController(
        RateLimitStore store,
        RateCeilingBreaker breaker,
        AdmissionConfig config,
        TimeSource timeSource,
        Random random
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.store = store;
        this.breaker = breaker;
        this.config = config;
        this.timeSource = timeSource;
        this.random = random;
    }

    @Override
    public boolean tryAcquire(String key, int limitPerSecond, long maxWaitMs) {
        validate(key, limitPerSecond);
        LocalTokenBucket bucket = bucketFor(key, limitPerSecond);
        if (bucket.tryTake()) {
            return true;
        }
        if (maxWaitMs <= 0) {
            return false;
        }

        long sleepMs = Math.min(config.retrySleepCapMs(), maxWaitMs);
        long jitterBound = Math.min(MAX_JITTER_MS, sleepMs / 4);
        if (jitterBound > 0) {
            sleepMs -= nextJitter(jitterBound);
        }
        if (!sleepQuietly(sleepMs)) {
            return false;
        }
        return bucket.tryTake();
    }

    @Override
    public boolean blockUntilAcquired(String key, int limitPerSecond, long maxBlockMs) {
        validate(key, limitPerSecond);
        long deadline = timeSource.currentTimeMillis() + Math.max(0, maxBlockMs);

        while (true) {
            long holdRemaining = holdRemainingMillis(key);
            if (holdRemaining > 0) {
                long wait = Math.min(holdRemaining, config.blockSliceMs());
                wait = Math.min(wait, Math.max(0, deadline - timeSource.currentTimeMillis()));
                if (wait > 0 && !sleepQuietly(wait)) {
                    return false;
                }
            }

            long sliceLeft = deadline - timeSource.currentTimeMillis();
            if (sliceLeft <= 0) {
                log.debug("Admission blocked until deadline for key={}", key);
                return false;
            }

            if (holdRemainingMillis(key) <= 0
                && tryAcquire(key, limitPerSecond, Math.min(config.blockSliceMs(), sliceLeft))) {
                return true;
            }

            if (config.blockPauseMs() > 0 && !sleepQuietly(config.blockPauseMs())) {
                return false;
            }
        }
    }

    @Override
    public void setHold(String key, long holdMs, String reason) {
        if (key == null || key.isBlank() || holdMs <= 0) {
            return;
        }
        try {
            long ttl = store.holdTtlMillis(key);
            if (ttl < holdMs - config.holdExtendMarginMs()) {
                store.writeHold(key, holdMs, reason == null ? "" : reason);
                log.info("Admission hold set for key={} holdMs={} reason={}", key, holdMs, reason);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to set admission hold for key={}", key, e);
        }
    }

    @Override
    public long holdRemainingMillis(String key) {
        if (key == null || key.isBlank()) {
            return 0L;
        }
        try {
            return Math.max(0L, store.holdTtlMillis(key));
        } catch (RuntimeException e) {
            log.debug("Failed to read admission hold for key={}", key, e);
            return 0L;
        }
    }

    int localTokens(String key, int limitPerSecond) {
        return bucketFor(key, limitPerSecond).availableTokens();
    }

    private LocalTokenBucket bucketFor(String key, int limitPerSecond) {
        return buckets.computeIfAbsent(
            key + "|" + limitPerSecond,
            k -> new LocalTokenBucket(key, limitPerSecond, store, breaker, config, timeSource, random)
        );
    }

    private long nextJitter(long bound) {
        synchronized (random) {
            return (long) (random.nextDouble() * (bound + 1));
        }
    }

    private boolean sleepQuietly(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            timeSource.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void validate(String key, int limitPerSecond) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (limitPerSecond <= 0) {
            throw new IllegalArgumentException(
                "limitPerSecond must be positive (current: " + limitPerSecond + ")"
            );
        }
    }
}

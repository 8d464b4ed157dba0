package com.ryuqq.substrate.adapter.runner.admission;

import com.ryuqq.substrate.core.protection.AdmissionConfig;
import com.ryuqq.substrate.core.protection.RateCeilingBreaker;
import com.ryuqq.substrate.core.spi.RateLimitStore;
import com.ryuqq.substrate.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 워커 로컬 토큰 버킷.
 *
 * <p>공유 저장소의 초 단위 윈도우에서 토큰을 일괄 청구(claim)하여 로컬에 보관하고,
 * 로컬 토큰이 소진되면 공유 윈도우에서 1개를 긴급 차감합니다.</p>
 *
 * <p><strong>동기화 규칙:</strong></p>
 * <ul>
 *   <li>마지막 동기화 후 syncIntervalMs가 지나면 재동기화</li>
 *   <li>유효 한도 = min(limitPerSecond, 현재 글로벌 ceiling)</li>
 *   <li>청구량 = {@link AdmissionConfig#localQuota(int)}</li>
 *   <li>저장소 장애 시 min(failOpenTokens, 청구량)만큼 fail-open</li>
 * </ul>
 *
 * <p>첫 동기화 시점은 syncInterval 범위 내에서 무작위로 흩어져
 * 워커들이 같은 순간에 청구하지 않습니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
final class LocalTokenBucket {

    private static final Logger log = LoggerFactory.getLogger(LocalTokenBucket.class);

    private final String key;
    private final int limitPerSecond;
    private final RateLimitStore store;
    private final RateCeilingBreaker breaker;
    private final AdmissionConfig config;
    private final TimeSource timeSource;
    private final ReentrantLock lock = new ReentrantLock();

    private int tokens;
    private long lastSyncMillis;
    private int effectiveLimit;

    LocalTokenBucket(
        String key,
        int limitPerSecond,
        RateLimitStore store,
        RateCeilingBreaker breaker,
        AdmissionConfig config,
        TimeSource timeSource,
        Random random
    ) {
        this.key = key;
        this.limitPerSecond = limitPerSecond;
        this.store = store;
        this.breaker = breaker;
        this.config = config;
        this.timeSource = timeSource;
        this.tokens = 0;
        this.effectiveLimit = Math.max(1, Math.min(limitPerSecond, breaker.currentCeiling()));
        long phase = (long) (random.nextDouble() * config.syncIntervalMs());
        this.lastSyncMillis = timeSource.currentTimeMillis() - phase;
    }

    /**
     * 토큰 1개 획득 시도 (대기 없음).
     *
     * @return 획득 성공 여부
     */
    boolean tryTake() {
        lock.lock();
        try {
            long now = timeSource.currentTimeMillis();
            if (now - lastSyncMillis > config.syncIntervalMs()) {
                sync(now);
            }
            if (tokens > 0) {
                tokens--;
                return true;
            }
            return emergencyTake(now);
        } finally {
            lock.unlock();
        }
    }

    int availableTokens() {
        lock.lock();
        try {
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    int effectiveLimit() {
        lock.lock();
        try {
            return effectiveLimit;
        } finally {
            lock.unlock();
        }
    }

    private void sync(long now) {
        int ceiling = breaker.currentCeiling();
        effectiveLimit = Math.max(1, Math.min(limitPerSecond, ceiling));
        int quota = config.localQuota(effectiveLimit);
        try {
            tokens = store.claimTokens(key, now / 1000L, quota, effectiveLimit);
        } catch (RuntimeException e) {
            tokens = Math.min(config.failOpenTokens(), quota);
            log.warn("Token claim failed for key={}, fail-open with {} tokens", key, tokens, e);
        }
        lastSyncMillis = now;
    }

    private boolean emergencyTake(long now) {
        try {
            return store.tryTakeOne(key, now / 1000L, effectiveLimit);
        } catch (RuntimeException e) {
            log.debug("Emergency take failed for key={}", key, e);
            return false;
        }
    }
}

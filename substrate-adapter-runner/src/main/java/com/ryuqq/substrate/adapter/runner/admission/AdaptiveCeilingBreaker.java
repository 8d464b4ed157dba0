package com.ryuqq.substrate.adapter.runner.admission;

import com.ryuqq.substrate.core.protection.AttemptResult;
import com.ryuqq.substrate.core.protection.CeilingBreakerConfig;
import com.ryuqq.substrate.core.protection.RateCeilingBreaker;
import com.ryuqq.substrate.core.spi.RateLimitStore;
import com.ryuqq.substrate.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * 공유 저장소 기반 적응형 ceiling 브레이커 (AIMD 변형).
 *
 * <p><strong>규칙 (첫 시도 결과만 반영):</strong></p>
 * <ul>
 *   <li>전송 실패(연결 오류 또는 응답 없음): ceiling 절반으로 감소 (floor 이상), 마지막 오류 시각 기록</li>
 *   <li>기타 실패: 마지막 오류 시각만 기록</li>
 *   <li>성공 + 마지막 오류 후 cleanWindow 경과: ceiling 두 배 (ceiling 상한)</li>
 * </ul>
 *
 * <p>ceiling 변경은 compare-and-set으로 적용되어 여러 워커가 동시에 감소시켜도
 * 한 번의 관측에 대해 한 번만 반영됩니다. 저장소 오류는 로그만 남기고 전파하지 않습니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class AdaptiveCeilingBreaker implements RateCeilingBreaker {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveCeilingBreaker.class);

    private final RateLimitStore store;
    private final CeilingBreakerConfig config;
    private final TimeSource timeSource;

    /**
     * 생성자.
     *
     * @param store 공유 저장소
     * @param config 설정
     * @param timeSource 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AdaptiveCeilingBreaker(RateLimitStore store, CeilingBreakerConfig config, TimeSource timeSource) {
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
        this.config = config;
        this.timeSource = timeSource;
    }

    @Override
    public void recordAttempt(AttemptResult result) {
        if (result == null || !result.firstAttempt()) {
            return;
        }
        try {
            long now = timeSource.currentTimeMillis();
            if (result.isTransportFailure()) {
                decrease();
                store.writeLastErrorMillis(now, config.stateTtlMs());
            } else if (result.ok()) {
                OptionalLong lastError = store.readLastErrorMillis();
                if (lastError.isEmpty() || now - lastError.getAsLong() >= config.cleanWindowMs()) {
                    increase();
                }
            } else {
                store.writeLastErrorMillis(now, config.stateTtlMs());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record attempt result in ceiling breaker", e);
        }
    }

    @Override
    public int currentCeiling() {
        try {
            OptionalInt value = store.readGlobalCeiling();
            return value.isPresent() ? config.clamp(value.getAsInt()) : config.initial();
        } catch (RuntimeException e) {
            log.debug("Failed to read global ceiling, using initial {}", config.initial(), e);
            return config.initial();
        }
    }

    private void decrease() {
        int current = store.initGlobalCeilingIfAbsent(config.initial(), config.stateTtlMs());
        int next = config.clamp(current / 2);
        if (next == current) {
            return;
        }
        if (store.compareAndSetGlobalCeiling(current, next, config.stateTtlMs())) {
            log.warn("Global ceiling decreased {} -> {}", current, next);
        }
    }

    private void increase() {
        int current = store.initGlobalCeilingIfAbsent(config.initial(), config.stateTtlMs());
        int next = config.clamp(current * 2);
        if (next == current) {
            return;
        }
        if (store.compareAndSetGlobalCeiling(current, next, config.stateTtlMs())) {
            log.info("Global ceiling increased {} -> {}", current, next);
        }
    }
}

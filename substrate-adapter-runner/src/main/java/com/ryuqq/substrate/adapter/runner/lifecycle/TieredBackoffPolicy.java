package com.ryuqq.substrate.adapter.runner.lifecycle;

import java.util.Random;

/**
 * 구간별 고정 지연 + 균등 Jitter 백오프 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = tier(retryNumber).delayMillis + random[0, jitterMaxMs)
 * </pre>
 *
 * <p><strong>예시 (기본 설정):</strong></p>
 * <ul>
 *   <li>retryNumber=1..6: 20000 ~ 29999ms</li>
 *   <li>retryNumber=7..25: 60000 ~ 69999ms</li>
 *   <li>retryNumber=26 이상: 900000 ~ 909999ms</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class TieredBackoffPolicy {

    private final LifecycleConfig config;
    private final Random random;

    /**
     * 기본 설정으로 생성.
     */
    public TieredBackoffPolicy() {
        this(new LifecycleConfig(), new Random());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param config 백오프 구간 설정
     * @param random jitter 난수 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TieredBackoffPolicy(LifecycleConfig config, Random random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.config = config;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param retryNumber 재시도 번호 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryNumber가 양수가 아닌 경우
     */
    public long delayMillis(int retryNumber) {
        long base = baseDelayMillis(retryNumber);
        if (config.jitterMaxMs() <= 0) {
            return base;
        }
        long jitter;
        synchronized (random) {
            jitter = (long) (random.nextDouble() * config.jitterMaxMs());
        }
        return base + jitter;
    }

    /**
     * jitter를 제외한 구간 기본 지연.
     *
     * @param retryNumber 재시도 번호 (1부터 시작)
     * @return 기본 지연 (밀리초)
     */
    public long baseDelayMillis(int retryNumber) {
        if (retryNumber <= 0) {
            throw new IllegalArgumentException(
                "retryNumber must be positive (current: " + retryNumber + ")"
            );
        }
        for (BackoffTier tier : config.tiers()) {
            if (retryNumber <= tier.upToRetry()) {
                return tier.delayMillis();
            }
        }
        return config.tiers().get(config.tiers().size() - 1).delayMillis();
    }

    public int getMaxRetries() {
        return config.maxRetries();
    }
}

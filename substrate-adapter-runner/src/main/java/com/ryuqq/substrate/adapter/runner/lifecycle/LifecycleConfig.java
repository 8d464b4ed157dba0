package com.ryuqq.substrate.adapter.runner.lifecycle;

import java.util.List;

/**
 * TaskLifecycleManager 설정 (불변 record).
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxRetries: 120</li>
 *   <li>tiers: 1~6회 20초, 7~25회 60초, 26회 이상 900초</li>
 *   <li>jitterMaxMs: 10000 (0 이상 10초 미만의 균등 jitter)</li>
 * </ul>
 *
 * <p>tiers는 upToRetry 오름차순이어야 하며, 마지막 구간은 모든 재시도 번호를 덮어야 합니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param tiers 백오프 구간 목록
 * @param jitterMaxMs jitter 상한 (밀리초, 미포함)
 */
public record LifecycleConfig(int maxRetries, List<BackoffTier> tiers, long jitterMaxMs) {

    public static final List<BackoffTier> DEFAULT_TIERS = List.of(
        new BackoffTier(6, 20_000),
        new BackoffTier(25, 60_000),
        BackoffTier.unbounded(900_000)
    );

    public LifecycleConfig() {
        this(120, DEFAULT_TIERS, 10_000);
    }

    public LifecycleConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries cannot be negative (current: " + maxRetries + ")"
            );
        }
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("tiers cannot be null or empty");
        }
        tiers = List.copyOf(tiers);
        for (int i = 1; i < tiers.size(); i++) {
            if (tiers.get(i).upToRetry() <= tiers.get(i - 1).upToRetry()) {
                throw new IllegalArgumentException("tiers must be ordered by upToRetry");
            }
        }
        if (tiers.get(tiers.size() - 1).upToRetry() != Integer.MAX_VALUE) {
            throw new IllegalArgumentException("last tier must be unbounded");
        }
        if (jitterMaxMs < 0) {
            throw new IllegalArgumentException(
                "jitterMaxMs cannot be negative (current: " + jitterMaxMs + ")"
            );
        }
    }

    public LifecycleConfig withMaxRetries(int maxRetries) {
        return new LifecycleConfig(maxRetries, tiers, jitterMaxMs);
    }

    public LifecycleConfig withTiers(List<BackoffTier> tiers) {
        return new LifecycleConfig(maxRetries, tiers, jitterMaxMs);
    }

    public LifecycleConfig withJitterMaxMs(long jitterMaxMs) {
        return new LifecycleConfig(maxRetries, tiers, jitterMaxMs);
    }
}

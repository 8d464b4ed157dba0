package com.ryuqq.substrate.adapter.runner.lifecycle;

/**
 * 재시도 백오프 구간.
 *
 * @param upToRetry 이 구간이 적용되는 마지막 재시도 번호 (포함)
 * @param delayMillis 구간 기본 지연 (밀리초)
 * @author Substrate Team
 * @since 1.0.0
 */
public record BackoffTier(int upToRetry, long delayMillis) {

    public BackoffTier {
        if (upToRetry <= 0) {
            throw new IllegalArgumentException(
                "upToRetry must be positive (current: " + upToRetry + ")"
            );
        }
        if (delayMillis < 0) {
            throw new IllegalArgumentException(
                "delayMillis cannot be negative (current: " + delayMillis + ")"
            );
        }
    }

    /**
     * 남은 모든 재시도에 적용되는 마지막 구간.
     *
     * @param delayMillis 지연 (밀리초)
     * @return 상한 없는 구간
     */
    public static BackoffTier unbounded(long delayMillis) {
        return new BackoffTier(Integer.MAX_VALUE, delayMillis);
    }
}

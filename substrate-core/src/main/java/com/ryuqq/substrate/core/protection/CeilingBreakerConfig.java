package com.ryuqq.substrate.core.protection;

/**
 * 적응형 상한 Circuit Breaker 설정 (불변 record).
 *
 * <p>기본값: floor=5, ceiling=450, initial=450, cleanWindowMs=5000, stateTtlMs=90000</p>
 *
 * @param enabled false이면 kill-switch (breaker 비활성)
 * @param floor 상한의 최솟값
 * @param ceiling 상한의 최댓값
 * @param initial 저장소에 값이 없을 때의 시작 상한
 * @param cleanWindowMs 상한을 올리기 위해 필요한 무오류 시간
 * @param stateTtlMs 공유 상태 키의 TTL
 * @author Substrate Team
 * @since 1.0.0
 */
public record CeilingBreakerConfig(
    boolean enabled,
    int floor,
    int ceiling,
    int initial,
    long cleanWindowMs,
    long stateTtlMs
) {

    public CeilingBreakerConfig() {
        this(true, 5, 450, 450, 5000, 90000);
    }

    public CeilingBreakerConfig {
        if (floor <= 0) {
            throw new IllegalArgumentException("floor must be positive (current: " + floor + ")");
        }
        if (ceiling < floor) {
            throw new IllegalArgumentException(
                "ceiling must be greater than or equal to floor (floor: " + floor + ", ceiling: " + ceiling + ")"
            );
        }
        if (initial < floor || initial > ceiling) {
            throw new IllegalArgumentException(
                "initial must be within [floor, ceiling] (current: " + initial + ")"
            );
        }
        if (cleanWindowMs < 0) {
            throw new IllegalArgumentException("cleanWindowMs cannot be negative (current: " + cleanWindowMs + ")");
        }
        if (stateTtlMs <= 0) {
            throw new IllegalArgumentException("stateTtlMs must be positive (current: " + stateTtlMs + ")");
        }
    }

    /**
     * 값을 [floor, ceiling] 범위로 보정.
     *
     * @param value 보정할 값
     * @return 보정된 값
     */
    public int clamp(int value) {
        return Math.max(floor, Math.min(ceiling, value));
    }

    public CeilingBreakerConfig withEnabled(boolean enabled) {
        return new CeilingBreakerConfig(enabled, floor, ceiling, initial, cleanWindowMs, stateTtlMs);
    }

    public CeilingBreakerConfig withBounds(int floor, int ceiling, int initial) {
        return new CeilingBreakerConfig(enabled, floor, ceiling, initial, cleanWindowMs, stateTtlMs);
    }

    public CeilingBreakerConfig withCleanWindowMs(long cleanWindowMs) {
        return new CeilingBreakerConfig(enabled, floor, ceiling, initial, cleanWindowMs, stateTtlMs);
    }
}

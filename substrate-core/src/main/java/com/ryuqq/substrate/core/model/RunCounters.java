package com.ryuqq.substrate.core.model;

import com.ryuqq.substrate.core.statemachine.CounterDelta;

/**
 * Run 단위 집계 카운터 (불변 record).
 *
 * <p>정합성이 맞춰진(reconciled) 상태에서는
 * {@code pending + processing + success + failed == total}이 성립하며,
 * 어떤 필드도 음수가 될 수 없습니다.</p>
 *
 * @param total 전체 Item 수
 * @param pending 대기 중 Item 수
 * @param processing 처리 중 Item 수
 * @param success 성공 Item 수
 * @param failed 실패 Item 수
 * @param startEpochSeconds Run 시작 시각 (epoch 초, 알 수 없으면 0)
 * @author Substrate Team
 * @since 1.0.0
 */
public record RunCounters(
    int total,
    int pending,
    int processing,
    int success,
    int failed,
    long startEpochSeconds
) {

    /**
     * Compact constructor: 음수 값은 0으로 보정합니다.
     */
    public RunCounters {
        total = Math.max(0, total);
        pending = Math.max(0, pending);
        processing = Math.max(0, processing);
        success = Math.max(0, success);
        failed = Math.max(0, failed);
        startEpochSeconds = Math.max(0L, startEpochSeconds);
    }

    /**
     * 새 Run의 초기 카운터.
     *
     * @param total 전체 Item 수
     * @param startEpochSeconds 시작 시각 (epoch 초)
     * @return 모든 Item이 pending인 카운터
     */
    public static RunCounters seeded(int total, long startEpochSeconds) {
        int clamped = Math.max(0, total);
        return new RunCounters(clamped, clamped, 0, 0, 0, startEpochSeconds);
    }

    /**
     * 비어 있는 카운터.
     *
     * @return 모든 값이 0인 카운터
     */
    public static RunCounters empty() {
        return new RunCounters(0, 0, 0, 0, 0, 0L);
    }

    /**
     * 처리 완료된 Item 수 (success + failed).
     *
     * @return 처리 완료 수
     */
    public int processed() {
        return success + failed;
    }

    /**
     * 모든 필드의 합이 0인지 여부.
     *
     * @return 비어 있으면 true
     */
    public boolean isBlank() {
        return total + pending + processing + success + failed == 0;
    }

    /**
     * 델타를 적용한 새 카운터를 반환합니다.
     *
     * <p>감소분은 현재 값까지만 적용됩니다 (0 미만으로 내려가지 않음).
     * total은 변경하지 않습니다.</p>
     *
     * @param delta 적용할 델타
     * @return 새 RunCounters 인스턴스
     */
    public RunCounters apply(CounterDelta delta) {
        return new RunCounters(
            total,
            clampedAdd(pending, delta.pending()),
            clampedAdd(processing, delta.processing()),
            clampedAdd(success, delta.success()),
            clampedAdd(failed, delta.failed()),
            startEpochSeconds
        );
    }

    private static int clampedAdd(int current, int delta) {
        if (delta < 0) {
            return current - Math.min(current, -delta);
        }
        return current + delta;
    }
}

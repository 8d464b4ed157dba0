package com.ryuqq.substrate.core.outcome;

/**
 * 작업 한 번 실행의 생명주기 결과.
 *
 * <ul>
 *   <li>{@link Completed}: 작업 성공</li>
 *   <li>{@link RetryScheduled}: 실패했으나 backoff 후 재시도 예약</li>
 *   <li>{@link DeadLettered}: 재시도 한도 소진 또는 재시도 불가 실패로 격리</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public sealed interface TaskOutcome permits Completed, RetryScheduled, DeadLettered {

    /**
     * 원본 작업 ID.
     *
     * @return 작업 ID
     */
    String taskId();

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    default boolean isRetryScheduled() {
        return this instanceof RetryScheduled;
    }

    default boolean isDeadLettered() {
        return this instanceof DeadLettered;
    }
}

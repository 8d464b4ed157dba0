package com.ryuqq.substrate.core.outcome;

/**
 * backoff 후 재시도가 예약된 일시적 실패.
 *
 * @param taskId 작업 ID
 * @param retryNumber 이번 재시도 번호 (1부터 시작)
 * @param countdownMillis 재시도까지 대기 시간 (밀리초)
 * @param reason 실패 사유
 * @author Substrate Team
 * @since 1.0.0
 */
public record RetryScheduled(
    String taskId,
    int retryNumber,
    long countdownMillis,
    String reason
) implements TaskOutcome {

    public RetryScheduled {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
        if (retryNumber < 1) {
            throw new IllegalArgumentException("retryNumber must be positive (current: " + retryNumber + ")");
        }
        if (countdownMillis < 0) {
            throw new IllegalArgumentException("countdownMillis must be non-negative (current: " + countdownMillis + ")");
        }
    }
}

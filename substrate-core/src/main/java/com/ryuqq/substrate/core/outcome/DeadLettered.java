package com.ryuqq.substrate.core.outcome;

/**
 * Dead-letter 저장소로 격리된 영구 실패.
 *
 * @param taskId 작업 ID
 * @param reason 마지막 실패 사유
 * @param attempts 총 시도 횟수
 * @author Substrate Team
 * @since 1.0.0
 */
public record DeadLettered(String taskId, String reason, int attempts) implements TaskOutcome {

    public DeadLettered {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }
}

package com.ryuqq.substrate.core.outcome;

/**
 * 작업 성공.
 *
 * @param taskId 작업 ID
 * @param result 작업 반환값 (null 허용)
 * @author Substrate Team
 * @since 1.0.0
 */
public record Completed(String taskId, Object result) implements TaskOutcome {

    public Completed {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
    }
}

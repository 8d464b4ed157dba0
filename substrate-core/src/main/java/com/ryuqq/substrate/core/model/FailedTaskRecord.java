package com.ryuqq.substrate.core.model;

import java.time.Instant;

/**
 * Dead-letter 저장소에 격리된 영구 실패 작업 기록 (불변 record).
 *
 * <p>taskId 당 최대 하나의 기록만 존재합니다. 같은 taskId가 다른 시도 번호로 다시 격리되면
 * 기존 기록이 갱신되고 {@code retryCount}가 증가하며 미해결 상태로 되돌아갑니다.
 * 같은 시도 번호의 중복 보고는 무시됩니다.</p>
 *
 * @param id 저장소가 부여한 식별자 (저장 전에는 0)
 * @param taskId 원본 작업 ID
 * @param taskName 원본 작업 이름 (재제출 시 사용)
 * @param argsJson 위치 인자 JSON (없으면 null)
 * @param kwargsJson 키워드 인자 JSON (없으면 null)
 * @param errorMessage 마지막 오류 메시지
 * @param queueName 원본 큐 이름
 * @param attempts 격리 시점까지의 총 시도 횟수
 * @param retryCount 격리된 횟수
 * @param failedAt 마지막 격리 시각
 * @param resolved 해결(재제출) 여부
 * @param resolvedAt 해결 시각 (미해결이면 null)
 * @author Substrate Team
 * @since 1.0.0
 */
public record FailedTaskRecord(
    long id,
    String taskId,
    String taskName,
    String argsJson,
    String kwargsJson,
    String errorMessage,
    String queueName,
    int attempts,
    int retryCount,
    Instant failedAt,
    boolean resolved,
    Instant resolvedAt
) {

    public FailedTaskRecord {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("taskName cannot be null or blank");
        }
        if (failedAt == null) {
            throw new IllegalArgumentException("failedAt cannot be null");
        }
        if (queueName == null || queueName.isBlank()) {
            queueName = "unknown";
        }
        if (attempts < 1) {
            throw new IllegalArgumentException(
                "attempts must be positive (current: " + attempts + ")"
            );
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException(
                "retryCount cannot be negative (current: " + retryCount + ")"
            );
        }
    }

    /**
     * 저장 전 새 기록 생성.
     *
     * @param taskId 작업 ID
     * @param taskName 작업 이름
     * @param argsJson 위치 인자 JSON
     * @param kwargsJson 키워드 인자 JSON
     * @param errorMessage 오류 메시지
     * @param queueName 큐 이름
     * @param attempts 총 시도 횟수
     * @param failedAt 실패 시각
     * @return 미해결 상태의 새 기록 (id=0, retryCount=0)
     */
    public static FailedTaskRecord newRecord(
        String taskId,
        String taskName,
        String argsJson,
        String kwargsJson,
        String errorMessage,
        String queueName,
        int attempts,
        Instant failedAt
    ) {
        return new FailedTaskRecord(0L, taskId, taskName, argsJson, kwargsJson,
            errorMessage, queueName, attempts, 0, failedAt, false, null);
    }

    public FailedTaskRecord withId(long id) {
        return new FailedTaskRecord(id, taskId, taskName, argsJson, kwargsJson,
            errorMessage, queueName, attempts, retryCount, failedAt, resolved, resolvedAt);
    }

    public FailedTaskRecord withRetryCount(int retryCount) {
        return new FailedTaskRecord(id, taskId, taskName, argsJson, kwargsJson,
            errorMessage, queueName, attempts, retryCount, failedAt, resolved, resolvedAt);
    }

    /**
     * 해결 처리된 새 인스턴스 생성.
     *
     * @param resolvedAt 해결 시각
     * @return resolved=true인 새 인스턴스
     */
    public FailedTaskRecord resolve(Instant resolvedAt) {
        if (resolvedAt == null) {
            throw new IllegalArgumentException("resolvedAt cannot be null");
        }
        return new FailedTaskRecord(id, taskId, taskName, argsJson, kwargsJson,
            errorMessage, queueName, attempts, retryCount, failedAt, true, resolvedAt);
    }

    public FailedTaskRecord reopen() {
        return new FailedTaskRecord(id, taskId, taskName, argsJson, kwargsJson,
            errorMessage, queueName, attempts, retryCount, failedAt, false, null);
    }
}

package com.ryuqq.substrate.adapter.runner.batch;

/**
 * WriteBatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxBatch: 한 번에 drain할 최대 페이로드 수 (기본 500)</li>
 *   <li>maxWaitMs: 마지막 flush 후 이 시간이 지나면 batch가 차지 않아도 drain (기본 100ms)</li>
 *   <li>chunkSize: 세션 내 부분 커밋 기준 페이로드 수 (기본 30)</li>
 *   <li>commitIntervalMs: 마지막 커밋 후 이 시간이 지나면 부분 커밋 (기본 30ms)</li>
 *   <li>commitRetries: 커밋 경합 시 최대 시도 횟수 (기본 5)</li>
 *   <li>maxContentionRequeues: 페이로드당 경합 재적재 상한, 초과 시 실패 처리 (기본 50)</li>
 *   <li>markFinishedOnCommit: 커밋 성공 시 Run Item을 SUCCESS로 기록 (기본 true)</li>
 *   <li>shutdownTimeoutMs: close() 시 잔여 큐 처리 대기 시간 (기본 10000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>쓰기 잠금 점유 시간 단축: chunkSize 감소 (30 → 10), commitIntervalMs 감소</li>
 *   <li>처리량 우선: maxBatch 증가, chunkSize 증가</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 * @param maxBatch 최대 batch 크기 (1 이상)
 * @param maxWaitMs 최대 대기 시간 (밀리초, 양수)
 * @param chunkSize 부분 커밋 크기 (1 이상)
 * @param commitIntervalMs 부분 커밋 간격 (밀리초, 0 이상)
 * @param commitRetries 커밋 시도 횟수 (1 이상)
 * @param maxContentionRequeues 경합 재적재 상한 (0 이상)
 * @param markFinishedOnCommit 커밋 성공 시 성공 기록 여부
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수)
 */
public record WriteBatcherConfig(
    int maxBatch,
    long maxWaitMs,
    int chunkSize,
    long commitIntervalMs,
    int commitRetries,
    int maxContentionRequeues,
    boolean markFinishedOnCommit,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxBatch=500, maxWaitMs=100, chunkSize=30, commitIntervalMs=30,
     * commitRetries=5, maxContentionRequeues=50, markFinishedOnCommit=true, shutdownTimeoutMs=10000</p>
     */
    public WriteBatcherConfig() {
        this(500, 100, 30, 30, 5, 50, true, 10_000);
    }

    public WriteBatcherConfig {
        if (maxBatch <= 0) {
            throw new IllegalArgumentException("maxBatch must be positive (current: " + maxBatch + ")");
        }
        if (maxWaitMs <= 0) {
            throw new IllegalArgumentException("maxWaitMs must be positive (current: " + maxWaitMs + ")");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive (current: " + chunkSize + ")");
        }
        if (commitIntervalMs < 0) {
            throw new IllegalArgumentException(
                "commitIntervalMs cannot be negative (current: " + commitIntervalMs + ")"
            );
        }
        if (commitRetries <= 0) {
            throw new IllegalArgumentException("commitRetries must be positive (current: " + commitRetries + ")");
        }
        if (maxContentionRequeues < 0) {
            throw new IllegalArgumentException(
                "maxContentionRequeues cannot be negative (current: " + maxContentionRequeues + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public WriteBatcherConfig withMaxBatch(int maxBatch) {
        return new WriteBatcherConfig(maxBatch, maxWaitMs, chunkSize, commitIntervalMs, commitRetries,
            maxContentionRequeues, markFinishedOnCommit, shutdownTimeoutMs);
    }

    public WriteBatcherConfig withMaxWaitMs(long maxWaitMs) {
        return new WriteBatcherConfig(maxBatch, maxWaitMs, chunkSize, commitIntervalMs, commitRetries,
            maxContentionRequeues, markFinishedOnCommit, shutdownTimeoutMs);
    }

    public WriteBatcherConfig withChunkSize(int chunkSize) {
        return new WriteBatcherConfig(maxBatch, maxWaitMs, chunkSize, commitIntervalMs, commitRetries,
            maxContentionRequeues, markFinishedOnCommit, shutdownTimeoutMs);
    }

    public WriteBatcherConfig withCommitIntervalMs(long commitIntervalMs) {
        return new WriteBatcherConfig(maxBatch, maxWaitMs, chunkSize, commitIntervalMs, commitRetries,
            maxContentionRequeues, markFinishedOnCommit, shutdownTimeoutMs);
    }

    public WriteBatcherConfig withCommitRetries(int commitRetries) {
        return new WriteBatcherConfig(maxBatch, maxWaitMs, chunkSize, commitIntervalMs, commitRetries,
            maxContentionRequeues, markFinishedOnCommit, shutdownTimeoutMs);
    }

    public WriteBatcherConfig withMaxContentionRequeues(int maxContentionRequeues) {
        return new WriteBatcherConfig(maxBatch, maxWaitMs, chunkSize, commitIntervalMs, commitRetries,
            maxContentionRequeues, markFinishedOnCommit, shutdownTimeoutMs);
    }

    public WriteBatcherConfig withMarkFinishedOnCommit(boolean markFinishedOnCommit) {
        return new WriteBatcherConfig(maxBatch, maxWaitMs, chunkSize, commitIntervalMs, commitRetries,
            maxContentionRequeues, markFinishedOnCommit, shutdownTimeoutMs);
    }
}

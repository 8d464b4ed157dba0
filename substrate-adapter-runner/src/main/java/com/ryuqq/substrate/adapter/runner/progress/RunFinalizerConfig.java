package com.ryuqq.substrate.adapter.runner.progress;

/**
 * RunFinalizer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>staleAfterMs: 처리 완료 수가 이 시간 동안 변하지 않은 미완료 Run을 정체로 판단 (기본 30분)</li>
 *   <li>batchSize: 한 번의 scan에서 정리할 최대 Run 수 (기본 100)</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 * @param staleAfterMs 정체 판단 기준 (밀리초, 양수)
 * @param batchSize 스캔 배치 크기 (1 이상)
 */
public record RunFinalizerConfig(long staleAfterMs, int batchSize) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: staleAfterMs=1800000ms (30분), batchSize=100</p>
     */
    public RunFinalizerConfig() {
        this(1_800_000, 100);
    }

    public RunFinalizerConfig {
        if (staleAfterMs <= 0) {
            throw new IllegalArgumentException(
                "staleAfterMs must be positive (current: " + staleAfterMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public RunFinalizerConfig withStaleAfterMs(long staleAfterMs) {
        return new RunFinalizerConfig(staleAfterMs, this.batchSize);
    }

    public RunFinalizerConfig withBatchSize(int batchSize) {
        return new RunFinalizerConfig(this.staleAfterMs, batchSize);
    }
}

package com.ryuqq.substrate.core.protection;

/**
 * Hybrid Admission Controller 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>syncIntervalMs: 로컬 버킷이 공유 저장소와 동기화하는 주기 (기본 100ms)</li>
 *   <li>headroom: 로컬 할당량 여유 배수 (기본 1.2)</li>
 *   <li>workerProcessCount: 전역 상한을 나눠 가지는 워커 프로세스 수 (기본 1)</li>
 *   <li>failOpenTokens: 저장소 장애 시 부여하는 최대 토큰 수 (기본 2)</li>
 *   <li>retrySleepCapMs: tryAcquire 재시도 전 최대 대기 (기본 250ms)</li>
 *   <li>blockSliceMs: blockUntilAcquired 한 번의 시도 구간 (기본 250ms)</li>
 *   <li>blockPauseMs: 실패한 구간 사이 휴지 (기본 50ms)</li>
 *   <li>holdExtendMarginMs: hold 연장이 무시되는 여유 (기본 100ms)</li>
 * </ul>
 *
 * @param syncIntervalMs 동기화 주기 (밀리초)
 * @param headroom 여유 배수 (1.0 이상)
 * @param workerProcessCount 워커 프로세스 수
 * @param failOpenTokens 장애 시 토큰 수
 * @param retrySleepCapMs 재시도 대기 상한
 * @param blockSliceMs 시도 구간
 * @param blockPauseMs 구간 사이 휴지
 * @param holdExtendMarginMs hold 연장 여유
 * @author Substrate Team
 * @since 1.0.0
 */
public record AdmissionConfig(
    long syncIntervalMs,
    double headroom,
    int workerProcessCount,
    int failOpenTokens,
    long retrySleepCapMs,
    long blockSliceMs,
    long blockPauseMs,
    long holdExtendMarginMs
) {

    /**
     * 기본 설정 생성자.
     */
    public AdmissionConfig() {
        this(100, 1.2, 1, 2, 250, 250, 50, 100);
    }

    public AdmissionConfig {
        if (syncIntervalMs <= 0) {
            throw new IllegalArgumentException("syncIntervalMs must be positive (current: " + syncIntervalMs + ")");
        }
        if (headroom < 1.0) {
            throw new IllegalArgumentException("headroom must be at least 1.0 (current: " + headroom + ")");
        }
        if (workerProcessCount <= 0) {
            throw new IllegalArgumentException("workerProcessCount must be positive (current: " + workerProcessCount + ")");
        }
        if (failOpenTokens < 0) {
            throw new IllegalArgumentException("failOpenTokens cannot be negative (current: " + failOpenTokens + ")");
        }
        if (retrySleepCapMs < 0 || blockSliceMs <= 0 || blockPauseMs < 0 || holdExtendMarginMs < 0) {
            throw new IllegalArgumentException(
                "Invalid wait settings (retrySleepCapMs: " + retrySleepCapMs + ", blockSliceMs: " + blockSliceMs
                    + ", blockPauseMs: " + blockPauseMs + ", holdExtendMarginMs: " + holdExtendMarginMs + ")"
            );
        }
    }

    /**
     * 워커 하나가 한 동기화 주기에 요청할 로컬 할당량.
     *
     * <p>{@code max(1, floor(ceiling × syncInterval(초) × headroom / workerProcessCount))}</p>
     *
     * @param ceiling 현재 초당 허용량
     * @return 로컬 할당량 (1 이상)
     */
    public int localQuota(int ceiling) {
        double perInterval = ceiling * (syncIntervalMs / 1000.0) * headroom / Math.max(1, workerProcessCount);
        return (int) Math.max(1, Math.floor(perInterval));
    }

    public AdmissionConfig withSyncIntervalMs(long syncIntervalMs) {
        return new AdmissionConfig(syncIntervalMs, headroom, workerProcessCount, failOpenTokens,
            retrySleepCapMs, blockSliceMs, blockPauseMs, holdExtendMarginMs);
    }

    public AdmissionConfig withHeadroom(double headroom) {
        return new AdmissionConfig(syncIntervalMs, headroom, workerProcessCount, failOpenTokens,
            retrySleepCapMs, blockSliceMs, blockPauseMs, holdExtendMarginMs);
    }

    public AdmissionConfig withWorkerProcessCount(int workerProcessCount) {
        return new AdmissionConfig(syncIntervalMs, headroom, workerProcessCount, failOpenTokens,
            retrySleepCapMs, blockSliceMs, blockPauseMs, holdExtendMarginMs);
    }

    public AdmissionConfig withFailOpenTokens(int failOpenTokens) {
        return new AdmissionConfig(syncIntervalMs, headroom, workerProcessCount, failOpenTokens,
            retrySleepCapMs, blockSliceMs, blockPauseMs, holdExtendMarginMs);
    }
}

package com.ryuqq.substrate.core.protection;

/**
 * 외부 호출 입장(admission) 제어 SPI.
 *
 * <p>key(예: provider 이름) 단위로 초당 호출 수를 제한합니다.
 * 모든 메서드는 여러 스레드에서 동시에 호출될 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!admission.tryAcquire("openai", 100, 250)) {
 *     throw new RetryableException("rate limited");
 * }
 * callProvider();
 * }</pre>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface AdmissionController {

    /**
     * 토큰 1개 획득 시도 (짧은 대기 허용).
     *
     * <p>한 번 시도 후 실패하면 {@code maxWaitMs} 이내에서 한 번 대기한 뒤 정확히 한 번 재시도합니다.</p>
     *
     * @param key 제한 키
     * @param limitPerSecond 초당 허용량
     * @param maxWaitMs 최대 대기 시간 (밀리초)
     * @return 획득 여부
     */
    boolean tryAcquire(String key, int limitPerSecond, long maxWaitMs);

    /**
     * 마감 시각까지 반복하여 토큰 획득.
     *
     * <p>활성화된 hold가 있으면 먼저 hold가 끝날 때까지 대기합니다.</p>
     *
     * @param key 제한 키
     * @param limitPerSecond 초당 허용량
     * @param maxBlockMs 최대 대기 시간 (밀리초)
     * @return 마감 전에 획득하면 true
     */
    boolean blockUntilAcquired(String key, int limitPerSecond, long maxBlockMs);

    /**
     * key에 대한 전역 hold 설정 (연장만 가능, 단축 불가).
     *
     * @param key 제한 키
     * @param holdMs hold 기간 (밀리초)
     * @param reason 사유 (로그용)
     */
    void setHold(String key, long holdMs, String reason);

    /**
     * 남은 hold 시간 조회.
     *
     * @param key 제한 키
     * @return 남은 시간 (밀리초, hold가 없거나 조회 실패 시 0)
     */
    long holdRemainingMillis(String key);
}

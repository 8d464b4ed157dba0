package com.ryuqq.substrate.core.protection;

/**
 * 적응형 전역 RPS 상한 SPI.
 *
 * <p>일반적인 OPEN/CLOSED Circuit Breaker와 달리 요청을 차단하지 않고,
 * 모든 워커가 공유하는 초당 허용량 상한(ceiling)을 조정합니다.</p>
 *
 * <ul>
 *   <li>첫 시도의 전송 실패: 상한 절반 (floor 이하로 내려가지 않음)</li>
 *   <li>마지막 오류 이후 일정 시간 경과 후 첫 시도 성공: 상한 두 배 (ceiling 이상으로 올라가지 않음)</li>
 *   <li>그 외 첫 시도 실패: 마지막 오류 시각만 갱신</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface RateCeilingBreaker {

    /**
     * 호출 결과 반영.
     *
     * <p>구현체는 저장소 오류를 호출자에게 전파해서는 안 됩니다.</p>
     *
     * @param result 호출 결과
     */
    void recordAttempt(AttemptResult result);

    /**
     * 현재 전역 상한 조회.
     *
     * @return 초당 허용량 상한
     */
    int currentCeiling();
}

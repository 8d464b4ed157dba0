package com.ryuqq.substrate.core.protection;

/**
 * 외부 호출 한 번의 결과 (Circuit Breaker 입력).
 *
 * <p>Circuit Breaker는 {@code firstAttempt}가 true인 결과만 반영합니다.
 * 재시도 호출의 결과는 무시됩니다.</p>
 *
 * @param firstAttempt 작업의 첫 번째 시도인지 여부
 * @param ok 성공 여부
 * @param statusCode 응답 상태 코드 (응답을 받지 못했으면 null)
 * @param connectionError 연결 수준 오류 여부
 * @author Substrate Team
 * @since 1.0.0
 */
public record AttemptResult(boolean firstAttempt, boolean ok, Integer statusCode, boolean connectionError) {

    public static AttemptResult success(boolean firstAttempt, int statusCode) {
        return new AttemptResult(firstAttempt, true, statusCode, false);
    }

    public static AttemptResult failure(boolean firstAttempt, int statusCode) {
        return new AttemptResult(firstAttempt, false, statusCode, false);
    }

    public static AttemptResult connectionFailure(boolean firstAttempt) {
        return new AttemptResult(firstAttempt, false, null, true);
    }

    /**
     * 전송 계층 실패 여부 (연결 오류 또는 상태 코드 없음).
     *
     * @return 실패이면서 연결 오류이거나 상태 코드가 없으면 true
     */
    public boolean isTransportFailure() {
        return !ok && (connectionError || statusCode == null);
    }
}

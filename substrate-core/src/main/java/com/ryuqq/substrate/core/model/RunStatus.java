package com.ryuqq.substrate.core.model;

/**
 * Run의 표시용 상태.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public enum RunStatus {

    /** 아직 어떤 Item도 대기/처리 중이 아님 */
    NOT_STARTED("not_started"),

    /** 대기 또는 처리 중인 Item이 존재 */
    PROCESSING("processing"),

    /** 처리 완료 수가 전체 수에 도달 */
    COMPLETED("completed");

    private final String wireValue;

    RunStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 이벤트 페이로드에 사용되는 문자열 값.
     *
     * @return wire 값 (예: "not_started")
     */
    public String wireValue() {
        return wireValue;
    }
}

package com.ryuqq.substrate.core.statemachine;

/**
 * Run 내 개별 Item의 상태.
 *
 * <p>상태 맵에 기록이 없는 Item은 {@link #PENDING}으로 간주합니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public enum ItemState {

    /** 대기 (기록 없음 포함) */
    PENDING("pending"),

    /** 처리 중 */
    PROCESSING("processing"),

    /** 성공 */
    SUCCESS("success"),

    /** 실패 */
    FAILED("failed");

    private final String wireValue;

    ItemState(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 저장소에 기록되는 문자열 값.
     *
     * @return wire 값 (예: "processing")
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * 처리 완료 상태(SUCCESS 또는 FAILED)인지 여부.
     *
     * @return 완료 상태이면 true
     */
    public boolean isFinished() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * wire 값으로부터 상태 조회.
     *
     * @param wireValue 저장소 문자열 값
     * @return 대응하는 상태
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ItemState fromWireValue(String wireValue) {
        for (ItemState state : values()) {
            if (state.wireValue.equals(wireValue)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown item state: " + wireValue);
    }

    /**
     * 처리 결과에 대응하는 완료 상태.
     *
     * @param ok 성공 여부
     * @return SUCCESS 또는 FAILED
     */
    public static ItemState finishedOf(boolean ok) {
        return ok ? SUCCESS : FAILED;
    }
}

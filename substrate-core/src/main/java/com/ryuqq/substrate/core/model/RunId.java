package com.ryuqq.substrate.core.model;

/**
 * 분석 Run의 전역 고유 식별자.
 *
 * <p>RunId는 하나의 장기 실행 분석 작업(여러 Item의 묶음)을 식별하며,
 * 공유 저장소의 진행 카운터 키를 구성하는 데 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * <p>값은 {@code run:{runId}:state}처럼 콜론으로 구분되는 저장소 키에 그대로 들어가므로
 * 콜론, 슬래시, 공백은 허용하지 않습니다. 외부 시스템의 ID에 이런 문자가 있으면
 * 호출자가 허용 문자로 변환(예: 해시, URL-safe Base64)한 뒤 사용해야 합니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class RunId {

    private final String value;

    private RunId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("RunId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("RunId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * RunId 생성.
     *
     * @param value RunId 값
     * @return RunId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RunId of(String value) {
        return new RunId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId runId = (RunId) o;
        return value.equals(runId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RunId{" + value + '}';
    }
}

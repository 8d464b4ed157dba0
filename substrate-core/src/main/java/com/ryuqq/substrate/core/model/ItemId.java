package com.ryuqq.substrate.core.model;

/**
 * Run에 속한 개별 작업 단위(Item)의 식별자.
 *
 * <p>Item 상태 맵의 필드 키로 사용되므로 공백을 허용하지 않습니다.
 * 숫자 행 ID는 {@link #of(long)}로 생성할 수 있습니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class ItemId {

    private final String value;

    private ItemId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ItemId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ItemId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.:]+$")) {
            throw new IllegalArgumentException("ItemId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * ItemId 생성.
     *
     * @param value ItemId 값
     * @return ItemId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ItemId of(String value) {
        return new ItemId(value);
    }

    /**
     * 숫자 행 ID로부터 ItemId 생성.
     *
     * @param rowId 행 ID
     * @return ItemId 인스턴스
     */
    public static ItemId of(long rowId) {
        return new ItemId(Long.toString(rowId));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ItemId itemId = (ItemId) o;
        return value.equals(itemId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ItemId{" + value + '}';
    }
}

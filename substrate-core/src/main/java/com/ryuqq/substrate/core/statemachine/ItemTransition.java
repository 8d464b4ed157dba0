package com.ryuqq.substrate.core.statemachine;

import java.util.EnumSet;
import java.util.Set;

/**
 * Item 상태 전이 규칙과 카운터 델타 계산.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>{@link #STARTABLE} → PROCESSING (시작)</li>
 *   <li>{@link #FINISHABLE} → SUCCESS | FAILED (완료, 시작이 관측되지 않은 완료 포함)</li>
 *   <li>{@link #RESTARTABLE} → PROCESSING (재분석)</li>
 * </ul>
 *
 * <p>허용 여부는 저장소의 {@code compareAndTransition}이 이 집합으로 원자적으로 판정합니다.</p>
 *
 * <p>모든 전이는 이전 상태 필드를 1 감소시키고 새 상태 필드를 1 증가시킵니다.
 * 같은 상태로의 전이는 변화가 없습니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class ItemTransition {

    /** 시작 전이가 허용되는 이전 상태 */
    public static final Set<ItemState> STARTABLE = EnumSet.of(ItemState.PENDING);

    /** 완료 전이가 허용되는 이전 상태 */
    public static final Set<ItemState> FINISHABLE = EnumSet.of(ItemState.PENDING, ItemState.PROCESSING);

    /** 재시작 전이가 허용되는 이전 상태 */
    public static final Set<ItemState> RESTARTABLE = EnumSet.of(ItemState.SUCCESS, ItemState.FAILED);

    private ItemTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이에 따른 카운터 델타.
     *
     * @param from 이전 상태
     * @param to 새 상태
     * @return 델타 (같은 상태이면 {@link CounterDelta#ZERO})
     */
    public static CounterDelta delta(ItemState from, ItemState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from == to) {
            return CounterDelta.ZERO;
        }
        return CounterDelta.of(from, -1).plus(CounterDelta.of(to, 1));
    }
}

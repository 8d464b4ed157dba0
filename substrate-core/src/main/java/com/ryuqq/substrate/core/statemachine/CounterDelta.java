package com.ryuqq.substrate.core.statemachine;

/**
 * Run 카운터에 적용할 필드별 증감량.
 *
 * @param pending pending 증감
 * @param processing processing 증감
 * @param success success 증감
 * @param failed failed 증감
 * @author Substrate Team
 * @since 1.0.0
 */
public record CounterDelta(int pending, int processing, int success, int failed) {

    public static final CounterDelta ZERO = new CounterDelta(0, 0, 0, 0);

    /**
     * 두 델타의 합.
     *
     * @param other 더할 델타
     * @return 합산된 새 델타
     */
    public CounterDelta plus(CounterDelta other) {
        return new CounterDelta(
            pending + other.pending,
            processing + other.processing,
            success + other.success,
            failed + other.failed
        );
    }

    public boolean isZero() {
        return pending == 0 && processing == 0 && success == 0 && failed == 0;
    }

    static CounterDelta of(ItemState state, int amount) {
        return switch (state) {
            case PENDING -> new CounterDelta(amount, 0, 0, 0);
            case PROCESSING -> new CounterDelta(0, amount, 0, 0);
            case SUCCESS -> new CounterDelta(0, 0, amount, 0);
            case FAILED -> new CounterDelta(0, 0, 0, amount);
        };
    }
}

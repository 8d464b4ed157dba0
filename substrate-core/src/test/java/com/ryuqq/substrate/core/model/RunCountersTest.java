package com.ryuqq.substrate.core.model;

import com.ryuqq.substrate.core.statemachine.CounterDelta;
import com.ryuqq.substrate.core.statemachine.ItemState;
import com.ryuqq.substrate.core.statemachine.ItemTransition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RunCounters 테스트.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
class RunCountersTest {

    @Test
    void seeded_모든_Item이_pending() {
        // when
        RunCounters counters = RunCounters.seeded(10, 1_700_000_000L);

        // then
        assertEquals(10, counters.total());
        assertEquals(10, counters.pending());
        assertEquals(0, counters.processing());
        assertEquals(0, counters.processed());
        assertEquals(1_700_000_000L, counters.startEpochSeconds());
    }

    @Test
    void 음수_값은_0으로_보정() {
        // when
        RunCounters counters = new RunCounters(-1, -2, -3, -4, -5, -6);

        // then
        assertTrue(counters.isBlank());
        assertEquals(0L, counters.startEpochSeconds());
    }

    @Test
    void apply_시작_전이는_pending에서_processing으로_이동() {
        // given
        RunCounters counters = RunCounters.seeded(3, 0);

        // when
        RunCounters next = counters.apply(ItemTransition.delta(ItemState.PENDING, ItemState.PROCESSING));

        // then
        assertEquals(2, next.pending());
        assertEquals(1, next.processing());
        assertEquals(3, next.total());
    }

    @Test
    void apply_감소는_0_미만으로_내려가지_않음() {
        // given
        RunCounters counters = new RunCounters(1, 0, 0, 1, 0, 0);

        // when
        RunCounters next = counters.apply(new CounterDelta(-1, -3, 0, 1));

        // then
        assertEquals(0, next.pending());
        assertEquals(0, next.processing());
        assertEquals(1, next.success());
        assertEquals(1, next.failed());
    }
}

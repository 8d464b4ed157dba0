package com.ryuqq.substrate.core.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProgressSnapshot 계산 규칙 테스트.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
class ProgressSnapshotTest {

    private static final long START = 1_700_000_000L;

    @Test
    void processed가_total에_도달하면_completed_이고_pending_processing은_0() {
        // given: 정합성이 깨져 processing이 남아 있는 상태
        RunCounters counters = new RunCounters(10, 1, 2, 7, 3, START);

        // when
        ProgressSnapshot snapshot = ProgressSnapshot.from(counters, (START + 10) * 1000L);

        // then
        assertEquals(RunStatus.COMPLETED, snapshot.status());
        assertTrue(snapshot.isComplete());
        assertFalse(snapshot.isRunning());
        assertEquals(0, snapshot.pending());
        assertEquals(0, snapshot.processing());
        assertEquals(10, snapshot.processed());
        assertEquals(70.0, snapshot.percentComplete());
        assertEquals(1.0, snapshot.qps());
    }

    @Test
    void 대기_Item이_있으면_processing() {
        // given
        RunCounters counters = new RunCounters(3, 1, 1, 1, 0, START);

        // when
        ProgressSnapshot snapshot = ProgressSnapshot.from(counters, (START + 3) * 1000L);

        // then
        assertEquals(RunStatus.PROCESSING, snapshot.status());
        assertEquals(33.33, snapshot.percentComplete());
        assertEquals(0.33, snapshot.qps());
    }

    @Test
    void total이_0이면_not_started() {
        // when
        ProgressSnapshot snapshot = ProgressSnapshot.from(RunCounters.empty(), 0L);

        // then
        assertEquals(RunStatus.NOT_STARTED, snapshot.status());
        assertEquals(0.0, snapshot.percentComplete());
        assertEquals(0.0, snapshot.qps());
    }

    @Test
    void 경과_시간은_최소_1초로_계산() {
        // given
        RunCounters counters = new RunCounters(100, 90, 0, 10, 0, START);

        // when: 시작 직후
        ProgressSnapshot snapshot = ProgressSnapshot.from(counters, START * 1000L + 200);

        // then
        assertEquals(10.0, snapshot.qps());
    }

    @Test
    void toEventData_wire_필드_포함() {
        // given
        ProgressSnapshot snapshot = ProgressSnapshot.from(RunCounters.seeded(2, START), START * 1000L);

        // when
        Map<String, Object> data = snapshot.toEventData();

        // then
        assertEquals("processing", data.get("status"));
        assertEquals(2, data.get("total"));
        assertEquals(false, data.get("is_complete"));
        assertEquals(true, data.get("running"));
    }
}

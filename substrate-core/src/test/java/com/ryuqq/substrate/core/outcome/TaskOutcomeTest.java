package com.ryuqq.substrate.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskOutcome 테스트.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
class TaskOutcomeTest {

    @Test
    void 각_케이스의_판별_메서드() {
        TaskOutcome completed = new Completed("t-1", "ok");
        TaskOutcome retry = new RetryScheduled("t-1", 1, 20_000, "timeout");
        TaskOutcome dead = new DeadLettered("t-1", "boom", 121);

        assertTrue(completed.isCompleted());
        assertTrue(retry.isRetryScheduled());
        assertTrue(dead.isDeadLettered());
        assertFalse(dead.isCompleted());
    }

    @Test
    void RetryScheduled_재시도_번호는_1_이상() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryScheduled("t-1", 0, 0, "x")
        );
        assertTrue(exception.getMessage().contains("retryNumber must be positive"));
    }

    @Test
    void RetryScheduled_음수_대기는_불가() {
        assertThrows(IllegalArgumentException.class, () -> new RetryScheduled("t-1", 1, -1, "x"));
    }
}

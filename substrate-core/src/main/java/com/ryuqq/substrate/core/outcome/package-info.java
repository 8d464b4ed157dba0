/**
 * Task lifecycle outcomes.
 *
 * <p>{@link com.ryuqq.substrate.core.outcome.TaskOutcome} is a sealed interface with three cases:
 * {@link com.ryuqq.substrate.core.outcome.Completed},
 * {@link com.ryuqq.substrate.core.outcome.RetryScheduled} and
 * {@link com.ryuqq.substrate.core.outcome.DeadLettered}.</p>
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.core.outcome;

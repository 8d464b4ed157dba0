/**
 * Protection SPIs guarding outbound provider calls.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.core.protection.AdmissionController} - Per-key rate admission with holds</li>
 *   <li>{@link com.ryuqq.substrate.core.protection.RateCeilingBreaker} - Adaptive global requests-per-second ceiling</li>
 *   <li>{@link com.ryuqq.substrate.core.protection.AttemptResult} - Input fed to the breaker</li>
 * </ul>
 *
 * <p>NoOp implementations live in {@code protection.noop}; the breaker NoOp doubles as the kill-switch.</p>
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.core.protection;

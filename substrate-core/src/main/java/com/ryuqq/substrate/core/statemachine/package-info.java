/**
 * Work item state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.core.statemachine.ItemState} - Item states (absent means PENDING)</li>
 *   <li>{@link com.ryuqq.substrate.core.statemachine.ItemTransition} - Allowed transitions and counter deltas</li>
 *   <li>{@link com.ryuqq.substrate.core.statemachine.CounterDelta} - Per-field counter adjustment</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * PENDING → PROCESSING            (start)
 * PROCESSING → SUCCESS | FAILED   (finish)
 * PENDING → SUCCESS | FAILED      (finish without observed start)
 * SUCCESS | FAILED → PROCESSING   (restart)
 * SUCCESS ↔ FAILED                (correction)
 * PROCESSING → PENDING            (requeue)
 * </pre>
 *
 * <p>Every transition moves exactly one unit from the source field to the target field.</p>
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.core.statemachine;

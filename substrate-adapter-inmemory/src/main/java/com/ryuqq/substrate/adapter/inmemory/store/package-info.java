/**
 * In-memory shared-store and dead-letter adapters.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.adapter.inmemory.store.InMemoryRateLimitStore}:
 *       rate windows, holds and global ceiling with TTLs on a pluggable clock</li>
 *   <li>{@link com.ryuqq.substrate.adapter.inmemory.store.InMemoryProgressStore}:
 *       per-run counters and item states with per-run atomicity</li>
 *   <li>{@link com.ryuqq.substrate.adapter.inmemory.store.InMemoryDeadLetterStore}:
 *       failed task records keyed by task id</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>State is process-local and lost on restart</li>
 *   <li>Suitable for contract tests and as a reference implementation</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
package com.ryuqq.substrate.adapter.inmemory.store;

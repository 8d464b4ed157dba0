/**
 * Service Provider Interfaces implemented by storage, messaging and persistence adapters.
 *
 * <h2>Shared Store</h2>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.core.spi.RateLimitStore} - Rate windows, holds and the global ceiling</li>
 *   <li>{@link com.ryuqq.substrate.core.spi.ProgressStore} - Per-run counters and item states</li>
 * </ul>
 *
 * <h2>Durable Store</h2>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.core.spi.DeadLetterStore} - Quarantined failed tasks</li>
 *   <li>{@link com.ryuqq.substrate.core.spi.PersistenceGateway} - Sessions for batched writes</li>
 * </ul>
 *
 * <h2>Messaging</h2>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.core.spi.EventSink} - Telemetry events</li>
 *   <li>{@link com.ryuqq.substrate.core.spi.TaskSubmitter} - Task re-submission</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.core.spi;

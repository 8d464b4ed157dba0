/**
 * Core domain model package containing value objects and records.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.core.model.RunId} - Run unique identifier</li>
 *   <li>{@link com.ryuqq.substrate.core.model.ItemId} - Work item identifier within a run</li>
 * </ul>
 *
 * <h2>Progress</h2>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.core.model.RunCounters} - Per-run aggregate counters</li>
 *   <li>{@link com.ryuqq.substrate.core.model.ProgressSnapshot} - Display-ready progress view</li>
 *   <li>{@link com.ryuqq.substrate.core.model.RunStatus} - not_started / processing / completed</li>
 * </ul>
 *
 * <h2>Dead Letters and Writes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.core.model.FailedTaskRecord} - Quarantined permanently failed task</li>
 *   <li>{@link com.ryuqq.substrate.core.model.DeadLetterStats} - Dead-letter store statistics</li>
 *   <li>{@link com.ryuqq.substrate.core.model.BatchedWritePayload} - Opaque persistence payload</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.core.model;

/**
 * ProgressTracker 구현체와 정체 Run 정리.
 *
 * <ul>
 *   <li>{@link com.ryuqq.substrate.adapter.runner.progress.StoreBackedProgressLedger} - 전이마다 저장소 원자 연산</li>
 *   <li>{@link com.ryuqq.substrate.adapter.runner.progress.BufferedProgressLedger} - 로컬 미러 + 배치 flush</li>
 *   <li>{@link com.ryuqq.substrate.adapter.runner.progress.RunFinalizer} - 정체 Run 강제 마무리</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
package com.ryuqq.substrate.adapter.runner.progress;

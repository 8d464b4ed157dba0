/**
 * Run 진행 카운터 포트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.application.progress.ProgressTracker} - Run/Item 진행 상태 기록 및 스냅샷 인터페이스</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code StoreBackedProgressLedger}, {@code BufferedProgressLedger}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.substrate.application.progress;

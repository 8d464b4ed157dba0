/**
 * 배치 영속화 큐 포트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.application.batch.WriteQueue} - 페이로드 적재 및 드레인 대기</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code WriteBatcher}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.substrate.application.batch;

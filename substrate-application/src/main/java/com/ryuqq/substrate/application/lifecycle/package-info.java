/**
 * 작업 생명주기 포트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.substrate.application.lifecycle.TaskHooks} - 성공/재시도/영구 실패 콜백</li>
 *   <li>{@link com.ryuqq.substrate.application.lifecycle.TaskContext} - 작업 식별자와 인자</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code TaskLifecycleManager}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.substrate.application.lifecycle;

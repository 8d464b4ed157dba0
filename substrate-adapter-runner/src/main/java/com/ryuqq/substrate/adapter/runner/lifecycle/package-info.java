/**
 * 작업 생명주기: 재시도 백오프, dead-letter, 완료 이벤트.
 *
 * <ul>
 *   <li>{@link com.ryuqq.substrate.adapter.runner.lifecycle.TaskLifecycleManager} - 성공/재시도/영구 실패 분기</li>
 *   <li>{@link com.ryuqq.substrate.adapter.runner.lifecycle.TieredBackoffPolicy} - 구간별 지연 + jitter</li>
 *   <li>{@link com.ryuqq.substrate.adapter.runner.lifecycle.DeadLetterService} - 격리, 재제출, 유지보수</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
package com.ryuqq.substrate.adapter.runner.lifecycle;

/**
 * 공유 저장소 기반 Admission 구현체.
 *
 * <ul>
 *   <li>{@link com.ryuqq.substrate.adapter.runner.admission.HybridAdmissionController} - 로컬 버킷 + 공유 윈도우</li>
 *   <li>{@link com.ryuqq.substrate.adapter.runner.admission.AdaptiveCeilingBreaker} - 글로벌 ceiling 조정</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
package com.ryuqq.substrate.adapter.runner.admission;

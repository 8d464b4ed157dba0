/**
 * 이벤트 발행 래퍼.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
package com.ryuqq.substrate.adapter.runner.event;

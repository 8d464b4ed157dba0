/**
 * 단일 쓰기 스레드 배처.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
package com.ryuqq.substrate.adapter.runner.batch;

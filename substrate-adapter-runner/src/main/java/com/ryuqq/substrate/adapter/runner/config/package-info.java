/**
 * 환경 설정 로딩과 워커 구성.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
package com.ryuqq.substrate.adapter.runner.config;

package com.ryuqq.substrate.adapter.runner.lifecycle;

/**
 * 재시도해도 성공할 수 없는 작업 오류.
 *
 * <p>작업 본문에서 이 예외를 던지면 남은 재시도 횟수와 관계없이
 * 즉시 dead-letter로 격리됩니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class NonRetriableTaskException extends RuntimeException {

    public NonRetriableTaskException(String message) {
        super(message);
    }

    public NonRetriableTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}

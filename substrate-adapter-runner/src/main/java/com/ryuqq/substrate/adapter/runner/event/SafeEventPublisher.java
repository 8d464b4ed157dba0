package com.ryuqq.substrate.adapter.runner.event;

import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.spi.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 예외를 전파하지 않는 이벤트 발행기.
 *
 * <p>이벤트 발행은 텔레메트리이므로 실패해도 호출자의 흐름을 막지 않습니다.
 * {@link EventSink} 오류는 debug 로그만 남기고 무시됩니다.</p>
 *
 * <p><strong>Scope 규칙:</strong></p>
 * <ul>
 *   <li>{@code task:{taskId}} - 개별 작업 이벤트 (progress, completed, retry, failed, status)</li>
 *   <li>{@code global} - Run 단위 이벤트 (run_complete, analysis_failed)</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class SafeEventPublisher {

    public static final String GLOBAL_SCOPE = "global";
    public static final String RUN_COMPLETE = "run_complete";

    private static final Logger log = LoggerFactory.getLogger(SafeEventPublisher.class);

    private final EventSink sink;

    /**
     * 생성자.
     *
     * @param sink 이벤트 싱크
     * @throws IllegalArgumentException sink가 null인 경우
     */
    public SafeEventPublisher(EventSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    /**
     * 이벤트 발행.
     *
     * @param scope 이벤트 scope
     * @param eventType 이벤트 타입
     * @param data 페이로드
     * @return 발행 성공 여부
     */
    public boolean publish(String scope, String eventType, Map<String, Object> data) {
        try {
            sink.publish(scope, eventType, data == null ? Map.of() : data);
            return true;
        } catch (RuntimeException e) {
            log.debug("Failed to publish {} event on {}", eventType, scope, e);
            return false;
        }
    }

    /**
     * Run 완료 이벤트 발행 ({@code global} scope).
     *
     * @param runId Run ID
     * @param snapshot 최종 스냅샷
     * @return 발행 성공 여부
     */
    public boolean publishRunComplete(RunId runId, ProgressSnapshot snapshot) {
        return publishRunComplete(runId, snapshot, "Run completed");
    }

    /**
     * Run 완료 이벤트 발행 ({@code global} scope).
     *
     * @param runId Run ID
     * @param snapshot 최종 스냅샷
     * @param message 표시 메시지
     * @return 발행 성공 여부
     */
    public boolean publishRunComplete(RunId runId, ProgressSnapshot snapshot, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("run_id", runId.getValue());
        data.putAll(snapshot.toEventData());
        data.put("message", message);
        return publish(GLOBAL_SCOPE, RUN_COMPLETE, data);
    }
}

package com.ryuqq.substrate.core.spi;

import java.util.Map;

/**
 * Event publication boundary.
 *
 * <p>Scopes used by this library: {@code task:{taskId}} for per-task lifecycle events
 * and {@code global} for run-level events ({@code run_complete}, {@code analysis_failed}).</p>
 *
 * <p>Implementations may throw; callers wrap the sink so that telemetry never
 * blocks or fails the work being reported.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface EventSink {

    /**
     * Publishes an event.
     *
     * @param scope event scope
     * @param eventType event type
     * @param data event payload
     */
    void publish(String scope, String eventType, Map<String, Object> data);
}

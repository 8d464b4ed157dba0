package com.ryuqq.substrate.adapter.inmemory.event;

import com.ryuqq.substrate.core.spi.EventSink;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link EventSink} that records every published event.
 *
 * <p><strong>Failure Injection:</strong> {@link #setFailing(boolean)} makes
 * {@link #publish} throw, to verify that callers never propagate telemetry errors.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class InMemoryEventSink implements EventSink {

    private final CopyOnWriteArrayList<PublishedEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void publish(String scope, String eventType, Map<String, Object> data) {
        if (failing) {
            throw new IllegalStateException("event sink unavailable");
        }
        events.add(new PublishedEvent(scope, eventType, data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data))));
    }

    public List<PublishedEvent> getEvents() {
        return List.copyOf(events);
    }

    /**
     * Returns events of a given type, in publication order.
     *
     * @param eventType event type
     * @return matching events
     */
    public List<PublishedEvent> eventsOfType(String eventType) {
        return events.stream()
            .filter(e -> e.eventType().equals(eventType))
            .collect(Collectors.toList());
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    /**
     * Clears recorded events (for testing).
     */
    public void clear() {
        events.clear();
        failing = false;
    }

    /**
     * A recorded event.
     *
     * @param scope event scope
     * @param eventType event type
     * @param data payload copy
     */
    public record PublishedEvent(String scope, String eventType, Map<String, Object> data) {
    }
}

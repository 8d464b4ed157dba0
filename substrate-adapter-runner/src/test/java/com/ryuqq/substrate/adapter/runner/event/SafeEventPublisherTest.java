package com.ryuqq.substrate.adapter.runner.event;

import com.ryuqq.substrate.adapter.inmemory.event.InMemoryEventSink;
import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.model.RunCounters;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.spi.EventSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;

/**
 * SafeEventPublisher 테스트.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SafeEventPublisherTest {

    @Mock
    private EventSink sink;

    @Test
    void publish_sink_예외를_삼키고_false_반환() {
        // given
        doThrow(new IllegalStateException("bus down")).when(sink).publish(anyString(), anyString(), anyMap());
        SafeEventPublisher publisher = new SafeEventPublisher(sink);

        // when
        boolean published = publisher.publish("task:1", "completed", Map.of("task_id", "1"));

        // then
        assertThat(published).isFalse();
    }

    @Test
    void publish_null_데이터는_빈_맵으로_전달() {
        // given
        InMemoryEventSink recording = new InMemoryEventSink();
        SafeEventPublisher publisher = new SafeEventPublisher(recording);

        // when
        boolean published = publisher.publish("task:1", "status", null);

        // then
        assertThat(published).isTrue();
        assertThat(recording.getEvents().get(0).data()).isEmpty();
    }

    @Test
    void publishRunComplete_글로벌_scope에_스냅샷과_메시지_포함() {
        // given
        InMemoryEventSink recording = new InMemoryEventSink();
        SafeEventPublisher publisher = new SafeEventPublisher(recording);
        ProgressSnapshot snapshot = ProgressSnapshot.from(new RunCounters(10, 0, 0, 7, 3, 0L), 0L);

        // when
        publisher.publishRunComplete(RunId.of("r1"), snapshot, "Run completed with failures");

        // then
        InMemoryEventSink.PublishedEvent event = recording.getEvents().get(0);
        assertThat(event.scope()).isEqualTo("global");
        assertThat(event.eventType()).isEqualTo("run_complete");
        assertThat(event.data())
            .containsEntry("run_id", "r1")
            .containsEntry("total", 10)
            .containsEntry("success", 7)
            .containsEntry("failed", 3)
            .containsEntry("percent_complete", 70.0)
            .containsEntry("is_complete", true)
            .containsEntry("status", "completed")
            .containsEntry("message", "Run completed with failures");
    }

    @Test
    void 생성자_null_sink는_예외() {
        assertThatThrownBy(() -> new SafeEventPublisher(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

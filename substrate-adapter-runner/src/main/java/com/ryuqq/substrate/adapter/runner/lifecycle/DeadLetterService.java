package com.ryuqq.substrate.adapter.runner.lifecycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.substrate.application.lifecycle.TaskContext;
import com.ryuqq.substrate.core.model.DeadLetterStats;
import com.ryuqq.substrate.core.model.FailedTaskRecord;
import com.ryuqq.substrate.core.spi.DeadLetterStore;
import com.ryuqq.substrate.core.spi.TaskSubmitter;
import com.ryuqq.substrate.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Dead-letter 격리, 재제출, 유지보수 서비스.
 *
 * <p>작업 인자(args, kwargs)는 Jackson으로 JSON 직렬화되어 저장되고,
 * 재제출 시 같은 형태로 역직렬화되어 원래 작업 이름으로 다시 제출됩니다.</p>
 *
 * <p><strong>재제출 규칙:</strong></p>
 * <ul>
 *   <li>기록이 없거나 이미 해결된 경우: false</li>
 *   <li>작업 이름이 등록되어 있지 않은 경우: false</li>
 *   <li>제출 성공 후 기록을 해결 처리: true</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);
    private static final int TOP_FAILURE_TYPES = 10;
    private static final TypeReference<List<Object>> ARGS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> KWARGS_TYPE = new TypeReference<>() {
    };

    private final DeadLetterStore store;
    private final TaskSubmitter submitter;
    private final ObjectMapper mapper;
    private final TimeSource timeSource;

    /**
     * 생성자.
     *
     * @param store Dead-letter 저장소
     * @param submitter 작업 제출기
     * @param mapper 인자 직렬화용 ObjectMapper
     * @param timeSource 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeadLetterService(
        DeadLetterStore store,
        TaskSubmitter submitter,
        ObjectMapper mapper,
        TimeSource timeSource
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (submitter == null) {
            throw new IllegalArgumentException("submitter cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.store = store;
        this.submitter = submitter;
        this.mapper = mapper;
        this.timeSource = timeSource;
    }

    /**
     * 영구 실패 작업을 격리.
     *
     * <p>예외를 전파하지 않습니다. 같은 작업의 같은 시도가 중복 보고되면
     * 저장소가 기존 기록을 그대로 반환합니다.</p>
     *
     * @param context 작업 컨텍스트
     * @param error 마지막 오류
     * @return 저장된 기록 (저장 실패 시 empty)
     */
    public Optional<FailedTaskRecord> record(TaskContext context, Throwable error) {
        try {
            FailedTaskRecord candidate = FailedTaskRecord.newRecord(
                context.taskId(),
                context.taskName(),
                toJson(context.args()),
                toJson(context.kwargs()),
                describe(error),
                context.queueName(),
                context.retryCount() + 1,
                now()
            );
            FailedTaskRecord stored = store.upsert(candidate);
            log.info("Stored failed task {} ({}) in dead-letter, retryCount={}",
                stored.taskId(), stored.taskName(), stored.retryCount());
            return Optional.of(stored);
        } catch (RuntimeException e) {
            log.error("Failed to store task {} in dead-letter", context.taskId(), e);
            return Optional.empty();
        }
    }

    /**
     * 격리된 작업을 원래 이름과 인자로 재제출.
     *
     * <p>기록을 먼저 resolved로 선점한 뒤 제출합니다. 제출이 실패하면 선점을 되돌립니다.
     * 동시에 호출되어도 제출은 한 번만 일어나며, false는 제출하지 않았음을 뜻합니다.</p>
     *
     * @param taskId 격리된 작업 ID
     * @return 재제출 성공 여부
     */
    public boolean retry(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return false;
        }
        try {
            Optional<FailedTaskRecord> found = store.findByTaskId(taskId);
            if (found.isEmpty()) {
                log.warn("Dead-letter record not found for task {}", taskId);
                return false;
            }
            FailedTaskRecord record = found.get();
            if (record.resolved()) {
                log.info("Dead-letter record for task {} is already resolved", taskId);
                return false;
            }
            if (!submitter.isRegistered(record.taskName())) {
                log.error("Cannot requeue task {}: task name {} is not registered", taskId, record.taskName());
                return false;
            }

            List<Object> args = record.argsJson() == null ? List.of() : mapper.readValue(record.argsJson(), ARGS_TYPE);
            Map<String, Object> kwargs = record.kwargsJson() == null
                ? Map.of()
                : mapper.readValue(record.kwargsJson(), KWARGS_TYPE);

            if (!store.markResolved(taskId, now())) {
                log.info("Dead-letter record for task {} was resolved concurrently", taskId);
                return false;
            }
            String newTaskId;
            try {
                newTaskId = submitter.submit(record.taskName(), args, kwargs);
            } catch (RuntimeException e) {
                store.reopen(taskId);
                throw e;
            }
            log.info("Requeued dead-letter task {} as {} ({})", taskId, newTaskId, record.taskName());
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to decode arguments of dead-letter task {}", taskId, e);
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to requeue dead-letter task {}", taskId, e);
            return false;
        }
    }

    /**
     * 최근 미해결 기록을 작업 이름별로 집계하여 로그로 남김.
     *
     * @param window 조회 구간
     * @return 작업 이름 → 미해결 건수
     */
    public Map<String, Long> processUnresolved(Duration window) {
        requireWindow(window);
        List<FailedTaskRecord> unresolved = store.findUnresolvedSince(now().minus(window));
        Map<String, Long> byTask = new TreeMap<>();
        for (FailedTaskRecord record : unresolved) {
            byTask.merge(record.taskName(), 1L, Long::sum);
        }
        if (byTask.isEmpty()) {
            log.info("No unresolved dead-letter records in the last {}", window);
        } else {
            log.warn("{} unresolved dead-letter records in the last {}", unresolved.size(), window);
            byTask.forEach((taskName, count) -> log.warn("  {}: {} failures", taskName, count));
        }
        return byTask;
    }

    /**
     * Dead-letter 통계.
     *
     * @param window 실패 건수를 셀 최근 구간
     * @return 통계 (실패 유형 상위 10개)
     */
    public DeadLetterStats stats(Duration window) {
        requireWindow(window);
        return store.stats(now().minus(window), TOP_FAILURE_TYPES);
    }

    /**
     * 해결된 지 오래된 기록 삭제.
     *
     * @param age 보존 기간
     * @return 삭제된 기록 수
     */
    public int purgeResolvedOlderThan(Duration age) {
        requireWindow(age);
        int purged = store.purgeResolvedBefore(now().minus(age));
        log.info("Purged {} resolved dead-letter records older than {}", purged, age);
        return purged;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize task arguments, storing string form", e);
            return mapper.valueToTree(String.valueOf(value)).toString();
        }
    }

    private Instant now() {
        return Instant.ofEpochMilli(timeSource.currentTimeMillis());
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null ? error.getClass().getName() : error.getMessage();
    }

    private static void requireWindow(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("window cannot be null or negative");
        }
    }
}

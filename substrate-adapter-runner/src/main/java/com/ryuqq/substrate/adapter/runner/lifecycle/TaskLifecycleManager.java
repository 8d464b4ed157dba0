package com.ryuqq.substrate.adapter.runner.lifecycle;

import com.ryuqq.substrate.adapter.runner.event.SafeEventPublisher;
import com.ryuqq.substrate.application.lifecycle.TaskContext;
import com.ryuqq.substrate.application.lifecycle.TaskHooks;
import com.ryuqq.substrate.application.progress.ProgressTracker;
import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.outcome.Completed;
import com.ryuqq.substrate.core.outcome.DeadLettered;
import com.ryuqq.substrate.core.outcome.RetryScheduled;
import com.ryuqq.substrate.core.outcome.TaskOutcome;
import com.ryuqq.substrate.core.spi.PersistenceGateway;
import com.ryuqq.substrate.core.spi.PersistenceSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 작업 생명주기 관리자.
 *
 * <p>작업 실행 결과를 관측하여 성공/재시도/영구 실패를 분기하고,
 * 진행 장부와 dead-letter, 이벤트를 일관되게 갱신합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(ctx, work)
 *   ↓
 * markStarted(run, item)           (Run에 속한 작업만)
 *   ↓
 * work.call()
 *   ├─ 성공 → onSuccess → Completed
 *   ├─ NonRetriableTaskException → onFailure → DeadLettered
 *   └─ 기타 예외 → retryWithBackoff
 *        ├─ retryNumber ≤ maxRetries → onRetry → RetryScheduled(countdown)
 *        └─ 초과 → onFailure → DeadLettered
 * </pre>
 *
 * <p><strong>영구 실패 처리 (onFailure):</strong> 각 단계는 독립적으로 실행되며
 * 어느 단계의 실패도 다음 단계나 호출자에게 전파되지 않습니다.</p>
 * <ol>
 *   <li>dead-letter 기록 저장</li>
 *   <li>{@code failed} 이벤트 (permanent=true) 및 {@code status} 이벤트 발행</li>
 *   <li>진행 장부 markFinished(run, item, false)</li>
 *   <li>처리 완료 수가 전체에 도달하면 flush 후 {@code run_complete} 발행</li>
 *   <li>영속 작업 행을 실패로 표시</li>
 * </ol>
 *
 * <p>성공 카운트는 결과가 커밋되는 쓰기 경로(WriteBatcher)가 담당합니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class TaskLifecycleManager implements TaskHooks {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycleManager.class);

    private final ProgressTracker ledger;
    private final DeadLetterService deadLetters;
    private final SafeEventPublisher events;
    private final PersistenceGateway persistence;
    private final TieredBackoffPolicy backoffPolicy;

    /**
     * 생성자.
     *
     * @param ledger 진행 장부 (일반적으로 BufferedProgressLedger)
     * @param deadLetters dead-letter 서비스
     * @param events 이벤트 발행기
     * @param persistence 작업 행 실패 표시용 영속 게이트웨이
     * @param backoffPolicy 재시도 백오프 정책
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TaskLifecycleManager(
        ProgressTracker ledger,
        DeadLetterService deadLetters,
        SafeEventPublisher events,
        PersistenceGateway persistence,
        TieredBackoffPolicy backoffPolicy
    ) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (deadLetters == null) {
            throw new IllegalArgumentException("deadLetters cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (persistence == null) {
            throw new IllegalArgumentException("persistence cannot be null");
        }
        if (backoffPolicy == null) {
            throw new IllegalArgumentException("backoffPolicy cannot be null");
        }
        this.ledger = ledger;
        this.deadLetters = deadLetters;
        this.events = events;
        this.persistence = persistence;
        this.backoffPolicy = backoffPolicy;
    }

    /**
     * 작업 실행 및 결과 분기.
     *
     * @param context 작업 컨텍스트
     * @param work 작업 본문
     * @return 실행 결과
     */
    public TaskOutcome execute(TaskContext context, Callable<?> work) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }

        if (context.hasRunItem()) {
            try {
                ledger.markStarted(context.runId(), context.itemId());
            } catch (RuntimeException e) {
                log.debug("Failed to mark {} started in {}", context.itemId(), context.runId(), e);
            }
        }

        Object result;
        try {
            result = work.call();
        } catch (NonRetriableTaskException e) {
            onFailure(context, e);
            return new DeadLettered(context.taskId(), describe(e), context.retryCount() + 1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return retryWithBackoff(context, e);
        } catch (Exception e) {
            return retryWithBackoff(context, e);
        }

        onSuccess(context, result);
        return new Completed(context.taskId(), result);
    }

    /**
     * 구간별 백오프로 재시도를 예약하거나, 재시도 예산을 소진했으면 영구 실패 처리.
     *
     * @param context 작업 컨텍스트 (retryCount = 지금까지의 재시도 횟수)
     * @param error 발생한 오류
     * @return RetryScheduled 또는 DeadLettered
     */
    public TaskOutcome retryWithBackoff(TaskContext context, Throwable error) {
        int retryNumber = context.retryCount() + 1;
        if (retryNumber > backoffPolicy.getMaxRetries()) {
            onFailure(context, error);
            return new DeadLettered(context.taskId(), describe(error), retryNumber);
        }
        long countdown = backoffPolicy.delayMillis(retryNumber);
        onRetry(context, error, retryNumber);
        return new RetryScheduled(context.taskId(), retryNumber, countdown, describe(error));
    }

    @Override
    public void onSuccess(TaskContext context, Object result) {
        log.debug("Task {} completed successfully", context.taskId());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", context.taskId());
        data.put("message", "Task completed successfully");
        data.put("result", result);
        events.publish(context.eventScope(), "completed", data);
    }

    @Override
    public void onRetry(TaskContext context, Throwable error, int retryNumber) {
        log.warn("Task {} retry {}/{} - {}", context.taskId(), retryNumber,
            backoffPolicy.getMaxRetries(), describe(error));

        Map<String, Object> retry = new LinkedHashMap<>();
        retry.put("task_id", context.taskId());
        retry.put("error", describe(error));
        retry.put("retry_count", retryNumber);
        retry.put("max_retries", backoffPolicy.getMaxRetries());
        events.publish(context.eventScope(), "retry", retry);

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("task_id", context.taskId());
        status.put("status", "retrying");
        status.put("error", describe(error));
        status.put("retry_count", retryNumber);
        events.publish(context.eventScope(), "status", status);
    }

    @Override
    public void onFailure(TaskContext context, Throwable error) {
        log.error("Task {} failed after {} retries: {}", context.taskId(), context.retryCount(), describe(error));

        deadLetters.record(context, error);
        publishFailure(context, error);

        if (!context.hasRunItem()) {
            return;
        }
        settleRunItem(context);
        markPersistedItemFailed(context, error);
    }

    /**
     * 작업 진행률 이벤트 발행 ({@code task:{id}} scope, 이벤트 타입 {@code progress}).
     *
     * @param context 작업 컨텍스트
     * @param percent 진행률 (0~100)
     * @param stage 현재 단계
     * @param message 표시 메시지
     */
    public void publishProgress(TaskContext context, int percent, String stage, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", context.taskId());
        data.put("progress", Math.max(0, Math.min(100, percent)));
        data.put("status", stage);
        data.put("message", message == null ? "" : message);
        events.publish(context.eventScope(), "progress", data);
    }

    private void publishFailure(TaskContext context, Throwable error) {
        Map<String, Object> failed = new LinkedHashMap<>();
        failed.put("task_id", context.taskId());
        failed.put("error", describe(error));
        failed.put("permanent", true);
        events.publish(context.eventScope(), "failed", failed);

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("task_id", context.taskId());
        status.put("status", "failed");
        status.put("error", describe(error));
        events.publish(context.eventScope(), "status", status);
    }

    private void settleRunItem(TaskContext context) {
        try {
            ProgressSnapshot snapshot = ledger.markFinished(context.runId(), context.itemId(), false);
            if (snapshot.total() > 0 && snapshot.processed() >= snapshot.total()) {
                ledger.flush();
                ProgressSnapshot finalSnapshot = ledger.snapshot(context.runId());
                events.publishRunComplete(context.runId(), finalSnapshot, "Run completed with failures");
                log.info("Run {} completed: success={}, failed={}", context.runId().getValue(),
                    finalSnapshot.success(), finalSnapshot.failed());
            }
        } catch (RuntimeException e) {
            log.debug("Failed to settle {} of {}", context.itemId(), context.runId(), e);
        }
    }

    private void markPersistedItemFailed(TaskContext context, Throwable error) {
        try (PersistenceSession session = persistence.openSession()) {
            session.markItemFailed(context.itemId(), describe(error));
            session.commit();
        } catch (RuntimeException e) {
            log.debug("Failed to mark persisted item {} failed", context.itemId(), e);
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}

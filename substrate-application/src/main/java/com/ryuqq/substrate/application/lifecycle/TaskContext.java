package com.ryuqq.substrate.application.lifecycle;

import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.RunId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity and arguments of one task execution.
 *
 * <p>{@code retryCount} is the number of retries already performed, so the first
 * attempt has {@code retryCount == 0}. {@code runId} and {@code itemId} are present
 * when the task processes one item of a tracked run.</p>
 *
 * @param taskId task id
 * @param taskName registered task name
 * @param queueName originating queue
 * @param args positional arguments
 * @param kwargs keyword arguments
 * @param retryCount retries performed so far
 * @param runId run of the item, or null
 * @param itemId item processed, or null
 * @author Substrate Team
 * @since 1.0.0
 */
public record TaskContext(
    String taskId,
    String taskName,
    String queueName,
    List<Object> args,
    Map<String, Object> kwargs,
    int retryCount,
    RunId runId,
    ItemId itemId
) {

    public TaskContext {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("taskName cannot be null or blank");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount cannot be negative (current: " + retryCount + ")");
        }
        if ((runId == null) != (itemId == null)) {
            throw new IllegalArgumentException("runId and itemId must be both present or both absent");
        }
        queueName = queueName == null || queueName.isBlank() ? "unknown" : queueName;
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    /**
     * Context of a task that is not tied to a run item.
     *
     * @param taskId task id
     * @param taskName task name
     * @param queueName queue name
     * @param args positional arguments
     * @param kwargs keyword arguments
     * @return a first-attempt context
     */
    public static TaskContext of(String taskId, String taskName, String queueName,
                                 List<Object> args, Map<String, Object> kwargs) {
        return new TaskContext(taskId, taskName, queueName, args, kwargs, 0, null, null);
    }

    /**
     * Context of a task processing one item of a run.
     *
     * @param taskId task id
     * @param taskName task name
     * @param queueName queue name
     * @param args positional arguments
     * @param kwargs keyword arguments
     * @param runId the run
     * @param itemId the item
     * @return a first-attempt context
     */
    public static TaskContext forItem(String taskId, String taskName, String queueName,
                                      List<Object> args, Map<String, Object> kwargs,
                                      RunId runId, ItemId itemId) {
        return new TaskContext(taskId, taskName, queueName, args, kwargs, 0, runId, itemId);
    }

    public boolean isFirstAttempt() {
        return retryCount == 0;
    }

    public boolean hasRunItem() {
        return runId != null;
    }

    /**
     * Event scope of this task ({@code task:{taskId}}).
     *
     * @return the scope
     */
    public String eventScope() {
        return "task:" + taskId;
    }

    public TaskContext withRetryCount(int retryCount) {
        return new TaskContext(taskId, taskName, queueName, args, kwargs, retryCount, runId, itemId);
    }
}

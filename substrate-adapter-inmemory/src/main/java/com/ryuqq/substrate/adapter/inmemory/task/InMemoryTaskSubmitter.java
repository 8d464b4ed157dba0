package com.ryuqq.substrate.adapter.inmemory.task;

import com.ryuqq.substrate.core.spi.TaskSubmissionException;
import com.ryuqq.substrate.core.spi.TaskSubmitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link TaskSubmitter} recording submissions.
 *
 * <p>Only task names passed to {@link #register(String)} are accepted.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class InMemoryTaskSubmitter implements TaskSubmitter {

    private final Set<String> registered = ConcurrentHashMap.newKeySet();
    private final CopyOnWriteArrayList<Submission> submissions = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean rejecting;

    public InMemoryTaskSubmitter register(String taskName) {
        registered.add(taskName);
        return this;
    }

    @Override
    public boolean isRegistered(String taskName) {
        return taskName != null && registered.contains(taskName);
    }

    @Override
    public String submit(String taskName, List<Object> args, Map<String, Object> kwargs) {
        if (!isRegistered(taskName)) {
            throw new IllegalArgumentException("Unknown task: " + taskName);
        }
        if (rejecting) {
            throw new TaskSubmissionException("Queue rejected submission of " + taskName);
        }
        String taskId = "task-" + sequence.incrementAndGet();
        submissions.add(new Submission(taskId, taskName,
            args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args)),
            kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs))));
        return taskId;
    }

    public List<Submission> getSubmissions() {
        return List.copyOf(submissions);
    }

    /**
     * Makes every subsequent {@link #submit} throw {@link TaskSubmissionException}.
     *
     * @param rejecting true to reject submissions
     */
    public void setRejecting(boolean rejecting) {
        this.rejecting = rejecting;
    }

    /**
     * Clears submissions and registrations (for testing).
     */
    public void clear() {
        rejecting = false;
        registered.clear();
        submissions.clear();
        sequence.set(0);
    }

    /**
     * A recorded submission.
     *
     * @param taskId assigned task id
     * @param taskName task name
     * @param args positional arguments
     * @param kwargs keyword arguments
     */
    public record Submission(String taskId, String taskName, List<Object> args, Map<String, Object> kwargs) {
    }
}

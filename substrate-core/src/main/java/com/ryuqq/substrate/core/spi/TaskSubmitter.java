package com.ryuqq.substrate.core.spi;

import java.util.List;
import java.util.Map;

/**
 * Task queue submission SPI, used to re-submit dead-lettered tasks.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface TaskSubmitter {

    /**
     * Whether a task with this name can be submitted.
     *
     * @param taskName registered task name
     * @return true if registered
     */
    boolean isRegistered(String taskName);

    /**
     * Submits a task for asynchronous execution.
     *
     * @param taskName registered task name
     * @param args positional arguments
     * @param kwargs keyword arguments
     * @return the new task id
     * @throws IllegalArgumentException if the task name is not registered
     * @throws TaskSubmissionException if the queue rejects the submission
     */
    String submit(String taskName, List<Object> args, Map<String, Object> kwargs);
}

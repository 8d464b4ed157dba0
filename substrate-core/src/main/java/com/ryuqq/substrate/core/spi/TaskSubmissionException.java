package com.ryuqq.substrate.core.spi;

/**
 * The task queue did not accept a submission (broker unavailable, serialization rejected).
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class TaskSubmissionException extends RuntimeException {

    public TaskSubmissionException(String message) {
        super(message);
    }

    public TaskSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}

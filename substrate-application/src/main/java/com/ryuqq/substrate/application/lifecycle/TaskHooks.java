package com.ryuqq.substrate.application.lifecycle;

/**
 * Lifecycle callbacks invoked by the task runtime.
 *
 * <p>Implementations must never throw: bookkeeping failures are logged and swallowed
 * so that they cannot change the outcome of the task being reported.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface TaskHooks {

    /**
     * Called once when the task body returns normally.
     *
     * @param context the task
     * @param result the returned value (may be null)
     */
    void onSuccess(TaskContext context, Object result);

    /**
     * Called when a failed attempt is scheduled for retry.
     *
     * @param context the task (retry count before this retry)
     * @param error the failure
     * @param retryNumber the number of the upcoming retry (1-based)
     */
    void onRetry(TaskContext context, Throwable error, int retryNumber);

    /**
     * Called once when the task fails permanently.
     *
     * @param context the task
     * @param error the last failure
     */
    void onFailure(TaskContext context, Throwable error);
}

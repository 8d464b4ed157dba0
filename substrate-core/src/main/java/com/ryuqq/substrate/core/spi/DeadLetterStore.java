package com.ryuqq.substrate.core.spi;

import com.ryuqq.substrate.core.model.DeadLetterStats;
import com.ryuqq.substrate.core.model.FailedTaskRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage SPI for permanently failed tasks.
 *
 * <p>Records are keyed by {@code taskId}; at most one record exists per task.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface DeadLetterStore {

    /**
     * Inserts a record, or updates the existing record of the same task.
     *
     * <p>If a record for the task already exists with the same {@code attempts}, the call is a
     * duplicate report and returns the existing record unchanged (resolved or not).
     * Otherwise, on update the arguments, error message and failure time are replaced,
     * {@code retryCount} is incremented and the record becomes unresolved again.
     * A newly inserted record starts with {@code retryCount = 1}.</p>
     *
     * @param candidate the record to store (id and retryCount are ignored)
     * @return the stored record
     */
    FailedTaskRecord upsert(FailedTaskRecord candidate);

    /**
     * Finds a record by task id.
     *
     * @param taskId the original task id
     * @return the record, or empty
     */
    Optional<FailedTaskRecord> findByTaskId(String taskId);

    /**
     * Marks an unresolved record resolved.
     *
     * @param taskId the original task id
     * @param resolvedAt resolution time
     * @return true if the record existed and was unresolved
     */
    boolean markResolved(String taskId, Instant resolvedAt);

    /**
     * Reverts a resolution, e.g. when the requeue that claimed the record could not submit.
     *
     * @param taskId the original task id
     * @return true if the record existed and was resolved
     */
    boolean reopen(String taskId);

    /**
     * Lists unresolved records that failed at or after {@code since}, newest first.
     *
     * @param since lower bound of failure time
     * @return matching records
     */
    List<FailedTaskRecord> findUnresolvedSince(Instant since);

    /**
     * Computes statistics.
     *
     * @param windowStart lower bound for {@link DeadLetterStats#failedInWindow()}
     * @param topFailureTypes maximum number of failure types to report
     * @return statistics
     */
    DeadLetterStats stats(Instant windowStart, int topFailureTypes);

    /**
     * Deletes resolved records resolved before {@code cutoff}.
     *
     * @param cutoff resolution time bound
     * @return number of deleted records
     */
    int purgeResolvedBefore(Instant cutoff);
}

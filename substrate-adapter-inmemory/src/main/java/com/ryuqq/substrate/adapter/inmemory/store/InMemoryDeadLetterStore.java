package com.ryuqq.substrate.adapter.inmemory.store;

import com.ryuqq.substrate.core.model.DeadLetterStats;
import com.ryuqq.substrate.core.model.FailedTaskRecord;
import com.ryuqq.substrate.core.spi.DeadLetterStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link DeadLetterStore} for testing and reference purposes.
 *
 * <p>Records are keyed by task id. A repeated report carrying the same attempt count
 * returns the existing record untouched. Mutations are {@code synchronized} so an upsert and a
 * concurrent resolve never interleave.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class InMemoryDeadLetterStore implements DeadLetterStore {

    private final ConcurrentHashMap<String, FailedTaskRecord> byTaskId = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized FailedTaskRecord upsert(FailedTaskRecord candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate cannot be null");
        }
        FailedTaskRecord existing = byTaskId.get(candidate.taskId());
        if (existing != null && existing.attempts() == candidate.attempts()) {
            return existing;
        }
        FailedTaskRecord stored;
        if (existing == null) {
            stored = new FailedTaskRecord(sequence.incrementAndGet(), candidate.taskId(), candidate.taskName(),
                candidate.argsJson(), candidate.kwargsJson(), candidate.errorMessage(), candidate.queueName(),
                candidate.attempts(), 1, candidate.failedAt(), false, null);
        } else {
            stored = new FailedTaskRecord(existing.id(), candidate.taskId(), candidate.taskName(),
                candidate.argsJson(), candidate.kwargsJson(), candidate.errorMessage(), candidate.queueName(),
                candidate.attempts(), existing.retryCount() + 1, candidate.failedAt(), false, null);
        }
        byTaskId.put(stored.taskId(), stored);
        return stored;
    }

    @Override
    public Optional<FailedTaskRecord> findByTaskId(String taskId) {
        return Optional.ofNullable(byTaskId.get(taskId));
    }

    @Override
    public synchronized boolean markResolved(String taskId, Instant resolvedAt) {
        FailedTaskRecord existing = byTaskId.get(taskId);
        if (existing == null || existing.resolved()) {
            return false;
        }
        byTaskId.put(taskId, existing.resolve(resolvedAt));
        return true;
    }

    @Override
    public synchronized boolean reopen(String taskId) {
        FailedTaskRecord existing = byTaskId.get(taskId);
        if (existing == null || !existing.resolved()) {
            return false;
        }
        byTaskId.put(taskId, existing.reopen());
        return true;
    }

    @Override
    public List<FailedTaskRecord> findUnresolvedSince(Instant since) {
        return byTaskId.values().stream()
            .filter(r -> !r.resolved())
            .filter(r -> !r.failedAt().isBefore(since))
            .sorted(Comparator.comparing(FailedTaskRecord::failedAt).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public DeadLetterStats stats(Instant windowStart, int topFailureTypes) {
        List<FailedTaskRecord> all = List.copyOf(byTaskId.values());
        long unresolved = all.stream().filter(r -> !r.resolved()).count();
        long inWindow = all.stream().filter(r -> !r.failedAt().isBefore(windowStart)).count();
        Map<String, Long> byName = all.stream()
            .filter(r -> !r.resolved())
            .collect(Collectors.groupingBy(FailedTaskRecord::taskName, Collectors.counting()));
        List<DeadLetterStats.FailureTypeCount> types = byName.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.<String, Long>comparingByKey()))
            .limit(topFailureTypes)
            .map(e -> new DeadLetterStats.FailureTypeCount(e.getKey(), e.getValue()))
            .collect(Collectors.toList());
        return new DeadLetterStats(all.size(), unresolved, inWindow, types);
    }

    @Override
    public synchronized int purgeResolvedBefore(Instant cutoff) {
        List<String> doomed = byTaskId.values().stream()
            .filter(FailedTaskRecord::resolved)
            .filter(r -> r.resolvedAt() != null && r.resolvedAt().isBefore(cutoff))
            .map(FailedTaskRecord::taskId)
            .collect(Collectors.toList());
        doomed.forEach(byTaskId::remove);
        return doomed.size();
    }

    public int size() {
        return byTaskId.size();
    }

    /**
     * Clears all records (for testing).
     */
    public void clear() {
        byTaskId.clear();
        sequence.set(0);
    }
}

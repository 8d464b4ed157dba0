package com.ryuqq.substrate.adapter.inmemory.store;

import com.ryuqq.substrate.core.model.DeadLetterStats;
import com.ryuqq.substrate.core.model.FailedTaskRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryDeadLetterStore}.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
class InMemoryDeadLetterStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryDeadLetterStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDeadLetterStore();
    }

    @Test
    void upsert_sameTaskIdKeepsSingleRecordAndBumpsRetryCount() {
        FailedTaskRecord first = store.upsert(record("t-1", "analyze", NOW));
        FailedTaskRecord second = store.upsert(record("t-1", "analyze", NOW.plusSeconds(5)));

        assertThat(store.size()).isEqualTo(1);
        assertThat(first.retryCount()).isEqualTo(1);
        assertThat(second.retryCount()).isEqualTo(2);
        assertThat(second.id()).isEqualTo(first.id());
    }

    @Test
    void upsert_sameAttemptIsDuplicateReport() {
        store.upsert(record("t-1", "analyze", NOW, 121));
        store.markResolved("t-1", NOW);

        FailedTaskRecord again = store.upsert(record("t-1", "analyze", NOW.plusSeconds(5), 121));

        assertThat(again.resolved()).isTrue();
        assertThat(again.retryCount()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void markResolved_onlyOnce() {
        store.upsert(record("t-1", "analyze", NOW));

        assertThat(store.markResolved("t-1", NOW)).isTrue();
        assertThat(store.markResolved("t-1", NOW)).isFalse();
        assertThat(store.markResolved("missing", NOW)).isFalse();
    }

    @Test
    void reopen_revertsResolutionOnly() {
        store.upsert(record("t-1", "analyze", NOW));
        store.markResolved("t-1", NOW);

        assertThat(store.reopen("t-1")).isTrue();
        assertThat(store.reopen("t-1")).isFalse();
        assertThat(store.reopen("missing")).isFalse();
        assertThat(store.findByTaskId("t-1")).hasValueSatisfying(r -> {
            assertThat(r.resolved()).isFalse();
            assertThat(r.resolvedAt()).isNull();
            assertThat(r.retryCount()).isEqualTo(1);
        });
    }

    @Test
    void upsert_reopensResolvedRecord() {
        store.upsert(record("t-1", "analyze", NOW));
        store.markResolved("t-1", NOW);

        FailedTaskRecord reopened = store.upsert(record("t-1", "analyze", NOW.plusSeconds(60)));

        assertThat(reopened.resolved()).isFalse();
        assertThat(reopened.resolvedAt()).isNull();
    }

    @Test
    void stats_countsAndRanksUnresolvedFailureTypes() {
        store.upsert(record("t-1", "analyze", NOW));
        store.upsert(record("t-2", "analyze", NOW));
        store.upsert(record("t-3", "embed", NOW.minus(Duration.ofDays(2))));
        store.upsert(record("t-4", "embed", NOW));
        store.markResolved("t-4", NOW);

        DeadLetterStats stats = store.stats(NOW.minus(Duration.ofHours(24)), 10);

        assertThat(stats.totalRecords()).isEqualTo(4);
        assertThat(stats.unresolvedRecords()).isEqualTo(3);
        assertThat(stats.failedInWindow()).isEqualTo(3);
        assertThat(stats.failureTypes()).containsExactly(
            new DeadLetterStats.FailureTypeCount("analyze", 2),
            new DeadLetterStats.FailureTypeCount("embed", 1)
        );
    }

    @Test
    void purgeResolvedBefore_deletesOnlyOldResolvedRecords() {
        store.upsert(record("old", "analyze", NOW));
        store.upsert(record("recent", "analyze", NOW));
        store.upsert(record("open", "analyze", NOW));
        store.markResolved("old", NOW.minus(Duration.ofDays(40)));
        store.markResolved("recent", NOW.minus(Duration.ofDays(1)));

        int purged = store.purgeResolvedBefore(NOW.minus(Duration.ofDays(30)));

        assertThat(purged).isEqualTo(1);
        assertThat(store.findByTaskId("old")).isEmpty();
        assertThat(store.findByTaskId("recent")).isPresent();
        assertThat(store.findByTaskId("open")).isPresent();
    }

    private static FailedTaskRecord record(String taskId, String taskName, Instant failedAt) {
        return record(taskId, taskName, failedAt, (int) (failedAt.getEpochSecond() % 1000) + 1);
    }

    private static FailedTaskRecord record(String taskId, String taskName, Instant failedAt, int attempts) {
        return FailedTaskRecord.newRecord(taskId, taskName, "[1]", "{}", "boom", "analysis", attempts, failedAt);
    }
}

package com.ryuqq.substrate.testkit.contract;

import com.ryuqq.substrate.adapter.inmemory.event.InMemoryEventSink;
import com.ryuqq.substrate.adapter.inmemory.persistence.InMemoryPersistenceGateway;
import com.ryuqq.substrate.adapter.inmemory.store.InMemoryDeadLetterStore;
import com.ryuqq.substrate.adapter.inmemory.store.InMemoryProgressStore;
import com.ryuqq.substrate.adapter.inmemory.store.InMemoryRateLimitStore;
import com.ryuqq.substrate.adapter.inmemory.task.InMemoryTaskSubmitter;
import com.ryuqq.substrate.adapter.inmemory.time.ManualTimeSource;
import com.ryuqq.substrate.adapter.runner.config.SubstrateSettings;
import com.ryuqq.substrate.adapter.runner.config.WorkerRuntime;
import com.ryuqq.substrate.application.lifecycle.TaskContext;
import com.ryuqq.substrate.core.model.BatchedWritePayload;
import com.ryuqq.substrate.core.model.ItemId;
import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.model.RunCounters;
import com.ryuqq.substrate.core.model.RunId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>This class wires one {@link WorkerRuntime} on top of the in-memory SPI
 * implementations and a manual clock, and provides helper methods for test scenarios.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryRateLimitStore: shared per-second windows, global ceiling, holds</li>
 *   <li>InMemoryProgressStore: run counters and item states</li>
 *   <li>InMemoryDeadLetterStore: failed task records</li>
 *   <li>InMemoryEventSink: published events</li>
 *   <li>InMemoryPersistenceGateway: committed payloads with injectable contention</li>
 *   <li>InMemoryTaskSubmitter: requeued tasks</li>
 *   <li>ManualTimeSource: virtual clock, sleeps advance time without blocking</li>
 * </ul>
 *
 * <p>Additional workers sharing the same stores can be created with
 * {@link #newWorker(long)}; they are closed in {@link #tearDown()}.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         RunId runId = seedRun("r1", 3);
 *         runtime.getBufferedLedger().markStarted(runId, ItemId.of(1));
 *         // ... test logic ...
 *
 *         assertConserved(runId);
 *     }
 * }
 * </pre>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    /** Task name registered with the submitter for every test. */
    protected static final String TASK_NAME = "pipeline.analyze_item";
    protected static final String QUEUE_NAME = "analysis";
    protected static final long START_MILLIS = 1_700_000_000_000L;

    protected ManualTimeSource time;
    protected InMemoryRateLimitStore rateLimitStore;
    protected InMemoryProgressStore progressStore;
    protected InMemoryDeadLetterStore deadLetterStore;
    protected InMemoryEventSink eventSink;
    protected InMemoryPersistenceGateway persistence;
    protected InMemoryTaskSubmitter submitter;
    protected WorkerRuntime runtime;

    private final List<WorkerRuntime> extraWorkers = new ArrayList<>();

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of all SPI implementations and the default worker.</p>
     */
    @BeforeEach
    void setUp() {
        time = new ManualTimeSource(START_MILLIS);
        rateLimitStore = new InMemoryRateLimitStore(time);
        progressStore = new InMemoryProgressStore();
        deadLetterStore = new InMemoryDeadLetterStore();
        eventSink = new InMemoryEventSink();
        persistence = new InMemoryPersistenceGateway();
        submitter = new InMemoryTaskSubmitter().register(TASK_NAME);
        runtime = newRuntime(42L);
    }

    /**
     * Cleans up test fixtures after each test.
     *
     * <p>Clears all in-memory state to prevent test interference.</p>
     */
    @AfterEach
    void tearDown() {
        for (WorkerRuntime worker : extraWorkers) {
            worker.close();
        }
        extraWorkers.clear();
        if (runtime != null) {
            runtime.close();
        }
        if (rateLimitStore != null) {
            rateLimitStore.clear();
        }
        if (progressStore != null) {
            progressStore.clear();
        }
        if (deadLetterStore != null) {
            deadLetterStore.clear();
        }
        if (eventSink != null) {
            eventSink.clear();
        }
        if (persistence != null) {
            persistence.clear();
        }
        if (submitter != null) {
            submitter.clear();
        }
    }

    /**
     * Settings used for every worker of the test. Override to change limits.
     *
     * @return worker settings
     */
    protected SubstrateSettings settings() {
        return new SubstrateSettings();
    }

    /**
     * Creates another worker that shares the stores of this test.
     *
     * @param seed random seed of the worker
     * @return a runtime closed automatically after the test
     */
    protected WorkerRuntime newWorker(long seed) {
        WorkerRuntime worker = newRuntime(seed);
        extraWorkers.add(worker);
        return worker;
    }

    /**
     * Seeds a run through the default worker's buffered ledger.
     *
     * @param runIdValue the run ID value (e.g., "r1")
     * @param total number of items
     * @return the run ID
     */
    protected RunId seedRun(String runIdValue, int total) {
        RunId runId = RunId.of(runIdValue);
        runtime.getBufferedLedger().seed(runId, total);
        return runId;
    }

    /**
     * Creates a first-attempt context for one item of a run.
     *
     * @param runId the run
     * @param itemNo the item number, also used as the positional argument
     * @return a new task context
     */
    protected TaskContext itemContext(RunId runId, long itemNo) {
        return TaskContext.forItem(
            "task-" + runId.getValue() + "-" + itemNo,
            TASK_NAME,
            QUEUE_NAME,
            List.of(itemNo, runId.getValue()),
            Map.of("mode", "full"),
            runId,
            ItemId.of(itemNo)
        );
    }

    /**
     * Creates a persistence payload for one item of a run.
     *
     * @param runId the run
     * @param itemNo the item number
     * @return a new payload
     */
    protected BatchedWritePayload payload(RunId runId, long itemNo) {
        return BatchedWritePayload.of(runId, ItemId.of(itemNo), Map.of("item", itemNo, "summary", "ok"));
    }

    /**
     * Asserts the stored counters of a run.
     *
     * @param runId the run
     * @param success expected success count
     * @param failed expected failed count
     */
    protected void assertCounters(RunId runId, int success, int failed) {
        RunCounters counters = storedCounters(runId);
        assertEquals(success, counters.success(),
                String.format("Expected success %d but was %d for run: %s", success, counters.success(), runId));
        assertEquals(failed, counters.failed(),
                String.format("Expected failed %d but was %d for run: %s", failed, counters.failed(), runId));
    }

    /**
     * Asserts that pending + processing + success + failed equals total and no field is negative.
     *
     * @param runId the run
     */
    protected void assertConserved(RunId runId) {
        RunCounters c = storedCounters(runId);
        int sum = c.pending() + c.processing() + c.success() + c.failed();
        assertEquals(c.total(), sum,
                String.format("Expected counters to sum to total %d but got %d (%s) for run: %s",
                        c.total(), sum, c, runId));
        assertTrue(c.pending() >= 0 && c.processing() >= 0 && c.success() >= 0 && c.failed() >= 0,
                String.format("Expected non-negative counters but got %s for run: %s", c, runId));
    }

    /**
     * Asserts the displayed snapshot is completed.
     *
     * @param snapshot the snapshot
     */
    protected void assertCompleted(ProgressSnapshot snapshot) {
        assertTrue(snapshot.isComplete(),
                String.format("Expected completed run but was %s (%d/%d processed)",
                        snapshot.status().wireValue(), snapshot.processed(), snapshot.total()));
    }

    /**
     * Asserts the number of published events of a type.
     *
     * @param eventType the event type
     * @param expected expected count
     */
    protected void assertEventCount(String eventType, int expected) {
        int actual = eventSink.eventsOfType(eventType).size();
        assertEquals(expected, actual,
                String.format("Expected %d '%s' events but found %d", expected, eventType, actual));
    }

    protected RunCounters storedCounters(RunId runId) {
        return progressStore.readCounters(runId)
            .orElseThrow(() -> new AssertionError("No counters stored for run: " + runId));
    }

    private WorkerRuntime newRuntime(long seed) {
        return WorkerRuntime.builder()
            .settings(settings())
            .rateLimitStore(rateLimitStore)
            .progressStore(progressStore)
            .deadLetterStore(deadLetterStore)
            .eventSink(eventSink)
            .persistenceGateway(persistence)
            .taskSubmitter(submitter)
            .timeSource(time)
            .random(new Random(seed))
            .build();
    }
}

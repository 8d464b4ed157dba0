package com.ryuqq.substrate.adapter.runner.batch;

import com.ryuqq.substrate.adapter.runner.event.SafeEventPublisher;
import com.ryuqq.substrate.application.batch.WriteQueue;
import com.ryuqq.substrate.application.progress.ProgressTracker;
import com.ryuqq.substrate.core.model.BatchedWritePayload;
import com.ryuqq.substrate.core.model.ProgressSnapshot;
import com.ryuqq.substrate.core.model.RunId;
import com.ryuqq.substrate.core.spi.PersistenceGateway;
import com.ryuqq.substrate.core.spi.PersistenceSession;
import com.ryuqq.substrate.core.spi.StorageContentionException;
import com.ryuqq.substrate.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 단일 쓰기 스레드로 결과를 묶어 영속화하는 배처.
 *
 * <p>여러 스레드가 {@link #enqueue}로 넣은 페이로드를 백그라운드 스레드 하나가
 * 모아서 세션 하나로 기록합니다. 쓰기 잠금 점유 시간을 줄이기 위해
 * 세션 안에서 chunk 단위로 부분 커밋합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * worker loop
 *   ↓
 * batch가 차거나(maxBatch) maxWaitMs가 지나거나 flush 요청이 올 때까지 대기
 *   ↓
 * drain(≤ maxBatch) → openSession()
 *   ↓
 * For each payload:
 *   persist
 *     ├─ 성공 → chunk에 추가
 *     ├─ StorageContentionException → 큐 앞쪽에 재적재 + 20~70ms 대기
 *     └─ 기타 예외 → markItemFailed + markFinished(false) + analysis_failed 이벤트
 *   chunk ≥ chunkSize 또는 commitIntervalMs 경과 → commit (경합 시 백오프 재시도)
 *   ↓
 * 남은 chunk commit → 커밋된 Run Item은 SUCCESS 기록
 * </pre>
 *
 * <p><strong>유실 방지:</strong></p>
 * <ul>
 *   <li>세션을 열 수 없으면 batch 전체를 큐 앞쪽으로 되돌림</li>
 *   <li>커밋 경합이 commitRetries 동안 지속되면 chunk의 페이로드를 재적재</li>
 *   <li>경합 재적재가 maxContentionRequeues를 넘은 페이로드는 명시적으로 실패 처리
 *       (persist 경합과 commit 경합 모두 집계)</li>
 * </ul>
 *
 * <p>Run의 마지막 Item이 이 배처에서 끝나면 장부를 flush하고 {@code run_complete}를 발행합니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class WriteBatcher implements WriteQueue, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WriteBatcher.class);
    private static final long WAIT_POLL_MS = 20;
    private static final long SESSION_RETRY_PAUSE_MS = 50;
    private static final long MAX_COMMIT_BACKOFF_MS = 500;

    private final PersistenceGateway gateway;
    private final ProgressTracker ledger;
    private final SafeEventPublisher events;
    private final WriteBatcherConfig config;
    private final TimeSource timeSource;
    private final Random random;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final Deque<BatchedWritePayload> queue = new ArrayDeque<>();
    private final Map<BatchedWritePayload, Integer> contentionCounts = new IdentityHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private int inFlight;
    private long lastFlushMillis;
    private boolean flushRequested;
    private volatile boolean running;
    private ExecutorService worker;

    /**
     * 생성자.
     *
     * @param gateway 영속 게이트웨이
     * @param ledger 진행 장부
     * @param events 이벤트 발행기
     * @param config 설정
     * @param timeSource 시간 소스
     * @param random 대기 jitter 난수 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WriteBatcher(
        PersistenceGateway gateway,
        ProgressTracker ledger,
        SafeEventPublisher events,
        WriteBatcherConfig config,
        TimeSource timeSource,
        Random random
    ) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.gateway = gateway;
        this.ledger = ledger;
        this.events = events;
        this.config = config;
        this.timeSource = timeSource;
        this.random = random;
        this.lastFlushMillis = timeSource.currentTimeMillis();
    }

    /**
     * 백그라운드 쓰기 스레드 시작. 두 번째 호출부터는 무시됩니다.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        running = true;
        worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "write-batcher");
            thread.setDaemon(true);
            return thread;
        });
        worker.submit(this::runLoop);
        log.info("WriteBatcher started (maxBatch={}, maxWaitMs={}, chunkSize={})",
            config.maxBatch(), config.maxWaitMs(), config.chunkSize());
    }

    @Override
    public void enqueue(BatchedWritePayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        lock.lock();
        try {
            queue.addLast(payload);
            if (queue.size() >= config.maxBatch()) {
                wakeUp.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 큐와 처리 중인 batch가 모두 비워질 때까지 대기.
     *
     * <p>쓰기 스레드를 깨운 뒤 20ms 간격으로 확인합니다.</p>
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return 시간 내에 비워졌으면 true
     */
    @Override
    public boolean waitUntilEmpty(long timeoutMs) {
        long deadline = timeSource.currentTimeMillis() + Math.max(0, timeoutMs);
        while (true) {
            lock.lock();
            try {
                if (queue.isEmpty() && inFlight == 0) {
                    return true;
                }
                flushRequested = true;
                wakeUp.signal();
            } finally {
                lock.unlock();
            }

            long remaining = deadline - timeSource.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            try {
                timeSource.sleep(Math.min(WAIT_POLL_MS, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    @Override
    public int pendingCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 호출 스레드에서 큐가 빌 때까지 batch를 처리.
     *
     * <p>백그라운드 스레드 없이 사용하는 경우(배치 작업, 테스트)를 위한 동기 경로입니다.</p>
     *
     * @return 처리한 batch 수
     */
    public int drainNow() {
        int batches = 0;
        while (true) {
            List<BatchedWritePayload> batch;
            lock.lock();
            try {
                batch = drainLocked();
            } finally {
                lock.unlock();
            }
            if (batch.isEmpty()) {
                return batches;
            }
            try {
                processBatch(batch);
            } finally {
                completeBatch(batch.size());
            }
            batches++;
        }
    }

    int trackedContentionCount() {
        lock.lock();
        try {
            return contentionCounts.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 쓰기 스레드 종료.
     *
     * <p>남은 큐를 처리한 뒤 종료하며, shutdownTimeoutMs 안에 끝나지 않으면 강제 종료합니다.</p>
     */
    @Override
    public void close() {
        if (!started.get() || worker == null) {
            return;
        }
        lock.lock();
        try {
            running = false;
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                worker.shutdownNow();
                log.warn("WriteBatcher did not drain within {}ms, {} payloads left",
                    config.shutdownTimeoutMs(), pendingCount());
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("WriteBatcher stopped");
    }

    private void runLoop() {
        while (true) {
            List<BatchedWritePayload> batch = awaitBatch();
            if (batch == null) {
                return;
            }
            if (batch.isEmpty()) {
                continue;
            }
            try {
                processBatch(batch);
            } catch (RuntimeException e) {
                log.error("Unexpected error while writing batch of {} payloads", batch.size(), e);
            } finally {
                completeBatch(batch.size());
            }
        }
    }

    private List<BatchedWritePayload> awaitBatch() {
        lock.lock();
        try {
            while (true) {
                if (!running && queue.isEmpty()) {
                    return null;
                }
                long waitMs = config.maxWaitMs() - (timeSource.currentTimeMillis() - lastFlushMillis);
                if (queue.size() >= config.maxBatch() || flushRequested || !running || waitMs <= 0) {
                    flushRequested = false;
                    List<BatchedWritePayload> batch = drainLocked();
                    if (batch.isEmpty()) {
                        lastFlushMillis = timeSource.currentTimeMillis();
                    }
                    return batch;
                }
                wakeUp.await(waitMs, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("WriteBatcher interrupted with {} payloads queued", queue.size());
            return null;
        } finally {
            lock.unlock();
        }
    }

    private List<BatchedWritePayload> drainLocked() {
        int count = Math.min(config.maxBatch(), queue.size());
        List<BatchedWritePayload> batch = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            batch.add(queue.pollFirst());
        }
        inFlight += count;
        return batch;
    }

    private void completeBatch(int count) {
        lock.lock();
        try {
            inFlight -= count;
            lastFlushMillis = timeSource.currentTimeMillis();
        } finally {
            lock.unlock();
        }
    }

    private void processBatch(List<BatchedWritePayload> batch) {
        PersistenceSession session;
        try {
            session = gateway.openSession();
        } catch (RuntimeException e) {
            log.warn("Failed to open persistence session, requeueing {} payloads", batch.size(), e);
            requeueFront(batch);
            pause(SESSION_RETRY_PAUSE_MS);
            return;
        }

        try (PersistenceSession s = session) {
            List<Staged> chunk = new ArrayList<>();
            long lastCommit = timeSource.currentTimeMillis();
            for (BatchedWritePayload payload : batch) {
                Staged staged = stage(s, payload);
                if (staged == null) {
                    continue;
                }
                chunk.add(staged);
                long now = timeSource.currentTimeMillis();
                if (chunk.size() >= config.chunkSize() || now - lastCommit >= config.commitIntervalMs()) {
                    chunk = commitChunk(s, chunk);
                    lastCommit = timeSource.currentTimeMillis();
                }
            }
            if (!chunk.isEmpty()) {
                List<Staged> leftover = commitChunk(s, chunk);
                if (!leftover.isEmpty()) {
                    leftover = commitChunk(s, leftover);
                }
                if (!leftover.isEmpty()) {
                    log.warn("Dropping {} failure marks after repeated commit contention", leftover.size());
                }
            }
        }
    }

    private Staged stage(PersistenceSession session, BatchedWritePayload payload) {
        try {
            session.persist(payload);
            return new Staged(payload, true, null);
        } catch (StorageContentionException e) {
            if (registerContention(payload)) {
                requeueFront(List.of(payload));
                pause(20 + (long) (nextDouble() * 50));
                return null;
            }
            log.error("Payload for {} exceeded {} contention requeues", payload.getItemId(),
                config.maxContentionRequeues(), e);
            return fail(session, payload, e);
        } catch (RuntimeException e) {
            log.error("Persist failed for {}", payload.getItemId(), e);
            return fail(session, payload, e);
        }
    }

    private Staged fail(PersistenceSession session, BatchedWritePayload payload, RuntimeException error) {
        clearContention(payload);
        String reason = describe(error);
        try {
            session.markItemFailed(payload.getItemId(), reason);
        } catch (RuntimeException e) {
            log.debug("Failed to mark {} failed in session", payload.getItemId(), e);
        }
        if (payload.hasRun()) {
            try {
                ProgressSnapshot snapshot = ledger.markFinished(payload.getRunId(), payload.getItemId(), false);
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("message", "Task failed");
                data.put("run_id", payload.getRunId().getValue());
                data.putAll(snapshot.toEventData());
                events.publish(SafeEventPublisher.GLOBAL_SCOPE, "analysis_failed", data);
                publishIfRunComplete(payload.getRunId(), snapshot, "Run completed with failures");
            } catch (RuntimeException e) {
                log.debug("Failed to record failure of {} in {}", payload.getItemId(), payload.getRunId(), e);
            }
        }
        return new Staged(payload, false, reason);
    }

    /**
     * chunk 커밋. 경합이 지속되면 저장된 페이로드는 재적재하고,
     * 실패 표시는 세션에 다시 기록하여 다음 chunk로 넘깁니다.
     *
     * @return 다음 chunk로 이어질 항목 (커밋 성공 시 빈 목록)
     */
    private List<Staged> commitChunk(PersistenceSession session, List<Staged> chunk) {
        StorageContentionException contention = null;
        for (int attempt = 0; attempt < config.commitRetries(); attempt++) {
            try {
                if (attempt > 0) {
                    restage(session, chunk);
                }
                session.commit();
                onCommitted(chunk);
                return new ArrayList<>();
            } catch (StorageContentionException e) {
                contention = e;
                rollbackQuietly(session);
                if (attempt + 1 < config.commitRetries()) {
                    long backoff = Math.min(MAX_COMMIT_BACKOFF_MS, 50L << attempt) + (long) (nextDouble() * 50);
                    log.warn("Commit contention (attempt {}/{}), retrying in {}ms",
                        attempt + 1, config.commitRetries(), backoff);
                    pause(backoff);
                }
            } catch (RuntimeException e) {
                log.error("Commit failed for chunk of {} payloads", chunk.size(), e);
                rollbackQuietly(session);
                failChunk(session, chunk, e);
                return new ArrayList<>();
            }
        }

        List<BatchedWritePayload> requeue = new ArrayList<>();
        List<Staged> carried = new ArrayList<>();
        for (Staged staged : chunk) {
            if (!staged.persisted()) {
                carried.add(staged);
                markFailedQuietly(session, staged);
            } else if (registerContention(staged.payload())) {
                requeue.add(staged.payload());
            } else {
                log.error("Payload for {} exceeded {} contention requeues", staged.payload().getItemId(),
                    config.maxContentionRequeues(), contention);
                carried.add(fail(session, staged.payload(), contention));
            }
        }
        log.warn("Commit contention persisted after {} attempts, requeueing {} payloads",
            config.commitRetries(), requeue.size());
        requeueFront(requeue);
        return carried;
    }

    private void restage(PersistenceSession session, List<Staged> chunk) {
        for (int i = 0; i < chunk.size(); i++) {
            Staged staged = chunk.get(i);
            if (!staged.persisted()) {
                session.markItemFailed(staged.payload().getItemId(), staged.reason());
                continue;
            }
            try {
                session.persist(staged.payload());
            } catch (StorageContentionException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Re-persist failed for {}", staged.payload().getItemId(), e);
                chunk.set(i, fail(session, staged.payload(), e));
            }
        }
    }

    private void failChunk(PersistenceSession session, List<Staged> chunk, RuntimeException error) {
        for (Staged staged : chunk) {
            if (staged.persisted()) {
                fail(session, staged.payload(), error);
            } else {
                markFailedQuietly(session, staged);
            }
        }
        try {
            session.commit();
        } catch (RuntimeException e) {
            log.error("Failed to commit failure marks for {} payloads", chunk.size(), e);
            rollbackQuietly(session);
        }
    }

    private void onCommitted(List<Staged> chunk) {
        int persisted = 0;
        Map<RunId, ProgressSnapshot> touched = new LinkedHashMap<>();
        for (Staged staged : chunk) {
            if (!staged.persisted()) {
                continue;
            }
            persisted++;
            BatchedWritePayload payload = staged.payload();
            clearContention(payload);
            if (config.markFinishedOnCommit() && payload.hasRun()) {
                try {
                    touched.put(payload.getRunId(), ledger.markFinished(payload.getRunId(), payload.getItemId(), true));
                } catch (RuntimeException e) {
                    log.debug("Failed to record success of {} in {}", payload.getItemId(), payload.getRunId(), e);
                }
            }
        }
        for (Map.Entry<RunId, ProgressSnapshot> entry : touched.entrySet()) {
            publishIfRunComplete(entry.getKey(), entry.getValue(), "All tasks completed");
        }
        log.debug("Committed chunk: {} persisted, {} failed", persisted, chunk.size() - persisted);
    }

    /**
     * 마지막 Item이 끝난 Run이면 장부를 flush하고 run_complete 발행.
     */
    private void publishIfRunComplete(RunId runId, ProgressSnapshot snapshot, String message) {
        if (snapshot.total() <= 0 || snapshot.processed() < snapshot.total()) {
            return;
        }
        try {
            ledger.flush();
            ProgressSnapshot finalSnapshot = ledger.snapshot(runId);
            events.publishRunComplete(runId, finalSnapshot, message);
            log.info("Run {} completed: success={}, failed={}", runId.getValue(),
                finalSnapshot.success(), finalSnapshot.failed());
        } catch (RuntimeException e) {
            log.debug("Failed to complete run {}", runId, e);
        }
    }

    private void markFailedQuietly(PersistenceSession session, Staged staged) {
        try {
            session.markItemFailed(staged.payload().getItemId(), staged.reason());
        } catch (RuntimeException e) {
            log.debug("Failed to re-stage failure mark for {}", staged.payload().getItemId(), e);
        }
    }

    private void rollbackQuietly(PersistenceSession session) {
        try {
            session.rollback();
        } catch (RuntimeException e) {
            log.debug("Rollback failed", e);
        }
    }

    private void requeueFront(List<BatchedWritePayload> payloads) {
        if (payloads.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            for (int i = payloads.size() - 1; i >= 0; i--) {
                queue.addFirst(payloads.get(i));
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean registerContention(BatchedWritePayload payload) {
        lock.lock();
        try {
            int count = contentionCounts.merge(payload, 1, Integer::sum);
            if (count > config.maxContentionRequeues()) {
                contentionCounts.remove(payload);
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void clearContention(BatchedWritePayload payload) {
        lock.lock();
        try {
            contentionCounts.remove(payload);
        } finally {
            lock.unlock();
        }
    }

    private double nextDouble() {
        synchronized (random) {
            return random.nextDouble();
        }
    }

    private void pause(long millis) {
        try {
            timeSource.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private record Staged(BatchedWritePayload payload, boolean persisted, String reason) {
    }
}

package com.ryuqq.substrate.adapter.inmemory.time;

import com.ryuqq.substrate.core.time.TimeSource;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic {@link TimeSource} for tests.
 *
 * <p>{@link #sleep(long)} does not block; it advances the virtual clock by the
 * requested amount and records the total slept time.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class ManualTimeSource implements TimeSource {

    private final AtomicLong nowMillis;
    private final AtomicLong totalSleptMillis = new AtomicLong();
    private final AtomicLong sleepCalls = new AtomicLong();

    public ManualTimeSource(long startMillis) {
        this.nowMillis = new AtomicLong(startMillis);
    }

    @Override
    public long currentTimeMillis() {
        return nowMillis.get();
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("sleep interrupted");
        }
        sleepCalls.incrementAndGet();
        if (millis > 0) {
            nowMillis.addAndGet(millis);
            totalSleptMillis.addAndGet(millis);
        }
    }

    /**
     * Advances the virtual clock without counting it as sleep.
     *
     * @param millis amount to advance
     */
    public void advance(long millis) {
        nowMillis.addAndGet(millis);
    }

    public void setMillis(long millis) {
        nowMillis.set(millis);
    }

    public long getTotalSleptMillis() {
        return totalSleptMillis.get();
    }

    public long getSleepCalls() {
        return sleepCalls.get();
    }
}

package com.ryuqq.substrate.adapter.inmemory.store;

import com.ryuqq.substrate.core.spi.RateLimitStore;
import com.ryuqq.substrate.core.spi.SharedStoreException;
import com.ryuqq.substrate.core.time.SystemTimeSource;
import com.ryuqq.substrate.core.time.TimeSource;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * In-memory implementation of {@link RateLimitStore} for testing and reference purposes.
 *
 * <p>All operations are {@code synchronized}, which gives the same atomicity as the
 * server-side scripts a networked store would run. Keys expire according to the
 * supplied {@link TimeSource}, so TTL behaviour can be tested with a virtual clock.</p>
 *
 * <p><strong>Failure Injection:</strong> {@link #setUnavailable(boolean)} makes every
 * operation throw {@link SharedStoreException}, simulating a store outage.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final long WINDOW_TTL_MILLIS = 2000L;

    private final TimeSource timeSource;
    private final Map<String, Expiring> windows = new HashMap<>();
    private final Map<String, Expiring> holds = new HashMap<>();
    private Expiring globalCeiling;
    private Expiring lastErrorMillis;
    private volatile boolean unavailable;

    public InMemoryRateLimitStore() {
        this(SystemTimeSource.INSTANCE);
    }

    public InMemoryRateLimitStore(TimeSource timeSource) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.timeSource = timeSource;
    }

    @Override
    public synchronized int claimTokens(String key, long epochSecond, int request, int limit) {
        checkAvailable();
        long now = timeSource.currentTimeMillis();
        evictExpiredWindows(now);
        String windowKey = windowKey(key, epochSecond);
        Expiring window = windows.get(windowKey);
        long used = window == null ? 0L : window.value();
        int granted = (int) Math.min(request, Math.max(0L, limit - used));
        if (granted > 0 || window == null) {
            windows.put(windowKey, new Expiring(used + granted, now + WINDOW_TTL_MILLIS, null));
        }
        return granted;
    }

    @Override
    public synchronized boolean tryTakeOne(String key, long epochSecond, int limit) {
        checkAvailable();
        long now = timeSource.currentTimeMillis();
        evictExpiredWindows(now);
        String windowKey = windowKey(key, epochSecond);
        Expiring window = windows.get(windowKey);
        long used = window == null ? 0L : window.value();
        if (used >= limit) {
            return false;
        }
        windows.put(windowKey, new Expiring(used + 1, now + WINDOW_TTL_MILLIS, null));
        return true;
    }

    @Override
    public synchronized OptionalInt readGlobalCeiling() {
        checkAvailable();
        Expiring current = live(globalCeiling);
        return current == null ? OptionalInt.empty() : OptionalInt.of((int) current.value());
    }

    @Override
    public synchronized int initGlobalCeilingIfAbsent(int value, long ttlMillis) {
        checkAvailable();
        Expiring current = live(globalCeiling);
        if (current != null) {
            return (int) current.value();
        }
        globalCeiling = new Expiring(value, timeSource.currentTimeMillis() + ttlMillis, null);
        return value;
    }

    @Override
    public synchronized boolean compareAndSetGlobalCeiling(int expected, int update, long ttlMillis) {
        checkAvailable();
        Expiring current = live(globalCeiling);
        if (current == null || current.value() != expected) {
            return false;
        }
        globalCeiling = new Expiring(update, timeSource.currentTimeMillis() + ttlMillis, null);
        return true;
    }

    @Override
    public synchronized OptionalLong readLastErrorMillis() {
        checkAvailable();
        Expiring current = live(lastErrorMillis);
        return current == null ? OptionalLong.empty() : OptionalLong.of(current.value());
    }

    @Override
    public synchronized void writeLastErrorMillis(long epochMillis, long ttlMillis) {
        checkAvailable();
        lastErrorMillis = new Expiring(epochMillis, timeSource.currentTimeMillis() + ttlMillis, null);
    }

    @Override
    public synchronized long holdTtlMillis(String key) {
        checkAvailable();
        Expiring hold = live(holds.get(key));
        if (hold == null) {
            holds.remove(key);
            return 0L;
        }
        return Math.max(0L, hold.expiresAtMillis() - timeSource.currentTimeMillis());
    }

    @Override
    public synchronized void writeHold(String key, long holdMillis, String reason) {
        checkAvailable();
        holds.put(key, new Expiring(1L, timeSource.currentTimeMillis() + holdMillis, reason));
    }

    /**
     * Returns tokens granted so far in a window (test helper).
     *
     * @param key the rate-limit key
     * @param epochSecond the window
     * @return granted tokens
     */
    public synchronized long grantedInWindow(String key, long epochSecond) {
        Expiring window = live(windows.get(windowKey(key, epochSecond)));
        return window == null ? 0L : window.value();
    }

    /**
     * Returns the reason stored with the active hold (test helper).
     *
     * @param key the rate-limit key
     * @return the reason, or null if no hold is active
     */
    public synchronized String holdReason(String key) {
        Expiring hold = live(holds.get(key));
        return hold == null ? null : hold.note();
    }

    /**
     * Sets the global ceiling directly (test helper).
     *
     * @param value ceiling
     * @param ttlMillis expiry
     */
    public synchronized void setGlobalCeiling(int value, long ttlMillis) {
        globalCeiling = new Expiring(value, timeSource.currentTimeMillis() + ttlMillis, null);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    /**
     * Clears all state (for testing).
     */
    public synchronized void clear() {
        windows.clear();
        holds.clear();
        globalCeiling = null;
        lastErrorMillis = null;
        unavailable = false;
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new SharedStoreException("rate-limit store unavailable");
        }
    }

    private Expiring live(Expiring entry) {
        if (entry == null || entry.expiresAtMillis() <= timeSource.currentTimeMillis()) {
            return null;
        }
        return entry;
    }

    private void evictExpiredWindows(long now) {
        Iterator<Expiring> it = windows.values().iterator();
        while (it.hasNext()) {
            if (it.next().expiresAtMillis() <= now) {
                it.remove();
            }
        }
    }

    private static String windowKey(String key, long epochSecond) {
        return "ratelimit:" + key + ":" + epochSecond;
    }

    private record Expiring(long value, long expiresAtMillis, String note) {
    }
}

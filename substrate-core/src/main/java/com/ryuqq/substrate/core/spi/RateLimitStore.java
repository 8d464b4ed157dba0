package com.ryuqq.substrate.core.spi;

import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Shared key-value store SPI backing the admission controller and the ceiling breaker.
 *
 * <p><strong>Logical key schema:</strong></p>
 * <ul>
 *   <li>{@code ratelimit:{key}:{epochSecond}} - granted tokens in a one-second window (TTL 2s)</li>
 *   <li>{@code ratelimit:{key}:hold} - hold marker with TTL</li>
 *   <li>{@code global:rps_ceiling} - adaptive global ceiling</li>
 *   <li>{@code global:last_error_ts} - timestamp of the last first-attempt error</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe and shared across worker processes</li>
 *   <li>{@link #claimTokens} and {@link #tryTakeOne} must be atomic read-modify-write operations</li>
 *   <li>Connectivity failures surface as {@link SharedStoreException}</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface RateLimitStore {

    /**
     * Atomically claims up to {@code request} tokens from the window of {@code epochSecond}.
     *
     * <p>Equivalent to: {@code used = GET; granted = min(request, max(0, limit - used));
     * INCRBY granted; EXPIRE 2s}.</p>
     *
     * @param key the rate-limit key
     * @param epochSecond the one-second window
     * @param request number of tokens requested
     * @param limit window limit
     * @return granted tokens (0 when the window is exhausted)
     * @throws SharedStoreException if the store is unreachable
     */
    int claimTokens(String key, long epochSecond, int request, int limit);

    /**
     * Atomically takes a single token if the window still has room.
     *
     * @param key the rate-limit key
     * @param epochSecond the one-second window
     * @param limit window limit
     * @return true if a token was taken
     * @throws SharedStoreException if the store is unreachable
     */
    boolean tryTakeOne(String key, long epochSecond, int limit);

    /**
     * Reads the shared global ceiling.
     *
     * @return the ceiling, or empty if absent or expired
     * @throws SharedStoreException if the store is unreachable
     */
    OptionalInt readGlobalCeiling();

    /**
     * Sets the global ceiling only if it is currently absent.
     *
     * @param value initial value
     * @param ttlMillis expiry of the key
     * @return the value present after the call
     * @throws SharedStoreException if the store is unreachable
     */
    int initGlobalCeilingIfAbsent(int value, long ttlMillis);

    /**
     * Replaces the global ceiling if it still equals {@code expected}.
     *
     * @param expected value previously read
     * @param update new value
     * @param ttlMillis expiry of the key
     * @return true if the value was replaced
     * @throws SharedStoreException if the store is unreachable
     */
    boolean compareAndSetGlobalCeiling(int expected, int update, long ttlMillis);

    /**
     * Reads the timestamp of the last recorded first-attempt error.
     *
     * @return epoch millis, or empty if none
     * @throws SharedStoreException if the store is unreachable
     */
    OptionalLong readLastErrorMillis();

    /**
     * Writes the timestamp of the last first-attempt error.
     *
     * @param epochMillis error timestamp
     * @param ttlMillis expiry of the key
     * @throws SharedStoreException if the store is unreachable
     */
    void writeLastErrorMillis(long epochMillis, long ttlMillis);

    /**
     * Reads the remaining time-to-live of the hold marker of {@code key}.
     *
     * @param key the rate-limit key
     * @return remaining millis, 0 if no hold is active
     * @throws SharedStoreException if the store is unreachable
     */
    long holdTtlMillis(String key);

    /**
     * Writes (or overwrites) the hold marker of {@code key}.
     *
     * @param key the rate-limit key
     * @param holdMillis hold duration
     * @param reason free-form reason stored with the marker
     * @throws SharedStoreException if the store is unreachable
     */
    void writeHold(String key, long holdMillis, String reason);
}

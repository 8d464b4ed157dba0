package com.ryuqq.substrate.adapter.runner.progress;

/**
 * BufferedProgressLedger 설정 (불변 record).
 *
 * <ul>
 *   <li>flushSize: 이 개수만큼 전이가 쌓이면 flush (기본 20)</li>
 *   <li>flushIntervalMs: 마지막 flush 후 이 시간이 지나면 flush (기본 500ms)</li>
 * </ul>
 *
 * @author Substrate Team
 * @since 1.0.0
 * @param flushSize flush 기준 전이 수 (1 이상)
 * @param flushIntervalMs flush 기준 경과 시간 (밀리초, 양수)
 */
public record CounterBufferConfig(int flushSize, long flushIntervalMs) {

    public CounterBufferConfig() {
        this(20, 500);
    }

    public CounterBufferConfig {
        if (flushSize <= 0) {
            throw new IllegalArgumentException(
                "flushSize must be positive (current: " + flushSize + ")"
            );
        }
        if (flushIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "flushIntervalMs must be positive (current: " + flushIntervalMs + ")"
            );
        }
    }

    public CounterBufferConfig withFlushSize(int flushSize) {
        return new CounterBufferConfig(flushSize, flushIntervalMs);
    }

    public CounterBufferConfig withFlushIntervalMs(long flushIntervalMs) {
        return new CounterBufferConfig(flushSize, flushIntervalMs);
    }
}

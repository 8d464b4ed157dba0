package com.ryuqq.substrate.core.time;

/**
 * 시스템 시계와 {@link Thread#sleep(long)}을 사용하는 기본 구현.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class SystemTimeSource implements TimeSource {

    public static final SystemTimeSource INSTANCE = new SystemTimeSource();

    private SystemTimeSource() {
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}

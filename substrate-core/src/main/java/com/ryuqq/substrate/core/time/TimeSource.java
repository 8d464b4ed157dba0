package com.ryuqq.substrate.core.time;

/**
 * 시각 조회와 협력적 대기(cooperative sleep)의 추상화.
 *
 * <p>모든 대기는 이 인터페이스의 {@link #sleep(long)}을 통해 이루어지므로,
 * 테스트에서는 가상 시간으로 대체할 수 있습니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface TimeSource {

    /**
     * 현재 시각.
     *
     * @return epoch 밀리초
     */
    long currentTimeMillis();

    /**
     * 지정 시간 동안 대기.
     *
     * @param millis 대기 시간 (0 이하면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(long millis) throws InterruptedException;

    /**
     * 현재 시각의 epoch 초.
     *
     * @return epoch 초
     */
    default long currentEpochSecond() {
        return currentTimeMillis() / 1000L;
    }
}

package com.ryuqq.substrate.core.protection.noop;

import com.ryuqq.substrate.core.protection.AttemptResult;
import com.ryuqq.substrate.core.protection.RateCeilingBreaker;

/**
 * Rate Ceiling Breaker NoOp 구현.
 *
 * <p>kill-switch가 켜졌을 때 사용됩니다. 결과를 반영하지 않으며,
 * 상한을 {@link Integer#MAX_VALUE}로 보고하여 호출자의 초당 허용량만 적용되게 합니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class NoOpRateCeilingBreaker implements RateCeilingBreaker {

    @Override
    public void recordAttempt(AttemptResult result) {
        // NoOp
    }

    @Override
    public int currentCeiling() {
        return Integer.MAX_VALUE;
    }
}

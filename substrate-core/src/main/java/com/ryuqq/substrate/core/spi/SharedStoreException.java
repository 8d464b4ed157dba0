package com.ryuqq.substrate.core.spi;

/**
 * Thrown by shared-store adapters when the backing store is unreachable or a
 * scripted operation fails.
 *
 * <p>Callers degrade instead of failing the work unit: the admission controller
 * fails open with a small grant, the breaker keeps its last ceiling, and the
 * progress ledger keeps buffered transitions for the next flush.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class SharedStoreException extends RuntimeException {

    public SharedStoreException(String message) {
        super(message);
    }

    public SharedStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

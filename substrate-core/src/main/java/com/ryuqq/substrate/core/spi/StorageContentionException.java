package com.ryuqq.substrate.core.spi;

/**
 * Transient persistence contention (lock wait, busy database, serialization conflict).
 *
 * <p>Thrown by {@link PersistenceSession} implementations. The write batcher treats
 * it as retryable: the affected payload is re-enqueued at the head of the queue.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public class StorageContentionException extends RuntimeException {

    public StorageContentionException(String message) {
        super(message);
    }

    public StorageContentionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ryuqq.substrate.core.spi;

/**
 * Factory of {@link PersistenceSession}s.
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public interface PersistenceGateway {

    /**
     * Opens a new session.
     *
     * @return an open session; the caller closes it
     */
    PersistenceSession openSession();
}

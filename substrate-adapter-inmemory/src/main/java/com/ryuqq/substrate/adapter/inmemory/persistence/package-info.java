/**
 * In-memory transactional persistence gateway with failure injection.
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.adapter.inmemory.persistence;

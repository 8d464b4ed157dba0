/**
 * Virtual clock for deterministic tests.
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.adapter.inmemory.time;

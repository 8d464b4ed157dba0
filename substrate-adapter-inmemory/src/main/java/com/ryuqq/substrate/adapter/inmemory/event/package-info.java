/**
 * In-memory event sink recording published events.
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.adapter.inmemory.event;

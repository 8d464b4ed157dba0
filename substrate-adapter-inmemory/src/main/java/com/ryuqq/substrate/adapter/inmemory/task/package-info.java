/**
 * In-memory task submitter recording re-submitted tasks.
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.adapter.inmemory.task;

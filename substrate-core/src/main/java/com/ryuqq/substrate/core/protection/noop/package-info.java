/**
 * NoOp implementations of the protection SPIs.
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.core.protection.noop;

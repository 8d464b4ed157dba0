/**
 * Clock and cooperative sleep abstraction.
 *
 * @since 1.0.0
 * @author Substrate Team
 */
package com.ryuqq.substrate.core.time;

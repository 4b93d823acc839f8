/**
 * Protection layer: circuit breaker and rate limiter SPIs.
 *
 * <p>The circuit breaker decides whether an orchestration run may be attempted at all;
 * retry inside a run is handled by {@link com.ryuqq.punchclock.core.retry.RetryPolicy}.
 * No-op implementations live in the {@code noop} subpackage.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.punchclock.core.protection;

package com.ryuqq.punchclock.core.protection.noop;

import com.ryuqq.punchclock.core.protection.RateLimiter;

/**
 * 대기 없이 즉시 허가하는 Rate Limiter.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    @Override
    public void acquire() {
        // no-op
    }
}

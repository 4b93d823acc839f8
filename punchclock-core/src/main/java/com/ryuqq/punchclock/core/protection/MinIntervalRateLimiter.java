package com.ryuqq.punchclock.core.protection;

import com.ryuqq.punchclock.core.retry.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 직전 호출 이후 최소 간격이 지날 때까지 대기하는 Rate Limiter.
 *
 * <p>동시 호출은 {@code synchronized}로 직렬화됩니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class MinIntervalRateLimiter implements RateLimiter {

    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;
    private Instant lastAcquired;

    public MinIntervalRateLimiter(Duration minInterval) {
        this(minInterval, Clock.systemUTC(), Sleeper.system());
    }

    public MinIntervalRateLimiter(Duration minInterval, Clock clock, Sleeper sleeper) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException(
                "minInterval must be non-negative (current: " + minInterval + ")"
            );
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public synchronized void acquire() throws InterruptedException {
        Instant now = clock.instant();
        if (lastAcquired != null) {
            Duration elapsed = Duration.between(lastAcquired, now);
            Duration remaining = minInterval.minus(elapsed);
            if (!remaining.isNegative() && !remaining.isZero()) {
                sleeper.sleep(remaining);
                now = lastAcquired.plus(minInterval);
            }
        }
        lastAcquired = now;
    }
}

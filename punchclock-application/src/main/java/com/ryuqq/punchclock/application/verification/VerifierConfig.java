package com.ryuqq.punchclock.application.verification;

import java.time.Duration;

/**
 * ResultVerifier 설정.
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param timeout 신호 대기 시간 (기본 10초)
 * @param pollInterval 관찰 간격 (기본 500ms)
 */
public record VerifierConfig(Duration timeout, Duration pollInterval) {

    public VerifierConfig() {
        this(Duration.ofSeconds(10), Duration.ofMillis(500));
    }

    public VerifierConfig {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive (current: " + pollInterval + ")");
        }
    }

    /**
     * timeout 동안 수행할 최대 관찰 횟수.
     */
    public int maxTicks() {
        return maxTicks(timeout);
    }

    int maxTicks(Duration budget) {
        long ticks = (budget.toMillis() + pollInterval.toMillis() - 1) / pollInterval.toMillis();
        return (int) Math.max(1L, Math.min(ticks, Integer.MAX_VALUE));
    }

    public VerifierConfig withTimeout(Duration timeout) {
        return new VerifierConfig(timeout, pollInterval);
    }

    public VerifierConfig withPollInterval(Duration pollInterval) {
        return new VerifierConfig(timeout, pollInterval);
    }
}

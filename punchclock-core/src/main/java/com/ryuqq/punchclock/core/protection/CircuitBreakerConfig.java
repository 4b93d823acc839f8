package com.ryuqq.punchclock.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param failureThreshold OPEN 전환 연속 실패 횟수 (1 이상, 기본 5)
 * @param recoveryTimeout OPEN 유지 시간 (양수, 기본 60초)
 */
public record CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout) {

    /**
     * 기본 설정 생성자 (failureThreshold=5, recoveryTimeout=60s).
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(60));
    }

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException(
                "failureThreshold must be >= 1 (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeout == null || recoveryTimeout.isZero() || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "recoveryTimeout must be positive (current: " + recoveryTimeout + ")"
            );
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout);
    }
}

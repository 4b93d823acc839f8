package com.ryuqq.punchclock.core.protection.noop;

import com.ryuqq.punchclock.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class NoOpCircuitBreakerTest {

    @Test
    void 실패가_누적되어도_항상_허용() {
        NoOpCircuitBreaker breaker = new NoOpCircuitBreaker();

        for (int i = 0; i < 100; i++) {
            breaker.recordFailure(new RuntimeException("x"));
        }

        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void NoOpRateLimiter는_즉시_반환() {
        assertThatCode(() -> new NoOpRateLimiter().acquire()).doesNotThrowAnyException();
    }
}

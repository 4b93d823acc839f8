package com.ryuqq.punchclock.core.protection.noop;

import com.ryuqq.punchclock.core.protection.CircuitBreaker;
import com.ryuqq.punchclock.core.protection.CircuitBreakerState;

/**
 * 항상 시도를 허용하는 Circuit Breaker.
 *
 * <p>보호 계층을 끄거나 테스트에서 Circuit 영향을 배제할 때 사용합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    @Override
    public boolean canExecute() {
        return true;
    }

    @Override
    public void recordSuccess() {
        // no-op
    }

    @Override
    public void recordFailure(Throwable error) {
        // no-op
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public void reset() {
        // no-op
    }
}

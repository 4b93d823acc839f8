package com.ryuqq.punchclock.core.protection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>CLOSED: 실패마다 카운트 증가, threshold 도달 시 OPEN</li>
 *   <li>OPEN: recoveryTimeout 경과 전까지 canExecute=false</li>
 *   <li>HALF_OPEN: 시험 시도 1회만 허용. 결과 기록 전 추가 호출은 거부</li>
 * </ul>
 *
 * <p>상태는 {@link ReentrantLock}으로 보호되며, 시간은 주입된 {@link Clock}을 사용합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean probeInFlight;

    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public boolean canExecute() {
        lock.lock();
        try {
            return switch (state) {
                case CLOSED -> true;
                case OPEN -> tryHalfOpen();
                case HALF_OPEN -> {
                    // 시험 시도 결과가 기록되기 전까지 추가 시도 거부
                    if (probeInFlight) {
                        yield false;
                    }
                    probeInFlight = true;
                    yield true;
                }
            };
        } finally {
            lock.unlock();
        }
    }

    private boolean tryHalfOpen() {
        Duration elapsed = Duration.between(openedAt, clock.instant());
        if (elapsed.compareTo(config.recoveryTimeout()) < 0) {
            return false;
        }
        state = CircuitBreakerState.HALF_OPEN;
        probeInFlight = true;
        log.info("Circuit breaker HALF_OPEN after {}ms, allowing trial attempt", elapsed.toMillis());
        return true;
    }

    @Override
    public void recordSuccess() {
        lock.lock();
        try {
            if (state == CircuitBreakerState.OPEN) {
                // OPEN 에서는 HALF_OPEN 시험 시도를 거쳐야만 닫힘
                log.debug("Circuit breaker success ignored while OPEN");
                return;
            }
            if (state == CircuitBreakerState.HALF_OPEN) {
                log.info("Circuit breaker CLOSED after successful attempt");
            }
            state = CircuitBreakerState.CLOSED;
            consecutiveFailures = 0;
            openedAt = null;
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(Throwable error) {
        lock.lock();
        try {
            consecutiveFailures++;
            probeInFlight = false;
            if (state == CircuitBreakerState.HALF_OPEN) {
                open("trial attempt failed", error);
            } else if (state == CircuitBreakerState.CLOSED && consecutiveFailures >= config.failureThreshold()) {
                open(consecutiveFailures + " consecutive failures", error);
            } else {
                log.debug("Circuit breaker failure recorded: count={}/{}", consecutiveFailures, config.failureThreshold());
            }
        } finally {
            lock.unlock();
        }
    }

    private void open(String reason, Throwable error) {
        state = CircuitBreakerState.OPEN;
        openedAt = clock.instant();
        log.warn("Circuit breaker OPEN ({}), blocking attempts for {}ms: {}",
            reason, config.recoveryTimeout().toMillis(), error == null ? "-" : error.toString());
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 연속 실패 횟수 (모니터링용).
     */
    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            state = CircuitBreakerState.CLOSED;
            consecutiveFailures = 0;
            openedAt = null;
            probeInFlight = false;
            log.info("Circuit breaker reset");
        } finally {
            lock.unlock();
        }
    }
}

package com.ryuqq.punchclock.core.protection;

/**
 * Circuit Breaker SPI.
 *
 * <p>연속 실패가 누적되면 일정 시간 동안 작업 시도 자체를 차단하여
 * 장애 중인 원격 시스템에 부하를 가하지 않도록 합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #canExecute()}가 false이면 호출자는 작업을 시도하지 않아야 함</li>
 *   <li>{@link #canExecute()}가 true를 반환한 경우 호출자는 반드시 결과를 기록해야 함</li>
 *   <li>모든 메서드는 스레드 안전해야 함</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 작업 시도 가능 여부.
     *
     * <p>OPEN 상태에서 복구 타임아웃이 경과했으면 HALF_OPEN으로 전환하고
     * 시험 시도 1회를 허용합니다.</p>
     *
     * @return 시도 가능하면 true
     */
    boolean canExecute();

    /**
     * 성공 기록. 실패 카운트를 초기화하고 CLOSED로 전환합니다.
     */
    void recordSuccess();

    /**
     * 실패 기록.
     *
     * @param error 실패 원인 (로그용, null 허용)
     */
    void recordFailure(Throwable error);

    /**
     * 현재 상태 조회.
     *
     * @return 현재 상태
     */
    CircuitBreakerState getState();

    /**
     * 수동 초기화 (CLOSED, 실패 카운트 0).
     */
    void reset();
}

package com.ryuqq.punchclock.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <pre>
 * CLOSED ──(연속 실패 ≥ threshold)──▶ OPEN
 * OPEN ──(recoveryTimeout 경과 후 canExecute)──▶ HALF_OPEN
 * HALF_OPEN ──(성공)──▶ CLOSED
 * HALF_OPEN ──(실패)──▶ OPEN
 * </pre>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /** 정상 상태. 모든 시도 허용. */
    CLOSED,

    /** 차단 상태. 복구 타임아웃 전까지 모든 시도 거부. */
    OPEN,

    /** 시험 상태. 단 한 번의 시도만 허용. */
    HALF_OPEN
}

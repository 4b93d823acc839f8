package com.ryuqq.punchclock.core.error;

/**
 * 오류 분류.
 *
 * <ul>
 *   <li>TERMINAL: 재시도해도 성공할 수 없음 (자격 증명 거부, 잘못된 설정/입력)</li>
 *   <li>TRANSIENT: 일시적 오류 (타임아웃, 네트워크, 드라이버 오류) - 재시도 및 Circuit Breaker 실패로 집계</li>
 *   <li>CANCELLED: 운영자 취소 - 재시도하지 않으며 오류로 취급하지 않음</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public enum ErrorClassification {

    TERMINAL,

    TRANSIENT,

    CANCELLED;

    /**
     * 재시도 가능 여부.
     *
     * @return TRANSIENT인 경우 true
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}

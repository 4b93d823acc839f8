package com.ryuqq.punchclock.core.error;

/**
 * 도메인 예외 최상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorClassification}을 가지며,
 * RetryPolicy는 이 분류로 재시도 여부를 결정합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public abstract class PunchClockException extends RuntimeException {

    protected PunchClockException(String message) {
        super(message);
    }

    protected PunchClockException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    public abstract ErrorClassification classification();
}

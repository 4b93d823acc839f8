package com.ryuqq.punchclock.core.error;

import java.time.Duration;
import java.util.Optional;

/**
 * 일시적 오류 (재시도 가능).
 *
 * <p>선택적으로 최소 대기 시간 힌트(예: HTTP 429의 Retry-After)를 가질 수 있으며,
 * RetryPolicy는 백오프 지연과 힌트 중 큰 값을 사용합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class TransientException extends PunchClockException {

    private final Duration retryAfter;

    public TransientException(String message) {
        this(message, null, null);
    }

    public TransientException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public TransientException(String message, Throwable cause, Duration retryAfter) {
        super(message, cause);
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter cannot be negative (current: " + retryAfter + ")");
        }
        this.retryAfter = retryAfter;
    }

    @Override
    public final ErrorClassification classification() {
        return ErrorClassification.TRANSIENT;
    }

    /**
     * 다음 시도 전 최소 대기 시간 힌트.
     *
     * @return 힌트 (없으면 empty)
     */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}

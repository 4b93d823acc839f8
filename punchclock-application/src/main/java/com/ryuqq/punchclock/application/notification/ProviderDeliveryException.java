package com.ryuqq.punchclock.application.notification;

import com.ryuqq.punchclock.core.error.TransientException;

import java.time.Duration;

/**
 * 채널이 전송을 받아들이지 않은 경우 (재시도 가능).
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ProviderDeliveryException extends TransientException {

    private final Integer statusCode;

    public ProviderDeliveryException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ProviderDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    protected ProviderDeliveryException(String message, Integer statusCode, Duration retryAfter) {
        super(message, null, retryAfter);
        this.statusCode = statusCode;
    }

    /**
     * 응답 코드 (전송 자체가 실패했으면 null).
     */
    public Integer statusCode() {
        return statusCode;
    }
}

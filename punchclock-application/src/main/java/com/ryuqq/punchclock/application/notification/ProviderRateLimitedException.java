package com.ryuqq.punchclock.application.notification;

import java.time.Duration;

/**
 * 채널이 요청 빈도 제한을 알린 경우. 재시도 전 최소 대기 시간을 함께 전달합니다.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ProviderRateLimitedException extends ProviderDeliveryException {

    public ProviderRateLimitedException(String message, int statusCode, Duration retryAfter) {
        super(message, statusCode, retryAfter);
    }
}

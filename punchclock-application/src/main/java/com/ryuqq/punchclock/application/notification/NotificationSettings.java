package com.ryuqq.punchclock.application.notification;

import com.ryuqq.punchclock.core.retry.RetryConfig;

import java.time.Duration;

/**
 * 채널 공통 알림 설정.
 *
 * <p><strong>등급별 전송 여부:</strong> SUCCESS → notifySuccess, ERROR → notifyFailure,
 * WARNING → notifyWarnings, INFO → notifyScheduler</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param enabled 채널 사용 여부
 * @param notifySuccess 성공 알림
 * @param notifyFailure 실패 알림
 * @param notifyWarnings 경고 알림
 * @param notifyScheduler 스케줄러 및 안내 알림
 * @param retryConfig 전송 재시도 설정 (기본 3회, 1s~10s)
 * @param rateLimitDelay 전송 간 최소 간격 (기본 1초)
 * @param timeout 요청 타임아웃 (기본 30초)
 */
public record NotificationSettings(
    boolean enabled,
    boolean notifySuccess,
    boolean notifyFailure,
    boolean notifyWarnings,
    boolean notifyScheduler,
    RetryConfig retryConfig,
    Duration rateLimitDelay,
    Duration timeout
) {

    public NotificationSettings() {
        this(true, true, true, true, true,
            new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0, true),
            Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    public NotificationSettings {
        if (retryConfig == null) {
            throw new IllegalArgumentException("retryConfig cannot be null");
        }
        if (rateLimitDelay == null || rateLimitDelay.isNegative()) {
            throw new IllegalArgumentException(
                "rateLimitDelay must be non-negative (current: " + rateLimitDelay + ")"
            );
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    /**
     * 등급에 대한 전송 여부.
     */
    public boolean isEnabledFor(NotificationLevel level) {
        if (!enabled) {
            return false;
        }
        return switch (level) {
            case SUCCESS -> notifySuccess;
            case ERROR -> notifyFailure;
            case WARNING -> notifyWarnings;
            case INFO -> notifyScheduler;
        };
    }

    public NotificationSettings withEnabled(boolean enabled) {
        return new NotificationSettings(enabled, notifySuccess, notifyFailure, notifyWarnings, notifyScheduler,
            retryConfig, rateLimitDelay, timeout);
    }

    public NotificationSettings withLevelToggles(boolean success, boolean failure, boolean warnings, boolean scheduler) {
        return new NotificationSettings(enabled, success, failure, warnings, scheduler,
            retryConfig, rateLimitDelay, timeout);
    }

    public NotificationSettings withRetryConfig(RetryConfig retryConfig) {
        return new NotificationSettings(enabled, notifySuccess, notifyFailure, notifyWarnings, notifyScheduler,
            retryConfig, rateLimitDelay, timeout);
    }

    public NotificationSettings withRateLimitDelay(Duration rateLimitDelay) {
        return new NotificationSettings(enabled, notifySuccess, notifyFailure, notifyWarnings, notifyScheduler,
            retryConfig, rateLimitDelay, timeout);
    }

    public NotificationSettings withTimeout(Duration timeout) {
        return new NotificationSettings(enabled, notifySuccess, notifyFailure, notifyWarnings, notifyScheduler,
            retryConfig, rateLimitDelay, timeout);
    }
}

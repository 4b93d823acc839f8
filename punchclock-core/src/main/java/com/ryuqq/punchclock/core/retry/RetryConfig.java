package com.ryuqq.punchclock.core.retry;

import java.time.Duration;

/**
 * 재시도 설정 (불변 record).
 *
 * <p>호출 지점마다 별도로 지정합니다 (예: 로그인, 화면 이동, 알림 전송).</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수 (첫 시도 포함, 기본 3)</li>
 *   <li>baseDelay: 기본 지연 (기본 1초)</li>
 *   <li>maxDelay: 최대 지연 (기본 30초)</li>
 *   <li>backoffBase: 지수 백오프 밑 (기본 2.0)</li>
 *   <li>jitterEnabled: ±25% Jitter 적용 여부 (기본 true)</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelay 기본 지연 (0 이상)
 * @param maxDelay 최대 지연 (baseDelay 이상)
 * @param backoffBase 지수 백오프 밑 (1.0 이상)
 * @param jitterEnabled Jitter 적용 여부
 */
public record RetryConfig(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    double backoffBase,
    boolean jitterEnabled
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelay=1s, maxDelay=30s, backoffBase=2.0, jitterEnabled=true</p>
     */
    public RetryConfig() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be >= 1 (current: " + maxAttempts + ")"
            );
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException(
                "baseDelay must be non-negative (current: " + baseDelay + ")"
            );
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (backoffBase < 1.0 || Double.isNaN(backoffBase)) {
            throw new IllegalArgumentException(
                "backoffBase must be >= 1.0 (current: " + backoffBase + ")"
            );
        }
    }

    /**
     * 재시도 없이 1회만 시도하는 설정.
     */
    public static RetryConfig singleAttempt() {
        return new RetryConfig(1, Duration.ZERO, Duration.ZERO, 1.0, false);
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffBase, jitterEnabled);
    }

    public RetryConfig withBaseDelay(Duration baseDelay) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffBase, jitterEnabled);
    }

    public RetryConfig withMaxDelay(Duration maxDelay) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffBase, jitterEnabled);
    }

    public RetryConfig withBackoffBase(double backoffBase) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffBase, jitterEnabled);
    }

    public RetryConfig withJitterEnabled(boolean jitterEnabled) {
        return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffBase, jitterEnabled);
    }
}

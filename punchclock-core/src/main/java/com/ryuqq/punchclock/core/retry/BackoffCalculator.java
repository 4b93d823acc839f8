package com.ryuqq.punchclock.core.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, ±25% Jitter를 추가하여
 * 동시에 재시도가 몰리는 현상(Retry Storm)을 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay(n) = min(maxDelay, baseDelay * backoffBase^(n-1))   // n = 다음 시도 번호 (2부터)
 * jitter   = delay * uniform(-0.25, +0.25)                  // jitterEnabled일 때만
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, backoffBase=2.0, maxDelay=30000ms, jitter 없음):</strong></p>
 * <ul>
 *   <li>attempt=2: 2000ms</li>
 *   <li>attempt=3: 4000ms</li>
 *   <li>attempt=4: 8000ms</li>
 *   <li>attempt=10: 30000ms (maxDelay로 제한)</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final double JITTER_RATIO = 0.25;

    private final RetryConfig config;
    private final DoubleSupplier random;

    /**
     * 생성자 (ThreadLocalRandom 사용).
     *
     * @param config 재시도 설정
     */
    public BackoffCalculator(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 생성자 (난수 공급자 주입).
     *
     * @param config 재시도 설정
     * @param random [0.0, 1.0) 범위 난수 공급자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public BackoffCalculator(RetryConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.config = config;
        this.random = random;
    }

    /**
     * 다음 시도 전 대기 시간 계산.
     *
     * @param attempt 곧 수행할 시도 번호 (2 이상)
     * @return 대기 시간 (0 이상)
     * @throws IllegalArgumentException attempt가 2 미만인 경우
     */
    public Duration delayBeforeAttempt(int attempt) {
        if (attempt < 2) {
            throw new IllegalArgumentException(
                "attempt must be >= 2 (current: " + attempt + ")"
            );
        }

        // 1. 지수 백오프 (maxDelay로 상한 - pow 결과가 매우 커도 min으로 안전)
        double baseMs = config.baseDelay().toMillis();
        double exponential = baseMs * Math.pow(config.backoffBase(), attempt - 1);
        double capped = Math.min(exponential, config.maxDelay().toMillis());

        // 2. ±25% Jitter
        if (config.jitterEnabled()) {
            double factor = (random.getAsDouble() * 2.0 - 1.0) * JITTER_RATIO;
            capped += capped * factor;
        }

        return Duration.ofMillis(Math.max(0L, Math.round(capped)));
    }

    public RetryConfig getConfig() {
        return config;
    }
}

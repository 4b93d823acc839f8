package com.ryuqq.punchclock.core.retry;

import com.ryuqq.punchclock.core.error.ErrorClassification;
import com.ryuqq.punchclock.core.error.TransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 재시도 정책.
 *
 * <p>하나의 논리 작업 안에서 재시도를 관리합니다. 작업 자체를 시도할지 여부는
 * {@link com.ryuqq.punchclock.core.protection.CircuitBreaker}가 결정합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * for attempt in 1..maxAttempts:
 *   1. operation.run() → 성공 시 즉시 반환
 *   2. 실패 시 오류 분류 (지연 계산보다 먼저)
 *      - TERMINAL / CANCELLED → 즉시 원래 오류 전파
 *   3. 마지막 시도였으면 반복 종료
 *   4. delay = max(backoff(attempt+1), retryAfter 힌트) 만큼 대기
 * 마지막 오류를 변경 없이 전파
 * </pre>
 *
 * <p>시도마다 시도 번호, 대기 시간, 오류 분류를 구조화된 로그로 남깁니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    private final RetryConfig config;
    private final ErrorClassifier classifier;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;

    /**
     * 기본 분류기와 시스템 Sleeper로 생성.
     *
     * @param config 재시도 설정
     */
    public RetryPolicy(RetryConfig config) {
        this(config, new ErrorClassifier(), new BackoffCalculator(config), Sleeper.system());
    }

    /**
     * 의존성 주입 생성자.
     *
     * @param config 재시도 설정
     * @param classifier 오류 분류기
     * @param backoffCalculator 백오프 계산기
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryPolicy(RetryConfig config, ErrorClassifier classifier, BackoffCalculator backoffCalculator, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.classifier = classifier;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
    }

    /**
     * 작업을 재시도 정책에 따라 실행.
     *
     * @param operation 실패 가능한 단일 작업
     * @param context 로그용 작업 이름 (예: "authenticate")
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 재시도 불가 오류 또는 시도 소진 시 마지막 오류 (변경 없이 전파)
     */
    public <T> T execute(FallibleOperation<T> operation, String context) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        Exception lastError = null;
        Duration lastDelay = Duration.ZERO;

        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            log.debug("[{}] attempt {}/{} starting (delay={}ms)", context, attempt, config.maxAttempts(), lastDelay.toMillis());
            try {
                T result = operation.run();
                if (attempt > 1) {
                    log.info("[{}] succeeded on attempt {}/{}", context, attempt, config.maxAttempts());
                }
                return result;
            } catch (Exception e) {
                lastError = e;
                ErrorClassification classification = classifier.classify(e);
                log.warn("[{}] attempt {}/{} failed: classification={}, delay={}ms, error={}",
                    context, attempt, config.maxAttempts(), classification, lastDelay.toMillis(), e.toString());

                if (!classification.isRetryable()) {
                    log.error("[{}] non-retryable error, giving up after attempt {}", context, attempt);
                    throw e;
                }
                if (attempt == config.maxAttempts()) {
                    break;
                }

                lastDelay = nextDelay(attempt + 1, e);
                log.info("[{}] retrying in {}ms (next attempt {}/{})", context, lastDelay.toMillis(), attempt + 1, config.maxAttempts());
                sleep(lastDelay, e);
            }
        }

        log.error("[{}] failed after {} attempts", context, config.maxAttempts());
        throw lastError;
    }

    private Duration nextDelay(int nextAttempt, Exception error) {
        Duration backoff = backoffCalculator.delayBeforeAttempt(nextAttempt);
        Optional<Duration> hint = error instanceof TransientException
            ? ((TransientException) error).retryAfter()
            : Optional.empty();
        if (hint.isPresent()) {
            Duration capped = hint.get().compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : hint.get();
            return capped.compareTo(backoff) > 0 ? capped : backoff;
        }
        return backoff;
    }

    /**
     * 백오프 대기.
     *
     * <p>인터럽트 시 플래그를 복원하고 대기 직전의 원래 오류를 전파합니다.</p>
     */
    private void sleep(Duration delay, Exception pending) throws Exception {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(ie);
            throw pending;
        }
    }

    public RetryConfig getConfig() {
        return config;
    }
}

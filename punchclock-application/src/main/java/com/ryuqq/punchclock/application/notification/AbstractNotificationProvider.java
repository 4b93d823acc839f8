package com.ryuqq.punchclock.application.notification;

import com.ryuqq.punchclock.core.protection.MinIntervalRateLimiter;
import com.ryuqq.punchclock.core.protection.RateLimiter;
import com.ryuqq.punchclock.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 재시도와 전송 간격 제한을 공통 처리하는 채널 기반 클래스.
 *
 * <p><strong>전송 흐름:</strong></p>
 * <pre>
 * deliver(message)
 *   ├─ validateConfig() 실패 → 실패 결과
 *   └─ RetryPolicy.execute:
 *        rateLimiter.acquire() → send(message)
 *   성공 → 결과 반환 / 모든 시도 실패 → 마지막 오류로 실패 결과
 * </pre>
 *
 * <p>하위 클래스는 {@link #send(NotificationMessage)}에서 응답을 해석해
 * 재시도 가능한 실패는 {@link ProviderDeliveryException}, 인증 실패는
 * {@link ProviderAuthenticationException}으로 던집니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public abstract class AbstractNotificationProvider implements NotificationProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractNotificationProvider.class);

    private final NotificationSettings settings;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;

    protected AbstractNotificationProvider(NotificationSettings settings) {
        this(settings, new RetryPolicy(settings.retryConfig()), new MinIntervalRateLimiter(settings.rateLimitDelay()));
    }

    /**
     * 생성자.
     *
     * @param settings 알림 설정
     * @param retryPolicy 전송 재시도 정책
     * @param rateLimiter 전송 간격 제한
     */
    protected AbstractNotificationProvider(NotificationSettings settings, RetryPolicy retryPolicy, RateLimiter rateLimiter) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        this.settings = settings;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
    }

    /**
     * 실제 전송 1회.
     *
     * @param message 메시지
     * @return 성공 결과
     * @throws Exception 전송 실패 시
     */
    protected abstract ProviderResult send(NotificationMessage message) throws Exception;

    /**
     * 채널 설정 유효성.
     */
    public abstract boolean validateConfig();

    @Override
    public boolean shouldNotify(NotificationMessage message) {
        return settings.isEnabledFor(message.level());
    }

    @Override
    public final ProviderResult deliver(NotificationMessage message) {
        if (!validateConfig()) {
            log.warn("[{}] invalid configuration, skipping '{}'", name(), message.title());
            return ProviderResult.failed(name(), null, "invalid provider configuration");
        }
        try {
            ProviderResult result = retryPolicy.execute(() -> {
                rateLimiter.acquire();
                return send(message);
            }, name());
            log.info("[{}] delivered '{}' ({})", name(), message.title(), message.level());
            return result;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("[{}] delivery of '{}' failed: {}", name(), message.title(), e.getMessage());
            return ProviderResult.failed(name(), statusCodeOf(e), describe(e));
        }
    }

    private static Integer statusCodeOf(Exception e) {
        if (e instanceof ProviderDeliveryException) {
            return ((ProviderDeliveryException) e).statusCode();
        }
        if (e instanceof ProviderAuthenticationException) {
            return ((ProviderAuthenticationException) e).statusCode();
        }
        return null;
    }

    private static String describe(Exception e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }

    protected NotificationSettings getSettings() {
        return settings;
    }
}

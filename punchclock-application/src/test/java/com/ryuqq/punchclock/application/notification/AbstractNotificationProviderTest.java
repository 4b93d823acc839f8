package com.ryuqq.punchclock.application.notification;

import com.ryuqq.punchclock.core.protection.RateLimiter;
import com.ryuqq.punchclock.core.retry.BackoffCalculator;
import com.ryuqq.punchclock.core.retry.ErrorClassifier;
import com.ryuqq.punchclock.core.retry.RetryConfig;
import com.ryuqq.punchclock.core.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AbstractNotificationProvider 테스트.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
class AbstractNotificationProviderTest {

    private static final NotificationMessage MESSAGE =
        NotificationMessage.of("clock-in succeeded", "ok", NotificationLevel.SUCCESS, Instant.EPOCH);

    private final List<Duration> sleeps = new ArrayList<>();
    private final AtomicInteger acquired = new AtomicInteger();
    private final RateLimiter countingLimiter = acquired::incrementAndGet;

    private ScriptedProvider provider(NotificationSettings settings, Object... script) {
        RetryConfig config = settings.retryConfig().withJitterEnabled(false);
        RetryPolicy policy = new RetryPolicy(config, new ErrorClassifier(), new BackoffCalculator(config), sleeps::add);
        return new ScriptedProvider(settings, policy, countingLimiter, script);
    }

    @Test
    void deliver_일시적_실패_후_성공() {
        // given
        ScriptedProvider provider = provider(new NotificationSettings(),
            new ProviderDeliveryException("HTTP 502", 502),
            ProviderResult.delivered("scripted", 204));

        // when
        ProviderResult result = provider.deliver(MESSAGE);

        // then
        assertThat(result.success()).isTrue();
        assertThat(provider.calls).isEqualTo(2);
        assertThat(acquired.get()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void deliver_인증_실패는_재시도하지_않고_실패_결과() {
        ScriptedProvider provider = provider(new NotificationSettings(),
            new ProviderAuthenticationException("HTTP 401 unauthorized", 401));

        ProviderResult result = provider.deliver(MESSAGE);

        assertThat(result.success()).isFalse();
        assertThat(result.statusCode()).isEqualTo(401);
        assertThat(provider.calls).isEqualTo(1);
    }

    @Test
    void deliver_빈도_제한은_retryAfter만큼_대기_후_재시도() {
        ScriptedProvider provider = provider(new NotificationSettings(),
            new ProviderRateLimitedException("HTTP 429", 429, Duration.ofSeconds(5)),
            ProviderResult.delivered("scripted", 204));

        assertThat(provider.deliver(MESSAGE).success()).isTrue();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
    }

    @Test
    void deliver_모든_시도_실패시_마지막_상태코드와_메시지() {
        ScriptedProvider provider = provider(new NotificationSettings(),
            new ProviderDeliveryException("HTTP 500", 500),
            new ProviderDeliveryException("HTTP 502", 502),
            new ProviderDeliveryException("HTTP 503", 503));

        ProviderResult result = provider.deliver(MESSAGE);

        assertThat(result.success()).isFalse();
        assertThat(result.statusCode()).isEqualTo(503);
        assertThat(result.errorMessage()).isEqualTo("HTTP 503");
        assertThat(provider.calls).isEqualTo(3);
    }

    @Test
    void deliver_설정이_잘못되면_전송하지_않음() {
        ScriptedProvider provider = provider(new NotificationSettings());
        provider.valid = false;

        ProviderResult result = provider.deliver(MESSAGE);

        assertThat(result.success()).isFalse();
        assertThat(provider.calls).isZero();
    }

    @Test
    void shouldNotify_등급별_설정을_따름() {
        ScriptedProvider provider = provider(new NotificationSettings().withLevelToggles(false, true, true, false));

        assertThat(provider.shouldNotify(MESSAGE)).isFalse();
        assertThat(provider.shouldNotify(NotificationMessage.of("x", "y", NotificationLevel.ERROR, Instant.EPOCH))).isTrue();
        assertThat(provider.shouldNotify(NotificationMessage.of("x", "y", NotificationLevel.INFO, Instant.EPOCH))).isFalse();
    }

    @Test
    void shouldNotify_비활성화되면_항상_false() {
        ScriptedProvider provider = provider(new NotificationSettings().withEnabled(false));

        assertThat(provider.shouldNotify(MESSAGE)).isFalse();
    }

    private static final class ScriptedProvider extends AbstractNotificationProvider {

        private final Deque<Object> script;
        private int calls;
        private boolean valid = true;

        ScriptedProvider(NotificationSettings settings, RetryPolicy policy, RateLimiter limiter, Object... script) {
            super(settings, policy, limiter);
            this.script = new ArrayDeque<>(List.of(script));
        }

        @Override
        public String name() {
            return "scripted";
        }

        @Override
        public boolean validateConfig() {
            return valid;
        }

        @Override
        protected ProviderResult send(NotificationMessage message) throws Exception {
            calls++;
            Object next = script.poll();
            if (next instanceof Exception) {
                throw (Exception) next;
            }
            return (ProviderResult) next;
        }
    }
}

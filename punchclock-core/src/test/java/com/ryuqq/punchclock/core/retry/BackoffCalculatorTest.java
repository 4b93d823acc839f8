package com.ryuqq.punchclock.core.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    private final RetryConfig noJitter = new RetryConfig().withJitterEnabled(false);

    @Test
    void delayBeforeAttempt_지수적으로_증가함() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(noJitter);

        // when & then
        assertThat(calculator.delayBeforeAttempt(2)).isEqualTo(Duration.ofMillis(2000));
        assertThat(calculator.delayBeforeAttempt(3)).isEqualTo(Duration.ofMillis(4000));
        assertThat(calculator.delayBeforeAttempt(4)).isEqualTo(Duration.ofMillis(8000));
    }

    @Test
    void delayBeforeAttempt_maxDelay로_상한_제한() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(noJitter);

        // when & then
        assertThat(calculator.delayBeforeAttempt(10)).isEqualTo(Duration.ofSeconds(30));
        assertThat(calculator.delayBeforeAttempt(1000)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void delayBeforeAttempt_backoffBase_1이면_고정_간격() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(noJitter.withBackoffBase(1.0));

        // when & then
        assertThat(calculator.delayBeforeAttempt(2)).isEqualTo(Duration.ofSeconds(1));
        assertThat(calculator.delayBeforeAttempt(5)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void delayBeforeAttempt_Jitter_하한은_마이너스_25퍼센트() {
        // given: random=0.0 → factor=-0.25
        BackoffCalculator calculator = new BackoffCalculator(new RetryConfig(), () -> 0.0);

        // when
        Duration delay = calculator.delayBeforeAttempt(2);

        // then
        assertThat(delay).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void delayBeforeAttempt_Jitter_상한은_플러스_25퍼센트() {
        // given: random→1.0 → factor→+0.25
        BackoffCalculator calculator = new BackoffCalculator(new RetryConfig(), () -> 0.999999);

        // when
        Duration delay = calculator.delayBeforeAttempt(2);

        // then
        assertThat(delay.toMillis()).isBetween(2499L, 2500L);
    }

    @Test
    void delayBeforeAttempt_Jitter는_상한_이후에도_25퍼센트_범위() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(new RetryConfig());

        // when & then
        for (int i = 0; i < 200; i++) {
            assertThat(calculator.delayBeforeAttempt(20).toMillis()).isBetween(22_500L, 37_500L);
        }
    }

    @Test
    void delayBeforeAttempt_attempt가_2_미만이면_예외() {
        BackoffCalculator calculator = new BackoffCalculator(noJitter);

        assertThatThrownBy(() -> calculator.delayBeforeAttempt(1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt must be >= 2");
    }

    @Test
    void retryConfig_잘못된_값은_거부() {
        assertThatThrownBy(() -> new RetryConfig().withMaxAttempts(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("(current: 0)");
        assertThatThrownBy(() -> new RetryConfig().withBackoffBase(0.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryConfig().withMaxDelay(Duration.ofMillis(10)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelay must be >= baseDelay");
    }
}

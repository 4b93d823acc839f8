package com.ryuqq.punchclock.application.verification;

import com.ryuqq.punchclock.application.page.PunchPage;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.StatusSnapshot;
import com.ryuqq.punchclock.core.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 동작 실행 후 결과 검증기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>timeout 동안 pollInterval 간격으로 화면 신호를 관찰하고 {@link SignalMatcher}로 판정.
 *       처음 판정된 신호에서 즉시 종료</li>
 *   <li>신호가 없으면 상태를 다시 읽어 기대한 가용성 변화가 있었는지 확인
 *       (ENTER: 출근 불가 + 퇴근 가능, EXIT: 퇴근 불가)</li>
 *   <li>그래도 판단할 수 없으면 {@code success=false, "result verification timed out"}</li>
 * </ol>
 *
 * <p>상태 비교는 보조 판단일 뿐입니다. 원격 화면의 가용성 표시가 실제 반영보다 늦을 수 있으므로
 * 변화가 없으면 실패가 아니라 판정 불가로 보고합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ResultVerifier {

    private static final Logger log = LoggerFactory.getLogger(ResultVerifier.class);

    private final SignalMatcher matcher;
    private final VerifierConfig config;
    private final Clock clock;
    private final Sleeper sleeper;

    public ResultVerifier(SignalMatcher matcher, VerifierConfig config) {
        this(matcher, config, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * 생성자.
     *
     * @param matcher 신호 판정기
     * @param config 검증 설정
     * @param clock 마감 시각 계산용
     * @param sleeper 관찰 간격 대기
     */
    public ResultVerifier(SignalMatcher matcher, VerifierConfig config, Clock clock, Sleeper sleeper) {
        if (matcher == null) {
            throw new IllegalArgumentException("matcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.matcher = matcher;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * 기본 timeout으로 검증.
     */
    public VerificationResult verify(PunchPage page, Action action, StatusSnapshot before) {
        return verify(page, action, before, config.timeout());
    }

    /**
     * 결과 검증.
     *
     * @param page 원격 화면
     * @param action 실행한 동작 (ENTER 또는 EXIT)
     * @param before 동작 전 상태
     * @param timeout 신호 대기 시간
     * @return 판정 (예외를 던지지 않음)
     */
    public VerificationResult verify(PunchPage page, Action action, StatusSnapshot before, Duration timeout) {
        if (!action.isReal()) {
            throw new IllegalArgumentException("only real actions can be verified (current: " + action + ")");
        }
        List<SignalRule> rules = matcher.rulesFor(action);
        int maxTicks = config.maxTicks(timeout);
        Instant deadline = clock.instant().plus(timeout);

        log.info("Verifying {} result (timeout={}ms, ticks={})", action.displayName(), timeout.toMillis(), maxTicks);

        for (int tick = 1; tick <= maxTicks; tick++) {
            Optional<VerificationResult> result = observeOnce(page, action, rules, tick);
            if (result.isPresent()) {
                log.info("Verification decided at tick {}: success={}, signal={}",
                    tick, result.get().success(), result.get().externalSignal());
                return result.get();
            }
            if (tick == maxTicks || !clock.instant().isBefore(deadline)) {
                break;
            }
            try {
                sleeper.sleep(config.pollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Verification interrupted at tick {}", tick);
                return VerificationResult.timedOut();
            }
        }

        log.info("No result signal within {}ms, falling back to state comparison", timeout.toMillis());
        return compareState(page, action, before);
    }

    private Optional<VerificationResult> observeOnce(PunchPage page, Action action, List<SignalRule> rules, int tick) {
        try {
            return matcher.match(action, page.observe(rules));
        } catch (RuntimeException e) {
            log.debug("Signal observation failed at tick {}: {}", tick, e.toString());
            return Optional.empty();
        }
    }

    private VerificationResult compareState(PunchPage page, Action action, StatusSnapshot before) {
        StatusSnapshot after;
        try {
            after = page.readStatus();
        } catch (RuntimeException e) {
            log.warn("State re-read failed, verification inconclusive: {}", e.toString());
            return VerificationResult.timedOut();
        }

        boolean wasAvailable = before == null || before.isAvailable(action);
        boolean flipped = switch (action) {
            case ENTER -> !after.enterAvailable() && after.exitAvailable();
            case EXIT -> !after.exitAvailable();
            case SIMULATE -> false;
        };

        if (wasAvailable && flipped) {
            log.info("Availability changed as expected after {}: enter={}, exit={}",
                action.displayName(), after.enterAvailable(), after.exitAvailable());
            return new VerificationResult(true, action.displayName() + " succeeded (availability changed)", null);
        }

        log.warn("Verification inconclusive for {}: enter={}, exit={}",
            action.displayName(), after.enterAvailable(), after.exitAvailable());
        return VerificationResult.timedOut();
    }

    public VerifierConfig getConfig() {
        return config;
    }
}

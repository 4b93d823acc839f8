package com.ryuqq.punchclock.testkit;

import com.ryuqq.punchclock.adapter.runner.OrchestratorConfig;
import com.ryuqq.punchclock.adapter.runner.StepwiseOrchestrator;
import com.ryuqq.punchclock.application.confirmation.ConfirmationGate;
import com.ryuqq.punchclock.application.notification.NotificationDispatcher;
import com.ryuqq.punchclock.application.notification.NotificationMessageFactory;
import com.ryuqq.punchclock.application.notification.NotificationProvider;
import com.ryuqq.punchclock.application.notification.ProviderResult;
import com.ryuqq.punchclock.application.orchestrator.ActionRequest;
import com.ryuqq.punchclock.application.page.DriverPunchPage;
import com.ryuqq.punchclock.application.page.PageProfile;
import com.ryuqq.punchclock.application.verification.ResultVerifier;
import com.ryuqq.punchclock.application.verification.SignalMatcher;
import com.ryuqq.punchclock.application.verification.SignalVocabulary;
import com.ryuqq.punchclock.application.verification.VerifierConfig;
import com.ryuqq.punchclock.core.model.ActionOutcome;
import com.ryuqq.punchclock.core.protection.CircuitBreakerConfig;
import com.ryuqq.punchclock.core.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.punchclock.core.retry.RetryConfig;
import com.ryuqq.punchclock.core.retry.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 실제 오케스트레이터, 검증기, 알림 분배기를 스크립트 화면에 연결한 테스트 하네스.
 *
 * <p>시계는 고정되어 있고 대기는 기록만 하므로 실제로 기다리지 않습니다.
 * {@link #run(ActionRequest)}는 실행 결과를 알림 분배기로 전송한 뒤 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PunchClockHarness harness = PunchClockHarness.builder(driver)
 *     .confirmationAnswers("yes")
 *     .providers(discord, slack)
 *     .build();
 * ActionOutcome outcome = harness.run(ActionRequest.interactive(Action.ENTER, credentials));
 * </pre>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public final class PunchClockHarness implements AutoCloseable {

    public static final Instant DEFAULT_NOW = Instant.parse("2026-03-02T01:00:00Z");
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("Asia/Taipei");

    private final StepwiseOrchestrator orchestrator;
    private final NotificationDispatcher dispatcher;
    private final ConsecutiveFailureCircuitBreaker circuitBreaker;
    private final ScriptedConfirmationPrompt prompt;
    private final List<Duration> sleeps;
    private final List<ProviderResult> lastDispatch = new CopyOnWriteArrayList<>();

    private PunchClockHarness(Builder builder) {
        Clock clock = Clock.fixed(builder.now, DEFAULT_ZONE);
        List<Duration> recorded = new CopyOnWriteArrayList<>();
        Sleeper sleeper = recorded::add;

        this.sleeps = recorded;
        this.prompt = new ScriptedConfirmationPrompt(builder.answers);
        this.circuitBreaker = new ConsecutiveFailureCircuitBreaker(builder.circuitBreakerConfig, clock);

        ResultVerifier verifier = new ResultVerifier(
            new SignalMatcher(SignalMatcher.defaultRules(), SignalVocabulary.defaults()),
            builder.verifierConfig, clock, sleeper);
        RetryConfig fastRetry = new RetryConfig().withJitterEnabled(false);
        OrchestratorConfig config = new OrchestratorConfig()
            .withAuthenticateRetry(fastRetry)
            .withNavigateRetry(fastRetry)
            .withVerificationTimeout(builder.verifierConfig.timeout())
            .withEvidenceEnabled(builder.evidenceEnabled);

        PageProfile profile = builder.profile;
        ScriptedSessionDriver driver = builder.driver;
        this.orchestrator = new StepwiseOrchestrator(
            () -> new DriverPunchPage(driver, profile, clock, sleeper),
            config,
            circuitBreaker,
            new ConfirmationGate(prompt),
            verifier,
            clock,
            sleeper);
        this.dispatcher = new NotificationDispatcher(builder.providers, new NotificationMessageFactory(DEFAULT_ZONE, clock));
    }

    public static Builder builder(ScriptedSessionDriver driver) {
        return new Builder(driver);
    }

    /**
     * 한 번 실행하고 결과를 알림으로 전송.
     */
    public ActionOutcome run(ActionRequest request) {
        ActionOutcome outcome = orchestrator.run(request);
        lastDispatch.clear();
        lastDispatch.addAll(dispatcher.dispatch(outcome));
        return outcome;
    }

    public List<ProviderResult> lastDispatch() {
        return List.copyOf(lastDispatch);
    }

    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    public List<String> questionsAsked() {
        return prompt.questions();
    }

    public StepwiseOrchestrator orchestrator() {
        return orchestrator;
    }

    public NotificationDispatcher dispatcher() {
        return dispatcher;
    }

    public ConsecutiveFailureCircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public void close() {
        dispatcher.close();
    }

    /**
     * 하네스 구성.
     */
    public static final class Builder {

        private final ScriptedSessionDriver driver;
        private PageProfile profile = PageProfile.aoaCloud();
        private String[] answers = new String[0];
        private final List<NotificationProvider> providers = new ArrayList<>();
        private VerifierConfig verifierConfig = new VerifierConfig();
        private CircuitBreakerConfig circuitBreakerConfig = new CircuitBreakerConfig();
        private boolean evidenceEnabled = true;
        private Instant now = DEFAULT_NOW;

        private Builder(ScriptedSessionDriver driver) {
            if (driver == null) {
                throw new IllegalArgumentException("driver cannot be null");
            }
            this.driver = driver;
        }

        public Builder profile(PageProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder confirmationAnswers(String... answers) {
            this.answers = answers.clone();
            return this;
        }

        public Builder providers(NotificationProvider... providers) {
            this.providers.addAll(List.of(providers));
            return this;
        }

        public Builder verifierConfig(VerifierConfig verifierConfig) {
            this.verifierConfig = verifierConfig;
            return this;
        }

        public Builder circuitBreakerConfig(CircuitBreakerConfig circuitBreakerConfig) {
            this.circuitBreakerConfig = circuitBreakerConfig;
            return this;
        }

        public Builder evidenceEnabled(boolean evidenceEnabled) {
            this.evidenceEnabled = evidenceEnabled;
            return this;
        }

        public Builder now(Instant now) {
            this.now = now;
            return this;
        }

        public PunchClockHarness build() {
            return new PunchClockHarness(this);
        }
    }
}

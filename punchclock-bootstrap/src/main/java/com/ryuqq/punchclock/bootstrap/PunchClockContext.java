package com.ryuqq.punchclock.bootstrap;

import com.ryuqq.punchclock.adapter.discord.DiscordConfig;
import com.ryuqq.punchclock.adapter.discord.DiscordNotificationProvider;
import com.ryuqq.punchclock.adapter.runner.ActionScheduler;
import com.ryuqq.punchclock.adapter.runner.OrchestratedActionTrigger;
import com.ryuqq.punchclock.adapter.runner.OrchestratorConfig;
import com.ryuqq.punchclock.adapter.runner.StepwiseOrchestrator;
import com.ryuqq.punchclock.adapter.selenium.ChromeSessionFactory;
import com.ryuqq.punchclock.application.confirmation.ConfirmationGate;
import com.ryuqq.punchclock.application.confirmation.ConfirmationPrompt;
import com.ryuqq.punchclock.application.notification.NotificationDispatcher;
import com.ryuqq.punchclock.application.notification.NotificationMessageFactory;
import com.ryuqq.punchclock.application.notification.NotificationProvider;
import com.ryuqq.punchclock.application.orchestrator.Orchestrator;
import com.ryuqq.punchclock.application.page.DriverPunchPageFactory;
import com.ryuqq.punchclock.application.page.PageProfile;
import com.ryuqq.punchclock.application.page.PunchPageFactory;
import com.ryuqq.punchclock.application.verification.ResultVerifier;
import com.ryuqq.punchclock.application.verification.SignalMatcher;
import com.ryuqq.punchclock.application.verification.SignalVocabulary;
import com.ryuqq.punchclock.application.verification.VerifierConfig;
import com.ryuqq.punchclock.bootstrap.config.AppConfig;
import com.ryuqq.punchclock.core.protection.CircuitBreaker;
import com.ryuqq.punchclock.core.protection.CircuitBreakerConfig;
import com.ryuqq.punchclock.core.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.punchclock.core.protection.noop.NoOpCircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 구성 루트. 설정에서 모든 구성 요소를 한 번 생성해 연결합니다.
 *
 * <p>스케줄러와 알림 분배기의 수명은 이 객체가 관리합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public final class PunchClockContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PunchClockContext.class);

    private final AppConfig config;
    private final Orchestrator orchestrator;
    private final NotificationDispatcher dispatcher;
    private final ActionScheduler scheduler;

    /**
     * 실행 모드에 맞춰 Chrome 세션으로 구성.
     *
     * <p>회로 차단기는 여러 번 실행되는 스케줄 모드에서만 의미가 있으므로
     * 한 번 실행하는 모드에서는 {@link NoOpCircuitBreaker}를 사용합니다.</p>
     */
    public static PunchClockContext create(AppConfig config, RunMode mode) {
        PunchPageFactory pageFactory =
            new DriverPunchPageFactory(new ChromeSessionFactory(config.session()), PageProfile.aoaCloud());
        ConfirmationPrompt prompt = mode == RunMode.INTERACTIVE ? new ConsoleConfirmationPrompt() : null;
        CircuitBreaker circuitBreaker = mode == RunMode.SCHEDULE
            ? new ConsecutiveFailureCircuitBreaker(new CircuitBreakerConfig())
            : new NoOpCircuitBreaker();
        return new PunchClockContext(config, prompt, pageFactory, circuitBreaker);
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param prompt 대화형 확인 프롬프트 (null이면 비대화형)
     * @param pageFactory 원격 화면 팩토리
     * @param circuitBreaker 실행 보호용 회로 차단기
     */
    public PunchClockContext(AppConfig config, ConfirmationPrompt prompt, PunchPageFactory pageFactory,
                             CircuitBreaker circuitBreaker) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.orchestrator = new StepwiseOrchestrator(
            pageFactory,
            new OrchestratorConfig(),
            circuitBreaker,
            prompt == null ? ConfirmationGate.nonInteractive() : new ConfirmationGate(prompt),
            new ResultVerifier(new SignalMatcher(SignalMatcher.defaultRules(), SignalVocabulary.defaults()), new VerifierConfig()));
        this.dispatcher = new NotificationDispatcher(
            providers(config), new NotificationMessageFactory(config.scheduler().zone()));
        this.scheduler = new ActionScheduler(
            new OrchestratedActionTrigger(orchestrator, config.credentials()), config.scheduler(), dispatcher);
    }

    static List<NotificationProvider> providers(AppConfig config) {
        List<NotificationProvider> providers = new ArrayList<>();
        if (!config.notification().enabled()) {
            log.info("Webhook notifications disabled");
            return providers;
        }
        config.discordWebhookUrlOptional().ifPresent(url ->
            providers.add(new DiscordNotificationProvider(DiscordConfig.of(url), config.notification())));
        return providers;
    }

    public AppConfig config() {
        return config;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public NotificationDispatcher dispatcher() {
        return dispatcher;
    }

    public ActionScheduler scheduler() {
        return scheduler;
    }

    /**
     * 실행 모드.
     */
    public enum RunMode {
        /** 스케줄러 상주 실행 */
        SCHEDULE,
        /** 운영자 확인을 받는 한 번 실행 */
        INTERACTIVE,
        /** 확인 없이 한 번 실행 (사전 승인 또는 모의 실행) */
        NON_INTERACTIVE
    }

    @Override
    public void close() {
        scheduler.stop();
        dispatcher.close();
    }
}

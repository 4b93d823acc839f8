package com.ryuqq.punchclock.bootstrap;

import com.ryuqq.punchclock.application.notification.ProviderResult;
import com.ryuqq.punchclock.application.orchestrator.ActionRequest;
import com.ryuqq.punchclock.bootstrap.PunchClockContext.RunMode;
import com.ryuqq.punchclock.bootstrap.config.AppConfig;
import com.ryuqq.punchclock.bootstrap.config.EnvironmentConfigLoader;
import com.ryuqq.punchclock.core.error.InvalidConfigurationException;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.ActionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.function.BiFunction;

/**
 * CLI 진입점.
 *
 * <ul>
 *   <li>{@code schedule}: 스케줄러를 시작하고 종료 신호까지 대기</li>
 *   <li>{@code run <enter|exit|simulate>}: 한 번 실행 (기본은 운영자 확인, {@code --yes}는 사전 승인)</li>
 *   <li>{@code test-webhooks}: 알림 채널 연결 확인</li>
 *   <li>{@code status}: 설정된 스케줄의 다음 실행 시각 출력</li>
 * </ul>
 *
 * <p>종료 코드: 0 성공, 1 실행 실패, 2 설정 오류</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
@Command(
    name = "punchclock",
    mixinStandardHelpOptions = true,
    version = "punchclock 1.0.0",
    description = "Scheduled clock-in/clock-out automation with confirmation, verification and notifications.",
    subcommands = {
        PunchClockApplication.ScheduleCommand.class,
        PunchClockApplication.RunCommand.class,
        PunchClockApplication.TestWebhooksCommand.class,
        PunchClockApplication.StatusCommand.class
    }
)
public class PunchClockApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PunchClockApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    private final Map<String, String> environment;
    private final BiFunction<AppConfig, RunMode, PunchClockContext> contextFactory;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public PunchClockApplication() {
        this(System.getenv(), PunchClockContext::create);
    }

    /**
     * 생성자.
     *
     * @param environment 환경 변수
     * @param contextFactory (설정, 실행 모드) → 구성 루트
     */
    PunchClockApplication(Map<String, String> environment,
                          BiFunction<AppConfig, RunMode, PunchClockContext> contextFactory) {
        this.environment = environment;
        this.contextFactory = contextFactory;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PunchClockApplication())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    private PunchClockContext openContext(RunMode mode) {
        AppConfig config = new EnvironmentConfigLoader(environment).load();
        return contextFactory.apply(config, mode);
    }

    private int configError(InvalidConfigurationException e) {
        log.error("Configuration error: {}", e.getMessage());
        spec.commandLine().getErr().println("Configuration error: " + e.getMessage());
        return EXIT_CONFIG;
    }

    // ========== schedule ==========

    @Command(name = "schedule", description = "Run the daily clock-in/clock-out scheduler until interrupted.")
    public static class ScheduleCommand implements Callable<Integer> {

        @ParentCommand
        PunchClockApplication parent;

        @Override
        public Integer call() throws InterruptedException {
            PunchClockContext context;
            try {
                context = parent.openContext(RunMode.SCHEDULE);
            } catch (InvalidConfigurationException e) {
                return parent.configError(e);
            }

            if (!context.config().schedule().enabled()) {
                log.warn("SCHEDULE_ENABLED is false, nothing to schedule");
                context.close();
                return EXIT_OK;
            }

            CountDownLatch shutdown = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown signal received");
                context.close();
                shutdown.countDown();
            }, "punchclock-shutdown"));

            context.scheduler().scheduleAll(context.config().schedule());
            context.scheduler().start();
            log.info("Scheduler running, press Ctrl+C to stop");
            shutdown.await();
            return EXIT_OK;
        }
    }

    // ========== run ==========

    @Command(name = "run", description = "Run one action now.")
    public static class RunCommand implements Callable<Integer> {

        @ParentCommand
        PunchClockApplication parent;

        @Parameters(index = "0", description = "Action to perform: ${COMPLETION-CANDIDATES}")
        Action action;

        @Option(names = {"-y", "--yes"}, description = "Perform the real action without asking for confirmation.")
        boolean confirmed;

        @Option(names = "--non-interactive", description = "Never prompt; without --yes the run is a simulation.")
        boolean nonInteractive;

        @Override
        public Integer call() {
            boolean interactive = !nonInteractive && !confirmed;
            try (PunchClockContext context = parent.openContext(interactive ? RunMode.INTERACTIVE : RunMode.NON_INTERACTIVE)) {
                ActionRequest request = new ActionRequest(action, context.config().credentials(), interactive, confirmed);
                ActionOutcome outcome = context.orchestrator().run(request);
                context.dispatcher().dispatch(outcome);

                PrintWriter out = parent.spec.commandLine().getOut();
                out.printf("%s: %s%n", outcome.success() ? "OK" : "FAILED", outcome.message());
                outcome.externalSignalOptional().ifPresent(signal -> out.println("Server response: " + signal));
                outcome.evidenceOptional().ifPresent(path -> out.println("Screenshot: " + path));
                out.flush();
                return outcome.success() ? EXIT_OK : EXIT_FAILED;
            } catch (InvalidConfigurationException e) {
                return parent.configError(e);
            }
        }
    }

    // ========== test-webhooks ==========

    @Command(name = "test-webhooks", description = "Send a test message to every configured notification provider.")
    public static class TestWebhooksCommand implements Callable<Integer> {

        @ParentCommand
        PunchClockApplication parent;

        @Override
        public Integer call() {
            try (PunchClockContext context = parent.openContext(RunMode.NON_INTERACTIVE)) {
                PrintWriter out = parent.spec.commandLine().getOut();
                if (!context.dispatcher().isEnabled()) {
                    out.println("No notification providers configured (check WEBHOOK_ENABLED and DISCORD_WEBHOOK_URL)");
                    out.flush();
                    return EXIT_FAILED;
                }
                List<ProviderResult> results = context.dispatcher().testProviders();
                for (ProviderResult result : results) {
                    out.printf("%s: %s%n", result.providerName(),
                        result.success() ? "OK" : "FAILED (" + result.errorMessage() + ")");
                }
                out.flush();
                boolean allDelivered = !results.isEmpty() && results.stream().allMatch(ProviderResult::success);
                return allDelivered ? EXIT_OK : EXIT_FAILED;
            } catch (InvalidConfigurationException e) {
                return parent.configError(e);
            }
        }
    }

    // ========== status ==========

    @Command(name = "status", description = "Show the configured schedule and next run times.")
    public static class StatusCommand implements Callable<Integer> {

        @ParentCommand
        PunchClockApplication parent;

        @Override
        public Integer call() {
            try (PunchClockContext context = parent.openContext(RunMode.NON_INTERACTIVE)) {
                PrintWriter out = parent.spec.commandLine().getOut();
                AppConfig config = context.config();
                out.printf("Schedule enabled: %s (weekdays only: %s, zone: %s)%n",
                    config.schedule().enabled(), config.schedule().weekdaysOnly(), config.scheduler().zone());
                context.scheduler().scheduleAll(config.schedule());
                for (Map.Entry<Action, ZonedDateTime> entry : context.scheduler().nextRuns().entrySet()) {
                    out.printf("Next %s: %s%n", entry.getKey().displayName(), entry.getValue());
                }
                out.printf("Notification providers: %s%n", context.dispatcher().providerNames());
                out.flush();
                return EXIT_OK;
            } catch (InvalidConfigurationException e) {
                return parent.configError(e);
            }
        }
    }
}

package com.ryuqq.punchclock.adapter.runner;

import com.ryuqq.punchclock.application.confirmation.ConfirmationGate;
import com.ryuqq.punchclock.application.orchestrator.ActionRequest;
import com.ryuqq.punchclock.application.orchestrator.Orchestrator;
import com.ryuqq.punchclock.application.page.PunchPage;
import com.ryuqq.punchclock.application.page.PunchPageFactory;
import com.ryuqq.punchclock.application.verification.ResultVerifier;
import com.ryuqq.punchclock.application.verification.VerificationResult;
import com.ryuqq.punchclock.core.error.ErrorClassification;
import com.ryuqq.punchclock.core.error.UserCancelledException;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.ActionOutcome;
import com.ryuqq.punchclock.core.model.StatusSnapshot;
import com.ryuqq.punchclock.core.protection.CircuitBreaker;
import com.ryuqq.punchclock.core.retry.BackoffCalculator;
import com.ryuqq.punchclock.core.retry.ErrorClassifier;
import com.ryuqq.punchclock.core.retry.RetryConfig;
import com.ryuqq.punchclock.core.retry.RetryPolicy;
import com.ryuqq.punchclock.core.retry.Sleeper;
import com.ryuqq.punchclock.core.statemachine.RunStage;
import com.ryuqq.punchclock.core.statemachine.RunStep;
import com.ryuqq.punchclock.core.statemachine.StageTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 단계별 상태 머신 Orchestrator 구현체.
 *
 * <p><strong>실행 단계:</strong></p>
 * <pre>
 * START → AUTHENTICATED → NAVIGATED → STATE_CHECKED → ACTION_ATTEMPTED → VERIFIED → DONE
 *   │          │              │              │                │
 *   └──────────┴──────────────┴──────────────┴────────────────┴──→ FAILED(step, reason)
 *                                            └──→ CANCELLED (운영자 중단)
 * </pre>
 *
 * <ol>
 *   <li>Circuit Breaker 확인 (OPEN이면 precheck 실패)</li>
 *   <li>로그인 (RetryPolicy, 로그인 거부는 재시도 안 함)</li>
 *   <li>출퇴근 화면 이동 (RetryPolicy)</li>
 *   <li>상태 읽기 (재시도 안 함, 실패 시 실행 전체 실패)</li>
 *   <li>가용성 확인 → 승인 → 버튼 클릭 1회 (또는 모의 실행)</li>
 *   <li>결과 확인 (ResultVerifier)</li>
 * </ol>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>한 번에 하나의 실행만 세션을 사용합니다 (세션 락).</li>
 *   <li>{@link #run(ActionRequest)}는 예외를 던지지 않고 항상 정확히 하나의 결과를 반환합니다.</li>
 *   <li>세션은 실행이 끝나면 항상 닫힙니다.</li>
 * </ul>
 *
 * <p><strong>Circuit Breaker 기록:</strong> 일시적(TRANSIENT) 오류로 끝난 실행만 실패로 기록합니다.
 * 그 외 결과(성공, 모의 실행, 로그인 거부, 동작 불가, 결과 확인 타임아웃)는 원격 화면이 응답한 것이므로
 * 성공으로 기록합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public final class StepwiseOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(StepwiseOrchestrator.class);

    static final String ACTION_UNAVAILABLE = "action unavailable";

    private final PunchPageFactory pageFactory;
    private final OrchestratorConfig config;
    private final CircuitBreaker circuitBreaker;
    private final ConfirmationGate confirmationGate;
    private final ResultVerifier resultVerifier;
    private final Clock clock;
    private final ErrorClassifier errorClassifier = new ErrorClassifier();
    private final RetryPolicy authenticateRetry;
    private final RetryPolicy navigateRetry;
    private final ReentrantLock sessionLock = new ReentrantLock();

    public StepwiseOrchestrator(PunchPageFactory pageFactory, OrchestratorConfig config, CircuitBreaker circuitBreaker,
                                ConfirmationGate confirmationGate, ResultVerifier resultVerifier) {
        this(pageFactory, config, circuitBreaker, confirmationGate, resultVerifier, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * 생성자.
     *
     * @param pageFactory 세션 생성기
     * @param config 설정
     * @param circuitBreaker 실행 간 장애 차단기
     * @param confirmationGate 실제 동작 승인
     * @param resultVerifier 결과 확인
     * @param clock 시간 소스
     * @param sleeper 재시도 대기 (테스트에서 대체)
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public StepwiseOrchestrator(PunchPageFactory pageFactory, OrchestratorConfig config, CircuitBreaker circuitBreaker,
                                ConfirmationGate confirmationGate, ResultVerifier resultVerifier,
                                Clock clock, Sleeper sleeper) {
        if (pageFactory == null) {
            throw new IllegalArgumentException("pageFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (confirmationGate == null) {
            throw new IllegalArgumentException("confirmationGate cannot be null");
        }
        if (resultVerifier == null) {
            throw new IllegalArgumentException("resultVerifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.pageFactory = pageFactory;
        this.config = config;
        this.circuitBreaker = circuitBreaker;
        this.confirmationGate = confirmationGate;
        this.resultVerifier = resultVerifier;
        this.clock = clock;
        this.authenticateRetry = retryPolicy(config.authenticateRetry(), sleeper);
        this.navigateRetry = retryPolicy(config.navigateRetry(), sleeper);
    }

    private RetryPolicy retryPolicy(RetryConfig retryConfig, Sleeper sleeper) {
        return new RetryPolicy(retryConfig, errorClassifier, new BackoffCalculator(retryConfig), sleeper);
    }

    @Override
    public ActionOutcome run(ActionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        Instant startedAt = clock.instant();

        sessionLock.lock();
        try {
            log.info("Run started: {} (interactive={}, confirmed={})",
                request.action().displayName(), request.interactiveMode(), request.explicitConfirm());
            ActionOutcome outcome = guardedRun(request, startedAt);
            long elapsedMs = Duration.between(startedAt, clock.instant()).toMillis();
            if (outcome.success()) {
                log.info("Run finished in {}ms: {} (simulation={})", elapsedMs, outcome.message(), outcome.simulation());
            } else {
                log.warn("Run failed in {}ms at {}: {}", elapsedMs, outcome.failedStep(), outcome.message());
            }
            return outcome;
        } finally {
            sessionLock.unlock();
        }
    }

    private ActionOutcome guardedRun(ActionRequest request, Instant startedAt) {
        Action requested = request.action();
        boolean dryRun = !requested.isReal();

        if (!circuitBreaker.canExecute()) {
            return ActionOutcome.failed(requested, startedAt, RunStep.PRECHECK,
                failureMessage(RunStep.PRECHECK, "circuit breaker is " + circuitBreaker.getState()),
                null, dryRun, null);
        }

        RunTrace trace = new RunTrace(requested);
        PunchPage page = null;
        try {
            page = pageFactory.open();
            ActionOutcome outcome = runSteps(page, request, trace, startedAt);
            circuitBreaker.recordSuccess();
            return outcome;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return failedRun(trace, startedAt, dryRun, e);
        } finally {
            closeQuietly(page);
        }
    }

    private ActionOutcome runSteps(PunchPage page, ActionRequest request, RunTrace trace, Instant startedAt)
            throws Exception {
        // 1. 로그인
        trace.enter(RunStep.AUTHENTICATE);
        authenticateRetry.execute(() -> {
            page.authenticate(request.credentials());
            return null;
        }, RunStep.AUTHENTICATE.description());
        trace.reach(RunStage.AUTHENTICATED);

        // 2. 화면 이동
        trace.enter(RunStep.NAVIGATE);
        navigateRetry.execute(() -> {
            page.navigateToPunchPage();
            return null;
        }, RunStep.NAVIGATE.description());
        trace.reach(RunStage.NAVIGATED);

        // 3. 상태 읽기 (재시도 없음)
        trace.enter(RunStep.CHECK_STATE);
        StatusSnapshot before = page.readStatus();
        trace.reach(RunStage.STATE_CHECKED);

        // 4. 동작 시도
        trace.enter(RunStep.ATTEMPT_ACTION);
        boolean dryRun = !request.action().isReal();
        Action action = dryRun ? resolveDryRunAction(before) : request.action();
        trace.action = action;

        if (!action.isReal() || !before.isAvailable(action)) {
            log.warn("{} is not available (enter={}, exit={}), no click attempted",
                action.displayName(), before.enterAvailable(), before.exitAvailable());
            trace.reach(RunStage.FAILED);
            return ActionOutcome.failed(action, startedAt, RunStep.ATTEMPT_ACTION, ACTION_UNAVAILABLE,
                null, dryRun, null);
        }

        boolean authorized;
        try {
            authorized = !dryRun && confirmationGate.authorize(action, request.interactiveMode(), request.explicitConfirm());
        } catch (UserCancelledException e) {
            trace.reach(RunStage.CANCELLED);
            return ActionOutcome.simulated(action, startedAt, action.displayName() + " cancelled by operator");
        }

        if (!authorized) {
            log.info("Simulating {}: no click performed", action.displayName());
            trace.reach(RunStage.ACTION_ATTEMPTED);
            trace.reach(RunStage.VERIFIED);
            trace.reach(RunStage.DONE);
            String reason = dryRun ? "dry run requested" : "not confirmed";
            return ActionOutcome.simulated(action, startedAt, action.displayName() + " simulated (" + reason + ")");
        }

        page.press(action);
        trace.reach(RunStage.ACTION_ATTEMPTED);
        if (config.evidenceEnabled()) {
            trace.evidence = page.captureEvidence().orElse(null);
        }

        // 5. 결과 확인
        trace.enter(RunStep.VERIFY);
        VerificationResult result = resultVerifier.verify(page, action, before, config.verificationTimeout());
        if (!result.success()) {
            trace.reach(RunStage.FAILED);
            return ActionOutcome.failed(action, startedAt, RunStep.VERIFY, result.message(),
                result.externalSignal(), false, trace.evidence);
        }
        trace.reach(RunStage.VERIFIED);
        trace.reach(RunStage.DONE);
        return ActionOutcome.succeeded(action, startedAt, result.message(), result.externalSignal(), trace.evidence);
    }

    /**
     * 모의 실행 대상 결정 (출근 우선).
     */
    private static Action resolveDryRunAction(StatusSnapshot snapshot) {
        if (snapshot.enterAvailable()) {
            return Action.ENTER;
        }
        if (snapshot.exitAvailable()) {
            return Action.EXIT;
        }
        return Action.SIMULATE;
    }

    private ActionOutcome failedRun(RunTrace trace, Instant startedAt, boolean dryRun, Exception error) {
        ErrorClassification classification = errorClassifier.classify(error);
        if (classification == ErrorClassification.TRANSIENT) {
            circuitBreaker.recordFailure(error);
        } else {
            circuitBreaker.recordSuccess();
        }
        if (!trace.stage.isTerminal()) {
            trace.reach(RunStage.FAILED);
        }
        log.error("Step {} failed ({}): {}", trace.step.description(), classification, error.toString());
        return ActionOutcome.failed(trace.action, startedAt, trace.step,
            failureMessage(trace.step, describe(error)), null, dryRun, trace.evidence);
    }

    private static String failureMessage(RunStep step, String reason) {
        return step.description() + " failed: " + reason;
    }

    private static String describe(Exception error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static void closeQuietly(PunchPage page) {
        if (page == null) {
            return;
        }
        try {
            page.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close session: {}", e.toString());
        }
    }

    /**
     * 실행 1회의 진행 상황.
     */
    private static final class RunTrace {

        private RunStage stage = RunStage.START;
        private RunStep step = RunStep.PRECHECK;
        private Action action;
        private Path evidence;

        RunTrace(Action action) {
            this.action = action;
        }

        void enter(RunStep next) {
            log.debug("Step: {}", next.description());
            step = next;
        }

        void reach(RunStage next) {
            log.debug("Run stage {} → {}", stage, next);
            stage = StageTransition.transition(stage, next);
        }
    }
}

package com.ryuqq.punchclock.adapter.runner;

import com.ryuqq.punchclock.application.schedule.ActionTrigger;
import com.ryuqq.punchclock.application.schedule.ScheduleConfig;
import com.ryuqq.punchclock.application.schedule.SchedulerEvent;
import com.ryuqq.punchclock.application.schedule.SchedulerEventListener;
import com.ryuqq.punchclock.application.schedule.SchedulerEventType;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.ActionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 매일 정해진 시각에 동작을 실행하는 스케줄러.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>동작별 일일 트리거 (출근/퇴근 각 1개)</li>
 *   <li>주기적 하트비트: 작업 상태만 로그로 남기고 동작은 실행하지 않음</li>
 * </ul>
 *
 * <p><strong>발화 처리:</strong></p>
 * <pre>
 * fire(job, scheduledAt)
 *   ├─ 지연 > misfireGracePeriod → 건너뜀 (MISFIRE 이벤트)
 *   ├─ 같은 작업 실행 중 → 건너뜀 (동시 실행 없음)
 *   └─ trigger.fire(action) → onOutcome(outcome)
 *        예외 → JOB_ERROR 이벤트
 * 다음 발화 시각 재계산 후 재예약
 * </pre>
 *
 * <p>정지 후에는 다시 시작할 수 없습니다. 새 인스턴스를 만드세요.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public final class ActionScheduler {

    private static final Logger log = LoggerFactory.getLogger(ActionScheduler.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ActionTrigger trigger;
    private final SchedulerConfig config;
    private final Clock clock;
    private final SchedulerEventListener listener;
    private final ScheduledExecutorService timer;

    private final Map<Action, ScheduledJob> jobs = new EnumMap<>(Action.class);
    private final ConcurrentMap<Action, Semaphore> runGates = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    private Duration heartbeatInterval = new ScheduleConfig().heartbeatInterval();
    private ScheduledFuture<?> heartbeat;
    private boolean running;
    private boolean stopped;

    public ActionScheduler(ActionTrigger trigger, SchedulerConfig config, SchedulerEventListener listener) {
        this(trigger, config, listener, Clock.system(config.zone()));
    }

    /**
     * 생성자.
     *
     * @param trigger 발화 시 호출할 콜백
     * @param config 설정
     * @param listener 이벤트/결과 수신자
     * @param clock 시간 소스
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ActionScheduler(ActionTrigger trigger, SchedulerConfig config, SchedulerEventListener listener, Clock clock) {
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.trigger = trigger;
        this.config = config;
        this.listener = listener;
        this.clock = clock;
        this.timer = Executors.newScheduledThreadPool(config.workerThreads(), schedulerThreads());
    }

    private static ThreadFactory schedulerThreads() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "punchclock-scheduler-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 동작 예약. 같은 동작을 다시 예약하면 기존 예약을 대체합니다.
     *
     * @param action ENTER 또는 EXIT
     * @param timeOfDay 실행 시각 (설정된 시간대 기준)
     * @param weekdaysOnly 평일만 실행
     * @throws IllegalArgumentException SIMULATE이거나 시각이 null인 경우
     * @throws IllegalStateException 이미 정지된 경우
     */
    public void schedule(Action action, LocalTime timeOfDay, boolean weekdaysOnly) {
        if (action == null || !action.isReal()) {
            throw new IllegalArgumentException("only real actions can be scheduled (current: " + action + ")");
        }
        ScheduledJob job = new ScheduledJob(action, new DailyTrigger(timeOfDay, weekdaysOnly), gateFor(action));
        synchronized (lifecycleLock) {
            ensureNotStopped();
            ScheduledJob previous = jobs.put(action, job);
            if (previous != null) {
                previous.cancel();
                log.info("Replaced schedule {} with {}", previous, job);
            } else {
                log.info("Scheduled {}", job);
            }
            if (running) {
                arm(job, now());
            }
        }
    }

    /**
     * 일정 설정에 따라 출근/퇴근 작업과 하트비트 주기를 등록.
     *
     * @param scheduleConfig 일정 설정 (비활성화면 아무 작업도 등록하지 않음)
     */
    public void scheduleAll(ScheduleConfig scheduleConfig) {
        if (scheduleConfig == null) {
            throw new IllegalArgumentException("scheduleConfig cannot be null");
        }
        if (!scheduleConfig.enabled()) {
            log.info("Schedule disabled, no jobs registered");
            return;
        }
        synchronized (lifecycleLock) {
            heartbeatInterval = scheduleConfig.heartbeatInterval();
        }
        schedule(Action.ENTER, scheduleConfig.enterTime(), scheduleConfig.weekdaysOnly());
        schedule(Action.EXIT, scheduleConfig.exitTime(), scheduleConfig.weekdaysOnly());
    }

    /**
     * 스케줄러 시작. 이미 실행 중이면 아무 일도 하지 않습니다.
     *
     * @throws IllegalStateException 이미 정지된 경우
     */
    public void start() {
        synchronized (lifecycleLock) {
            ensureNotStopped();
            if (running) {
                log.warn("Scheduler already running");
                return;
            }
            running = true;
            ZonedDateTime now = now();
            for (ScheduledJob job : jobs.values()) {
                arm(job, now);
            }
            long periodMs = heartbeatInterval.toMillis();
            heartbeat = timer.scheduleAtFixedRate(this::logHeartbeat, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }

        log.info("Scheduler started ({} job(s), zone {})", jobs.size(), config.zone());
        Map<String, String> details = new LinkedHashMap<>();
        nextRuns().forEach((action, next) -> details.put(action.displayName(), next.toString()));
        emit(new SchedulerEvent(SchedulerEventType.STARTED, "Scheduler started", clock.instant(), details));
    }

    /**
     * 스케줄러 정지. 실행 중인 작업은 최대 30초 기다립니다.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            boolean wasRunning = running;
            running = false;
            for (ScheduledJob job : jobs.values()) {
                job.cancel();
            }
            if (heartbeat != null) {
                heartbeat.cancel(false);
            }
            if (!wasRunning) {
                timer.shutdownNow();
                return;
            }
        }

        timer.shutdown();
        try {
            if (!timer.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Scheduled job did not finish within {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped");
        emit(SchedulerEvent.of(SchedulerEventType.STOPPED, "Scheduler stopped", clock.instant()));
    }

    /**
     * 동작 즉시 실행 (호출 스레드에서, 완료까지 블로킹).
     *
     * <p>같은 동작이 실행 중이면 끝날 때까지 기다린 뒤 실행합니다.</p>
     *
     * @param action ENTER, EXIT 또는 SIMULATE
     * @return 실행 결과
     * @throws IllegalStateException 대기 중 인터럽트된 경우
     */
    public ActionOutcome triggerNow(Action action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        Semaphore gate = gateFor(action);
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for running " + action.displayName(), e);
        }
        try {
            log.info("Manual trigger: {}", action.displayName());
            ActionOutcome outcome = trigger.fire(action);
            recordOutcome(action, outcome);
            return outcome;
        } catch (RuntimeException e) {
            reportJobError(action, e);
            throw e;
        } finally {
            gate.release();
        }
    }

    /**
     * 예약 발화 처리.
     *
     * @param job 작업
     * @param scheduledAt 예정 발화 시각
     * @return 동작을 실행했으면 true, 건너뛰었으면 false
     */
    boolean fire(ScheduledJob job, Instant scheduledAt) {
        Duration lateness = Duration.between(scheduledAt, clock.instant());
        if (lateness.compareTo(config.misfireGracePeriod()) > 0) {
            log.warn("Skipping {}: fired {}ms late (grace {}ms)",
                job, lateness.toMillis(), config.misfireGracePeriod().toMillis());
            emit(new SchedulerEvent(SchedulerEventType.MISFIRE,
                job.id() + " skipped: scheduled run was missed by " + lateness.toSeconds() + "s",
                clock.instant(), Map.of("Scheduled at", scheduledAt.atZone(config.zone()).toString())));
            return false;
        }

        if (!job.runGate().tryAcquire()) {
            log.warn("Skipping {}: previous run still in progress", job);
            return false;
        }
        try {
            log.info("Firing {}", job);
            ActionOutcome outcome = trigger.fire(job.action());
            recordOutcome(job.action(), outcome);
            return true;
        } catch (RuntimeException e) {
            reportJobError(job.action(), e);
            return true;
        } finally {
            job.runGate().release();
        }
    }

    private void arm(ScheduledJob job, ZonedDateTime after) {
        ZonedDateTime next = job.trigger().nextFireAfter(after);
        long delayMs = Math.max(0, Duration.between(clock.instant(), next.toInstant()).toMillis());
        ScheduledFuture<?> future = timer.schedule(() -> onTimer(job, next.toInstant()), delayMs, TimeUnit.MILLISECONDS);
        job.arm(next, future);
        log.debug("{} next run at {}", job, next);
    }

    private void onTimer(ScheduledJob job, Instant scheduledAt) {
        try {
            fire(job, scheduledAt);
        } finally {
            synchronized (lifecycleLock) {
                if (running && jobs.get(job.action()) == job) {
                    ZonedDateTime now = now();
                    ZonedDateTime base = now.toInstant().isAfter(scheduledAt) ? now : scheduledAt.atZone(config.zone());
                    arm(job, base);
                }
            }
        }
    }

    private void recordOutcome(Action action, ActionOutcome outcome) {
        synchronized (lifecycleLock) {
            ScheduledJob job = jobs.get(action);
            if (job != null) {
                job.recordOutcome(outcome, clock.instant());
            }
        }
        try {
            listener.onOutcome(outcome);
        } catch (RuntimeException e) {
            log.error("Outcome listener failed for {}", action.displayName(), e);
        }
    }

    private void reportJobError(Action action, RuntimeException error) {
        log.error("Job {} failed", action.displayName(), error);
        emit(new SchedulerEvent(SchedulerEventType.JOB_ERROR,
            action.displayName() + " job failed: " + error.getMessage(),
            clock.instant(), Map.of("Error", error.getClass().getSimpleName())));
    }

    private void emit(SchedulerEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.error("Scheduler event listener failed for {}", event.type(), e);
        }
    }

    private void logHeartbeat() {
        List<JobStatus> statuses = jobStatus();
        if (statuses.isEmpty()) {
            log.info("Scheduler heartbeat: no jobs");
            return;
        }
        for (JobStatus status : statuses) {
            log.info("Scheduler heartbeat: {} next={} running={} lastSuccess={}",
                status.jobId(), status.nextFireTime(), status.running(), status.lastSuccess());
        }
    }

    /**
     * 등록된 작업 상태 목록.
     */
    public List<JobStatus> jobStatus() {
        synchronized (lifecycleLock) {
            List<JobStatus> statuses = new ArrayList<>();
            for (ScheduledJob job : jobs.values()) {
                statuses.add(job.status());
            }
            return statuses;
        }
    }

    /**
     * 동작별 다음 실행 시각 (현재 시각 기준으로 계산).
     */
    public Map<Action, ZonedDateTime> nextRuns() {
        synchronized (lifecycleLock) {
            ZonedDateTime now = now();
            Map<Action, ZonedDateTime> next = new EnumMap<>(Action.class);
            for (ScheduledJob job : jobs.values()) {
                next.put(job.action(), job.trigger().nextFireAfter(now));
            }
            return next;
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return running;
        }
    }

    /**
     * 등록된 작업 조회 (발화 처리 테스트용).
     */
    ScheduledJob job(Action action) {
        synchronized (lifecycleLock) {
            return jobs.get(action);
        }
    }

    private Semaphore gateFor(Action action) {
        return runGates.computeIfAbsent(action, key -> new Semaphore(1));
    }

    private ZonedDateTime now() {
        return ZonedDateTime.ofInstant(clock.instant(), config.zone());
    }

    private void ensureNotStopped() {
        if (stopped) {
            throw new IllegalStateException("Scheduler has been stopped and cannot be reused");
        }
    }
}

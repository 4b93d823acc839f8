package com.ryuqq.punchclock.adapter.runner;

import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.ActionOutcome;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;

/**
 * ActionScheduler에 등록된 작업 하나.
 *
 * <p>실행 게이트(허가 1개짜리 {@link Semaphore})는 같은 동작의 예약 실행과 즉시 실행이 공유하므로
 * 같은 작업이 동시에 두 번 실행되지 않습니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
final class ScheduledJob {

    private final String id;
    private final Action action;
    private final DailyTrigger trigger;
    private final Semaphore runGate;

    private volatile ZonedDateTime nextFireTime;
    private volatile ScheduledFuture<?> pending;
    private volatile Instant lastRunAt;
    private volatile Boolean lastSuccess;

    ScheduledJob(Action action, DailyTrigger trigger, Semaphore runGate) {
        this.id = action.displayName();
        this.action = action;
        this.trigger = trigger;
        this.runGate = runGate;
    }

    String id() {
        return id;
    }

    Action action() {
        return action;
    }

    DailyTrigger trigger() {
        return trigger;
    }

    Semaphore runGate() {
        return runGate;
    }

    ZonedDateTime nextFireTime() {
        return nextFireTime;
    }

    void arm(ZonedDateTime fireTime, ScheduledFuture<?> future) {
        this.nextFireTime = fireTime;
        this.pending = future;
    }

    void cancel() {
        ScheduledFuture<?> future = pending;
        if (future != null) {
            future.cancel(false);
        }
        pending = null;
        nextFireTime = null;
    }

    void recordOutcome(ActionOutcome outcome, Instant finishedAt) {
        this.lastRunAt = finishedAt;
        this.lastSuccess = outcome.success();
    }

    JobStatus status() {
        return new JobStatus(id, action, trigger, nextFireTime, runGate.availablePermits() == 0, lastRunAt, lastSuccess);
    }

    @Override
    public String toString() {
        return id + " @ " + trigger.describe();
    }
}

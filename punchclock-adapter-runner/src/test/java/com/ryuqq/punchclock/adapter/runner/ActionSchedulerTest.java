package com.ryuqq.punchclock.adapter.runner;

import com.ryuqq.punchclock.application.schedule.ActionTrigger;
import com.ryuqq.punchclock.application.schedule.ScheduleConfig;
import com.ryuqq.punchclock.application.schedule.SchedulerEvent;
import com.ryuqq.punchclock.application.schedule.SchedulerEventListener;
import com.ryuqq.punchclock.application.schedule.SchedulerEventType;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.ActionOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ActionScheduler 테스트.
 *
 * <p>발화 처리는 {@code fire(job, scheduledAt)}를 직접 호출해 시간과 무관하게 검증합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
class ActionSchedulerTest {

    private static final ZoneId TAIPEI = ZoneId.of("Asia/Taipei");
    // 2026-03-02 (월) 08:00 Asia/Taipei
    private static final Instant MONDAY_0800 = ZonedDateTime.of(2026, 3, 2, 8, 0, 0, 0, TAIPEI).toInstant();

    private MutableClock clock;
    private RecordingListener listener;
    private final AtomicInteger fired = new AtomicInteger();
    private ActionScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MONDAY_0800, TAIPEI);
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    private ActionScheduler scheduler(ActionTrigger trigger) {
        scheduler = new ActionScheduler(trigger, new SchedulerConfig(), listener, clock);
        return scheduler;
    }

    private ActionOutcome succeed(Action action) {
        fired.incrementAndGet();
        return ActionOutcome.succeeded(action, clock.instant(), action.displayName() + " succeeded", null, null);
    }

    // ========== 발화 ==========

    @Test
    void fire_예정_시각에_발화하면_실행하고_결과_전달() {
        // given
        ActionScheduler scheduler = scheduler(this::succeed);
        scheduler.schedule(Action.ENTER, LocalTime.of(8, 0), true);

        // when
        boolean ran = scheduler.fire(scheduler.job(Action.ENTER), MONDAY_0800);

        // then
        assertThat(ran).isTrue();
        assertThat(fired.get()).isEqualTo(1);
        assertThat(listener.outcomes).singleElement().extracting(ActionOutcome::action).isEqualTo(Action.ENTER);
        assertThat(scheduler.jobStatus()).singleElement().satisfies(status -> {
            assertThat(status.lastSuccess()).isTrue();
            assertThat(status.running()).isFalse();
        });
    }

    @Test
    void fire_유예_시간_안의_지연은_허용() {
        ActionScheduler scheduler = scheduler(this::succeed);
        scheduler.schedule(Action.ENTER, LocalTime.of(8, 0), true);
        clock.advance(Duration.ofSeconds(30));

        assertThat(scheduler.fire(scheduler.job(Action.ENTER), MONDAY_0800)).isTrue();
    }

    @Test
    void fire_유예_시간을_넘긴_발화는_건너뛰고_MISFIRE_이벤트() {
        // given
        ActionScheduler scheduler = scheduler(this::succeed);
        scheduler.schedule(Action.ENTER, LocalTime.of(8, 0), true);
        clock.advance(Duration.ofSeconds(31));

        // when
        boolean ran = scheduler.fire(scheduler.job(Action.ENTER), MONDAY_0800);

        // then
        assertThat(ran).isFalse();
        assertThat(fired.get()).isZero();
        assertThat(listener.events).extracting(SchedulerEvent::type).containsExactly(SchedulerEventType.MISFIRE);
    }

    @Test
    void fire_같은_작업이_실행_중이면_두번째_발화는_건너뜀() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        ActionScheduler scheduler = scheduler(action -> {
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            started.countDown();
            awaitQuietly(release);
            concurrent.decrementAndGet();
            return succeed(action);
        });
        scheduler.schedule(Action.ENTER, LocalTime.of(8, 0), true);
        ScheduledJob job = scheduler.job(Action.ENTER);
        ExecutorService pool = Executors.newSingleThreadExecutor();

        try {
            // when
            Future<Boolean> first = pool.submit(() -> scheduler.fire(job, MONDAY_0800));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            boolean second = scheduler.fire(job, MONDAY_0800);
            release.countDown();

            // then
            assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(second).isFalse();
            assertThat(fired.get()).isEqualTo(1);
            assertThat(maxConcurrent.get()).isEqualTo(1);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void fire_실행_예외는_JOB_ERROR_이벤트로_전환() {
        ActionScheduler scheduler = scheduler(action -> {
            throw new IllegalStateException("orchestrator wiring broken");
        });
        scheduler.schedule(Action.EXIT, LocalTime.of(18, 0), true);

        boolean ran = scheduler.fire(scheduler.job(Action.EXIT), MONDAY_0800);

        assertThat(ran).isTrue();
        assertThat(listener.events).singleElement().satisfies(event -> {
            assertThat(event.type()).isEqualTo(SchedulerEventType.JOB_ERROR);
            assertThat(event.message()).contains("orchestrator wiring broken");
        });
        // 다음 발화는 다시 가능
        assertThat(scheduler.job(Action.EXIT).runGate().availablePermits()).isEqualTo(1);
    }

    // ========== 즉시 실행 ==========

    @Test
    void triggerNow_호출_스레드에서_실행하고_결과_반환() {
        ActionScheduler scheduler = scheduler(this::succeed);

        ActionOutcome outcome = scheduler.triggerNow(Action.EXIT);

        assertThat(outcome.success()).isTrue();
        assertThat(listener.outcomes).containsExactly(outcome);
    }

    @Test
    void triggerNow_실행_중_같은_동작의_예약_발화는_건너뜀() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ActionScheduler scheduler = scheduler(action -> {
            started.countDown();
            awaitQuietly(release);
            return succeed(action);
        });
        scheduler.schedule(Action.ENTER, LocalTime.of(8, 0), true);
        ExecutorService pool = Executors.newSingleThreadExecutor();

        try {
            // when
            Future<ActionOutcome> manual = pool.submit(() -> scheduler.triggerNow(Action.ENTER));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            boolean scheduled = scheduler.fire(scheduler.job(Action.ENTER), MONDAY_0800);
            release.countDown();

            // then
            assertThat(scheduled).isFalse();
            assertThat(manual.get(5, TimeUnit.SECONDS).success()).isTrue();
            assertThat(fired.get()).isEqualTo(1);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void triggerNow_예약_발화가_실행_중이면_끝날_때까지_기다린_뒤_실행() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        ActionScheduler scheduler = scheduler(action -> {
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            started.countDown();
            awaitQuietly(release);
            concurrent.decrementAndGet();
            return succeed(action);
        });
        scheduler.schedule(Action.EXIT, LocalTime.of(18, 0), true);
        ScheduledJob job = scheduler.job(Action.EXIT);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            // when
            Future<Boolean> scheduled = pool.submit(() -> scheduler.fire(job, MONDAY_0800));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            Future<ActionOutcome> manual = pool.submit(() -> scheduler.triggerNow(Action.EXIT));

            // then: 예약 실행이 끝나기 전에는 시작하지 않음
            assertThatThrownBy(() -> manual.get(200, TimeUnit.MILLISECONDS))
                .isInstanceOf(TimeoutException.class);
            assertThat(fired.get()).isZero();

            release.countDown();
            assertThat(scheduled.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(manual.get(5, TimeUnit.SECONDS).success()).isTrue();
            assertThat(fired.get()).isEqualTo(2);
            assertThat(maxConcurrent.get()).isEqualTo(1);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void triggerNow_실행_예외는_JOB_ERROR_후_전파() {
        ActionScheduler scheduler = scheduler(action -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> scheduler.triggerNow(Action.ENTER))
            .isInstanceOf(IllegalStateException.class);
        assertThat(listener.events).extracting(SchedulerEvent::type).containsExactly(SchedulerEventType.JOB_ERROR);
    }

    // ========== 등록 / 생명주기 ==========

    @Test
    void scheduleAll_출근_퇴근_작업과_다음_실행_시각() {
        ActionScheduler scheduler = scheduler(this::succeed);

        scheduler.scheduleAll(new ScheduleConfig());

        Map<Action, ZonedDateTime> next = scheduler.nextRuns();
        assertThat(next).containsEntry(Action.ENTER, ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, TAIPEI))
            .containsEntry(Action.EXIT, ZonedDateTime.of(2026, 3, 2, 18, 0, 0, 0, TAIPEI));
    }

    @Test
    void scheduleAll_비활성화면_작업_없음() {
        ActionScheduler scheduler = scheduler(this::succeed);

        scheduler.scheduleAll(new ScheduleConfig().withEnabled(false));

        assertThat(scheduler.jobStatus()).isEmpty();
    }

    @Test
    void schedule_SIMULATE는_예약할_수_없음() {
        ActionScheduler scheduler = scheduler(this::succeed);

        assertThatThrownBy(() -> scheduler.schedule(Action.SIMULATE, LocalTime.NOON, true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void start_stop_이벤트와_다음_발화_시각() {
        // given
        ActionScheduler scheduler = scheduler(this::succeed);
        scheduler.scheduleAll(new ScheduleConfig());

        // when
        scheduler.start();

        // then
        assertThat(scheduler.isRunning()).isTrue();
        assertThat(scheduler.job(Action.ENTER).nextFireTime())
            .isEqualTo(ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, TAIPEI));
        assertThat(listener.events).singleElement().satisfies(event -> {
            assertThat(event.type()).isEqualTo(SchedulerEventType.STARTED);
            assertThat(event.details()).containsKeys("clock-in", "clock-out");
        });

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(listener.events).extracting(SchedulerEvent::type)
            .containsExactly(SchedulerEventType.STARTED, SchedulerEventType.STOPPED);
        assertThat(fired.get()).isZero();
    }

    @Test
    void stop_이후에는_재시작_불가() {
        ActionScheduler scheduler = scheduler(this::succeed);
        scheduler.start();
        scheduler.stop();

        assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 리스너_예외는_스케줄러를_멈추지_않음() {
        ActionScheduler scheduler = new ActionScheduler(this::succeed, new SchedulerConfig(), new SchedulerEventListener() {
            @Override
            public void onEvent(SchedulerEvent event) {
                throw new IllegalStateException("listener down");
            }

            @Override
            public void onOutcome(ActionOutcome outcome) {
                throw new IllegalStateException("listener down");
            }
        }, clock);
        this.scheduler = scheduler;
        scheduler.schedule(Action.ENTER, LocalTime.of(8, 0), true);

        assertThat(scheduler.fire(scheduler.job(Action.ENTER), MONDAY_0800)).isTrue();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class RecordingListener implements SchedulerEventListener {

        private final List<SchedulerEvent> events = new CopyOnWriteArrayList<>();
        private final List<ActionOutcome> outcomes = new CopyOnWriteArrayList<>();

        @Override
        public void onEvent(SchedulerEvent event) {
            events.add(event);
        }

        @Override
        public void onOutcome(ActionOutcome outcome) {
            outcomes.add(outcome);
        }
    }
}

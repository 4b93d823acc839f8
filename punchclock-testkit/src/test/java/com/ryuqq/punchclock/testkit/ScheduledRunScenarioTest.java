package com.ryuqq.punchclock.testkit;

import com.ryuqq.punchclock.adapter.runner.ActionScheduler;
import com.ryuqq.punchclock.adapter.runner.OrchestratedActionTrigger;
import com.ryuqq.punchclock.adapter.runner.SchedulerConfig;
import com.ryuqq.punchclock.application.notification.NotificationLevel;
import com.ryuqq.punchclock.application.notification.NotificationMessage;
import com.ryuqq.punchclock.application.page.PageProfile;
import com.ryuqq.punchclock.application.schedule.ScheduleConfig;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.ActionOutcome;
import com.ryuqq.punchclock.core.model.LoginCredentials;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 스케줄러에서 시작된 실행이 오케스트레이터와 알림까지 이어지는지 검증.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
class ScheduledRunScenarioTest {

    private static final LoginCredentials CREDENTIALS = new LoginCredentials("ACME", "u001", "s3cret");

    private final PageProfile profile = PageProfile.aoaCloud();
    private final RecordingNotificationProvider discord = new RecordingNotificationProvider("Discord");

    private PunchClockHarness harness;
    private ActionScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
        if (harness != null) {
            harness.close();
        }
    }

    @Test
    void 즉시_실행은_사전_승인된_실제_퇴근을_수행하고_알린다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, false, true);
        driver.onClick(profile.exitButton(), d -> d.showAfterChecks("xpath://*[contains(text(),'簽退成功')]", "簽退成功", 1));
        harness = PunchClockHarness.builder(driver).providers(discord).build();
        scheduler = new ActionScheduler(
            new OrchestratedActionTrigger(harness.orchestrator(), CREDENTIALS),
            new SchedulerConfig(),
            harness.dispatcher(),
            Clock.fixed(PunchClockHarness.DEFAULT_NOW, PunchClockHarness.DEFAULT_ZONE));

        // when
        ActionOutcome outcome = scheduler.triggerNow(Action.EXIT);

        // then
        assertThat(outcome.isRealStateChange()).isTrue();
        assertThat(harness.questionsAsked()).isEmpty();
        assertThat(discord.lastReceived().title()).isEqualTo("clock-out succeeded");
        assertThat(discord.lastReceived().details()).containsEntry("Server response", "簽退成功");
    }

    @Test
    void 시작과_종료는_INFO_알림으로_전달된다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, true, false);
        harness = PunchClockHarness.builder(driver).providers(discord).build();
        scheduler = new ActionScheduler(
            new OrchestratedActionTrigger(harness.orchestrator(), CREDENTIALS),
            new SchedulerConfig(),
            harness.dispatcher());
        scheduler.scheduleAll(new ScheduleConfig());

        // when
        scheduler.start();
        scheduler.stop();

        // then
        assertThat(discord.received())
            .extracting(NotificationMessage::title)
            .containsExactly("Scheduler started", "Scheduler stopped");
        assertThat(discord.received())
            .allMatch(message -> message.level() == NotificationLevel.INFO);
        assertThat(driver.navigations()).isEmpty();
    }
}

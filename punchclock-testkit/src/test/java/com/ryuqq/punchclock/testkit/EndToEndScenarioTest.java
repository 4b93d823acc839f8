package com.ryuqq.punchclock.testkit;

import com.ryuqq.punchclock.application.notification.NotificationLevel;
import com.ryuqq.punchclock.application.notification.NotificationMessage;
import com.ryuqq.punchclock.application.notification.ProviderResult;
import com.ryuqq.punchclock.application.orchestrator.ActionRequest;
import com.ryuqq.punchclock.application.page.PageProfile;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.ActionOutcome;
import com.ryuqq.punchclock.core.model.LoginCredentials;
import com.ryuqq.punchclock.core.statemachine.RunStep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 실제 실행 경로 전체(화면 단계, 확인, 검증, 알림)를 스크립트 화면 위에서 검증.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
class EndToEndScenarioTest {

    private static final LoginCredentials CREDENTIALS = new LoginCredentials("ACME", "u001", "s3cret");
    private static final String ENTER_SUCCESS = "xpath://*[contains(text(),'簽到成功')]";

    private final PageProfile profile = PageProfile.aoaCloud();
    private final RecordingNotificationProvider discord = new RecordingNotificationProvider("Discord");
    private final RecordingNotificationProvider slack = new RecordingNotificationProvider("Slack");

    private PunchClockHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    // ========== Scenario A ==========

    @Test
    @DisplayName("A: 출근 가능 + 승인 + 첫 관찰에서 성공 신호 → 실제 성공")
    void 출근_성공_신호를_첫_관찰에서_확인한다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, true, false);
        driver.onClick(profile.enterButton(), d -> d.showAfterChecks(ENTER_SUCCESS, "簽到成功", 1));
        harness = PunchClockHarness.builder(driver)
            .confirmationAnswers("yes")
            .providers(discord)
            .build();

        // when
        ActionOutcome outcome = harness.run(ActionRequest.interactive(Action.ENTER, CREDENTIALS));

        // then
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.simulation()).isFalse();
        assertThat(outcome.externalSignal()).isEqualTo("簽到成功");
        assertThat(outcome.evidence()).isNotNull();
        assertThat(driver.clicks()).containsSubsequence(profile.loginButton(), profile.punchIcon(), profile.enterButton());
        assertThat(driver.typed()).containsEntry(profile.userIdField(), "u001");
        assertThat(driver.isClosed()).isTrue();
        assertThat(harness.sleeps()).isEmpty();

        NotificationMessage message = discord.lastReceived();
        assertThat(message.level()).isEqualTo(NotificationLevel.SUCCESS);
        assertThat(message.title()).isEqualTo("clock-in succeeded");
        assertThat(message.attachments()).containsExactly(outcome.evidence());
    }

    @Test
    void 성공_신호가_세번째_관찰에_나타나면_그_시점에_끝난다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, true, false);
        driver.onClick(profile.enterButton(), d -> d.showAfterChecks(ENTER_SUCCESS, "簽到成功", 3));
        harness = PunchClockHarness.builder(driver).build();

        // when
        ActionOutcome outcome = harness.run(ActionRequest.scheduled(Action.ENTER, CREDENTIALS));

        // then
        assertThat(outcome.success()).isTrue();
        assertThat(harness.sleeps()).containsExactly(Duration.ofMillis(500), Duration.ofMillis(500));
    }

    // ========== Scenario B ==========

    @Test
    @DisplayName("B: 출근 불가 상태에서 출근 요청 → 클릭 없이 action unavailable")
    void 불가능한_동작은_클릭하지_않고_실패한다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, false, true);
        harness = PunchClockHarness.builder(driver).providers(discord).build();

        // when
        ActionOutcome outcome = harness.run(ActionRequest.scheduled(Action.ENTER, CREDENTIALS));

        // then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.message()).isEqualTo("action unavailable");
        assertThat(driver.wasClicked(profile.enterButton())).isFalse();
        assertThat(driver.wasClicked(profile.exitButton())).isFalse();
        assertThat(discord.lastReceived().level()).isEqualTo(NotificationLevel.ERROR);
    }

    // ========== Scenario C ==========

    @Test
    @DisplayName("C: 대화형 확인 거절 → 성공한 모의 실행")
    void 확인을_거절하면_모의_실행으로_끝난다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, true, false);
        harness = PunchClockHarness.builder(driver)
            .confirmationAnswers("no")
            .providers(discord)
            .build();

        // when
        ActionOutcome outcome = harness.run(ActionRequest.interactive(Action.ENTER, CREDENTIALS));

        // then
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.simulation()).isTrue();
        assertThat(outcome.isRealStateChange()).isFalse();
        assertThat(driver.wasClicked(profile.enterButton())).isFalse();
        assertThat(harness.questionsAsked()).hasSize(1);
        assertThat(discord.lastReceived().title()).isEqualTo("clock-in simulated");
    }

    @Test
    void quit_응답은_실행을_취소하고_모의_결과를_남긴다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, false, true);
        harness = PunchClockHarness.builder(driver).confirmationAnswers("quit").build();

        // when
        ActionOutcome outcome = harness.run(ActionRequest.interactive(Action.EXIT, CREDENTIALS));

        // then
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.simulation()).isTrue();
        assertThat(outcome.message()).isEqualTo("clock-out cancelled by operator");
        assertThat(driver.wasClicked(profile.exitButton())).isFalse();
    }

    @Test
    void 비대화형_미승인_요청은_묻지_않고_모의_실행한다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, true, false);
        harness = PunchClockHarness.builder(driver).confirmationAnswers("yes").build();

        // when
        ActionOutcome outcome = harness.run(new ActionRequest(Action.ENTER, CREDENTIALS, false, false));

        // then
        assertThat(outcome.simulation()).isTrue();
        assertThat(harness.questionsAsked()).isEmpty();
        assertThat(driver.wasClicked(profile.enterButton())).isFalse();
    }

    // ========== Scenario D ==========

    @Test
    @DisplayName("D: 신호 없음 + 상태 변화 없음 → verification timed out, 모든 채널에 ERROR 알림")
    void 판정_불가는_실패로_보고되고_모든_채널에_알린다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, true, false);
        harness = PunchClockHarness.builder(driver).providers(discord, slack).build();

        // when
        ActionOutcome outcome = harness.run(ActionRequest.scheduled(Action.ENTER, CREDENTIALS));

        // then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.message()).isEqualTo("result verification timed out");
        assertThat(outcome.failedStep()).isEqualTo(RunStep.VERIFY);
        assertThat(driver.wasClicked(profile.enterButton())).isTrue();
        assertThat(harness.sleeps()).hasSize(19);

        List<ProviderResult> results = harness.lastDispatch();
        assertThat(results).extracting(ProviderResult::providerName).containsExactlyInAnyOrder("Discord", "Slack");
        assertThat(results).allMatch(ProviderResult::success);
        assertThat(discord.lastReceived().level()).isEqualTo(NotificationLevel.ERROR);
        assertThat(slack.lastReceived().level()).isEqualTo(NotificationLevel.ERROR);
        assertThat(slack.lastReceived().body()).isEqualTo("result verification timed out");
    }

    @Test
    void 상태가_기대대로_바뀌면_신호가_없어도_성공이다() {
        // given
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, true, false);
        driver.onClick(profile.enterButton(), d -> d.disable(profile.enterButton()).enable(profile.exitButton()));
        harness = PunchClockHarness.builder(driver).build();

        // when
        ActionOutcome outcome = harness.run(ActionRequest.scheduled(Action.ENTER, CREDENTIALS));

        // then
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.message()).isEqualTo("clock-in succeeded (availability changed)");
    }

    @Test
    void 오류_등급만_받는_채널은_성공_알림을_받지_않는다() {
        // given
        RecordingNotificationProvider errorsOnly =
            new RecordingNotificationProvider("Pager", EnumSet.of(NotificationLevel.ERROR));
        ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, true, false);
        driver.onClick(profile.enterButton(), d -> d.showAfterChecks(ENTER_SUCCESS, "簽到成功", 1));
        harness = PunchClockHarness.builder(driver).providers(discord, errorsOnly).build();

        // when
        harness.run(ActionRequest.scheduled(Action.ENTER, CREDENTIALS));

        // then
        assertThat(discord.received()).hasSize(1);
        assertThat(errorsOnly.received()).isEmpty();
        assertThat(harness.lastDispatch()).extracting(ProviderResult::providerName).containsExactly("Discord");
    }

    // ========== 인증 / 보호 ==========

    @Test
    void 로그인_거부는_재시도하지_않는다() {
        // given
        ScriptedSessionDriver driver = new ScriptedSessionDriver()
            .show(profile.companyIdField(), "")
            .show(profile.userIdField(), "")
            .show(profile.passwordField(), "")
            .show(profile.loginButton(), "登入");
        driver.onClick(profile.loginButton(), d -> d.show(".error-message", "帳號或密碼錯誤"));
        harness = PunchClockHarness.builder(driver).providers(discord).build();

        // when
        ActionOutcome outcome = harness.run(ActionRequest.scheduled(Action.ENTER, CREDENTIALS));

        // then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failedStep()).isEqualTo(RunStep.AUTHENTICATE);
        assertThat(outcome.message()).contains("帳號或密碼錯誤");
        assertThat(driver.navigations()).hasSize(1);
        assertThat(harness.circuitBreaker().getConsecutiveFailures()).isZero();
        assertThat(discord.lastReceived().details()).containsEntry("Failed step", "authenticate");
    }

    @Test
    void 로그인_화면이_계속_안_뜨면_재시도_후_실패하고_차단기에_기록된다() {
        // given
        ScriptedSessionDriver driver = new ScriptedSessionDriver();
        harness = PunchClockHarness.builder(driver).build();

        // when
        ActionOutcome outcome = harness.run(ActionRequest.scheduled(Action.ENTER, CREDENTIALS));

        // then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failedStep()).isEqualTo(RunStep.AUTHENTICATE);
        assertThat(driver.navigations()).hasSize(3);
        assertThat(harness.sleeps()).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
        assertThat(harness.circuitBreaker().getConsecutiveFailures()).isEqualTo(1);
    }
}

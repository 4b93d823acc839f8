package com.ryuqq.punchclock.application.verification;

import com.ryuqq.punchclock.core.model.Action;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SignalMatcher 테스트 (드라이버 없이 판정 정책만 검증).
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
class SignalMatcherTest {

    private static final SignalRule SUCCESS_TOAST = SignalRule.success("ion-toast[color=\"success\"]");
    private static final SignalRule ENTER_SUCCESS = SignalRule.success("#enter-ok", Action.ENTER);
    private static final SignalRule DANGER_TOAST = SignalRule.failure("ion-toast[color=\"danger\"]");
    private static final SignalRule TOAST = SignalRule.notice("ion-toast");

    private final SignalMatcher matcher = new SignalMatcher(
        List.of(TOAST, DANGER_TOAST, SUCCESS_TOAST, ENTER_SUCCESS), SignalVocabulary.defaults());

    @Test
    void 규칙은_분류_우선순위로_정렬됨() {
        assertThat(matcher.getRules()).extracting(SignalRule::category).containsExactly(
            SignalCategory.EXPLICIT_SUCCESS, SignalCategory.EXPLICIT_SUCCESS,
            SignalCategory.EXPLICIT_FAILURE, SignalCategory.GENERIC_NOTICE);
    }

    @Test
    void 신호가_없으면_판정하지_않음() {
        assertThat(matcher.match(Action.ENTER, List.of())).isEmpty();
    }

    @Test
    void 같은_관찰에_성공과_실패가_있으면_성공이_우선() {
        // given: 관찰 순서상 실패가 먼저
        List<ObservedSignal> observed = List.of(
            new ObservedSignal(DANGER_TOAST, "簽到失敗"),
            new ObservedSignal(SUCCESS_TOAST, "簽到成功"));

        // when
        Optional<VerificationResult> result = matcher.match(Action.ENTER, observed);

        // then
        assertThat(result).isPresent();
        assertThat(result.get().success()).isTrue();
        assertThat(result.get().externalSignal()).isEqualTo("簽到成功");
    }

    @Test
    void 명시적_실패는_일반_알림보다_우선() {
        List<ObservedSignal> observed = List.of(
            new ObservedSignal(TOAST, "打卡成功"),
            new ObservedSignal(DANGER_TOAST, "系統錯誤"));

        VerificationResult result = matcher.match(Action.EXIT, observed).orElseThrow();

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("clock-out failed");
    }

    @Test
    void 다른_동작_전용_규칙은_무시() {
        List<ObservedSignal> observed = List.of(new ObservedSignal(ENTER_SUCCESS, "ok"));

        assertThat(matcher.match(Action.EXIT, observed)).isEmpty();
        assertThat(matcher.rulesFor(Action.EXIT)).doesNotContain(ENTER_SUCCESS);
    }

    @Test
    void 일반_알림은_동작과_관련되고_성공_단어가_있으면_성공() {
        VerificationResult result = matcher.match(Action.ENTER,
            List.of(new ObservedSignal(TOAST, "簽到成功 09:00"))).orElseThrow();

        assertThat(result.success()).isTrue();
    }

    @Test
    void 일반_알림은_도메인_단어와_실패_단어로도_실패_판정() {
        VerificationResult result = matcher.match(Action.ENTER,
            List.of(new ObservedSignal(TOAST, "打卡失敗，請稍後再試"))).orElseThrow();

        assertThat(result.success()).isFalse();
    }

    @Test
    void 일반_알림이_동작과_무관하면_판정하지_않음() {
        assertThat(matcher.match(Action.ENTER, List.of(new ObservedSignal(TOAST, "儲存成功")))).isEmpty();
    }

    @Test
    void 일반_알림에_성공_실패_단어가_없으면_판정하지_않음() {
        assertThat(matcher.match(Action.ENTER, List.of(new ObservedSignal(TOAST, "簽到處理中")))).isEmpty();
    }

    @Test
    void 부정형_성공_단어는_성공으로_보지_않음() {
        VerificationResult result = matcher.match(Action.ENTER,
            List.of(new ObservedSignal(TOAST, "Clock-in unsuccessful: outside allowed area"))).orElseThrow();

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("clock-in failed");
    }

    @Test
    void 영문_성공_단어는_단어_시작에서만_일치() {
        VerificationResult successful = matcher.match(Action.ENTER,
            List.of(new ObservedSignal(TOAST, "Clock-in successful"))).orElseThrow();

        assertThat(successful.success()).isTrue();
        assertThat(matcher.match(Action.ENTER,
            List.of(new ObservedSignal(TOAST, "Clock-in nonsuccess pending")))).isEmpty();
    }

    @Test
    void 대문자_영문_알림은_기본_로케일과_무관하게_판정() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            VerificationResult result = matcher.match(Action.ENTER,
                List.of(new ObservedSignal(TOAST, "SIGN IN SUCCESSFUL"))).orElseThrow();

            assertThat(result.success()).isTrue();
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void 일반_알림에_성공과_실패_단어가_함께_있으면_실패() {
        VerificationResult result = matcher.match(Action.EXIT,
            List.of(new ObservedSignal(TOAST, "簽退成功 but sync failed"))).orElseThrow();

        assertThat(result.success()).isFalse();
    }

    @Test
    void 기본_규칙에는_세_분류가_모두_있음() {
        assertThat(SignalMatcher.defaultRules()).extracting(SignalRule::category)
            .contains(SignalCategory.EXPLICIT_SUCCESS, SignalCategory.EXPLICIT_FAILURE, SignalCategory.GENERIC_NOTICE);
    }
}

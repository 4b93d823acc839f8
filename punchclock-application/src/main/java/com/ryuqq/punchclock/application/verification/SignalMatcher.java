package com.ryuqq.punchclock.application.verification;

import com.ryuqq.punchclock.core.model.Action;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 관찰된 신호를 판정으로 변환하는 순수 규칙 평가기.
 *
 * <p>드라이버에 의존하지 않으므로 매칭 정책을 단독으로 테스트할 수 있습니다.</p>
 *
 * <p><strong>판정 순서:</strong> 같은 관찰 안에서 분류 우선순위
 * (EXPLICIT_SUCCESS &gt; EXPLICIT_FAILURE &gt; GENERIC_NOTICE) 순, 같은 분류 안에서는 규칙 순서대로
 * 검사하며 처음 판정된 신호가 결과를 결정합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class SignalMatcher {

    private final List<SignalRule> rules;
    private final SignalVocabulary vocabulary;

    /**
     * 생성자.
     *
     * @param rules 규칙 목록 (우선순위 순으로 정렬되어 보관)
     * @param vocabulary 일반 알림 판정 어휘
     */
    public SignalMatcher(List<SignalRule> rules, SignalVocabulary vocabulary) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("rules cannot be null or empty");
        }
        if (vocabulary == null) {
            throw new IllegalArgumentException("vocabulary cannot be null");
        }
        List<SignalRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparing(SignalRule::category));
        this.rules = List.copyOf(sorted);
        this.vocabulary = vocabulary;
    }

    /**
     * 기본 규칙.
     *
     * <ul>
     *   <li>성공: 打卡成功 / 簽到成功 / 簽退成功 문구, .success-message, 성공 토스트, .alert-success</li>
     *   <li>실패: 打卡失敗 / 簽到失敗 / 簽退失敗 문구, .error-message, 위험 토스트, .alert-danger</li>
     *   <li>일반: ion-toast</li>
     * </ul>
     */
    public static List<SignalRule> defaultRules() {
        return List.of(
            SignalRule.success("xpath://*[contains(text(),'打卡成功')]"),
            SignalRule.success("xpath://*[contains(text(),'簽到成功')]", Action.ENTER),
            SignalRule.success("xpath://*[contains(text(),'簽退成功')]", Action.EXIT),
            SignalRule.success(".success-message"),
            SignalRule.success("ion-toast[color=\"success\"]"),
            SignalRule.success(".alert-success"),
            SignalRule.failure("xpath://*[contains(text(),'打卡失敗')]"),
            SignalRule.failure("xpath://*[contains(text(),'簽到失敗')]", Action.ENTER),
            SignalRule.failure("xpath://*[contains(text(),'簽退失敗')]", Action.EXIT),
            SignalRule.failure(".error-message"),
            SignalRule.failure("ion-toast[color=\"danger\"]"),
            SignalRule.failure(".alert-danger"),
            SignalRule.notice("ion-toast")
        );
    }

    /**
     * 특정 동작에 적용되는 규칙 (관찰 대상).
     */
    public List<SignalRule> rulesFor(Action action) {
        List<SignalRule> applicable = new ArrayList<>();
        for (SignalRule rule : rules) {
            if (rule.appliesTo(action)) {
                applicable.add(rule);
            }
        }
        return applicable;
    }

    /**
     * 한 번의 관찰 결과 판정.
     *
     * @param action 검증 대상 동작
     * @param observed 관찰된 신호
     * @return 판정 (신호가 없거나 판정 불가하면 empty)
     */
    public Optional<VerificationResult> match(Action action, List<ObservedSignal> observed) {
        List<ObservedSignal> ordered = new ArrayList<>();
        for (ObservedSignal signal : observed) {
            if (signal.rule().appliesTo(action)) {
                ordered.add(signal);
            }
        }
        ordered.sort(Comparator.comparing(signal -> signal.rule().category()));

        for (ObservedSignal signal : ordered) {
            Optional<VerificationResult> result = evaluate(action, signal);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    private Optional<VerificationResult> evaluate(Action action, ObservedSignal signal) {
        String text = signal.text();
        String name = action.displayName();
        return switch (signal.rule().category()) {
            case EXPLICIT_SUCCESS -> Optional.of(new VerificationResult(true, name + " succeeded", text));
            case EXPLICIT_FAILURE -> Optional.of(new VerificationResult(false, name + " failed", text));
            case GENERIC_NOTICE -> {
                if (text.isBlank() || !vocabulary.isAssociated(text, action)) {
                    yield Optional.empty();
                }
                if (vocabulary.indicatesFailure(text)) {
                    yield Optional.of(new VerificationResult(false, name + " failed", text));
                }
                if (vocabulary.indicatesSuccess(text)) {
                    yield Optional.of(new VerificationResult(true, name + " succeeded", text));
                }
                yield Optional.empty();
            }
        };
    }

    public List<SignalRule> getRules() {
        return rules;
    }
}

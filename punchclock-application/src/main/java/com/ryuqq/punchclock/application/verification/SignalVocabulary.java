package com.ryuqq.punchclock.application.verification;

import com.ryuqq.punchclock.core.model.Action;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 일반 알림 문구 판정용 어휘.
 *
 * <p>문구가 동작 단어 또는 도메인 단어를 포함해야 동작과 관련된 것으로 보고,
 * 그 다음 실패 단어, 성공 단어 순서로 검사합니다.</p>
 *
 * <p>영문/숫자로 시작하는 단어는 단어 시작 위치에서만 일치합니다
 * ("unsuccessful" 은 "success" 로 보지 않음). 한자 단어는 부분 문자열로 일치합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param actionTerms 동작별 단어 (예: ENTER → 簽到)
 * @param domainTerms 동작 공통 단어 (예: 打卡)
 * @param successTerms 성공 단어
 * @param failureTerms 실패 단어
 */
public record SignalVocabulary(
    Map<Action, List<String>> actionTerms,
    List<String> domainTerms,
    List<String> successTerms,
    List<String> failureTerms
) {

    public SignalVocabulary {
        if (actionTerms == null) {
            throw new IllegalArgumentException("actionTerms cannot be null");
        }
        actionTerms = Map.copyOf(actionTerms);
        domainTerms = domainTerms == null ? List.of() : List.copyOf(domainTerms);
        if (successTerms == null || successTerms.isEmpty()) {
            throw new IllegalArgumentException("successTerms cannot be null or empty");
        }
        if (failureTerms == null || failureTerms.isEmpty()) {
            throw new IllegalArgumentException("failureTerms cannot be null or empty");
        }
        successTerms = List.copyOf(successTerms);
        failureTerms = List.copyOf(failureTerms);
    }

    /**
     * 기본 어휘 (중국어 화면 문구 + 영어).
     */
    public static SignalVocabulary defaults() {
        Map<Action, List<String>> terms = new EnumMap<>(Action.class);
        terms.put(Action.ENTER, List.of("簽到", "clock-in", "clock in", "sign in"));
        terms.put(Action.EXIT, List.of("簽退", "clock-out", "clock out", "sign out"));
        return new SignalVocabulary(
            terms,
            List.of("打卡", "punch"),
            List.of("成功", "success"),
            List.of("失敗", "錯誤", "fail", "unsuccessful", "error")
        );
    }

    /**
     * 문구가 해당 동작과 관련되어 있는지 확인.
     */
    public boolean isAssociated(String text, Action action) {
        String normalized = text.toLowerCase(Locale.ROOT);
        return containsAny(normalized, actionTerms.getOrDefault(action, List.of()))
            || containsAny(normalized, domainTerms);
    }

    public boolean indicatesSuccess(String text) {
        return containsAny(text.toLowerCase(Locale.ROOT), successTerms);
    }

    public boolean indicatesFailure(String text) {
        return containsAny(text.toLowerCase(Locale.ROOT), failureTerms);
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (containsTerm(text, term.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsTerm(String text, String term) {
        if (term.isEmpty()) {
            return false;
        }
        if (!isAsciiWordChar(term.charAt(0))) {
            return text.contains(term);
        }
        int from = 0;
        int index;
        while ((index = text.indexOf(term, from)) >= 0) {
            if (index == 0 || !isAsciiWordChar(text.charAt(index - 1))) {
                return true;
            }
            from = index + 1;
        }
        return false;
    }

    private static boolean isAsciiWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }
}

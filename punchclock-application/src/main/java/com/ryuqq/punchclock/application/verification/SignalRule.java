package com.ryuqq.punchclock.application.verification;

import com.ryuqq.punchclock.core.model.Action;

import java.util.EnumSet;
import java.util.Set;

/**
 * 결과 신호 규칙 (셀렉터 → 분류).
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param category 분류
 * @param selector 신호 요소 셀렉터
 * @param appliesTo 적용 대상 동작 (비어 있으면 모든 동작)
 */
public record SignalRule(SignalCategory category, String selector, Set<Action> appliesTo) {

    public SignalRule {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("selector cannot be null or blank");
        }
        appliesTo = appliesTo == null || appliesTo.isEmpty() ? Set.of() : Set.copyOf(appliesTo);
    }

    public static SignalRule success(String selector, Action... actions) {
        return new SignalRule(SignalCategory.EXPLICIT_SUCCESS, selector, toSet(actions));
    }

    public static SignalRule failure(String selector, Action... actions) {
        return new SignalRule(SignalCategory.EXPLICIT_FAILURE, selector, toSet(actions));
    }

    public static SignalRule notice(String selector) {
        return new SignalRule(SignalCategory.GENERIC_NOTICE, selector, Set.of());
    }

    private static Set<Action> toSet(Action... actions) {
        if (actions.length == 0) {
            return Set.of();
        }
        EnumSet<Action> set = EnumSet.noneOf(Action.class);
        for (Action action : actions) {
            set.add(action);
        }
        return set;
    }

    /**
     * 이 규칙이 주어진 동작에 적용되는지 확인.
     */
    public boolean appliesTo(Action action) {
        return appliesTo.isEmpty() || appliesTo.contains(action);
    }
}

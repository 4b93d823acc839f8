package com.ryuqq.punchclock.application.verification;

/**
 * 한 번의 관찰에서 화면에 표시되고 있던 신호.
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param rule 일치한 규칙
 * @param text 요소 텍스트 (없으면 빈 문자열)
 */
public record ObservedSignal(SignalRule rule, String text) {

    public ObservedSignal {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        text = text == null ? "" : text;
    }
}

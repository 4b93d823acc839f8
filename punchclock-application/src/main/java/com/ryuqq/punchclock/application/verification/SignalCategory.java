package com.ryuqq.punchclock.application.verification;

/**
 * 결과 신호 분류. 선언 순서가 우선순위입니다.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public enum SignalCategory {

    /** 명시적 성공 표시. 보이면 성공. */
    EXPLICIT_SUCCESS,

    /** 명시적 실패 표시. 보이면 실패. */
    EXPLICIT_FAILURE,

    /** 일반 알림. 문구가 동작과 관련되고 성공/실패 단어를 포함할 때만 판정. */
    GENERIC_NOTICE
}

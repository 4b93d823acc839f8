package com.ryuqq.punchclock.core.statemachine;

/**
 * 한 번의 오케스트레이션 실행(run)의 진행 단계.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * START
 *   │ authenticate
 *   ▼
 * AUTHENTICATED
 *   │ navigate
 *   ▼
 * NAVIGATED
 *   │ checkState
 *   ▼
 * STATE_CHECKED ──(확인 단계에서 운영자 quit)──► CANCELLED
 *   │ attemptAction
 *   ▼
 * ACTION_ATTEMPTED
 *   │ verify
 *   ▼
 * VERIFIED
 *   │
 *   ▼
 * DONE
 *
 * 종료 상태가 아닌 모든 단계 ──(단계 실패)──► FAILED
 * </pre>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public enum RunStage {

    /** 실행 시작 (아직 아무 단계도 수행 안 됨). */
    START,

    /** 로그인 완료. */
    AUTHENTICATED,

    /** 대상 화면 진입 완료. */
    NAVIGATED,

    /** 상태 스냅샷 확보. */
    STATE_CHECKED,

    /** 액션 시도 (실제 클릭 또는 시뮬레이션) 완료. */
    ACTION_ATTEMPTED,

    /** 결과 검증 완료. */
    VERIFIED,

    /** 정상 종료. */
    DONE,

    /** 단계 실패로 종료. */
    FAILED,

    /** 운영자 중단으로 종료. */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}

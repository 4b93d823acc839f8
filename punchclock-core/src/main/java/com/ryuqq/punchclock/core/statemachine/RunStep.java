package com.ryuqq.punchclock.core.statemachine;

/**
 * 실행 중 실패할 수 있는 단계의 식별자.
 *
 * <p>실패한 {@link com.ryuqq.punchclock.core.model.ActionOutcome}은 어느 단계에서 실패했는지를 이 값으로 기록합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public enum RunStep {

    PRECHECK("precheck"),
    AUTHENTICATE("authenticate"),
    NAVIGATE("navigate"),
    CHECK_STATE("check-state"),
    ATTEMPT_ACTION("attempt-action"),
    VERIFY("verify");

    private final String description;

    RunStep(String description) {
        this.description = description;
    }

    /**
     * 로그 및 메시지용 단계 이름.
     */
    public String description() {
        return description;
    }
}

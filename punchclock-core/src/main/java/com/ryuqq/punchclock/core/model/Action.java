package com.ryuqq.punchclock.core.model;

/**
 * 원격 세션에 대해 수행할 수 있는 출퇴근 동작.
 *
 * <p>{@link #ENTER}와 {@link #EXIT}는 상호 배타적인 실제 동작이며,
 * {@link #SIMULATE}는 실제 상태 변경 없이 가능한 동작을 모의 실행하라는 표식입니다.</p>
 *
 * <p>불변 enum이므로 Map 키, 스케줄 작업 식별자 등으로 안전하게 사용됩니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public enum Action {

    /**
     * 출근 (clock-in).
     */
    ENTER("clock-in"),

    /**
     * 퇴근 (clock-out).
     */
    EXIT("clock-out"),

    /**
     * 모의 실행 표식 (원격 상태를 변경하지 않음).
     */
    SIMULATE("simulation");

    private final String displayName;

    Action(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 로그 및 알림에 사용하는 표시 이름.
     *
     * @return 표시 이름 (예: clock-in)
     */
    public String displayName() {
        return displayName;
    }

    /**
     * 원격 상태를 실제로 변경하는 동작인지 확인.
     *
     * @return ENTER 또는 EXIT인 경우 true
     */
    public boolean isReal() {
        return this != SIMULATE;
    }
}

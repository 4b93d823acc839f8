package com.ryuqq.punchclock.core.statemachine;

/**
 * 실행 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>선형 전진: START → AUTHENTICATED → NAVIGATED → STATE_CHECKED → ACTION_ATTEMPTED → VERIFIED → DONE</li>
 *   <li>종료 상태가 아닌 모든 단계 → FAILED</li>
 *   <li>STATE_CHECKED → CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(DONE, FAILED, CANCELLED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>단계 건너뛰기 및 역방향 전이 불가</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public final class StageTransition {

    // Utility class - prevent instantiation
    private StageTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunStage from, RunStage to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Stages cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal stage: %s → %s", from, to)
            );
        }

        if (to == RunStage.FAILED) {
            return;
        }

        boolean valid = switch (from) {
            case START -> to == RunStage.AUTHENTICATED;
            case AUTHENTICATED -> to == RunStage.NAVIGATED;
            case NAVIGATED -> to == RunStage.STATE_CHECKED;
            case STATE_CHECKED -> to == RunStage.ACTION_ATTEMPTED || to == RunStage.CANCELLED;
            case ACTION_ATTEMPTED -> to == RunStage.VERIFIED;
            case VERIFIED -> to == RunStage.DONE;
            case DONE, FAILED, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid stage transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RunStage transition(RunStage current, RunStage next) {
        validate(current, next);
        return next;
    }
}

package com.ryuqq.punchclock.core.model;

import com.ryuqq.punchclock.core.statemachine.RunStep;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Orchestrator 1회 실행의 최종 결과.
 *
 * <p>실행마다 정확히 하나가 생성되며 생성 후 변경되지 않습니다.
 * 결과는 이를 받은 호출자(Scheduler 또는 대화형 호출자)가 소유합니다.</p>
 *
 * <p><strong>불변식:</strong> {@code simulation=true}인 결과는 원격 시스템의 실제 상태 변경으로
 * 보고되어서는 안 됩니다.</p>
 *
 * @param success 모든 단계 성공 여부
 * @param action 실행된 동작 (SIMULATE 요청 시 실제로 모의 실행된 동작)
 * @param timestamp 실행 시작 시각
 * @param message 사람이 읽을 수 있는 결과 메시지 (실패 시 최초 실패 단계 설명)
 * @param externalSignal 원격 화면에서 읽은 결과 신호 텍스트 (null 가능)
 * @param simulation 모의 실행 여부
 * @param failedStep 실패한 단계 (성공 시 null)
 * @param evidence 결과 스크린샷 경로 (null 가능)
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public record ActionOutcome(
    boolean success,
    Action action,
    Instant timestamp,
    String message,
    String externalSignal,
    boolean simulation,
    RunStep failedStep,
    Path evidence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 성공 결과에 실패 단계가 지정된 경우
     */
    public ActionOutcome {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (success && failedStep != null) {
            throw new IllegalArgumentException("successful outcome cannot carry a failed step (current: " + failedStep + ")");
        }
    }

    /**
     * 실제 동작 성공 결과 생성.
     */
    public static ActionOutcome succeeded(Action action, Instant timestamp, String message, String externalSignal, Path evidence) {
        return new ActionOutcome(true, action, timestamp, message, externalSignal, false, null, evidence);
    }

    /**
     * 모의 실행 결과 생성 (항상 성공).
     */
    public static ActionOutcome simulated(Action action, Instant timestamp, String message) {
        return new ActionOutcome(true, action, timestamp, message, null, true, null, null);
    }

    /**
     * 실패 결과 생성.
     */
    public static ActionOutcome failed(Action action, Instant timestamp, RunStep failedStep, String message,
                                       String externalSignal, boolean simulation, Path evidence) {
        return new ActionOutcome(false, action, timestamp, message, externalSignal, simulation, failedStep, evidence);
    }

    /**
     * 원격 시스템의 실제 상태가 변경되었다고 보고할 수 있는지 확인.
     *
     * @return 성공했고 모의 실행이 아닌 경우 true
     */
    public boolean isRealStateChange() {
        return success && !simulation;
    }

    public Optional<String> externalSignalOptional() {
        return Optional.ofNullable(externalSignal);
    }

    public Optional<Path> evidenceOptional() {
        return Optional.ofNullable(evidence);
    }
}

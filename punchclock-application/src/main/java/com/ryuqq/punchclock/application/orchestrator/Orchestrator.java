package com.ryuqq.punchclock.application.orchestrator;

import com.ryuqq.punchclock.core.model.ActionOutcome;

/**
 * 동작 1회 실행 조정자.
 *
 * <p>로그인 → 화면 이동 → 상태 확인 → 동작 시도 → 결과 검증 순서로 단계를 진행하며,
 * 어떤 경우에도 정확히 하나의 {@link ActionOutcome}을 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ActionOutcome outcome = orchestrator.run(ActionRequest.scheduled(Action.ENTER, credentials));
 *
 * if (outcome.isRealStateChange()) {
 *     // 원격 시스템에 실제 반영됨
 * } else if (outcome.simulation()) {
 *     // 확인 거부 또는 모의 실행
 * } else {
 *     // outcome.failedStep(), outcome.message()로 실패 단계 확인
 * }
 * </pre>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * 동작 1회 실행.
     *
     * <p>구현체는 세션을 배타적으로 사용하며, 실행 중 발생한 오류를 밖으로 던지지 않고
     * 실패 결과로 변환해야 합니다.</p>
     *
     * @param request 실행 요청
     * @return 실행 결과 (null 아님)
     * @throws IllegalArgumentException request가 null인 경우
     */
    ActionOutcome run(ActionRequest request);
}

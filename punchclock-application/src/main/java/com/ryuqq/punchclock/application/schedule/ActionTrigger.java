package com.ryuqq.punchclock.application.schedule;

import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.ActionOutcome;

/**
 * 스케줄러가 발화 시 호출하는 콜백.
 *
 * <p>구현체는 내부에서 사전 승인(explicitConfirm=true)으로 Orchestrator를 끝까지 실행해야 합니다.
 * 시작 시 한 번 주입됩니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ActionTrigger {

    /**
     * 동작 실행.
     *
     * @param action 예약된 동작
     * @return 실행 결과
     */
    ActionOutcome fire(Action action);
}

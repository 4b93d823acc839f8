package com.ryuqq.punchclock.application.schedule;

import com.ryuqq.punchclock.core.model.ActionOutcome;

/**
 * 스케줄러 이벤트 수신자.
 *
 * <p>구현체는 예외를 던지지 않아야 합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public interface SchedulerEventListener {

    /**
     * 생명주기 이벤트.
     */
    void onEvent(SchedulerEvent event);

    /**
     * 예약 실행 완료.
     */
    void onOutcome(ActionOutcome outcome);

    /**
     * 아무것도 하지 않는 수신자.
     */
    static SchedulerEventListener noop() {
        return new SchedulerEventListener() {
            @Override
            public void onEvent(SchedulerEvent event) {
                // no-op
            }

            @Override
            public void onOutcome(ActionOutcome outcome) {
                // no-op
            }
        };
    }
}

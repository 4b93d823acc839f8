package com.ryuqq.punchclock.application.schedule;

/**
 * 스케줄러 생명주기 이벤트 종류.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public enum SchedulerEventType {

    /** 스케줄러 시작. */
    STARTED,

    /** 스케줄러 종료. */
    STOPPED,

    /** 예약 작업 실행 중 예기치 않은 오류. */
    JOB_ERROR,

    /** 유예 시간을 넘겨 건너뛴 발화. */
    MISFIRE
}

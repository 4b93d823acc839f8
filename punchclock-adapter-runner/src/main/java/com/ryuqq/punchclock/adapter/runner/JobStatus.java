package com.ryuqq.punchclock.adapter.runner;

import com.ryuqq.punchclock.core.model.Action;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * 예약 작업 상태 스냅샷 (모니터링/하트비트용).
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param jobId 작업 식별자
 * @param action 예약 동작
 * @param trigger 발화 규칙
 * @param nextFireTime 다음 발화 시각 (스케줄러 시작 전이면 null)
 * @param running 현재 실행 중 여부
 * @param lastRunAt 마지막 실행 완료 시각 (없으면 null)
 * @param lastSuccess 마지막 실행 성공 여부 (없으면 null)
 */
public record JobStatus(
    String jobId,
    Action action,
    DailyTrigger trigger,
    ZonedDateTime nextFireTime,
    boolean running,
    Instant lastRunAt,
    Boolean lastSuccess
) {
}

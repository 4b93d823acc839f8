package com.ryuqq.punchclock.application.schedule;

import java.time.Duration;
import java.time.LocalTime;

/**
 * 반복 실행 일정 (시작 시 한 번 로드, 이후 읽기 전용).
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param enterTime 출근 실행 시각 (기본 09:00)
 * @param exitTime 퇴근 실행 시각 (기본 18:00)
 * @param enabled 스케줄 사용 여부
 * @param weekdaysOnly 평일(월~금)만 실행
 * @param heartbeatInterval 상태 로그 주기 (기본 300초)
 */
public record ScheduleConfig(
    LocalTime enterTime,
    LocalTime exitTime,
    boolean enabled,
    boolean weekdaysOnly,
    Duration heartbeatInterval
) {

    public ScheduleConfig() {
        this(LocalTime.of(9, 0), LocalTime.of(18, 0), true, true, Duration.ofSeconds(300));
    }

    public ScheduleConfig {
        if (enterTime == null) {
            throw new IllegalArgumentException("enterTime cannot be null");
        }
        if (exitTime == null) {
            throw new IllegalArgumentException("exitTime cannot be null");
        }
        if (enterTime.equals(exitTime)) {
            throw new IllegalArgumentException(
                "enterTime and exitTime must differ (current: " + enterTime + ")"
            );
        }
        if (heartbeatInterval == null || heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException(
                "heartbeatInterval must be positive (current: " + heartbeatInterval + ")"
            );
        }
    }

    public ScheduleConfig withEnterTime(LocalTime enterTime) {
        return new ScheduleConfig(enterTime, exitTime, enabled, weekdaysOnly, heartbeatInterval);
    }

    public ScheduleConfig withExitTime(LocalTime exitTime) {
        return new ScheduleConfig(enterTime, exitTime, enabled, weekdaysOnly, heartbeatInterval);
    }

    public ScheduleConfig withEnabled(boolean enabled) {
        return new ScheduleConfig(enterTime, exitTime, enabled, weekdaysOnly, heartbeatInterval);
    }

    public ScheduleConfig withWeekdaysOnly(boolean weekdaysOnly) {
        return new ScheduleConfig(enterTime, exitTime, enabled, weekdaysOnly, heartbeatInterval);
    }

    public ScheduleConfig withHeartbeatInterval(Duration heartbeatInterval) {
        return new ScheduleConfig(enterTime, exitTime, enabled, weekdaysOnly, heartbeatInterval);
    }
}

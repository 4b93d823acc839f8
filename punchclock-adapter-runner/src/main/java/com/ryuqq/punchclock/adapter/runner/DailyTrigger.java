package com.ryuqq.punchclock.adapter.runner;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 매일 같은 시각에 발화하는 트리거 (선택적으로 평일만).
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param timeOfDay 발화 시각 (분 단위, 초 이하는 버림)
 * @param weekdaysOnly true면 토/일요일 제외
 */
public record DailyTrigger(LocalTime timeOfDay, boolean weekdaysOnly) {

    public DailyTrigger {
        if (timeOfDay == null) {
            throw new IllegalArgumentException("timeOfDay cannot be null");
        }
        timeOfDay = timeOfDay.truncatedTo(ChronoUnit.MINUTES);
    }

    /**
     * 주어진 시각 이후(초과) 첫 발화 시각.
     *
     * @param now 기준 시각 (이 시각의 시간대로 계산)
     * @return 다음 발화 시각
     */
    public ZonedDateTime nextFireAfter(ZonedDateTime now) {
        ZonedDateTime candidate = now.with(timeOfDay).truncatedTo(ChronoUnit.MINUTES);
        if (!candidate.isAfter(now)) {
            candidate = candidate.plusDays(1).with(timeOfDay);
        }
        while (!runsOn(candidate.getDayOfWeek())) {
            candidate = candidate.plusDays(1).with(timeOfDay);
        }
        return candidate;
    }

    /**
     * 해당 요일에 발화하는지 확인.
     */
    public boolean runsOn(DayOfWeek day) {
        return !weekdaysOnly || (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY);
    }

    /**
     * 로그용 표현 (예: "09:00 mon-fri").
     */
    public String describe() {
        return timeOfDay + (weekdaysOnly ? " mon-fri" : " daily");
    }
}

package com.ryuqq.punchclock.application.schedule;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 스케줄러 생명주기 이벤트.
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param type 이벤트 종류
 * @param message 설명
 * @param timestamp 발생 시각
 * @param details 순서가 유지되는 상세 항목
 */
public record SchedulerEvent(SchedulerEventType type, String message, Instant timestamp, Map<String, String> details) {

    public SchedulerEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static SchedulerEvent of(SchedulerEventType type, String message, Instant timestamp) {
        return new SchedulerEvent(type, message, timestamp, Map.of());
    }
}

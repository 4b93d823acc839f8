package com.ryuqq.punchclock.application.notification;

import com.ryuqq.punchclock.application.schedule.SchedulerEvent;
import com.ryuqq.punchclock.core.model.ActionOutcome;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 실행 결과와 스케줄러 이벤트로부터 알림 메시지 생성.
 *
 * <p><strong>등급 규칙:</strong></p>
 * <ul>
 *   <li>실행 결과: 성공 → SUCCESS, 실패 → ERROR</li>
 *   <li>스케줄러 이벤트: STARTED/STOPPED → INFO, JOB_ERROR → ERROR, MISFIRE → WARNING</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class NotificationMessageFactory {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId zone;
    private final Clock clock;

    public NotificationMessageFactory(ZoneId zone) {
        this(zone, Clock.system(zone));
    }

    public NotificationMessageFactory(ZoneId zone, Clock clock) {
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.zone = zone;
        this.clock = clock;
    }

    public NotificationMessage fromOutcome(ActionOutcome outcome) {
        String name = outcome.action().displayName();
        String title;
        if (!outcome.success()) {
            title = name + " failed";
        } else if (outcome.simulation()) {
            title = name + " simulated";
        } else {
            title = name + " succeeded";
        }

        Map<String, String> details = new LinkedHashMap<>();
        details.put("Action", name);
        details.put("Time", TIME_FORMAT.format(outcome.timestamp().atZone(zone)));
        details.put("Mode", outcome.simulation() ? "simulation" : "real");
        outcome.externalSignalOptional().ifPresent(signal -> details.put("Server response", signal));
        if (outcome.failedStep() != null) {
            details.put("Failed step", outcome.failedStep().description());
        }

        List<Path> attachments = outcome.evidenceOptional().map(List::of).orElse(List.of());
        NotificationLevel level = outcome.success() ? NotificationLevel.SUCCESS : NotificationLevel.ERROR;
        return new NotificationMessage(title, outcome.message(), level, outcome.timestamp(), details, attachments);
    }

    public NotificationMessage fromSchedulerEvent(SchedulerEvent event) {
        NotificationLevel level = switch (event.type()) {
            case STARTED, STOPPED -> NotificationLevel.INFO;
            case JOB_ERROR -> NotificationLevel.ERROR;
            case MISFIRE -> NotificationLevel.WARNING;
        };
        String title = switch (event.type()) {
            case STARTED -> "Scheduler started";
            case STOPPED -> "Scheduler stopped";
            case JOB_ERROR -> "Scheduler job error";
            case MISFIRE -> "Scheduled run skipped";
        };
        Map<String, String> details = new LinkedHashMap<>(event.details());
        details.put("Time", TIME_FORMAT.format(event.timestamp().atZone(zone)));
        return new NotificationMessage(title, event.message(), level, event.timestamp(), details, List.of());
    }

    /**
     * 채널 연결 확인용 메시지.
     */
    public NotificationMessage connectivityTest() {
        return NotificationMessage.of("Webhook connectivity test",
            "This is a test message to verify the webhook configuration.",
            NotificationLevel.INFO, clock.instant());
    }
}

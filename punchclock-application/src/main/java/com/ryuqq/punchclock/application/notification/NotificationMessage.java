package com.ryuqq.punchclock.application.notification;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 채널 공통 알림 메시지 (불변).
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param title 제목
 * @param body 본문
 * @param level 등급
 * @param timestamp 발생 시각
 * @param details 순서가 유지되는 상세 항목
 * @param attachments 첨부 파일 경로
 */
public record NotificationMessage(
    String title,
    String body,
    NotificationLevel level,
    Instant timestamp,
    Map<String, String> details,
    List<Path> attachments
) {

    public NotificationMessage {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /**
     * 상세 항목과 첨부 없이 생성.
     */
    public static NotificationMessage of(String title, String body, NotificationLevel level, Instant timestamp) {
        return new NotificationMessage(title, body, level, timestamp, Map.of(), List.of());
    }
}

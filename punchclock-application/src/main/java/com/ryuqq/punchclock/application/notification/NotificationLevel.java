package com.ryuqq.punchclock.application.notification;

/**
 * 알림 등급.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public enum NotificationLevel {

    SUCCESS(0x00ff00),
    WARNING(0xffaa00),
    ERROR(0xff0000),
    INFO(0x0099ff);

    private final int colorCode;

    NotificationLevel(int colorCode) {
        this.colorCode = colorCode;
    }

    /**
     * 채널 표시 색상 (RGB).
     */
    public int colorCode() {
        return colorCode;
    }
}

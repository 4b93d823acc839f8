package com.ryuqq.punchclock.bootstrap.config;

import com.ryuqq.punchclock.adapter.runner.SchedulerConfig;
import com.ryuqq.punchclock.adapter.selenium.SeleniumSessionConfig;
import com.ryuqq.punchclock.application.notification.NotificationSettings;
import com.ryuqq.punchclock.application.schedule.ScheduleConfig;
import com.ryuqq.punchclock.core.model.LoginCredentials;

import java.util.Optional;

/**
 * 애플리케이션 전체 설정 (불변 record).
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param credentials 로그인 정보
 * @param schedule 출퇴근 스케줄
 * @param scheduler 스케줄러 실행 설정 (시간대 포함)
 * @param session 브라우저 세션 설정
 * @param notification 알림 공통 설정
 * @param discordWebhookUrl Discord webhook URL (null 가능)
 */
public record AppConfig(
    LoginCredentials credentials,
    ScheduleConfig schedule,
    SchedulerConfig scheduler,
    SeleniumSessionConfig session,
    NotificationSettings notification,
    String discordWebhookUrl
) {

    public AppConfig {
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        if (schedule == null) {
            throw new IllegalArgumentException("schedule cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
    }

    public Optional<String> discordWebhookUrlOptional() {
        return Optional.ofNullable(discordWebhookUrl).filter(url -> !url.isBlank());
    }
}

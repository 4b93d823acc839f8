package com.ryuqq.punchclock.bootstrap.config;

import com.ryuqq.punchclock.adapter.runner.SchedulerConfig;
import com.ryuqq.punchclock.adapter.selenium.SeleniumSessionConfig;
import com.ryuqq.punchclock.application.notification.NotificationSettings;
import com.ryuqq.punchclock.application.schedule.ScheduleConfig;
import com.ryuqq.punchclock.core.error.InvalidConfigurationException;
import com.ryuqq.punchclock.core.model.LoginCredentials;
import com.ryuqq.punchclock.core.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 환경 변수에서 {@link AppConfig}를 읽는 로더.
 *
 * <p><strong>필수:</strong> COMPANY_ID, USER_ID, PASSWORD</p>
 *
 * <p><strong>선택 (기본값):</strong></p>
 * <ul>
 *   <li>CLOCK_IN_TIME (09:00), CLOCK_OUT_TIME (18:00), SCHEDULE_ENABLED (true), WEEKDAYS_ONLY (true)</li>
 *   <li>STATUS_MESSAGE_INTERVAL 초 (300), TIMEZONE (Asia/Taipei)</li>
 *   <li>HEADLESS (true), SCREENSHOT_DIR (screenshots), GPS_LATITUDE / GPS_LONGITUDE (25 / 121)</li>
 *   <li>WEBHOOK_ENABLED (false), DISCORD_WEBHOOK_URL, WEBHOOK_NOTIFY_SUCCESS / FAILURE / WARNINGS / SCHEDULER (true)</li>
 *   <li>WEBHOOK_RETRY_ATTEMPTS (3), WEBHOOK_RATE_LIMIT_DELAY 초 (1.0), WEBHOOK_TIMEOUT_SECONDS (30)</li>
 * </ul>
 *
 * <p>불린 값은 true/false, 1/0, yes/no, on/off를 허용합니다. 필수 값 누락이나 형식 오류는
 * {@link InvalidConfigurationException}으로 보고합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class EnvironmentConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentConfigLoader.class);

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no", "off");

    private final Map<String, String> environment;

    public EnvironmentConfigLoader(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.environment = Map.copyOf(environment);
    }

    public static EnvironmentConfigLoader fromSystem() {
        return new EnvironmentConfigLoader(System.getenv());
    }

    /**
     * 설정 로드.
     *
     * @return 전체 설정
     * @throws InvalidConfigurationException 필수 값 누락 또는 형식 오류
     */
    public AppConfig load() {
        LoginCredentials credentials = new LoginCredentials(
            required("COMPANY_ID"), required("USER_ID"), required("PASSWORD"));

        ScheduleConfig defaults = new ScheduleConfig();
        ScheduleConfig schedule = build("schedule", () -> new ScheduleConfig(
            time("CLOCK_IN_TIME", defaults.enterTime()),
            time("CLOCK_OUT_TIME", defaults.exitTime()),
            bool("SCHEDULE_ENABLED", defaults.enabled()),
            bool("WEEKDAYS_ONLY", defaults.weekdaysOnly()),
            seconds("STATUS_MESSAGE_INTERVAL", defaults.heartbeatInterval())));

        SchedulerConfig scheduler = new SchedulerConfig().withZone(zone("TIMEZONE", SchedulerConfig.DEFAULT_ZONE));

        SeleniumSessionConfig sessionDefaults = new SeleniumSessionConfig();
        SeleniumSessionConfig session = build("browser", () -> new SeleniumSessionConfig(
            bool("HEADLESS", sessionDefaults.headless()),
            Path.of(optional("SCREENSHOT_DIR", sessionDefaults.screenshotDirectory().toString())),
            sessionDefaults.pageLoadTimeout(),
            new SeleniumSessionConfig.GeoLocation(
                decimal("GPS_LATITUDE", sessionDefaults.geolocation().latitude()),
                decimal("GPS_LONGITUDE", sessionDefaults.geolocation().longitude()))));

        NotificationSettings notificationDefaults = new NotificationSettings();
        RetryConfig retryDefaults = notificationDefaults.retryConfig();
        NotificationSettings notification = build("webhook", () -> new NotificationSettings(
            bool("WEBHOOK_ENABLED", false),
            bool("WEBHOOK_NOTIFY_SUCCESS", true),
            bool("WEBHOOK_NOTIFY_FAILURE", true),
            bool("WEBHOOK_NOTIFY_WARNINGS", true),
            bool("WEBHOOK_NOTIFY_SCHEDULER", true),
            retryDefaults.withMaxAttempts(integer("WEBHOOK_RETRY_ATTEMPTS", retryDefaults.maxAttempts())),
            seconds("WEBHOOK_RATE_LIMIT_DELAY", notificationDefaults.rateLimitDelay()),
            seconds("WEBHOOK_TIMEOUT_SECONDS", notificationDefaults.timeout())));

        String webhookUrl = optional("DISCORD_WEBHOOK_URL", null);
        if (notification.enabled() && webhookUrl == null) {
            log.warn("WEBHOOK_ENABLED is set but DISCORD_WEBHOOK_URL is missing, notifications will not be sent");
        }

        AppConfig config = new AppConfig(credentials, schedule, scheduler, session, notification, webhookUrl);
        log.info("Configuration loaded: user={}, enter={}, exit={}, schedule={}, weekdaysOnly={}, zone={}, headless={}, webhook={}",
            credentials.userId(), schedule.enterTime(), schedule.exitTime(), schedule.enabled(),
            schedule.weekdaysOnly(), scheduler.zone(), session.headless(), notification.enabled());
        return config;
    }

    @FunctionalInterface
    private interface Section<T> {
        T create();
    }

    /**
     * record 검증 실패를 설정 오류로 변환.
     */
    private static <T> T build(String section, Section<T> factory) {
        try {
            return factory.create();
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("invalid " + section + " configuration: " + e.getMessage(), e);
        }
    }

    private String required(String key) {
        String value = environment.get(key);
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("required environment variable is not set: " + key);
        }
        return value.trim();
    }

    private String optional(String key, String defaultValue) {
        String value = environment.get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private boolean bool(String key, boolean defaultValue) {
        String value = optional(key, null);
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return true;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return false;
        }
        throw new InvalidConfigurationException(
            key + " has invalid boolean value '" + value + "' (use true/false, 1/0, yes/no, on/off)");
    }

    private LocalTime time(String key, LocalTime defaultValue) {
        String value = optional(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return LocalTime.parse(value.length() == 4 ? "0" + value : value);
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException(key + " must be HH:mm (current: " + value + ")", e);
        }
    }

    private int integer(String key, int defaultValue) {
        String value = optional(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private double decimal(String key, double defaultValue) {
        String value = optional(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " must be a number (current: " + value + ")", e);
        }
    }

    /**
     * 초 단위 값 (소수 허용).
     */
    private Duration seconds(String key, Duration defaultValue) {
        String value = optional(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            BigDecimal millis = new BigDecimal(value).movePointRight(3);
            return Duration.ofMillis(millis.longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidConfigurationException(key + " must be a number of seconds (current: " + value + ")", e);
        }
    }

    private ZoneId zone(String key, ZoneId defaultValue) {
        String value = optional(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new InvalidConfigurationException(key + " is not a valid time zone (current: " + value + ")", e);
        }
    }
}

package com.ryuqq.punchclock.adapter.discord;

/**
 * Discord webhook 설정 (불변 record).
 *
 * <p>URL 형식 검증은 전송 시점({@link DiscordNotificationProvider#validateConfig()})에 수행합니다.
 * 잘못된 URL이라도 애플리케이션 시작은 막지 않고 해당 채널만 실패로 기록됩니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param webhookUrl webhook URL ({@value #WEBHOOK_URL_PREFIX}로 시작해야 유효)
 * @param username 메시지 표시 이름
 * @param footerLabel embed 꼬리말 접두어 (뒤에 등급이 붙음)
 */
public record DiscordConfig(String webhookUrl, String username, String footerLabel) {

    public static final String WEBHOOK_URL_PREFIX = "https://discord.com/api/webhooks/";

    private static final String DEFAULT_USERNAME = "震旦HR打卡機器人";
    private static final String DEFAULT_FOOTER_LABEL = "震旦HR打卡系統";

    public DiscordConfig {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username cannot be null or blank");
        }
        if (footerLabel == null || footerLabel.isBlank()) {
            throw new IllegalArgumentException("footerLabel cannot be null or blank");
        }
    }

    /**
     * 기본 표시 이름과 꼬리말로 생성.
     */
    public static DiscordConfig of(String webhookUrl) {
        return new DiscordConfig(webhookUrl, DEFAULT_USERNAME, DEFAULT_FOOTER_LABEL);
    }

    /**
     * URL이 Discord webhook 형식인지 확인.
     */
    public boolean hasValidUrl() {
        return webhookUrl != null && webhookUrl.startsWith(WEBHOOK_URL_PREFIX);
    }

    public DiscordConfig withUsername(String username) {
        return new DiscordConfig(webhookUrl, username, footerLabel);
    }

    @Override
    public String toString() {
        // webhook URL의 토큰 부분은 비밀 값
        String masked = hasValidUrl() ? WEBHOOK_URL_PREFIX + "****" : String.valueOf(webhookUrl);
        return "DiscordConfig[webhookUrl=" + masked + ", username=" + username + "]";
    }
}

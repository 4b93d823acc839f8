/**
 * Discord webhook 알림 채널 (OkHttp 전송, Jackson 직렬화).
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
package com.ryuqq.punchclock.adapter.discord;

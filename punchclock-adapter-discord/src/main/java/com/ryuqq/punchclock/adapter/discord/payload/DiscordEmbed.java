package com.ryuqq.punchclock.adapter.discord.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Discord embed.
 *
 * @param title 제목
 * @param description 본문
 * @param color 색상 (RGB 정수)
 * @param timestamp 시각 (ISO-8601로 직렬화)
 * @param fields 상세 항목 (없으면 생략)
 * @param footer 꼬리말
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscordEmbed(
    String title,
    String description,
    int color,
    Instant timestamp,
    List<DiscordField> fields,
    DiscordFooter footer
) {
}

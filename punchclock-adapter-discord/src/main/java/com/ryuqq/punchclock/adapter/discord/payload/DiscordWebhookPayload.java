package com.ryuqq.punchclock.adapter.discord.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Discord webhook 요청 본문.
 *
 * <p>첨부 파일이 있으면 multipart의 {@code payload_json} 파트로, 없으면 JSON 본문으로 전송됩니다.</p>
 *
 * @param content 일반 텍스트 (사용하지 않으면 null)
 * @param username 표시 이름
 * @param embeds embed 목록
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscordWebhookPayload(
    String content,
    String username,
    List<DiscordEmbed> embeds
) {
}

package com.ryuqq.punchclock.adapter.discord.payload;

/**
 * Embed 상세 항목.
 */
public record DiscordField(String name, String value, boolean inline) {
}

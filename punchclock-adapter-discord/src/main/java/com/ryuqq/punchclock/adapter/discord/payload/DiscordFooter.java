package com.ryuqq.punchclock.adapter.discord.payload;

public record DiscordFooter(String text) {
}

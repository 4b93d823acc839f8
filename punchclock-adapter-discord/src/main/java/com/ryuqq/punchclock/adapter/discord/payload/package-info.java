/**
 * Discord webhook JSON payload records, serialized with Jackson.
 */
package com.ryuqq.punchclock.adapter.discord.payload;

package com.ryuqq.punchclock.adapter.discord;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.punchclock.adapter.discord.payload.DiscordEmbed;
import com.ryuqq.punchclock.adapter.discord.payload.DiscordField;
import com.ryuqq.punchclock.adapter.discord.payload.DiscordFooter;
import com.ryuqq.punchclock.adapter.discord.payload.DiscordWebhookPayload;
import com.ryuqq.punchclock.application.notification.AbstractNotificationProvider;
import com.ryuqq.punchclock.application.notification.NotificationMessage;
import com.ryuqq.punchclock.application.notification.NotificationSettings;
import com.ryuqq.punchclock.application.notification.ProviderAuthenticationException;
import com.ryuqq.punchclock.application.notification.ProviderDeliveryException;
import com.ryuqq.punchclock.application.notification.ProviderRateLimitedException;
import com.ryuqq.punchclock.application.notification.ProviderResult;
import com.ryuqq.punchclock.core.protection.RateLimiter;
import com.ryuqq.punchclock.core.retry.RetryPolicy;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Discord webhook 알림 채널.
 *
 * <p><strong>전송 형식:</strong></p>
 * <ul>
 *   <li>첨부 없음: {@code application/json} 본문</li>
 *   <li>첨부 있음: multipart ({@code payload_json} + {@code file0..n}), 8MB 초과 파일은 제외</li>
 * </ul>
 *
 * <p><strong>응답 해석:</strong></p>
 * <ul>
 *   <li>200/204: 성공</li>
 *   <li>429: 빈도 제한, {@code Retry-After}만큼 기다린 뒤 재시도</li>
 *   <li>401/403: 인증 실패, 재시도 안 함</li>
 *   <li>그 외: 일시적 실패로 재시도, 상태 코드 기록</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class DiscordNotificationProvider extends AbstractNotificationProvider {

    private static final Logger log = LoggerFactory.getLogger(DiscordNotificationProvider.class);

    static final long MAX_ATTACHMENT_BYTES = 8L * 1024 * 1024;

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");
    private static final MediaType PNG_MEDIA_TYPE = MediaType.get("image/png");
    private static final MediaType OCTET_MEDIA_TYPE = MediaType.get("application/octet-stream");
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);
    private static final int MAX_ERROR_BODY_LENGTH = 200;

    private final DiscordConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public DiscordNotificationProvider(DiscordConfig config, NotificationSettings settings) {
        super(settings);
        this.config = requireConfig(config);
        this.httpClient = defaultClient(settings.timeout());
        this.objectMapper = createObjectMapper();
    }

    /**
     * 생성자 (HTTP 클라이언트, 재시도, 전송 간격 직접 지정).
     *
     * @param config Discord 설정
     * @param settings 알림 설정
     * @param httpClient HTTP 클라이언트
     * @param retryPolicy 재시도 정책
     * @param rateLimiter 전송 간격 제한
     */
    public DiscordNotificationProvider(DiscordConfig config, NotificationSettings settings, OkHttpClient httpClient,
                                       RetryPolicy retryPolicy, RateLimiter rateLimiter) {
        super(settings, retryPolicy, rateLimiter);
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        this.config = requireConfig(config);
        this.httpClient = httpClient;
        this.objectMapper = createObjectMapper();
    }

    private static DiscordConfig requireConfig(DiscordConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    private static OkHttpClient defaultClient(Duration timeout) {
        return new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .writeTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .callTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .build();
    }

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public String name() {
        return "Discord";
    }

    @Override
    public boolean validateConfig() {
        if (config.webhookUrl() == null || config.webhookUrl().isBlank()) {
            log.error("Discord webhook URL is not configured");
            return false;
        }
        if (!config.hasValidUrl()) {
            log.error("Discord webhook URL must start with {}", DiscordConfig.WEBHOOK_URL_PREFIX);
            return false;
        }
        return true;
    }

    @Override
    protected ProviderResult send(NotificationMessage message) throws IOException {
        String payloadJson = objectMapper.writeValueAsString(buildPayload(message));
        List<Path> files = uploadableAttachments(message.attachments());

        RequestBody body;
        if (files.isEmpty()) {
            body = RequestBody.create(payloadJson, JSON_MEDIA_TYPE);
        } else {
            MultipartBody.Builder multipart = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("payload_json", payloadJson);
            for (int i = 0; i < files.size(); i++) {
                Path file = files.get(i);
                multipart.addFormDataPart("file" + i, file.getFileName().toString(),
                    RequestBody.create(file.toFile(), mediaTypeOf(file)));
            }
            body = multipart.build();
        }

        Request request = new Request.Builder()
            .url(config.webhookUrl())
            .post(body)
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            return interpret(response, responseBody);
        }
    }

    private ProviderResult interpret(Response response, String responseBody) {
        int code = response.code();
        if (code == 200 || code == 204) {
            log.debug("Discord accepted message (HTTP {})", code);
            return ProviderResult.delivered(name(), code);
        }
        if (code == 429) {
            Duration retryAfter = retryAfter(response, responseBody);
            throw new ProviderRateLimitedException(
                "Discord rate limit, retry after " + retryAfter.toMillis() + "ms", code, retryAfter);
        }
        if (code == 401 || code == 403) {
            throw new ProviderAuthenticationException(
                "Discord webhook authentication failed: HTTP " + code + " " + abbreviate(responseBody), code);
        }
        throw new ProviderDeliveryException("HTTP " + code + ": " + abbreviate(responseBody), code);
    }

    /**
     * 재시도 대기 시간: {@code Retry-After} 헤더(초, 소수 허용), 없으면 본문의 {@code retry_after}, 둘 다 없으면 1초.
     */
    Duration retryAfter(Response response, String responseBody) {
        Duration fromHeader = parseSeconds(response.header("Retry-After"));
        if (fromHeader != null) {
            return fromHeader;
        }
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            if (node != null && node.hasNonNull("retry_after")) {
                return toDuration(node.get("retry_after").asDouble());
            }
        } catch (JsonProcessingException e) {
            log.debug("Rate limit response body is not JSON: {}", e.getOriginalMessage());
        }
        return DEFAULT_RETRY_AFTER;
    }

    private static Duration parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return toDuration(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed Retry-After header: {}", value);
            return null;
        }
    }

    private static Duration toDuration(double seconds) {
        return seconds <= 0 ? DEFAULT_RETRY_AFTER : Duration.ofMillis(Math.round(seconds * 1000));
    }

    DiscordWebhookPayload buildPayload(NotificationMessage message) {
        List<DiscordField> fields = null;
        if (!message.details().isEmpty()) {
            fields = new ArrayList<>();
            for (Map.Entry<String, String> entry : message.details().entrySet()) {
                if (entry.getValue() != null) {
                    fields.add(new DiscordField(entry.getKey(), entry.getValue(), true));
                }
            }
        }
        DiscordFooter footer = new DiscordFooter(
            config.footerLabel() + " • " + message.level().name().toUpperCase(Locale.ROOT));
        DiscordEmbed embed = new DiscordEmbed(message.title(), message.body(), message.level().colorCode(),
            message.timestamp(), fields, footer);
        return new DiscordWebhookPayload(null, config.username(), List.of(embed));
    }

    private static List<Path> uploadableAttachments(List<Path> attachments) {
        List<Path> files = new ArrayList<>();
        for (Path attachment : attachments) {
            try {
                if (Files.isRegularFile(attachment) && Files.size(attachment) <= MAX_ATTACHMENT_BYTES) {
                    files.add(attachment);
                } else {
                    log.warn("Skipping attachment (missing or larger than 8MB): {}", attachment);
                }
            } catch (IOException e) {
                log.warn("Skipping unreadable attachment {}: {}", attachment, e.getMessage());
            }
        }
        return files;
    }

    private static MediaType mediaTypeOf(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".png") ? PNG_MEDIA_TYPE : OCTET_MEDIA_TYPE;
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_ERROR_BODY_LENGTH ? text : text.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }
}

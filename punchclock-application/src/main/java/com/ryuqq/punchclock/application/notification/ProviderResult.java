package com.ryuqq.punchclock.application.notification;

/**
 * 채널 하나에 대한 전송 결과.
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param providerName 채널 이름
 * @param success 성공 여부
 * @param statusCode 전송 응답 코드 (없으면 null)
 * @param errorMessage 실패 사유 (성공 시 null)
 */
public record ProviderResult(String providerName, boolean success, Integer statusCode, String errorMessage) {

    public ProviderResult {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("providerName cannot be null or blank");
        }
        if (!success && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("failed result must carry an errorMessage");
        }
    }

    public static ProviderResult delivered(String providerName, Integer statusCode) {
        return new ProviderResult(providerName, true, statusCode, null);
    }

    public static ProviderResult failed(String providerName, Integer statusCode, String errorMessage) {
        return new ProviderResult(providerName, false, statusCode, errorMessage);
    }
}

package com.ryuqq.punchclock.application.verification;

/**
 * 결과 검증 판정.
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param success 성공 여부
 * @param message 판정 설명
 * @param externalSignal 판정 근거가 된 화면 문구 (null 가능)
 */
public record VerificationResult(boolean success, String message, String externalSignal) {

    /** 신호도 상태 변화도 확인하지 못했을 때의 메시지. */
    public static final String TIMED_OUT_MESSAGE = "result verification timed out";

    public VerificationResult {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static VerificationResult timedOut() {
        return new VerificationResult(false, TIMED_OUT_MESSAGE, null);
    }
}

package com.ryuqq.punchclock.application.notification;

/**
 * 알림 채널 SPI.
 *
 * <p>{@link #deliver(NotificationMessage)}는 어떤 경우에도 예외를 던지지 않고
 * 실패를 {@link ProviderResult}로 반환해야 합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public interface NotificationProvider {

    /**
     * 채널 이름 (로그 및 결과 식별용).
     */
    String name();

    /**
     * 메시지 등급과 채널 설정에 따라 전송 대상인지 판단.
     */
    boolean shouldNotify(NotificationMessage message);

    /**
     * 전송 (재시도와 전송 간격 제한 포함).
     *
     * @param message 메시지
     * @return 전송 결과
     */
    ProviderResult deliver(NotificationMessage message);
}

/**
 * 결과 알림.
 *
 * <h2>핵심 구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.punchclock.application.notification.NotificationDispatcher} - 채널 병렬 전송, 예외 없음</li>
 *   <li>{@link com.ryuqq.punchclock.application.notification.NotificationProvider} - 채널 SPI</li>
 *   <li>{@link com.ryuqq.punchclock.application.notification.AbstractNotificationProvider} - 채널별 재시도와 전송 간격 제한</li>
 *   <li>{@link com.ryuqq.punchclock.application.notification.NotificationMessageFactory} - 결과/이벤트 → 메시지</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
package com.ryuqq.punchclock.application.notification;

package com.ryuqq.punchclock.core.error;

/**
 * 세션 드라이버 오류 (요소 대기 타임아웃, 클릭 실패, 연결 끊김 등).
 *
 * <p>드라이버가 던지는 모든 오류는 이 타입으로 변환되며 재시도 가능으로 분류됩니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class DriverException extends TransientException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}

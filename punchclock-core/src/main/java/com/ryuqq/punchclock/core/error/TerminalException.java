package com.ryuqq.punchclock.core.error;

/**
 * 재시도 불가 오류.
 *
 * <p>자격 증명 거부, 잘못된 설정 등 다시 시도해도 결과가 달라지지 않는 경우입니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class TerminalException extends PunchClockException {

    public TerminalException(String message) {
        super(message);
    }

    public TerminalException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public final ErrorClassification classification() {
        return ErrorClassification.TERMINAL;
    }
}

package com.ryuqq.punchclock.core.error;

/**
 * 설정 값 누락 또는 형식 오류.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class InvalidConfigurationException extends TerminalException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

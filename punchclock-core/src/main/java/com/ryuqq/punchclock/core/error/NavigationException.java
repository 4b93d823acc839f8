package com.ryuqq.punchclock.core.error;

/**
 * 대상 화면으로 이동하지 못함.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class NavigationException extends TransientException {

    public NavigationException(String message) {
        super(message);
    }

    public NavigationException(String message, Throwable cause) {
        super(message, cause);
    }
}

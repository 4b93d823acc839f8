package com.ryuqq.punchclock.application.notification;

import com.ryuqq.punchclock.core.error.TerminalException;

/**
 * 채널 인증 실패 (잘못된 웹훅 주소 또는 토큰). 재시도하지 않습니다.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ProviderAuthenticationException extends TerminalException {

    private final int statusCode;

    public ProviderAuthenticationException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}

package com.ryuqq.punchclock.core.error;

/**
 * 원격 시스템이 로그인 자격 증명을 거부함.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class CredentialRejectedException extends TerminalException {

    public CredentialRejectedException(String message) {
        super(message);
    }
}

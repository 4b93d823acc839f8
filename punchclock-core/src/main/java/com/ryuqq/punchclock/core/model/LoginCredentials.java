package com.ryuqq.punchclock.core.model;

/**
 * 원격 세션 로그인 자격 증명.
 *
 * @param companyId 회사 코드
 * @param userId 사용자 ID
 * @param password 비밀번호 ({@link #toString()}에 노출되지 않음)
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public record LoginCredentials(String companyId, String userId, String password) {

    public LoginCredentials {
        if (companyId == null || companyId.isBlank()) {
            throw new IllegalArgumentException("companyId cannot be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return "LoginCredentials{companyId=" + companyId + ", userId=" + userId + ", password=****}";
    }
}

package com.ryuqq.punchclock.adapter.runner;

import com.ryuqq.punchclock.core.retry.RetryConfig;

import java.time.Duration;

/**
 * StepwiseOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>authenticateRetry: 로그인 단계 재시도 (기본 3회, 1초부터 지수 증가)</li>
 *   <li>navigateRetry: 화면 이동 단계 재시도 (기본 3회)</li>
 *   <li>verificationTimeout: 결과 확인 최대 대기 (기본 10초)</li>
 *   <li>evidenceEnabled: 동작 후 스크린샷 저장 여부 (기본 true)</li>
 * </ul>
 *
 * <p>상태 읽기와 버튼 클릭은 재시도하지 않습니다. 깨진 스냅샷을 신뢰할 수 없고,
 * 클릭을 반복하면 중복 기록이 생길 수 있기 때문입니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param authenticateRetry 로그인 재시도 설정
 * @param navigateRetry 화면 이동 재시도 설정
 * @param verificationTimeout 결과 확인 타임아웃 (양수)
 * @param evidenceEnabled 스크린샷 저장 여부
 */
public record OrchestratorConfig(
    RetryConfig authenticateRetry,
    RetryConfig navigateRetry,
    Duration verificationTimeout,
    boolean evidenceEnabled
) {

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(new RetryConfig(), new RetryConfig(), Duration.ofSeconds(10), true);
    }

    public OrchestratorConfig {
        if (authenticateRetry == null) {
            throw new IllegalArgumentException("authenticateRetry cannot be null");
        }
        if (navigateRetry == null) {
            throw new IllegalArgumentException("navigateRetry cannot be null");
        }
        if (verificationTimeout == null || verificationTimeout.isNegative() || verificationTimeout.isZero()) {
            throw new IllegalArgumentException(
                "verificationTimeout must be positive (current: " + verificationTimeout + ")"
            );
        }
    }

    public OrchestratorConfig withAuthenticateRetry(RetryConfig authenticateRetry) {
        return new OrchestratorConfig(authenticateRetry, navigateRetry, verificationTimeout, evidenceEnabled);
    }

    public OrchestratorConfig withNavigateRetry(RetryConfig navigateRetry) {
        return new OrchestratorConfig(authenticateRetry, navigateRetry, verificationTimeout, evidenceEnabled);
    }

    public OrchestratorConfig withVerificationTimeout(Duration verificationTimeout) {
        return new OrchestratorConfig(authenticateRetry, navigateRetry, verificationTimeout, evidenceEnabled);
    }

    public OrchestratorConfig withEvidenceEnabled(boolean evidenceEnabled) {
        return new OrchestratorConfig(authenticateRetry, navigateRetry, verificationTimeout, evidenceEnabled);
    }
}

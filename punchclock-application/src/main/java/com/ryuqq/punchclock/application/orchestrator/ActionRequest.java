package com.ryuqq.punchclock.application.orchestrator;

import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.LoginCredentials;

/**
 * 동작 실행 요청.
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param action 요청 동작 (SIMULATE면 가용한 동작을 모의 실행)
 * @param credentials 로그인 정보
 * @param interactiveMode 운영자에게 확인을 물을 수 있는지 여부
 * @param explicitConfirm 자동화 호출자가 이미 실제 동작을 승인했는지 여부
 */
public record ActionRequest(
    Action action,
    LoginCredentials credentials,
    boolean interactiveMode,
    boolean explicitConfirm
) {

    public ActionRequest {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
    }

    /**
     * 스케줄러 실행 요청 (비대화형, 사전 승인).
     */
    public static ActionRequest scheduled(Action action, LoginCredentials credentials) {
        return new ActionRequest(action, credentials, false, true);
    }

    /**
     * 수동 실행 요청 (운영자 확인 필요).
     */
    public static ActionRequest interactive(Action action, LoginCredentials credentials) {
        return new ActionRequest(action, credentials, true, false);
    }
}

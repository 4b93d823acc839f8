package com.ryuqq.punchclock.adapter.runner;

import com.ryuqq.punchclock.application.orchestrator.ActionRequest;
import com.ryuqq.punchclock.application.orchestrator.Orchestrator;
import com.ryuqq.punchclock.application.schedule.ActionTrigger;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.ActionOutcome;
import com.ryuqq.punchclock.core.model.LoginCredentials;

/**
 * 예약 실행을 Orchestrator에 연결하는 ActionTrigger.
 *
 * <p>예약 실행은 의도된 실제 동작이므로 사전 승인({@code explicitConfirm=true})으로 요청합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public final class OrchestratedActionTrigger implements ActionTrigger {

    private final Orchestrator orchestrator;
    private final LoginCredentials credentials;

    public OrchestratedActionTrigger(Orchestrator orchestrator, LoginCredentials credentials) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        this.orchestrator = orchestrator;
        this.credentials = credentials;
    }

    @Override
    public ActionOutcome fire(Action action) {
        return orchestrator.run(ActionRequest.scheduled(action, credentials));
    }
}

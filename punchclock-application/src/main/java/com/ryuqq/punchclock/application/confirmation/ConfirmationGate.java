package com.ryuqq.punchclock.application.confirmation;

import com.ryuqq.punchclock.core.error.UserCancelledException;
import com.ryuqq.punchclock.core.model.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * 실제 상태 변경 동작의 승인 여부 판단.
 *
 * <p><strong>판단 순서:</strong></p>
 * <ol>
 *   <li>explicitConfirm=true: 즉시 승인 (스케줄러가 실제 동작을 수행하는 유일한 경로)</li>
 *   <li>interactiveMode=true: 운영자에게 한 번 묻고, 정확히 {@code yes}일 때만 승인.
 *       {@code quit}/{@code q}는 실행 중단({@link UserCancelledException})</li>
 *   <li>그 외: 거부 (기본값)</li>
 * </ol>
 *
 * <p>거부는 실행 실패가 아니며, Orchestrator는 모의 실행으로 전환합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ConfirmationGate {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationGate.class);

    private static final String AFFIRMATIVE = "yes";
    private static final Set<String> QUIT_TOKENS = Set.of("quit", "q");

    private final ConfirmationPrompt prompt;

    /**
     * 생성자.
     *
     * @param prompt 대화형 프롬프트 (비대화형 전용이면 null 허용)
     */
    public ConfirmationGate(ConfirmationPrompt prompt) {
        this.prompt = prompt;
    }

    /**
     * 비대화형 전용 게이트.
     */
    public static ConfirmationGate nonInteractive() {
        return new ConfirmationGate(null);
    }

    /**
     * 승인 여부 판단.
     *
     * @param action 실행하려는 동작
     * @param interactiveMode 운영자에게 물을 수 있는지 여부
     * @param explicitConfirm 호출자가 이미 승인했는지 여부
     * @return 승인 시 true
     * @throws UserCancelledException 운영자가 중단을 요청한 경우
     */
    public boolean authorize(Action action, boolean interactiveMode, boolean explicitConfirm) {
        if (explicitConfirm) {
            log.info("{} authorized by caller", action.displayName());
            return true;
        }
        if (!interactiveMode || prompt == null) {
            log.info("{} not authorized (non-interactive, no explicit confirmation)", action.displayName());
            return false;
        }

        String answer;
        try {
            answer = prompt.ask("Perform a REAL " + action.displayName() + "? Type 'yes' to confirm, 'quit' to abort: ");
        } catch (IOException e) {
            log.warn("Could not read confirmation, denying {}: {}", action.displayName(), e.getMessage());
            return false;
        }

        String normalized = answer == null ? "" : answer.trim().toLowerCase(Locale.ROOT);
        if (QUIT_TOKENS.contains(normalized)) {
            log.info("Operator aborted {}", action.displayName());
            throw new UserCancelledException("operator aborted " + action.displayName());
        }
        boolean authorized = AFFIRMATIVE.equals(normalized);
        log.info("Operator {} {}", authorized ? "confirmed" : "declined", action.displayName());
        return authorized;
    }
}

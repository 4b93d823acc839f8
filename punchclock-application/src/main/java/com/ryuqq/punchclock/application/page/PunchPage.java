package com.ryuqq.punchclock.application.page;

import com.ryuqq.punchclock.application.verification.ObservedSignal;
import com.ryuqq.punchclock.application.verification.SignalRule;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.LoginCredentials;
import com.ryuqq.punchclock.core.model.StatusSnapshot;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 원격 출퇴근 화면에 대한 단계별 조작.
 *
 * <p>Orchestrator와 ResultVerifier가 원격 화면에 접근하는 유일한 경로입니다.
 * 세션 하나를 감싸며, 닫으면 세션도 종료됩니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public interface PunchPage extends AutoCloseable {

    /**
     * 로그인.
     *
     * @param credentials 로그인 정보
     * @throws com.ryuqq.punchclock.core.error.CredentialRejectedException 로그인 거부 시 (재시도 불가)
     * @throws com.ryuqq.punchclock.core.error.TransientException 화면 로딩 실패 등 (재시도 가능)
     */
    void authenticate(LoginCredentials credentials);

    /**
     * 출퇴근 체크 화면으로 이동.
     *
     * <p>위치 확인은 부가 단계이며 실패해도 예외를 던지지 않습니다.</p>
     *
     * @throws com.ryuqq.punchclock.core.error.NavigationException 화면 진입 실패 시
     */
    void navigateToPunchPage();

    /**
     * 현재 화면 상태 읽기.
     *
     * @return 상태 스냅샷
     * @throws com.ryuqq.punchclock.core.error.DriverException 구조적 읽기 실패 시
     */
    StatusSnapshot readStatus();

    /**
     * 동작 버튼 클릭 (실제 상태 변경).
     *
     * @param action ENTER 또는 EXIT
     */
    void press(Action action);

    /**
     * 규칙별로 현재 표시 중인 결과 신호 수집 (한 번의 관찰).
     *
     * @param rules 관찰할 규칙 (우선순위 순)
     * @return 표시 중인 신호 목록 (규칙 순서 유지)
     */
    List<ObservedSignal> observe(List<SignalRule> rules);

    /**
     * 증거 스크린샷 (best-effort).
     *
     * @return 저장 경로, 실패 시 empty
     */
    Optional<Path> captureEvidence();

    @Override
    void close();
}

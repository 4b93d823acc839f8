/**
 * 결과 검증.
 *
 * <p>화면 신호 규칙({@link com.ryuqq.punchclock.application.verification.SignalRule})은 설정 데이터이고,
 * 판정은 {@link com.ryuqq.punchclock.application.verification.SignalMatcher}가 순수 함수로 수행합니다.
 * {@link com.ryuqq.punchclock.application.verification.ResultVerifier}는 관찰 루프와 상태 비교를 담당합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.punchclock.application.verification;

/**
 * 통합 시나리오 테스트용 도구.
 *
 * <p>{@link com.ryuqq.punchclock.testkit.ScriptedSessionDriver}로 원격 화면을 흉내 내고,
 * {@link com.ryuqq.punchclock.testkit.PunchClockHarness}로 실제 실행 경로 전체를 연결합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.punchclock.testkit;

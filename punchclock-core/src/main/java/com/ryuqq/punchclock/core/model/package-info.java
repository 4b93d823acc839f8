/**
 * 출퇴근 동작 도메인 모델.
 *
 * <ul>
 *   <li>{@link com.ryuqq.punchclock.core.model.Action} - ENTER / EXIT / SIMULATE</li>
 *   <li>{@link com.ryuqq.punchclock.core.model.ActionOutcome} - 실행 1회의 불변 결과</li>
 *   <li>{@link com.ryuqq.punchclock.core.model.StatusSnapshot} - 화면 상태 스냅샷</li>
 *   <li>{@link com.ryuqq.punchclock.core.model.LoginCredentials} - 로그인 자격 증명</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
package com.ryuqq.punchclock.core.model;

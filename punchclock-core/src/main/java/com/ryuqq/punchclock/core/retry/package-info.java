/**
 * 재시도 정책 패키지.
 *
 * <p>단일 논리 작업 내부의 재시도를 담당합니다. 오류 분류 → 지연 계산 → 대기 순으로 동작하며
 * 재시도 횟수는 항상 {@code maxAttempts}로 제한됩니다 (무한 재시도 없음).</p>
 *
 * <h2>사용 예시</h2>
 * <pre>{@code
 * RetryPolicy policy = new RetryPolicy(new RetryConfig().withMaxAttempts(3));
 * policy.execute(() -> {
 *     page.authenticate(credentials);
 *     return null;
 * }, "authenticate");
 * }</pre>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
package com.ryuqq.punchclock.core.retry;

/**
 * Runner Adapter Layer - Orchestrator와 Scheduler 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.punchclock.adapter.runner.StepwiseOrchestrator} - 단계별 상태 머신 실행기</li>
 *   <li>{@link com.ryuqq.punchclock.adapter.runner.ActionScheduler} - 일일 트리거 + 하트비트 스케줄러</li>
 *   <li>{@link com.ryuqq.punchclock.adapter.runner.OrchestratedActionTrigger} - 예약 실행 → Orchestrator 연결</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (StepwiseOrchestrator, ActionScheduler)
 *   ↓ implements
 * application (Orchestrator, ActionTrigger, PunchPage, ResultVerifier)
 *   ↓ depends on
 * core (RetryPolicy, CircuitBreaker, RunStage)
 * </pre>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
package com.ryuqq.punchclock.adapter.runner;

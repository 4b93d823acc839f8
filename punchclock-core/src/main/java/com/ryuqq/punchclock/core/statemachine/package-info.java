/**
 * Run state machine.
 *
 * <p>{@link com.ryuqq.punchclock.core.statemachine.RunStage} is the lifecycle of a single orchestration run and
 * {@link com.ryuqq.punchclock.core.statemachine.StageTransition} guards its edges.
 * {@link com.ryuqq.punchclock.core.statemachine.RunStep} names the step that failed.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.punchclock.core.statemachine;

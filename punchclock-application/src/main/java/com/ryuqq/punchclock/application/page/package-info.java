/**
 * Remote punch page steps.
 *
 * <p>{@link com.ryuqq.punchclock.application.page.PunchPage} exposes the steps the orchestrator sequences.
 * {@link com.ryuqq.punchclock.application.page.DriverPunchPage} implements them over a
 * {@link com.ryuqq.punchclock.core.spi.SessionDriver} using selectors from a
 * {@link com.ryuqq.punchclock.application.page.PageProfile}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.punchclock.application.page;

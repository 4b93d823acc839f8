/**
 * Scheduling ports: the schedule definition, the trigger callback the scheduler invokes,
 * and the lifecycle events it reports. The scheduler itself lives in the runner adapter.
 *
 * @since 1.0.0
 */
package com.ryuqq.punchclock.application.schedule;

/**
 * Confirmation gate for state-changing actions. Default is deny.
 *
 * @since 1.0.0
 */
package com.ryuqq.punchclock.application.confirmation;

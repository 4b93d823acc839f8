/**
 * Error taxonomy.
 *
 * <pre>
 * PunchClockException
 *   ├─ TerminalException      (never retried)
 *   │    ├─ CredentialRejectedException
 *   │    └─ InvalidConfigurationException
 *   ├─ TransientException     (retried, counts toward circuit breaker failures)
 *   │    ├─ DriverException
 *   │    └─ NavigationException
 *   └─ UserCancelledException (operator abort, not an error)
 * </pre>
 *
 * <p>Ambiguous verification is not an exception: it is reported through the outcome.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
package com.ryuqq.punchclock.core.error;

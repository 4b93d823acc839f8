/**
 * Service Provider Interfaces for the remote interactive session.
 *
 * @since 1.0.0
 */
package com.ryuqq.punchclock.core.spi;

/**
 * Selenium WebDriver implementation of the session driver SPI.
 *
 * <p>Selectors are CSS by default; an {@code xpath:} prefix selects XPath.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.punchclock.adapter.selenium;

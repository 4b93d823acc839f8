package com.ryuqq.punchclock.application.page;

import com.ryuqq.punchclock.application.verification.ObservedSignal;
import com.ryuqq.punchclock.application.verification.SignalRule;
import com.ryuqq.punchclock.core.error.CredentialRejectedException;
import com.ryuqq.punchclock.core.error.DriverException;
import com.ryuqq.punchclock.core.error.NavigationException;
import com.ryuqq.punchclock.core.model.Action;
import com.ryuqq.punchclock.core.model.LoginCredentials;
import com.ryuqq.punchclock.core.model.StatusSnapshot;
import com.ryuqq.punchclock.core.retry.Sleeper;
import com.ryuqq.punchclock.core.spi.SessionDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SessionDriver} 기반 {@link PunchPage} 구현.
 *
 * <p>화면 구조는 {@link PageProfile}에서 읽으며, 로직은 특정 사이트에 묶이지 않습니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class DriverPunchPage implements PunchPage {

    private static final Logger log = LoggerFactory.getLogger(DriverPunchPage.class);

    private static final Duration SETTLE_POLL_INTERVAL = Duration.ofMillis(500);

    private final SessionDriver driver;
    private final PageProfile profile;
    private final Clock clock;
    private final Sleeper sleeper;

    public DriverPunchPage(SessionDriver driver, PageProfile profile) {
        this(driver, profile, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * 생성자.
     *
     * @param driver 세션 드라이버
     * @param profile 화면 구조 설정
     * @param clock 시간 소스
     * @param sleeper 로딩 대기용 Sleeper
     */
    public DriverPunchPage(SessionDriver driver, PageProfile profile, Clock clock, Sleeper sleeper) {
        if (driver == null) {
            throw new IllegalArgumentException("driver cannot be null");
        }
        if (profile == null) {
            throw new IllegalArgumentException("profile cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.driver = driver;
        this.profile = profile;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public void authenticate(LoginCredentials credentials) {
        log.info("Opening login page: {}", profile.baseUrl());
        driver.navigateTo(profile.baseUrl());

        if (!driver.waitForElement(profile.companyIdField(), profile.elementTimeout())) {
            throw new NavigationException("login form did not load within " + profile.elementTimeout().toSeconds() + "s");
        }

        driver.type(profile.companyIdField(), credentials.companyId());
        driver.type(profile.userIdField(), credentials.userId());
        driver.type(profile.passwordField(), credentials.password());
        driver.click(profile.loginButton());
        log.info("Login submitted for user {}", credentials.userId());

        if (driver.waitForElement(profile.punchIcon(), profile.elementTimeout())
            || isPresent(profile.punchIconFallback())) {
            log.info("Login succeeded");
            return;
        }

        for (String selector : profile.loginErrorSelectors()) {
            if (driver.isVisible(selector)) {
                String text = driver.readText(selector);
                throw new CredentialRejectedException("login rejected: " + (text.isBlank() ? selector : text.trim()));
            }
        }
        throw new NavigationException("login did not reach the home page");
    }

    @Override
    public void navigateToPunchPage() {
        if (driver.waitForElement(profile.punchIcon(), profile.elementTimeout())) {
            driver.click(profile.punchIcon());
        } else if (isPresent(profile.punchIconFallback())) {
            log.info("Punch icon found with fallback selector");
            driver.click(profile.punchIconFallback());
        } else {
            throw new NavigationException("punch icon not found on home page");
        }

        if (!isPunchPage()) {
            throw new NavigationException("could not confirm arrival on the punch page");
        }

        triggerPositioning();
        waitForLoading();
        log.info("Arrived on punch page");
    }

    private boolean isPunchPage() {
        if (driver.waitForElement(profile.pageTitle(), profile.elementTimeout())
            && titleMatches()) {
            return true;
        }
        return driver.waitForElement(profile.enterButton(), profile.elementTimeout());
    }

    private boolean titleMatches() {
        String keyword = profile.pageTitleKeyword();
        return keyword == null || driver.readText(profile.pageTitle()).contains(keyword);
    }

    /**
     * 위치 확인 부가 단계. 실패는 로그만 남기고 진행합니다.
     */
    private void triggerPositioning() {
        if (profile.locateButton() == null) {
            return;
        }
        try {
            if (driver.isVisible(profile.locateButton())) {
                driver.click(profile.locateButton());
                log.info("Positioning requested");
            } else {
                log.info("Locate button not shown, skipping positioning");
            }
        } catch (DriverException e) {
            log.warn("Positioning failed, continuing without it: {}", e.getMessage());
        }
    }

    private void waitForLoading() {
        if (profile.loadingIndicator() == null) {
            return;
        }
        Instant deadline = clock.instant().plus(profile.settleTimeout());
        while (driver.isVisible(profile.loadingIndicator())) {
            if (!clock.instant().isBefore(deadline)) {
                log.warn("Loading indicator still visible after {}s, continuing", profile.settleTimeout().toSeconds());
                return;
            }
            try {
                sleeper.sleep(SETTLE_POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DriverException("interrupted while waiting for page to settle", e);
            }
        }
    }

    @Override
    public StatusSnapshot readStatus() {
        boolean pageLoaded = (driver.isVisible(profile.pageTitle()) && titleMatches())
            || driver.isVisible(profile.enterButton());
        boolean positioningReady = isPresent(profile.positioningMap());

        StatusSnapshot snapshot = new StatusSnapshot(
            isAvailable(profile.enterButton()),
            isAvailable(profile.exitButton()),
            pageLoaded,
            positioningReady,
            readOptional(profile.remoteDate()),
            readOptional(profile.remoteTime()),
            readOptional(profile.locationText()),
            clock.instant()
        );

        log.info("Punch page status: loaded={}, positioning={}, date={}, time={}, location={}, enter={}, exit={}",
            snapshot.pageLoaded(), snapshot.positioningReady(), snapshot.remoteDate(), snapshot.remoteTime(),
            snapshot.locationText(), snapshot.enterAvailable(), snapshot.exitAvailable());
        return snapshot;
    }

    private boolean isAvailable(String button) {
        return driver.isVisible(button) && driver.isEnabled(button);
    }

    private boolean isPresent(String selector) {
        return selector != null && driver.isVisible(selector);
    }

    private String readOptional(String selector) {
        if (selector == null) {
            return null;
        }
        String text = driver.readText(selector);
        return text == null || text.isBlank() ? null : text.trim();
    }

    @Override
    public void press(Action action) {
        String button = profile.buttonFor(action);
        log.info("Clicking {} button", action.displayName());
        driver.click(button);
    }

    @Override
    public List<ObservedSignal> observe(List<SignalRule> rules) {
        List<ObservedSignal> observed = new ArrayList<>();
        for (SignalRule rule : rules) {
            if (driver.isVisible(rule.selector())) {
                String text = driver.readText(rule.selector());
                observed.add(new ObservedSignal(rule, text == null ? "" : text.trim()));
            }
        }
        return observed;
    }

    @Override
    public Optional<Path> captureEvidence() {
        try {
            Path path = driver.captureScreenshot();
            log.info("Evidence screenshot saved: {}", path);
            return Optional.ofNullable(path);
        } catch (DriverException e) {
            log.warn("Evidence screenshot failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        driver.close();
    }
}

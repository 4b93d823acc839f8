package com.ryuqq.punchclock.testkit;

import com.ryuqq.punchclock.application.page.PageProfile;
import com.ryuqq.punchclock.core.error.DriverException;
import com.ryuqq.punchclock.core.spi.SessionDriver;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 스크립트로 화면을 흉내 내는 {@link SessionDriver}.
 *
 * <p>셀렉터별 요소 상태(표시/활성/텍스트)를 메모리에 두고, 클릭 반응과
 * "N번째 확인부터 표시" 같은 지연 표시를 미리 등록해 둡니다. 등록되지 않은 셀렉터는
 * 화면에 없는 요소로 취급합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedSessionDriver driver = ScriptedSessionDriver.punchSite(profile, true, false);
 * driver.onClick(profile.enterButton(), d -&gt; d.showAfterChecks(successSelector, "簽到成功", 1));
 * </pre>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ScriptedSessionDriver implements SessionDriver {

    /**
     * 클릭 시 화면 변화.
     */
    @FunctionalInterface
    public interface ClickReaction {
        void apply(ScriptedSessionDriver driver);
    }

    private static final class Element {
        boolean visible;
        boolean enabled = true;
        String text = "";
        int checks;
        int visibleFromCheck;
    }

    private final Map<String, Element> elements = new HashMap<>();
    private final Map<String, ClickReaction> reactions = new HashMap<>();
    private final Map<String, String> typed = new LinkedHashMap<>();
    private final List<String> navigations = new ArrayList<>();
    private final List<String> clicks = new ArrayList<>();
    private final List<Path> screenshots = new ArrayList<>();
    private RuntimeException navigationFailure;
    private boolean closed;

    /**
     * 로그인 → 홈 → 체크 화면까지 이어지는 기본 사이트 구성.
     *
     * @param profile 화면 구조 설정
     * @param enterAvailable 체크 화면의 출근 버튼 활성 여부
     * @param exitAvailable 체크 화면의 퇴근 버튼 활성 여부
     * @return 구성된 드라이버
     */
    public static ScriptedSessionDriver punchSite(PageProfile profile, boolean enterAvailable, boolean exitAvailable) {
        ScriptedSessionDriver driver = new ScriptedSessionDriver();
        driver.show(profile.companyIdField(), "");
        driver.show(profile.userIdField(), "");
        driver.show(profile.passwordField(), "");
        driver.show(profile.loginButton(), "登入");
        driver.onClick(profile.loginButton(), d -> d.show(profile.punchIcon(), "出勤打卡"));
        driver.onClick(profile.punchIcon(), d -> {
            d.show(profile.pageTitle(), "出勤打卡");
            d.setButton(profile.enterButton(), "簽到", enterAvailable);
            d.setButton(profile.exitButton(), "簽退", exitAvailable);
            if (profile.remoteDate() != null) {
                d.show(profile.remoteDate(), "2026/03/02");
            }
            if (profile.remoteTime() != null) {
                d.show(profile.remoteTime(), "09:00:00");
            }
        });
        return driver;
    }

    private void setButton(String selector, String label, boolean available) {
        show(selector, label);
        element(selector).enabled = available;
    }

    // ========== 스크립트 구성 ==========

    public synchronized ScriptedSessionDriver show(String selector, String text) {
        Element element = element(selector);
        element.visible = true;
        element.visibleFromCheck = 0;
        element.text = text == null ? "" : text;
        return this;
    }

    public synchronized ScriptedSessionDriver hide(String selector) {
        element(selector).visible = false;
        return this;
    }

    public synchronized ScriptedSessionDriver disable(String selector) {
        element(selector).enabled = false;
        return this;
    }

    public synchronized ScriptedSessionDriver enable(String selector) {
        element(selector).enabled = true;
        return this;
    }

    /**
     * 이 시점 이후 n번째 표시 확인부터 요소가 보이도록 설정.
     *
     * <p>결과 검증기는 한 번의 관찰에서 규칙마다 표시 여부를 한 번 확인하므로,
     * n은 검증 관찰 회차와 같습니다.</p>
     */
    public synchronized ScriptedSessionDriver showAfterChecks(String selector, String text, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1 (current: " + n + ")");
        }
        Element element = element(selector);
        element.visible = true;
        element.text = text == null ? "" : text;
        element.checks = 0;
        element.visibleFromCheck = n;
        return this;
    }

    public synchronized ScriptedSessionDriver onClick(String selector, ClickReaction reaction) {
        reactions.put(selector, reaction);
        return this;
    }

    /**
     * 다음 페이지 이동들이 모두 실패하도록 설정 (null이면 해제).
     */
    public synchronized ScriptedSessionDriver failNavigationWith(RuntimeException failure) {
        this.navigationFailure = failure;
        return this;
    }

    // ========== SessionDriver ==========

    @Override
    public synchronized void navigateTo(String url) {
        ensureOpen();
        navigations.add(url);
        if (navigationFailure != null) {
            throw navigationFailure;
        }
    }

    @Override
    public synchronized boolean waitForElement(String selector, Duration timeout) {
        ensureOpen();
        return checkVisible(selector);
    }

    @Override
    public synchronized String readText(String selector) {
        ensureOpen();
        Element element = elements.get(selector);
        if (element == null || !element.visible || element.checks < element.visibleFromCheck) {
            return "";
        }
        return element.text;
    }

    @Override
    public synchronized boolean isVisible(String selector) {
        ensureOpen();
        return checkVisible(selector);
    }

    @Override
    public synchronized boolean isEnabled(String selector) {
        ensureOpen();
        Element element = elements.get(selector);
        return element != null && element.visible && element.enabled;
    }

    @Override
    public synchronized void click(String selector) {
        ensureOpen();
        Element element = elements.get(selector);
        if (element == null || !element.visible) {
            throw new DriverException("no such element: " + selector);
        }
        clicks.add(selector);
        ClickReaction reaction = reactions.get(selector);
        if (reaction != null) {
            reaction.apply(this);
        }
    }

    @Override
    public synchronized void type(String selector, String text) {
        ensureOpen();
        if (!checkVisible(selector)) {
            throw new DriverException("no such element: " + selector);
        }
        typed.put(selector, text);
    }

    @Override
    public synchronized Path captureScreenshot() {
        ensureOpen();
        Path path = Path.of("evidence", "punch_" + (screenshots.size() + 1) + ".png");
        screenshots.add(path);
        return path;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    // ========== 검증용 조회 ==========

    public synchronized List<String> clicks() {
        return List.copyOf(clicks);
    }

    public synchronized boolean wasClicked(String selector) {
        return clicks.contains(selector);
    }

    public synchronized List<String> navigations() {
        return List.copyOf(navigations);
    }

    public synchronized Map<String, String> typed() {
        return Map.copyOf(typed);
    }

    public synchronized List<Path> screenshots() {
        return List.copyOf(screenshots);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private Element element(String selector) {
        return elements.computeIfAbsent(selector, key -> new Element());
    }

    private boolean checkVisible(String selector) {
        Element element = elements.get(selector);
        if (element == null || !element.visible) {
            return false;
        }
        element.checks++;
        return element.checks >= element.visibleFromCheck;
    }

    private void ensureOpen() {
        if (closed) {
            throw new DriverException("session already closed");
        }
    }
}

package com.ryuqq.punchclock.adapter.selenium;

import com.ryuqq.punchclock.core.error.DriverException;
import com.ryuqq.punchclock.core.spi.SessionDriver;
import org.openqa.selenium.By;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Selenium WebDriver 기반 {@link SessionDriver}.
 *
 * <p><strong>셀렉터:</strong> 기본은 CSS, {@code xpath:} 접두사가 붙으면 XPath로 해석합니다.</p>
 *
 * <p>모든 {@link WebDriverException}은 재시도 가능한 {@link DriverException}으로 바뀝니다.
 * 요소가 없을 때 {@link #isVisible}/{@link #isEnabled}는 false, {@link #readText}는 빈 문자열을 반환합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class SeleniumSessionDriver implements SessionDriver {

    private static final Logger log = LoggerFactory.getLogger(SeleniumSessionDriver.class);

    static final String XPATH_PREFIX = "xpath:";

    private static final DateTimeFormatter FILE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final WebDriver driver;
    private final Path screenshotDirectory;
    private final Clock clock;

    public SeleniumSessionDriver(WebDriver driver, Path screenshotDirectory) {
        this(driver, screenshotDirectory, Clock.system(ZoneId.systemDefault()));
    }

    /**
     * 생성자.
     *
     * @param driver WebDriver (이 객체가 소유하며 close 시 종료)
     * @param screenshotDirectory 스크린샷 저장 디렉터리 (없으면 생성)
     * @param clock 파일 이름용 시간 소스
     */
    public SeleniumSessionDriver(WebDriver driver, Path screenshotDirectory, Clock clock) {
        if (driver == null) {
            throw new IllegalArgumentException("driver cannot be null");
        }
        if (screenshotDirectory == null) {
            throw new IllegalArgumentException("screenshotDirectory cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.driver = driver;
        this.screenshotDirectory = screenshotDirectory;
        this.clock = clock;
    }

    /**
     * 셀렉터 문자열을 {@link By}로 변환.
     */
    static By toBy(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("selector cannot be null or blank");
        }
        if (selector.startsWith(XPATH_PREFIX)) {
            return By.xpath(selector.substring(XPATH_PREFIX.length()));
        }
        return By.cssSelector(selector);
    }

    @Override
    public void navigateTo(String url) {
        try {
            driver.get(url);
        } catch (WebDriverException e) {
            throw new DriverException("navigation to " + url + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public boolean waitForElement(String selector, Duration timeout) {
        By by = toBy(selector);
        try {
            new WebDriverWait(driver, timeout).until(ExpectedConditions.visibilityOfElementLocated(by));
            return true;
        } catch (TimeoutException e) {
            log.debug("Element {} not visible within {}ms", selector, timeout.toMillis());
            return false;
        } catch (WebDriverException e) {
            throw new DriverException("waiting for " + selector + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public String readText(String selector) {
        try {
            List<WebElement> elements = driver.findElements(toBy(selector));
            if (elements.isEmpty()) {
                return "";
            }
            WebElement element = elements.get(0);
            String tag = element.getTagName() == null ? "" : element.getTagName().toLowerCase(Locale.ROOT);
            String text = "input".equals(tag) || "textarea".equals(tag)
                ? element.getAttribute("value")
                : element.getText();
            return text == null ? "" : text.trim();
        } catch (StaleElementReferenceException e) {
            log.debug("Element {} went stale while reading", selector);
            return "";
        } catch (WebDriverException e) {
            throw new DriverException("reading " + selector + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public boolean isVisible(String selector) {
        try {
            List<WebElement> elements = driver.findElements(toBy(selector));
            return !elements.isEmpty() && elements.get(0).isDisplayed();
        } catch (StaleElementReferenceException e) {
            return false;
        } catch (WebDriverException e) {
            throw new DriverException("checking visibility of " + selector + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public boolean isEnabled(String selector) {
        try {
            List<WebElement> elements = driver.findElements(toBy(selector));
            return !elements.isEmpty() && elements.get(0).isEnabled();
        } catch (StaleElementReferenceException e) {
            return false;
        } catch (WebDriverException e) {
            throw new DriverException("checking state of " + selector + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public void click(String selector) {
        try {
            driver.findElement(toBy(selector)).click();
        } catch (WebDriverException e) {
            throw new DriverException("click on " + selector + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public void type(String selector, String text) {
        try {
            WebElement element = driver.findElement(toBy(selector));
            element.clear();
            element.sendKeys(text);
        } catch (WebDriverException e) {
            throw new DriverException("typing into " + selector + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public Path captureScreenshot() {
        if (!(driver instanceof TakesScreenshot)) {
            throw new DriverException("driver does not support screenshots: " + driver.getClass().getSimpleName());
        }
        try {
            byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
            Files.createDirectories(screenshotDirectory);
            Path file = screenshotDirectory.resolve("punch_" + FILE_TIME_FORMAT.format(clock.instant().atZone(clock.getZone())) + ".png");
            Files.write(file, png);
            log.info("Screenshot saved: {}", file);
            return file;
        } catch (WebDriverException e) {
            throw new DriverException("screenshot failed: " + firstLine(e), e);
        } catch (IOException e) {
            throw new DriverException("could not write screenshot to " + screenshotDirectory, e);
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
            log.debug("Browser session closed");
        } catch (WebDriverException e) {
            log.warn("Exception during browser quit: {}", firstLine(e));
        }
    }

    /**
     * Selenium 예외 메시지는 여러 줄의 환경 정보를 포함하므로 첫 줄만 사용.
     */
    private static String firstLine(WebDriverException e) {
        String message = e.getMessage();
        if (message == null) {
            return e.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}

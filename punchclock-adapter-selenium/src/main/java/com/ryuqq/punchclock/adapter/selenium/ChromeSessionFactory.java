package com.ryuqq.punchclock.adapter.selenium;

import com.ryuqq.punchclock.core.error.DriverException;
import com.ryuqq.punchclock.core.spi.SessionDriver;
import com.ryuqq.punchclock.core.spi.SessionDriverFactory;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Chrome 세션 팩토리.
 *
 * <p>드라이버 바이너리는 Selenium Manager가 찾아 준비합니다. 위치 정보 권한은 자동 허용되며,
 * 설정된 좌표가 있으면 DevTools로 위치를 고정합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ChromeSessionFactory implements SessionDriverFactory {

    private static final Logger log = LoggerFactory.getLogger(ChromeSessionFactory.class);

    private final SeleniumSessionConfig config;

    public ChromeSessionFactory(SeleniumSessionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public SessionDriver open() {
        ChromeDriver driver;
        try {
            driver = new ChromeDriver(options());
        } catch (WebDriverException e) {
            throw new DriverException("failed to start Chrome session", e);
        }

        try {
            driver.manage().timeouts().pageLoadTimeout(config.pageLoadTimeout());
            if (config.geolocation() != null) {
                driver.executeCdpCommand("Emulation.setGeolocationOverride", Map.of(
                    "latitude", config.geolocation().latitude(),
                    "longitude", config.geolocation().longitude(),
                    "accuracy", 100));
            }
        } catch (WebDriverException e) {
            driver.quit();
            throw new DriverException("failed to configure Chrome session", e);
        }

        log.info("Chrome session started (headless={})", config.headless());
        return new SeleniumSessionDriver(driver, config.screenshotDirectory());
    }

    ChromeOptions options() {
        ChromeOptions options = new ChromeOptions();
        if (config.headless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=1280,900",
            "--use-fake-ui-for-media-stream"
        );
        options.setExperimentalOption("prefs", Map.of("profile.default_content_setting_values.geolocation", 1));
        return options;
    }
}

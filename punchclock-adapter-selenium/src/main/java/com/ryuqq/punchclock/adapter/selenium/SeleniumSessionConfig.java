package com.ryuqq.punchclock.adapter.selenium;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Chrome 세션 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>headless: 화면 없이 실행 (기본 true)</li>
 *   <li>screenshotDirectory: 스크린샷 저장 위치 (기본 ./screenshots)</li>
 *   <li>pageLoadTimeout: 페이지 로딩 제한 (기본 30초)</li>
 *   <li>geolocation: 위치 정보 고정값 (기본 위도 25, 경도 121, null이면 고정하지 않음)</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param headless 헤드리스 실행 여부
 * @param screenshotDirectory 스크린샷 디렉터리
 * @param pageLoadTimeout 페이지 로딩 제한 (양수)
 * @param geolocation 위치 고정값 (null 허용)
 */
public record SeleniumSessionConfig(
    boolean headless,
    Path screenshotDirectory,
    Duration pageLoadTimeout,
    GeoLocation geolocation
) {

    public SeleniumSessionConfig() {
        this(true, Path.of("screenshots"), Duration.ofSeconds(30), new GeoLocation(25.0, 121.0));
    }

    public SeleniumSessionConfig {
        if (screenshotDirectory == null) {
            throw new IllegalArgumentException("screenshotDirectory cannot be null");
        }
        if (pageLoadTimeout == null || pageLoadTimeout.isNegative() || pageLoadTimeout.isZero()) {
            throw new IllegalArgumentException(
                "pageLoadTimeout must be positive (current: " + pageLoadTimeout + ")"
            );
        }
    }

    public SeleniumSessionConfig withHeadless(boolean headless) {
        return new SeleniumSessionConfig(headless, screenshotDirectory, pageLoadTimeout, geolocation);
    }

    public SeleniumSessionConfig withScreenshotDirectory(Path screenshotDirectory) {
        return new SeleniumSessionConfig(headless, screenshotDirectory, pageLoadTimeout, geolocation);
    }

    public SeleniumSessionConfig withGeolocation(GeoLocation geolocation) {
        return new SeleniumSessionConfig(headless, screenshotDirectory, pageLoadTimeout, geolocation);
    }

    /**
     * 브라우저에 알려줄 위치.
     *
     * @param latitude 위도 (-90 ~ 90)
     * @param longitude 경도 (-180 ~ 180)
     */
    public record GeoLocation(double latitude, double longitude) {

        public GeoLocation {
            if (latitude < -90 || latitude > 90) {
                throw new IllegalArgumentException("latitude must be between -90 and 90 (current: " + latitude + ")");
            }
            if (longitude < -180 || longitude > 180) {
                throw new IllegalArgumentException("longitude must be between -180 and 180 (current: " + longitude + ")");
            }
        }
    }
}

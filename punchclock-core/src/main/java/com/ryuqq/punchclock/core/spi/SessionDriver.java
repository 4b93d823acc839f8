package com.ryuqq.punchclock.core.spi;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 원격 대화형 세션(브라우저 자동화) 드라이버 SPI.
 *
 * <p>모든 메서드는 실패 시 {@link com.ryuqq.punchclock.core.error.DriverException}을 던질 수 있으며,
 * 이는 재시도 가능한 오류로 분류됩니다.</p>
 *
 * <p><strong>셀렉터 형식:</strong> 구현체가 해석합니다 (Selenium 구현은 기본 CSS, {@code xpath:} 접두사는 XPath).</p>
 *
 * <p><strong>소유권:</strong> 세션은 한 번에 하나의 실행만 사용하는 배타적 자원이며,
 * 실행이 끝나면 {@link #close()}로 반드시 해제해야 합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public interface SessionDriver extends AutoCloseable {

    /**
     * URL로 이동.
     *
     * @param url 대상 URL
     */
    void navigateTo(String url);

    /**
     * 요소가 나타날 때까지 대기.
     *
     * @param selector 셀렉터
     * @param timeout 최대 대기 시간
     * @return 제한 시간 내 요소가 나타나면 true
     */
    boolean waitForElement(String selector, Duration timeout);

    /**
     * 요소의 텍스트 읽기. 입력 요소는 입력값을 반환합니다.
     *
     * @param selector 셀렉터
     * @return 텍스트 (요소가 없으면 빈 문자열)
     */
    String readText(String selector);

    /**
     * 요소 표시 여부.
     *
     * @param selector 셀렉터
     * @return 존재하고 표시되면 true
     */
    boolean isVisible(String selector);

    /**
     * 요소 활성화 여부.
     *
     * @param selector 셀렉터
     * @return 존재하고 활성화되어 있으면 true
     */
    boolean isEnabled(String selector);

    /**
     * 요소 클릭.
     *
     * @param selector 셀렉터
     */
    void click(String selector);

    /**
     * 입력 요소에 텍스트 입력 (기존 값은 지움).
     *
     * @param selector 셀렉터
     * @param text 입력할 텍스트
     */
    void type(String selector, String text);

    /**
     * 현재 화면 스크린샷 저장.
     *
     * @return 저장된 파일 경로
     */
    Path captureScreenshot();

    /**
     * 세션 종료. 예외를 던지지 않습니다.
     */
    @Override
    void close();
}

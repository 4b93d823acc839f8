package com.ryuqq.punchclock.application.page;

import com.ryuqq.punchclock.core.model.Action;

import java.time.Duration;
import java.util.List;

/**
 * 대상 웹 애플리케이션의 화면 구조 설정 (셀렉터와 URL).
 *
 * <p>셀렉터는 {@link com.ryuqq.punchclock.core.spi.SessionDriver} 구현이 해석하는 문자열입니다.
 * 텍스트 기반 요소는 {@code xpath:} 접두사를 사용합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param baseUrl 로그인 페이지 URL
 * @param companyIdField 회사 코드 입력란
 * @param userIdField 사용자 ID 입력란
 * @param passwordField 비밀번호 입력란
 * @param loginButton 로그인 버튼
 * @param loginErrorSelectors 로그인 거부 메시지 후보
 * @param punchIcon 홈 화면의 출근 체크 아이콘
 * @param punchIconFallback 아이콘 대체 셀렉터
 * @param pageTitle 화면 제목
 * @param pageTitleKeyword 체크 화면 제목에 포함되는 단어
 * @param positioningMap 위치 확인 지도
 * @param locateButton 위치 재확인 버튼
 * @param loadingIndicator 로딩 표시
 * @param remoteDate 원격 화면의 날짜
 * @param remoteTime 원격 화면의 시각
 * @param locationText 위치 주소 입력란
 * @param enterButton 출근(ENTER) 버튼
 * @param exitButton 퇴근(EXIT) 버튼
 * @param elementTimeout 요소 대기 시간
 * @param settleTimeout 로딩 표시가 사라지기를 기다리는 최대 시간
 */
public record PageProfile(
    String baseUrl,
    String companyIdField,
    String userIdField,
    String passwordField,
    String loginButton,
    List<String> loginErrorSelectors,
    String punchIcon,
    String punchIconFallback,
    String pageTitle,
    String pageTitleKeyword,
    String positioningMap,
    String locateButton,
    String loadingIndicator,
    String remoteDate,
    String remoteTime,
    String locationText,
    String enterButton,
    String exitButton,
    Duration elementTimeout,
    Duration settleTimeout
) {

    public PageProfile {
        requireText(baseUrl, "baseUrl");
        requireText(companyIdField, "companyIdField");
        requireText(userIdField, "userIdField");
        requireText(passwordField, "passwordField");
        requireText(loginButton, "loginButton");
        requireText(punchIcon, "punchIcon");
        requireText(pageTitle, "pageTitle");
        requireText(enterButton, "enterButton");
        requireText(exitButton, "exitButton");
        loginErrorSelectors = loginErrorSelectors == null ? List.of() : List.copyOf(loginErrorSelectors);
        if (elementTimeout == null || elementTimeout.isNegative() || elementTimeout.isZero()) {
            throw new IllegalArgumentException(
                "elementTimeout must be positive (current: " + elementTimeout + ")"
            );
        }
        if (settleTimeout == null || settleTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "settleTimeout must be non-negative (current: " + settleTimeout + ")"
            );
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    /**
     * AOA Cloud 근태 화면 기본 설정.
     */
    public static PageProfile aoaCloud() {
        return new PageProfile(
            "https://erpline.aoacloud.com.tw",
            "input[name=\"CompId\"]",
            "input[name=\"UserId\"]",
            "input[name=\"Passwd\"]",
            "xpath://button[contains(normalize-space(.),'登入')]",
            List.of(
                "xpath://*[contains(text(),'帳號或密碼錯誤')]",
                "xpath://*[contains(text(),'登入失敗')]",
                ".error-message",
                ".alert-danger"
            ),
            "xpath://ion-col[.//p[contains(text(),'出勤打卡')]]",
            "img[src*=\"home_01\"]",
            ".toolbar-title",
            "打卡",
            "#divImap iframe",
            "ion-fab button[ion-fab]",
            "ion-loading",
            "xpath:(//*[contains(concat(' ',normalize-space(@class),' '),' date ')])[1]",
            "xpath:(//*[contains(concat(' ',normalize-space(@class),' '),' date ')])[2]",
            "#addressDiv ion-input input",
            "xpath://button[contains(normalize-space(.),'簽到')]",
            "xpath://button[contains(normalize-space(.),'簽退')]",
            Duration.ofSeconds(10),
            Duration.ofSeconds(10)
        );
    }

    /**
     * 동작별 버튼 셀렉터.
     *
     * @throws IllegalArgumentException SIMULATE인 경우
     */
    public String buttonFor(Action action) {
        return switch (action) {
            case ENTER -> enterButton;
            case EXIT -> exitButton;
            case SIMULATE -> throw new IllegalArgumentException("SIMULATE has no button");
        };
    }

    public PageProfile withBaseUrl(String baseUrl) {
        return new PageProfile(baseUrl, companyIdField, userIdField, passwordField, loginButton,
            loginErrorSelectors, punchIcon, punchIconFallback, pageTitle, pageTitleKeyword, positioningMap,
            locateButton, loadingIndicator, remoteDate, remoteTime, locationText, enterButton, exitButton,
            elementTimeout, settleTimeout);
    }

    public PageProfile withElementTimeout(Duration elementTimeout) {
        return new PageProfile(baseUrl, companyIdField, userIdField, passwordField, loginButton,
            loginErrorSelectors, punchIcon, punchIconFallback, pageTitle, pageTitleKeyword, positioningMap,
            locateButton, loadingIndicator, remoteDate, remoteTime, locationText, enterButton, exitButton,
            elementTimeout, settleTimeout);
    }

    public PageProfile withSettleTimeout(Duration settleTimeout) {
        return new PageProfile(baseUrl, companyIdField, userIdField, passwordField, loginButton,
            loginErrorSelectors, punchIcon, punchIconFallback, pageTitle, pageTitleKeyword, positioningMap,
            locateButton, loadingIndicator, remoteDate, remoteTime, locationText, enterButton, exitButton,
            elementTimeout, settleTimeout);
    }
}

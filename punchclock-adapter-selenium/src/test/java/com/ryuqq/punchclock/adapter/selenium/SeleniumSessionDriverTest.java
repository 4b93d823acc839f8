package com.ryuqq.punchclock.adapter.selenium;

import com.ryuqq.punchclock.core.error.DriverException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

/**
 * SeleniumSessionDriver 테스트.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
class SeleniumSessionDriverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T01:00:00.123Z"), ZoneId.of("Asia/Taipei"));

    @TempDir
    Path screenshots;

    private WebDriver webDriver;
    private SeleniumSessionDriver driver;

    @BeforeEach
    void setUp() {
        webDriver = mock(WebDriver.class, withSettings().extraInterfaces(TakesScreenshot.class));
        driver = new SeleniumSessionDriver(webDriver, screenshots, CLOCK);
    }

    // ========== 셀렉터 ==========

    @Test
    void 접두사_없는_셀렉터는_CSS로_해석된다() {
        assertThat(SeleniumSessionDriver.toBy("#btnPunch")).isEqualTo(By.cssSelector("#btnPunch"));
    }

    @Test
    void xpath_접두사는_XPath로_해석된다() {
        assertThat(SeleniumSessionDriver.toBy("xpath://button[text()='上班']"))
            .isEqualTo(By.xpath("//button[text()='上班']"));
    }

    @Test
    void 빈_셀렉터는_거부된다() {
        assertThatThrownBy(() -> SeleniumSessionDriver.toBy(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== 읽기 ==========

    @Test
    void readText_요소가_없으면_빈_문자열() {
        // given
        when(webDriver.findElements(By.cssSelector(".status"))).thenReturn(List.of());

        // when & then
        assertThat(driver.readText(".status")).isEmpty();
    }

    @Test
    void readText_일반_요소는_텍스트를_trim해서_반환한다() {
        // given
        WebElement element = mock(WebElement.class);
        when(element.getTagName()).thenReturn("span");
        when(element.getText()).thenReturn("  已上班  ");
        when(webDriver.findElements(By.cssSelector(".status"))).thenReturn(List.of(element));

        // when & then
        assertThat(driver.readText(".status")).isEqualTo("已上班");
    }

    @Test
    void readText_input_요소는_value_속성을_읽는다() {
        // given
        WebElement element = mock(WebElement.class);
        when(element.getTagName()).thenReturn("INPUT");
        when(element.getAttribute("value")).thenReturn("u001");
        when(webDriver.findElements(By.cssSelector("#account"))).thenReturn(List.of(element));

        // when & then
        assertThat(driver.readText("#account")).isEqualTo("u001");
    }

    @Test
    void isVisible_stale_요소는_false() {
        // given
        WebElement element = mock(WebElement.class);
        when(element.isDisplayed()).thenThrow(new StaleElementReferenceException("stale"));
        when(webDriver.findElements(By.cssSelector("#btnPunch"))).thenReturn(List.of(element));

        // when & then
        assertThat(driver.isVisible("#btnPunch")).isFalse();
    }

    @Test
    void isEnabled_요소_상태를_따른다() {
        // given
        WebElement element = mock(WebElement.class);
        when(element.isEnabled()).thenReturn(true);
        when(webDriver.findElements(By.cssSelector("#btnPunch"))).thenReturn(List.of(element));

        // when & then
        assertThat(driver.isEnabled("#btnPunch")).isTrue();
        assertThat(driver.isEnabled("#missing")).isFalse();
    }

    // ========== 조작 ==========

    @Test
    void type_기존_값을_지우고_입력한다() {
        // given
        WebElement element = mock(WebElement.class);
        when(webDriver.findElement(By.cssSelector("#password"))).thenReturn(element);

        // when
        driver.type("#password", "s3cret");

        // then
        InOrder order = inOrder(element);
        order.verify(element).clear();
        order.verify(element).sendKeys("s3cret");
    }

    @Test
    void click_요소가_없으면_DriverException() {
        // given
        when(webDriver.findElement(By.cssSelector("#btnPunch")))
            .thenThrow(new NoSuchElementException("no such element\nBuild info: ..."));

        // when & then
        assertThatThrownBy(() -> driver.click("#btnPunch"))
            .isInstanceOf(DriverException.class)
            .hasMessage("click on #btnPunch failed: no such element");
    }

    @Test
    void navigateTo_실패는_DriverException으로_변환된다() {
        // given
        doThrow(new WebDriverException("net::ERR_NAME_NOT_RESOLVED")).when(webDriver).get("https://hr.example.com");

        // when & then
        assertThatThrownBy(() -> driver.navigateTo("https://hr.example.com"))
            .isInstanceOf(DriverException.class)
            .hasMessageStartingWith("navigation to https://hr.example.com failed");
    }

    // ========== 스크린샷 / 종료 ==========

    @Test
    void 스크린샷은_시각_기반_파일명으로_저장된다() throws Exception {
        // given
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(((TakesScreenshot) webDriver).getScreenshotAs(OutputType.BYTES)).thenReturn(png);

        // when
        Path file = driver.captureScreenshot();

        // then
        assertThat(file.getFileName().toString()).isEqualTo("punch_20260302_090000_123.png");
        assertThat(Files.readAllBytes(file)).isEqualTo(png);
    }

    @Test
    void 스크린샷을_지원하지_않는_드라이버는_DriverException() {
        // given
        SeleniumSessionDriver plain = new SeleniumSessionDriver(mock(WebDriver.class), screenshots, CLOCK);

        // when & then
        assertThatThrownBy(plain::captureScreenshot).isInstanceOf(DriverException.class);
    }

    @Test
    void close_quit_실패는_무시된다() {
        // given
        doThrow(new WebDriverException("session already gone")).when(webDriver).quit();

        // when & then
        assertThatCode(driver::close).doesNotThrowAnyException();
        verify(webDriver).quit();
    }
}

package com.ryuqq.punchclock.application.page;

import com.ryuqq.punchclock.core.error.DriverException;
import com.ryuqq.punchclock.core.spi.SessionDriver;
import com.ryuqq.punchclock.core.spi.SessionDriverFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * DriverPunchPageFactory 테스트.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
class DriverPunchPageFactoryTest {

    @Test
    void open_호출마다_새_세션을_감싼다() throws Exception {
        // given
        SessionDriver driver = mock(SessionDriver.class);
        DriverPunchPageFactory factory = new DriverPunchPageFactory(() -> driver, PageProfile.aoaCloud());

        // when
        PunchPage page = factory.open();
        page.close();

        // then
        assertThat(page).isInstanceOf(DriverPunchPage.class);
        verify(driver).close();
    }

    @Test
    void 세션_생성_실패는_그대로_전파된다() {
        // given
        SessionDriverFactory failing = () -> {
            throw new DriverException("chrome failed to start");
        };
        DriverPunchPageFactory factory = new DriverPunchPageFactory(failing, PageProfile.aoaCloud());

        // when & then
        assertThatThrownBy(factory::open)
            .isInstanceOf(DriverException.class)
            .hasMessage("chrome failed to start");
    }

    @Test
    void null_인자는_거부된다() {
        assertThatThrownBy(() -> new DriverPunchPageFactory(null, PageProfile.aoaCloud()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DriverPunchPageFactory(() -> null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.ryuqq.punchclock.application.page;

import com.ryuqq.punchclock.core.spi.SessionDriverFactory;

/**
 * 세션 드라이버를 열어 {@link DriverPunchPage}로 감싸는 팩토리.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class DriverPunchPageFactory implements PunchPageFactory {

    private final SessionDriverFactory driverFactory;
    private final PageProfile profile;

    public DriverPunchPageFactory(SessionDriverFactory driverFactory, PageProfile profile) {
        if (driverFactory == null) {
            throw new IllegalArgumentException("driverFactory cannot be null");
        }
        if (profile == null) {
            throw new IllegalArgumentException("profile cannot be null");
        }
        this.driverFactory = driverFactory;
        this.profile = profile;
    }

    @Override
    public PunchPage open() {
        return new DriverPunchPage(driverFactory.open(), profile);
    }
}

package com.ryuqq.punchclock.core.spi;

/**
 * 실행마다 새 {@link SessionDriver}를 여는 팩토리.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SessionDriverFactory {

    /**
     * 새 세션 열기.
     *
     * @return 새 세션 (호출자가 닫아야 함)
     * @throws com.ryuqq.punchclock.core.error.DriverException 세션 생성 실패 시
     */
    SessionDriver open();
}

package com.ryuqq.punchclock.application.page;

/**
 * 실행마다 새 세션을 열어 {@link PunchPage}를 제공하는 팩토리.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PunchPageFactory {

    /**
     * 새 세션 열기.
     *
     * @return 새 화면 조작 객체 (호출자가 닫아야 함)
     * @throws com.ryuqq.punchclock.core.error.DriverException 세션 생성 실패 시
     */
    PunchPage open();
}

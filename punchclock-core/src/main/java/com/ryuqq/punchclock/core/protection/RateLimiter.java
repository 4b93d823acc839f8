package com.ryuqq.punchclock.core.protection;

/**
 * 호출 간 최소 간격을 강제하는 Rate Limiter SPI.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 호출 허가 획득. 필요하면 대기합니다.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void acquire() throws InterruptedException;
}

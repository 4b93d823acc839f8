package com.ryuqq.punchclock.core.retry;

import java.time.Duration;

/**
 * 대기 추상화.
 *
 * <p>재시도 백오프, 폴링 간격, Rate Limit 대기에 사용됩니다.
 * 테스트에서는 실제로 대기하지 않고 요청된 시간을 기록하는 구현을 주입합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정된 시간만큼 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 구현.
     *
     * @return 시스템 Sleeper
     */
    static Sleeper system() {
        return duration -> {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}

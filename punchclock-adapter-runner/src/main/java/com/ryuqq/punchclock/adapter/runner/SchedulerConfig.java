package com.ryuqq.punchclock.adapter.runner;

import java.time.Duration;
import java.time.ZoneId;

/**
 * ActionScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>zone: 예약 시각 해석 기준 시간대 (기본 Asia/Taipei)</li>
 *   <li>misfireGracePeriod: 예정 시각을 놓친 실행을 허용하는 최대 지연 (기본 30초)</li>
 *   <li>workerThreads: 예약/하트비트 스레드 수 (기본 2)</li>
 * </ul>
 *
 * @author PunchClock Team
 * @since 1.0.0
 * @param zone 시간대
 * @param misfireGracePeriod 지연 허용 시간 (0 이상)
 * @param workerThreads 스레드 수 (1 이상)
 */
public record SchedulerConfig(
    ZoneId zone,
    Duration misfireGracePeriod,
    int workerThreads
) {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("Asia/Taipei");

    /**
     * 기본 설정 생성자.
     */
    public SchedulerConfig() {
        this(DEFAULT_ZONE, Duration.ofSeconds(30), 2);
    }

    public SchedulerConfig {
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        if (misfireGracePeriod == null || misfireGracePeriod.isNegative()) {
            throw new IllegalArgumentException(
                "misfireGracePeriod must be non-negative (current: " + misfireGracePeriod + ")"
            );
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException(
                "workerThreads must be positive (current: " + workerThreads + ")"
            );
        }
    }

    public SchedulerConfig withZone(ZoneId zone) {
        return new SchedulerConfig(zone, misfireGracePeriod, workerThreads);
    }

    public SchedulerConfig withMisfireGracePeriod(Duration misfireGracePeriod) {
        return new SchedulerConfig(zone, misfireGracePeriod, workerThreads);
    }

    public SchedulerConfig withWorkerThreads(int workerThreads) {
        return new SchedulerConfig(zone, misfireGracePeriod, workerThreads);
    }
}

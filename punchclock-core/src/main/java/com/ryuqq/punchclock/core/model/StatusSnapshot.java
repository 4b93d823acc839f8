package com.ryuqq.punchclock.core.model;

import java.time.Instant;

/**
 * 출퇴근 화면의 상태 스냅샷.
 *
 * <p>두 동작의 가용성과 표시용 정보(원격 날짜/시각, 위치 텍스트)를 고정된 형태로 담습니다.
 * 상태 비교 휴리스틱이 타입 안전하게 동작하도록 열린 Map 대신 record를 사용합니다.</p>
 *
 * @param enterAvailable 출근 버튼 가용 여부 (보이고 활성화됨)
 * @param exitAvailable 퇴근 버튼 가용 여부 (보이고 활성화됨)
 * @param pageLoaded 출퇴근 화면 로드 확인 여부
 * @param positioningReady 보조 위치 신호(지도) 로드 여부
 * @param remoteDate 원격 화면의 날짜 텍스트 (null 가능)
 * @param remoteTime 원격 화면의 시각 텍스트 (null 가능)
 * @param locationText 위치 텍스트 (null 가능)
 * @param capturedAt 스냅샷 생성 시각
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public record StatusSnapshot(
    boolean enterAvailable,
    boolean exitAvailable,
    boolean pageLoaded,
    boolean positioningReady,
    String remoteDate,
    String remoteTime,
    String locationText,
    Instant capturedAt
) {

    public StatusSnapshot {
        if (capturedAt == null) {
            throw new IllegalArgumentException("capturedAt cannot be null");
        }
    }

    /**
     * 동작 가용성 조회.
     *
     * @param action ENTER 또는 EXIT
     * @return 해당 동작 버튼이 사용 가능한 경우 true
     * @throws IllegalArgumentException SIMULATE인 경우
     */
    public boolean isAvailable(Action action) {
        return switch (action) {
            case ENTER -> enterAvailable;
            case EXIT -> exitAvailable;
            case SIMULATE -> throw new IllegalArgumentException(
                "availability is only defined for real actions (current: " + action + ")");
        };
    }

    /**
     * 하나 이상의 동작이 사용 가능한지 확인.
     */
    public boolean anyAvailable() {
        return enterAvailable || exitAvailable;
    }
}

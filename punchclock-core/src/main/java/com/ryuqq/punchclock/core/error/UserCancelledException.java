package com.ryuqq.punchclock.core.error;

/**
 * 운영자가 확인 대기 중 실행을 중단함 ("quit").
 *
 * <p>재시도하지 않으며, 실행은 사용자 취소 결과로 종료됩니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class UserCancelledException extends PunchClockException {

    public UserCancelledException(String message) {
        super(message);
    }

    @Override
    public ErrorClassification classification() {
        return ErrorClassification.CANCELLED;
    }
}

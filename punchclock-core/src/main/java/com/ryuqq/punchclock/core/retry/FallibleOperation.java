package com.ryuqq.punchclock.core.retry;

/**
 * 입력 없이 실행되는 실패 가능한 단일 작업.
 *
 * @param <T> 결과 타입
 * @author PunchClock Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FallibleOperation<T> {

    /**
     * 작업 실행.
     *
     * @return 결과
     * @throws Exception 작업 실패 시
     */
    T run() throws Exception;
}

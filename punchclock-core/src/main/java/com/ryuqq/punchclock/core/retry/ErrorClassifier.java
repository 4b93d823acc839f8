package com.ryuqq.punchclock.core.retry;

import com.ryuqq.punchclock.core.error.ErrorClassification;
import com.ryuqq.punchclock.core.error.PunchClockException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 오류 분류기.
 *
 * <p>분류는 지연 계산보다 먼저 수행되며, TERMINAL로 분류된 오류는 재시도하지 않습니다.</p>
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ol>
 *   <li>{@link PunchClockException}: 예외가 가진 분류를 그대로 사용</li>
 *   <li>잘못된 입력 계열 ({@link IllegalArgumentException}, {@link NullPointerException},
 *       {@link ClassCastException}, {@link UnsupportedOperationException}): TERMINAL</li>
 *   <li>{@link InterruptedException}: TERMINAL (종료 중이므로 재시도하지 않음)</li>
 *   <li>{@link ExecutionException}/{@link CompletionException}: 원인 예외로 재분류</li>
 *   <li>그 외 (타임아웃, I/O, 알 수 없는 런타임 오류): TRANSIENT</li>
 * </ol>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ErrorClassifier {

    /**
     * 오류 분류.
     *
     * @param error 발생한 오류
     * @return 분류 결과
     * @throws IllegalArgumentException error가 null인 경우
     */
    public ErrorClassification classify(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (error instanceof PunchClockException) {
            return ((PunchClockException) error).classification();
        }
        if ((error instanceof ExecutionException || error instanceof CompletionException) && error.getCause() != null) {
            return classify(error.getCause());
        }
        if (error instanceof IllegalArgumentException
            || error instanceof NullPointerException
            || error instanceof ClassCastException
            || error instanceof UnsupportedOperationException
            || error instanceof InterruptedException) {
            return ErrorClassification.TERMINAL;
        }
        return ErrorClassification.TRANSIENT;
    }
}

package com.ryuqq.punchclock.core.retry;

import com.ryuqq.punchclock.core.error.CredentialRejectedException;
import com.ryuqq.punchclock.core.error.DriverException;
import com.ryuqq.punchclock.core.error.InvalidConfigurationException;
import com.ryuqq.punchclock.core.error.UserCancelledException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static com.ryuqq.punchclock.core.error.ErrorClassification.CANCELLED;
import static com.ryuqq.punchclock.core.error.ErrorClassification.TERMINAL;
import static com.ryuqq.punchclock.core.error.ErrorClassification.TRANSIENT;
import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void 도메인_예외는_자신의_분류를_사용() {
        assertThat(classifier.classify(new CredentialRejectedException("bad password"))).isEqualTo(TERMINAL);
        assertThat(classifier.classify(new InvalidConfigurationException("missing USER_ID"))).isEqualTo(TERMINAL);
        assertThat(classifier.classify(new DriverException("stale element"))).isEqualTo(TRANSIENT);
        assertThat(classifier.classify(new UserCancelledException("quit"))).isEqualTo(CANCELLED);
    }

    @Test
    void 잘못된_입력_계열은_TERMINAL() {
        assertThat(classifier.classify(new IllegalArgumentException("x"))).isEqualTo(TERMINAL);
        assertThat(classifier.classify(new NullPointerException())).isEqualTo(TERMINAL);
        assertThat(classifier.classify(new InterruptedException())).isEqualTo(TERMINAL);
    }

    @Test
    void 타임아웃과_IO_오류_및_알수없는_오류는_TRANSIENT() {
        assertThat(classifier.classify(new TimeoutException())).isEqualTo(TRANSIENT);
        assertThat(classifier.classify(new IOException("connection reset"))).isEqualTo(TRANSIENT);
        assertThat(classifier.classify(new IllegalStateException("weird"))).isEqualTo(TRANSIENT);
    }

    @Test
    void ExecutionException은_원인으로_재분류() {
        assertThat(classifier.classify(new ExecutionException(new CredentialRejectedException("no"))))
            .isEqualTo(TERMINAL);
        assertThat(classifier.classify(new ExecutionException(new IOException("io"))))
            .isEqualTo(TRANSIENT);
    }
}

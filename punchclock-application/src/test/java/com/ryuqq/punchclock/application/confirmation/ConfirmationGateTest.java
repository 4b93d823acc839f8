package com.ryuqq.punchclock.application.confirmation;

import com.ryuqq.punchclock.core.error.UserCancelledException;
import com.ryuqq.punchclock.core.model.Action;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ConfirmationGate 테스트.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ConfirmationGateTest {

    @Mock
    private ConfirmationPrompt prompt;

    @ParameterizedTest
    @EnumSource(Action.class)
    @DisplayName("비대화형이고 사전 승인이 없으면 모든 동작을 거부한다")
    void authorize_기본값은_거부(Action action) {
        ConfirmationGate gate = new ConfirmationGate(prompt);

        assertThat(gate.authorize(action, false, false)).isFalse();
        verifyNoInteractions(prompt);
    }

    @Test
    void authorize_사전_승인이면_묻지_않고_승인() {
        ConfirmationGate gate = new ConfirmationGate(prompt);

        assertThat(gate.authorize(Action.ENTER, true, true)).isTrue();
        assertThat(gate.authorize(Action.EXIT, false, true)).isTrue();
        verifyNoInteractions(prompt);
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", "YES", "  yes  "})
    void authorize_정확히_yes면_승인(String answer) throws IOException {
        when(prompt.ask(anyString())).thenReturn(answer);

        assertThat(new ConfirmationGate(prompt).authorize(Action.ENTER, true, false)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"y", "no", "", "yes please", "ok"})
    void authorize_yes가_아니면_거부(String answer) throws IOException {
        when(prompt.ask(anyString())).thenReturn(answer);

        assertThat(new ConfirmationGate(prompt).authorize(Action.EXIT, true, false)).isFalse();
    }

    @Test
    void authorize_입력이_끝났으면_거부() throws IOException {
        when(prompt.ask(anyString())).thenReturn(null);

        assertThat(new ConfirmationGate(prompt).authorize(Action.ENTER, true, false)).isFalse();
    }

    @Test
    void authorize_입력_오류는_거부() throws IOException {
        when(prompt.ask(anyString())).thenThrow(new IOException("stdin closed"));

        assertThat(new ConfirmationGate(prompt).authorize(Action.ENTER, true, false)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"quit", "q", "QUIT"})
    void authorize_quit은_실행_중단(String answer) throws IOException {
        when(prompt.ask(anyString())).thenReturn(answer);

        assertThatThrownBy(() -> new ConfirmationGate(prompt).authorize(Action.ENTER, true, false))
            .isInstanceOf(UserCancelledException.class);
    }

    @Test
    void nonInteractive_게이트는_대화형_요청도_거부() {
        assertThat(ConfirmationGate.nonInteractive().authorize(Action.ENTER, true, false)).isFalse();
    }
}

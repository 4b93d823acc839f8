package com.ryuqq.punchclock.application.confirmation;

import java.io.IOException;

/**
 * 운영자에게 한 줄 응답을 받는 프롬프트 SPI.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConfirmationPrompt {

    /**
     * 질문을 출력하고 응답 한 줄을 읽음.
     *
     * @param question 질문
     * @return 응답 (입력이 끝났으면 null)
     * @throws IOException 입력을 읽을 수 없는 경우
     */
    String ask(String question) throws IOException;
}

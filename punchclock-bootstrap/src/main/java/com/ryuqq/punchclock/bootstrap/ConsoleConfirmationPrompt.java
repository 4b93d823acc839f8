package com.ryuqq.punchclock.bootstrap;

import com.ryuqq.punchclock.application.confirmation.ConfirmationPrompt;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * 표준 입출력 기반 확인 프롬프트.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ConsoleConfirmationPrompt implements ConfirmationPrompt {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationPrompt() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleConfirmationPrompt(BufferedReader in, PrintStream out) {
        if (in == null) {
            throw new IllegalArgumentException("in cannot be null");
        }
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.in = in;
        this.out = out;
    }

    @Override
    public String ask(String question) throws IOException {
        out.print(question);
        out.flush();
        return in.readLine();
    }
}

package com.ryuqq.punchclock.testkit;

import com.ryuqq.punchclock.application.confirmation.ConfirmationPrompt;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 미리 정한 응답을 순서대로 돌려주는 {@link ConfirmationPrompt}.
 *
 * <p>응답이 소진되면 입력 종료(null)로 응답합니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class ScriptedConfirmationPrompt implements ConfirmationPrompt {

    private final Deque<String> answers;
    private final List<String> questions = new CopyOnWriteArrayList<>();

    public ScriptedConfirmationPrompt(String... answers) {
        this.answers = new ArrayDeque<>(Arrays.asList(answers));
    }

    @Override
    public synchronized String ask(String question) {
        questions.add(question);
        return answers.pollFirst();
    }

    public List<String> questions() {
        return List.copyOf(questions);
    }
}

package com.tenantoptions.database.testing;

import com.tenantoptions.database.OperatorConsole;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * {@link OperatorConsole} that records every line and answers prompts from a script.
 *
 * <pre>{@code
 * var console = new RecordingConsole().answering(true, false);
 * generator.generate(request, console);
 * assertThat(console.lines()).contains("Migration created: ...");
 * }</pre>
 */
public final class RecordingConsole implements OperatorConsole {

    private final List<String> lines = new ArrayList<>();
    private final List<String> questions = new ArrayList<>();
    private final Deque<Boolean> answers = new ArrayDeque<>();

    /** Queues answers for upcoming prompts; unanswered prompts get no. */
    public RecordingConsole answering(Boolean... replies) {
        answers.addAll(List.of(replies));
        return this;
    }

    @Override
    public void info(String message) {
        lines.add(message);
    }

    @Override
    public void success(String message) {
        lines.add(message);
    }

    @Override
    public void warning(String message) {
        lines.add("WARNING: " + message);
    }

    @Override
    public void error(String message) {
        lines.add("ERROR: " + message);
    }

    @Override
    public boolean confirm(String question) {
        questions.add(question);
        return !answers.isEmpty() && answers.poll();
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }

    public List<String> questions() {
        return List.copyOf(questions);
    }

    /** All recorded lines joined with newlines. */
    public String output() {
        return String.join("\n", lines);
    }
}

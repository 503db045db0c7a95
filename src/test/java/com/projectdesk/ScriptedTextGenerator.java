package com.projectdesk;

import com.projectdesk.providers.GenerationContext;
import com.projectdesk.providers.TextGenerator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Replays canned replies in order and records every prompt it was given.
 */
public class ScriptedTextGenerator implements TextGenerator {

    private final Deque<String> replies = new ArrayDeque<>();
    private final List<String> prompts = new ArrayList<>();
    private RuntimeException failure;

    public ScriptedTextGenerator(String... replies) {
        this.replies.addAll(List.of(replies));
    }

    public ScriptedTextGenerator failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public synchronized String generate(String prompt, GenerationContext context) {
        prompts.add(prompt);
        if (failure != null) {
            throw failure;
        }
        if (replies.isEmpty()) {
            throw new IllegalStateException("No scripted reply left for " + context.purpose());
        }
        return replies.poll();
    }

    public synchronized List<String> prompts() {
        return new ArrayList<>(prompts);
    }

    public synchronized int calls() {
        return prompts.size();
    }
}

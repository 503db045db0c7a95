package com.projectdesk.models;

import java.util.List;

/**
 * What a structured or agent run produced: the model's final text and the files it staged.
 */
public record RunResult(String text, List<StagedFile> staged) {

    public RunResult {
        staged = List.copyOf(staged);
    }
}

package com.projectdesk.tools;

import com.projectdesk.models.StagedFile;

import java.util.List;

public class ToolExecutionResult {
    private final String output;
    private final boolean ok;
    private final String error;
    private final List<StagedFile> staged;

    public ToolExecutionResult(String output, boolean ok, String error, List<StagedFile> staged) {
        this.output = output;
        this.ok = ok;
        this.error = error;
        this.staged = staged == null ? List.of() : List.copyOf(staged);
    }

    public static ToolExecutionResult ok(String output) {
        return new ToolExecutionResult(output, true, null, null);
    }

    public static ToolExecutionResult ok(String output, List<StagedFile> staged) {
        return new ToolExecutionResult(output, true, null, staged);
    }

    public static ToolExecutionResult error(String output, String error) {
        return new ToolExecutionResult(output, false, error, null);
    }

    public String getOutput() {
        return output;
    }

    public boolean isOk() {
        return ok;
    }

    public String getError() {
        return error;
    }

    public List<StagedFile> getStaged() {
        return staged;
    }
}

package com.projectdesk.providers;

/**
 * Who is asking and why; used for logging and timeouts, never sent to the model.
 */
public record GenerationContext(String projectId, String purpose) {

    public static GenerationContext structured(String projectId) {
        return new GenerationContext(projectId, "structured");
    }

    public static GenerationContext agentTurn(String projectId, int turn) {
        return new GenerationContext(projectId, "agent-turn-" + turn);
    }
}

package com.projectdesk.agent;

import com.projectdesk.AppLogger;
import com.projectdesk.events.EventSink;
import com.projectdesk.models.Project;
import com.projectdesk.models.RunResult;
import com.projectdesk.models.StagedFile;
import com.projectdesk.providers.GenerationContext;
import com.projectdesk.providers.TextGenerator;
import com.projectdesk.tools.SandboxedToolExecutor;
import com.projectdesk.tools.ToolCall;
import com.projectdesk.tools.ToolCallParseResult;
import com.projectdesk.tools.ToolCallParser;
import com.projectdesk.tools.ToolExecutionResult;
import com.projectdesk.tools.ToolSchema;
import com.projectdesk.tools.ToolSchemaRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * General-purpose agent for requests the structured pipeline does not cover.
 * <p>
 * Runs a bounded loop: each turn the model sees the preamble, the request and the transcript so far,
 * and replies with either one JSON tool call or its final answer. Tool results go back into the
 * transcript. Writes land in staging only.
 */
public class FallbackAgent {

    public static final int DEFAULT_MAX_TURNS = 8;
    static final int MAX_TOOL_OUTPUT_CHARS = 60_000;

    private final TextGenerator generator;
    private final SandboxedToolExecutor executor;
    private final ToolSchemaRegistry schemas;
    private final ToolCallParser parser;
    private final int maxTurns;
    private final AppLogger logger = AppLogger.get();

    public FallbackAgent(TextGenerator generator, SandboxedToolExecutor executor, ToolCallParser parser,
                         ToolSchemaRegistry schemas, int maxTurns) {
        this.generator = generator;
        this.executor = executor;
        this.parser = parser;
        this.schemas = schemas;
        this.maxTurns = maxTurns;
    }

    public RunResult run(Project project, String prompt, EventSink sink) throws InterruptedException {
        String preamble = systemPreamble(project) + aliasHint(project);
        List<String> transcript = new ArrayList<>();
        Map<String, StagedFile> staged = new LinkedHashMap<>();

        for (int turn = 1; turn <= maxTurns; turn++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Agent run cancelled");
            }
            sink.status("agent_turn", Map.of("turn", turn, "maxTurns", maxTurns));
            String reply = generator.generate(composeTurnPrompt(preamble, prompt, transcript),
                GenerationContext.agentTurn(project.getId(), turn));
            if (reply == null) {
                reply = "";
            }

            ToolCallParseResult parsed = parser.parseStrict(reply);
            if (parsed.isToolCall()) {
                ToolCall call = parsed.getCall();
                sink.status("tool", Map.of("tool", call.getName(), "turn", turn));
                ToolExecutionResult result = executor.execute(project, call);
                for (StagedFile file : result.getStaged()) {
                    staged.put(file.getPath(), file);
                    sink.fileWritten(file);
                }
                transcript.add("ASSISTANT:\n" + call.getRaw());
                transcript.add("TOOL RESULT (" + call.getName() + ", " + (result.isOk() ? "ok" : "error") + "):\n"
                    + capped(result.getOutput()));
                continue;
            }
            if (parsed.isError()) {
                String detail = parsed.getErrorDetail() != null ? " (" + parsed.getErrorDetail() + ")" : "";
                logger.warn("Agent turn " + turn + " produced an unusable tool call: " + parsed.getErrorCode() + detail);
                transcript.add("ASSISTANT:\n" + capped(reply));
                transcript.add("TOOL CALL REJECTED: " + parsed.getErrorCode() + detail
                    + ". Reply with exactly one valid tool call, or with your final answer as plain text.");
                continue;
            }

            sink.chunk(reply);
            logger.info("Agent for " + project.getId() + " finished after " + turn + " turn(s), staged " + staged.size());
            return new RunResult(reply, new ArrayList<>(staged.values()));
        }

        String text = "Stopped after " + maxTurns + " turns without a final answer.";
        if (!staged.isEmpty()) {
            text += " Files staged so far are listed below.";
        }
        sink.chunk(text);
        logger.warn("Agent for " + project.getId() + " hit the turn limit (" + maxTurns + ")");
        return new RunResult(text, new ArrayList<>(staged.values()));
    }

    String systemPreamble(Project project) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a careful assistant working inside the project \"").append(project.getName()).append("\".\n");
        sb.append("Rules:\n");
        sb.append("- Project root: ").append(project.getRoot()).append('\n');
        sb.append("- Read-only dirs: ").append(String.join(", ", project.getReadDirs())).append('\n');
        sb.append("- Write dir: ").append(project.getWriteDir())
            .append(". Every write is staged in ").append(project.getStagingDir())
            .append(" and reaches the write dir only after a human approves it.\n");
        sb.append("- read and list take paths relative to the project root.\n");
        sb.append("- write takes a path relative to the write dir. If a path starts with '")
            .append(project.getWriteDir()).append("/', strip that folder (write 'notes.md', not '")
            .append(project.getWriteDir()).append("/notes.md').\n");
        sb.append("- To append to a file: read it, then write the full updated content back to the same path.\n");
        sb.append("- Always name the concrete relative paths you touched.\n");
        if (executor.isShellEnabled()) {
            sb.append("- shell runs with ").append(project.getStagingDir())
                .append(" as its working directory; changes it makes to ").append(project.getWriteDir())
                .append(" are moved to staging.\n");
        }
        sb.append("\nTOOLS\n");
        sb.append("To use a tool, reply with exactly one JSON object and nothing else:\n");
        sb.append("{\"tool\": \"<name>\", \"args\": {...}}\n");
        for (ToolSchema schema : schemas.getSchemas()) {
            sb.append("- ").append(schema.usage()).append(": ").append(schema.getDescription()).append('\n');
        }
        sb.append("Actually read every referenced file before answering.\n");
        sb.append("When you are done, reply with your final answer as plain text (not JSON) ");
        sb.append("and mention every file you wrote as @output/<path>.\n");
        return sb.toString();
    }

    static String aliasHint(Project project) {
        if (project.getAliases().isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\nPROJECT FILE ALIASES (usable as read/write paths):\n");
        project.getAliases().forEach((alias, target) ->
            sb.append("- @").append(alias).append(" => ").append(target).append('\n'));
        sb.append("If an alias target does not exist yet, create it under the write dir.\n");
        return sb.toString();
    }

    static String composeTurnPrompt(String preamble, String prompt, List<String> transcript) {
        StringBuilder sb = new StringBuilder(preamble);
        sb.append("\nUSER REQUEST:\n").append(prompt).append('\n');
        for (String entry : transcript) {
            sb.append('\n').append(entry).append('\n');
        }
        if (!transcript.isEmpty()) {
            sb.append("\nContinue: reply with the next tool call or your final answer.\n");
        }
        return sb.toString();
    }

    private static String capped(String output) {
        if (output == null) {
            return "";
        }
        if (output.length() <= MAX_TOOL_OUTPUT_CHARS) {
            return output;
        }
        return output.substring(0, MAX_TOOL_OUTPUT_CHARS) + "\n[truncated]";
    }
}

package com.projectdesk.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectdesk.ProjectFileService;
import com.projectdesk.RecordingSink;
import com.projectdesk.ScriptedTextGenerator;
import com.projectdesk.StagingStore;
import com.projectdesk.TestProjects;
import com.projectdesk.models.Project;
import com.projectdesk.models.RunResult;
import com.projectdesk.pipeline.MentionResolver;
import com.projectdesk.tools.SandboxedToolExecutor;
import com.projectdesk.tools.ToolCallParser;
import com.projectdesk.tools.ToolSchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FallbackAgentTest {

    @TempDir
    Path dir;

    private Project project;
    private StagingStore staging;

    @BeforeEach
    void setUp() throws IOException {
        project = TestProjects.demo(dir);
        staging = new StagingStore();
    }

    private FallbackAgent agent(ScriptedTextGenerator generator, int maxTurns) {
        ToolSchemaRegistry schemas = ToolSchemaRegistry.projectTools(false);
        SandboxedToolExecutor executor = new SandboxedToolExecutor(staging, new ProjectFileService(), new MentionResolver(), null);
        return new FallbackAgent(generator, executor, new ToolCallParser(new ObjectMapper(), schemas), schemas, maxTurns);
    }

    @Test
    void readThenWriteStagesTheFile() throws Exception {
        ScriptedTextGenerator generator = new ScriptedTextGenerator(
            "{\"tool\":\"read\",\"args\":{\"path\":\"input/meeting.md\"}}",
            "{\"tool\":\"write\",\"args\":{\"path\":\"output/todo.md\",\"content\":\"- QA: Ana\\n\"}}",
            "Wrote the action items to @output/todo.md.");
        RecordingSink sink = new RecordingSink();

        RunResult result = agent(generator, FallbackAgent.DEFAULT_MAX_TURNS)
            .run(project, "List action items from input/meeting.md into output/todo.md", sink);

        assertEquals("Wrote the action items to @output/todo.md.", result.text());
        assertEquals(1, result.staged().size());
        assertEquals("todo.md", result.staged().get(0).getPath());
        assertEquals("- QA: Ana\n", TestProjects.read(project.stagingRoot().resolve("todo.md")));
        assertFalse(Files.exists(project.writeRoot().resolve("todo.md")));
        assertEquals(List.of("@output/todo.md"), sink.written);

        List<String> prompts = generator.prompts();
        assertEquals(3, prompts.size());
        assertTrue(prompts.get(1).contains("TOOL RESULT (read, ok)"), prompts.get(1));
        assertTrue(prompts.get(1).contains("ship on Friday"));
        assertTrue(prompts.get(2).contains("TOOL RESULT (write, ok)"));
    }

    @Test
    void rejectedToolCallIsFedBack() throws Exception {
        ScriptedTextGenerator generator = new ScriptedTextGenerator(
            "{\"tool\":\"delete\",\"args\":{\"path\":\"input/meeting.md\"}}",
            "I cannot delete files.");

        RunResult result = agent(generator, 4).run(project, "delete the meeting notes", new RecordingSink());

        assertEquals("I cannot delete files.", result.text());
        assertTrue(result.staged().isEmpty());
        assertTrue(generator.prompts().get(1).contains("TOOL CALL REJECTED: " + ToolCallParser.ERR_UNKNOWN_TOOL));
    }

    @Test
    void sandboxViolationIsReportedAsToolError() throws Exception {
        ScriptedTextGenerator generator = new ScriptedTextGenerator(
            "{\"tool\":\"write\",\"args\":{\"path\":\"../../escape.md\",\"content\":\"x\"}}",
            "That path is not allowed.");

        RunResult result = agent(generator, 4).run(project, "write outside", new RecordingSink());

        assertTrue(result.staged().isEmpty());
        assertTrue(generator.prompts().get(1).contains("TOOL RESULT (write, error)"));
        assertFalse(Files.exists(dir.resolve("escape.md")));
    }

    @Test
    void stopsAtTurnLimit() throws Exception {
        String read = "{\"tool\":\"read\",\"args\":{\"path\":\"input/meeting.md\"}}";
        ScriptedTextGenerator generator = new ScriptedTextGenerator(read, read, read);
        RecordingSink sink = new RecordingSink();

        RunResult result = agent(generator, 3).run(project, "loop forever", sink);

        assertEquals(3, generator.calls());
        assertEquals("Stopped after 3 turns without a final answer.", result.text());
        assertEquals(3, sink.stages.stream().filter("agent_turn"::equals).count());
    }

    @Test
    void preambleNamesDirsToolsAndAliases() {
        FallbackAgent agent = agent(new ScriptedTextGenerator(), 2);
        String preamble = agent.systemPreamble(project) + FallbackAgent.aliasHint(project);

        assertTrue(preamble.contains("Write dir: output"));
        assertTrue(preamble.contains("output_pending"));
        assertTrue(preamble.contains("write {\"path\": string, \"content\": string}"));
        assertFalse(preamble.contains("shell"));
        assertTrue(preamble.contains("@notes => input/meeting.md"));
    }
}

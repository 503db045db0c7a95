package com.projectdesk.pipeline;

import com.projectdesk.AppLogger;
import com.projectdesk.PathSandbox;
import com.projectdesk.ProjectDeskException;
import com.projectdesk.StagingStore;
import com.projectdesk.events.EventSink;
import com.projectdesk.models.Project;
import com.projectdesk.models.ResolvedMention;
import com.projectdesk.models.RunResult;
import com.projectdesk.models.StagedFile;
import com.projectdesk.providers.GenerationContext;
import com.projectdesk.providers.TextGenerator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic summarize-and-save flow: read inputs and guidelines, generate once,
 * stage the result under every declared output path.
 * <p>
 * Inputs and outputs are validated before the generator is called, so a failed
 * validation stages nothing.
 */
public class StructuredPipeline {

    private final TextGenerator generator;
    private final StagingStore staging;
    private final AppLogger logger = AppLogger.get();

    public StructuredPipeline(TextGenerator generator, StagingStore staging) {
        this.generator = generator;
        this.staging = staging;
    }

    public RunResult run(Project project,
                         List<ResolvedMention> inputs,
                         List<ResolvedMention> guidelines,
                         List<ResolvedMention> outputs,
                         String instructions,
                         EventSink sink) throws IOException, InterruptedException {
        if (inputs.isEmpty() || outputs.isEmpty()) {
            throw ProjectDeskException.invalidRequest("Summarize needs at least one @input/ and one @output/ mention");
        }

        Set<String> outputPaths = new LinkedHashSet<>();
        for (ResolvedMention output : outputs) {
            if (output.relativePath().isBlank()) {
                throw ProjectDeskException.invalidRequest("Output mention has no file name: " + output.token());
            }
            outputPaths.add(staging.normalize(project, output.relativePath()));
        }

        Map<String, String> inputTexts = new LinkedHashMap<>();
        for (ResolvedMention input : inputs) {
            Path file = PathSandbox.resolve(project.inputRoot(), input.relativePath());
            if (!Files.isRegularFile(file)) {
                throw ProjectDeskException.missingInput(project.getInputDir() + "/" + input.relativePath());
            }
            inputTexts.put(PathSandbox.toRelative(project.getRoot(), file), readText(file));
        }

        Map<String, String> guidelineTexts = new LinkedHashMap<>();
        for (ResolvedMention guideline : guidelines) {
            Path file = PathSandbox.resolve(project.guidelineRoot(), guideline.relativePath());
            if (!Files.isRegularFile(file)) {
                logger.warn("Guideline not found, continuing without it: " + guideline.token());
                continue;
            }
            guidelineTexts.put(PathSandbox.toRelative(project.getRoot(), file), readText(file));
        }
        sink.status("reading", Map.of("inputs", inputTexts.size(), "guidelines", guidelineTexts.size()));

        String prompt = composePrompt(inputTexts, guidelineTexts, instructions);
        sink.status("generating");
        String text = generator.generate(prompt, GenerationContext.structured(project.getId()));
        if (text == null) {
            text = "";
        }
        sink.chunk(text);

        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        List<StagedFile> staged = new ArrayList<>();
        for (String path : outputPaths) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Run cancelled before staging " + path);
            }
            sink.status("staging", Map.of("path", path));
            StagedFile file = staging.stage(project, path, bytes);
            staged.add(file);
            sink.fileWritten(file);
        }
        logger.info("Structured run for " + project.getId() + " staged " + staged.size() + " file(s)");
        return new RunResult(text, staged);
    }

    static String composePrompt(Map<String, String> inputs, Map<String, String> guidelines, String instructions) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are preparing a document from project files.\n");
        sb.append("Follow the guidelines when present. Respond with the document content only: ");
        sb.append("no preamble, no closing remarks, no code fences around the whole answer.\n\n");
        for (Map.Entry<String, String> entry : inputs.entrySet()) {
            sb.append("=== INPUT: ").append(entry.getKey()).append(" ===\n");
            sb.append(entry.getValue());
            if (!entry.getValue().endsWith("\n")) {
                sb.append('\n');
            }
            sb.append('\n');
        }
        for (Map.Entry<String, String> entry : guidelines.entrySet()) {
            sb.append("=== GUIDELINE: ").append(entry.getKey()).append(" ===\n");
            sb.append(entry.getValue());
            if (!entry.getValue().endsWith("\n")) {
                sb.append('\n');
            }
            sb.append('\n');
        }
        sb.append("=== INSTRUCTIONS ===\n");
        sb.append(instructions == null ? "" : instructions.trim()).append('\n');
        return sb.toString();
    }

    private static String readText(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }
}

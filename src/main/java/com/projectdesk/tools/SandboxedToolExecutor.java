package com.projectdesk.tools;

import com.projectdesk.AppLogger;
import com.projectdesk.ErrorKind;
import com.projectdesk.ProjectDeskException;
import com.projectdesk.ProjectFileService;
import com.projectdesk.StagingStore;
import com.projectdesk.models.FileEntry;
import com.projectdesk.models.FilePreview;
import com.projectdesk.models.Project;
import com.projectdesk.models.StagedFile;
import com.projectdesk.pipeline.MentionResolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the agent's read / write / list / shell tools inside a project's sandbox.
 * <p>
 * Failures (sandbox violations included) come back as error results for the model to see;
 * nothing outside the allowed roots is touched and writes only ever reach staging.
 */
public class SandboxedToolExecutor {

    private final StagingStore staging;
    private final ProjectFileService files;
    private final MentionResolver mentions;
    private final ShellRunner shell;
    private final CommittedTreeGuard guard;
    private final AppLogger logger = AppLogger.get();

    /**
     * @param shell null disables the shell tool
     */
    public SandboxedToolExecutor(StagingStore staging, ProjectFileService files, MentionResolver mentions, ShellRunner shell) {
        this.staging = staging;
        this.files = files;
        this.mentions = mentions;
        this.shell = shell;
        this.guard = new CommittedTreeGuard(staging);
    }

    public boolean isShellEnabled() {
        return shell != null;
    }

    public ToolExecutionResult execute(Project project, ToolCall call) throws InterruptedException {
        if (call == null || call.getName() == null) {
            return ToolExecutionResult.error("Tool call missing name.", "missing-tool");
        }
        String tool = call.getName();
        try {
            switch (tool) {
                case "read":
                    return read(project, call.stringArg("path"));
                case "write":
                    return write(project, call.stringArg("path"), call.stringArg("content"));
                case "list":
                    return list(project, call.stringArg("path"));
                case "shell":
                    if (shell == null) {
                        return ToolExecutionResult.error("The shell tool is disabled on this server.", "shell-disabled");
                    }
                    return shell(project, call.stringArg("command"));
                default:
                    return ToolExecutionResult.error("Unknown tool: " + tool, "unknown-tool");
            }
        } catch (ProjectDeskException e) {
            logger.warn("Tool " + tool + " rejected: " + e.getMessage());
            return ToolExecutionResult.error(e.getKind().wireName() + ": " + e.getMessage(), e.getKind().wireName());
        } catch (IOException e) {
            logger.warn("Tool execution failed: " + tool + " (" + e.getMessage() + ")");
            return ToolExecutionResult.error("Tool execution failed: " + e.getMessage(), "execution-error");
        }
    }

    private ToolExecutionResult read(Project project, String path) throws IOException {
        FilePreview preview = files.preview(project, projectPath(project, path));
        if (!preview.isText()) {
            return ToolExecutionResult.error("Binary file, cannot be read as text: " + preview.getRel(), "binary-file");
        }
        String content = preview.getContent();
        if (Boolean.TRUE.equals(preview.getTruncated())) {
            content += "\n[truncated at " + ProjectFileService.MAX_PREVIEW_BYTES + " bytes of " + preview.getSize() + "]";
        }
        return ToolExecutionResult.ok(content);
    }

    private ToolExecutionResult write(Project project, String path, String content) throws IOException {
        String rel = writePath(project, path);
        StagedFile file = staging.stage(project, rel, (content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
        return ToolExecutionResult.ok("Staged " + file.mention() + " (" + file.getSize() + " bytes); "
            + "it will reach " + project.getWriteDir() + "/ after approval.", List.of(file));
    }

    private ToolExecutionResult list(Project project, String path) throws IOException {
        String rel = path == null || path.isBlank() ? "" : projectPath(project, path);
        List<FileEntry> entries = files.listEntries(project, rel);
        if (entries.isEmpty()) {
            return ToolExecutionResult.ok("(empty)");
        }
        StringBuilder sb = new StringBuilder();
        for (FileEntry entry : entries) {
            sb.append(entry.getRel());
            if (entry.isDir()) {
                sb.append('/');
            }
            sb.append('\n');
        }
        return ToolExecutionResult.ok(sb.toString());
    }

    private ToolExecutionResult shell(Project project, String command) throws IOException, InterruptedException {
        if (command == null || command.isBlank()) {
            throw ProjectDeskException.invalidRequest("command is required");
        }
        Files.createDirectories(project.stagingRoot());
        Map<String, String> stagedBefore = stagedDigests(project);
        CommittedTreeGuard.Snapshot snapshot = guard.snapshot(project);
        ShellRunner.ShellResult result;
        List<StagedFile> fromCommitted;
        try {
            logger.info("Shell in " + project.getId() + ":" + project.getStagingDir() + ": " + command);
            result = shell.run(command, project.stagingRoot());
        } finally {
            fromCommitted = guard.reconcile(project, snapshot);
        }

        List<StagedFile> staged = new ArrayList<>(fromCommitted);
        Map<String, String> stagedAfter = stagedDigests(project);
        for (StagedFile file : staging.list(project)) {
            String before = stagedBefore.get(file.getPath());
            boolean alreadyReported = staged.stream().anyMatch(s -> s.getPath().equals(file.getPath()));
            if (!alreadyReported && (before == null || !before.equals(stagedAfter.get(file.getPath())))) {
                staged.add(file);
            }
        }

        StringBuilder out = new StringBuilder();
        out.append("exit=").append(result.exitCode());
        if (result.timedOut()) {
            out.append(" (timed out)");
        }
        out.append('\n').append(result.output());
        if (result.truncated()) {
            out.append("\n[output truncated]");
        }
        if (!fromCommitted.isEmpty()) {
            out.append("\nNote: changes to ").append(project.getWriteDir())
                .append("/ were moved to staging and the committed files restored.");
        }
        return new ToolExecutionResult(out.toString(), result.exitCode() == 0, result.exitCode() == 0 ? null : "non-zero-exit", staged);
    }

    // Content digests, so a rewrite that keeps size and mtime still counts as a change.
    private Map<String, String> stagedDigests(Project project) throws IOException {
        Map<String, String> digests = new HashMap<>();
        for (StagedFile file : staging.list(project)) {
            try {
                digests.put(file.getPath(), CommittedTreeGuard.digest(staging.read(project, file.getPath()).getContent()));
            } catch (ProjectDeskException e) {
                if (e.getKind() != ErrorKind.NOT_STAGED) {
                    throw e;
                }
            }
        }
        return digests;
    }

    private String projectPath(Project project, String path) {
        if (path == null || path.isBlank()) {
            throw ProjectDeskException.invalidRequest("path is required");
        }
        String p = path.trim();
        if (p.startsWith("@")) {
            return mentions.projectPath(p.substring(1), project);
        }
        return p;
    }

    /**
     * Write-root-relative path: strips {@code @output/} or a leading {@code <write_dir>/}.
     */
    static String writePath(Project project, String path) {
        if (path == null || path.isBlank()) {
            throw ProjectDeskException.invalidRequest("path is required");
        }
        String p = path.trim().replace('\\', '/');
        if (p.startsWith("@output/")) {
            return p.substring("@output/".length());
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        String prefix = project.getWriteDir() + "/";
        if (p.startsWith(prefix)) {
            p = p.substring(prefix.length());
        }
        return p;
    }
}

package com.projectdesk;

import com.projectdesk.models.Project;
import com.projectdesk.models.ProjectManifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Builds small on-disk projects for tests.
 */
public final class TestProjects {

    private TestProjects() {
    }

    /**
     * Project "demo" with input/, guideline/, output/ and output_pending/,
     * an input file, a guideline and the alias {@code notes -> input/meeting.md}.
     */
    public static Project demo(Path dir) throws IOException {
        Path root = dir.resolve("demo");
        write(root.resolve("input/meeting.md"), "# Sync\n- ship on Friday\n- Ana owns QA\n");
        write(root.resolve("guideline/style.md"), "Use bullet points.\n");
        ProjectManifest manifest = new ProjectManifest();
        manifest.setName("Demo");
        manifest.setReadDirs(List.of("input", "guideline"));
        manifest.setAliases(Map.of("notes", "input/meeting.md"));
        return ProjectRegistry.fromManifest("demo", root, manifest);
    }

    public static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    public static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }
}

package com.projectdesk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectdesk.models.Project;
import com.projectdesk.models.ProjectManifest;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Loads every {@code <projectsDir>/<id>/manifest.json} once at startup.
 * The loaded set never changes afterwards.
 */
public class ProjectRegistry {

    public static final String MANIFEST_FILE = "manifest.json";
    private static final Pattern PROJECT_ID = Pattern.compile("[A-Za-z0-9_\\-]+");

    private final Map<String, Project> projects;

    public ProjectRegistry(Collection<Project> projects) {
        Map<String, Project> byId = new TreeMap<>();
        for (Project project : projects) {
            byId.put(project.getId(), project);
        }
        this.projects = Collections.unmodifiableMap(byId);
    }

    public static ProjectRegistry load(Path projectsDir, ObjectMapper objectMapper) throws IOException {
        AppLogger logger = AppLogger.get();
        List<Project> loaded = new ArrayList<>();
        if (!Files.isDirectory(projectsDir)) {
            logger.warn("Projects directory not found: " + projectsDir);
            return new ProjectRegistry(loaded);
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(projectsDir)) {
            for (Path dir : stream) {
                Path manifestPath = dir.resolve(MANIFEST_FILE);
                if (!Files.isDirectory(dir) || !Files.isRegularFile(manifestPath)) {
                    continue;
                }
                String id = dir.getFileName().toString();
                try {
                    ProjectManifest manifest = objectMapper.readValue(manifestPath.toFile(), ProjectManifest.class);
                    loaded.add(fromManifest(id, dir, manifest));
                    logger.info("Loaded project '" + id + "'");
                } catch (IOException | ProjectDeskException e) {
                    logger.warn("Skipping project '" + id + "': " + e.getMessage());
                }
            }
        }
        return new ProjectRegistry(loaded);
    }

    /**
     * Validates a manifest and builds the immutable project. Creates the write and staging roots.
     */
    public static Project fromManifest(String id, Path projectRoot, ProjectManifest manifest) throws IOException {
        if (id == null || !PROJECT_ID.matcher(id).matches()) {
            throw ProjectDeskException.invalidRequest("Invalid project id: " + id);
        }
        Path root = projectRoot.toAbsolutePath().normalize();

        List<String> readDirs = new ArrayList<>();
        if (manifest.getReadDirs() != null) {
            for (String dir : manifest.getReadDirs()) {
                addDir(readDirs, normalizeDir(root, dir, "read_dirs"));
            }
        }
        String inputDir = normalizeDir(root, defaulted(manifest.getInputDir(), "input"), "input_dir");
        String guidelineDir = normalizeDir(root, defaulted(manifest.getGuidelineDir(), "guideline"), "guideline_dir");
        addDir(readDirs, inputDir);
        addDir(readDirs, guidelineDir);

        String writeDir = normalizeDir(root, defaulted(manifest.getWriteDir(), "output"), "write_dir");
        String stagingDir = normalizeDir(root, defaulted(manifest.getStagingDir(), "output_pending"), "staging_dir");

        if (overlaps(writeDir, stagingDir)) {
            throw ProjectDeskException.invalidRequest("write_dir and staging_dir overlap: " + writeDir + ", " + stagingDir);
        }
        for (String readDir : readDirs) {
            if (overlaps(readDir, writeDir) || overlaps(readDir, stagingDir)) {
                throw ProjectDeskException.invalidRequest("read dir overlaps write or staging dir: " + readDir);
            }
        }

        Map<String, String> aliases = new LinkedHashMap<>();
        if (manifest.getAliases() != null) {
            manifest.getAliases().forEach((key, target) -> {
                if (key == null || key.isBlank() || target == null || target.isBlank()) {
                    return;
                }
                String alias = key.trim();
                while (alias.startsWith("@")) {
                    alias = alias.substring(1);
                }
                aliases.put(alias, target.trim());
            });
        }

        Files.createDirectories(root.resolve(writeDir));
        Files.createDirectories(root.resolve(stagingDir));

        // alias targets must stay inside a read, write or staging dir
        List<Path> aliasRoots = new ArrayList<>();
        for (String dir : readDirs) {
            aliasRoots.add(root.resolve(dir));
        }
        aliasRoots.add(root.resolve(writeDir));
        aliasRoots.add(root.resolve(stagingDir));
        for (Map.Entry<String, String> alias : aliases.entrySet()) {
            PathSandbox.resolveWithin(root, aliasRoots, alias.getValue());
        }

        String name = manifest.getName() != null && !manifest.getName().isBlank() ? manifest.getName() : id;
        return new Project(id, name, root, readDirs, inputDir, guidelineDir, writeDir, stagingDir, aliases);
    }

    public List<Project> list() {
        return new ArrayList<>(projects.values());
    }

    public Project get(String projectId) {
        if (projectId == null || !PROJECT_ID.matcher(projectId).matches()) {
            throw ProjectDeskException.invalidRequest("Invalid project id: " + projectId);
        }
        Project project = projects.get(projectId);
        if (project == null) {
            throw ProjectDeskException.unknownProject(projectId);
        }
        return project;
    }

    public int size() {
        return projects.size();
    }

    private static String normalizeDir(Path root, String dir, String field) {
        if (dir == null || dir.isBlank()) {
            throw ProjectDeskException.invalidRequest(field + " must not be empty");
        }
        Path resolved = PathSandbox.resolve(root, dir);
        if (resolved.equals(root)) {
            throw ProjectDeskException.invalidRequest(field + " must not be the project root");
        }
        return PathSandbox.toRelative(root, resolved);
    }

    private static void addDir(List<String> dirs, String dir) {
        if (!dirs.contains(dir)) {
            dirs.add(dir);
        }
    }

    private static boolean overlaps(String a, String b) {
        return a.equals(b) || a.startsWith(b + "/") || b.startsWith(a + "/");
    }

    private static String defaulted(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}

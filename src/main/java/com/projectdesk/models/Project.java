package com.projectdesk.models;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A loaded project. Immutable for the lifetime of the server.
 * Directory names are project-relative; the matching {@code *Root} paths are absolute.
 */
public final class Project {

    private final String id;
    private final String name;
    private final Path root;
    private final List<String> readDirs;
    private final String inputDir;
    private final String guidelineDir;
    private final String writeDir;
    private final String stagingDir;
    private final Map<String, String> aliases;

    public Project(String id, String name, Path root, List<String> readDirs,
                   String inputDir, String guidelineDir, String writeDir, String stagingDir,
                   Map<String, String> aliases) {
        this.id = id;
        this.name = name;
        this.root = root.toAbsolutePath().normalize();
        this.readDirs = List.copyOf(readDirs);
        this.inputDir = inputDir;
        this.guidelineDir = guidelineDir;
        this.writeDir = writeDir;
        this.stagingDir = stagingDir;
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public Path getRoot() { return root; }
    public List<String> getReadDirs() { return readDirs; }
    public String getInputDir() { return inputDir; }
    public String getGuidelineDir() { return guidelineDir; }
    public String getWriteDir() { return writeDir; }
    public String getStagingDir() { return stagingDir; }
    public Map<String, String> getAliases() { return aliases; }

    public List<Path> readRoots() {
        List<Path> roots = new ArrayList<>();
        for (String dir : readDirs) {
            roots.add(root.resolve(dir).normalize());
        }
        return roots;
    }

    public Path inputRoot() {
        return root.resolve(inputDir).normalize();
    }

    public Path guidelineRoot() {
        return root.resolve(guidelineDir).normalize();
    }

    public Path writeRoot() {
        return root.resolve(writeDir).normalize();
    }

    public Path stagingRoot() {
        return root.resolve(stagingDir).normalize();
    }

    /**
     * Read roots plus the write and staging roots: everything a client may browse or read.
     */
    public List<Path> browsableRoots() {
        List<Path> roots = readRoots();
        roots.add(writeRoot());
        roots.add(stagingRoot());
        return roots;
    }

    public List<String> browsableDirs() {
        List<String> dirs = new ArrayList<>(readDirs);
        dirs.add(writeDir);
        dirs.add(stagingDir);
        return dirs;
    }
}

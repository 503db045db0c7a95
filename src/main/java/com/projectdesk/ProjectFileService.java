package com.projectdesk;

import com.projectdesk.models.FileEntry;
import com.projectdesk.models.FilePreview;
import com.projectdesk.models.Project;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only browsing of a project's configured roots: directory listing, file preview and name search.
 * All paths are project-relative and must fall under a read, write or staging root.
 */
public class ProjectFileService {

    public static final int MAX_PREVIEW_BYTES = 200 * 1024;
    public static final int DEFAULT_SEARCH_LIMIT = 200;
    private static final int MAX_SEARCH_LIMIT = 1000;
    static final Set<String> IGNORE_NAMES = Set.of(
        ".git", "node_modules", ".venv", "__pycache__", "dist", "build", ".DS_Store"
    );

    private final AppLogger logger = AppLogger.get();

    /**
     * Lists a directory. An empty path lists the project's roots themselves.
     */
    public List<FileEntry> listEntries(Project project, String relativePath) throws IOException {
        if (relativePath == null || relativePath.isBlank()) {
            List<FileEntry> roots = new ArrayList<>();
            for (String dir : project.browsableDirs()) {
                Path abs = PathSandbox.resolve(project.getRoot(), dir);
                if (Files.isDirectory(abs)) {
                    roots.add(new FileEntry(abs.getFileName().toString(), dir, "dir"));
                }
            }
            return roots;
        }

        Path dir = PathSandbox.resolveWithin(project.getRoot(), project.browsableRoots(), relativePath);
        if (!Files.exists(dir)) {
            throw ProjectDeskException.notFound("Directory not found: " + relativePath);
        }
        if (!Files.isDirectory(dir)) {
            throw ProjectDeskException.invalidRequest("Not a directory: " + relativePath);
        }

        String base = PathSandbox.toRelative(project.getRoot(), dir);
        List<FileEntry> folders = new ArrayList<>();
        List<FileEntry> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString();
                if (isIgnored(name)) {
                    continue;
                }
                String rel = base + "/" + name;
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    folders.add(new FileEntry(name, rel, "dir"));
                } else {
                    files.add(new FileEntry(name, rel, "file"));
                }
            }
        }

        // Sort alphabetically (case-insensitive), folders first
        folders.sort(Comparator.comparing(FileEntry::getName, String.CASE_INSENSITIVE_ORDER));
        files.sort(Comparator.comparing(FileEntry::getName, String.CASE_INSENSITIVE_ORDER));
        List<FileEntry> entries = new ArrayList<>(folders);
        entries.addAll(files);
        return entries;
    }

    /**
     * Text preview capped at {@link #MAX_PREVIEW_BYTES}, or a binary marker.
     */
    public FilePreview preview(Project project, String relativePath) throws IOException {
        if (relativePath == null || relativePath.isBlank()) {
            throw ProjectDeskException.invalidRequest("path is required");
        }
        Path file = PathSandbox.resolveWithin(project.getRoot(), project.browsableRoots(), relativePath);
        if (!Files.isRegularFile(file)) {
            throw ProjectDeskException.notFound("Not a file: " + relativePath);
        }

        long size = Files.size(file);
        byte[] sample = readPrefix(file, (int) Math.min(size, MAX_PREVIEW_BYTES));

        FilePreview preview = new FilePreview();
        preview.setName(file.getFileName().toString());
        preview.setRel(relativePath);
        preview.setSize(size);
        preview.setMime(guessMime(file));

        if (looksLikeText(sample)) {
            preview.setKind("text");
            preview.setContent(decodeLenient(sample));
            preview.setTruncated(size > MAX_PREVIEW_BYTES);
        } else {
            preview.setKind("binary");
            preview.setNote("binary or unsupported text; preview omitted");
        }
        return preview;
    }

    /**
     * Case-insensitive match on file and directory names across every browsable root.
     */
    public List<FileEntry> search(Project project, String query, int limit) throws IOException {
        List<FileEntry> results = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return results;
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        int max = Math.max(1, Math.min(limit, MAX_SEARCH_LIMIT));
        Path projectRoot = project.getRoot();

        for (Path root : project.browsableRoots()) {
            if (results.size() >= max) {
                break;
            }
            if (!Files.isDirectory(root)) {
                continue;
            }
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && isIgnored(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (!dir.equals(root)) {
                        collect(dir, "dir");
                    }
                    return results.size() >= max ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!isIgnored(file.getFileName().toString())) {
                        collect(file, "file");
                    }
                    return results.size() >= max ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Search skipped unreadable path " + file + ": " + exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }

                private void collect(Path path, String type) {
                    String name = path.getFileName().toString();
                    if (results.size() < max && name.toLowerCase(Locale.ROOT).contains(needle)) {
                        results.add(new FileEntry(name, PathSandbox.toRelative(projectRoot, path), type));
                    }
                }
            });
        }
        return results;
    }

    static boolean isIgnored(String name) {
        return IGNORE_NAMES.contains(name) || name.startsWith(".");
    }

    static boolean looksLikeText(byte[] sample) {
        for (byte b : sample) {
            if (b == 0) {
                return false;
            }
        }
        return true;
    }

    // Invalid UTF-8 (including a sequence cut by the preview cap) decodes to U+FFFD.
    static String decodeLenient(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static String guessMime(Path file) throws IOException {
        String mime = Files.probeContentType(file);
        if (mime == null) {
            mime = URLConnection.guessContentTypeFromName(file.getFileName().toString());
        }
        if (mime == null) {
            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            if (name.endsWith(".md") || name.endsWith(".markdown")) {
                mime = "text/markdown";
            }
        }
        return mime != null ? mime : "application/octet-stream";
    }

    private static byte[] readPrefix(Path file, int length) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return in.readNBytes(length);
        }
    }
}

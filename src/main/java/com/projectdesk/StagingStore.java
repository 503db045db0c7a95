package com.projectdesk;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.projectdesk.models.Project;
import com.projectdesk.models.StagedFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Pending writes live under a project's staging root, mirroring the shape of the write root.
 * Nothing reaches the write root except through {@link #promote}.
 * <p>
 * Paths are write-root-relative; a leading {@code <staging_dir>/} is accepted and stripped.
 * Every operation on one path holds that path's lock from {@link PathLocks}.
 */
public class StagingStore {

    private static final String TEMP_PREFIX = ".stage-";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final int DIFF_CONTEXT = 3;

    private final PathLocks locks;
    private final Map<String, Set<CommittedWriteLog>> committedWatchers = new ConcurrentHashMap<>();
    private final AppLogger logger;

    public StagingStore(PathLocks locks) {
        this.locks = locks;
        this.logger = AppLogger.get();
    }

    public StagingStore() {
        this(new PathLocks());
    }

    /**
     * Enumerates every staged file, sorted by path. Content is not loaded.
     * Files promoted or rejected while the walk runs are left out.
     */
    public List<StagedFile> list(Project project) throws IOException {
        Path stagingRoot = project.stagingRoot();
        if (!Files.isDirectory(stagingRoot)) {
            return List.of();
        }
        List<StagedFile> result = new ArrayList<>();
        Files.walkFileTree(stagingRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile() || isTempFile(file)) {
                    return FileVisitResult.CONTINUE;
                }
                String rel = PathSandbox.toRelative(stagingRoot, file);
                Path committed = PathSandbox.resolve(project.writeRoot(), rel);
                result.add(new StagedFile(rel, attrs.size(), Files.exists(committed),
                    attrs.lastModifiedTime().toMillis(), null));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null && !(exc instanceof NoSuchFileException)) {
                    throw exc;
                }
                return FileVisitResult.CONTINUE;
            }
        });
        result.sort(Comparator.comparing(StagedFile::getPath));
        return result;
    }

    /**
     * Writes {@code content} as the staged version of {@code relativePath}, replacing any earlier staged version.
     */
    public StagedFile stage(Project project, String relativePath, byte[] content) throws IOException {
        String rel = normalize(project, relativePath);
        return locks.withLock(project.getId(), rel, () -> {
            Path staged = PathSandbox.resolve(project.stagingRoot(), rel);
            if (Files.isDirectory(staged)) {
                throw ProjectDeskException.invalidRequest("Cannot stage over a directory: " + rel);
            }
            Files.createDirectories(staged.getParent());
            try {
                writeAtomically(staged, content);
            } catch (NoSuchFileException e) {
                // parent pruned by a concurrent promote/reject of a sibling path
                Files.createDirectories(staged.getParent());
                writeAtomically(staged, content);
            }
            Path committed = PathSandbox.resolve(project.writeRoot(), rel);
            logger.info("Staged " + project.getId() + ":" + rel + " (" + content.length + " bytes)");
            return new StagedFile(rel, content.length, Files.exists(committed),
                Files.getLastModifiedTime(staged).toMillis(), content);
        });
    }

    /**
     * Staged file with its content.
     */
    public StagedFile read(Project project, String relativePath) throws IOException {
        String rel = normalize(project, relativePath);
        return locks.withLock(project.getId(), rel, () -> {
            Path staged = requireStaged(project, rel);
            byte[] content = Files.readAllBytes(staged);
            Path committed = PathSandbox.resolve(project.writeRoot(), rel);
            return new StagedFile(rel, content.length, Files.exists(committed),
                Files.getLastModifiedTime(staged).toMillis(), content);
        });
    }

    public boolean isStaged(Project project, String relativePath) {
        String rel = normalize(project, relativePath);
        return Files.isRegularFile(PathSandbox.resolve(project.stagingRoot(), rel));
    }

    /**
     * Unified line diff from the committed file (empty if absent) to the staged file.
     */
    public String diff(Project project, String relativePath) throws IOException {
        String rel = normalize(project, relativePath);
        return locks.withLock(project.getId(), rel, () -> {
            Path staged = requireStaged(project, rel);
            Path committed = PathSandbox.resolve(project.writeRoot(), rel);
            List<String> original = Files.isRegularFile(committed) ? readLines(committed) : List.of();
            List<String> revised = readLines(staged);
            var patch = DiffUtils.diff(original, revised);
            List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                project.getWriteDir() + "/" + rel,
                project.getStagingDir() + "/" + rel,
                original,
                patch,
                DIFF_CONTEXT
            );
            return String.join("\n", unified);
        });
    }

    /**
     * Moves the staged file into the write root at the same relative path.
     *
     * @throws ProjectDeskException NOT_STAGED if nothing is staged there,
     *                              ALREADY_EXISTS if a committed file exists and {@code overwrite} is false
     */
    public StagedFile promote(Project project, String relativePath, boolean overwrite) throws IOException {
        String rel = normalize(project, relativePath);
        return locks.withLock(project.getId(), rel, () -> {
            Path staged = requireStaged(project, rel);
            Path committed = PathSandbox.resolve(project.writeRoot(), rel);
            if (Files.isDirectory(committed)) {
                throw ProjectDeskException.invalidRequest("Destination is a directory: " + project.getWriteDir() + "/" + rel);
            }
            boolean existed = Files.exists(committed);
            if (existed && !overwrite) {
                throw ProjectDeskException.alreadyExists(project.getWriteDir() + "/" + rel);
            }
            byte[] content = Files.readAllBytes(staged);
            Files.createDirectories(committed.getParent());
            writeAtomically(committed, content);
            recordCommitted(project, rel, content);
            Files.delete(staged);
            pruneEmptyParents(project.stagingRoot(), staged.getParent());
            logger.info("Promoted " + project.getId() + ":" + rel + (existed ? " (overwrote committed file)" : ""));
            return new StagedFile(rel, content.length, true, System.currentTimeMillis(), content);
        });
    }

    /**
     * Deletes the staged file. The committed tree is not touched.
     */
    public StagedFile reject(Project project, String relativePath) throws IOException {
        String rel = normalize(project, relativePath);
        return locks.withLock(project.getId(), rel, () -> {
            Path staged = requireStaged(project, rel);
            long size = Files.size(staged);
            Path committed = PathSandbox.resolve(project.writeRoot(), rel);
            Files.delete(staged);
            pruneEmptyParents(project.stagingRoot(), staged.getParent());
            logger.info("Rejected " + project.getId() + ":" + rel);
            return new StagedFile(rel, size, Files.exists(committed), System.currentTimeMillis(), null);
        });
    }

    /**
     * Starts recording every file {@link #promote} writes into the project's write root.
     */
    public CommittedWriteLog watchCommitted(Project project) {
        CommittedWriteLog log = new CommittedWriteLog();
        committedWatchers.compute(project.getId(), (id, logs) -> {
            Set<CommittedWriteLog> set = logs != null ? logs : ConcurrentHashMap.newKeySet();
            set.add(log);
            return set;
        });
        return log;
    }

    public void unwatchCommitted(Project project, CommittedWriteLog log) {
        committedWatchers.computeIfPresent(project.getId(), (id, logs) -> {
            logs.remove(log);
            return logs.isEmpty() ? null : logs;
        });
    }

    /**
     * Runs {@code action} holding the lock for an already normalized path.
     */
    public <T> T withPathLock(Project project, String rel, PathLocks.LockedAction<T> action) throws IOException {
        return locks.withLock(project.getId(), rel, action);
    }

    private void recordCommitted(Project project, String rel, byte[] content) {
        Set<CommittedWriteLog> logs = committedWatchers.get(project.getId());
        if (logs == null) {
            return;
        }
        for (CommittedWriteLog log : logs) {
            log.record(rel, content);
        }
    }

    /**
     * Files promoted into a write root since {@link #watchCommitted}; the last write per path wins.
     */
    public static final class CommittedWriteLog {
        private final Map<String, byte[]> writes = new HashMap<>();

        private synchronized void record(String rel, byte[] content) {
            writes.put(rel, content);
        }

        /**
         * Bytes last promoted to {@code rel}, or null if nothing was promoted there.
         */
        public synchronized byte[] lastWrite(String rel) {
            return writes.get(rel);
        }

        public synchronized Set<String> paths() {
            return new HashSet<>(writes.keySet());
        }
    }

    /**
     * Canonical write-root-relative key for {@code relativePath}, validated against both the staging and write roots.
     */
    public String normalize(Project project, String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw ProjectDeskException.invalidRequest("path is required");
        }
        String rel = relativePath.trim().replace('\\', '/');
        while (rel.startsWith("/")) {
            rel = rel.substring(1);
        }
        String stagingPrefix = project.getStagingDir() + "/";
        if (rel.startsWith(stagingPrefix)) {
            rel = rel.substring(stagingPrefix.length());
        }
        Path staged = PathSandbox.resolve(project.stagingRoot(), rel);
        PathSandbox.resolve(project.writeRoot(), rel);
        String key = PathSandbox.toRelative(project.stagingRoot(), staged);
        if (key.isEmpty()) {
            throw ProjectDeskException.invalidRequest("path must name a file: " + relativePath);
        }
        return key;
    }

    private Path requireStaged(Project project, String rel) {
        Path staged = PathSandbox.resolve(project.stagingRoot(), rel);
        if (!Files.isRegularFile(staged)) {
            throw ProjectDeskException.notStaged(rel);
        }
        return staged;
    }

    private static List<String> readLines(Path file) throws IOException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return text.lines().collect(Collectors.toList());
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), TEMP_PREFIX, TEMP_SUFFIX);
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static boolean isTempFile(Path file) {
        String name = file.getFileName().toString();
        return name.startsWith(TEMP_PREFIX) && name.endsWith(TEMP_SUFFIX);
    }

    private static void pruneEmptyParents(Path stagingRoot, Path dir) throws IOException {
        Path root = stagingRoot.toAbsolutePath().normalize();
        Path current = dir.toAbsolutePath().normalize();
        while (current != null && !current.equals(root) && current.startsWith(root)) {
            try {
                try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                    if (entries.iterator().hasNext()) {
                        return;
                    }
                }
                Files.delete(current);
            } catch (DirectoryNotEmptyException e) {
                // a concurrent stage() just wrote into it
                return;
            } catch (NoSuchFileException e) {
                // already pruned by a sibling's promote/reject; keep walking up
            }
            current = current.getParent();
        }
    }
}

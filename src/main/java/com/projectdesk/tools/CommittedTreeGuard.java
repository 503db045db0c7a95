package com.projectdesk.tools;

import com.projectdesk.AppLogger;
import com.projectdesk.PathSandbox;
import com.projectdesk.StagingStore;
import com.projectdesk.models.Project;
import com.projectdesk.models.StagedFile;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps shell commands from changing the committed tree.
 * <p>
 * {@link #snapshot} backs up the write root; {@link #reconcile} stages every file the command
 * created or modified there, then puts the committed tree back the way it was.
 * Files promoted through {@link StagingStore} in between count as committed, not as shell changes.
 */
public class CommittedTreeGuard {

    private final StagingStore staging;
    private final AppLogger logger = AppLogger.get();

    public CommittedTreeGuard(StagingStore staging) {
        this.staging = staging;
    }

    public static final class Snapshot {
        private final Path backupDir;
        private final Map<String, String> digests;
        private final Set<String> dirs;
        private final StagingStore.CommittedWriteLog promotions;

        private Snapshot(Path backupDir, Map<String, String> digests, Set<String> dirs,
                         StagingStore.CommittedWriteLog promotions) {
            this.backupDir = backupDir;
            this.digests = digests;
            this.dirs = dirs;
            this.promotions = promotions;
        }
    }

    /**
     * Backs up the write root. Promotes that land before {@link #reconcile} are recorded and kept.
     */
    public Snapshot snapshot(Project project) throws IOException {
        StagingStore.CommittedWriteLog promotions = staging.watchCommitted(project);
        try {
            return backup(project, promotions);
        } catch (IOException | RuntimeException e) {
            staging.unwatchCommitted(project, promotions);
            throw e;
        }
    }

    private Snapshot backup(Project project, StagingStore.CommittedWriteLog promotions) throws IOException {
        Path writeRoot = project.writeRoot();
        Path backup = Files.createTempDirectory("project-desk-guard-");
        Map<String, String> digests = new TreeMap<>();
        Set<String> dirs = new HashSet<>();
        if (Files.isDirectory(writeRoot)) {
            Files.walkFileTree(writeRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    dirs.add(PathSandbox.toRelative(writeRoot, dir));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String rel = PathSandbox.toRelative(writeRoot, file);
                    Path copy = backup.resolve(rel);
                    Files.createDirectories(copy.getParent());
                    Files.copy(file, copy, StandardCopyOption.REPLACE_EXISTING);
                    digests.put(rel, digest(Files.readAllBytes(copy)));
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        return new Snapshot(backup, digests, dirs, promotions);
    }

    /**
     * Moves committed-tree changes into staging and restores the committed tree.
     * A path promoted during the window is expected to hold the promoted bytes, not the backup.
     *
     * @return files staged from the committed tree
     */
    public List<StagedFile> reconcile(Project project, Snapshot snapshot) throws IOException {
        Path writeRoot = project.writeRoot();
        List<StagedFile> staged = new ArrayList<>();
        try {
            Set<String> paths = new TreeSet<>(snapshot.digests.keySet());
            paths.addAll(currentFiles(writeRoot));
            paths.addAll(snapshot.promotions.paths());
            for (String rel : paths) {
                StagedFile moved = staging.withPathLock(project, rel, () -> reconcilePath(project, snapshot, rel));
                if (moved != null) {
                    staged.add(moved);
                }
            }
            removeNewEmptyDirs(writeRoot, snapshot.dirs);
        } finally {
            staging.unwatchCommitted(project, snapshot.promotions);
            deleteTree(snapshot.backupDir);
        }
        return staged;
    }

    // Runs under the path lock, so a promote of this path cannot interleave.
    private StagedFile reconcilePath(Project project, Snapshot snapshot, String rel) throws IOException {
        Path target = PathSandbox.resolve(project.writeRoot(), rel);
        byte[] promoted = snapshot.promotions.lastWrite(rel);
        String expected = promoted != null ? digest(promoted) : snapshot.digests.get(rel);
        byte[] current = Files.isRegularFile(target) ? Files.readAllBytes(target) : null;

        if (current == null) {
            if (expected != null) {
                restore(snapshot, rel, promoted, target);
                logger.warn("Shell deleted committed file " + project.getWriteDir() + "/" + rel + "; restored");
            }
            return null;
        }
        if (expected != null && expected.equals(digest(current))) {
            return null;
        }
        StagedFile moved = staging.stage(project, rel, current);
        if (expected != null) {
            restore(snapshot, rel, promoted, target);
        } else {
            Files.delete(target);
        }
        logger.warn("Shell changed committed file " + project.getWriteDir() + "/" + rel + "; moved to staging");
        return moved;
    }

    private static void restore(Snapshot snapshot, String rel, byte[] promoted, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        if (promoted != null) {
            Files.write(target, promoted);
        } else {
            Files.copy(snapshot.backupDir.resolve(rel), target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Set<String> currentFiles(Path writeRoot) throws IOException {
        Set<String> files = new TreeSet<>();
        if (!Files.isDirectory(writeRoot)) {
            Files.createDirectories(writeRoot);
            return files;
        }
        try (Stream<Path> walk = Files.walk(writeRoot)) {
            for (Path file : walk.filter(Files::isRegularFile).collect(Collectors.toList())) {
                files.add(PathSandbox.toRelative(writeRoot, file));
            }
        }
        return files;
    }

    private static void removeNewEmptyDirs(Path writeRoot, Set<String> knownDirs) throws IOException {
        List<Path> dirs;
        try (Stream<Path> walk = Files.walk(writeRoot)) {
            dirs = walk.filter(Files::isDirectory)
                .filter(d -> !knownDirs.contains(PathSandbox.toRelative(writeRoot, d)))
                .sorted(Comparator.comparingInt(Path::getNameCount).reversed())
                .collect(Collectors.toList());
        }
        for (Path dir : dirs) {
            try (Stream<Path> children = Files.list(dir)) {
                if (children.findAny().isPresent()) {
                    continue;
                }
            }
            Files.delete(dir);
        }
    }

    private static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        }
    }

    static String digest(byte[] content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(content);
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

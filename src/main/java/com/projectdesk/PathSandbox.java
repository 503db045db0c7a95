package com.projectdesk;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Resolves root-relative paths and rejects anything that would leave the root.
 * Every filesystem access in the application goes through here first.
 */
public final class PathSandbox {

    private PathSandbox() {
    }

    /**
     * Resolves {@code relativePath} against {@code root}.
     *
     * @param root         sandbox root
     * @param relativePath root-relative path; empty or null means the root itself
     * @return absolute, normalized path inside the root
     * @throws ProjectDeskException with {@link ErrorKind#PATH_ESCAPE} if the path leaves the root
     */
    public static Path resolve(Path root, String relativePath) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        String rel = clean(relativePath);
        if (rel.isEmpty()) {
            return normalizedRoot;
        }

        Path resolved;
        try {
            resolved = normalizedRoot.resolve(rel).normalize();
        } catch (InvalidPathException e) {
            throw ProjectDeskException.pathEscape(relativePath);
        }
        if (!resolved.startsWith(normalizedRoot)) {
            throw ProjectDeskException.pathEscape(relativePath);
        }
        checkRealPath(normalizedRoot, resolved, relativePath);
        return resolved;
    }

    /**
     * Resolves a project-relative path and requires it to land under one of {@code allowedRoots}.
     */
    public static Path resolveWithin(Path projectRoot, Collection<Path> allowedRoots, String relativePath) {
        Path resolved = resolve(projectRoot, relativePath);
        for (Path allowed : allowedRoots) {
            Path normalized = allowed.toAbsolutePath().normalize();
            if (resolved.startsWith(normalized)) {
                checkRealPath(normalized, resolved, relativePath);
                return resolved;
            }
        }
        throw ProjectDeskException.pathEscape(relativePath);
    }

    public static boolean isWithin(Path root, Path candidate) {
        return candidate.toAbsolutePath().normalize().startsWith(root.toAbsolutePath().normalize());
    }

    /**
     * Root-relative form of {@code path} using forward slashes.
     */
    public static String toRelative(Path root, Path path) {
        return root.toAbsolutePath().normalize()
            .relativize(path.toAbsolutePath().normalize())
            .toString()
            .replace('\\', '/');
    }

    private static String clean(String relativePath) {
        if (relativePath == null) {
            return "";
        }
        if (relativePath.indexOf('\0') >= 0) {
            throw ProjectDeskException.pathEscape(relativePath.replace('\0', '?'));
        }
        String rel = relativePath.trim().replace('\\', '/');
        while (rel.startsWith("/")) {
            rel = rel.substring(1);
        }
        if (".".equals(rel)) {
            return "";
        }
        return rel;
    }

    // Symlinks inside the root must not point outside it.
    private static void checkRealPath(Path root, Path resolved, String relativePath) {
        if (!Files.exists(root)) {
            return;
        }
        Path existing = resolved;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return;
        }
        try {
            Path realRoot = root.toRealPath();
            Path real = existing.toRealPath();
            if (!real.startsWith(realRoot)) {
                throw ProjectDeskException.pathEscape(relativePath);
            }
        } catch (IOException e) {
            throw new ProjectDeskException(ErrorKind.PATH_ESCAPE,
                "Cannot verify path " + relativePath + ": " + e.getMessage(), e);
        }
    }
}

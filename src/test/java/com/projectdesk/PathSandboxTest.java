package com.projectdesk;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathSandboxTest {

    @TempDir
    Path root;

    @Test
    void resolvesNestedPathInsideRoot() {
        Path resolved = PathSandbox.resolve(root, "a/b/../c.txt");
        assertEquals(root.toAbsolutePath().normalize().resolve("a/c.txt"), resolved);
    }

    @Test
    void normalizesBackslashesAndLeadingSlash() {
        Path resolved = PathSandbox.resolve(root, "\\docs\\notes.md");
        assertEquals(root.toAbsolutePath().normalize().resolve("docs/notes.md"), resolved);
        assertEquals(root.toAbsolutePath().normalize().resolve("etc/passwd"), PathSandbox.resolve(root, "/etc/passwd"));
    }

    @Test
    void emptyAndDotResolveToRoot() {
        Path expected = root.toAbsolutePath().normalize();
        assertEquals(expected, PathSandbox.resolve(root, ""));
        assertEquals(expected, PathSandbox.resolve(root, null));
        assertEquals(expected, PathSandbox.resolve(root, "."));
    }

    @Test
    void rejectsParentTraversal() {
        ProjectDeskException e = assertThrows(ProjectDeskException.class,
            () -> PathSandbox.resolve(root, "../outside.txt"));
        assertEquals(ErrorKind.PATH_ESCAPE, e.getKind());
        assertThrows(ProjectDeskException.class, () -> PathSandbox.resolve(root, "a/../../b"));
    }

    @Test
    void rejectsNulCharacter() {
        ProjectDeskException e = assertThrows(ProjectDeskException.class,
            () -> PathSandbox.resolve(root, "a\0b"));
        assertEquals(ErrorKind.PATH_ESCAPE, e.getKind());
    }

    @Test
    void rejectsSymlinkPointingOutside(@TempDir Path outside) throws IOException {
        Path link = root.resolve("escape");
        try {
            Files.createSymbolicLink(link, outside);
        } catch (UnsupportedOperationException | IOException e) {
            return; // no symlink support on this filesystem
        }
        assertThrows(ProjectDeskException.class, () -> PathSandbox.resolve(root, "escape/secret.txt"));
    }

    @Test
    void resolveWithinRequiresAnAllowedRoot() {
        List<Path> allowed = List.of(root.resolve("input"), root.resolve("output"));
        assertEquals(root.toAbsolutePath().normalize().resolve("input/a.md"),
            PathSandbox.resolveWithin(root, allowed, "input/a.md"));
        ProjectDeskException e = assertThrows(ProjectDeskException.class,
            () -> PathSandbox.resolveWithin(root, allowed, "secrets/key.txt"));
        assertEquals(ErrorKind.PATH_ESCAPE, e.getKind());
    }

    @Test
    void toRelativeUsesForwardSlashes() {
        Path file = root.resolve("a").resolve("b.txt");
        assertEquals("a/b.txt", PathSandbox.toRelative(root, file));
    }
}

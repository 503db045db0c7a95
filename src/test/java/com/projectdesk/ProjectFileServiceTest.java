package com.projectdesk;

import com.projectdesk.models.FileEntry;
import com.projectdesk.models.FilePreview;
import com.projectdesk.models.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProjectFileServiceTest {

    @TempDir
    Path dir;

    private Project project;
    private final ProjectFileService service = new ProjectFileService();

    @BeforeEach
    void setUp() throws IOException {
        project = TestProjects.demo(dir);
    }

    @Test
    void emptyPathListsConfiguredRoots() throws IOException {
        List<String> rels = service.listEntries(project, "").stream()
            .map(FileEntry::getRel)
            .collect(Collectors.toList());
        assertEquals(List.of("input", "guideline", "output", "output_pending"), rels);
    }

    @Test
    void listingPutsDirectoriesFirstAndHidesIgnoredNames() throws IOException {
        Path input = project.inputRoot();
        TestProjects.write(input.resolve("Zeta.md"), "z");
        TestProjects.write(input.resolve("alpha.md"), "a");
        TestProjects.write(input.resolve(".hidden"), "h");
        Files.createDirectories(input.resolve("node_modules"));
        Files.createDirectories(input.resolve("sub"));

        List<String> names = service.listEntries(project, "input").stream()
            .map(FileEntry::getName)
            .collect(Collectors.toList());

        assertEquals(List.of("sub", "alpha.md", "meeting.md", "Zeta.md"), names);
        assertEquals("input/sub", service.listEntries(project, "input").get(0).getRel());
    }

    @Test
    void listingOutsideAllowedRootsIsRejected() throws IOException {
        Files.createDirectories(project.getRoot().resolve("private"));
        ProjectDeskException e = assertThrows(ProjectDeskException.class,
            () -> service.listEntries(project, "private"));
        assertEquals(ErrorKind.PATH_ESCAPE, e.getKind());
        assertEquals(ErrorKind.NOT_FOUND,
            assertThrows(ProjectDeskException.class, () -> service.listEntries(project, "input/nope")).getKind());
    }

    @Test
    void previewReturnsTextContent() throws IOException {
        FilePreview preview = service.preview(project, "input/meeting.md");
        assertEquals("text", preview.getKind());
        assertEquals("meeting.md", preview.getName());
        assertTrue(preview.getContent().startsWith("# Sync"));
        assertFalse(preview.getTruncated());
    }

    @Test
    void previewTruncatesLargeFiles() throws IOException {
        String big = "x".repeat(ProjectFileService.MAX_PREVIEW_BYTES + 10);
        TestProjects.write(project.inputRoot().resolve("big.txt"), big);

        FilePreview preview = service.preview(project, "input/big.txt");

        assertTrue(preview.getTruncated());
        assertEquals(ProjectFileService.MAX_PREVIEW_BYTES, preview.getContent().length());
        assertEquals(big.length(), preview.getSize());
    }

    @Test
    void previewMarksBinaryFiles() throws IOException {
        Files.write(project.inputRoot().resolve("image.bin"), new byte[] {1, 0, 2, 3});

        FilePreview preview = service.preview(project, "input/image.bin");

        assertEquals("binary", preview.getKind());
        assertNull(preview.getContent());
        assertNotNull(preview.getNote());
    }

    @Test
    void searchMatchesNamesCaseInsensitivelyAcrossRoots() throws IOException {
        TestProjects.write(project.writeRoot().resolve("Meeting-summary.md"), "s");

        List<String> rels = service.search(project, "MEETING", 200).stream()
            .map(FileEntry::getRel)
            .collect(Collectors.toList());

        assertTrue(rels.contains("input/meeting.md"), rels.toString());
        assertTrue(rels.contains("output/Meeting-summary.md"), rels.toString());
    }

    @Test
    void searchClampsLimit() throws IOException {
        for (int i = 0; i < 5; i++) {
            TestProjects.write(project.inputRoot().resolve("note-" + i + ".md"), "n");
        }
        assertEquals(1, service.search(project, "note", 0).size());
        assertEquals(3, service.search(project, "note", 3).size());
        assertTrue(service.search(project, "  ", 10).isEmpty());
    }
}

package com.projectdesk.pipeline;

import com.projectdesk.TestProjects;
import com.projectdesk.models.MentionKind;
import com.projectdesk.models.MentionResolution;
import com.projectdesk.models.Project;
import com.projectdesk.models.ResolvedMention;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MentionResolverTest {

    @TempDir
    Path dir;

    private Project project;
    private final MentionResolver resolver = new MentionResolver();

    @BeforeEach
    void setUp() throws IOException {
        project = TestProjects.demo(dir);
    }

    @Test
    void classifiesEachPrefix() {
        MentionResolution resolution = resolver.resolve(
            "Summarize @input/meeting.md using @guideline/style.md into @output/summary.md, see @notes and @someone",
            project);

        List<ResolvedMention> mentions = resolution.mentions();
        assertEquals(5, mentions.size());
        assertEquals(new ResolvedMention(MentionKind.INPUT, "@input/meeting.md", "meeting.md"), mentions.get(0));
        assertEquals(new ResolvedMention(MentionKind.GUIDELINE, "@guideline/style.md", "style.md"), mentions.get(1));
        assertEquals(new ResolvedMention(MentionKind.OUTPUT, "@output/summary.md", "summary.md"), mentions.get(2));
        assertEquals(new ResolvedMention(MentionKind.ALIAS, "@notes", "input/meeting.md"), mentions.get(3));
        assertEquals(new ResolvedMention(MentionKind.RAW, "@someone", "someone"), mentions.get(4));
    }

    @Test
    void expandsToProjectRelativePathsAndLeavesRawTokens() {
        MentionResolution resolution = resolver.resolve("Read @notes then write @output/a.md for @bob", project);
        assertEquals("Read input/meeting.md then write output/a.md for @bob", resolution.expandedPrompt());
    }

    @Test
    void trailingSentencePunctuationIsNotPartOfTheToken() {
        MentionResolution resolution = resolver.resolve("Save it to @output/summary.md.", project);
        assertEquals("summary.md", resolution.mentions().get(0).relativePath());
        assertEquals("Save it to output/summary.md.", resolution.expandedPrompt());
    }

    @Test
    void acceptsUnicodeFileNames() {
        MentionResolution resolution = resolver.resolve("@input/議事録.txt を要約して @output/要約.md に保存", project);
        assertEquals(2, resolution.mentions().size());
        assertEquals("議事録.txt", resolution.mentions().get(0).relativePath());
        assertEquals(MentionKind.OUTPUT, resolution.mentions().get(1).kind());
        assertEquals("要約.md", resolution.mentions().get(1).relativePath());
    }

    @Test
    void promptWithoutMentionsIsUnchanged() {
        MentionResolution resolution = resolver.resolve("just chat", project);
        assertTrue(resolution.mentions().isEmpty());
        assertEquals("just chat", resolution.expandedPrompt());
        assertTrue(resolver.resolve(null, project).mentions().isEmpty());
    }

    @Test
    void projectPathResolvesSingleMentions() {
        assertEquals("input/meeting.md", resolver.projectPath("notes", project));
        assertEquals("guideline/style.md", resolver.projectPath("guideline/style.md", project));
        assertEquals("docs/x.md", resolver.projectPath("docs/x.md", project));
    }
}

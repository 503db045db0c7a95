package com.projectdesk.pipeline;

import com.projectdesk.models.MentionKind;
import com.projectdesk.models.ResolvedMention;
import com.projectdesk.models.Route;
import com.projectdesk.models.RoutingDecision;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptRouterTest {

    private final PromptRouter router = new PromptRouter();

    private static ResolvedMention input(String path) {
        return new ResolvedMention(MentionKind.INPUT, "@input/" + path, path);
    }

    private static ResolvedMention output(String path) {
        return new ResolvedMention(MentionKind.OUTPUT, "@output/" + path, path);
    }

    private static ResolvedMention guideline(String path) {
        return new ResolvedMention(MentionKind.GUIDELINE, "@guideline/" + path, path);
    }

    @Test
    void summarizeWithInputAndOutputIsStructured() {
        RoutingDecision decision = router.decide("Please SUMMARIZE the meeting",
            List.of(input("m.md"), guideline("g.md"), output("s.md")));

        assertEquals(Route.STRUCTURED, decision.route());
        assertEquals(1, decision.inputs().size());
        assertEquals(1, decision.guidelines().size());
        assertEquals(1, decision.outputs().size());
    }

    @Test
    void japaneseKeywordRoutesStructured() {
        RoutingDecision decision = router.decide("@input/議事録.txt を要約して @output/要約.md に保存",
            List.of(input("議事録.txt"), output("要約.md")));
        assertTrue(decision.isStructured());
    }

    @Test
    void otherLanguagesAreRecognized() {
        List<ResolvedMention> mentions = List.of(input("a.md"), output("b.md"));
        assertTrue(router.decide("会議のまとめを作って", mentions).isStructured());
        assertTrue(router.decide("请总结", mentions).isStructured());
        assertTrue(router.decide("요약해 주세요", mentions).isStructured());
        assertTrue(router.decide("Bitte zusammenfassen", mentions).isStructured());
    }

    @Test
    void missingOutputFallsBack() {
        RoutingDecision decision = router.decide("summarize this", List.of(input("a.md")));
        assertEquals(Route.FALLBACK, decision.route());
    }

    @Test
    void missingInputFallsBack() {
        assertFalse(router.decide("summary please", List.of(output("a.md"))).isStructured());
    }

    @Test
    void noKeywordFallsBack() {
        assertFalse(router.decide("translate this", List.of(input("a.md"), output("b.md"))).isStructured());
    }

    @Test
    void aliasMentionsDoNotCountAsInputs() {
        ResolvedMention alias = new ResolvedMention(MentionKind.ALIAS, "@notes", "input/meeting.md");
        assertFalse(router.decide("summarize", List.of(alias, output("b.md"))).isStructured());
    }
}

package com.projectdesk.pipeline;

import com.projectdesk.models.MentionKind;
import com.projectdesk.models.ResolvedMention;
import com.projectdesk.models.Route;
import com.projectdesk.models.RoutingDecision;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Chooses the structured summarize-and-save pipeline or the fallback agent.
 * Structured needs a summarization keyword and at least one input and one output mention.
 */
public class PromptRouter {

    static final List<String> SUMMARY_KEYWORDS = List.of(
        "summarize", "summarise", "summary", "summarization", "summarisation",
        "要約", "まとめ", "サマリ",
        "总结", "總結", "摘要",
        "요약",
        "resumir", "résumé", "zusammenfass"
    );

    public RoutingDecision decide(String prompt, List<ResolvedMention> mentions) {
        List<ResolvedMention> inputs = ofKind(mentions, MentionKind.INPUT);
        List<ResolvedMention> guidelines = ofKind(mentions, MentionKind.GUIDELINE);
        List<ResolvedMention> outputs = ofKind(mentions, MentionKind.OUTPUT);

        boolean structured = hasSummaryIntent(prompt) && !inputs.isEmpty() && !outputs.isEmpty();
        return new RoutingDecision(structured ? Route.STRUCTURED : Route.FALLBACK, inputs, guidelines, outputs);
    }

    static boolean hasSummaryIntent(String prompt) {
        if (prompt == null || prompt.isEmpty()) {
            return false;
        }
        String lowered = prompt.toLowerCase(Locale.ROOT);
        for (String keyword : SUMMARY_KEYWORDS) {
            if (lowered.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static List<ResolvedMention> ofKind(List<ResolvedMention> mentions, MentionKind kind) {
        if (mentions == null) {
            return List.of();
        }
        return mentions.stream()
            .filter(m -> m.kind() == kind)
            .collect(Collectors.toList());
    }
}

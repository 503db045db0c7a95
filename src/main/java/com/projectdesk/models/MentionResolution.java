package com.projectdesk.models;

import java.util.List;

/**
 * Result of scanning a prompt: the prompt with mentions expanded, and the mentions in order of appearance.
 */
public record MentionResolution(String expandedPrompt, List<ResolvedMention> mentions) {

    public MentionResolution {
        mentions = List.copyOf(mentions);
    }
}

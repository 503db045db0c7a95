package com.projectdesk.models;

import java.util.Map;

/**
 * Response of a non-streamed request: the final text plus route and staging metadata.
 */
public class AskResult {
    private final String text;
    private final Map<String, Object> meta;

    public AskResult(String text, Map<String, Object> meta) {
        this.text = text;
        this.meta = meta;
    }

    public String getText() {
        return text;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }
}

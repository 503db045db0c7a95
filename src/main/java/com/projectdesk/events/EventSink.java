package com.projectdesk.events;

import com.projectdesk.models.StagedFile;

import java.util.Map;

/**
 * Progress callbacks for a running request. Implementations must be thread-safe.
 */
public interface EventSink {

    EventSink NONE = new EventSink() {
        @Override
        public void status(String stage, Map<String, Object> details) {
        }

        @Override
        public void chunk(String text) {
        }

        @Override
        public void fileWritten(StagedFile file) {
        }
    };

    void status(String stage, Map<String, Object> details);

    default void status(String stage) {
        status(stage, Map.of());
    }

    void chunk(String text);

    void fileWritten(StagedFile file);
}

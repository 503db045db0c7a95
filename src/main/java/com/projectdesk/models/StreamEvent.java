package com.projectdesk.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One progress event of a streamed request. {@code sequence} increases by one per event.
 * Payload keys keep their insertion order on the wire.
 */
public record StreamEvent(long sequence, StreamEventKind kind, Map<String, Object> payload) {

    public StreamEvent {
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}

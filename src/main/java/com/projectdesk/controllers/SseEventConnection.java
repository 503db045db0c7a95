package com.projectdesk.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectdesk.events.EventConnection;
import com.projectdesk.models.StreamEvent;
import io.javalin.http.sse.SseClient;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link EventConnection} over a Javalin {@link SseClient}.
 * Frames are {@code event: <kind>}, {@code id: <sequence>}, {@code data: <json payload>}.
 */
class SseEventConnection implements EventConnection {

    private final SseClient client;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final List<Runnable> closeCallbacks = new CopyOnWriteArrayList<>();

    SseEventConnection(SseClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
        // SseClient keeps a single close callback; fan it out here
        client.onClose(this::clientClosed);
    }

    @Override
    public void send(StreamEvent event) throws IOException {
        if (!open.get()) {
            throw new IOException("Stream already closed");
        }
        String data = objectMapper.writeValueAsString(event.payload());
        client.sendEvent(event.kind().wireName(), data, String.valueOf(event.sequence()));
    }

    @Override
    public void sendComment(String comment) throws IOException {
        if (!open.get()) {
            throw new IOException("Stream already closed");
        }
        client.sendComment(comment);
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void onClose(Runnable callback) {
        closeCallbacks.add(callback);
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            client.close();
        }
    }

    private void clientClosed() {
        // Only a disconnect from the client side notifies listeners.
        if (open.compareAndSet(true, false)) {
            for (Runnable callback : closeCallbacks) {
                callback.run();
            }
        }
    }
}

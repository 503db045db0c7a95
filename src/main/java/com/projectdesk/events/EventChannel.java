package com.projectdesk.events;

import com.projectdesk.AppLogger;
import com.projectdesk.ErrorKind;
import com.projectdesk.models.StagedFile;
import com.projectdesk.models.StreamEvent;
import com.projectdesk.models.StreamEventKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Ordered, unbounded event buffer for one streamed request.
 * <p>
 * Producers emit status, chunk and file_written events and finish with exactly one done or error.
 * Anything emitted after the terminal event, or after {@link #cancel()}, is dropped.
 * Slow consumers never block producers.
 */
public class EventChannel implements EventSink {

    private final LinkedBlockingQueue<StreamEvent> queue = new LinkedBlockingQueue<>();
    private final List<Runnable> cancelHandlers = new ArrayList<>();
    private final AppLogger logger = AppLogger.get();
    private long nextSequence = 1;
    private boolean terminated;
    private boolean cancelled;

    @Override
    public void status(String stage, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stage", stage);
        payload.putAll(details);
        emit(StreamEventKind.STATUS, payload);
    }

    @Override
    public void chunk(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        emit(StreamEventKind.CHUNK, Map.of("text", text));
    }

    @Override
    public void fileWritten(StagedFile file) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("path", file.mention());
        payload.put("size", file.getSize());
        emit(StreamEventKind.FILE_WRITTEN, payload);
    }

    public boolean done(Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.putAll(payload);
        return emit(StreamEventKind.DONE, body);
    }

    public boolean error(String message, ErrorKind kind) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message != null ? message : "Unknown error");
        body.put("kind", kind != null ? kind.wireName() : "internal");
        return emit(StreamEventKind.ERROR, body);
    }

    /**
     * Appends an event unless the channel is already terminated or cancelled.
     *
     * @return true if the event was accepted
     */
    public synchronized boolean emit(StreamEventKind kind, Map<String, Object> payload) {
        if (terminated || cancelled) {
            return false;
        }
        queue.add(new StreamEvent(nextSequence++, kind, payload));
        if (kind.isTerminal()) {
            terminated = true;
        }
        return true;
    }

    /**
     * Next event, waiting up to {@code timeout}; null if none arrived in time.
     */
    public StreamEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Registers work to stop when the consumer goes away. Runs immediately if already cancelled.
     */
    public void onCancel(Runnable handler) {
        boolean runNow;
        synchronized (this) {
            runNow = cancelled;
            if (!runNow) {
                cancelHandlers.add(handler);
            }
        }
        if (runNow) {
            handler.run();
        }
    }

    public void cancel() {
        List<Runnable> handlers;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            handlers = new ArrayList<>(cancelHandlers);
            cancelHandlers.clear();
        }
        for (Runnable handler : handlers) {
            try {
                handler.run();
            } catch (RuntimeException e) {
                logger.warn("Cancel handler failed: " + e.getMessage());
            }
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized boolean isTerminated() {
        return terminated;
    }
}

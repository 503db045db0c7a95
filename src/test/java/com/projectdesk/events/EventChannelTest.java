package com.projectdesk.events;

import com.projectdesk.ErrorKind;
import com.projectdesk.models.StagedFile;
import com.projectdesk.models.StreamEvent;
import com.projectdesk.models.StreamEventKind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventChannelTest {

    @Test
    void eventsKeepOrderAndSequence() throws Exception {
        EventChannel channel = new EventChannel();
        channel.status("reading");
        channel.chunk("hello");
        channel.fileWritten(new StagedFile("summary.md", 5, false, 0L, null));
        channel.done(Map.of("route", "structured"));

        StreamEvent status = channel.poll(1, TimeUnit.SECONDS);
        assertEquals(1, status.sequence());
        assertEquals(StreamEventKind.STATUS, status.kind());
        assertEquals("reading", status.payload().get("stage"));

        StreamEvent chunk = channel.poll(1, TimeUnit.SECONDS);
        assertEquals("hello", chunk.payload().get("text"));

        StreamEvent written = channel.poll(1, TimeUnit.SECONDS);
        assertEquals("@output/summary.md", written.payload().get("path"));
        assertEquals(5L, written.payload().get("size"));

        StreamEvent done = channel.poll(1, TimeUnit.SECONDS);
        assertEquals(4, done.sequence());
        assertEquals(true, done.payload().get("ok"));
        assertEquals("structured", done.payload().get("route"));
        assertTrue(channel.isTerminated());
    }

    @Test
    void payloadKeysKeepInsertionOrder() throws Exception {
        EventChannel channel = new EventChannel();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("step", 2);
        details.put("of", 5);
        channel.status("generating", details);
        channel.fileWritten(new StagedFile("summary.md", 5, false, 0L, null));
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("route", "agent");
        extra.put("staged", List.of("summary.md"));
        channel.done(extra);

        assertEquals(List.of("stage", "step", "of"),
            List.copyOf(channel.poll(1, TimeUnit.SECONDS).payload().keySet()));
        assertEquals(List.of("path", "size"),
            List.copyOf(channel.poll(1, TimeUnit.SECONDS).payload().keySet()));
        assertEquals(List.of("ok", "route", "staged"),
            List.copyOf(channel.poll(1, TimeUnit.SECONDS).payload().keySet()));
    }

    @Test
    void nothingIsAcceptedAfterTerminalEvent() throws Exception {
        EventChannel channel = new EventChannel();
        assertTrue(channel.error("boom", ErrorKind.GENERATION_FAILURE));
        assertFalse(channel.done(Map.of()));
        assertFalse(channel.emit(StreamEventKind.CHUNK, Map.of("text", "late")));

        StreamEvent error = channel.poll(1, TimeUnit.SECONDS);
        assertEquals("generation_failure", error.payload().get("kind"));
        assertNull(channel.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void errorWithoutKindIsInternal() throws Exception {
        EventChannel channel = new EventChannel();
        channel.error(null, null);
        StreamEvent error = channel.poll(1, TimeUnit.SECONDS);
        assertEquals("internal", error.payload().get("kind"));
        assertEquals("Unknown error", error.payload().get("message"));
    }

    @Test
    void emptyChunksAreSkipped() throws Exception {
        EventChannel channel = new EventChannel();
        channel.chunk("");
        channel.chunk(null);
        assertNull(channel.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelRunsHandlersOnceAndDropsLaterEvents() {
        EventChannel channel = new EventChannel();
        AtomicInteger calls = new AtomicInteger();
        channel.onCancel(calls::incrementAndGet);

        channel.cancel();
        channel.cancel();
        assertEquals(1, calls.get());
        assertTrue(channel.isCancelled());
        assertFalse(channel.emit(StreamEventKind.STATUS, Map.of("stage", "late")));

        channel.onCancel(calls::incrementAndGet);
        assertEquals(2, calls.get());
    }
}

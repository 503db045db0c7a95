package com.projectdesk.events;

import com.projectdesk.AppLogger;
import com.projectdesk.models.StreamEvent;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Drains an {@link EventChannel} onto a client connection.
 * <p>
 * Sends a keep-alive comment after each quiet interval, stops after the terminal event and
 * closes the connection. A client disconnect cancels the channel (and with it the running work);
 * files already staged stay staged.
 */
public class EventStreamPublisher {

    public static final long DEFAULT_HEARTBEAT_MS = 15_000;

    private final long heartbeatMs;
    private final AppLogger logger = AppLogger.get();

    public EventStreamPublisher() {
        this(DEFAULT_HEARTBEAT_MS);
    }

    public EventStreamPublisher(long heartbeatMs) {
        this.heartbeatMs = heartbeatMs;
    }

    /**
     * Blocks until the terminal event was sent or the client went away.
     *
     * @return true if the terminal event reached the connection
     */
    public boolean publish(EventConnection connection, EventChannel channel) {
        connection.onClose(channel::cancel);
        try {
            while (connection.isOpen()) {
                StreamEvent event = channel.poll(heartbeatMs, TimeUnit.MILLISECONDS);
                if (!connection.isOpen()) {
                    break;
                }
                if (event == null) {
                    connection.sendComment("ping");
                    continue;
                }
                connection.send(event);
                if (event.kind().isTerminal()) {
                    return true;
                }
            }
            logger.info("Stream client disconnected; cancelling run");
            channel.cancel();
            return false;
        } catch (IOException e) {
            logger.warn("Stream write failed, cancelling run: " + e.getMessage());
            channel.cancel();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.cancel();
            return false;
        } finally {
            connection.close();
        }
    }
}

package com.projectdesk.events;

import com.projectdesk.models.StreamEvent;

import java.io.IOException;

/**
 * Transport for one client stream, independent of the HTTP framework.
 */
public interface EventConnection {

    void send(StreamEvent event) throws IOException;

    void sendComment(String comment) throws IOException;

    boolean isOpen();

    /**
     * Called once when the client disconnects.
     */
    void onClose(Runnable callback);

    void close();
}

package com.projectdesk.providers.chat;

import java.io.IOException;

/**
 * The provider answered with a non-2xx status.
 */
public class ChatCallException extends IOException {

    private final int statusCode;

    public ChatCallException(int statusCode, String body) {
        super("Provider answered " + statusCode + ": " + abbreviate(body));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }
}

package com.projectdesk.models;

public enum StreamEventKind {
    STATUS("status"),
    CHUNK("chunk"),
    FILE_WRITTEN("file_written"),
    DONE("done"),
    ERROR("error");

    private final String wireName;

    StreamEventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}

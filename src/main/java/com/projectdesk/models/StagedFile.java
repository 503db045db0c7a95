package com.projectdesk.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A pending write under a project's staging root, keyed by its write-root-relative path.
 * {@code content} is only populated when the bytes were written or read explicitly.
 */
public class StagedFile {

    private final String path;
    private final long size;
    private final boolean committedExists;
    private final long modifiedAt;
    private final byte[] content;

    public StagedFile(String path, long size, boolean committedExists, long modifiedAt, byte[] content) {
        this.path = path;
        this.size = size;
        this.committedExists = committedExists;
        this.modifiedAt = modifiedAt;
        this.content = content;
    }

    public String getPath() {
        return path;
    }

    public long getSize() {
        return size;
    }

    public boolean isCommittedExists() {
        return committedExists;
    }

    public long getModifiedAt() {
        return modifiedAt;
    }

    @JsonIgnore
    public byte[] getContent() {
        return content;
    }

    /**
     * Acknowledgement form used in responses and {@code file_written} events.
     */
    @JsonIgnore
    public String mention() {
        return "@output/" + path;
    }
}

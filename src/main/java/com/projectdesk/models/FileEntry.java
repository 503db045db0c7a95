package com.projectdesk.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class FileEntry {
    private String name;
    private String rel;
    private String type; // "dir" or "file"

    public FileEntry(String name, String rel, String type) {
        this.name = name;
        this.rel = rel;
        this.type = type;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getRel() { return rel; }
    public void setRel(String rel) { this.rel = rel; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    @JsonIgnore
    public boolean isDir() {
        return "dir".equals(type);
    }
}

package com.projectdesk.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilePreview {
    private String name;
    private String rel;
    private long size;
    private String mime;
    private String kind; // "text" or "binary"
    private String content;
    private Boolean truncated;
    private String note;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getRel() { return rel; }
    public void setRel(String rel) { this.rel = rel; }

    public long getSize() { return size; }
    public void setSize(long size) { this.size = size; }

    public String getMime() { return mime; }
    public void setMime(String mime) { this.mime = mime; }

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public Boolean getTruncated() { return truncated; }
    public void setTruncated(Boolean truncated) { this.truncated = truncated; }

    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }

    @JsonIgnore
    public boolean isText() {
        return "text".equals(kind);
    }
}

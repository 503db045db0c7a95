package com.projectdesk.models;

public enum MentionKind {
    INPUT,
    GUIDELINE,
    OUTPUT,
    ALIAS,
    RAW
}

package com.projectdesk.models;

public enum Route {
    STRUCTURED,
    FALLBACK
}

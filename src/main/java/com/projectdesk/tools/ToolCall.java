package com.projectdesk.tools;

import java.util.Map;

public class ToolCall {
    private final String name;
    private final Map<String, Object> args;
    private final String raw;

    public ToolCall(String name, Map<String, Object> args, String raw) {
        this.name = name;
        this.args = args;
        this.raw = raw;
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public String getRaw() {
        return raw;
    }

    public String stringArg(String key) {
        Object value = args != null ? args.get(key) : null;
        return value != null ? value.toString() : null;
    }
}

package com.projectdesk.tools;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class ToolSchemaRegistry {
    private final Map<String, ToolSchema> schemas = new LinkedHashMap<>();

    public ToolSchemaRegistry register(ToolSchema schema) {
        if (schema != null && schema.getToolId() != null) {
            schemas.put(schema.getToolId(), schema);
        }
        return this;
    }

    public boolean hasTool(String toolId) {
        return toolId != null && schemas.containsKey(toolId);
    }

    public ToolSchema getSchema(String toolId) {
        return toolId != null ? schemas.get(toolId) : null;
    }

    public Set<String> getToolIds() {
        return Collections.unmodifiableSet(schemas.keySet());
    }

    public Collection<ToolSchema> getSchemas() {
        return Collections.unmodifiableCollection(schemas.values());
    }

    /**
     * The sandboxed file tools offered to the fallback agent.
     */
    public static ToolSchemaRegistry projectTools(boolean shellEnabled) {
        ToolSchemaRegistry registry = new ToolSchemaRegistry()
            .register(new ToolSchema("read", "Read a project file (path relative to the project root).")
                .arg("path", ToolArgSpec.ArgType.STRING, true)
                .alias("file_path", "path")
                .alias("file", "path"))
            .register(new ToolSchema("write", "Write a file; path is relative to the write dir. The file is staged for approval.")
                .arg("path", ToolArgSpec.ArgType.STRING, true)
                .arg("content", ToolArgSpec.ArgType.STRING, true)
                .alias("file_path", "path")
                .alias("file", "path")
                .alias("text", "content"))
            .register(new ToolSchema("list", "List a directory (path relative to the project root; empty for the roots).")
                .arg("path", ToolArgSpec.ArgType.STRING, false)
                .alias("dir", "path")
                .alias("directory", "path"));
        if (shellEnabled) {
            registry.register(new ToolSchema("shell", "Run a shell command in the staging dir.")
                .arg("command", ToolArgSpec.ArgType.STRING, true)
                .alias("cmd", "command"));
        }
        return registry;
    }
}

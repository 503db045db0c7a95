package com.projectdesk.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

public class ToolSchema {
    private final String toolId;
    private final String description;
    private final Map<String, ToolArgSpec> args = new LinkedHashMap<>();
    // Alias -> canonical arg name
    private final Map<String, String> argAliases = new LinkedHashMap<>();

    public ToolSchema(String toolId, String description) {
        this.toolId = toolId;
        this.description = description;
    }

    public ToolSchema arg(String name, ToolArgSpec.ArgType type, boolean required) {
        args.put(name, new ToolArgSpec(name, type, required));
        return this;
    }

    public ToolSchema alias(String alias, String canonical) {
        if (alias == null || alias.isBlank() || canonical == null || canonical.isBlank()) {
            return this;
        }
        argAliases.put(normalizeArgKey(alias), canonical);
        return this;
    }

    public String getToolId() {
        return toolId;
    }

    public String getDescription() {
        return description;
    }

    public Set<String> getArgNames() {
        return args.keySet();
    }

    /**
     * One-line usage shown to the model, e.g. {@code write {"path": string, "content": string}}.
     */
    public String usage() {
        StringJoiner joined = new StringJoiner(", ", toolId + " {", "}");
        for (ToolArgSpec spec : args.values()) {
            joined.add(spec.usage());
        }
        return joined.toString();
    }

    public JsonNode normalizeArgsNode(JsonNode argsNode) {
        if (argsNode == null || !argsNode.isObject()) {
            return argsNode;
        }
        // Copy to avoid mutating the parsed JSON tree.
        ObjectNode obj = ((ObjectNode) argsNode).deepCopy();

        List<String> keys = new ArrayList<>();
        Iterator<String> it = obj.fieldNames();
        while (it.hasNext()) {
            keys.add(it.next());
        }
        for (String key : keys) {
            if (args.containsKey(key)) continue;

            String norm = normalizeArgKey(key);
            String canonical = args.containsKey(norm) ? norm : argAliases.get(norm);
            if (canonical == null || canonical.isBlank()) {
                continue;
            }
            if (!obj.has(canonical)) {
                obj.set(canonical, obj.get(key));
            }
            obj.remove(key);
        }
        return obj;
    }

    private String normalizeArgKey(String key) {
        if (key == null) return "";
        String k = key.trim().toLowerCase(Locale.ROOT);
        // Unify common separators.
        return k.replace('-', '_').replace(' ', '_');
    }

    public String validate(JsonNode argsNode) {
        JsonNode normalized = normalizeArgsNode(argsNode);
        if (normalized == null || !normalized.isObject()) {
            return "args-not-object";
        }
        for (ToolArgSpec spec : args.values()) {
            String error = spec.check(normalized.get(spec.name()));
            if (error != null) {
                return error;
            }
        }
        Iterator<String> fields = normalized.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!args.containsKey(field)) {
                return "unknown-arg:" + field;
            }
        }
        return null;
    }
}

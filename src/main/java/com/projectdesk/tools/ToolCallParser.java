package com.projectdesk.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Recognizes a model reply that consists of exactly one JSON tool call:
 * {@code {"tool": "<id>", "args": {...}}}, optionally wrapped in a single code fence.
 * Anything else is not a tool call and is treated as the model's final answer.
 */
public class ToolCallParser {
    public static final String ERR_INVALID_FORMAT = "tool_call_invalid_format";
    public static final String ERR_MULTIPLE = "tool_call_multiple";
    public static final String ERR_UNKNOWN_TOOL = "tool_call_unknown_tool";
    public static final String ERR_INVALID_ARGS = "tool_call_invalid_args";

    private static final Map<String, String> TOOL_ALIASES = buildToolAliases();

    private final ObjectMapper objectMapper;
    private final ToolSchemaRegistry schemaRegistry;

    public ToolCallParser(ObjectMapper objectMapper, ToolSchemaRegistry schemaRegistry) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.schemaRegistry = schemaRegistry;
    }

    public ToolCallParseResult parseStrict(String content) {
        if (content == null) {
            return ToolCallParseResult.noCall();
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return ToolCallParseResult.noCall();
        }
        trimmed = unwrapStrictJsonCodeFence(trimmed);
        trimmed = stripInvisibleEdgeChars(trimmed);
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            return ToolCallParseResult.noCall();
        }
        if (containsMultipleJsonObjects(trimmed)) {
            return ToolCallParseResult.error(ERR_MULTIPLE);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (Exception e) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT);
        }
        if (node == null || !node.isObject()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT);
        }
        JsonNode toolNode = node.get("tool");
        JsonNode argsNode = node.get("args");
        if (toolNode == null || !toolNode.isTextual() || argsNode == null || !argsNode.isObject()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT);
        }
        Iterator<String> fields = node.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!"tool".equals(field) && !"args".equals(field)) {
                return ToolCallParseResult.error(ERR_INVALID_FORMAT, "unknown-field:" + field);
            }
        }
        String toolRaw = toolNode.asText();
        String tool = toolRaw.trim();
        if (tool.isBlank()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT, "blank-tool");
        }
        String canonical = canonicalToolId(tool);
        if (canonical == null) {
            return ToolCallParseResult.error(ERR_UNKNOWN_TOOL, "unknown-tool:" + truncate(toolRaw, 60));
        }
        ToolSchema schema = schemaRegistry.getSchema(canonical);
        JsonNode normalizedArgsNode = schema.normalizeArgsNode(argsNode);
        String validationError = schema.validate(normalizedArgsNode);
        if (validationError != null) {
            return ToolCallParseResult.error(ERR_INVALID_ARGS, validationError);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> args = objectMapper.convertValue(normalizedArgsNode, Map.class);
        return ToolCallParseResult.call(new ToolCall(canonical, args, trimmed));
    }

    // Models drift on case and separators ("Read", "read-file"); the registry stays authoritative.
    private String canonicalToolId(String tool) {
        if (schemaRegistry == null) {
            return null;
        }
        if (schemaRegistry.hasTool(tool)) {
            return tool;
        }
        String lower = tool.toLowerCase(Locale.ROOT).replace('-', '_');
        if (schemaRegistry.hasTool(lower)) {
            return lower;
        }
        String alias = TOOL_ALIASES.get(lower);
        if (alias != null && schemaRegistry.hasTool(alias)) {
            return alias;
        }
        return null;
    }

    private String truncate(String value, int max) {
        if (value == null) return "";
        String v = value.trim();
        if (v.length() <= max) return v;
        return v.substring(0, max) + "...";
    }

    private String unwrapStrictJsonCodeFence(String trimmed) {
        String t = trimmed.trim();
        if (!t.startsWith("```")) return t;
        // Only a single JSON object inside a single fence, no prose around it.
        String[] lines = t.split("\n", -1);
        if (lines.length < 3) return t;
        String first = lines[0].trim();
        String last = lines[lines.length - 1].trim();
        if (!first.startsWith("```") || !"```".equals(last)) return t;
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < lines.length - 1; i++) {
            sb.append(lines[i]);
            if (i < lines.length - 2) sb.append("\n");
        }
        return sb.toString().trim();
    }

    private String stripInvisibleEdgeChars(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isInvisible(value.charAt(start))) {
            start++;
        }
        while (end > start && isInvisible(value.charAt(end - 1))) {
            end--;
        }
        if (start == 0 && end == value.length()) return value;
        return value.substring(start, end).trim();
    }

    private static boolean isInvisible(char c) {
        return c == '\uFEFF' || c == '\u200B' || c == '\u200C' || c == '\u200D' || c == '\u2060';
    }

    // Braces inside string values are skipped so file contents with JSON do not count.
    private boolean containsMultipleJsonObjects(String trimmed) {
        int depth = 0;
        boolean seenObject = false;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
                if (depth == 1 && seenObject) {
                    return true;
                }
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
                if (depth == 0) {
                    seenObject = true;
                }
            }
        }
        return false;
    }

    private static Map<String, String> buildToolAliases() {
        // Keep this list small and high-confidence.
        Map<String, String> map = new HashMap<>();
        map.put("read_file", "read");
        map.put("readfile", "read");
        map.put("cat", "read");
        map.put("write_file", "write");
        map.put("writefile", "write");
        map.put("save", "write");
        map.put("list_files", "list");
        map.put("list_dir", "list");
        map.put("ls", "list");
        map.put("bash", "shell");
        map.put("run", "shell");
        map.put("exec", "shell");
        return Collections.unmodifiableMap(map);
    }
}

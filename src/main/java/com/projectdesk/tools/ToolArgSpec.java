package com.projectdesk.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One named argument of a tool call.
 */
public record ToolArgSpec(String name, ArgType type, boolean required) {

    /**
     * JSON value kinds a tool argument may take; {@link #label()} is how the model sees them.
     */
    public enum ArgType {
        STRING("string") {
            @Override
            boolean accepts(JsonNode value) {
                return value.isTextual();
            }
        },
        INTEGER("integer") {
            @Override
            boolean accepts(JsonNode value) {
                return value.isIntegralNumber() && value.canConvertToInt();
            }
        },
        BOOLEAN("boolean") {
            @Override
            boolean accepts(JsonNode value) {
                return value.isBoolean();
            }
        };

        private final String label;

        ArgType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        abstract boolean accepts(JsonNode value);
    }

    /**
     * @return null if {@code value} is acceptable, else an error code such as {@code missing-required:path}
     */
    public String check(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return required ? "missing-required:" + name : null;
        }
        return type.accepts(value) ? null : "invalid-type:" + name + " (expected " + type.label() + ")";
    }

    public String usage() {
        return '"' + name + "\": " + type.label() + (required ? "" : "?");
    }
}

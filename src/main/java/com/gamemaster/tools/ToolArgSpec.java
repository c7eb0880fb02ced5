package com.gamemaster.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single string argument of a tool. Every adventure tool takes text only.
 */
public class ToolArgSpec {

    private final String name;
    private final String description;
    private final boolean required;
    private final int maxLength;

    public ToolArgSpec(String name, String description, boolean required, int maxLength) {
        this.name = name;
        this.description = description;
        this.required = required;
        this.maxLength = maxLength;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getType() {
        return "string";
    }

    public boolean isRequired() {
        return required;
    }

    public int getMaxLength() {
        return maxLength;
    }

    /**
     * Checks presence and type only.
     *
     * @return an error code, or null when the value is acceptable
     */
    public String validate(JsonNode node) {
        if (node == null || node.isNull()) {
            return required ? "missing-required:" + name : null;
        }
        if (!node.isTextual()) {
            return "invalid-type:" + name;
        }
        return null;
    }

    /**
     * Clips a value to {@code maxLength}; zero means unbounded.
     */
    public String clip(String value) {
        if (value == null || maxLength <= 0 || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}

package com.gamemaster.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ToolSchema {

    private final String toolId;
    private final String description;
    private final Map<String, ToolArgSpec> args = new LinkedHashMap<>();

    public ToolSchema(String toolId, String description) {
        this.toolId = toolId;
        this.description = description;
    }

    public ToolSchema arg(String name, String description, boolean required, int maxLength) {
        args.put(name, new ToolArgSpec(name, description, required, maxLength));
        return this;
    }

    public String getToolId() {
        return toolId;
    }

    public String getDescription() {
        return description;
    }

    public List<ToolArgSpec> getArgs() {
        return new ArrayList<>(args.values());
    }

    public ToolArgSpec getArg(String name) {
        return name != null ? args.get(name) : null;
    }

    /**
     * @return the first error code found, or null if {@code argsNode} satisfies the schema
     */
    public String validate(JsonNode argsNode) {
        if (argsNode == null || !argsNode.isObject()) {
            return "args-not-object";
        }
        for (ToolArgSpec spec : args.values()) {
            String error = spec.validate(argsNode.get(spec.getName()));
            if (error != null) {
                return error;
            }
        }
        Iterator<String> fields = argsNode.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!args.containsKey(field)) {
                return "unknown-arg:" + field;
            }
        }
        return null;
    }
}

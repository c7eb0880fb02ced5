package com.gamemaster.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Strict parser for {@code {"tool": "...", "args": {...}}} requests from the host runtime.
 */
public class ToolCallParser {

    public static final String ERR_INVALID_FORMAT = "tool_call_invalid_format";
    public static final String ERR_UNKNOWN_TOOL = "tool_call_unknown_tool";
    public static final String ERR_INVALID_ARGS = "tool_call_invalid_args";

    private final ObjectMapper objectMapper;
    private final ToolSchemaRegistry schemaRegistry;

    public ToolCallParser(ObjectMapper objectMapper, ToolSchemaRegistry schemaRegistry) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.schemaRegistry = schemaRegistry;
    }

    public ToolCallParseResult parse(String body) {
        if (body == null || body.isBlank()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT, "empty-body");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (Exception e) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT, "invalid-json");
        }
        return parse(node);
    }

    public ToolCallParseResult parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT);
        }
        Iterator<String> fields = node.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!"tool".equals(field) && !"args".equals(field)) {
                return ToolCallParseResult.error(ERR_INVALID_FORMAT, "unknown-field:" + field);
            }
        }
        JsonNode toolNode = node.get("tool");
        if (toolNode == null || !toolNode.isTextual() || toolNode.asText().isBlank()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT, "blank-tool");
        }
        JsonNode argsNode = node.get("args");
        if (argsNode == null || argsNode.isNull()) {
            argsNode = objectMapper.createObjectNode();
        }
        if (!argsNode.isObject()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT, "args-not-object");
        }

        String tool = canonicalToolId(toolNode.asText());
        if (tool == null) {
            return ToolCallParseResult.error(ERR_UNKNOWN_TOOL, "unknown-tool:" + truncate(toolNode.asText(), 60));
        }
        ToolSchema schema = schemaRegistry.getSchema(tool);
        String validationError = schema.validate(argsNode);
        if (validationError != null) {
            return ToolCallParseResult.error(ERR_INVALID_ARGS, validationError);
        }

        Map<String, String> args = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = argsNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getValue().isNull()) {
                args.put(entry.getKey(), schema.getArg(entry.getKey()).clip(entry.getValue().asText()));
            }
        }
        return ToolCallParseResult.call(new ToolCall(tool, args));
    }

    // Hosts sometimes send "Player-Action" or " get_scene "; the registry stays authoritative.
    private String canonicalToolId(String raw) {
        String trimmed = raw.trim();
        if (schemaRegistry.hasTool(trimmed)) {
            return trimmed;
        }
        String normalized = trimmed.toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return schemaRegistry.hasTool(normalized) ? normalized : null;
    }

    private String truncate(String value, int max) {
        String v = value.trim();
        if (v.length() <= max) return v;
        return v.substring(0, max) + "...";
    }
}

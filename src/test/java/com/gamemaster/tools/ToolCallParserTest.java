package com.gamemaster.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallParserTest {

    private ToolCallParser buildParser() {
        return new ToolCallParser(new ObjectMapper(), ToolSchemaRegistry.adventureTools());
    }

    @Test
    void parseValidToolCall() {
        ToolCallParser parser = buildParser();
        String json = "{\"tool\":\"player_action\",\"args\":{\"action\":\"open the hatch\"}}";
        ToolCallParseResult result = parser.parse(json);
        assertTrue(result.isToolCall());
        assertEquals("player_action", result.getCall().getName());
        assertEquals("open the hatch", result.getCall().arg("action"));
    }

    @Test
    void argsMayBeOmittedForArgumentlessTools() {
        ToolCallParseResult result = buildParser().parse("{\"tool\":\"get_scene\"}");
        assertTrue(result.isToolCall());
        assertTrue(result.getCall().getArgs().isEmpty());
    }

    @Test
    void toolNamesAreCanonicalized() {
        ToolCallParseResult result = buildParser().parse("{\"tool\":\" Show-Journal \",\"args\":{}}");
        assertTrue(result.isToolCall());
        assertEquals(ToolSchemaRegistry.SHOW_JOURNAL, result.getCall().getName());
    }

    @Test
    void optionalNameMayBeAbsent() {
        ToolCallParseResult result = buildParser().parse("{\"tool\":\"start_adventure\",\"args\":{}}");
        assertTrue(result.isToolCall());
        assertNull(result.getCall().arg("player_name"));
    }

    @Test
    void rejectsUnknownTool() {
        ToolCallParseResult result = buildParser().parse("{\"tool\":\"cast_spell\",\"args\":{}}");
        assertFalse(result.isToolCall());
        assertEquals(ToolCallParser.ERR_UNKNOWN_TOOL, result.getErrorCode());
    }

    @Test
    void rejectsInvalidArgsUnknownKey() {
        ToolCallParseResult result = buildParser()
            .parse("{\"tool\":\"player_action\",\"args\":{\"action\":\"fight\",\"extra\":true}}");
        assertFalse(result.isToolCall());
        assertEquals(ToolCallParser.ERR_INVALID_ARGS, result.getErrorCode());
        assertEquals("unknown-arg:extra", result.getErrorDetail());
    }

    @Test
    void rejectsMissingAction() {
        ToolCallParseResult missing = buildParser().parse("{\"tool\":\"player_action\",\"args\":{}}");
        assertEquals(ToolCallParser.ERR_INVALID_ARGS, missing.getErrorCode());
        assertEquals("missing-required:action", missing.getErrorDetail());
    }

    @Test
    void blankActionIsPassedThrough() {
        ToolCallParseResult blank = buildParser().parse("{\"tool\":\"player_action\",\"args\":{\"action\":\"  \"}}");
        assertTrue(blank.isToolCall());
        assertEquals("  ", blank.getCall().arg("action"));
    }

    @Test
    void rejectsNonStringArgs() {
        ToolCallParseResult number = buildParser().parse("{\"tool\":\"player_action\",\"args\":{\"action\":42}}");
        assertEquals(ToolCallParser.ERR_INVALID_ARGS, number.getErrorCode());
        assertEquals("invalid-type:action", number.getErrorDetail());
    }

    @Test
    void overlongArgsAreClipped() {
        ToolCallParser parser = buildParser();
        ToolCallParseResult action = parser.parse(
            "{\"tool\":\"player_action\",\"args\":{\"action\":\"" + "a".repeat(501) + "\"}}");
        assertTrue(action.isToolCall());
        assertEquals(500, action.getCall().arg("action").length());

        ToolCallParseResult name = parser.parse(
            "{\"tool\":\"start_adventure\",\"args\":{\"player_name\":\"" + "n".repeat(80) + "\"}}");
        assertEquals(64, name.getCall().arg("player_name").length());
    }

    @Test
    void rejectsUnknownTopLevelField() {
        ToolCallParseResult result = buildParser()
            .parse("{\"tool\":\"get_scene\",\"args\":{},\"nonce\":\"abc\"}");
        assertFalse(result.isToolCall());
        assertEquals(ToolCallParser.ERR_INVALID_FORMAT, result.getErrorCode());
    }

    @Test
    void rejectsInvalidJson() {
        ToolCallParseResult result = buildParser().parse("{\"tool\":\"get_scene\",\"args\":");
        assertFalse(result.isToolCall());
        assertEquals(ToolCallParser.ERR_INVALID_FORMAT, result.getErrorCode());
    }

    @Test
    void rejectsNonObjectArgs() {
        ToolCallParseResult result = buildParser().parse("{\"tool\":\"player_action\",\"args\":[\"fight\"]}");
        assertEquals(ToolCallParser.ERR_INVALID_FORMAT, result.getErrorCode());
    }

    @Test
    void functionLikeSyntaxIsNotParsed() {
        ToolCallParseResult result = buildParser().parse("player_action(action: \"fight\")");
        assertFalse(result.isToolCall());
        assertEquals(ToolCallParser.ERR_INVALID_FORMAT, result.getErrorCode());
    }
}

package com.gamemaster.controllers;

import com.gamemaster.AppLogger;
import com.gamemaster.SessionRegistry;
import com.gamemaster.models.SessionState;
import com.gamemaster.tools.ToolCallParseResult;
import com.gamemaster.tools.ToolCallParser;
import com.gamemaster.tools.ToolExecutionResult;
import com.gamemaster.tools.ToolExecutionService;
import com.gamemaster.tools.ToolSchemaRegistry;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Tool endpoints used by the host conversational runtime.
 */
public class AdventureController implements Controller {

    private final SessionRegistry sessionRegistry;
    private final ToolSchemaRegistry schemaRegistry;
    private final ToolCallParser parser;
    private final ToolExecutionService executor;
    private final AppLogger logger;

    public AdventureController(SessionRegistry sessionRegistry, ToolSchemaRegistry schemaRegistry,
                               ToolCallParser parser, ToolExecutionService executor) {
        this.sessionRegistry = sessionRegistry;
        this.schemaRegistry = schemaRegistry;
        this.parser = parser;
        this.executor = executor;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/tools", this::listTools);
        app.post("/api/sessions/{key}/tools", this::invokeTool);
        app.delete("/api/sessions/{key}", this::endSession);
    }

    /**
     * GET /api/tools
     * Tool schemas for the host to register with its conversational model.
     */
    private void listTools(Context ctx) {
        ctx.json(Map.of("tools", schemaRegistry.getSchemas()));
    }

    /**
     * POST /api/sessions/{key}/tools
     * Body: {"tool": "player_action", "args": {"action": "open the hatch"}}
     */
    private void invokeTool(Context ctx) {
        String key = ctx.pathParam("key");
        ToolCallParseResult parsed = parser.parse(ctx.body());
        if (!parsed.isToolCall()) {
            logger.warn("Rejected tool call for conversation " + key + ": " + parsed.getErrorCode()
                + (parsed.getErrorDetail() != null ? " (" + parsed.getErrorDetail() + ")" : ""));
            ctx.status(400).json(Controller.errorBody(parsed.getErrorCode(), parsed.getErrorDetail()));
            return;
        }
        SessionState state = sessionRegistry.getOrCreate(key);
        ToolExecutionResult result = executor.execute(parsed.getCall(), state);
        ctx.json(result);
    }

    /**
     * DELETE /api/sessions/{key}
     * Called when the host conversation ends.
     */
    private void endSession(Context ctx) {
        boolean ended = sessionRegistry.end(ctx.pathParam("key"));
        ctx.json(Map.of("ended", ended));
    }
}

package com.gamemaster.controllers;

import com.gamemaster.GameMasterInstructions;
import com.gamemaster.SessionRegistry;
import com.gamemaster.WorldGraph;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

public class StatusController implements Controller {

    private final WorldGraph world;
    private final SessionRegistry sessionRegistry;
    private final GameMasterInstructions instructions;

    public StatusController(WorldGraph world, SessionRegistry sessionRegistry, GameMasterInstructions instructions) {
        this.world = world;
        this.sessionRegistry = sessionRegistry;
        this.instructions = instructions;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/health", this::health);
        app.get("/api/instructions", this::getInstructions);
    }

    private void health(Context ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("world", world.getName());
        body.put("scenes", world.size());
        body.put("sessions", sessionRegistry.activeCount());
        ctx.json(body);
    }

    /**
     * GET /api/instructions
     * System instructions the host hands to its conversational model.
     */
    private void getInstructions(Context ctx) {
        ctx.contentType("text/plain; charset=utf-8").result(instructions.getText());
    }
}

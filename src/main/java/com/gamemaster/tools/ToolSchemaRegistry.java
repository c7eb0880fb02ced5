package com.gamemaster.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ToolSchemaRegistry {

    public static final String START_ADVENTURE = "start_adventure";
    public static final String GET_SCENE = "get_scene";
    public static final String PLAYER_ACTION = "player_action";
    public static final String SHOW_JOURNAL = "show_journal";
    public static final String RESTART_ADVENTURE = "restart_adventure";

    private static final int MAX_NAME_LENGTH = 64;
    private static final int MAX_ACTION_LENGTH = 500;

    private final Map<String, ToolSchema> schemas = new LinkedHashMap<>();

    /**
     * The tool surface offered to the host runtime.
     */
    public static ToolSchemaRegistry adventureTools() {
        return new ToolSchemaRegistry()
            .register(new ToolSchema(START_ADVENTURE,
                "Initialize a new adventure session for the player and return the opening description.")
                .arg("player_name", "Player name", false, MAX_NAME_LENGTH))
            .register(new ToolSchema(GET_SCENE,
                "Return the current scene description (useful for 'remind me where I am')."))
            .register(new ToolSchema(PLAYER_ACTION,
                "Accept the player's spoken action, resolve it to one of the scene's choices, advance the story "
                    + "and return the next description.")
                .arg("action", "Player spoken action (e.g., 'I want to check the wooden box' or 'fight the monster')",
                    true, MAX_ACTION_LENGTH))
            .register(new ToolSchema(SHOW_JOURNAL,
                "Show the session's journal, inventory and recent choices."))
            .register(new ToolSchema(RESTART_ADVENTURE,
                "Reset the session and start again from the beginning."));
    }

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

    public List<ToolSchema> getSchemas() {
        return new ArrayList<>(schemas.values());
    }
}

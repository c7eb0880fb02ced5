package com.gamemaster.tools;

import com.gamemaster.AppLogger;
import com.gamemaster.GameSessionService;
import com.gamemaster.NarrativeComposer;
import com.gamemaster.models.SessionState;

/**
 * Dispatches parsed tool calls to {@link GameSessionService}. A failure inside a tool still
 * produces speakable text so the conversation can carry on.
 */
public class ToolExecutionService {

    static final String FALTER_TEXT = "The tale falters for a moment. Please say that again.\n"
        + NarrativeComposer.PROMPT;

    private final GameSessionService sessions;
    private final AppLogger logger;

    public ToolExecutionService(GameSessionService sessions) {
        this.sessions = sessions;
        this.logger = AppLogger.get();
    }

    public ToolExecutionResult execute(ToolCall call, SessionState state) {
        if (call == null || call.getName() == null) {
            return ToolExecutionResult.error(null, FALTER_TEXT, "missing-tool");
        }
        String tool = call.getName();
        try {
            String text;
            switch (tool) {
                case ToolSchemaRegistry.START_ADVENTURE:
                    text = sessions.start(state, call.arg("player_name"));
                    break;
                case ToolSchemaRegistry.GET_SCENE:
                    text = sessions.getCurrentScene(state);
                    break;
                case ToolSchemaRegistry.PLAYER_ACTION:
                    text = sessions.playerAction(state, call.arg("action"));
                    break;
                case ToolSchemaRegistry.SHOW_JOURNAL:
                    text = sessions.showJournal(state);
                    break;
                case ToolSchemaRegistry.RESTART_ADVENTURE:
                    text = sessions.restart(state);
                    break;
                default:
                    return ToolExecutionResult.error(tool, FALTER_TEXT, "unsupported-tool");
            }
            return ToolExecutionResult.ok(tool, text);
        } catch (RuntimeException e) {
            logger.error("Tool execution failed: " + tool + " (" + e.getMessage() + ")", e);
            return ToolExecutionResult.error(tool, FALTER_TEXT, "execution-error");
        }
    }
}

package com.gamemaster;

import com.gamemaster.models.Choice;
import com.gamemaster.models.HistoryEntry;
import com.gamemaster.models.OverrideRule;
import com.gamemaster.models.Scene;
import com.gamemaster.models.SessionState;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Turns scenes and session state into the text the host speaks to the player.
 *
 * <p>Output is plain prose with line breaks only; it is read aloud verbatim, so no markup.
 * Every player-facing reply ends with {@link #PROMPT}.
 */
public class NarrativeComposer {

    public static final String PROMPT = "What do you do?";
    public static final String CLARIFICATION = "I need a clearer action to move the story forward. "
        + "Please choose one of the options I presented, or use a very simple phrase related to the options, "
        + "like 'take the map' or 'descend'.";
    public static final String RESTART_LINE = "The world resets. A new tide laps at the shore. "
        + "You stand once more at the beginning.";
    public static final String VOID_SCENE = "You are in a featureless void. " + PROMPT;
    public static final int JOURNAL_HISTORY_LIMIT = 6;

    private final WorldGraph world;

    public NarrativeComposer(WorldGraph world) {
        this.world = world;
    }

    /**
     * Renders {@code sceneId}, or the scene an override rule substitutes for it.
     */
    public String renderScene(String sceneId, SessionState state) {
        if (!world.hasScene(sceneId)) {
            return VOID_SCENE;
        }
        Scene scene = world.requireScene(effectiveSceneId(sceneId, state));
        StringBuilder sb = new StringBuilder(scene.getDescription());
        if (!scene.getChoiceMap().isEmpty()) {
            sb.append("\n\nChoices:\n");
            for (Choice choice : scene.getChoiceMap().values()) {
                sb.append("- ").append(choice.getDescription()).append("\n");
            }
        } else {
            sb.append("\n");
        }
        sb.append("\n").append(PROMPT);
        return sb.toString();
    }

    /**
     * The scene actually shown for {@code sceneId} given the session's state: override rules are
     * followed until none applies. The world guarantees the rules are acyclic.
     */
    public String effectiveSceneId(String sceneId, SessionState state) {
        String resolved = sceneId;
        Set<String> visited = new HashSet<>();
        while (visited.add(resolved)) {
            String next = null;
            for (OverrideRule rule : world.getOverrideRules()) {
                if (rule.appliesTo(resolved, state)) {
                    next = rule.getOverrideSceneId();
                    break;
                }
            }
            if (next == null) {
                break;
            }
            resolved = next;
        }
        return resolved;
    }

    /**
     * One sentence describing the move just made. Built only from the choice's own description.
     */
    public String renderTransition(Scene fromScene, String choiceId, Scene toScene) {
        Choice choice = fromScene != null ? fromScene.getChoice(choiceId) : null;
        if (choice == null) {
            return "The scene changes.";
        }
        String description = stripTrailingPeriod(choice.getDescription().trim());
        String key = choiceId.toLowerCase(Locale.ROOT);
        if (key.contains("take") || key.contains("pick")) {
            return "You " + lowerFirst(description) + ", and a new path opens.";
        }
        if (key.contains("approach") || key.contains("walk") || key.contains("go_to")) {
            return "You decide to " + lowerFirst(description) + " and proceed.";
        }
        return "You chose to '" + description + "', and the scene changes.";
    }

    public String greeting(SessionState state) {
        String name = state.getPlayerName() != null ? state.getPlayerName() : "traveler";
        Scene entry = world.getEntryScene();
        return ensurePrompt("Greetings " + name + ". Welcome to '" + entry.getTitle() + "'. "
            + "A new adventure begins now.\n\n" + renderScene(entry.getId(), state));
    }

    public String restartGreeting(SessionState state) {
        return ensurePrompt(RESTART_LINE + "\n\n" + renderScene(world.getEntrySceneId(), state));
    }

    public String clarification(SessionState state) {
        return ensurePrompt(CLARIFICATION + "\n\n" + renderScene(state.getCurrentSceneId(), state));
    }

    public String renderJournal(SessionState state) {
        StringBuilder sb = new StringBuilder();
        sb.append("Session: ").append(state.getSessionId())
            .append(" | Started at: ").append(state.getStartedAt()).append("\n");
        if (state.getPlayerName() != null) {
            sb.append("Player: ").append(state.getPlayerName()).append("\n");
        }

        if (state.getJournal().isEmpty()) {
            sb.append("\nJournal is empty.\n");
        } else {
            sb.append("\nJournal entries:\n");
            for (String entry : state.getJournal()) {
                sb.append("- ").append(entry).append("\n");
            }
        }

        if (state.getInventory().isEmpty()) {
            sb.append("\nNo items in inventory.\n");
        } else {
            sb.append("\nInventory:\n");
            for (String item : state.getInventory()) {
                sb.append("- ").append(item).append("\n");
            }
        }

        sb.append("\nRecent choices:\n");
        if (state.getHistory().isEmpty()) {
            sb.append("- None yet.\n");
        }
        for (HistoryEntry entry : state.recentHistory(JOURNAL_HISTORY_LIMIT)) {
            sb.append("- ").append(entry.getTimestamp())
                .append(" | from ").append(entry.getFromScene())
                .append(" -> ").append(entry.getToScene())
                .append(" via ").append(entry.getAction()).append("\n");
        }
        sb.append("\n").append(PROMPT);
        return sb.toString();
    }

    public String ensurePrompt(String text) {
        String body = text == null ? "" : text;
        if (body.endsWith(PROMPT)) {
            return body;
        }
        return body + "\n" + PROMPT;
    }

    private static String lowerFirst(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return Character.toLowerCase(text.charAt(0)) + text.substring(1);
    }

    private static String stripTrailingPeriod(String text) {
        String result = text;
        while (result.endsWith(".")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}

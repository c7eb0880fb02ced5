package com.gamemaster;

import com.gamemaster.models.Choice;
import com.gamemaster.models.HistoryEntry;
import com.gamemaster.models.Scene;
import com.gamemaster.models.SessionState;
import com.gamemaster.resolver.ActionResolver;
import com.gamemaster.resolver.Resolution;

import java.time.Clock;
import java.util.Optional;

/**
 * The five game operations the host runtime can call. Each works on the state it is handed;
 * sessions never share anything but the read-only world.
 */
public class GameSessionService {

    private final WorldGraph world;
    private final ActionResolver resolver;
    private final EffectEngine effectEngine;
    private final NarrativeComposer composer;
    private final Clock clock;
    private final AppLogger logger;

    public GameSessionService(WorldGraph world, ActionResolver resolver, EffectEngine effectEngine,
                              NarrativeComposer composer, Clock clock) {
        this.world = world;
        this.resolver = resolver;
        this.effectEngine = effectEngine;
        this.composer = composer;
        this.clock = clock;
        this.logger = AppLogger.get();
    }

    public SessionState newSession() {
        return SessionState.fresh(world.getEntrySceneId(), clock.instant());
    }

    public String start(SessionState state, String playerName) {
        state.reset(world.getEntrySceneId(), playerName, clock.instant());
        logger.info("Session " + state.getSessionId() + " started"
            + (state.getPlayerName() != null ? " for " + state.getPlayerName() : ""));
        return composer.greeting(state);
    }

    public String restart(SessionState state) {
        state.reset(world.getEntrySceneId(), null, clock.instant());
        logger.info("Session restarted as " + state.getSessionId());
        return composer.restartGreeting(state);
    }

    public String getCurrentScene(SessionState state) {
        return composer.renderScene(currentSceneId(state), state);
    }

    public String showJournal(SessionState state) {
        return composer.renderJournal(state);
    }

    /**
     * Resolves the utterance against the current scene and, only if a choice matched, commits the
     * whole transition at once. An unresolved action leaves {@code state} untouched.
     */
    public String playerAction(SessionState state, String utterance) {
        String currentId = currentSceneId(state);
        // Override rules only change what is rendered; choices always come from the stored scene.
        Optional<Scene> current = world.getScene(currentId);
        if (current.isEmpty()) {
            logger.warn("Session " + state.getSessionId() + " was in unknown scene '" + currentId + "'; restarting");
            return restart(state);
        }
        Scene scene = current.get();

        Resolution resolution = resolver.resolve(scene, utterance);
        if (!resolution.isResolved()) {
            return composer.clarification(state);
        }

        Choice choice = scene.getChoice(resolution.getChoiceId());
        Scene next = world.requireScene(choice.getResultSceneId());

        SessionState staged = state.copy();
        effectEngine.apply(choice.getEffects(), staged);
        staged.recordTransition(new HistoryEntry(scene.getId(), choice.getId(), next.getId(),
            clock.instant().toString()));
        state.replaceWith(staged);

        String note = composer.renderTransition(scene, choice.getId(), next);
        return composer.ensurePrompt(note + "\n\n" + composer.renderScene(next.getId(), state));
    }

    private String currentSceneId(SessionState state) {
        String id = state.getCurrentSceneId();
        return id != null ? id : world.getEntrySceneId();
    }
}

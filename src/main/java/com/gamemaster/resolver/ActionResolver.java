package com.gamemaster.resolver;

import com.gamemaster.AppLogger;
import com.gamemaster.models.Scene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Maps a freeform utterance to one of the current scene's choices by running an ordered list of
 * stages. The first stage that names a choice wins and later stages are skipped.
 * Only the scene's own choices are ever considered.
 */
public class ActionResolver {

    private final List<ResolutionStage> stages;
    private final AppLogger logger;

    public ActionResolver(List<ResolutionStage> stages) {
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
        this.logger = AppLogger.get();
    }

    /**
     * Exact key, description words, then action verbs. No external calls.
     */
    public static ActionResolver deterministic() {
        return new ActionResolver(deterministicStages());
    }

    /**
     * The deterministic stages followed by the semantic fallback.
     */
    public static ActionResolver withFallback(SemanticFallbackStage fallback) {
        List<ResolutionStage> stages = deterministicStages();
        stages.add(fallback);
        return new ActionResolver(stages);
    }

    private static List<ResolutionStage> deterministicStages() {
        List<ResolutionStage> stages = new ArrayList<>();
        stages.add(new ExactKeyStage());
        stages.add(new DescriptionWordStage());
        stages.add(new ActionVerbStage());
        return stages;
    }

    public List<ResolutionStage> getStages() {
        return stages;
    }

    public Resolution resolve(Scene scene, String utterance) {
        String text = utterance == null ? "" : utterance.trim();
        if (scene == null || text.isEmpty()) {
            return Resolution.unresolved();
        }
        for (ResolutionStage stage : stages) {
            Optional<String> match = stage.match(scene, text);
            if (match.isPresent() && scene.hasChoice(match.get())) {
                logger.info("Resolved '" + text + "' in scene " + scene.getId() + " to "
                    + match.get() + " via " + stage.getName());
                return Resolution.resolved(match.get(), stage.getName());
            }
        }
        logger.info("No stage resolved '" + text + "' in scene " + scene.getId());
        return Resolution.unresolved();
    }
}

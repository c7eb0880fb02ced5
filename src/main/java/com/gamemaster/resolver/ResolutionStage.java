package com.gamemaster.resolver;

import com.gamemaster.models.Scene;

import java.util.Optional;

/**
 * One step of the action-resolution pipeline. A stage never mutates anything; it either
 * names a choice of {@code scene} or declines.
 */
public interface ResolutionStage {

    /**
     * Short name used in logs and in {@link Resolution#getStage()}.
     */
    String getName();

    Optional<String> match(Scene scene, String utterance);
}

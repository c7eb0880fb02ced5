package com.gamemaster.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * When a session is shown {@code sceneId} and {@code condition} holds, {@code overrideSceneId}
 * is rendered in its place.
 */
public class OverrideRule {

    private final String sceneId;
    private final StateCondition condition;
    private final String overrideSceneId;

    @JsonCreator
    public OverrideRule(@JsonProperty("sceneId") String sceneId,
                        @JsonProperty("condition") StateCondition condition,
                        @JsonProperty("overrideSceneId") String overrideSceneId) {
        this.sceneId = sceneId;
        this.condition = condition;
        this.overrideSceneId = overrideSceneId;
    }

    public String getSceneId() {
        return sceneId;
    }

    public StateCondition getCondition() {
        return condition;
    }

    public String getOverrideSceneId() {
        return overrideSceneId;
    }

    public boolean appliesTo(String renderedSceneId, SessionState state) {
        return sceneId != null && sceneId.equals(renderedSceneId) && condition != null && condition.test(state);
    }
}

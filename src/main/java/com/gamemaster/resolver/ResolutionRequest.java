package com.gamemaster.resolver;

import com.gamemaster.models.Choice;
import com.gamemaster.models.Scene;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the semantic resolver is allowed to see: the scene title, the choices on offer
 * (id to description, in declaration order) and what the player said.
 */
public class ResolutionRequest {

    private final String sceneTitle;
    private final Map<String, String> choiceMap;
    private final String utterance;

    public ResolutionRequest(String sceneTitle, Map<String, String> choiceMap, String utterance) {
        this.sceneTitle = sceneTitle;
        this.choiceMap = Collections.unmodifiableMap(new LinkedHashMap<>(choiceMap));
        this.utterance = utterance;
    }

    public static ResolutionRequest of(Scene scene, String utterance) {
        Map<String, String> choices = new LinkedHashMap<>();
        for (Choice choice : scene.getChoiceMap().values()) {
            choices.put(choice.getId(), choice.getDescription());
        }
        return new ResolutionRequest(scene.getTitle(), choices, utterance);
    }

    public String getSceneTitle() {
        return sceneTitle;
    }

    public Map<String, String> getChoiceMap() {
        return choiceMap;
    }

    public String getUtterance() {
        return utterance;
    }
}

package com.gamemaster.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Choice {

    private final String id;
    private final String description;
    private final String resultSceneId;
    private final List<Effect> effects;

    @JsonCreator
    public Choice(@JsonProperty("id") String id,
                  @JsonProperty("description") String description,
                  @JsonProperty("resultSceneId") String resultSceneId,
                  @JsonProperty("effects") List<Effect> effects) {
        this.id = id;
        this.description = description != null ? description : "";
        this.resultSceneId = resultSceneId;
        this.effects = effects == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(effects));
    }

    public Choice(String id, String description, String resultSceneId) {
        this(id, description, resultSceneId, null);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public String getResultSceneId() {
        return resultSceneId;
    }

    public List<Effect> getEffects() {
        return effects;
    }
}

package com.gamemaster.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the world graph. Choices keep the order they were declared in; that order is
 * both the display order and the tie-break order during action resolution.
 */
public class Scene {

    private final String id;
    private final String title;
    private final String description;
    private final Map<String, Choice> choices;

    @JsonCreator
    public Scene(@JsonProperty("id") String id,
                 @JsonProperty("title") String title,
                 @JsonProperty("description") String description,
                 @JsonProperty("choices") List<Choice> choices) {
        this.id = id;
        this.title = title != null ? title : "";
        this.description = description != null ? description : "";
        Map<String, Choice> ordered = new LinkedHashMap<>();
        if (choices != null) {
            for (Choice choice : choices) {
                if (choice == null) {
                    continue;
                }
                if (ordered.containsKey(choice.getId())) {
                    throw new IllegalArgumentException("Duplicate choice '" + choice.getId() + "' in scene '" + id + "'");
                }
                ordered.put(choice.getId(), choice);
            }
        }
        this.choices = Collections.unmodifiableMap(ordered);
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    @JsonIgnore
    public Map<String, Choice> getChoiceMap() {
        return choices;
    }

    @JsonProperty("choices")
    public List<Choice> getChoices() {
        return new ArrayList<>(choices.values());
    }

    @JsonIgnore
    public Collection<String> getChoiceIds() {
        return choices.keySet();
    }

    public Choice getChoice(String choiceId) {
        return choiceId != null ? choices.get(choiceId) : null;
    }

    public boolean hasChoice(String choiceId) {
        return choiceId != null && choices.containsKey(choiceId);
    }
}

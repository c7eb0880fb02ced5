package com.gamemaster.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk shape of a world file, before validation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorldDefinition {

    private String name;
    private String entrySceneId;
    private List<Scene> scenes = new ArrayList<>();
    private List<OverrideRule> overrideRules = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEntrySceneId() {
        return entrySceneId;
    }

    public void setEntrySceneId(String entrySceneId) {
        this.entrySceneId = entrySceneId;
    }

    public List<Scene> getScenes() {
        return scenes;
    }

    public void setScenes(List<Scene> scenes) {
        this.scenes = scenes != null ? scenes : new ArrayList<>();
    }

    public List<OverrideRule> getOverrideRules() {
        return overrideRules;
    }

    public void setOverrideRules(List<OverrideRule> overrideRules) {
        this.overrideRules = overrideRules != null ? overrideRules : new ArrayList<>();
    }
}

package com.gamemaster;

import com.gamemaster.models.Choice;
import com.gamemaster.models.Effect;
import com.gamemaster.models.OverrideRule;
import com.gamemaster.models.Scene;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable scene graph shared by every session. Validated once on construction; a graph that
 * exists is guaranteed to have every choice, override rule and the entry scene pointing at
 * scenes it contains.
 */
public class WorldGraph {

    private final String name;
    private final String entrySceneId;
    private final Map<String, Scene> scenes;
    private final List<OverrideRule> overrideRules;

    public WorldGraph(String name, String entrySceneId, Collection<Scene> scenes, List<OverrideRule> overrideRules) {
        this.name = name != null && !name.isBlank() ? name : "untitled";
        this.entrySceneId = entrySceneId;
        Map<String, Scene> byId = new LinkedHashMap<>();
        if (scenes != null) {
            for (Scene scene : scenes) {
                if (scene == null || isBlank(scene.getId())) {
                    throw new WorldGraphException("Scene without an id");
                }
                if (byId.containsKey(scene.getId())) {
                    throw new WorldGraphException("Duplicate scene id: " + scene.getId());
                }
                byId.put(scene.getId(), scene);
            }
        }
        this.scenes = Collections.unmodifiableMap(byId);
        this.overrideRules = overrideRules == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(overrideRules));
        validate();
    }

    public String getName() {
        return name;
    }

    public String getEntrySceneId() {
        return entrySceneId;
    }

    public Scene getEntryScene() {
        return scenes.get(entrySceneId);
    }

    public Optional<Scene> getScene(String sceneId) {
        return sceneId == null ? Optional.empty() : Optional.ofNullable(scenes.get(sceneId));
    }

    public Scene requireScene(String sceneId) {
        return getScene(sceneId)
            .orElseThrow(() -> new IllegalStateException("Unknown scene: " + sceneId));
    }

    public boolean hasScene(String sceneId) {
        return sceneId != null && scenes.containsKey(sceneId);
    }

    public Collection<Scene> getScenes() {
        return scenes.values();
    }

    public int size() {
        return scenes.size();
    }

    public List<OverrideRule> getOverrideRules() {
        return overrideRules;
    }

    private void validate() {
        if (scenes.isEmpty()) {
            throw new WorldGraphException("World '" + name + "' has no scenes");
        }
        if (!hasScene(entrySceneId)) {
            throw new WorldGraphException("Entry scene '" + entrySceneId + "' does not exist");
        }
        for (Scene scene : scenes.values()) {
            for (Choice choice : scene.getChoiceMap().values()) {
                String where = scene.getId() + "/" + choice.getId();
                if (isBlank(choice.getId())) {
                    throw new WorldGraphException("Choice without an id in scene " + scene.getId());
                }
                if (!hasScene(choice.getResultSceneId())) {
                    throw new WorldGraphException("Choice " + where + " points to missing scene '"
                        + choice.getResultSceneId() + "'");
                }
                for (Effect effect : choice.getEffects()) {
                    validateEffect(where, effect);
                }
            }
        }
        for (OverrideRule rule : overrideRules) {
            if (!hasScene(rule.getSceneId()) || !hasScene(rule.getOverrideSceneId())) {
                throw new WorldGraphException("Override rule " + rule.getSceneId() + " -> "
                    + rule.getOverrideSceneId() + " names a missing scene");
            }
            if (rule.getCondition() == null || isBlank(rule.getCondition().getOperand())) {
                throw new WorldGraphException("Override rule on " + rule.getSceneId() + " has no condition");
            }
        }
        rejectOverrideCycles();
    }

    private void validateEffect(String where, Effect effect) {
        if (effect == null) {
            throw new WorldGraphException("Null effect on choice " + where);
        }
        switch (effect.getKind()) {
            case APPEND_JOURNAL:
                if (isBlank(((Effect.AppendJournal) effect).getText())) {
                    throw new WorldGraphException("Empty journal effect on choice " + where);
                }
                break;
            case ADD_INVENTORY_ITEM:
                if (isBlank(((Effect.AddInventoryItem) effect).getItemId())) {
                    throw new WorldGraphException("Inventory effect without item id on choice " + where);
                }
                break;
            default:
                throw new WorldGraphException("Unsupported effect " + effect.getKind() + " on choice " + where);
        }
    }

    // Rendering follows override rules recursively, so a cycle would never terminate.
    private void rejectOverrideCycles() {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (OverrideRule rule : overrideRules) {
            edges.computeIfAbsent(rule.getSceneId(), k -> new HashSet<>()).add(rule.getOverrideSceneId());
        }
        Set<String> done = new HashSet<>();
        for (String start : edges.keySet()) {
            visit(start, edges, new HashSet<>(), done);
        }
    }

    private void visit(String sceneId, Map<String, Set<String>> edges, Set<String> path, Set<String> done) {
        if (done.contains(sceneId)) {
            return;
        }
        if (!path.add(sceneId)) {
            throw new WorldGraphException("Override rules form a cycle through scene '" + sceneId + "'");
        }
        for (String next : edges.getOrDefault(sceneId, Collections.emptySet())) {
            visit(next, edges, path, done);
        }
        path.remove(sceneId);
        done.add(sceneId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.gamemaster.models;

public class HistoryEntry {

    private final String fromScene;
    private final String action;
    private final String toScene;
    private final String timestamp;

    public HistoryEntry(String fromScene, String action, String toScene, String timestamp) {
        this.fromScene = fromScene;
        this.action = action;
        this.toScene = toScene;
        this.timestamp = timestamp;
    }

    public String getFromScene() {
        return fromScene;
    }

    public String getAction() {
        return action;
    }

    public String getToScene() {
        return toScene;
    }

    public String getTimestamp() {
        return timestamp;
    }
}

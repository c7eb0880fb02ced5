package com.gamemaster.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Mutable record of one player's traversal of the world graph.
 *
 * <p>Owned by a single conversation. The host serializes turns, so the class does no locking.
 * History, journal and choices only ever grow between resets; the inventory is a set and never
 * holds the same item id twice.
 */
public class SessionState {

    private String sessionId;
    private String playerName;
    private String currentSceneId;
    private List<HistoryEntry> history = new ArrayList<>();
    private List<String> journal = new ArrayList<>();
    private Set<String> inventory = new LinkedHashSet<>();
    private List<String> choicesMade = new ArrayList<>();
    private String startedAt;

    private SessionState() {
    }

    /**
     * A state positioned at {@code entrySceneId} with nothing recorded yet.
     */
    public static SessionState fresh(String entrySceneId, Instant now) {
        SessionState state = new SessionState();
        state.reset(entrySceneId, null, now);
        return state;
    }

    /**
     * Wipes every mutable field and issues a new session id. A null {@code playerName} keeps
     * the name already on record.
     */
    public void reset(String entrySceneId, String playerName, Instant now) {
        if (playerName != null && !playerName.isBlank()) {
            this.playerName = playerName.trim();
        }
        this.currentSceneId = entrySceneId;
        this.history = new ArrayList<>();
        this.journal = new ArrayList<>();
        this.inventory = new LinkedHashSet<>();
        this.choicesMade = new ArrayList<>();
        this.sessionId = UUID.randomUUID().toString().substring(0, 8);
        this.startedAt = now.toString();
    }

    public void appendJournal(String entry) {
        journal.add(entry);
    }

    /**
     * @return true if the item was not held before
     */
    public boolean addInventoryItem(String itemId) {
        return inventory.add(itemId);
    }

    /**
     * Records a move along a choice: history entry, choice id, and new current scene.
     */
    public void recordTransition(HistoryEntry entry) {
        history.add(entry);
        choicesMade.add(entry.getAction());
        currentSceneId = entry.getToScene();
    }

    public SessionState copy() {
        SessionState copy = new SessionState();
        copy.sessionId = sessionId;
        copy.playerName = playerName;
        copy.currentSceneId = currentSceneId;
        copy.history = new ArrayList<>(history);
        copy.journal = new ArrayList<>(journal);
        copy.inventory = new LinkedHashSet<>(inventory);
        copy.choicesMade = new ArrayList<>(choicesMade);
        copy.startedAt = startedAt;
        return copy;
    }

    /**
     * Adopts every field of a staged copy. Used to commit a turn in one step.
     */
    public void replaceWith(SessionState staged) {
        this.sessionId = staged.sessionId;
        this.playerName = staged.playerName;
        this.currentSceneId = staged.currentSceneId;
        this.history = staged.history;
        this.journal = staged.journal;
        this.inventory = staged.inventory;
        this.choicesMade = staged.choicesMade;
        this.startedAt = staged.startedAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getPlayerName() {
        return playerName;
    }

    public String getCurrentSceneId() {
        return currentSceneId;
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public List<String> getJournal() {
        return Collections.unmodifiableList(journal);
    }

    public Set<String> getInventory() {
        return Collections.unmodifiableSet(inventory);
    }

    public List<String> getChoicesMade() {
        return Collections.unmodifiableList(choicesMade);
    }

    public String getStartedAt() {
        return startedAt;
    }

    public List<HistoryEntry> recentHistory(int limit) {
        int from = Math.max(0, history.size() - Math.max(0, limit));
        return Collections.unmodifiableList(new ArrayList<>(history.subList(from, history.size())));
    }
}

package com.gamemaster;

import com.gamemaster.models.SessionState;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live session state per host conversation. States are created on first use, positioned at the
 * entry scene, and dropped when the host ends the conversation. Nothing is persisted.
 */
public class SessionRegistry {

    private final GameSessionService sessions;
    private final Map<String, SessionState> states = new ConcurrentHashMap<>();
    private final AppLogger logger;

    public SessionRegistry(GameSessionService sessions) {
        this.sessions = sessions;
        this.logger = AppLogger.get();
    }

    public SessionState getOrCreate(String conversationKey) {
        return states.computeIfAbsent(requireKey(conversationKey), key -> {
            logger.info("Opening session state for conversation " + key);
            return sessions.newSession();
        });
    }

    public boolean end(String conversationKey) {
        if (conversationKey == null) {
            return false;
        }
        boolean removed = states.remove(conversationKey.trim()) != null;
        if (removed) {
            logger.info("Discarded session state for conversation " + conversationKey);
        }
        return removed;
    }

    public int activeCount() {
        return states.size();
    }

    private String requireKey(String conversationKey) {
        if (conversationKey == null || conversationKey.isBlank()) {
            throw new IllegalArgumentException("Conversation key is required");
        }
        return conversationKey.trim();
    }
}

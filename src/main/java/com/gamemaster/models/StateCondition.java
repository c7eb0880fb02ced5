package com.gamemaster.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Predicate over a session's accumulated state, used by {@link OverrideRule}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StateCondition.JournalContains.class, name = "journal_contains"),
    @JsonSubTypes.Type(value = StateCondition.HasItem.class, name = "has_item")
})
public abstract class StateCondition {

    private StateCondition() {
    }

    public abstract boolean test(SessionState state);

    /**
     * Value the condition compares against; validated non-blank at load time.
     */
    public abstract String getOperand();

    public static final class JournalContains extends StateCondition {
        private final String entry;

        @JsonCreator
        public JournalContains(@JsonProperty("entry") String entry) {
            this.entry = entry;
        }

        public String getEntry() {
            return entry;
        }

        @Override
        public String getOperand() {
            return entry;
        }

        @Override
        public boolean test(SessionState state) {
            return state != null && state.getJournal().contains(entry);
        }
    }

    public static final class HasItem extends StateCondition {
        private final String itemId;

        @JsonCreator
        public HasItem(@JsonProperty("itemId") String itemId) {
            this.itemId = itemId;
        }

        public String getItemId() {
            return itemId;
        }

        @Override
        public String getOperand() {
            return itemId;
        }

        @Override
        public boolean test(SessionState state) {
            return state != null && state.getInventory().contains(itemId);
        }
    }
}

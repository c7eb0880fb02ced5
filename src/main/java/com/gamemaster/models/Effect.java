package com.gamemaster.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * A state mutation carried by a {@link Choice}. The set of variants is closed: the world
 * file names them by {@code type}, and an unknown type fails loading.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Effect.AppendJournal.class, name = "append_journal"),
    @JsonSubTypes.Type(value = Effect.AddInventoryItem.class, name = "add_inventory_item")
})
public abstract class Effect {

    public enum Kind {
        APPEND_JOURNAL,
        ADD_INVENTORY_ITEM
    }

    private Effect() {
    }

    public abstract Kind getKind();

    public static AppendJournal appendJournal(String text) {
        return new AppendJournal(text);
    }

    public static AddInventoryItem addInventoryItem(String itemId) {
        return new AddInventoryItem(itemId);
    }

    public static final class AppendJournal extends Effect {
        private final String text;

        @JsonCreator
        public AppendJournal(@JsonProperty("text") String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }

        @Override
        public Kind getKind() {
            return Kind.APPEND_JOURNAL;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof AppendJournal && Objects.equals(text, ((AppendJournal) o).text);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.APPEND_JOURNAL, text);
        }

        @Override
        public String toString() {
            return "AppendJournal(" + text + ")";
        }
    }

    public static final class AddInventoryItem extends Effect {
        private final String itemId;

        @JsonCreator
        public AddInventoryItem(@JsonProperty("itemId") String itemId) {
            this.itemId = itemId;
        }

        public String getItemId() {
            return itemId;
        }

        @Override
        public Kind getKind() {
            return Kind.ADD_INVENTORY_ITEM;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof AddInventoryItem && Objects.equals(itemId, ((AddInventoryItem) o).itemId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.ADD_INVENTORY_ITEM, itemId);
        }

        @Override
        public String toString() {
            return "AddInventoryItem(" + itemId + ")";
        }
    }
}

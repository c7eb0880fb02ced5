package com.gamemaster;

import com.gamemaster.models.Effect;
import com.gamemaster.models.SessionState;

import java.util.List;

/**
 * Applies the effects carried by a choice to a session, in the order they were listed.
 */
public class EffectEngine {

    public void apply(List<Effect> effects, SessionState state) {
        if (effects == null || effects.isEmpty()) {
            return;
        }
        for (Effect effect : effects) {
            switch (effect.getKind()) {
                case APPEND_JOURNAL:
                    state.appendJournal(((Effect.AppendJournal) effect).getText());
                    break;
                case ADD_INVENTORY_ITEM:
                    // The inventory is a set: a repeated grant is a no-op.
                    state.addInventoryItem(((Effect.AddInventoryItem) effect).getItemId());
                    break;
                default:
                    throw new IllegalStateException("Unhandled effect kind: " + effect.getKind());
            }
        }
    }
}

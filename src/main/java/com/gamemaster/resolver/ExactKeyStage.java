package com.gamemaster.resolver;

import com.gamemaster.models.Scene;

import java.util.Locale;
import java.util.Optional;

/**
 * Matches when the whole utterance is a choice id, ignoring case and surrounding whitespace.
 */
public class ExactKeyStage implements ResolutionStage {

    @Override
    public String getName() {
        return "exact";
    }

    @Override
    public Optional<String> match(Scene scene, String utterance) {
        String folded = utterance.trim().toLowerCase(Locale.ROOT);
        if (folded.isEmpty()) {
            return Optional.empty();
        }
        for (String choiceId : scene.getChoiceIds()) {
            if (choiceId.equals(folded) || choiceId.toLowerCase(Locale.ROOT).equals(folded)) {
                return Optional.of(choiceId);
            }
        }
        return Optional.empty();
    }
}

package com.gamemaster.resolver;

import com.gamemaster.models.Choice;
import com.gamemaster.models.Scene;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Matches a choice whose description shares one of a fixed set of action verbs with the utterance.
 */
public class ActionVerbStage implements ResolutionStage {

    public static final List<String> ACTION_VERBS = List.of(
        "take", "pick", "open", "go", "return", "leave", "fight", "flee", "search", "descend", "close"
    );

    @Override
    public String getName() {
        return "verb";
    }

    @Override
    public Optional<String> match(Scene scene, String utterance) {
        String folded = utterance.toLowerCase(Locale.ROOT);
        for (Choice choice : scene.getChoiceMap().values()) {
            String description = choice.getDescription().toLowerCase(Locale.ROOT);
            for (String verb : ACTION_VERBS) {
                if (folded.contains(verb) && description.contains(verb)) {
                    return Optional.of(choice.getId());
                }
            }
        }
        return Optional.empty();
    }
}

package com.gamemaster.resolver;

import com.gamemaster.models.Choice;
import com.gamemaster.models.Scene;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Heuristic match on the choice id or the leading words of its description. Walks choices in
 * declaration order and returns the first hit, so ties always break the same way.
 */
public class DescriptionWordStage implements ResolutionStage {

    static final int LEADING_WORDS = 4;
    static final int MIN_WORD_LENGTH = 3;

    @Override
    public String getName() {
        return "description";
    }

    @Override
    public Optional<String> match(Scene scene, String utterance) {
        String folded = utterance.toLowerCase(Locale.ROOT);
        for (Choice choice : scene.getChoiceMap().values()) {
            if (folded.contains(choice.getId().toLowerCase(Locale.ROOT))) {
                return Optional.of(choice.getId());
            }
            for (String word : leadingWords(choice.getDescription())) {
                if (folded.contains(word)) {
                    return Optional.of(choice.getId());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * First four whitespace-delimited words, case-folded, keeping those longer than two characters.
     * Punctuation stays attached to the word.
     */
    static List<String> leadingWords(String description) {
        List<String> words = new ArrayList<>();
        String trimmed = description == null ? "" : description.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return words;
        }
        String[] parts = trimmed.split("\\s+");
        for (int i = 0; i < parts.length && i < LEADING_WORDS; i++) {
            if (parts[i].length() >= MIN_WORD_LENGTH) {
                words.add(parts[i]);
            }
        }
        return words;
    }
}

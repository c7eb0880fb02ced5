package com.gamemaster;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Game-master persona and tool-use rules for the host's conversational model, read from the
 * classpath once at startup.
 */
public class GameMasterInstructions {

    public static final String DEFAULT_RESOURCE = "prompts/game-master.txt";

    private final String text;

    private GameMasterInstructions(String text) {
        this.text = text;
    }

    public static GameMasterInstructions load(String resourcePath) throws IOException {
        try (InputStream in = GameMasterInstructions.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IOException("Instructions resource not found: " + resourcePath);
            }
            return new GameMasterInstructions(new String(in.readAllBytes(), StandardCharsets.UTF_8).trim());
        }
    }

    public String getText() {
        return text;
    }
}

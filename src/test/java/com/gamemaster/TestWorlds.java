package com.gamemaster;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

final class TestWorlds {

    private TestWorlds() {
    }

    static WorldGraph brinmere() {
        return new WorldLoader(new ObjectMapper()).loadResource(WorldLoader.DEFAULT_WORLD_RESOURCE);
    }

    static WorldGraph fromJson(String json) {
        return new WorldLoader(new ObjectMapper())
            .load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");
    }
}

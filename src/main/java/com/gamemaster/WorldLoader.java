package com.gamemaster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamemaster.models.WorldDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a world file and turns it into a validated {@link WorldGraph}.
 * Every failure, including I/O, surfaces as {@link WorldGraphException}.
 */
public class WorldLoader {

    public static final String DEFAULT_WORLD_RESOURCE = "world/brinmere.json";

    private final ObjectMapper mapper;

    public WorldLoader(ObjectMapper mapper) {
        this.mapper = mapper != null ? mapper : new ObjectMapper();
    }

    public WorldGraph loadResource(String resourcePath) {
        InputStream in = WorldLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (in == null) {
            throw new WorldGraphException("World resource not found on classpath: " + resourcePath);
        }
        try (InputStream stream = in) {
            return load(stream, resourcePath);
        } catch (IOException e) {
            throw new WorldGraphException("Failed to read world resource " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    public WorldGraph loadFile(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new WorldGraphException("World file not found: " + path);
        }
        try (InputStream stream = Files.newInputStream(path)) {
            return load(stream, path.toString());
        } catch (IOException e) {
            throw new WorldGraphException("Failed to read world file " + path + ": " + e.getMessage(), e);
        }
    }

    public WorldGraph load(InputStream in, String source) {
        WorldDefinition definition;
        try {
            definition = mapper.readValue(in, WorldDefinition.class);
        } catch (JsonProcessingException e) {
            throw new WorldGraphException("Malformed world " + source + ": " + rootMessage(e), e);
        } catch (IOException e) {
            throw new WorldGraphException("Failed to read world " + source + ": " + e.getMessage(), e);
        }
        if (definition == null) {
            throw new WorldGraphException("Empty world document: " + source);
        }
        String name = definition.getName() != null ? definition.getName() : source;
        return new WorldGraph(name, definition.getEntrySceneId(), definition.getScenes(), definition.getOverrideRules());
    }

    private String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}

package com.gamemaster;

/**
 * The world file is malformed or violates a graph invariant. Fatal at startup.
 */
public class WorldGraphException extends RuntimeException {

    public WorldGraphException(String message) {
        super(message);
    }

    public WorldGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}

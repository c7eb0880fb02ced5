package com.gamemaster.controllers;

import io.javalin.Javalin;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An HTTP surface of the game master. Main hands every controller the same Javalin app.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * {@code {"error": message}} for an unexpected exception. Falls back to the exception's
     * simple class name when it carries no message.
     */
    static Map<String, Object> errorBody(Exception e) {
        String message = e.getMessage();
        return errorBody(message == null || message.isBlank() ? e.getClass().getSimpleName() : message, null);
    }

    /**
     * {@code {"error": code, "detail": detail}}; the detail is left out when null.
     */
    static Map<String, Object> errorBody(String code, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        if (detail != null) {
            body.put("detail", detail);
        }
        return body;
    }
}

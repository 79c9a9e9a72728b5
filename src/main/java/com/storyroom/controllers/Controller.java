package com.storyroom.controllers;

import io.javalin.Javalin;

import java.util.Map;

/**
 * An API controller registers its own routes with the Javalin app.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * JSON error body; falls back to the exception's class name when it has no message.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }
}

package com.civicdesk.controllers;

import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A group of Civic Desk API routes, plus the JSON error shapes every group shares:
 * {@code {"error": ...}} and, for rejected submissions, {@code {"error": ..., "fields": [...]}}.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }

    static Map<String, Object> errorBody(String message, List<String> fields) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message == null || message.isBlank() ? "Invalid request" : message);
        body.put("fields", fields == null ? List.of() : fields);
        return body;
    }

    /**
     * Returns the trimmed query parameter, or answers 400 and returns null when it is absent or blank.
     */
    static String requiredQueryParam(Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null || value.isBlank()) {
            ctx.status(400).json(errorBody(name + " query parameter is required", List.of(name)));
            return null;
        }
        return value.trim();
    }
}

package com.civicdesk.controllers;

import com.civicdesk.GamificationEngine;
import com.civicdesk.models.Badge;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;
import java.util.Optional;

/**
 * Controller for the badge catalog.
 */
public class BadgeController implements Controller {

    private final GamificationEngine engine;

    public BadgeController(GamificationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/badges", this::getBadges);
        app.get("/api/badges/{id}", this::getBadge);
    }

    private void getBadges(Context ctx) {
        try {
            ctx.json(engine.getCatalog().all());
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getBadge(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            Optional<Badge> badge = engine.getCatalog().find(id);
            if (badge.isPresent()) {
                ctx.json(badge.get());
            } else {
                ctx.status(404).json(Map.of("error", "Badge not found: " + id));
            }
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}

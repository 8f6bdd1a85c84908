package com.civicdesk.controllers;

import com.civicdesk.NotificationFeed;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Controller for the per-user notification feed.
 */
public class NotificationController implements Controller {

    private final NotificationFeed feed;

    public NotificationController(NotificationFeed feed) {
        this.feed = feed;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/notifications", this::getNotifications);
        app.get("/api/notifications/unread-count", this::getUnreadCount);
        app.post("/api/notifications/mark-all-read", this::markAllRead);
        app.post("/api/notifications/{id}/read", this::markRead);
    }

    private void getNotifications(Context ctx) {
        try {
            String userId = Controller.requiredQueryParam(ctx, "userId");
            if (userId == null) {
                return;
            }
            boolean unreadOnly = Boolean.parseBoolean(ctx.queryParam("unreadOnly"));
            ctx.json(feed.listForUser(userId, unreadOnly));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getUnreadCount(Context ctx) {
        try {
            String userId = Controller.requiredQueryParam(ctx, "userId");
            if (userId == null) {
                return;
            }
            ctx.json(Map.of("unreadCount", feed.unreadCount(userId)));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void markRead(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            if (feed.markRead(id)) {
                ctx.json(Map.of("success", true));
            } else {
                ctx.status(404).json(Map.of("error", "Notification not found: " + id));
            }
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void markAllRead(Context ctx) {
        try {
            String userId = Controller.requiredQueryParam(ctx, "userId");
            if (userId == null) {
                return;
            }
            int changed = feed.markAllRead(userId);
            ctx.json(Map.of("success", true, "updated", changed));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}

package com.civicdesk.controllers;

import com.civicdesk.GamificationEngine;
import com.civicdesk.IssueLifecycleCoordinator;
import com.civicdesk.LeaderboardService;
import com.civicdesk.models.UserProgress;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Controller for user progress, badges and the leaderboard.
 */
public class UserController implements Controller {

    private static final int DEFAULT_LEADERBOARD_SIZE = 20;

    private final IssueLifecycleCoordinator coordinator;
    private final GamificationEngine engine;
    private final LeaderboardService leaderboardService;

    public UserController(IssueLifecycleCoordinator coordinator, GamificationEngine engine,
                          LeaderboardService leaderboardService) {
        this.coordinator = coordinator;
        this.engine = engine;
        this.leaderboardService = leaderboardService;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/users/{userId}/progress", this::getProgress);
        app.get("/api/users/{userId}/badges", this::getUserBadges);
        app.get("/api/users/{userId}/issues", this::getUserIssues);
        app.get("/api/leaderboard", this::getLeaderboard);
    }

    private void getProgress(Context ctx) {
        try {
            String userId = ctx.pathParam("userId");
            Optional<UserProgress> progress = coordinator.getProgress(userId);
            if (progress.isEmpty()) {
                ctx.status(404).json(Map.of("error", "No progress recorded for user: " + userId));
                return;
            }
            ctx.json(progress.get());
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getUserBadges(Context ctx) {
        try {
            String userId = ctx.pathParam("userId");
            UserProgress progress = coordinator.getProgress(userId).orElse(new UserProgress(userId));
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("userId", userId);
            response.put("earned", progress.getEarnedBadges());
            response.put("stats", engine.badgeStats(progress));
            ctx.json(response);
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getUserIssues(Context ctx) {
        try {
            ctx.json(coordinator.getUserHistory(ctx.pathParam("userId")));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getLeaderboard(Context ctx) {
        try {
            int limit = DEFAULT_LEADERBOARD_SIZE;
            String limitParam = ctx.queryParam("limit");
            if (limitParam != null && !limitParam.isBlank()) {
                limit = Integer.parseInt(limitParam.trim());
            }
            ctx.json(leaderboardService.top(limit));
        } catch (NumberFormatException e) {
            ctx.status(400).json(Map.of("error", "limit must be a number"));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}

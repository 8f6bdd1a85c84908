package com.civicdesk.controllers;

import com.civicdesk.AppLogger;
import com.civicdesk.IssueAnalyticsService;
import com.civicdesk.IssueLifecycleCoordinator;
import com.civicdesk.models.Issue;
import com.civicdesk.models.IssueCategory;
import com.civicdesk.models.IssueDraft;
import com.civicdesk.models.IssuePriority;
import com.civicdesk.models.IssueStatus;
import com.civicdesk.models.LocationZone;
import com.civicdesk.models.SubmissionResult;
import com.civicdesk.models.TransitionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Controller for issue submission, lookup and status changes.
 */
public class IssueController implements Controller {

    private final IssueLifecycleCoordinator coordinator;
    private final IssueAnalyticsService analyticsService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public IssueController(IssueLifecycleCoordinator coordinator, IssueAnalyticsService analyticsService,
                           ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.analyticsService = analyticsService;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/issues", this::getIssues);
        app.get("/api/issues/analytics", this::getAnalytics);
        app.get("/api/issues/{id}", this::getIssue);
        app.post("/api/issues", this::submitIssue);
        app.post("/api/issues/{id}/status", this::changeStatus);
    }

    private void getIssues(Context ctx) {
        try {
            IssueCategory category = parseFilter(ctx, "category", IssueCategory::fromString);
            IssuePriority priority = parseFilter(ctx, "priority", IssuePriority::fromString);
            IssueStatus status = parseFilter(ctx, "status", IssueStatus::fromString);
            LocationZone zone = parseFilter(ctx, "zone", LocationZone::fromString);
            ctx.json(coordinator.findIssues(category, priority, status, zone));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logError("Error listing issues: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getIssue(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            Optional<Issue> issue = coordinator.getIssue(id);
            if (issue.isPresent()) {
                ctx.json(issue.get());
            } else {
                ctx.status(404).json(Map.of("error", "Issue not found: " + id));
            }
        } catch (Exception e) {
            logError("Error getting issue: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getAnalytics(Context ctx) {
        try {
            ctx.json(analyticsService.snapshot());
        } catch (Exception e) {
            logError("Error computing analytics: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void submitIssue(Context ctx) {
        try {
            IssueDraft draft = parseDraft(objectMapper.readTree(ctx.body()));
            SubmissionResult result = coordinator.submitIssue(draft);
            if (result.isSuccess()) {
                ctx.status(201).json(result);
            } else {
                ctx.status(400).json(Controller.errorBody(result.getErrorMessage(), result.getErrorFields()));
            }
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body"));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logError("Error submitting issue: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void changeStatus(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            JsonNode json = objectMapper.readTree(ctx.body());
            String value = json.has("status") ? json.get("status").asText() : null;
            IssueStatus status = IssueStatus.fromString(value);
            if (status == null) {
                ctx.status(400).json(Map.of("error", "Unknown status: " + value));
                return;
            }

            TransitionResult result = coordinator.transitionStatus(id, status);
            switch (result.getOutcome()) {
                case SUCCESS:
                    ctx.json(result.getIssue());
                    break;
                case NOT_FOUND:
                    ctx.status(404).json(Map.of("error", result.getMessage()));
                    break;
                default:
                    ctx.status(409).json(Map.of("error", result.getMessage()));
                    break;
            }
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body"));
        } catch (Exception e) {
            logError("Error changing issue status: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private IssueDraft parseDraft(JsonNode json) {
        IssueDraft draft = new IssueDraft();
        draft.setTitle(text(json, "title"));
        draft.setDescription(text(json, "description"));
        draft.setLocation(text(json, "location"));
        draft.setUserId(text(json, "userId"));

        String category = text(json, "category");
        if (category != null && !category.isBlank()) {
            IssueCategory parsed = IssueCategory.fromString(category);
            if (parsed == null) {
                throw new IllegalArgumentException("Unknown category: " + category);
            }
            draft.setCategory(parsed);
        }

        String priority = text(json, "priority");
        if (priority != null && !priority.isBlank()) {
            IssuePriority parsed = IssuePriority.fromString(priority);
            if (parsed == null) {
                throw new IllegalArgumentException("Unknown priority: " + priority);
            }
            draft.setPriority(parsed);
        }

        List<String> attachments = new ArrayList<>();
        if (json.has("attachments") && json.get("attachments").isArray()) {
            for (JsonNode node : json.get("attachments")) {
                attachments.add(node.asText());
            }
        }
        draft.setAttachments(attachments);
        return draft;
    }

    private String text(JsonNode json, String field) {
        return json.has(field) && !json.get(field).isNull() ? json.get(field).asText() : null;
    }

    private <T> T parseFilter(Context ctx, String name, Function<String, T> parser) {
        String value = ctx.queryParam(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        T parsed = parser.apply(value);
        if (parsed == null) {
            throw new IllegalArgumentException("Unknown " + name + ": " + value);
        }
        return parsed;
    }

    private void logError(String message) {
        if (logger != null) {
            logger.error("[IssueController] " + message);
        }
    }
}

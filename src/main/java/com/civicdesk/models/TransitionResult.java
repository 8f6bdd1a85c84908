package com.civicdesk.models;

public class TransitionResult {

    public enum Outcome {
        SUCCESS,
        NOT_FOUND,
        INVALID_TRANSITION
    }

    private final Outcome outcome;
    private final Issue issue;
    private final IssueStatus previousStatus;
    private final String message;

    private TransitionResult(Outcome outcome, Issue issue, IssueStatus previousStatus, String message) {
        this.outcome = outcome;
        this.issue = issue;
        this.previousStatus = previousStatus;
        this.message = message;
    }

    public static TransitionResult success(Issue issue, IssueStatus previousStatus) {
        return new TransitionResult(Outcome.SUCCESS, issue, previousStatus, null);
    }

    public static TransitionResult notFound(String issueId) {
        return new TransitionResult(Outcome.NOT_FOUND, null, null, "Issue not found: " + issueId);
    }

    public static TransitionResult invalid(Issue issue, IssueStatus requested) {
        String message = "Cannot move issue " + issue.getId() + " from "
            + issue.getStatus().getLabel() + " to " + (requested != null ? requested.getLabel() : "null");
        return new TransitionResult(Outcome.INVALID_TRANSITION, issue, issue.getStatus(), message);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public Issue getIssue() {
        return issue;
    }

    public IssueStatus getPreviousStatus() {
        return previousStatus;
    }

    public String getMessage() {
        return message;
    }
}

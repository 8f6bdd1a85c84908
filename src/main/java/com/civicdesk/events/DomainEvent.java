package com.civicdesk.events;

import com.civicdesk.models.Issue;

/**
 * Immutable record of something that happened to an issue or a user's progress.
 * The issue carried is a snapshot taken when the event was raised.
 */
public abstract class DomainEvent {

    private final long timestamp;
    private final String userId;
    private final Issue issue;

    protected DomainEvent(long timestamp, String userId, Issue issue) {
        this.timestamp = timestamp;
        this.userId = userId;
        this.issue = issue != null ? new Issue(issue) : null;
    }

    public abstract EventKind getKind();

    public long getTimestamp() {
        return timestamp;
    }

    public String getUserId() {
        return userId;
    }

    public Issue getIssue() {
        return issue != null ? new Issue(issue) : null;
    }

    public String getIssueId() {
        return issue != null ? issue.getId() : null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{issueId='" + getIssueId() + "', userId='" + userId
            + "', timestamp=" + timestamp + '}';
    }
}

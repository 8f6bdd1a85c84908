package com.civicdesk.models;

import com.civicdesk.events.EventKind;

public class Notification {

    private String id;
    private String userId;
    private EventKind type;
    private String title;
    private String message;
    private Integer pointsAwarded;
    private String relatedIssueId;
    private String relatedBadgeId;
    private long createdAt;
    private boolean read;

    public Notification() {
    }

    public Notification(String id, String userId, EventKind type, String title, String message, long createdAt) {
        this.id = id;
        this.userId = userId;
        this.type = type;
        this.title = title;
        this.message = message;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public EventKind getType() {
        return type;
    }

    public void setType(EventKind type) {
        this.type = type;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Integer getPointsAwarded() {
        return pointsAwarded;
    }

    public void setPointsAwarded(Integer pointsAwarded) {
        this.pointsAwarded = pointsAwarded;
    }

    public String getRelatedIssueId() {
        return relatedIssueId;
    }

    public void setRelatedIssueId(String relatedIssueId) {
        this.relatedIssueId = relatedIssueId;
    }

    public String getRelatedBadgeId() {
        return relatedBadgeId;
    }

    public void setRelatedBadgeId(String relatedBadgeId) {
        this.relatedBadgeId = relatedBadgeId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public boolean isRead() {
        return read;
    }

    public void setRead(boolean read) {
        this.read = read;
    }

    @Override
    public String toString() {
        return "Notification{" +
            "id='" + id + '\'' +
            ", userId='" + userId + '\'' +
            ", type=" + type +
            ", title='" + title + '\'' +
            ", createdAt=" + createdAt +
            ", read=" + read +
            '}';
    }
}

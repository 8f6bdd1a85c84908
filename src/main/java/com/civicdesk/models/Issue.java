package com.civicdesk.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class Issue {

    private String id;
    private String title;
    private String description;
    private IssueCategory category;
    private IssuePriority priority;
    private IssueStatus status;
    private String location;
    private String userId;
    private long submittedAt;
    private Long resolvedAt;
    private List<String> attachments = new ArrayList<>();
    private int awardedPoints;

    public Issue() {
    }

    public Issue(Issue other) {
        this.id = other.id;
        this.title = other.title;
        this.description = other.description;
        this.category = other.category;
        this.priority = other.priority;
        this.status = other.status;
        this.location = other.location;
        this.userId = other.userId;
        this.submittedAt = other.submittedAt;
        this.resolvedAt = other.resolvedAt;
        this.attachments = new ArrayList<>(other.attachments);
        this.awardedPoints = other.awardedPoints;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public IssueCategory getCategory() {
        return category;
    }

    public void setCategory(IssueCategory category) {
        this.category = category;
    }

    public IssuePriority getPriority() {
        return priority;
    }

    public void setPriority(IssuePriority priority) {
        this.priority = priority;
    }

    public IssueStatus getStatus() {
        return status;
    }

    public void setStatus(IssueStatus status) {
        this.status = status;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public long getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(long submittedAt) {
        this.submittedAt = submittedAt;
    }

    public Long getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Long resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public List<String> getAttachments() {
        return attachments;
    }

    public void setAttachments(List<String> attachments) {
        this.attachments = attachments != null ? new ArrayList<>(attachments) : new ArrayList<>();
    }

    public boolean hasAttachments() {
        return attachments != null && !attachments.isEmpty();
    }

    public int getAwardedPoints() {
        return awardedPoints;
    }

    public void setAwardedPoints(int awardedPoints) {
        this.awardedPoints = awardedPoints;
    }

    @Override
    public String toString() {
        return "Issue{" +
            "id='" + id + '\'' +
            ", title='" + title + '\'' +
            ", category=" + category +
            ", priority=" + priority +
            ", status=" + status +
            ", userId='" + userId + '\'' +
            ", submittedAt=" + submittedAt +
            ", awardedPoints=" + awardedPoints +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Issue issue = (Issue) o;
        return Objects.equals(id, issue.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}

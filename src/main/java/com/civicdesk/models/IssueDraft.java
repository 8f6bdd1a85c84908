package com.civicdesk.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied fields of a new issue. Identity, timestamps, status and points are assigned on creation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssueDraft {

    private String title;
    private String description;
    private IssueCategory category;
    private IssuePriority priority;
    private String location;
    private String userId;
    private List<String> attachments = new ArrayList<>();

    public IssueDraft() {
    }

    public IssueDraft(String title, String description, IssueCategory category, IssuePriority priority,
                      String location, String userId, List<String> attachments) {
        this.title = title;
        this.description = description;
        this.category = category;
        this.priority = priority;
        this.location = location;
        this.userId = userId;
        setAttachments(attachments);
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

    public List<String> getAttachments() {
        return attachments;
    }

    public void setAttachments(List<String> attachments) {
        this.attachments = attachments != null ? new ArrayList<>(attachments) : new ArrayList<>();
    }
}

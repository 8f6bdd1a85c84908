package com.civicdesk.models;

import java.util.EnumMap;
import java.util.Map;

public class IssueAnalytics {

    private int totalIssues;
    private int resolvedIssues;
    private double averageResolutionHours;
    private Map<IssueCategory, Integer> byCategory = new EnumMap<>(IssueCategory.class);
    private Map<IssuePriority, Integer> byPriority = new EnumMap<>(IssuePriority.class);
    private Map<IssueStatus, Integer> byStatus = new EnumMap<>(IssueStatus.class);
    private Map<LocationZone, Integer> byZone = new EnumMap<>(LocationZone.class);
    private Map<IssueCategory, Map<IssuePriority, Integer>> categoryPriorityMatrix = new EnumMap<>(IssueCategory.class);

    public int getTotalIssues() {
        return totalIssues;
    }

    public void setTotalIssues(int totalIssues) {
        this.totalIssues = totalIssues;
    }

    public int getResolvedIssues() {
        return resolvedIssues;
    }

    public void setResolvedIssues(int resolvedIssues) {
        this.resolvedIssues = resolvedIssues;
    }

    public double getAverageResolutionHours() {
        return averageResolutionHours;
    }

    public void setAverageResolutionHours(double averageResolutionHours) {
        this.averageResolutionHours = averageResolutionHours;
    }

    public Map<IssueCategory, Integer> getByCategory() {
        return byCategory;
    }

    public void setByCategory(Map<IssueCategory, Integer> byCategory) {
        this.byCategory = byCategory;
    }

    public Map<IssuePriority, Integer> getByPriority() {
        return byPriority;
    }

    public void setByPriority(Map<IssuePriority, Integer> byPriority) {
        this.byPriority = byPriority;
    }

    public Map<IssueStatus, Integer> getByStatus() {
        return byStatus;
    }

    public void setByStatus(Map<IssueStatus, Integer> byStatus) {
        this.byStatus = byStatus;
    }

    public Map<LocationZone, Integer> getByZone() {
        return byZone;
    }

    public void setByZone(Map<LocationZone, Integer> byZone) {
        this.byZone = byZone;
    }

    public Map<IssueCategory, Map<IssuePriority, Integer>> getCategoryPriorityMatrix() {
        return categoryPriorityMatrix;
    }

    public void setCategoryPriorityMatrix(Map<IssueCategory, Map<IssuePriority, Integer>> categoryPriorityMatrix) {
        this.categoryPriorityMatrix = categoryPriorityMatrix;
    }
}

package com.civicdesk.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gamification state of one user. Points only grow, the level always follows the points,
 * and a recorded badge is never removed.
 */
public class UserProgress {

    private final String userId;
    private int points;
    private UserLevel level = UserLevel.BRONZE;
    private final Map<String, EarnedBadge> earnedBadges = new LinkedHashMap<>();
    private final List<String> issueIds = new ArrayList<>();
    private int issuesResolved;
    private long lastActiveAt;

    public UserProgress(String userId) {
        this.userId = userId;
    }

    public UserProgress(UserProgress other) {
        this.userId = other.userId;
        this.points = other.points;
        this.level = other.level;
        this.earnedBadges.putAll(other.earnedBadges);
        this.issueIds.addAll(other.issueIds);
        this.issuesResolved = other.issuesResolved;
        this.lastActiveAt = other.lastActiveAt;
    }

    public String getUserId() {
        return userId;
    }

    public int getPoints() {
        return points;
    }

    public UserLevel getLevel() {
        return level;
    }

    public List<EarnedBadge> getEarnedBadges() {
        return Collections.unmodifiableList(new ArrayList<>(earnedBadges.values()));
    }

    public boolean hasBadge(String badgeId) {
        return earnedBadges.containsKey(badgeId);
    }

    /**
     * Issue ids in submission order.
     */
    public List<String> getIssueIds() {
        return Collections.unmodifiableList(issueIds);
    }

    public int getIssuesSubmitted() {
        return issueIds.size();
    }

    public int getIssuesResolved() {
        return issuesResolved;
    }

    public long getLastActiveAt() {
        return lastActiveAt;
    }

    public void addPoints(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Points can only increase");
        }
        points += amount;
        level = UserLevel.forPoints(points);
    }

    public void recordIssue(String issueId, long submittedAt) {
        issueIds.add(issueId);
        lastActiveAt = Math.max(lastActiveAt, submittedAt);
    }

    /**
     * @return false if the badge was already held; the existing earn record is kept
     */
    public boolean recordBadge(EarnedBadge badge) {
        return earnedBadges.putIfAbsent(badge.getBadgeId(), badge) == null;
    }

    public void recordResolution() {
        issuesResolved++;
    }

    @Override
    public String toString() {
        return "UserProgress{" +
            "userId='" + userId + '\'' +
            ", points=" + points +
            ", level=" + level +
            ", badges=" + earnedBadges.keySet() +
            ", issuesSubmitted=" + issueIds.size() +
            '}';
    }
}

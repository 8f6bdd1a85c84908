package com.civicdesk.models;

public class LeaderboardEntry {

    private int rank;
    private String userId;
    private int points;
    private UserLevel level;
    private int issuesSubmitted;
    private int issuesResolved;
    private int badgeCount;
    private long lastActiveAt;

    public LeaderboardEntry() {
    }

    public LeaderboardEntry(int rank, UserProgress progress) {
        this.rank = rank;
        this.userId = progress.getUserId();
        this.points = progress.getPoints();
        this.level = progress.getLevel();
        this.issuesSubmitted = progress.getIssuesSubmitted();
        this.issuesResolved = progress.getIssuesResolved();
        this.badgeCount = progress.getEarnedBadges().size();
        this.lastActiveAt = progress.getLastActiveAt();
    }

    public int getRank() {
        return rank;
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

    public int getIssuesSubmitted() {
        return issuesSubmitted;
    }

    public int getIssuesResolved() {
        return issuesResolved;
    }

    public int getBadgeCount() {
        return badgeCount;
    }

    public long getLastActiveAt() {
        return lastActiveAt;
    }
}

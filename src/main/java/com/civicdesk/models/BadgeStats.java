package com.civicdesk.models;

import java.util.ArrayList;
import java.util.List;

public class BadgeStats {

    private int totalBadges;
    private int earnedBadges;
    private int pointsFromBadges;
    private List<EarnedBadge> recentBadges = new ArrayList<>();

    public BadgeStats() {
    }

    public BadgeStats(int totalBadges, int earnedBadges, int pointsFromBadges, List<EarnedBadge> recentBadges) {
        this.totalBadges = totalBadges;
        this.earnedBadges = earnedBadges;
        this.pointsFromBadges = pointsFromBadges;
        this.recentBadges = recentBadges != null ? new ArrayList<>(recentBadges) : new ArrayList<>();
    }

    public int getTotalBadges() {
        return totalBadges;
    }

    public int getEarnedBadges() {
        return earnedBadges;
    }

    public int getLockedBadges() {
        return totalBadges - earnedBadges;
    }

    public int getPointsFromBadges() {
        return pointsFromBadges;
    }

    public List<EarnedBadge> getRecentBadges() {
        return recentBadges;
    }

    public double getCompletionPercentage() {
        return totalBadges > 0 ? (double) earnedBadges / totalBadges * 100 : 0;
    }
}

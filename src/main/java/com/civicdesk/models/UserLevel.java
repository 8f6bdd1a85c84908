package com.civicdesk.models;

/**
 * Levels in ascending order; each carries the minimum cumulative points it requires.
 */
public enum UserLevel {
    BRONZE(0),
    SILVER(100),
    GOLD(250),
    PLATINUM(500),
    DIAMOND(1000);

    private final int minimumPoints;

    UserLevel(int minimumPoints) {
        this.minimumPoints = minimumPoints;
    }

    public int getMinimumPoints() {
        return minimumPoints;
    }

    public static UserLevel forPoints(int points) {
        UserLevel[] levels = values();
        for (int i = levels.length - 1; i >= 0; i--) {
            if (points >= levels[i].minimumPoints) {
                return levels[i];
            }
        }
        return BRONZE;
    }
}

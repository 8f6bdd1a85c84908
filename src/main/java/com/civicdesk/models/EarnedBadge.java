package com.civicdesk.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A badge held by one user. {@code earnedAt} is the submission time of the issue that
 * first satisfied the badge threshold. Instances are shared between the user's progress,
 * submission results and events, so they never change after construction.
 */
public final class EarnedBadge {

    private final String badgeId;
    private final String name;
    private final int pointsValue;
    private final long earnedAt;
    private final String triggeringIssueId;

    @JsonCreator
    public EarnedBadge(@JsonProperty("badgeId") String badgeId,
                       @JsonProperty("name") String name,
                       @JsonProperty("pointsValue") int pointsValue,
                       @JsonProperty("earnedAt") long earnedAt,
                       @JsonProperty("triggeringIssueId") String triggeringIssueId) {
        this.badgeId = Objects.requireNonNull(badgeId, "badgeId");
        this.name = name;
        this.pointsValue = pointsValue;
        this.earnedAt = earnedAt;
        this.triggeringIssueId = triggeringIssueId;
    }

    public String getBadgeId() {
        return badgeId;
    }

    public String getName() {
        return name;
    }

    public int getPointsValue() {
        return pointsValue;
    }

    public long getEarnedAt() {
        return earnedAt;
    }

    public String getTriggeringIssueId() {
        return triggeringIssueId;
    }

    @Override
    public String toString() {
        return "EarnedBadge{" +
            "badgeId='" + badgeId + '\'' +
            ", earnedAt=" + earnedAt +
            ", triggeringIssueId='" + triggeringIssueId + '\'' +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EarnedBadge that = (EarnedBadge) o;
        return earnedAt == that.earnedAt
            && Objects.equals(badgeId, that.badgeId)
            && Objects.equals(triggeringIssueId, that.triggeringIssueId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(badgeId, earnedAt, triggeringIssueId);
    }
}

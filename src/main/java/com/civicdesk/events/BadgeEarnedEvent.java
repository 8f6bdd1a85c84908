package com.civicdesk.events;

import com.civicdesk.models.Badge;
import com.civicdesk.models.EarnedBadge;
import com.civicdesk.models.Issue;

/**
 * Raised once per user and badge. The issue is the submission that triggered the evaluation.
 */
public class BadgeEarnedEvent extends DomainEvent {

    private final Badge badge;
    private final EarnedBadge earnedBadge;

    public BadgeEarnedEvent(long timestamp, String userId, Issue issue, Badge badge, EarnedBadge earnedBadge) {
        super(timestamp, userId, issue);
        this.badge = badge;
        this.earnedBadge = earnedBadge;
    }

    @Override
    public EventKind getKind() {
        return EventKind.BADGE_EARNED;
    }

    public Badge getBadge() {
        return badge;
    }

    public EarnedBadge getEarnedBadge() {
        return earnedBadge;
    }
}

package com.civicdesk.events;

public enum EventKind {
    ISSUE_SUBMITTED,
    ISSUE_STATUS_CHANGED,
    BADGE_EARNED,
    ISSUE_RESOLVED
}

package com.civicdesk.events;

import com.civicdesk.models.Issue;

public class IssueSubmittedEvent extends DomainEvent {

    public IssueSubmittedEvent(long timestamp, Issue issue) {
        super(timestamp, issue.getUserId(), issue);
    }

    @Override
    public EventKind getKind() {
        return EventKind.ISSUE_SUBMITTED;
    }

    public int getPointsAwarded() {
        return getIssue().getAwardedPoints();
    }
}

package com.civicdesk.events;

import com.civicdesk.models.Issue;
import com.civicdesk.models.IssueStatus;

public class IssueStatusChangedEvent extends DomainEvent {

    private final IssueStatus from;
    private final IssueStatus to;

    public IssueStatusChangedEvent(long timestamp, Issue issue, IssueStatus from, IssueStatus to) {
        super(timestamp, issue.getUserId(), issue);
        this.from = from;
        this.to = to;
    }

    @Override
    public EventKind getKind() {
        return EventKind.ISSUE_STATUS_CHANGED;
    }

    public IssueStatus getFrom() {
        return from;
    }

    public IssueStatus getTo() {
        return to;
    }
}

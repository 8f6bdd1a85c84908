package com.civicdesk.events;

import com.civicdesk.models.Issue;

public class IssueResolvedEvent extends DomainEvent {

    public IssueResolvedEvent(long timestamp, Issue issue) {
        super(timestamp, issue.getUserId(), issue);
    }

    @Override
    public EventKind getKind() {
        return EventKind.ISSUE_RESOLVED;
    }
}

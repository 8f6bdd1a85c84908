package com.civicdesk;

import com.civicdesk.models.Issue;
import com.civicdesk.models.IssuePriority;

import java.util.Comparator;

public final class IssueOrdering {

    /**
     * Most urgent first, then highest awarded points, then newest submission.
     */
    public static final Comparator<Issue> PRIORITY_THEN_RECENT = Comparator
        .comparing((Issue issue) -> issue.getPriority() != null ? issue.getPriority() : IssuePriority.LOW)
        .reversed()
        .thenComparing(Comparator.comparingInt(Issue::getAwardedPoints).reversed())
        .thenComparing(Comparator.comparingLong(Issue::getSubmittedAt).reversed());

    private IssueOrdering() {
    }
}

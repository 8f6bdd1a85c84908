package com.civicdesk;

import com.civicdesk.models.Issue;
import com.civicdesk.models.IssueAnalytics;
import com.civicdesk.models.IssueCategory;
import com.civicdesk.models.IssuePriority;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate counts and resolution times across all issues.
 */
public class IssueAnalyticsService {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final IssueLifecycleCoordinator coordinator;

    public IssueAnalyticsService(IssueLifecycleCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public IssueAnalytics snapshot() {
        return coordinator.readConsistently(this::compute);
    }

    private IssueAnalytics compute(IssueStore store, SecondaryIndexes indexes) {
        List<Issue> issues = store.listAll();
        IssueAnalytics analytics = new IssueAnalytics();

        Map<IssueCategory, Integer> byCategory = new EnumMap<>(IssueCategory.class);
        Map<IssuePriority, Integer> byPriority = new EnumMap<>(IssuePriority.class);
        Map<IssueCategory, Map<IssuePriority, Integer>> matrix = new EnumMap<>(IssueCategory.class);
        for (IssueCategory category : IssueCategory.values()) {
            byCategory.put(category, 0);
            Map<IssuePriority, Integer> row = new EnumMap<>(IssuePriority.class);
            for (IssuePriority priority : IssuePriority.values()) {
                row.put(priority, 0);
            }
            matrix.put(category, row);
        }
        for (IssuePriority priority : IssuePriority.values()) {
            byPriority.put(priority, 0);
        }

        int resolved = 0;
        double totalResolutionHours = 0;
        for (Issue issue : issues) {
            byCategory.merge(issue.getCategory(), 1, Integer::sum);
            byPriority.merge(issue.getPriority(), 1, Integer::sum);
            matrix.get(issue.getCategory()).merge(issue.getPriority(), 1, Integer::sum);
            if (issue.getResolvedAt() != null) {
                resolved++;
                totalResolutionHours += (issue.getResolvedAt() - issue.getSubmittedAt()) / MILLIS_PER_HOUR;
            }
        }

        analytics.setTotalIssues(issues.size());
        analytics.setResolvedIssues(resolved);
        analytics.setAverageResolutionHours(resolved > 0 ? totalResolutionHours / resolved : 0);
        analytics.setByCategory(byCategory);
        analytics.setByPriority(byPriority);
        analytics.setCategoryPriorityMatrix(matrix);
        analytics.setByStatus(indexes.statusCounts());
        analytics.setByZone(indexes.zoneCounts());
        return analytics;
    }
}

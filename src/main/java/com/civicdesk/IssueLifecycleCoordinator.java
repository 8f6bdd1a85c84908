package com.civicdesk;

import com.civicdesk.events.BadgeEarnedEvent;
import com.civicdesk.events.IssueResolvedEvent;
import com.civicdesk.events.IssueStatusChangedEvent;
import com.civicdesk.events.IssueSubmittedEvent;
import com.civicdesk.models.Badge;
import com.civicdesk.models.BadgeEvaluation;
import com.civicdesk.models.EarnedBadge;
import com.civicdesk.models.Issue;
import com.civicdesk.models.IssueCategory;
import com.civicdesk.models.IssueDraft;
import com.civicdesk.models.IssuePriority;
import com.civicdesk.models.IssueStatus;
import com.civicdesk.models.LocationZone;
import com.civicdesk.models.SubmissionResult;
import com.civicdesk.models.TransitionResult;
import com.civicdesk.models.UserProgress;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Runs issue submission and status transitions against the store, the indexes, user progress
 * and the dispatcher. Each operation is one critical section under a single lock, and events
 * are dispatched inside it so subscribers see them in the order they were raised.
 */
public class IssueLifecycleCoordinator {

    private final IssueStore store;
    private final SecondaryIndexes indexes;
    private final GamificationEngine engine;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;
    private final Map<String, UserProgress> progressByUser = new HashMap<>();
    private final Object lock = new Object();

    public IssueLifecycleCoordinator(IssueStore store, SecondaryIndexes indexes, GamificationEngine engine,
                                     NotificationDispatcher dispatcher, Clock clock) {
        this.store = store;
        this.indexes = indexes;
        this.engine = engine;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public SubmissionResult submitIssue(IssueDraft draft) {
        synchronized (lock) {
            String issueId;
            try {
                issueId = store.create(draft);
            } catch (ValidationException e) {
                return SubmissionResult.failed(e.getMessage(), e.getFields());
            }

            Issue issue = store.get(issueId).orElseThrow(() -> new IssueNotFoundException(issueId));
            indexes.onIssueCreated(issue);

            int points = engine.computePointsForSubmission(issue);
            issue.setAwardedPoints(points);
            issue = store.update(issue);

            UserProgress progress = progressByUser.computeIfAbsent(issue.getUserId(), UserProgress::new);
            progress.recordIssue(issue.getId(), issue.getSubmittedAt());
            progress.addPoints(points);

            BadgeEvaluation evaluation = engine.evaluateBadges(historyOf(progress), earnedBadgeIds(progress));
            List<EarnedBadge> awarded = new ArrayList<>();
            for (EarnedBadge earned : evaluation.getNewlyEarned()) {
                if (progress.recordBadge(earned)) {
                    awarded.add(earned);
                }
            }

            log("Issue " + issue.getId() + " submitted by " + issue.getUserId() + ": +" + points
                + " points, level " + progress.getLevel() + ", " + awarded.size() + " new badge(s)");

            for (EarnedBadge earned : awarded) {
                Badge badge = engine.getCatalog().find(earned.getBadgeId()).orElse(null);
                log("Badge earned: " + earned.getBadgeId() + " -> " + issue.getUserId());
                dispatcher.dispatch(new BadgeEarnedEvent(clock.millis(), issue.getUserId(), issue, badge, earned));
            }
            dispatcher.dispatch(new IssueSubmittedEvent(clock.millis(), issue));

            return SubmissionResult.succeeded(issue, points, awarded, new UserProgress(progress));
        }
    }

    public TransitionResult transitionStatus(String issueId, IssueStatus newStatus) {
        synchronized (lock) {
            Optional<Issue> found = store.get(issueId);
            if (found.isEmpty()) {
                logWarning("Status change rejected, unknown issue " + issueId);
                return TransitionResult.notFound(issueId);
            }

            Issue issue = found.get();
            IssueStatus oldStatus = issue.getStatus();
            if (!oldStatus.canTransitionTo(newStatus)) {
                logWarning("Status change rejected for " + issueId + ": " + oldStatus + " -> " + newStatus);
                return TransitionResult.invalid(issue, newStatus);
            }

            boolean firstResolution = false;
            issue.setStatus(newStatus);
            if (newStatus.isResolution() && issue.getResolvedAt() == null) {
                issue.setResolvedAt(clock.millis());
                firstResolution = true;
            }
            Issue updated = store.update(issue);
            indexes.onStatusChanged(updated, oldStatus, newStatus);

            if (firstResolution) {
                UserProgress progress = progressByUser.get(updated.getUserId());
                if (progress != null) {
                    progress.recordResolution();
                }
            }

            log("Issue " + issueId + " moved " + oldStatus + " -> " + newStatus);
            dispatcher.dispatch(new IssueStatusChangedEvent(clock.millis(), updated, oldStatus, newStatus));
            if (newStatus == IssueStatus.RESOLVED) {
                dispatcher.dispatch(new IssueResolvedEvent(clock.millis(), updated));
            }
            return TransitionResult.success(updated, oldStatus);
        }
    }

    public Optional<Issue> getIssue(String issueId) {
        synchronized (lock) {
            return store.get(issueId);
        }
    }

    /**
     * Runs a read over the store and the indexes under the coordinator lock, so it never sees
     * a submission or transition half applied.
     */
    <T> T readConsistently(BiFunction<IssueStore, SecondaryIndexes, T> reader) {
        synchronized (lock) {
            return reader.apply(store, indexes);
        }
    }

    /**
     * Issues matching every non-null filter, most urgent first.
     */
    public List<Issue> findIssues(IssueCategory category, IssuePriority priority, IssueStatus status,
                                  LocationZone zone) {
        List<Issue> results = new ArrayList<>();
        synchronized (lock) {
            Set<String> ids = null;
            if (category != null) {
                ids = intersect(ids, indexes.byCategory(category));
            }
            if (priority != null) {
                ids = intersect(ids, indexes.byPriority(priority));
            }
            if (status != null) {
                ids = intersect(ids, indexes.byStatus(status));
            }
            if (zone != null) {
                ids = intersect(ids, indexes.byLocationZone(zone));
            }

            if (ids == null) {
                results.addAll(store.listAll());
            } else {
                for (String id : ids) {
                    store.get(id).ifPresent(results::add);
                }
            }
        }
        results.sort(IssueOrdering.PRIORITY_THEN_RECENT);
        return results;
    }

    public Optional<UserProgress> getProgress(String userId) {
        synchronized (lock) {
            UserProgress progress = userId != null ? progressByUser.get(userId) : null;
            return progress != null ? Optional.of(new UserProgress(progress)) : Optional.empty();
        }
    }

    public List<UserProgress> listProgress() {
        synchronized (lock) {
            List<UserProgress> results = new ArrayList<>();
            for (UserProgress progress : progressByUser.values()) {
                results.add(new UserProgress(progress));
            }
            return results;
        }
    }

    public List<Issue> getUserHistory(String userId) {
        synchronized (lock) {
            UserProgress progress = userId != null ? progressByUser.get(userId) : null;
            return progress != null ? historyOf(progress) : new ArrayList<>();
        }
    }

    private List<Issue> historyOf(UserProgress progress) {
        List<Issue> history = new ArrayList<>();
        for (String id : progress.getIssueIds()) {
            store.get(id).ifPresent(history::add);
        }
        return history;
    }

    private Set<String> earnedBadgeIds(UserProgress progress) {
        Set<String> ids = new HashSet<>();
        for (EarnedBadge badge : progress.getEarnedBadges()) {
            ids.add(badge.getBadgeId());
        }
        return ids;
    }

    private Set<String> intersect(Set<String> current, Set<String> bucket) {
        if (current == null) {
            return new LinkedHashSet<>(bucket);
        }
        current.retainAll(bucket);
        return current;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[IssueLifecycleCoordinator] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[IssueLifecycleCoordinator] " + message);
        }
    }
}

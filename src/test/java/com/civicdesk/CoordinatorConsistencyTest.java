package com.civicdesk;

import com.civicdesk.events.BadgeEarnedEvent;
import com.civicdesk.events.EventKind;
import com.civicdesk.models.EarnedBadge;
import com.civicdesk.models.Issue;
import com.civicdesk.models.IssueAnalytics;
import com.civicdesk.models.IssueCategory;
import com.civicdesk.models.IssueDraft;
import com.civicdesk.models.IssuePriority;
import com.civicdesk.models.IssueStatus;
import com.civicdesk.models.LocationZone;
import com.civicdesk.models.SubmissionResult;
import com.civicdesk.models.TransitionResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConsistencyTest {

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private final IssueStore store = new IssueStore(clock);
    private final NotificationDispatcher dispatcher = new NotificationDispatcher();
    private final GamificationEngine engine = new GamificationEngine(BadgeCatalog.standard());

    private IssueDraft draft(String userId, IssueCategory category, IssuePriority priority, String location) {
        return new IssueDraft("Report", "", category, priority, location, userId, List.of());
    }

    @Test
    void readsWaitForSubmissionInProgress() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean blockNext = new AtomicBoolean(true);
        LocationZoneResolver keywords = LocationZoneResolver.keywords();
        LocationZoneResolver blocking = location -> {
            if (blockNext.compareAndSet(true, false)) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return keywords.resolve(location);
        };
        SecondaryIndexes indexes = new SecondaryIndexes(blocking);
        IssueLifecycleCoordinator coordinator = new IssueLifecycleCoordinator(store, indexes, engine, dispatcher, clock);
        IssueAnalyticsService analytics = new IssueAnalyticsService(coordinator);

        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<SubmissionResult> submission = pool.submit(() -> coordinator.submitIssue(
                draft("alice", IssueCategory.ROADS, IssuePriority.LOW, "North Road")));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            // The store already holds the record, but the submission has not finished.
            String id = store.listAll().get(0).getId();
            Future<Issue> read = pool.submit(() -> coordinator.getIssue(id).orElseThrow());
            Future<IssueAnalytics> snapshot = pool.submit(() -> analytics.snapshot());

            assertThrows(TimeoutException.class, () -> read.get(200, TimeUnit.MILLISECONDS));
            assertFalse(snapshot.isDone());
            release.countDown();

            assertEquals(15, read.get(5, TimeUnit.SECONDS).getAwardedPoints());
            IssueAnalytics stats = snapshot.get(5, TimeUnit.SECONDS);
            assertEquals(1, stats.getTotalIssues());
            assertEquals(1, stats.getByStatus().get(IssueStatus.OPEN));
            assertEquals(1, stats.getByZone().get(LocationZone.NORTH));
            assertTrue(submission.get(5, TimeUnit.SECONDS).isSuccess());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void statusIndexCoversEveryIssueExactlyOnce() {
        SecondaryIndexes indexes = new SecondaryIndexes(LocationZoneResolver.keywords());
        IssueLifecycleCoordinator coordinator = new IssueLifecycleCoordinator(store, indexes, engine, dispatcher, clock);

        String a = coordinator.submitIssue(draft("alice", IssueCategory.ROADS, IssuePriority.LOW, "North Road"))
            .getIssue().getId();
        String b = coordinator.submitIssue(draft("bob", IssueCategory.ELECTRICITY, IssuePriority.HIGH, "Downtown"))
            .getIssue().getId();
        String c = coordinator.submitIssue(draft("carol", IssueCategory.OTHER, IssuePriority.CRITICAL, "Riverside"))
            .getIssue().getId();
        assertFalse(coordinator.submitIssue(draft("", IssueCategory.OTHER, IssuePriority.LOW, "")).isSuccess());

        coordinator.transitionStatus(a, IssueStatus.IN_PROGRESS);
        coordinator.transitionStatus(a, IssueStatus.CLOSED);
        coordinator.transitionStatus(b, IssueStatus.RESOLVED);
        assertEquals(TransitionResult.Outcome.INVALID_TRANSITION,
            coordinator.transitionStatus(b, IssueStatus.IN_PROGRESS).getOutcome());
        assertEquals(TransitionResult.Outcome.INVALID_TRANSITION,
            coordinator.transitionStatus(c, IssueStatus.CLOSED).getOutcome());
        assertEquals(TransitionResult.Outcome.NOT_FOUND,
            coordinator.transitionStatus("missing", IssueStatus.RESOLVED).getOutcome());

        assertIndexesComplete(indexes);
    }

    @Test
    void statusIndexStaysCompleteUnderConcurrentLifecycles() throws Exception {
        SecondaryIndexes indexes = new SecondaryIndexes(LocationZoneResolver.keywords());
        IssueLifecycleCoordinator coordinator = new IssueLifecycleCoordinator(store, indexes, engine, dispatcher, clock);
        IssueStatus[][] paths = {
            {IssueStatus.IN_PROGRESS, IssueStatus.RESOLVED, IssueStatus.CLOSED},
            {IssueStatus.RESOLVED, IssueStatus.OPEN},
            {IssueStatus.IN_PROGRESS, IssueStatus.CLOSED, IssueStatus.RESOLVED},
            {IssueStatus.CLOSED},
            {}
        };

        int threads = 8;
        int perThread = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            String userId = "user-" + t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    IssueCategory category = IssueCategory.values()[i % IssueCategory.values().length];
                    String id = coordinator.submitIssue(draft(userId, category, IssuePriority.MEDIUM, "East Side"))
                        .getIssue().getId();
                    for (IssueStatus next : paths[i % paths.length]) {
                        coordinator.transitionStatus(id, next);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(threads * perThread, store.size());
        assertIndexesComplete(indexes);
    }

    @Test
    void badgeRecordsHandedOutMatchTheStoredOnes() {
        SecondaryIndexes indexes = new SecondaryIndexes(LocationZoneResolver.keywords());
        IssueLifecycleCoordinator coordinator = new IssueLifecycleCoordinator(store, indexes, engine, dispatcher, clock);
        List<BadgeEarnedEvent> announced = Collections.synchronizedList(new ArrayList<>());
        dispatcher.subscribe(EventKind.BADGE_EARNED, event -> announced.add((BadgeEarnedEvent) event));

        SubmissionResult result = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.LOW, "North Road"));
        long submittedAt = result.getIssue().getSubmittedAt();
        clock.advance(60_000);

        EarnedBadge returned = result.getBadgesEarned().get(0);
        EarnedBadge stored = coordinator.getProgress("alice").orElseThrow().getEarnedBadges().get(0);
        assertEquals(returned, stored);
        assertEquals(submittedAt, stored.getEarnedAt());
        assertEquals(stored, announced.get(0).getEarnedBadge());
        assertEquals(submittedAt, announced.get(0).getEarnedBadge().getEarnedAt());
    }

    @Test
    void submissionSucceedsWhenASubscriberFailsAnAssertion() {
        SecondaryIndexes indexes = new SecondaryIndexes(LocationZoneResolver.keywords());
        IssueLifecycleCoordinator coordinator = new IssueLifecycleCoordinator(store, indexes, engine, dispatcher, clock);
        dispatcher.subscribe(EventKind.ISSUE_SUBMITTED, event -> {
            throw new AssertionError("subscriber invariant broken");
        });

        SubmissionResult result = assertDoesNotThrow(() -> coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.LOW, "North Road")));

        assertTrue(result.isSuccess());
        assertEquals(1, store.size());
        assertEquals(15, coordinator.getProgress("alice").orElseThrow().getPoints());
    }

    private void assertIndexesComplete(SecondaryIndexes indexes) {
        List<Issue> issues = store.listAll();
        Set<String> stored = issues.stream().map(Issue::getId).collect(Collectors.toSet());

        Set<String> indexed = new HashSet<>();
        int bucketEntries = 0;
        for (IssueStatus status : IssueStatus.values()) {
            Set<String> bucket = indexes.byStatus(status);
            bucketEntries += bucket.size();
            indexed.addAll(bucket);
        }
        assertEquals(stored, indexed);
        assertEquals(stored.size(), bucketEntries, "an issue sits in more than one status bucket");

        for (Issue issue : issues) {
            assertTrue(indexes.byStatus(issue.getStatus()).contains(issue.getId()),
                issue.getId() + " not indexed under " + issue.getStatus());
            assertTrue(indexes.byCategory(issue.getCategory()).contains(issue.getId()));
            assertTrue(indexes.byPriority(issue.getPriority()).contains(issue.getId()));
            assertTrue(indexes.byLocationZone(indexes.zoneFor(issue.getLocation())).contains(issue.getId()));
        }
    }
}

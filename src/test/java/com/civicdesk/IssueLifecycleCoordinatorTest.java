package com.civicdesk;

import com.civicdesk.events.BadgeEarnedEvent;
import com.civicdesk.events.DomainEvent;
import com.civicdesk.events.EventKind;
import com.civicdesk.models.Badge;
import com.civicdesk.models.EarnedBadge;
import com.civicdesk.models.Issue;
import com.civicdesk.models.IssueCategory;
import com.civicdesk.models.IssueDraft;
import com.civicdesk.models.IssuePriority;
import com.civicdesk.models.IssueStatus;
import com.civicdesk.models.LocationZone;
import com.civicdesk.models.SubmissionResult;
import com.civicdesk.models.TransitionResult;
import com.civicdesk.models.UserLevel;
import com.civicdesk.models.UserProgress;
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
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IssueLifecycleCoordinatorTest {

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private final IssueStore store = new IssueStore(clock);
    private final SecondaryIndexes indexes = new SecondaryIndexes(LocationZoneResolver.keywords());
    private final NotificationDispatcher dispatcher = new NotificationDispatcher();
    private final List<DomainEvent> events = Collections.synchronizedList(new ArrayList<>());

    private IssueLifecycleCoordinator coordinator(BadgeCatalog catalog) {
        dispatcher.subscribeAll(events::add);
        return new IssueLifecycleCoordinator(store, indexes, new GamificationEngine(catalog), dispatcher, clock);
    }

    private IssueLifecycleCoordinator coordinator() {
        return coordinator(BadgeCatalog.standard());
    }

    private IssueDraft draft(String userId, IssueCategory category, IssuePriority priority, String location,
                             String... attachments) {
        return new IssueDraft("Report from " + userId, "details", category, priority, location, userId,
            List.of(attachments));
    }

    private List<EventKind> kinds() {
        return events.stream().map(DomainEvent::getKind).collect(Collectors.toList());
    }

    private Set<String> badgeIds(List<EarnedBadge> badges) {
        return badges.stream().map(EarnedBadge::getBadgeId).collect(Collectors.toSet());
    }

    @Test
    void firstSubmissionAwardsPointsAndFirstReport() {
        IssueLifecycleCoordinator coordinator = coordinator();

        SubmissionResult result = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.LOW, "North Road"));

        assertTrue(result.isSuccess());
        assertEquals(15, result.getPointsAwarded());
        assertEquals(Set.of(BadgeCatalog.FIRST_REPORT), badgeIds(result.getBadgesEarned()));
        assertEquals(UserLevel.BRONZE, result.getProgress().getLevel());
        assertEquals(15, result.getProgress().getPoints());
        assertEquals(15, result.getIssue().getAwardedPoints());

        Issue stored = store.get(result.getIssue().getId()).orElseThrow();
        assertEquals(15, stored.getAwardedPoints());
        assertEquals(IssueStatus.OPEN, stored.getStatus());
    }

    @Test
    void submissionIndexesTheIssue() {
        IssueLifecycleCoordinator coordinator = coordinator();
        String id = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.HIGH, "North Road")).getIssue().getId();

        assertTrue(indexes.byCategory(IssueCategory.ROADS).contains(id));
        assertTrue(indexes.byPriority(IssuePriority.HIGH).contains(id));
        assertTrue(indexes.byLocationZone(LocationZone.NORTH).contains(id));
        assertTrue(indexes.byStatus(IssueStatus.OPEN).contains(id));
    }

    @Test
    void badgeEventsPrecedeSubmissionEvent() {
        IssueLifecycleCoordinator coordinator = coordinator();
        coordinator.submitIssue(draft("alice", IssueCategory.PUBLIC_SAFETY, IssuePriority.CRITICAL, "Downtown",
            "photo.jpg"));

        assertEquals(List.of(EventKind.BADGE_EARNED, EventKind.BADGE_EARNED, EventKind.BADGE_EARNED,
            EventKind.ISSUE_SUBMITTED), kinds());
        assertEquals("alice", events.get(3).getUserId());
    }

    @Test
    void invalidSubmissionChangesNothing() {
        IssueLifecycleCoordinator coordinator = coordinator();

        SubmissionResult result = coordinator.submitIssue(
            new IssueDraft("", "details", null, IssuePriority.LOW, "North Road", "alice", List.of()));

        assertFalse(result.isSuccess());
        assertEquals(List.of("title", "category"), result.getErrorFields());
        assertEquals(0, store.size());
        assertTrue(coordinator.getProgress("alice").isEmpty());
        assertTrue(events.isEmpty());
    }

    @Test
    void thresholdBadgeUsesThirdSubmissionTime() {
        IssueLifecycleCoordinator coordinator = coordinator();

        coordinator.submitIssue(draft("alice", IssueCategory.WATER_SUPPLY, IssuePriority.LOW, "Main St"));
        clock.advance(60_000);
        coordinator.submitIssue(draft("alice", IssueCategory.WATER_SUPPLY, IssuePriority.HIGH, "Main St"));
        clock.advance(60_000);
        SubmissionResult third = coordinator.submitIssue(
            draft("alice", IssueCategory.WATER_SUPPLY, IssuePriority.MEDIUM, "Main St"));
        long thirdSubmittedAt = third.getIssue().getSubmittedAt();
        clock.advance(60_000);

        EarnedBadge waterSaver = third.getBadgesEarned().stream()
            .filter(badge -> badge.getBadgeId().equals(BadgeCatalog.WATER_SAVER))
            .findFirst()
            .orElseThrow();
        assertEquals(thirdSubmittedAt, waterSaver.getEarnedAt());
        assertTrue(badgeIds(third.getBadgesEarned()).contains(BadgeCatalog.COMMUNITY_HELPER));

        EarnedBadge recorded = coordinator.getProgress("alice").orElseThrow().getEarnedBadges().stream()
            .filter(badge -> badge.getBadgeId().equals(BadgeCatalog.WATER_SAVER))
            .findFirst()
            .orElseThrow();
        assertEquals(thirdSubmittedAt, recorded.getEarnedAt());
    }

    @Test
    void badgesAreAwardedOnlyOnce() {
        IssueLifecycleCoordinator coordinator = coordinator();
        coordinator.submitIssue(draft("alice", IssueCategory.ROADS, IssuePriority.LOW, "Main St"));
        clock.advance(1000);
        SubmissionResult second = coordinator.submitIssue(
            draft("alice", IssueCategory.ELECTRICITY, IssuePriority.LOW, "Main St"));

        assertFalse(badgeIds(second.getBadgesEarned()).contains(BadgeCatalog.FIRST_REPORT));
        long firstReportEvents = events.stream()
            .filter(event -> event instanceof BadgeEarnedEvent)
            .filter(event -> ((BadgeEarnedEvent) event).getEarnedBadge().getBadgeId()
                .equals(BadgeCatalog.FIRST_REPORT))
            .count();
        assertEquals(1, firstReportEvents);
    }

    @Test
    void pointsAccumulateAcrossSubmissionsAndLevelFollows() {
        IssueLifecycleCoordinator coordinator = coordinator();
        for (int i = 0; i < 4; i++) {
            coordinator.submitIssue(draft("alice", IssueCategory.OTHER, IssuePriority.CRITICAL, "Main St",
                "photo.jpg"));
            clock.advance(1000);
        }

        UserProgress progress = coordinator.getProgress("alice").orElseThrow();
        assertEquals(140, progress.getPoints());
        assertEquals(UserLevel.SILVER, progress.getLevel());
        assertEquals(4, progress.getIssuesSubmitted());
    }

    @Test
    void usersAreTrackedIndependently() {
        IssueLifecycleCoordinator coordinator = coordinator();
        coordinator.submitIssue(draft("alice", IssueCategory.ROADS, IssuePriority.LOW, "Main St"));
        SubmissionResult bob = coordinator.submitIssue(
            draft("bob", IssueCategory.ROADS, IssuePriority.LOW, "Main St"));

        assertTrue(badgeIds(bob.getBadgesEarned()).contains(BadgeCatalog.FIRST_REPORT));
        assertEquals(1, coordinator.getUserHistory("alice").size());
        assertEquals(1, coordinator.getUserHistory("bob").size());
    }

    @Test
    void fullLifecycleSetsResolutionTimeOnce() {
        IssueLifecycleCoordinator coordinator = coordinator();
        String id = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.HIGH, "North Road")).getIssue().getId();

        clock.advance(1000);
        assertTrue(coordinator.transitionStatus(id, IssueStatus.IN_PROGRESS).isSuccess());
        assertNull(store.get(id).orElseThrow().getResolvedAt());

        clock.advance(1000);
        TransitionResult resolved = coordinator.transitionStatus(id, IssueStatus.RESOLVED);
        long resolvedAt = clock.millis();
        assertEquals(IssueStatus.IN_PROGRESS, resolved.getPreviousStatus());
        assertEquals(resolvedAt, resolved.getIssue().getResolvedAt());

        clock.advance(1000);
        coordinator.transitionStatus(id, IssueStatus.CLOSED);
        Issue closed = store.get(id).orElseThrow();
        assertEquals(IssueStatus.CLOSED, closed.getStatus());
        assertEquals(resolvedAt, closed.getResolvedAt());
        assertEquals(Set.of(id), indexes.byStatus(IssueStatus.CLOSED));
        assertTrue(indexes.byStatus(IssueStatus.RESOLVED).isEmpty());

        assertEquals(1, coordinator.getProgress("alice").orElseThrow().getIssuesResolved());
    }

    @Test
    void transitionsLeavePointsUntouched() {
        IssueLifecycleCoordinator coordinator = coordinator();
        SubmissionResult result = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.HIGH, "North Road"));
        String id = result.getIssue().getId();

        coordinator.transitionStatus(id, IssueStatus.RESOLVED);

        assertEquals(25, store.get(id).orElseThrow().getAwardedPoints());
        assertEquals(25, coordinator.getProgress("alice").orElseThrow().getPoints());
    }

    @Test
    void resolvingRaisesStatusChangeThenResolvedEvents() {
        IssueLifecycleCoordinator coordinator = coordinator();
        String id = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.HIGH, "North Road")).getIssue().getId();
        events.clear();

        coordinator.transitionStatus(id, IssueStatus.RESOLVED);

        assertEquals(List.of(EventKind.ISSUE_STATUS_CHANGED, EventKind.ISSUE_RESOLVED), kinds());
    }

    @Test
    void closingFromInProgressSetsResolutionWithoutResolvedEvent() {
        IssueLifecycleCoordinator coordinator = coordinator();
        String id = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.HIGH, "North Road")).getIssue().getId();
        coordinator.transitionStatus(id, IssueStatus.IN_PROGRESS);
        events.clear();

        clock.advance(5000);
        coordinator.transitionStatus(id, IssueStatus.CLOSED);

        assertEquals(List.of(EventKind.ISSUE_STATUS_CHANGED), kinds());
        assertEquals(clock.millis(), store.get(id).orElseThrow().getResolvedAt());
    }

    @Test
    void invalidTransitionLeavesIssueAndIndexesUnchanged() {
        IssueLifecycleCoordinator coordinator = coordinator();
        String id = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.HIGH, "North Road")).getIssue().getId();
        coordinator.transitionStatus(id, IssueStatus.RESOLVED);
        events.clear();

        TransitionResult result = coordinator.transitionStatus(id, IssueStatus.OPEN);

        assertEquals(TransitionResult.Outcome.INVALID_TRANSITION, result.getOutcome());
        assertEquals(IssueStatus.RESOLVED, store.get(id).orElseThrow().getStatus());
        assertEquals(Set.of(id), indexes.byStatus(IssueStatus.RESOLVED));
        assertTrue(indexes.byStatus(IssueStatus.OPEN).isEmpty());
        assertTrue(events.isEmpty());
    }

    @Test
    void sameStatusAndNullStatusAreInvalid() {
        IssueLifecycleCoordinator coordinator = coordinator();
        String id = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.HIGH, "North Road")).getIssue().getId();

        assertEquals(TransitionResult.Outcome.INVALID_TRANSITION,
            coordinator.transitionStatus(id, IssueStatus.OPEN).getOutcome());
        assertEquals(TransitionResult.Outcome.INVALID_TRANSITION,
            coordinator.transitionStatus(id, null).getOutcome());
    }

    @Test
    void unknownIssueIsNotFound() {
        IssueLifecycleCoordinator coordinator = coordinator();

        TransitionResult result = coordinator.transitionStatus("no-such-issue", IssueStatus.IN_PROGRESS);

        assertEquals(TransitionResult.Outcome.NOT_FOUND, result.getOutcome());
        assertNull(result.getIssue());
        assertTrue(events.isEmpty());
    }

    @Test
    void findIssuesIntersectsFiltersAndOrdersByUrgency() {
        IssueLifecycleCoordinator coordinator = coordinator();
        String low = coordinator.submitIssue(
            draft("alice", IssueCategory.ROADS, IssuePriority.LOW, "North Road")).getIssue().getId();
        clock.advance(1000);
        String critical = coordinator.submitIssue(
            draft("bob", IssueCategory.ROADS, IssuePriority.CRITICAL, "North Road")).getIssue().getId();
        clock.advance(1000);
        String elsewhere = coordinator.submitIssue(
            draft("bob", IssueCategory.ROADS, IssuePriority.CRITICAL, "South Road")).getIssue().getId();
        coordinator.submitIssue(draft("carol", IssueCategory.ELECTRICITY, IssuePriority.HIGH, "North Road"));

        List<String> northRoads = coordinator.findIssues(IssueCategory.ROADS, null, null, LocationZone.NORTH)
            .stream().map(Issue::getId).collect(Collectors.toList());
        assertEquals(List.of(critical, low), northRoads);

        List<String> criticalRoads = coordinator.findIssues(IssueCategory.ROADS, IssuePriority.CRITICAL, null, null)
            .stream().map(Issue::getId).collect(Collectors.toList());
        assertEquals(List.of(elsewhere, critical), criticalRoads);

        assertEquals(4, coordinator.findIssues(null, null, null, null).size());
        assertTrue(coordinator.findIssues(IssueCategory.ROADS, null, IssueStatus.CLOSED, null).isEmpty());
    }

    @Test
    void progressIsReturnedAsCopy() {
        IssueLifecycleCoordinator coordinator = coordinator();
        coordinator.submitIssue(draft("alice", IssueCategory.ROADS, IssuePriority.LOW, "Main St"));

        UserProgress copy = coordinator.getProgress("alice").orElseThrow();
        copy.addPoints(500);

        assertEquals(15, coordinator.getProgress("alice").orElseThrow().getPoints());
    }

    @Test
    void concurrentSubmissionsNeverLoseOrDuplicateBadges() throws Exception {
        int n = 16;
        List<Badge> definitions = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            String title = "task-" + i;
            definitions.add(new Badge("Badge" + i, "Badge " + i, "", Badge.Kind.FIRST_REPORT, 1, null, 10,
                issue -> title.equals(issue.getTitle())));
        }
        IssueLifecycleCoordinator coordinator = coordinator(new BadgeCatalog(definitions));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SubmissionResult>> futures = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            IssueDraft draft = new IssueDraft("task-" + i, "", IssueCategory.OTHER, IssuePriority.LOW,
                "Main St", "alice", List.of());
            futures.add(pool.submit(() -> {
                start.await();
                return coordinator.submitIssue(draft);
            }));
        }
        start.countDown();
        for (Future<SubmissionResult> future : futures) {
            assertTrue(future.get(10, TimeUnit.SECONDS).isSuccess());
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        UserProgress progress = coordinator.getProgress("alice").orElseThrow();
        assertEquals(n, progress.getEarnedBadges().size());
        assertEquals(n, badgeIds(progress.getEarnedBadges()).size());
        assertEquals(n, progress.getIssuesSubmitted());
        assertEquals(n * 15, progress.getPoints());

        Set<String> announced = new HashSet<>();
        for (DomainEvent event : events) {
            if (event instanceof BadgeEarnedEvent) {
                assertTrue(announced.add(((BadgeEarnedEvent) event).getEarnedBadge().getBadgeId()));
            }
        }
        assertEquals(n, announced.size());
    }
}

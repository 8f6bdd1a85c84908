package com.civicdesk;

import com.civicdesk.models.Issue;
import com.civicdesk.models.IssueCategory;
import com.civicdesk.models.IssuePriority;
import com.civicdesk.models.IssueStatus;
import com.civicdesk.models.LocationZone;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Category, priority, zone and status lookups over issue ids. Fed explicitly by the
 * lifecycle coordinator; it never reads the issue store itself. Each id sits in exactly
 * one bucket per dimension.
 */
public class SecondaryIndexes {

    private final Map<IssueCategory, Set<String>> byCategory = new EnumMap<>(IssueCategory.class);
    private final Map<IssuePriority, Set<String>> byPriority = new EnumMap<>(IssuePriority.class);
    private final Map<LocationZone, Set<String>> byZone = new EnumMap<>(LocationZone.class);
    private final Map<IssueStatus, Set<String>> byStatus = new EnumMap<>(IssueStatus.class);
    private final LocationZoneResolver zoneResolver;

    public SecondaryIndexes(LocationZoneResolver zoneResolver) {
        this.zoneResolver = zoneResolver != null ? zoneResolver : LocationZoneResolver.keywords();
    }

    public synchronized void onIssueCreated(Issue issue) {
        String id = issue.getId();
        bucket(byCategory, issue.getCategory() != null ? issue.getCategory() : IssueCategory.OTHER).add(id);
        bucket(byPriority, issue.getPriority() != null ? issue.getPriority() : IssuePriority.MEDIUM).add(id);
        bucket(byZone, zoneFor(issue.getLocation())).add(id);
        bucket(byStatus, issue.getStatus() != null ? issue.getStatus() : IssueStatus.OPEN).add(id);
    }

    public synchronized void onStatusChanged(Issue issue, IssueStatus oldStatus, IssueStatus newStatus) {
        String id = issue.getId();
        Set<String> previous = byStatus.get(oldStatus);
        if (previous == null || !previous.remove(id)) {
            // Keep the one-bucket rule even if the caller's old status was stale.
            for (Set<String> ids : byStatus.values()) {
                ids.remove(id);
            }
            logWarning("Issue " + id + " was not indexed under " + oldStatus + "; reindexed as " + newStatus);
        }
        bucket(byStatus, newStatus).add(id);
    }

    public synchronized Set<String> byCategory(IssueCategory category) {
        return snapshot(byCategory.get(category));
    }

    public synchronized Set<String> byPriority(IssuePriority priority) {
        return snapshot(byPriority.get(priority));
    }

    public synchronized Set<String> byStatus(IssueStatus status) {
        return snapshot(byStatus.get(status));
    }

    public synchronized Set<String> byLocationZone(LocationZone zone) {
        return snapshot(byZone.get(zone));
    }

    public LocationZone zoneFor(String location) {
        LocationZone zone = zoneResolver.resolve(location);
        return zone != null ? zone : LocationZone.OTHER;
    }

    public synchronized Map<IssueStatus, Integer> statusCounts() {
        return counts(byStatus, IssueStatus.class);
    }

    public synchronized Map<LocationZone, Integer> zoneCounts() {
        return counts(byZone, LocationZone.class);
    }

    private static <K> Set<String> bucket(Map<K, Set<String>> index, K key) {
        return index.computeIfAbsent(key, k -> new LinkedHashSet<>());
    }

    private static Set<String> snapshot(Set<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }

    private static <K extends Enum<K>> Map<K, Integer> counts(Map<K, Set<String>> index, Class<K> type) {
        Map<K, Integer> counts = new EnumMap<>(type);
        for (K key : type.getEnumConstants()) {
            Set<String> ids = index.get(key);
            counts.put(key, ids != null ? ids.size() : 0);
        }
        return counts;
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[SecondaryIndexes] " + message);
        }
    }
}

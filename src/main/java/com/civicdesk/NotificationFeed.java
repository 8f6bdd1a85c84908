package com.civicdesk;

import com.civicdesk.events.BadgeEarnedEvent;
import com.civicdesk.events.DomainEvent;
import com.civicdesk.events.EventKind;
import com.civicdesk.events.IssueStatusChangedEvent;
import com.civicdesk.events.IssueSubmittedEvent;
import com.civicdesk.models.Issue;
import com.civicdesk.models.Notification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * User-facing notification feed built from domain events.
 */
public class NotificationFeed {

    private final Map<String, Notification> notifications = new ConcurrentHashMap<>();

    public void register(NotificationDispatcher dispatcher) {
        dispatcher.subscribeAll(this::onEvent);
    }

    public void onEvent(DomainEvent event) {
        Notification notification = toNotification(event);
        if (notification == null) {
            return;
        }
        notifications.put(notification.getId(), notification);
        log("Notification pushed: " + notification.getId() + " - " + notification.getTitle()
            + " -> " + notification.getUserId());
    }

    /**
     * Newest first.
     */
    public List<Notification> listForUser(String userId, boolean unreadOnly) {
        List<Notification> results = new ArrayList<>();
        if (userId == null || userId.isBlank()) {
            return results;
        }
        for (Notification notification : notifications.values()) {
            if (userId.equals(notification.getUserId()) && (!unreadOnly || !notification.isRead())) {
                results.add(notification);
            }
        }
        results.sort(Comparator.comparingLong(Notification::getCreatedAt).reversed());
        return results;
    }

    public int unreadCount(String userId) {
        return listForUser(userId, true).size();
    }

    public boolean markRead(String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        Notification notification = notifications.get(id);
        if (notification == null) {
            return false;
        }
        notification.setRead(true);
        return true;
    }

    public int markAllRead(String userId) {
        int changed = 0;
        for (Notification notification : listForUser(userId, true)) {
            notification.setRead(true);
            changed++;
        }
        return changed;
    }

    private Notification toNotification(DomainEvent event) {
        if (event == null || event.getUserId() == null) {
            return null;
        }
        Issue issue = event.getIssue();
        Notification notification = new Notification(UUID.randomUUID().toString(), event.getUserId(),
            event.getKind(), null, null, event.getTimestamp());
        notification.setRelatedIssueId(event.getIssueId());

        EventKind kind = event.getKind();
        if (kind == EventKind.ISSUE_SUBMITTED) {
            IssueSubmittedEvent submitted = (IssueSubmittedEvent) event;
            notification.setTitle("Issue Submitted Successfully");
            notification.setMessage("Your issue '" + issue.getTitle() + "' has been submitted and is being reviewed. "
                + "You earned " + submitted.getPointsAwarded() + " points!");
            notification.setPointsAwarded(submitted.getPointsAwarded());
        } else if (kind == EventKind.BADGE_EARNED) {
            BadgeEarnedEvent earned = (BadgeEarnedEvent) event;
            notification.setTitle("Badge Earned!");
            notification.setMessage("Congratulations! You've earned the '" + earned.getEarnedBadge().getName()
                + "' badge!");
            notification.setPointsAwarded(earned.getEarnedBadge().getPointsValue());
            notification.setRelatedBadgeId(earned.getEarnedBadge().getBadgeId());
        } else if (kind == EventKind.ISSUE_STATUS_CHANGED) {
            IssueStatusChangedEvent changed = (IssueStatusChangedEvent) event;
            notification.setTitle("Issue Status Updated");
            notification.setMessage("Your issue '" + issue.getTitle() + "' status has been changed from "
                + changed.getFrom().getLabel() + " to " + changed.getTo().getLabel());
        } else if (kind == EventKind.ISSUE_RESOLVED) {
            notification.setTitle("Issue Resolved");
            notification.setMessage("Your issue '" + issue.getTitle() + "' has been resolved. "
                + "Thank you for helping your community!");
        }
        return notification;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[NotificationFeed] " + message);
        }
    }
}

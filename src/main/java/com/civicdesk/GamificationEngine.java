package com.civicdesk;

import com.civicdesk.models.Badge;
import com.civicdesk.models.BadgeEvaluation;
import com.civicdesk.models.BadgeStats;
import com.civicdesk.models.EarnedBadge;
import com.civicdesk.models.Issue;
import com.civicdesk.models.IssuePriority;
import com.civicdesk.models.UserLevel;
import com.civicdesk.models.UserProgress;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Points, levels and badges as pure functions of issue data. Holds no per-user state.
 */
public class GamificationEngine {

    public static final int BASE_POINTS = 10;
    public static final int ATTACHMENT_BONUS = 5;
    private static final int RECENT_BADGE_COUNT = 3;

    private final BadgeCatalog catalog;

    public GamificationEngine(BadgeCatalog catalog) {
        this.catalog = catalog;
    }

    public BadgeCatalog getCatalog() {
        return catalog;
    }

    public int computePointsForSubmission(Issue issue) {
        IssuePriority priority = issue.getPriority() != null ? issue.getPriority() : IssuePriority.MEDIUM;
        int points = BASE_POINTS + priority.getSubmissionBonus();
        if (issue.hasAttachments()) {
            points += ATTACHMENT_BONUS;
        }
        return points;
    }

    public UserLevel levelForPoints(int points) {
        return UserLevel.forPoints(points);
    }

    public BadgeEvaluation evaluateBadges(List<Issue> history) {
        return evaluateBadges(history, Collections.emptySet());
    }

    /**
     * Evaluates every badge independently over the full history.
     *
     * @param history          one user's issues; re-sorted by submission time, ties keep list order
     * @param previouslyEarned badge ids already recorded for the user
     */
    public BadgeEvaluation evaluateBadges(List<Issue> history, Collection<String> previouslyEarned) {
        List<Issue> ordered = new ArrayList<>(history != null ? history : Collections.emptyList());
        ordered.sort(Comparator.comparingLong(Issue::getSubmittedAt));

        List<EarnedBadge> earned = new ArrayList<>();
        List<EarnedBadge> newlyEarned = new ArrayList<>();
        for (Badge badge : catalog.all()) {
            EarnedBadge result = evaluate(badge, ordered);
            if (result == null) {
                continue;
            }
            earned.add(result);
            if (previouslyEarned == null || !previouslyEarned.contains(badge.getId())) {
                newlyEarned.add(result);
            }
        }
        return new BadgeEvaluation(earned, newlyEarned);
    }

    public BadgeStats badgeStats(UserProgress progress) {
        List<EarnedBadge> earned = progress != null ? progress.getEarnedBadges() : Collections.emptyList();
        int points = 0;
        for (EarnedBadge badge : earned) {
            points += badge.getPointsValue();
        }
        List<EarnedBadge> recent = new ArrayList<>(earned);
        recent.sort(Comparator.comparingLong(EarnedBadge::getEarnedAt).reversed());
        if (recent.size() > RECENT_BADGE_COUNT) {
            recent = recent.subList(0, RECENT_BADGE_COUNT);
        }
        return new BadgeStats(catalog.size(), earned.size(), points, recent);
    }

    private EarnedBadge evaluate(Badge badge, List<Issue> ordered) {
        int count = 0;
        for (Issue issue : ordered) {
            if (badge.qualifies(issue)) {
                count++;
                if (count == badge.getRequiredCount()) {
                    return new EarnedBadge(badge.getId(), badge.getName(), badge.getPointsValue(),
                        issue.getSubmittedAt(), issue.getId());
                }
            }
        }
        return null;
    }
}

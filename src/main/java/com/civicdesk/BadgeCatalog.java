package com.civicdesk;

import com.civicdesk.models.Badge;
import com.civicdesk.models.Badge.Kind;
import com.civicdesk.models.IssueCategory;
import com.civicdesk.models.IssuePriority;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed set of badge definitions, in display order.
 */
public class BadgeCatalog {

    public static final String FIRST_REPORT = "FirstReport";
    public static final String COMMUNITY_HELPER = "CommunityHelper";
    public static final String CONSISTENT_REPORTER = "ConsistentReporter";
    public static final String COMMUNITY_CHAMPION = "CommunityChampion";
    public static final String MEDIA_CONTRIBUTOR = "MediaContributor";
    public static final String EMERGENCY_RESPONDER = "EmergencyResponder";
    public static final String WATER_SAVER = "WaterSaver";
    public static final String POWER_SAVER = "PowerSaver";
    public static final String ROAD_WARRIOR = "RoadWarrior";
    public static final String ECO_GUARDIAN = "EcoGuardian";

    private static final String SPECIALIST_PREFIX = "CategorySpecialist:";
    private static final int SPECIALIST_THRESHOLD = 2;
    private static final int CATEGORY_BADGE_THRESHOLD = 3;

    private final Map<String, Badge> badges;

    public BadgeCatalog(List<Badge> definitions) {
        Map<String, Badge> byId = new LinkedHashMap<>();
        for (Badge badge : definitions) {
            if (byId.putIfAbsent(badge.getId(), badge) != null) {
                throw new IllegalArgumentException("Duplicate badge id: " + badge.getId());
            }
        }
        this.badges = Collections.unmodifiableMap(byId);
    }

    public static BadgeCatalog standard() {
        List<Badge> definitions = new ArrayList<>();

        definitions.add(new Badge(FIRST_REPORT, "First Responder",
            "Submitted your first municipal issue report", Kind.FIRST_REPORT, 1, null, 25,
            issue -> true));
        definitions.add(new Badge(COMMUNITY_HELPER, "Community Helper",
            "Reported 3 or more municipal issues", Kind.COMMUNITY_HELPER, 3, null, 50,
            issue -> true));
        definitions.add(new Badge(CONSISTENT_REPORTER, "Consistent Reporter",
            "Reported 5 or more municipal issues", Kind.CONSISTENT_REPORTER, 5, null, 100,
            issue -> true));
        definitions.add(new Badge(COMMUNITY_CHAMPION, "Community Champion",
            "Reported 10 or more municipal issues", Kind.COMMUNITY_CHAMPION, 10, null, 200,
            issue -> true));
        definitions.add(new Badge(MEDIA_CONTRIBUTOR, "Media Contributor",
            "Submitted a report with photos or videos", Kind.MEDIA_CONTRIBUTOR, 1, null, 40,
            issue -> issue.hasAttachments()));
        definitions.add(new Badge(EMERGENCY_RESPONDER, "Emergency Responder",
            "Reported a critical priority issue", Kind.EMERGENCY_RESPONDER, 1, null, 75,
            issue -> issue.getPriority() == IssuePriority.CRITICAL));

        for (IssueCategory category : IssueCategory.values()) {
            definitions.add(new Badge(specialistId(category), category.getLabel() + " Specialist",
                "Reported " + SPECIALIST_THRESHOLD + " or more " + category.getLabel() + " issues",
                Kind.CATEGORY_SPECIALIST, SPECIALIST_THRESHOLD, category.getLabel(), 30,
                issue -> issue.getCategory() == category));
        }

        definitions.add(categoryBadge(WATER_SAVER, "Water Saver", "water supply", "WaterSupply", 60,
            EnumSet.of(IssueCategory.WATER_SUPPLY)));
        definitions.add(categoryBadge(POWER_SAVER, "Power Saver", "electricity", "Electricity", 60,
            EnumSet.of(IssueCategory.ELECTRICITY)));
        definitions.add(categoryBadge(ROAD_WARRIOR, "Road Warrior", "roads and infrastructure", "Roads", 60,
            EnumSet.of(IssueCategory.ROADS)));
        definitions.add(categoryBadge(ECO_GUARDIAN, "Eco Guardian", "environmental", "Environmental", 70,
            EnumSet.of(IssueCategory.WASTE_MANAGEMENT, IssueCategory.PARKS_AND_RECREATION)));

        return new BadgeCatalog(definitions);
    }

    public static String specialistId(IssueCategory category) {
        return SPECIALIST_PREFIX + category.getLabel();
    }

    public List<Badge> all() {
        return new ArrayList<>(badges.values());
    }

    public Optional<Badge> find(String badgeId) {
        return Optional.ofNullable(badgeId != null ? badges.get(badgeId) : null);
    }

    public int size() {
        return badges.size();
    }

    private static Badge categoryBadge(String id, String name, String topic, String requiredCategory, int points,
                                       Set<IssueCategory> categories) {
        return new Badge(id, name, "Reported " + CATEGORY_BADGE_THRESHOLD + " or more " + topic + " issues",
            Kind.CATEGORY_CHAMPION, CATEGORY_BADGE_THRESHOLD, requiredCategory, points,
            issue -> categories.contains(issue.getCategory()));
    }
}

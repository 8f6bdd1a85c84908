package com.civicdesk.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Static achievement definition. A badge is earned once {@code requiredCount} issues
 * in a user's history satisfy its qualifier.
 */
public class Badge {

    public enum Kind {
        FIRST_REPORT,
        COMMUNITY_HELPER,
        CATEGORY_SPECIALIST,
        /** Themed category badge (Water Saver and the like) at a higher threshold than the specialist. */
        CATEGORY_CHAMPION,
        MEDIA_CONTRIBUTOR,
        CONSISTENT_REPORTER,
        EMERGENCY_RESPONDER,
        COMMUNITY_CHAMPION
    }

    private final String id;
    private final String name;
    private final String description;
    private final Kind kind;
    private final int requiredCount;
    private final String requiredCategory;
    private final int pointsValue;
    private final Predicate<Issue> qualifier;

    public Badge(String id, String name, String description, Kind kind, int requiredCount,
                 String requiredCategory, int pointsValue, Predicate<Issue> qualifier) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.description = description;
        this.kind = kind;
        this.requiredCount = Math.max(1, requiredCount);
        this.requiredCategory = requiredCategory;
        this.pointsValue = pointsValue;
        this.qualifier = Objects.requireNonNull(qualifier, "qualifier");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Kind getKind() {
        return kind;
    }

    public int getRequiredCount() {
        return requiredCount;
    }

    public String getRequiredCategory() {
        return requiredCategory;
    }

    public int getPointsValue() {
        return pointsValue;
    }

    @JsonIgnore
    public Predicate<Issue> getQualifier() {
        return qualifier;
    }

    public boolean qualifies(Issue issue) {
        return issue != null && qualifier.test(issue);
    }

    @Override
    public String toString() {
        return "Badge{id='" + id + "', name='" + name + "', requiredCount=" + requiredCount + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Badge) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}

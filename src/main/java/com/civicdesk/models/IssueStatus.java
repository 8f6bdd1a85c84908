package com.civicdesk.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum IssueStatus {
    OPEN("Open"),
    IN_PROGRESS("InProgress"),
    RESOLVED("Resolved"),
    CLOSED("Closed");

    private final String label;

    IssueStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Forward-only lifecycle. Nothing ever moves back to OPEN.
     */
    public Set<IssueStatus> allowedTargets() {
        switch (this) {
            case OPEN:
                return EnumSet.of(IN_PROGRESS, RESOLVED);
            case IN_PROGRESS:
                return EnumSet.of(RESOLVED, CLOSED);
            case RESOLVED:
                return EnumSet.of(CLOSED);
            default:
                return EnumSet.noneOf(IssueStatus.class);
        }
    }

    public boolean canTransitionTo(IssueStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isResolution() {
        return this == RESOLVED || this == CLOSED;
    }

    @JsonCreator
    public static IssueStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace("_", "").replace(" ", "");
        for (IssueStatus status : values()) {
            if (status.label.equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        return null;
    }
}

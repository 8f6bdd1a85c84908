package com.civicdesk.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered by urgency: declaration order is the comparison order.
 */
public enum IssuePriority {
    LOW("Low", 5),
    MEDIUM("Medium", 10),
    HIGH("High", 15),
    CRITICAL("Critical", 20);

    private final String label;
    private final int submissionBonus;

    IssuePriority(String label, int submissionBonus) {
        this.label = label;
        this.submissionBonus = submissionBonus;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getSubmissionBonus() {
        return submissionBonus;
    }

    @JsonCreator
    public static IssuePriority fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim();
        for (IssuePriority priority : values()) {
            if (priority.label.equalsIgnoreCase(normalized)) {
                return priority;
            }
        }
        return null;
    }
}

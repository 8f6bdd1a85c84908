package com.civicdesk.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueCategory {
    WATER_SUPPLY("WaterSupply"),
    ELECTRICITY("Electricity"),
    ROADS("Roads"),
    WASTE_MANAGEMENT("WasteManagement"),
    PUBLIC_SAFETY("PublicSafety"),
    PARKS_AND_RECREATION("ParksAndRecreation"),
    BUILDING_PERMITS("BuildingPermits"),
    OTHER("Other");

    private final String label;

    IssueCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts either the label ("WaterSupply") or the constant name ("WATER_SUPPLY"), case-insensitive.
     */
    @JsonCreator
    public static IssueCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace("_", "").replace(" ", "");
        for (IssueCategory category : values()) {
            if (category.label.equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        return null;
    }
}

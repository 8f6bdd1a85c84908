package com.civicdesk.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LocationZone {
    CITY_CENTRE("CityCentre"),
    NORTH("North"),
    SOUTH("South"),
    EAST("East"),
    WEST("West"),
    OTHER("Other");

    private final String label;

    LocationZone(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static LocationZone fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace("_", "").replace(" ", "");
        for (LocationZone zone : values()) {
            if (zone.label.equalsIgnoreCase(normalized)) {
                return zone;
            }
        }
        return null;
    }
}
